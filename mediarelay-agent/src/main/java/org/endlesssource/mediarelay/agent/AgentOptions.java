package org.endlesssource.mediarelay.agent;

import org.endlesssource.mediarelay.monitor.MonitorOptions;
import org.endlesssource.mediarelay.protocol.Protocol;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration options for {@link MediaRelayAgent}.
 */
public final class AgentOptions {
    public static final String DEFAULT_BIND_ADDRESS = "0.0.0.0";
    public static final Duration DEFAULT_PAIRING_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_PENDING_PAIRINGS = 4;
    public static final int DEFAULT_CLIENT_QUEUE_CAPACITY = 256;
    public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_HANDSHAKE_TIMEOUT = Duration.ofSeconds(10);

    private final String bindAddress;
    private final int relayPort;
    private final int pairingPort;
    private final Path stateDirectory;
    private final Duration pairingTimeout;
    private final int sasDigits;
    private final int maxPendingPairings;
    private final int clientQueueCapacity;
    private final Duration commandTimeout;
    private final Duration handshakeTimeout;
    private final MonitorOptions monitorOptions;
    private final boolean advertise;

    private AgentOptions(String bindAddress,
                         int relayPort,
                         int pairingPort,
                         Path stateDirectory,
                         Duration pairingTimeout,
                         int sasDigits,
                         int maxPendingPairings,
                         int clientQueueCapacity,
                         Duration commandTimeout,
                         Duration handshakeTimeout,
                         MonitorOptions monitorOptions,
                         boolean advertise) {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress must not be null");
        this.relayPort = requirePort("relayPort", relayPort);
        this.pairingPort = requirePort("pairingPort", pairingPort);
        this.stateDirectory = Objects.requireNonNull(stateDirectory, "stateDirectory must not be null");
        this.pairingTimeout = requirePositive("pairingTimeout", pairingTimeout);
        this.sasDigits = sasDigits;
        this.maxPendingPairings = requirePositive("maxPendingPairings", maxPendingPairings);
        this.clientQueueCapacity = requirePositive("clientQueueCapacity", clientQueueCapacity);
        this.commandTimeout = requirePositive("commandTimeout", commandTimeout);
        this.handshakeTimeout = requirePositive("handshakeTimeout", handshakeTimeout);
        this.monitorOptions = Objects.requireNonNull(monitorOptions, "monitorOptions must not be null");
        this.advertise = advertise;
        if (sasDigits < Protocol.MIN_SAS_DIGITS || sasDigits > Protocol.MAX_SAS_DIGITS) {
            throw new IllegalArgumentException("sasDigits must be between " + Protocol.MIN_SAS_DIGITS
                    + " and " + Protocol.MAX_SAS_DIGITS);
        }
        if (relayPort != 0 && relayPort == pairingPort) {
            throw new IllegalArgumentException("relayPort and pairingPort must differ");
        }
    }

    public static AgentOptions defaults() {
        return new AgentOptions(DEFAULT_BIND_ADDRESS, Protocol.DEFAULT_RELAY_PORT, Protocol.DEFAULT_PAIRING_PORT,
                defaultStateDirectory(), DEFAULT_PAIRING_TIMEOUT, Protocol.DEFAULT_SAS_DIGITS,
                DEFAULT_MAX_PENDING_PAIRINGS, DEFAULT_CLIENT_QUEUE_CAPACITY, DEFAULT_COMMAND_TIMEOUT,
                DEFAULT_HANDSHAKE_TIMEOUT, MonitorOptions.defaults(), true);
    }

    /**
     * {@code $XDG_CONFIG_HOME/mediarelay}, or {@code ~/.config/mediarelay} when the variable is unset.
     */
    public static Path defaultStateDirectory() {
        String xdg = System.getenv("XDG_CONFIG_HOME");
        Path base = xdg != null && !xdg.isBlank()
                ? Paths.get(xdg)
                : Paths.get(System.getProperty("user.home"), ".config");
        return base.resolve("mediarelay");
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public int getRelayPort() {
        return relayPort;
    }

    public int getPairingPort() {
        return pairingPort;
    }

    public Path getStateDirectory() {
        return stateDirectory;
    }

    public Duration getPairingTimeout() {
        return pairingTimeout;
    }

    public int getSasDigits() {
        return sasDigits;
    }

    public int getMaxPendingPairings() {
        return maxPendingPairings;
    }

    public int getClientQueueCapacity() {
        return clientQueueCapacity;
    }

    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public Duration getHandshakeTimeout() {
        return handshakeTimeout;
    }

    public MonitorOptions getMonitorOptions() {
        return monitorOptions;
    }

    /**
     * Whether the agent announces itself on the local network through multicast DNS.
     */
    public boolean isAdvertise() {
        return advertise;
    }

    public AgentOptions withBindAddress(String address) {
        return new AgentOptions(address, relayPort, pairingPort, stateDirectory, pairingTimeout, sasDigits,
                maxPendingPairings, clientQueueCapacity, commandTimeout, handshakeTimeout, monitorOptions, advertise);
    }

    /**
     * @param relay   relay port, 0 for an ephemeral port
     * @param pairing pairing port, 0 for an ephemeral port
     */
    public AgentOptions withPorts(int relay, int pairing) {
        return new AgentOptions(bindAddress, relay, pairing, stateDirectory, pairingTimeout, sasDigits,
                maxPendingPairings, clientQueueCapacity, commandTimeout, handshakeTimeout, monitorOptions, advertise);
    }

    public AgentOptions withStateDirectory(Path directory) {
        return new AgentOptions(bindAddress, relayPort, pairingPort, directory, pairingTimeout, sasDigits,
                maxPendingPairings, clientQueueCapacity, commandTimeout, handshakeTimeout, monitorOptions, advertise);
    }

    public AgentOptions withPairingTimeout(Duration timeout) {
        return new AgentOptions(bindAddress, relayPort, pairingPort, stateDirectory, timeout, sasDigits,
                maxPendingPairings, clientQueueCapacity, commandTimeout, handshakeTimeout, monitorOptions, advertise);
    }

    public AgentOptions withSasDigits(int digits) {
        return new AgentOptions(bindAddress, relayPort, pairingPort, stateDirectory, pairingTimeout, digits,
                maxPendingPairings, clientQueueCapacity, commandTimeout, handshakeTimeout, monitorOptions, advertise);
    }

    public AgentOptions withMaxPendingPairings(int max) {
        return new AgentOptions(bindAddress, relayPort, pairingPort, stateDirectory, pairingTimeout, sasDigits,
                max, clientQueueCapacity, commandTimeout, handshakeTimeout, monitorOptions, advertise);
    }

    public AgentOptions withClientQueueCapacity(int capacity) {
        return new AgentOptions(bindAddress, relayPort, pairingPort, stateDirectory, pairingTimeout, sasDigits,
                maxPendingPairings, capacity, commandTimeout, handshakeTimeout, monitorOptions, advertise);
    }

    public AgentOptions withCommandTimeout(Duration timeout) {
        return new AgentOptions(bindAddress, relayPort, pairingPort, stateDirectory, pairingTimeout, sasDigits,
                maxPendingPairings, clientQueueCapacity, timeout, handshakeTimeout, monitorOptions, advertise);
    }

    public AgentOptions withHandshakeTimeout(Duration timeout) {
        return new AgentOptions(bindAddress, relayPort, pairingPort, stateDirectory, pairingTimeout, sasDigits,
                maxPendingPairings, clientQueueCapacity, commandTimeout, timeout, monitorOptions, advertise);
    }

    public AgentOptions withMonitorOptions(MonitorOptions options) {
        return new AgentOptions(bindAddress, relayPort, pairingPort, stateDirectory, pairingTimeout, sasDigits,
                maxPendingPairings, clientQueueCapacity, commandTimeout, handshakeTimeout, options, advertise);
    }

    public AgentOptions withAdvertise(boolean enabled) {
        return new AgentOptions(bindAddress, relayPort, pairingPort, stateDirectory, pairingTimeout, sasDigits,
                maxPendingPairings, clientQueueCapacity, commandTimeout, handshakeTimeout, monitorOptions, enabled);
    }

    private static int requirePort(String name, int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(name + " must be between 0 and 65535");
        }
        return port;
    }

    private static Duration requirePositive(String name, Duration value) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private static int requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }
}
