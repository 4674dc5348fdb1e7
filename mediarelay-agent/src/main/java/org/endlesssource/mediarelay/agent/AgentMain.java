package org.endlesssource.mediarelay.agent;

import org.endlesssource.mediarelay.BusAvailability;
import org.endlesssource.mediarelay.MediaBusFactory;
import org.endlesssource.mediarelay.agent.pairing.ConsoleConfirmationPrompt;
import org.endlesssource.mediarelay.agent.store.FileCredentialStore;
import org.endlesssource.mediarelay.protocol.Protocol;
import org.endlesssource.mediarelay.spi.BusException;
import org.endlesssource.mediarelay.spi.ControlService;
import org.endlesssource.mediarelay.spi.ControlService.RemoteAgent;
import org.endlesssource.mediarelay.spi.PairingEntry;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command line entry point of the agent.
 * <p>
 * Without a subcommand the agent runs until it is interrupted or asked to stop. Options fall back to
 * {@code MEDIARELAY_*} environment variables. Pairing commands go through the running agent when
 * there is one and edit the credential store directly otherwise.
 */
@Command(
        name = "mediarelay-agent",
        mixinStandardHelpOptions = true,
        description = "Relay local media players to paired remote controllers",
        subcommands = {AgentMain.PairingsCommand.class, AgentMain.CheckCommand.class, AgentMain.StatusCommand.class,
                AgentMain.StopCommand.class}
)
public final class AgentMain implements Callable<Integer> {

    @Option(names = {"--bind"}, defaultValue = "${env:MEDIARELAY_BIND:-" + AgentOptions.DEFAULT_BIND_ADDRESS + "}",
            description = "Address to listen on (default: ${DEFAULT-VALUE})")
    String bindAddress;

    @Option(names = {"--relay-port"}, defaultValue = "${env:MEDIARELAY_RELAY_PORT:-" + Protocol.DEFAULT_RELAY_PORT + "}",
            description = "Relay port (default: ${DEFAULT-VALUE})")
    int relayPort;

    @Option(names = {"--pairing-port"},
            defaultValue = "${env:MEDIARELAY_PAIRING_PORT:-" + Protocol.DEFAULT_PAIRING_PORT + "}",
            description = "Pairing port (default: ${DEFAULT-VALUE})")
    int pairingPort;

    @Option(names = {"--state-dir"}, defaultValue = "${env:MEDIARELAY_STATE_DIR}",
            description = "Directory holding trust records (default: $XDG_CONFIG_HOME/mediarelay)")
    Path stateDirectory;

    @Option(names = {"--pairing-timeout"}, defaultValue = "${env:MEDIARELAY_PAIRING_TIMEOUT:-60}",
            description = "Seconds to wait for pairing confirmation (default: ${DEFAULT-VALUE})")
    long pairingTimeoutSeconds;

    @Option(names = {"--sas-digits"}, defaultValue = "${env:MEDIARELAY_SAS_DIGITS:-" + Protocol.DEFAULT_SAS_DIGITS + "}",
            description = "Digits in the pairing code, " + Protocol.MIN_SAS_DIGITS + " to " + Protocol.MAX_SAS_DIGITS
                    + " (default: ${DEFAULT-VALUE})")
    int sasDigits;

    @Option(names = {"--no-advertise"}, defaultValue = "${env:MEDIARELAY_NO_ADVERTISE:-false}",
            description = "Do not announce the agent on the local network through multicast DNS")
    boolean noAdvertise;

    @Option(names = {"--log-level"}, defaultValue = "${env:MEDIARELAY_LOG_LEVEL:-info}",
            description = "trace, debug, info, warn or error (default: ${DEFAULT-VALUE})")
    String logLevel;

    // Looked up on first use; tests set it directly.
    ControlService controlService;

    public static void main(String[] args) {
        System.exit(new CommandLine(new AgentMain()).execute(args));
    }

    // Must run before the first logger is created.
    void applyLogLevel() {
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", logLevel.toLowerCase(Locale.ROOT));
    }

    Path stateDirectory() {
        return stateDirectory == null ? AgentOptions.defaultStateDirectory() : stateDirectory;
    }

    AgentOptions options() {
        return AgentOptions.defaults()
                .withBindAddress(bindAddress)
                .withPorts(relayPort, pairingPort)
                .withStateDirectory(stateDirectory())
                .withPairingTimeout(Duration.ofSeconds(pairingTimeoutSeconds))
                .withSasDigits(sasDigits)
                .withAdvertise(!noAdvertise);
    }

    ControlService controlService() {
        if (controlService == null) {
            try {
                controlService = MediaBusFactory.selectProvider().createControlService();
            } catch (UnsupportedOperationException e) {
                controlService = ControlService.NONE;
            }
        }
        return controlService;
    }

    /**
     * @return the agent running in this session, or empty if none can be reached
     */
    Optional<RemoteAgent> runningAgent() {
        try {
            return controlService().connect();
        } catch (BusException e) {
            System.err.println("Cannot look for a running agent: " + e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Integer call() throws Exception {
        applyLogLevel();
        AgentOptions options = options();
        MediaRelayAgent agent = MediaRelayAgent.create(options, new ConsoleConfirmationPrompt());
        Runtime.getRuntime().addShutdownHook(new Thread(agent::close, "mediarelay-shutdown"));
        try {
            agent.start();
        } catch (IllegalStateException e) {
            System.err.println(e.getMessage());
            return 1;
        }
        System.out.printf("mediarelay agent listening: relay %d, pairing %d%n",
                agent.getRelayPort(), agent.getPairingPort());
        System.out.println("Certificate fingerprint " + agent.getCertificate().fingerprintHex());
        agent.awaitStopped();
        return 0;
    }

    @Command(name = "check", description = "Report whether a media bus is usable here")
    static final class CheckCommand implements Callable<Integer> {
        @ParentCommand
        AgentMain parent;

        @Override
        public Integer call() {
            parent.applyLogLevel();
            BusAvailability availability = MediaBusFactory.availability();
            if (availability.available()) {
                System.out.println("Media bus available via " + availability.provider());
                return 0;
            }
            System.err.printf("Media bus unavailable (%s): %s%n", availability.provider(), availability.reason());
            return 1;
        }
    }

    @Command(name = "status", description = "Report whether an agent is running in this session")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        AgentMain parent;

        @Override
        public Integer call() {
            parent.applyLogLevel();
            Optional<RemoteAgent> agent = parent.runningAgent();
            if (agent.isEmpty()) {
                System.out.println("No agent running");
                return 1;
            }
            try (RemoteAgent remote = agent.get()) {
                System.out.println(remote.ping());
                return 0;
            } catch (BusException e) {
                return agentFailed(e);
            }
        }
    }

    @Command(name = "stop", description = "Stop the agent running in this session")
    static final class StopCommand implements Callable<Integer> {
        @ParentCommand
        AgentMain parent;

        @Override
        public Integer call() {
            parent.applyLogLevel();
            Optional<RemoteAgent> agent = parent.runningAgent();
            if (agent.isEmpty()) {
                System.err.println("No agent running");
                return 1;
            }
            try (RemoteAgent remote = agent.get()) {
                remote.quit();
                System.out.println("Agent stopping");
                return 0;
            } catch (BusException e) {
                return agentFailed(e);
            }
        }
    }

    @Command(name = "pairings", description = "Manage paired clients",
            subcommands = {ListCommand.class, RevokeCommand.class, ResetCommand.class})
    static final class PairingsCommand implements Runnable {
        @ParentCommand
        AgentMain parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: list | revoke <identity> | reset");
        }

        FileCredentialStore open() {
            return FileCredentialStore.open(parent.stateDirectory());
        }

        Optional<RemoteAgent> runningAgent() {
            parent.applyLogLevel();
            return parent.runningAgent();
        }
    }

    static int agentFailed(BusException e) {
        System.err.println("Agent did not answer: " + e.getMessage());
        return 1;
    }

    @Command(name = "list", description = "List paired clients")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        PairingsCommand parent;

        @Override
        public Integer call() {
            Optional<RemoteAgent> agent = parent.runningAgent();
            if (agent.isPresent()) {
                try (RemoteAgent remote = agent.get()) {
                    print(remote.listPairings());
                    return 0;
                } catch (BusException e) {
                    return agentFailed(e);
                }
            }
            try (FileCredentialStore store = parent.open()) {
                print(store.list().stream()
                        .map(record -> new PairingEntry(record.identity(), record.clientName(), record.createdAt()))
                        .collect(Collectors.toList()));
            }
            return 0;
        }

        private static void print(List<PairingEntry> entries) {
            if (entries.isEmpty()) {
                System.out.println("No paired clients");
            }
            for (PairingEntry entry : entries) {
                System.out.printf("%s  %-24s  paired %s%n", entry.identity(), entry.clientName(), entry.pairedAt());
            }
        }
    }

    @Command(name = "revoke", description = "Remove a paired client")
    static final class RevokeCommand implements Callable<Integer> {
        @ParentCommand
        PairingsCommand parent;

        @Parameters(index = "0", description = "Client identity")
        String identity;

        @Override
        public Integer call() {
            boolean revoked;
            Optional<RemoteAgent> agent = parent.runningAgent();
            if (agent.isPresent()) {
                try (RemoteAgent remote = agent.get()) {
                    revoked = remote.revokePairing(identity);
                } catch (BusException e) {
                    return agentFailed(e);
                }
            } else {
                try (FileCredentialStore store = parent.open()) {
                    revoked = store.revoke(identity);
                }
            }
            if (!revoked) {
                System.err.println("No paired client " + identity);
                return 1;
            }
            System.out.println("Revoked " + identity);
            return 0;
        }
    }

    @Command(name = "reset", description = "Remove every paired client")
    static final class ResetCommand implements Callable<Integer> {
        @ParentCommand
        PairingsCommand parent;

        @Override
        public Integer call() {
            int revoked;
            Optional<RemoteAgent> agent = parent.runningAgent();
            if (agent.isPresent()) {
                try (RemoteAgent remote = agent.get()) {
                    revoked = remote.resetPairings();
                } catch (BusException e) {
                    return agentFailed(e);
                }
            } else {
                try (FileCredentialStore store = parent.open()) {
                    revoked = store.revokeAll();
                }
            }
            System.out.println("Revoked " + revoked + " pairing(s)");
            return 0;
        }
    }
}
