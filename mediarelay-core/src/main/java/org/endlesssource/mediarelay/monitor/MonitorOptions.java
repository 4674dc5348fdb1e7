package org.endlesssource.mediarelay.monitor;

import org.endlesssource.mediarelay.facade.FacadeSettings;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration options for {@link PlayerMonitor}.
 */
public final class MonitorOptions {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_REFRESH_DELAY = Duration.ofMillis(50);
    public static final int DEFAULT_PROBE_ATTEMPTS = 3;
    public static final Duration DEFAULT_PROBE_BACKOFF = Duration.ofMillis(200);
    public static final int DEFAULT_BUS_CONNECT_ATTEMPTS = 5;
    public static final Duration DEFAULT_BUS_RETRY_BACKOFF = Duration.ofMillis(500);
    public static final Duration DEFAULT_BUS_RETRY_MAX_BACKOFF = Duration.ofSeconds(30);
    public static final int DEFAULT_COMMAND_QUEUE_CAPACITY = 16;

    private final Duration pollInterval;
    private final Duration refreshDelay;
    private final int probeAttempts;
    private final Duration probeBackoff;
    private final int busConnectAttempts;
    private final Duration busRetryBackoff;
    private final Duration busRetryMaxBackoff;
    private final int commandQueueCapacity;

    private MonitorOptions(Duration pollInterval,
                           Duration refreshDelay,
                           int probeAttempts,
                           Duration probeBackoff,
                           int busConnectAttempts,
                           Duration busRetryBackoff,
                           Duration busRetryMaxBackoff,
                           int commandQueueCapacity) {
        this.pollInterval = requirePositive("pollInterval", pollInterval);
        this.refreshDelay = requirePositive("refreshDelay", refreshDelay);
        this.probeAttempts = requirePositive("probeAttempts", probeAttempts);
        this.probeBackoff = requirePositive("probeBackoff", probeBackoff);
        this.busConnectAttempts = requirePositive("busConnectAttempts", busConnectAttempts);
        this.busRetryBackoff = requirePositive("busRetryBackoff", busRetryBackoff);
        this.busRetryMaxBackoff = requirePositive("busRetryMaxBackoff", busRetryMaxBackoff);
        this.commandQueueCapacity = requirePositive("commandQueueCapacity", commandQueueCapacity);
        if (busRetryMaxBackoff.compareTo(busRetryBackoff) < 0) {
            throw new IllegalArgumentException("busRetryMaxBackoff must not be shorter than busRetryBackoff");
        }
    }

    public static MonitorOptions defaults() {
        return new MonitorOptions(DEFAULT_POLL_INTERVAL, DEFAULT_REFRESH_DELAY, DEFAULT_PROBE_ATTEMPTS,
                DEFAULT_PROBE_BACKOFF, DEFAULT_BUS_CONNECT_ATTEMPTS, DEFAULT_BUS_RETRY_BACKOFF,
                DEFAULT_BUS_RETRY_MAX_BACKOFF, DEFAULT_COMMAND_QUEUE_CAPACITY);
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getRefreshDelay() {
        return refreshDelay;
    }

    public int getProbeAttempts() {
        return probeAttempts;
    }

    public Duration getProbeBackoff() {
        return probeBackoff;
    }

    public int getBusConnectAttempts() {
        return busConnectAttempts;
    }

    public Duration getBusRetryBackoff() {
        return busRetryBackoff;
    }

    public Duration getBusRetryMaxBackoff() {
        return busRetryMaxBackoff;
    }

    public int getCommandQueueCapacity() {
        return commandQueueCapacity;
    }

    public FacadeSettings facadeSettings() {
        return new FacadeSettings(commandQueueCapacity, refreshDelay);
    }

    public MonitorOptions withPollInterval(Duration interval) {
        return new MonitorOptions(interval, refreshDelay, probeAttempts, probeBackoff, busConnectAttempts,
                busRetryBackoff, busRetryMaxBackoff, commandQueueCapacity);
    }

    public MonitorOptions withRefreshDelay(Duration delay) {
        return new MonitorOptions(pollInterval, delay, probeAttempts, probeBackoff, busConnectAttempts,
                busRetryBackoff, busRetryMaxBackoff, commandQueueCapacity);
    }

    public MonitorOptions withProbeAttempts(int attempts) {
        return new MonitorOptions(pollInterval, refreshDelay, attempts, probeBackoff, busConnectAttempts,
                busRetryBackoff, busRetryMaxBackoff, commandQueueCapacity);
    }

    public MonitorOptions withProbeBackoff(Duration backoff) {
        return new MonitorOptions(pollInterval, refreshDelay, probeAttempts, backoff, busConnectAttempts,
                busRetryBackoff, busRetryMaxBackoff, commandQueueCapacity);
    }

    public MonitorOptions withBusConnectAttempts(int attempts) {
        return new MonitorOptions(pollInterval, refreshDelay, probeAttempts, probeBackoff, attempts,
                busRetryBackoff, busRetryMaxBackoff, commandQueueCapacity);
    }

    public MonitorOptions withBusRetryBackoff(Duration backoff, Duration maxBackoff) {
        return new MonitorOptions(pollInterval, refreshDelay, probeAttempts, probeBackoff, busConnectAttempts,
                backoff, maxBackoff, commandQueueCapacity);
    }

    public MonitorOptions withCommandQueueCapacity(int capacity) {
        return new MonitorOptions(pollInterval, refreshDelay, probeAttempts, probeBackoff, busConnectAttempts,
                busRetryBackoff, busRetryMaxBackoff, capacity);
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
