package org.endlesssource.mediarelay.monitor;

import org.endlesssource.mediarelay.NamedThreadFactory;
import org.endlesssource.mediarelay.api.CommandResult;
import org.endlesssource.mediarelay.api.PlayerCommand;
import org.endlesssource.mediarelay.api.PlayerEvent;
import org.endlesssource.mediarelay.api.PlayerEventListener;
import org.endlesssource.mediarelay.api.PlayerSnapshot;
import org.endlesssource.mediarelay.api.RejectionReason;
import org.endlesssource.mediarelay.facade.FacadeKind;
import org.endlesssource.mediarelay.facade.FacadeSelector;
import org.endlesssource.mediarelay.facade.MprisNames;
import org.endlesssource.mediarelay.facade.PlayerFacade;
import org.endlesssource.mediarelay.spi.BusException;
import org.endlesssource.mediarelay.spi.BusListener;
import org.endlesssource.mediarelay.spi.MediaBus;
import org.endlesssource.mediarelay.spi.PlayerEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the live set of local players and turns bus activity into one ordered event stream.
 * <p>
 * Every registry change and every event emission runs on a single dispatcher thread.
 * For any player the stream therefore reads {@code PLAYER_APPEARED}, zero or more
 * {@code STATE_CHANGED}, then {@code PLAYER_DISAPPEARED}. Listeners are called on the
 * dispatcher thread and must not block.
 * <p>
 * Players are found through bus name notifications and, as a fallback for missed
 * notifications, by polling the bus. Probing a new player happens off the dispatcher and
 * is retried with backoff; a player whose state stays unreadable is registered as degraded.
 */
public final class PlayerMonitor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PlayerMonitor.class);
    private static final int PROBE_THREADS = 4;

    private final MediaBus bus;
    private final MonitorOptions options;
    private final FacadeSelector selector;
    private final ExecutorService dispatcher;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService probePool;
    private final List<PlayerEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, PlayerFacade> players = new ConcurrentHashMap<>();
    private final Map<String, PlayerSnapshot> emitted = new ConcurrentHashMap<>();

    // Confined to the dispatcher thread.
    private final Set<String> pending = new HashSet<>();
    // Names whose endpoint could not be opened; not probed again until they leave the bus.
    private final Set<String> skipped = new HashSet<>();
    private long generation;

    private volatile MonitorState state = MonitorState.NEW;

    public PlayerMonitor(MediaBus bus, MonitorOptions options, FacadeSelector selector) {
        this.bus = Objects.requireNonNull(bus, "bus must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.dispatcher = Executors.newSingleThreadExecutor(new NamedThreadFactory("mediarelay-monitor"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("mediarelay-monitor-timer"));
        this.probePool = Executors.newFixedThreadPool(PROBE_THREADS, new NamedThreadFactory("mediarelay-probe"));
    }

    public PlayerMonitor(MediaBus bus) {
        this(bus, MonitorOptions.defaults(), FacadeSelector.byName());
    }

    /**
     * Connect to the bus and begin monitoring. Returns immediately; connection attempts
     * continue in the background.
     *
     * @throws IllegalStateException if the monitor was already started
     */
    public synchronized void start() {
        if (state != MonitorState.NEW) {
            throw new IllegalStateException("Monitor already started, state=" + state);
        }
        state = MonitorState.CONNECTING;
        bus.setListener(new BusHandler());
        dispatch(() -> connect(1, true));
        long intervalMs = options.getPollInterval().toMillis();
        scheduler.scheduleWithFixedDelay(() -> dispatch(this::reconcile), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    public MonitorState state() {
        return state;
    }

    public void addListener(PlayerEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(PlayerEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Snapshots of all registered players as last emitted on the event stream,
     * ordered by player id. Call from {@link #runSerialized(Callable)} to get a view that
     * is consistent with the events that follow.
     */
    public List<PlayerSnapshot> snapshots() {
        List<PlayerSnapshot> result = new ArrayList<>(emitted.values());
        result.sort(Comparator.comparing(PlayerSnapshot::playerId));
        return result;
    }

    /**
     * Look up a player by id (bus name) or by display identity.
     */
    public Optional<PlayerSnapshot> find(String playerIdOrIdentity) {
        return resolve(playerIdOrIdentity).map(facade -> emitted.get(facade.playerId()));
    }

    /**
     * Run a task on the dispatcher thread, between two events.
     * No event is emitted while the task runs.
     */
    public <T> CompletableFuture<T> runSerialized(Callable<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        boolean accepted = dispatch(() -> {
            try {
                result.complete(task.call());
            } catch (Exception e) {
                result.completeExceptionally(e);
            }
        });
        if (!accepted) {
            result.completeExceptionally(new IllegalStateException("Monitor is closed"));
        }
        return result;
    }

    /**
     * Route a command to the player's façade.
     *
     * @param playerIdOrIdentity player id or display identity
     * @return the outcome; {@link RejectionReason#NOT_FOUND} when no such player is registered
     */
    public CompletableFuture<CommandResult> execute(String playerIdOrIdentity, PlayerCommand command) {
        Optional<PlayerFacade> facade = resolve(playerIdOrIdentity);
        if (facade.isEmpty()) {
            return CompletableFuture.completedFuture(
                    CommandResult.rejected(RejectionReason.NOT_FOUND, "No player named " + playerIdOrIdentity));
        }
        return facade.get().execute(command);
    }

    /**
     * Stop monitoring, release every player and close the bus.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (state == MonitorState.CLOSED) {
                return;
            }
            state = MonitorState.CLOSED;
        }
        scheduler.shutdownNow();
        probePool.shutdownNow();
        dispatch(() -> {
            players.values().forEach(PlayerFacade::close);
            players.clear();
            emitted.clear();
            pending.clear();
            skipped.clear();
        });
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Monitor dispatcher did not stop in time");
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatcher.shutdownNow();
        }
        bus.close();
        logger.info("Player monitor closed");
    }

    private Optional<PlayerFacade> resolve(String playerIdOrIdentity) {
        if (playerIdOrIdentity == null) {
            return Optional.empty();
        }
        PlayerFacade byId = players.get(playerIdOrIdentity);
        if (byId != null) {
            return Optional.of(byId);
        }
        return players.values().stream()
                .filter(facade -> facade.displayIdentity().equals(playerIdOrIdentity))
                .findFirst();
    }

    private void connect(int attempt, boolean startup) {
        if (state == MonitorState.CLOSED) {
            return;
        }
        try {
            bus.connect();
        } catch (BusException e) {
            if (startup && attempt >= options.getBusConnectAttempts()) {
                state = MonitorState.FAILED;
                logger.error("Session bus unavailable after {} attempts, players will not be monitored: {}",
                        attempt, e.getMessage());
                return;
            }
            Duration delay = busBackoff(attempt);
            logger.warn("Session bus unavailable (attempt {}), retrying in {} ms: {}",
                    attempt, delay.toMillis(), e.getMessage());
            schedule(() -> connect(attempt + 1, startup), delay);
            return;
        }
        generation++;
        state = MonitorState.RUNNING;
        logger.info("Connected to session bus");
        reconcile();
    }

    private Duration busBackoff(int attempt) {
        Duration delay = options.getBusRetryBackoff().multipliedBy(1L << Math.min(attempt - 1, 20));
        return delay.compareTo(options.getBusRetryMaxBackoff()) > 0 ? options.getBusRetryMaxBackoff() : delay;
    }

    private void busLost(Throwable cause) {
        if (state != MonitorState.RUNNING) {
            return;
        }
        state = MonitorState.RECONNECTING;
        logger.warn("Lost session bus connection: {}", cause == null ? "unknown cause" : cause.getMessage());
        generation++;
        pending.clear();
        skipped.clear();
        new ArrayList<>(players.keySet()).forEach(this::removePlayer);
        schedule(() -> connect(1, false), options.getBusRetryBackoff());
    }

    private void reconcile() {
        if (state != MonitorState.RUNNING) {
            return;
        }
        List<String> names;
        try {
            names = bus.listPlayerNames();
        } catch (BusException e) {
            if (!bus.isConnected()) {
                busLost(e);
            } else {
                logger.debug("Failed to list players: {}", e.getMessage());
            }
            return;
        }
        Set<String> present = new HashSet<>();
        for (String name : names) {
            if (MprisNames.isPlayerBusName(name)) {
                present.add(name);
            }
        }
        for (String playerId : new ArrayList<>(players.keySet())) {
            if (!present.contains(playerId)) {
                removePlayer(playerId);
            }
        }
        pending.retainAll(present);
        skipped.retainAll(present);
        for (String name : present) {
            if (!players.containsKey(name) && !pending.contains(name) && !skipped.contains(name)) {
                beginProbe(name);
            }
        }
    }

    private void beginProbe(String busName) {
        pending.add(busName);
        long probeGeneration = generation;
        try {
            probePool.execute(() -> probe(busName, probeGeneration));
        } catch (RejectedExecutionException e) {
            pending.remove(busName);
        }
    }

    // Runs on the probe pool.
    private void probe(String busName, long probeGeneration) {
        PlayerFacade facade = null;
        BusException failure = null;
        int attempts = options.getProbeAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                if (facade == null) {
                    facade = createFacade(busName);
                }
                facade.refresh();
                failure = null;
                break;
            } catch (BusException e) {
                failure = e;
                logger.debug("Probe {} of {} for {} failed: {}", attempt, attempts, busName, e.getMessage());
                if (attempt < attempts && !sleep(options.getProbeBackoff().multipliedBy(1L << (attempt - 1)))) {
                    break;
                }
            }
        }

        if (facade == null) {
            logger.warn("Skipping player {}: {}", busName, failure == null ? "probe interrupted" : failure.getMessage());
            dispatch(() -> {
                if (pending.remove(busName) && probeGeneration == generation) {
                    skipped.add(busName);
                }
            });
            return;
        }
        if (failure != null) {
            facade.markDegraded(failure.getMessage());
        }
        PlayerFacade ready = facade;
        if (!dispatch(() -> register(ready, probeGeneration))) {
            ready.close();
        }
    }

    private PlayerFacade createFacade(String busName) throws BusException {
        PlayerEndpoint endpoint = bus.openPlayer(busName);
        Map<String, Object> root;
        try {
            root = endpoint.getAllProperties(MprisNames.ROOT_INTERFACE);
        } catch (BusException e) {
            logger.debug("No root properties for {}: {}", busName, e.getMessage());
            root = Map.of();
        }
        String identity = MprisNames.identityFor(busName, root);
        FacadeKind kind = selector.select(busName, identity);
        PlayerFacade facade = kind.create(endpoint, identity, options.facadeSettings());
        try {
            facade.subscribe();
        } catch (BusException e) {
            facade.close();
            throw e;
        }
        logger.debug("Created {} façade for {} ({})", kind, busName, identity);
        return facade;
    }

    private void register(PlayerFacade facade, long probeGeneration) {
        String playerId = facade.playerId();
        if (probeGeneration != generation || state != MonitorState.RUNNING || !pending.remove(playerId)) {
            logger.debug("Discarding probe result for {}", playerId);
            facade.close();
            return;
        }
        facade.setDisplayIdentity(uniqueIdentity(facade.reportedIdentity()));
        players.put(playerId, facade);
        PlayerSnapshot snapshot = facade.snapshot();
        emitted.put(playerId, snapshot);
        logger.info("Player appeared: {} as \"{}\" ({})", playerId, snapshot.identity(), facade.kind());
        emit(PlayerEvent.appeared(snapshot));
        // Subscribers always get the first full state as a change of its own.
        emit(PlayerEvent.changed(snapshot));

        facade.setListener(changed -> dispatch(() -> stateChanged(changed)));
        // Catch changes made between the snapshot above and listener registration.
        stateChanged(facade);
    }

    private void stateChanged(PlayerFacade facade) {
        String playerId = facade.playerId();
        if (players.get(playerId) != facade) {
            return;
        }
        PlayerSnapshot snapshot = facade.snapshot();
        if (snapshot.sameStateAs(emitted.get(playerId))) {
            return;
        }
        emitted.put(playerId, snapshot);
        emit(PlayerEvent.changed(snapshot));
    }

    private void removePlayer(String playerId) {
        PlayerFacade facade = players.remove(playerId);
        if (facade == null) {
            return;
        }
        emitted.remove(playerId);
        facade.close();
        logger.info("Player disappeared: {}", playerId);
        emit(PlayerEvent.disappeared(playerId));
    }

    private String uniqueIdentity(String identity) {
        Set<String> taken = new HashSet<>();
        players.values().forEach(facade -> taken.add(facade.displayIdentity()));
        if (!taken.contains(identity)) {
            return identity;
        }
        int suffix = 2;
        while (taken.contains(identity + " (" + suffix + ")")) {
            suffix++;
        }
        return identity + " (" + suffix + ")";
    }

    private void emit(PlayerEvent event) {
        for (PlayerEventListener listener : listeners) {
            try {
                listener.onPlayerEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Player event listener failed on {}", event.type(), e);
            }
        }
    }

    private boolean dispatch(Runnable task) {
        try {
            dispatcher.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    logger.error("Monitor task failed", e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    private void schedule(Runnable task, Duration delay) {
        try {
            scheduler.schedule(() -> dispatch(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Monitor is closing, not scheduling retry");
        }
    }

    private static boolean sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private final class BusHandler implements BusListener {
        @Override
        public void onPlayerNameAppeared(String busName) {
            dispatch(() -> {
                skipped.remove(busName);
                if (state == MonitorState.RUNNING && MprisNames.isPlayerBusName(busName)
                        && !players.containsKey(busName) && !pending.contains(busName)) {
                    beginProbe(busName);
                }
            });
        }

        @Override
        public void onPlayerNameVanished(String busName) {
            dispatch(() -> {
                pending.remove(busName);
                skipped.remove(busName);
                removePlayer(busName);
            });
        }

        @Override
        public void onBusLost(Throwable cause) {
            dispatch(() -> busLost(cause));
        }
    }
}
