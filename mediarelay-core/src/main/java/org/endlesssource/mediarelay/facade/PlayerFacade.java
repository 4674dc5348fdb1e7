package org.endlesssource.mediarelay.facade;

import org.endlesssource.mediarelay.NamedThreadFactory;
import org.endlesssource.mediarelay.api.CommandAction;
import org.endlesssource.mediarelay.api.CommandResult;
import org.endlesssource.mediarelay.api.PlaybackState;
import org.endlesssource.mediarelay.api.PlayerCommand;
import org.endlesssource.mediarelay.api.PlayerSnapshot;
import org.endlesssource.mediarelay.api.PlayerStatus;
import org.endlesssource.mediarelay.api.RejectionReason;
import org.endlesssource.mediarelay.api.TrackMetadata;
import org.endlesssource.mediarelay.api.TransportCapabilities;
import org.endlesssource.mediarelay.spi.BusException;
import org.endlesssource.mediarelay.spi.PlayerEndpoint;
import org.endlesssource.mediarelay.spi.PlayerSignalListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Canonical view of one MPRIS player.
 * <p>
 * The façade is the only writer of its player's state. Raw properties arrive from the
 * endpoint (initial probe, refreshes and change signals) and are turned into a
 * {@link PlayerSnapshot} on demand. Subclasses adjust how state, capabilities and
 * commands are interpreted for players that do not follow the MPRIS contract.
 * <p>
 * Commands run one at a time on the façade's own command thread.
 * <p>
 * MPRIS does not signal {@code Position} while playing, so the position is anchored whenever it
 * is read and projected forward by the playback rate. A periodic re-read corrects the anchor.
 */
public abstract class PlayerFacade implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PlayerFacade.class);
    private static final long POSITION_TOLERANCE_MICROS = PlayerSnapshot.POSITION_TOLERANCE.toNanos() / 1000L;

    protected final PlayerEndpoint endpoint;
    protected final FacadeSettings settings;

    private final String reportedIdentity;
    private final ThreadPoolExecutor commandExecutor;
    private final ScheduledExecutorService refreshScheduler;
    private final Object stateLock = new Object();
    private final Map<String, Object> properties = new HashMap<>();
    private boolean degraded = true;
    private long anchorMicros;
    private long anchorNanos = System.nanoTime();

    private volatile String displayIdentity;
    private volatile FacadeListener listener;
    private volatile boolean closed;

    protected PlayerFacade(PlayerEndpoint endpoint, String identity, FacadeSettings settings) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.reportedIdentity = Objects.requireNonNull(identity, "identity must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.displayIdentity = identity;
        this.commandExecutor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(settings.commandQueueCapacity()),
                new NamedThreadFactory("mediarelay-command-" + MprisNames.shortName(endpoint.busName())));
        this.refreshScheduler = Executors.newSingleThreadScheduledExecutor(
                new NamedThreadFactory("mediarelay-refresh-" + MprisNames.shortName(endpoint.busName())));
    }

    public abstract FacadeKind kind();

    public String playerId() {
        return endpoint.busName();
    }

    /**
     * Name the player reports for itself.
     */
    public String reportedIdentity() {
        return reportedIdentity;
    }

    /**
     * Name shown to clients, unique among the current players.
     */
    public String displayIdentity() {
        return displayIdentity;
    }

    public void setDisplayIdentity(String displayIdentity) {
        this.displayIdentity = Objects.requireNonNull(displayIdentity, "displayIdentity must not be null");
    }

    public void setListener(FacadeListener listener) {
        this.listener = listener;
    }

    /**
     * Start receiving change signals. Signals that arrive before the first
     * {@link #refresh()} are applied to the state but do not leave the degraded status.
     *
     * @throws BusException if the subscription fails
     */
    public void subscribe() throws BusException {
        endpoint.subscribe(new SignalHandler());
        Duration interval = settings.positionSyncInterval();
        if (!interval.isZero()) {
            refreshScheduler.scheduleWithFixedDelay(this::syncPosition,
                    interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Re-read every player property. A successful refresh clears the degraded status.
     *
     * @throws BusException if the properties cannot be read
     */
    public void refresh() throws BusException {
        Map<String, Object> current = endpoint.getAllProperties(MprisNames.PLAYER_INTERFACE);
        boolean recovered;
        synchronized (stateLock) {
            recovered = degraded;
            properties.clear();
            properties.putAll(current);
            anchor(MprisMetadata.asLong(current.get(MprisNames.POSITION), 0L));
            degraded = false;
        }
        if (recovered) {
            logger.debug("State of {} is available", playerId());
        }
        notifyChanged();
    }

    /**
     * Report the player as degraded until a later refresh succeeds.
     */
    public void markDegraded(String reason) {
        synchronized (stateLock) {
            degraded = true;
        }
        logger.warn("Player {} is degraded: {}", playerId(), reason);
    }

    public boolean isDegraded() {
        synchronized (stateLock) {
            return degraded;
        }
    }

    /**
     * @return the current canonical state
     */
    public PlayerSnapshot snapshot() {
        synchronized (stateLock) {
            if (degraded) {
                return PlayerSnapshot.degraded(playerId(), displayIdentity);
            }
            TrackMetadata metadata = MprisMetadata.parse(properties.get(MprisNames.METADATA));
            long positionMicros = projectedMicros(metadata);
            return new PlayerSnapshot(
                    playerId(),
                    displayIdentity,
                    playbackState(properties, metadata),
                    PlayerStatus.HEALTHY,
                    metadata,
                    Duration.of(positionMicros, ChronoUnit.MICROS),
                    MprisMetadata.asDouble(properties.get(MprisNames.RATE), 1.0d),
                    capabilities(properties),
                    Instant.now());
        }
    }

    /**
     * Queue a command behind the ones already waiting.
     *
     * @return future completed with the outcome; never completed exceptionally
     */
    public CompletableFuture<CommandResult> execute(PlayerCommand command) {
        Objects.requireNonNull(command, "command must not be null");
        if (closed) {
            return CompletableFuture.completedFuture(
                    CommandResult.rejected(RejectionReason.NOT_FOUND, displayIdentity + " is no longer available"));
        }
        Optional<CommandResult> rejection = checkCommand(command, snapshot());
        if (rejection.isPresent()) {
            logger.debug("Rejected {} for {}: {}", command.action(), playerId(), rejection.get().message());
            return CompletableFuture.completedFuture(rejection.get());
        }
        CommandTask task = new CommandTask(command);
        try {
            commandExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            String message = closed
                    ? displayIdentity + " is no longer available"
                    : displayIdentity + " has too many pending commands";
            return CompletableFuture.completedFuture(
                    CommandResult.rejected(closed ? RejectionReason.NOT_FOUND : RejectionReason.PLAYER_BUSY, message));
        }
        return task.result;
    }

    /**
     * Stop command processing, drop the signal subscription and release the endpoint.
     * Commands still waiting are answered with {@link RejectionReason#NOT_FOUND}.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        listener = null;
        List<Runnable> pending = commandExecutor.shutdownNow();
        for (Runnable runnable : pending) {
            if (runnable instanceof CommandTask task) {
                task.result.complete(CommandResult.rejected(RejectionReason.NOT_FOUND,
                        displayIdentity + " is no longer available"));
            }
        }
        refreshScheduler.shutdownNow();
        endpoint.close();
    }

    /**
     * Canonical playback state. Absent or unrecognized status is reported as stopped.
     */
    protected PlaybackState playbackState(Map<String, Object> props, TrackMetadata metadata) {
        PlaybackState state = PlaybackState.fromMpris(MprisMetadata.asString(props.get(MprisNames.PLAYBACK_STATUS)));
        return state == PlaybackState.UNKNOWN ? PlaybackState.STOPPED : state;
    }

    /**
     * Canonical capabilities. A missing {@code Can*} property counts as false,
     * and nothing is controllable when {@code CanControl} is false.
     */
    protected TransportCapabilities capabilities(Map<String, Object> props) {
        boolean canControl = MprisMetadata.asBoolean(props.get(MprisNames.CAN_CONTROL), false);
        if (!canControl) {
            return TransportCapabilities.NONE;
        }
        double minimumRate = MprisMetadata.asDouble(props.get(MprisNames.MINIMUM_RATE), 1.0d);
        double maximumRate = MprisMetadata.asDouble(props.get(MprisNames.MAXIMUM_RATE), 1.0d);
        return new TransportCapabilities(
                MprisMetadata.asBoolean(props.get(MprisNames.CAN_PLAY), false),
                MprisMetadata.asBoolean(props.get(MprisNames.CAN_PAUSE), false),
                true,
                MprisMetadata.asBoolean(props.get(MprisNames.CAN_GO_NEXT), false),
                MprisMetadata.asBoolean(props.get(MprisNames.CAN_GO_PREVIOUS), false),
                MprisMetadata.asBoolean(props.get(MprisNames.CAN_SEEK), false),
                minimumRate < maximumRate);
    }

    /**
     * Decide whether a command can be attempted at all.
     *
     * @return a rejection, or empty to go ahead
     */
    protected Optional<CommandResult> checkCommand(PlayerCommand command, PlayerSnapshot current) {
        if (!current.capabilities().supports(command.action())) {
            return Optional.of(CommandResult.rejected(RejectionReason.UNSUPPORTED,
                    current.identity() + " does not support " + command.action()));
        }
        if (command.action() == CommandAction.SET_RATE) {
            double rate = command.rate();
            double minimumRate;
            double maximumRate;
            synchronized (stateLock) {
                minimumRate = MprisMetadata.asDouble(properties.get(MprisNames.MINIMUM_RATE), 1.0d);
                maximumRate = MprisMetadata.asDouble(properties.get(MprisNames.MAXIMUM_RATE), 1.0d);
            }
            if (rate <= 0.0d || rate < minimumRate || rate > maximumRate) {
                return Optional.of(CommandResult.rejected(RejectionReason.INVALID_ARGUMENT,
                        "rate " + rate + " is outside [" + minimumRate + ", " + maximumRate + "]"));
            }
        }
        return Optional.empty();
    }

    /**
     * Carry out an accepted command against the endpoint. Runs on the command thread.
     */
    protected void perform(PlayerCommand command) throws BusException {
        switch (command.action()) {
            case PLAY -> endpoint.play();
            case PAUSE -> endpoint.pause();
            case STOP -> endpoint.stop();
            case NEXT -> endpoint.next();
            case PREVIOUS -> endpoint.previous();
            case SEEK -> seekTo(command.position());
            case SET_RATE -> endpoint.setProperty(MprisNames.PLAYER_INTERFACE, MprisNames.RATE, command.rate());
        }
    }

    /**
     * Hook run after a property change signal was applied.
     */
    protected void afterPropertiesChanged() {
    }

    /**
     * Absolute seek through {@code SetPosition} when the current track id is known,
     * otherwise a relative {@code Seek} from the position the player reports right now.
     */
    protected final void seekTo(Duration position) throws BusException {
        long targetMicros = position.toNanos() / 1000L;
        Optional<String> trackId = snapshot().metadata().getTrackId();
        if (trackId.isPresent()) {
            endpoint.setPosition(trackId.get(), targetMicros);
        } else {
            endpoint.seek(targetMicros - currentPositionMicros());
        }
    }

    /**
     * Re-read {@code Position} and re-anchor on it; falls back to the projected position
     * when the player does not answer.
     */
    protected final long currentPositionMicros() {
        try {
            long micros = readPositionMicros();
            synchronized (stateLock) {
                anchor(micros);
            }
            return micros;
        } catch (BusException e) {
            logger.debug("Position of {} unavailable, using projection: {}", playerId(), e.getMessage());
            synchronized (stateLock) {
                return projectedMicros(MprisMetadata.parse(properties.get(MprisNames.METADATA)));
            }
        }
    }

    private long readPositionMicros() throws BusException {
        Object raw = endpoint.getProperty(MprisNames.PLAYER_INTERFACE, MprisNames.POSITION);
        if (!(raw instanceof Number number)) {
            throw new BusException("Position of " + playerId() + " is not a number: " + raw);
        }
        return number.longValue();
    }

    // Runs on the refresh scheduler.
    private void syncPosition() {
        if (closed || isDegraded()) {
            return;
        }
        long micros;
        try {
            micros = readPositionMicros();
        } catch (BusException e) {
            logger.debug("Position sync of {} failed: {}", playerId(), e.getMessage());
            return;
        }
        boolean jumped;
        synchronized (stateLock) {
            long projected = projectedMicros(MprisMetadata.parse(properties.get(MprisNames.METADATA)));
            jumped = Math.abs(micros - projected) > POSITION_TOLERANCE_MICROS;
            anchor(micros);
        }
        if (jumped) {
            logger.debug("Position of {} moved without a signal", playerId());
            notifyChanged();
        }
    }

    // Callers hold stateLock.
    private void anchor(long micros) {
        anchorMicros = Math.max(0L, micros);
        anchorNanos = System.nanoTime();
        properties.put(MprisNames.POSITION, anchorMicros);
    }

    // Callers hold stateLock.
    private long projectedMicros(TrackMetadata metadata) {
        PlaybackState raw = PlaybackState.fromMpris(MprisMetadata.asString(properties.get(MprisNames.PLAYBACK_STATUS)));
        double rate = MprisMetadata.asDouble(properties.get(MprisNames.RATE), 1.0d);
        if (raw != PlaybackState.PLAYING || rate <= 0.0d) {
            return anchorMicros;
        }
        long elapsedMicros = Math.max(0L, System.nanoTime() - anchorNanos) / 1000L;
        long projected = anchorMicros + Math.round(elapsedMicros * rate);
        Duration length = metadata.length();
        if (length != null && !length.isZero()) {
            projected = Math.min(projected, length.toNanos() / 1000L);
        }
        return projected;
    }

    /**
     * Re-read the player state after the given delay.
     */
    protected final void scheduleRefresh(Duration delay) {
        if (closed) {
            return;
        }
        try {
            refreshScheduler.schedule(this::refreshQuietly, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Refresh of {} not scheduled, façade is closing", playerId());
        }
    }

    private void refreshQuietly() {
        if (closed) {
            return;
        }
        try {
            refresh();
        } catch (BusException e) {
            logger.debug("Refresh of {} failed: {}", playerId(), e.getMessage());
        }
    }

    private void notifyChanged() {
        FacadeListener current = listener;
        if (current != null && !closed) {
            current.onFacadeChanged(this);
        }
    }

    private CommandResult run(PlayerCommand command) {
        try {
            perform(command);
            logger.debug("{} sent to {}", command.action(), playerId());
            return CommandResult.ok();
        } catch (BusException e) {
            logger.warn("{} failed on {}: {}", command.action(), playerId(), e.getMessage());
            return CommandResult.rejected(RejectionReason.FAILED, e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("{} failed on {}", command.action(), playerId(), e);
            return CommandResult.rejected(RejectionReason.FAILED, String.valueOf(e.getMessage()));
        }
    }

    private final class CommandTask implements Runnable {
        private final PlayerCommand command;
        private final CompletableFuture<CommandResult> result = new CompletableFuture<>();

        private CommandTask(PlayerCommand command) {
            this.command = command;
        }

        @Override
        public void run() {
            result.complete(PlayerFacade.this.run(command));
        }
    }

    private final class SignalHandler implements PlayerSignalListener {
        @Override
        public void onPropertiesChanged(String interfaceName, Map<String, Object> changed, List<String> invalidated) {
            if (closed || !MprisNames.PLAYER_INTERFACE.equals(interfaceName)) {
                return;
            }
            boolean wasDegraded;
            synchronized (stateLock) {
                wasDegraded = degraded;
                // Freeze the projection before status or rate change under it.
                long projected = projectedMicros(MprisMetadata.parse(properties.get(MprisNames.METADATA)));
                properties.putAll(changed);
                // Invalidated values fall back to their absent defaults: stopped, empty metadata, no capability.
                invalidated.forEach(properties::remove);
                Object position = changed.get(MprisNames.POSITION);
                anchor(position == null ? projected : MprisMetadata.asLong(position, projected));
            }
            if (wasDegraded) {
                scheduleRefresh(Duration.ZERO);
                return;
            }
            afterPropertiesChanged();
            notifyChanged();
        }

        @Override
        public void onSeeked(long positionMicros) {
            if (closed) {
                return;
            }
            synchronized (stateLock) {
                anchor(positionMicros);
            }
            notifyChanged();
        }
    }
}
