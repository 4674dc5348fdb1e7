package org.endlesssource.mediarelay.test;

import org.endlesssource.mediarelay.spi.BusException;
import org.endlesssource.mediarelay.spi.PlayerEndpoint;
import org.endlesssource.mediarelay.spi.PlayerSignalListener;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable MPRIS player object. Commands are recorded and, by default, reflected
 * back as property changes the way a well-behaved player would.
 */
public class FakePlayerEndpoint implements PlayerEndpoint {
    public static final String ROOT = "org.mpris.MediaPlayer2";
    public static final String PLAYER = "org.mpris.MediaPlayer2.Player";

    private final String busName;
    private final Map<String, Object> rootProperties = new HashMap<>();
    private final Map<String, Object> playerProperties = new HashMap<>();
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final AtomicInteger playerReadFailures = new AtomicInteger();
    private final AtomicInteger closeCount = new AtomicInteger();
    private final AtomicInteger waitingCommands = new AtomicInteger();
    private volatile PlayerSignalListener listener;
    private volatile boolean failCommands;
    private volatile boolean reflectCommands = true;
    private volatile CountDownLatch commandGate;

    public FakePlayerEndpoint(String busName, String identity) {
        this.busName = busName;
        if (identity != null) {
            rootProperties.put("Identity", identity);
        }
        playerProperties.put("PlaybackStatus", "Stopped");
        playerProperties.put("Metadata", Map.of());
        playerProperties.put("Position", 0L);
        playerProperties.put("Rate", 1.0d);
        playerProperties.put("MinimumRate", 0.5d);
        playerProperties.put("MaximumRate", 2.0d);
        playerProperties.put("CanControl", true);
        playerProperties.put("CanPlay", true);
        playerProperties.put("CanPause", true);
        playerProperties.put("CanGoNext", true);
        playerProperties.put("CanGoPrevious", true);
        playerProperties.put("CanSeek", true);
    }

    public static FakePlayerEndpoint compliant(String shortName, String identity) {
        return new FakePlayerEndpoint("org.mpris.MediaPlayer2." + shortName, identity);
    }

    public static Map<String, Object> track(String trackId, String title, String artist) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("mpris:trackid", trackId);
        metadata.put("xesam:title", title);
        metadata.put("xesam:artist", List.of(artist));
        metadata.put("mpris:length", 240_000_000L);
        return metadata;
    }

    /**
     * Change properties without signalling.
     */
    public synchronized FakePlayerEndpoint set(String property, Object value) {
        playerProperties.put(property, value);
        return this;
    }

    public synchronized FakePlayerEndpoint setRoot(String property, Object value) {
        rootProperties.put(property, value);
        return this;
    }

    /**
     * Change properties and signal the change.
     */
    public void emitChanged(Map<String, Object> changed, List<String> invalidated) {
        synchronized (this) {
            playerProperties.putAll(changed);
            invalidated.forEach(playerProperties::remove);
        }
        PlayerSignalListener current = listener;
        if (current != null) {
            current.onPropertiesChanged(PLAYER, changed, invalidated);
        }
    }

    public void emitChanged(String property, Object value) {
        emitChanged(Map.of(property, value), List.of());
    }

    public void emitSeeked(long positionMicros) {
        synchronized (this) {
            playerProperties.put("Position", positionMicros);
        }
        PlayerSignalListener current = listener;
        if (current != null) {
            current.onSeeked(positionMicros);
        }
    }

    public void failNextPlayerReads(int count) {
        playerReadFailures.set(count);
    }

    public void setFailCommands(boolean failCommands) {
        this.failCommands = failCommands;
    }

    public void setReflectCommands(boolean reflectCommands) {
        this.reflectCommands = reflectCommands;
    }

    /**
     * Make every command wait until the returned latch is released.
     */
    public CountDownLatch holdCommands() {
        CountDownLatch gate = new CountDownLatch(1);
        commandGate = gate;
        return gate;
    }

    /**
     * Commands currently held by {@link #holdCommands()}.
     */
    public int waitingCommands() {
        return waitingCommands.get();
    }

    public List<String> calls() {
        return new ArrayList<>(calls);
    }

    public boolean isSubscribed() {
        return listener != null;
    }

    public int closeCount() {
        return closeCount.get();
    }

    @Override
    public String busName() {
        return busName;
    }

    @Override
    public synchronized Map<String, Object> getAllProperties(String interfaceName) throws BusException {
        if (ROOT.equals(interfaceName)) {
            return new HashMap<>(rootProperties);
        }
        if (PLAYER.equals(interfaceName)) {
            if (playerReadFailures.get() != 0) {
                playerReadFailures.decrementAndGet();
                throw new BusException("org.freedesktop.DBus.Error.NoReply: " + busName);
            }
            return new HashMap<>(playerProperties);
        }
        throw new BusException("Unknown interface " + interfaceName);
    }

    @Override
    public synchronized Object getProperty(String interfaceName, String property) throws BusException {
        if (PLAYER.equals(interfaceName) && playerReadFailures.get() != 0) {
            throw new BusException("org.freedesktop.DBus.Error.NoReply: " + busName);
        }
        Object value = (ROOT.equals(interfaceName) ? rootProperties : playerProperties).get(property);
        if (value == null) {
            throw new BusException("org.freedesktop.DBus.Error.InvalidArgs: no property " + property);
        }
        return value;
    }

    @Override
    public void setProperty(String interfaceName, String property, Object value) throws BusException {
        command("Set:" + property + ":" + value);
        if (reflectCommands) {
            emitChanged(property, value);
        }
    }

    @Override
    public void play() throws BusException {
        command("Play");
        reflectStatus("Playing");
    }

    @Override
    public void pause() throws BusException {
        command("Pause");
        reflectStatus("Paused");
    }

    @Override
    public void playPause() throws BusException {
        command("PlayPause");
    }

    @Override
    public void stop() throws BusException {
        command("Stop");
        reflectStatus("Stopped");
    }

    @Override
    public void next() throws BusException {
        command("Next");
    }

    @Override
    public void previous() throws BusException {
        command("Previous");
    }

    @Override
    public void seek(long offsetMicros) throws BusException {
        command("Seek:" + offsetMicros);
    }

    @Override
    public void setPosition(String trackId, long positionMicros) throws BusException {
        command("SetPosition:" + trackId + ":" + positionMicros);
        if (reflectCommands) {
            emitSeeked(positionMicros);
        }
    }

    @Override
    public void subscribe(PlayerSignalListener listener) {
        this.listener = listener;
    }

    @Override
    public void close() {
        listener = null;
        closeCount.incrementAndGet();
    }

    private void command(String call) throws BusException {
        CountDownLatch gate = commandGate;
        if (gate != null) {
            waitingCommands.incrementAndGet();
            try {
                if (!gate.await(5, TimeUnit.SECONDS)) {
                    throw new BusException("command gate not released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BusException("interrupted", e);
            } finally {
                waitingCommands.decrementAndGet();
            }
        }
        if (failCommands) {
            throw new BusException("org.freedesktop.DBus.Error.Failed: " + call);
        }
        calls.add(call);
    }

    private void reflectStatus(String status) {
        if (reflectCommands) {
            emitChanged("PlaybackStatus", status);
        }
    }
}
