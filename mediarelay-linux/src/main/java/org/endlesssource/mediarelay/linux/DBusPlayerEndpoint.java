package org.endlesssource.mediarelay.linux;

import org.endlesssource.mediarelay.facade.MprisNames;
import org.endlesssource.mediarelay.spi.BusException;
import org.endlesssource.mediarelay.spi.PlayerEndpoint;
import org.endlesssource.mediarelay.spi.PlayerSignalListener;
import org.freedesktop.dbus.DBusPath;
import org.freedesktop.dbus.connections.impl.DBusConnection;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.exceptions.DBusExecutionException;
import org.freedesktop.dbus.interfaces.DBusSigHandler;
import org.freedesktop.dbus.interfaces.Properties;
import org.freedesktop.dbus.messages.DBusSignal;
import org.freedesktop.dbus.types.Variant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One MPRIS player object on the session bus.
 * <p>
 * Signal handlers are registered per signal type on the shared connection, so incoming
 * signals are filtered by the player's unique bus name and object path.
 */
class DBusPlayerEndpoint implements PlayerEndpoint {
    private static final Logger logger = LoggerFactory.getLogger(DBusPlayerEndpoint.class);

    private final DBusConnection connection;
    private final String busName;
    private final String uniqueName;
    private final MprisPlayer player;
    private final Properties properties;
    private final DBusSigHandler<Properties.PropertiesChanged> propertiesHandler = this::onPropertiesChanged;
    private final DBusSigHandler<MprisPlayer.Seeked> seekedHandler = this::onSeeked;
    private volatile PlayerSignalListener listener;
    private volatile boolean closed;

    DBusPlayerEndpoint(DBusConnection connection, String busName, String uniqueName) throws DBusException {
        this.connection = connection;
        this.busName = busName;
        this.uniqueName = uniqueName;
        this.player = connection.getRemoteObject(busName, MprisNames.OBJECT_PATH, MprisPlayer.class);
        this.properties = connection.getRemoteObject(busName, MprisNames.OBJECT_PATH, Properties.class);
    }

    @Override
    public String busName() {
        return busName;
    }

    @Override
    public Map<String, Object> getAllProperties(String interfaceName) throws BusException {
        try {
            return DBusValues.toPlainMap(properties.GetAll(interfaceName));
        } catch (DBusExecutionException e) {
            throw new BusException("Failed to read " + interfaceName + " of " + busName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Object getProperty(String interfaceName, String property) throws BusException {
        try {
            Object value = properties.Get(interfaceName, property);
            return DBusValues.toPlain(value);
        } catch (DBusExecutionException e) {
            throw new BusException("Failed to read " + property + " of " + busName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void setProperty(String interfaceName, String property, Object value) throws BusException {
        call("Set " + property, () -> properties.Set(interfaceName, property, new Variant<>(value)));
    }

    @Override
    public void play() throws BusException {
        call("Play", player::Play);
    }

    @Override
    public void pause() throws BusException {
        call("Pause", player::Pause);
    }

    @Override
    public void playPause() throws BusException {
        call("PlayPause", player::PlayPause);
    }

    @Override
    public void stop() throws BusException {
        call("Stop", player::Stop);
    }

    @Override
    public void next() throws BusException {
        call("Next", player::Next);
    }

    @Override
    public void previous() throws BusException {
        call("Previous", player::Previous);
    }

    @Override
    public void seek(long offsetMicros) throws BusException {
        call("Seek", () -> player.Seek(offsetMicros));
    }

    @Override
    public void setPosition(String trackId, long positionMicros) throws BusException {
        // MPRIS expects microseconds
        call("SetPosition", () -> player.SetPosition(new DBusPath(trackId), positionMicros));
    }

    @Override
    public void subscribe(PlayerSignalListener listener) throws BusException {
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        try {
            connection.addSigHandler(Properties.PropertiesChanged.class, propertiesHandler);
            connection.addSigHandler(MprisPlayer.Seeked.class, seekedHandler);
        } catch (DBusException e) {
            throw new BusException("Failed to subscribe to " + busName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (listener == null) {
            return;
        }
        listener = null;
        try {
            connection.removeSigHandler(Properties.PropertiesChanged.class, propertiesHandler);
            connection.removeSigHandler(MprisPlayer.Seeked.class, seekedHandler);
        } catch (Exception e) {
            logger.debug("Failed to remove signal handlers for {}: {}", busName, e.getMessage());
        }
    }

    private boolean fromThisPlayer(DBusSignal signal) {
        return uniqueName.equals(signal.getSource()) && MprisNames.OBJECT_PATH.equals(signal.getPath());
    }

    private void onPropertiesChanged(Properties.PropertiesChanged signal) {
        PlayerSignalListener current = listener;
        if (current == null || !fromThisPlayer(signal)) {
            return;
        }
        Map<String, Object> changed = DBusValues.toPlainMap(signal.getPropertiesChanged());
        List<String> invalidated = signal.getPropertiesRemoved();
        current.onPropertiesChanged(signal.getInterfaceName(), changed, invalidated == null ? List.of() : invalidated);
    }

    private void onSeeked(MprisPlayer.Seeked signal) {
        PlayerSignalListener current = listener;
        if (current != null && fromThisPlayer(signal)) {
            current.onSeeked(signal.getPosition());
        }
    }

    private void call(String method, Runnable invocation) throws BusException {
        try {
            invocation.run();
        } catch (DBusExecutionException e) {
            throw new BusException(method + " failed on " + busName + ": " + e.getMessage(), e);
        }
    }
}
