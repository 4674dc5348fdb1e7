package org.endlesssource.mediarelay.linux;

import org.endlesssource.mediarelay.facade.MprisNames;
import org.endlesssource.mediarelay.spi.BusException;
import org.endlesssource.mediarelay.spi.BusListener;
import org.endlesssource.mediarelay.spi.MediaBus;
import org.endlesssource.mediarelay.spi.PlayerEndpoint;
import org.freedesktop.dbus.connections.impl.DBusConnection;
import org.freedesktop.dbus.connections.impl.DBusConnectionBuilder;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.exceptions.DBusExecutionException;
import org.freedesktop.dbus.interfaces.DBus;
import org.freedesktop.dbus.interfaces.DBusSigHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Linux session bus client using D-Bus.
 * Name appearance and disappearance come from {@code NameOwnerChanged}; a connection that drops
 * is reported through {@link BusListener#onBusLost(Throwable)}.
 */
public class DBusMediaBus implements MediaBus {
    private static final Logger logger = LoggerFactory.getLogger(DBusMediaBus.class);
    private static final String DBUS_NAME = "org.freedesktop.DBus";
    private static final String DBUS_PATH = "/org/freedesktop/DBus";

    private final DBusSigHandler<DBus.NameOwnerChanged> nameOwnerHandler = this::onNameOwnerChanged;
    private volatile BusListener listener;
    private DBusConnection connection;
    private DBus dbus;

    @Override
    public synchronized void connect() throws BusException {
        closeConnection();
        try {
            connection = DBusConnectionBuilder.forSessionBus()
                    .withShared(false)
                    .withDisconnectCallback(new BusLossForwarder(() -> listener))
                    .build();
            dbus = connection.getRemoteObject(DBUS_NAME, DBUS_PATH, DBus.class);
            connection.addSigHandler(DBus.NameOwnerChanged.class, nameOwnerHandler);
            logger.debug("Connected to session bus as {}", connection.getUniqueName());
        } catch (DBusException | RuntimeException e) {
            closeConnection();
            throw new BusException("Failed to connect to session bus: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized boolean isConnected() {
        return connection != null && connection.isConnected();
    }

    @Override
    public List<String> listPlayerNames() throws BusException {
        DBus current = requireDBus();
        try {
            List<String> names = new ArrayList<>();
            for (String name : current.ListNames()) {
                if (MprisNames.isPlayerBusName(name)) {
                    names.add(name);
                }
            }
            return names;
        } catch (DBusExecutionException e) {
            throw new BusException("Failed to list bus names: " + e.getMessage(), e);
        }
    }

    @Override
    public PlayerEndpoint openPlayer(String busName) throws BusException {
        DBusConnection current;
        DBus currentDBus;
        synchronized (this) {
            current = connection;
            currentDBus = dbus;
        }
        if (current == null || currentDBus == null) {
            throw new BusException("Not connected to session bus");
        }
        try {
            String uniqueName = currentDBus.GetNameOwner(busName);
            return new DBusPlayerEndpoint(current, busName, uniqueName);
        } catch (DBusException | DBusExecutionException e) {
            throw new BusException("Failed to open " + busName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void setListener(BusListener listener) {
        this.listener = listener;
    }

    @Override
    public synchronized void close() {
        closeConnection();
    }

    private synchronized DBus requireDBus() throws BusException {
        if (dbus == null) {
            throw new BusException("Not connected to session bus");
        }
        return dbus;
    }

    private void onNameOwnerChanged(DBus.NameOwnerChanged signal) {
        BusListener current = listener;
        if (current == null || !MprisNames.isPlayerBusName(signal.name)) {
            return;
        }
        boolean hadOwner = signal.oldOwner != null && !signal.oldOwner.isEmpty();
        boolean hasOwner = signal.newOwner != null && !signal.newOwner.isEmpty();
        if (hadOwner) {
            current.onPlayerNameVanished(signal.name);
        }
        if (hasOwner) {
            current.onPlayerNameAppeared(signal.name);
        }
    }

    private void closeConnection() {
        if (connection == null) {
            return;
        }
        try {
            connection.removeSigHandler(DBus.NameOwnerChanged.class, nameOwnerHandler);
        } catch (Exception e) {
            logger.debug("Failed to remove NameOwnerChanged handler: {}", e.getMessage());
        }
        try {
            connection.close();
        } catch (Exception e) {
            logger.error("Failed to close D-Bus connection", e);
        }
        connection = null;
        dbus = null;
    }
}
