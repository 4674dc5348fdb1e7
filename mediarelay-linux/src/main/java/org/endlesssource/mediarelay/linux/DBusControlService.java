package org.endlesssource.mediarelay.linux;

import org.endlesssource.mediarelay.spi.AgentAlreadyRunningException;
import org.endlesssource.mediarelay.spi.AgentControl;
import org.endlesssource.mediarelay.spi.BusException;
import org.endlesssource.mediarelay.spi.ControlService;
import org.freedesktop.dbus.connections.impl.DBusConnection;
import org.freedesktop.dbus.connections.impl.DBusConnectionBuilder;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.exceptions.DBusExecutionException;
import org.freedesktop.dbus.interfaces.DBus;
import org.freedesktop.dbus.types.UInt32;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Publishes the agent as {@code org.endlesssource.MediaRelay1} on the session bus. The name is
 * requested without queueing, so a second agent in the same session fails to start.
 */
public class DBusControlService implements ControlService {
    private static final Logger logger = LoggerFactory.getLogger(DBusControlService.class);
    static final String BUS_NAME = "org.endlesssource.MediaRelay1";
    static final String OBJECT_PATH = "/org/endlesssource/MediaRelay1";
    private static final String DBUS_NAME = "org.freedesktop.DBus";
    private static final String DBUS_PATH = "/org/freedesktop/DBus";

    @Override
    public Registration export(AgentControl control) throws BusException {
        DBusConnection connection = open();
        try {
            connection.exportObject(OBJECT_PATH, new ExportedAgentControl(control));
            DBus dbus = connection.getRemoteObject(DBUS_NAME, DBUS_PATH, DBus.class);
            UInt32 reply = dbus.RequestName(BUS_NAME, new UInt32(DBus.DBUS_NAME_FLAG_DO_NOT_QUEUE));
            if (reply.intValue() != DBus.DBUS_REQUEST_NAME_REPLY_PRIMARY_OWNER) {
                close(connection);
                throw new AgentAlreadyRunningException("Another agent already owns " + BUS_NAME);
            }
        } catch (DBusException | DBusExecutionException e) {
            close(connection);
            throw new BusException("Failed to publish " + BUS_NAME + ": " + e.getMessage(), e);
        }
        logger.debug("Published agent control as {}", BUS_NAME);
        return () -> close(connection);
    }

    @Override
    public Optional<RemoteAgent> connect() throws BusException {
        DBusConnection connection = open();
        try {
            DBus dbus = connection.getRemoteObject(DBUS_NAME, DBUS_PATH, DBus.class);
            if (!dbus.NameHasOwner(BUS_NAME)) {
                close(connection);
                return Optional.empty();
            }
            MediaRelayControl remote = connection.getRemoteObject(BUS_NAME, OBJECT_PATH, MediaRelayControl.class);
            return Optional.of(new RemoteAgentControl(remote, () -> close(connection)));
        } catch (DBusException | DBusExecutionException e) {
            close(connection);
            throw new BusException("Failed to look up " + BUS_NAME + ": " + e.getMessage(), e);
        }
    }

    private static DBusConnection open() throws BusException {
        try {
            return DBusConnectionBuilder.forSessionBus().withShared(false).build();
        } catch (DBusException | RuntimeException e) {
            throw new BusException("Failed to connect to session bus: " + e.getMessage(), e);
        }
    }

    private static void close(DBusConnection connection) {
        try {
            connection.close();
        } catch (Exception e) {
            logger.debug("Failed to close control connection: {}", e.getMessage());
        }
    }
}
