package org.endlesssource.mediarelay.linux;

import org.endlesssource.mediarelay.NamedThreadFactory;
import org.endlesssource.mediarelay.spi.DesktopNotifier;
import org.freedesktop.dbus.connections.impl.DBusConnection;
import org.freedesktop.dbus.connections.impl.DBusConnectionBuilder;
import org.freedesktop.dbus.types.UInt32;
import org.freedesktop.dbus.types.Variant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Posts to {@code org.freedesktop.Notifications} on a background thread.
 * Failures are logged and otherwise ignored.
 */
public class DBusDesktopNotifier implements DesktopNotifier {
    private static final Logger logger = LoggerFactory.getLogger(DBusDesktopNotifier.class);
    private static final String APP_NAME = "mediarelay";
    private static final int EXPIRE_MS = 60_000;

    private final ExecutorService executor = Executors.newSingleThreadExecutor(new NamedThreadFactory("mediarelay-notify"));
    private DBusConnection connection;

    @Override
    public void show(String summary, String body) {
        try {
            executor.execute(() -> post(summary, body));
        } catch (RejectedExecutionException e) {
            logger.debug("Notifier closed, dropping \"{}\"", summary);
        }
    }

    private void post(String summary, String body) {
        try {
            if (connection == null || !connection.isConnected()) {
                connection = DBusConnectionBuilder.forSessionBus().withShared(false).build();
            }
            Notifications notifications = connection.getRemoteObject(
                    "org.freedesktop.Notifications", "/org/freedesktop/Notifications", Notifications.class);
            notifications.Notify(APP_NAME, new UInt32(0), "", summary, body, new String[0],
                    Map.<String, Variant<?>>of("urgency", new Variant<>((byte) 2)), EXPIRE_MS);
        } catch (Exception e) {
            logger.warn("Desktop notification failed: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            executor.execute(this::closeConnection);
        } catch (RejectedExecutionException e) {
            logger.debug("Notifier already closed");
        }
        executor.shutdown();
    }

    private void closeConnection() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (Exception e) {
            logger.debug("Failed to close notification connection: {}", e.getMessage());
        }
        connection = null;
    }
}
