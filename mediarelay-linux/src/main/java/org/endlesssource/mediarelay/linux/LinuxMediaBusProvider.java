package org.endlesssource.mediarelay.linux;

import org.endlesssource.mediarelay.BusAvailability;
import org.endlesssource.mediarelay.spi.ControlService;
import org.endlesssource.mediarelay.spi.DesktopNotifier;
import org.endlesssource.mediarelay.spi.MediaBus;
import org.endlesssource.mediarelay.spi.MediaBusProvider;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Session D-Bus provider for Linux and the BSDs.
 */
public final class LinuxMediaBusProvider implements MediaBusProvider {
    static final String ID = "dbus";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean appliesToCurrentOs() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        return os.contains("linux") || os.contains("bsd");
    }

    @Override
    public BusAvailability probe() {
        if (!appliesToCurrentOs()) {
            return BusAvailability.unavailable(ID, "No session D-Bus on " + System.getProperty("os.name"));
        }
        try {
            Class.forName("org.freedesktop.dbus.connections.impl.DBusConnectionBuilder");
        } catch (ClassNotFoundException e) {
            return BusAvailability.unavailable(ID, "dbus-java is not on the classpath");
        }
        if (sessionBusAddress() == null) {
            return BusAvailability.unavailable(ID,
                    "DBUS_SESSION_BUS_ADDRESS is unset and $XDG_RUNTIME_DIR/bus does not exist");
        }
        return BusAvailability.available(ID);
    }

    /**
     * The address dbus-java would connect to, or null if it has nothing to go on.
     */
    static String sessionBusAddress() {
        String address = System.getenv("DBUS_SESSION_BUS_ADDRESS");
        if (address != null && !address.isBlank()) {
            return address;
        }
        String runtimeDir = System.getenv("XDG_RUNTIME_DIR");
        if (runtimeDir != null && Files.exists(Path.of(runtimeDir, "bus"))) {
            return "unix:path=" + Path.of(runtimeDir, "bus");
        }
        return null;
    }

    @Override
    public MediaBus create() {
        return new DBusMediaBus();
    }

    @Override
    public DesktopNotifier createNotifier() {
        return new DBusDesktopNotifier();
    }

    @Override
    public ControlService createControlService() {
        return new DBusControlService();
    }
}
