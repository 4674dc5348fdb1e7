package org.endlesssource.mediarelay.spi;

import org.endlesssource.mediarelay.BusAvailability;

/**
 * SPI implemented by platform-specific bus modules.
 */
public interface MediaBusProvider {

    /**
     * Stable provider id, e.g. {@code dbus}.
     */
    String id();

    /**
     * Whether this provider is meant for the operating system we run on.
     */
    boolean appliesToCurrentOs();

    /**
     * Check that the bus can be reached from this process without connecting to it.
     */
    BusAvailability probe();

    /**
     * Create an unconnected bus client.
     */
    MediaBus create();

    /**
     * Create a notifier for pairing prompts on this platform.
     */
    default DesktopNotifier createNotifier() {
        return DesktopNotifier.NONE;
    }

    /**
     * Create the service that publishes a running agent to other processes on this platform.
     */
    default ControlService createControlService() {
        return ControlService.NONE;
    }
}
