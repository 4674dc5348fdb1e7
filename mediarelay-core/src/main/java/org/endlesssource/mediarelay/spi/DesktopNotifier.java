package org.endlesssource.mediarelay.spi;

/**
 * Fire-and-forget desktop notifications.
 */
@FunctionalInterface
public interface DesktopNotifier extends AutoCloseable {

    DesktopNotifier NONE = (summary, body) -> { };

    /**
     * Show a notification. Must not throw and must not block for long.
     */
    void show(String summary, String body);

    @Override
    default void close() {
    }
}
