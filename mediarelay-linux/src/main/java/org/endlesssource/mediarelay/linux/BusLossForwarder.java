package org.endlesssource.mediarelay.linux;

import org.endlesssource.mediarelay.spi.BusException;
import org.endlesssource.mediarelay.spi.BusListener;
import org.freedesktop.dbus.connections.IDisconnectCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.function.Supplier;

/**
 * Reports a session bus connection that dropped on its own. Disconnects the agent asked for are not reported.
 */
class BusLossForwarder implements IDisconnectCallback {
    private static final Logger logger = LoggerFactory.getLogger(BusLossForwarder.class);

    private final Supplier<BusListener> listener;

    BusLossForwarder(Supplier<BusListener> listener) {
        this.listener = listener;
    }

    @Override
    public void disconnectOnError(IOException ex) {
        forward("Session bus connection failed", ex);
    }

    @Override
    public void exceptionOnTerminate(IOException ex) {
        forward("Session bus connection terminated", ex);
    }

    @Override
    public void requestedDisconnect(Integer connectionId) {
        logger.debug("Session bus connection {} closed on request", connectionId);
    }

    @Override
    public void clientDisconnect() {
        logger.debug("Session bus connection closed");
    }

    private void forward(String message, IOException cause) {
        logger.warn("{}: {}", message, cause == null ? "no cause" : cause.getMessage());
        BusListener current = listener.get();
        if (current != null) {
            current.onBusLost(new BusException(message, cause));
        }
    }
}
