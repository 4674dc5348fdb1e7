package org.endlesssource.mediarelay.linux;

import org.endlesssource.mediarelay.spi.BusListener;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class BusLossForwarderTest {
    private final List<Throwable> losses = new CopyOnWriteArrayList<>();
    private final BusListener listener = new BusListener() {
        @Override
        public void onPlayerNameAppeared(String busName) {
        }

        @Override
        public void onPlayerNameVanished(String busName) {
        }

        @Override
        public void onBusLost(Throwable cause) {
            losses.add(cause);
        }
    };

    @Test
    void connectionError_isReportedAsBusLoss() {
        IOException broken = new IOException("Broken pipe");

        new BusLossForwarder(() -> listener).disconnectOnError(broken);

        assertEquals(1, losses.size());
        assertSame(broken, losses.get(0).getCause());
    }

    @Test
    void terminationError_isReportedAsBusLoss() {
        new BusLossForwarder(() -> listener).exceptionOnTerminate(new IOException("EOF"));

        assertEquals(1, losses.size());
    }

    @Test
    void requestedDisconnect_isNotReported() {
        BusLossForwarder forwarder = new BusLossForwarder(() -> listener);

        forwarder.requestedDisconnect(1);
        forwarder.clientDisconnect();

        assertTrue(losses.isEmpty());
    }

    @Test
    void missingListener_isTolerated() {
        assertDoesNotThrow(() -> new BusLossForwarder(() -> null).disconnectOnError(new IOException("gone")));
    }
}
