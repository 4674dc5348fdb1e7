package org.endlesssource.mediarelay.linux;

import org.endlesssource.mediarelay.spi.AgentControl;
import org.endlesssource.mediarelay.spi.BusException;
import org.endlesssource.mediarelay.spi.PairingEntry;
import org.freedesktop.dbus.exceptions.DBusExecutionException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exported and remote sides wired directly, without a bus in between.
 */
class AgentControlBridgeTest {
    private final List<String> calls = new ArrayList<>();
    private final List<PairingEntry> pairings = new ArrayList<>(List.of(
            new PairingEntry("aaaa", "phone", Instant.parse("2024-05-01T10:15:30Z")),
            new PairingEntry("bbbb", "tablet", Instant.parse("2024-05-02T08:00:00Z"))));

    private final AgentControl agent = new AgentControl() {
        @Override
        public String ping() {
            return "running";
        }

        @Override
        public List<PairingEntry> listPairings() {
            return List.copyOf(pairings);
        }

        @Override
        public boolean revokePairing(String identity) {
            calls.add("revoke " + identity);
            return pairings.removeIf(entry -> entry.identity().equals(identity));
        }

        @Override
        public int resetPairings() throws BusException {
            throw new BusException("store is read-only");
        }

        @Override
        public void quit() {
            calls.add("quit");
        }
    };

    @Test
    void callsReachTheAgent() throws Exception {
        AtomicBoolean released = new AtomicBoolean();
        RemoteAgentControl remote = new RemoteAgentControl(new ExportedAgentControl(agent),
                () -> released.set(true));

        assertEquals("running", remote.ping());
        assertEquals(pairings, remote.listPairings());
        assertTrue(remote.revokePairing("aaaa"));
        assertFalse(remote.revokePairing("aaaa"));
        remote.quit();
        remote.close();

        assertEquals(List.of("revoke aaaa", "revoke aaaa", "quit"), calls);
        assertEquals(1, remote.listPairings().size());
        assertTrue(released.get());
    }

    @Test
    void agentFailure_reachesCallerAsBusException() {
        RemoteAgentControl remote = new RemoteAgentControl(new ExportedAgentControl(agent), () -> { });

        BusException failure = assertThrows(BusException.class, remote::resetPairings);

        assertInstanceOf(DBusExecutionException.class, failure.getCause());
        assertTrue(failure.getMessage().contains("store is read-only"));
    }

    @Test
    void pairingTime_isSentAsIsoText() {
        MediaRelayControl.Pairing struct = ExportedAgentControl.toStruct(pairings.get(0));

        assertEquals("aaaa", struct.identity);
        assertEquals("phone", struct.clientName);
        assertEquals("2024-05-01T10:15:30Z", struct.pairedAt);
    }
}
