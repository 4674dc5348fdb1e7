package org.endlesssource.mediarelay.agent;

import org.endlesssource.mediarelay.protocol.Protocol;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AgentOptionsTest {

    @Test
    void defaults_matchProtocolPorts() {
        AgentOptions options = AgentOptions.defaults();
        assertEquals(Protocol.DEFAULT_RELAY_PORT, options.getRelayPort());
        assertEquals(Protocol.DEFAULT_PAIRING_PORT, options.getPairingPort());
        assertEquals(Protocol.DEFAULT_SAS_DIGITS, options.getSasDigits());
        assertEquals(Duration.ofSeconds(60), options.getPairingTimeout());
        assertEquals(256, options.getClientQueueCapacity());
        assertTrue(options.getStateDirectory().endsWith("mediarelay"));
        assertTrue(options.isAdvertise());
    }

    @Test
    void withers_returnModifiedCopies() {
        AgentOptions base = AgentOptions.defaults();
        AgentOptions changed = base.withPorts(9000, 9001).withSasDigits(8).withStateDirectory(Path.of("/tmp/x"))
                .withHandshakeTimeout(Duration.ofSeconds(3)).withAdvertise(false);
        assertFalse(changed.isAdvertise());
        assertEquals(9000, changed.withBindAddress("127.0.0.1").getRelayPort());
        assertFalse(changed.withBindAddress("127.0.0.1").isAdvertise());
        assertEquals(Duration.ofSeconds(3), changed.getHandshakeTimeout());
        assertEquals(9000, changed.getRelayPort());
        assertEquals(9001, changed.getPairingPort());
        assertEquals(8, changed.getSasDigits());
        assertEquals(Path.of("/tmp/x"), changed.getStateDirectory());
        assertEquals(Protocol.DEFAULT_RELAY_PORT, base.getRelayPort());
    }

    @Test
    void invalidValues_areRejected() {
        AgentOptions options = AgentOptions.defaults();
        assertThrows(IllegalArgumentException.class, () -> options.withSasDigits(3));
        assertThrows(IllegalArgumentException.class, () -> options.withSasDigits(9));
        assertThrows(IllegalArgumentException.class, () -> options.withPorts(70000, 1));
        assertThrows(IllegalArgumentException.class, () -> options.withPorts(5000, 5000));
        assertThrows(IllegalArgumentException.class, () -> options.withPairingTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> options.withClientQueueCapacity(0));
        assertThrows(NullPointerException.class, () -> options.withStateDirectory(null));
    }

    @Test
    void ephemeralPorts_mayBothBeZero() {
        AgentOptions options = AgentOptions.defaults().withPorts(0, 0);
        assertEquals(0, options.getRelayPort());
        assertEquals(0, options.getPairingPort());
    }
}
