package org.endlesssource.mediarelay;

import org.endlesssource.mediarelay.spi.MediaBus;
import org.endlesssource.mediarelay.spi.MediaBusProvider;
import org.endlesssource.mediarelay.test.FakeMediaBus;
import org.endlesssource.mediarelay.test.FakeMediaBusProvider;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MediaBusFactoryFakeProviderTest {

    @Test
    void selectProvider_usesFakeProvider() {
        MediaBusProvider provider = MediaBusFactory.selectProvider();
        assertEquals(FakeMediaBusProvider.ID, provider.id());

        try (MediaBus bus = provider.create()) {
            assertInstanceOf(FakeMediaBus.class, bus);
            assertFalse(bus.isConnected());
        }
    }

    @Test
    void availability_reportsFakeProvider() {
        BusAvailability availability = MediaBusFactory.availability();
        assertTrue(availability.available());
        assertEquals(FakeMediaBusProvider.ID, availability.provider());
        assertEquals("", availability.reason());
    }

    @Test
    void unavailable_keepsReason() {
        BusAvailability availability = BusAvailability.unavailable("dbus", "no bus");
        assertFalse(availability.available());
        assertEquals("no bus", availability.reason());
        assertThrows(NullPointerException.class, () -> BusAvailability.available(null));
    }

    @Test
    void defaultNotifier_isSilent() {
        MediaBusProvider provider = MediaBusFactory.selectProvider();
        assertDoesNotThrow(() -> provider.createNotifier().show("Pairing request", "Code 123456"));
    }
}
