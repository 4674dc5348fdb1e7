package org.endlesssource.mediarelay.linux;

import org.freedesktop.dbus.Struct;
import org.freedesktop.dbus.annotations.DBusInterfaceName;
import org.freedesktop.dbus.annotations.Position;
import org.freedesktop.dbus.interfaces.DBusInterface;

import java.util.List;

/**
 * Control object a running agent exports on the session bus.
 */
@DBusInterfaceName("org.endlesssource.MediaRelay1")
public interface MediaRelayControl extends DBusInterface {
    String Ping();

    List<Pairing> ListPairings();

    boolean RevokePairing(String identity);

    int ResetPairings();

    void Quit();

    /**
     * {@code (sss)}: identity, client name and ISO-8601 pairing time.
     */
    final class Pairing extends Struct {
        @Position(0)
        public final String identity;
        @Position(1)
        public final String clientName;
        @Position(2)
        public final String pairedAt;

        public Pairing(String identity, String clientName, String pairedAt) {
            this.identity = identity;
            this.clientName = clientName;
            this.pairedAt = pairedAt;
        }
    }
}
