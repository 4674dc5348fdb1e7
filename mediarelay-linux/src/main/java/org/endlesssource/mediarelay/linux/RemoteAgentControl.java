package org.endlesssource.mediarelay.linux;

import org.endlesssource.mediarelay.spi.BusException;
import org.endlesssource.mediarelay.spi.ControlService;
import org.endlesssource.mediarelay.spi.PairingEntry;
import org.freedesktop.dbus.exceptions.DBusExecutionException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Calls a running agent's {@link MediaRelayControl} over the session bus.
 */
final class RemoteAgentControl implements ControlService.RemoteAgent {
    private final MediaRelayControl remote;
    private final Runnable onClose;

    RemoteAgentControl(MediaRelayControl remote, Runnable onClose) {
        this.remote = remote;
        this.onClose = onClose;
    }

    @Override
    public String ping() throws BusException {
        try {
            return remote.Ping();
        } catch (DBusExecutionException e) {
            throw failed("Ping", e);
        }
    }

    @Override
    public List<PairingEntry> listPairings() throws BusException {
        List<MediaRelayControl.Pairing> pairings;
        try {
            pairings = remote.ListPairings();
        } catch (DBusExecutionException e) {
            throw failed("ListPairings", e);
        }
        List<PairingEntry> entries = new ArrayList<>(pairings.size());
        for (MediaRelayControl.Pairing pairing : pairings) {
            try {
                entries.add(new PairingEntry(pairing.identity, pairing.clientName, Instant.parse(pairing.pairedAt)));
            } catch (DateTimeParseException e) {
                throw new BusException("Agent sent an invalid pairing time for " + pairing.identity, e);
            }
        }
        return entries;
    }

    @Override
    public boolean revokePairing(String identity) throws BusException {
        try {
            return remote.RevokePairing(identity);
        } catch (DBusExecutionException e) {
            throw failed("RevokePairing", e);
        }
    }

    @Override
    public int resetPairings() throws BusException {
        try {
            return remote.ResetPairings();
        } catch (DBusExecutionException e) {
            throw failed("ResetPairings", e);
        }
    }

    @Override
    public void quit() throws BusException {
        try {
            remote.Quit();
        } catch (DBusExecutionException e) {
            throw failed("Quit", e);
        }
    }

    @Override
    public void close() {
        onClose.run();
    }

    private static BusException failed(String method, DBusExecutionException e) {
        return new BusException(method + " failed: " + e.getMessage(), e);
    }
}
