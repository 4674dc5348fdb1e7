package org.endlesssource.mediarelay.linux;

import org.endlesssource.mediarelay.spi.AgentControl;
import org.endlesssource.mediarelay.spi.BusException;
import org.endlesssource.mediarelay.spi.PairingEntry;
import org.freedesktop.dbus.exceptions.DBusExecutionException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Serves {@link MediaRelayControl} calls from the local agent.
 */
final class ExportedAgentControl implements MediaRelayControl {
    private final AgentControl control;

    ExportedAgentControl(AgentControl control) {
        this.control = control;
    }

    @Override
    public String getObjectPath() {
        return DBusControlService.OBJECT_PATH;
    }

    @Override
    public String Ping() {
        try {
            return control.ping();
        } catch (BusException e) {
            throw failed(e);
        }
    }

    @Override
    public List<Pairing> ListPairings() {
        try {
            return control.listPairings().stream()
                    .map(ExportedAgentControl::toStruct)
                    .collect(Collectors.toList());
        } catch (BusException e) {
            throw failed(e);
        }
    }

    @Override
    public boolean RevokePairing(String identity) {
        try {
            return control.revokePairing(identity);
        } catch (BusException e) {
            throw failed(e);
        }
    }

    @Override
    public int ResetPairings() {
        try {
            return control.resetPairings();
        } catch (BusException e) {
            throw failed(e);
        }
    }

    @Override
    public void Quit() {
        try {
            control.quit();
        } catch (BusException e) {
            throw failed(e);
        }
    }

    static Pairing toStruct(PairingEntry entry) {
        return new Pairing(entry.identity(), entry.clientName(), entry.pairedAt().toString());
    }

    private static DBusExecutionException failed(BusException e) {
        DBusExecutionException failure = new DBusExecutionException(e.getMessage());
        failure.initCause(e);
        return failure;
    }
}
