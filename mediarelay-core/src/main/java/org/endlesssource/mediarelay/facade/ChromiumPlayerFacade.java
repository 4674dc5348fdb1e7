package org.endlesssource.mediarelay.facade;

import org.endlesssource.mediarelay.api.PlayerCommand;
import org.endlesssource.mediarelay.api.TransportCapabilities;
import org.endlesssource.mediarelay.spi.BusException;
import org.endlesssource.mediarelay.spi.PlayerEndpoint;

import java.time.Duration;
import java.util.Map;

/**
 * Chromium based browsers ignore writes to {@code Rate} and treat {@code Stop} as closing
 * the media session. Rate control is not offered and stop is performed as pause plus
 * rewind to the start.
 */
public class ChromiumPlayerFacade extends PlayerFacade {

    public ChromiumPlayerFacade(PlayerEndpoint endpoint, String identity, FacadeSettings settings) {
        super(endpoint, identity, settings);
    }

    @Override
    public FacadeKind kind() {
        return FacadeKind.CHROMIUM;
    }

    @Override
    protected TransportCapabilities capabilities(Map<String, Object> props) {
        TransportCapabilities reported = super.capabilities(props);
        return reported.withSetRate(false).withStop(reported.canPause());
    }

    @Override
    protected void perform(PlayerCommand command) throws BusException {
        switch (command.action()) {
            case STOP -> {
                endpoint.pause();
                seekTo(Duration.ZERO);
            }
            default -> super.perform(command);
        }
    }
}
