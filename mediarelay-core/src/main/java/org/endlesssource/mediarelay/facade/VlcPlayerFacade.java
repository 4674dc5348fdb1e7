package org.endlesssource.mediarelay.facade;

import org.endlesssource.mediarelay.spi.PlayerEndpoint;

/**
 * VLC signals status and metadata changes but not the {@code Can*} properties that
 * change with them, so every signal is followed by a full re-read.
 */
public class VlcPlayerFacade extends PlayerFacade {

    public VlcPlayerFacade(PlayerEndpoint endpoint, String identity, FacadeSettings settings) {
        super(endpoint, identity, settings);
    }

    @Override
    public FacadeKind kind() {
        return FacadeKind.VLC;
    }

    @Override
    protected void afterPropertiesChanged() {
        scheduleRefresh(settings.refreshDelay());
    }
}
