package org.endlesssource.mediarelay.facade;

import org.endlesssource.mediarelay.spi.PlayerEndpoint;

/**
 * The façade variants. Chosen once per player by a {@link FacadeSelector}.
 */
public enum FacadeKind {
    COMPLIANT,
    VLC,
    CHROMIUM,
    FIREFOX;

    public PlayerFacade create(PlayerEndpoint endpoint, String identity, FacadeSettings settings) {
        return switch (this) {
            case COMPLIANT -> new CompliantPlayerFacade(endpoint, identity, settings);
            case VLC -> new VlcPlayerFacade(endpoint, identity, settings);
            case CHROMIUM -> new ChromiumPlayerFacade(endpoint, identity, settings);
            case FIREFOX -> new FirefoxPlayerFacade(endpoint, identity, settings);
        };
    }
}
