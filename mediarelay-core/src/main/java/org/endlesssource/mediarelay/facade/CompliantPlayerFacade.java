package org.endlesssource.mediarelay.facade;

import org.endlesssource.mediarelay.spi.PlayerEndpoint;

/**
 * Player that follows the MPRIS contract: every change is signalled and every
 * advertised command does what it says.
 */
public class CompliantPlayerFacade extends PlayerFacade {

    public CompliantPlayerFacade(PlayerEndpoint endpoint, String identity, FacadeSettings settings) {
        super(endpoint, identity, settings);
    }

    @Override
    public FacadeKind kind() {
        return FacadeKind.COMPLIANT;
    }
}
