package org.endlesssource.mediarelay.facade;

/**
 * Told whenever a façade's canonical state may have changed.
 * The listener reads {@link PlayerFacade#snapshot()} itself, so it always sees the latest state.
 */
@FunctionalInterface
public interface FacadeListener {
    void onFacadeChanged(PlayerFacade facade);
}
