package org.endlesssource.mediarelay.client;

/**
 * Asks the client's user whether the agent shows the same code.
 */
@FunctionalInterface
public interface SasConfirmation {

    boolean confirm(String sas);
}
