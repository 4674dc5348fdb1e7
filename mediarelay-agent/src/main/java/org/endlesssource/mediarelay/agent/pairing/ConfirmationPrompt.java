package org.endlesssource.mediarelay.agent.pairing;

/**
 * Asks the local operator whether a pairing request shows the same code as the client.
 * <p>
 * Prompts are issued one at a time. The authenticator interrupts the prompting thread when the
 * request times out or the agent shuts down, so implementations should block interruptibly.
 */
@FunctionalInterface
public interface ConfirmationPrompt {

    OperatorDecision confirm(PairingRequest request) throws InterruptedException;
}
