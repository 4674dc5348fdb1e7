package org.endlesssource.mediarelay.spi;

import java.util.List;

/**
 * Operations a running agent offers to other processes of the same user.
 * Remote implementations report an unreachable agent as {@link BusException}.
 */
public interface AgentControl {

    /**
     * @return a short status line of the running agent
     */
    String ping() throws BusException;

    /**
     * @return the paired clients, oldest first
     */
    List<PairingEntry> listPairings() throws BusException;

    /**
     * Forget a paired client and drop its open connections.
     *
     * @return whether the client was paired
     */
    boolean revokePairing(String identity) throws BusException;

    /**
     * Forget every paired client and drop their open connections.
     *
     * @return the number of pairings removed
     */
    int resetPairings() throws BusException;

    /**
     * Ask the agent to stop. Returns before the agent has stopped.
     */
    void quit() throws BusException;
}
