package org.endlesssource.mediarelay.agent.pairing;

/**
 * The local operator's answer to a pairing request.
 */
public enum OperatorDecision {
    ACCEPT,
    REJECT,
    /** Reject and refuse further pairing attempts from the same address until restart. */
    BLOCK
}
