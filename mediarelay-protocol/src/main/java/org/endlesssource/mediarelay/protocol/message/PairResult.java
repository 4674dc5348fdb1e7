package org.endlesssource.mediarelay.protocol.message;

/**
 * Final message of a pairing attempt.
 *
 * @param reason       why the attempt failed; null when established
 * @param confirmation agent's MAC over the transcript; only present when established
 */
public record PairResult(String sessionId, PairingOutcome outcome, PairingFailure reason, byte[] confirmation)
        implements Message {

    public static PairResult established(String sessionId, byte[] confirmation) {
        return new PairResult(sessionId, PairingOutcome.ESTABLISHED, null, confirmation);
    }

    public static PairResult failed(String sessionId, PairingFailure reason) {
        return new PairResult(sessionId, reason.outcome(), reason, null);
    }
}
