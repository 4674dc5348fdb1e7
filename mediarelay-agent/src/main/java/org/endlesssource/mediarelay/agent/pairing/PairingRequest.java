package org.endlesssource.mediarelay.agent.pairing;

import java.time.Instant;

/**
 * What the operator is asked to confirm.
 *
 * @param sas      the short code that must match the one shown on the client
 * @param deadline when the request times out
 */
public record PairingRequest(String sessionId, String clientName, String identity, String remoteAddress,
                             String sas, Instant deadline) {
}
