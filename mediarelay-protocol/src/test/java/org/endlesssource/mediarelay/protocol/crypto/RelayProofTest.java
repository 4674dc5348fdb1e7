package org.endlesssource.mediarelay.protocol.crypto;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RelayProofTest {

    private final byte[] token = CryptoPrimitives.randomBytes(32);
    private final byte[] agentNonce = CryptoPrimitives.randomBytes(32);
    private final byte[] clientNonce = CryptoPrimitives.randomBytes(32);

    @Test
    void clientProofVerifiesWithSameToken() {
        byte[] proof = RelayProof.client(token, "abc", agentNonce, clientNonce);
        assertTrue(RelayProof.verifyClient(token, "abc", agentNonce, clientNonce, proof));
    }

    @Test
    void proofFailsForOtherTokenIdentityOrNonce() {
        byte[] proof = RelayProof.client(token, "abc", agentNonce, clientNonce);
        assertFalse(RelayProof.verifyClient(CryptoPrimitives.randomBytes(32), "abc", agentNonce, clientNonce, proof));
        assertFalse(RelayProof.verifyClient(token, "abd", agentNonce, clientNonce, proof));
        assertFalse(RelayProof.verifyClient(token, "abc", CryptoPrimitives.randomBytes(32), clientNonce, proof));
        assertFalse(RelayProof.verifyClient(token, "abc", agentNonce, clientNonce, null));
    }

    @Test
    void agentProofIsNotAClientProof() {
        byte[] agentProof = RelayProof.agent(token, "abc", agentNonce, clientNonce);
        assertFalse(RelayProof.verifyClient(token, "abc", agentNonce, clientNonce, agentProof));
        assertTrue(RelayProof.verifyAgent(token, "abc", agentNonce, clientNonce, agentProof));
    }
}
