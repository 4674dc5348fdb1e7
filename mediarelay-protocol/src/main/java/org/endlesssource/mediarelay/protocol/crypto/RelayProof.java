package org.endlesssource.mediarelay.protocol.crypto;

/**
 * Proofs of possession of a trust token exchanged at the start of every relay connection:
 * HMAC-SHA256(token, role | identity | agentNonce | clientNonce), role being "client" or "agent".
 */
public final class RelayProof {
    private static final byte[] CLIENT = CryptoPrimitives.utf8("client");
    private static final byte[] AGENT = CryptoPrimitives.utf8("agent");

    private RelayProof() {
    }

    public static byte[] client(byte[] trustToken, String identity, byte[] agentNonce, byte[] clientNonce) {
        return compute(trustToken, CLIENT, identity, agentNonce, clientNonce);
    }

    public static byte[] agent(byte[] trustToken, String identity, byte[] agentNonce, byte[] clientNonce) {
        return compute(trustToken, AGENT, identity, agentNonce, clientNonce);
    }

    public static boolean verifyClient(byte[] trustToken, String identity, byte[] agentNonce,
                                       byte[] clientNonce, byte[] proof) {
        return CryptoPrimitives.constantTimeEquals(client(trustToken, identity, agentNonce, clientNonce), proof);
    }

    public static boolean verifyAgent(byte[] trustToken, String identity, byte[] agentNonce,
                                      byte[] clientNonce, byte[] proof) {
        return CryptoPrimitives.constantTimeEquals(agent(trustToken, identity, agentNonce, clientNonce), proof);
    }

    private static byte[] compute(byte[] trustToken, byte[] role, String identity, byte[] agentNonce,
                                  byte[] clientNonce) {
        byte[] data = CryptoPrimitives.lengthPrefixed(role, CryptoPrimitives.utf8(identity), agentNonce, clientNonce);
        return CryptoPrimitives.hmacSha256(trustToken, data);
    }
}
