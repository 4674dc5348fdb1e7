package org.endlesssource.mediarelay.agent.pairing;

import org.endlesssource.mediarelay.agent.store.CredentialStore;
import org.endlesssource.mediarelay.agent.store.TrustMaterial;
import org.endlesssource.mediarelay.agent.store.TrustRecord;
import org.endlesssource.mediarelay.protocol.crypto.CryptoPrimitives;
import org.endlesssource.mediarelay.protocol.crypto.EphemeralKeyPair;
import org.endlesssource.mediarelay.protocol.crypto.IdentityKeyPair;
import org.endlesssource.mediarelay.protocol.crypto.InvalidKeyMaterialException;
import org.endlesssource.mediarelay.protocol.crypto.PairingKeys;
import org.endlesssource.mediarelay.protocol.crypto.PairingTranscript;
import org.endlesssource.mediarelay.protocol.message.PairConfirm;
import org.endlesssource.mediarelay.protocol.message.PairingFailure;

import java.time.Instant;
import java.util.Base64;
import java.util.Objects;

/**
 * One in-progress pairing handshake. Owns the ephemeral key material, which is wiped when the
 * session reaches a terminal state or is closed.
 */
public final class PairingSession implements AutoCloseable {
    private static final int SESSION_ID_BYTES = 16;

    private final String sessionId;
    private final String remoteAddress;
    private final String clientName;
    private final String identity;
    private final byte[] identityKey;
    private final byte[] certificateFingerprint;
    private final Instant createdAt;
    private final EphemeralKeyPair localKey;

    private PairingState state = PairingState.INIT;
    private PairingFailure failure;
    private PairingKeys keys;
    private byte[] transcript;

    PairingSession(String remoteAddress, String clientName, String identity, byte[] identityKey,
                   byte[] certificateFingerprint) {
        this.sessionId = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(CryptoPrimitives.randomBytes(SESSION_ID_BYTES));
        this.remoteAddress = remoteAddress;
        this.clientName = clientName == null || clientName.isBlank() ? "unnamed client" : clientName;
        this.identity = Objects.requireNonNull(identity, "identity must not be null");
        this.identityKey = identityKey.clone();
        this.certificateFingerprint = certificateFingerprint.clone();
        this.createdAt = Instant.now();
        this.localKey = EphemeralKeyPair.generate();
    }

    public String sessionId() {
        return sessionId;
    }

    public String remoteAddress() {
        return remoteAddress;
    }

    public String clientName() {
        return clientName;
    }

    public String identity() {
        return identity;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public synchronized PairingState state() {
        return state;
    }

    /**
     * @return why the session failed, or null if it has not
     */
    public synchronized PairingFailure failure() {
        return failure;
    }

    synchronized byte[] localPublicKey() {
        return localKey.publicKey();
    }

    /**
     * Derive the shared secret, keys and code from the client's ephemeral key.
     */
    synchronized void keyExchange(byte[] remoteEphemeralKey, int sasDigits) throws PairingException {
        requireState(PairingState.INIT);
        byte[] secret = null;
        try {
            secret = localKey.agree(remoteEphemeralKey);
            transcript = PairingTranscript.of(sessionId, remoteEphemeralKey, localKey.publicKey(), identityKey,
                    certificateFingerprint);
            keys = PairingKeys.derive(secret, transcript, sasDigits);
            state = PairingState.KEY_EXCHANGE;
        } catch (InvalidKeyMaterialException e) {
            throw new PairingException(PairingFailure.PROTOCOL_ERROR, "Unusable ephemeral key: " + e.getMessage(), e);
        } finally {
            CryptoPrimitives.wipe(secret);
        }
    }

    synchronized String sas() {
        requireKeys();
        return keys.sas();
    }

    synchronized void awaitConfirmation() throws PairingException {
        requireState(PairingState.KEY_EXCHANGE);
        state = PairingState.AWAITING_CONFIRMATION;
    }

    /**
     * Check the client's confirmation MAC and its signature over the transcript.
     */
    synchronized boolean verify(PairConfirm confirm) {
        requireKeys();
        return keys.verifyClientConfirmation(transcript, confirm.confirmation())
                && IdentityKeyPair.verify(identityKey, transcript, confirm.signature());
    }

    /**
     * Write the trust record and move to {@link PairingState#ESTABLISHED}. Fails if the session
     * was ended concurrently, in which case nothing is written.
     *
     * @return the stored record and the agent's confirmation MAC
     */
    synchronized Established establish(CredentialStore store) throws PairingException {
        requireState(PairingState.AWAITING_CONFIRMATION);
        TrustRecord record = store.put(identity, new TrustMaterial(identityKey, clientName, keys.trustToken()));
        state = PairingState.ESTABLISHED;
        Established established = new Established(record, keys.agentConfirmation(transcript));
        wipe();
        return established;
    }

    /**
     * Move to the terminal state for {@code reason}.
     *
     * @return false if the session had already ended
     */
    synchronized boolean fail(PairingFailure reason) {
        if (state.isTerminal()) {
            return false;
        }
        state = PairingState.of(reason);
        failure = reason;
        wipe();
        return true;
    }

    @Override
    public synchronized void close() {
        if (!state.isTerminal()) {
            fail(PairingFailure.PROTOCOL_ERROR);
        }
        wipe();
    }

    private void wipe() {
        localKey.close();
        if (keys != null) {
            keys.close();
        }
    }

    private void requireState(PairingState expected) throws PairingException {
        if (state != expected) {
            PairingFailure reason = failure != null ? failure : PairingFailure.PROTOCOL_ERROR;
            throw new PairingException(reason, "Session " + sessionId + " is " + state + ", expected " + expected);
        }
    }

    private void requireKeys() {
        if (keys == null) {
            throw new IllegalStateException("Keys not derived yet for session " + sessionId);
        }
    }

    record Established(TrustRecord record, byte[] agentConfirmation) {
    }
}
