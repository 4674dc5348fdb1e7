package org.endlesssource.mediarelay.client;

import org.endlesssource.mediarelay.protocol.MessageReader;
import org.endlesssource.mediarelay.protocol.MessageWriter;
import org.endlesssource.mediarelay.protocol.Protocol;
import org.endlesssource.mediarelay.protocol.ProtocolException;
import org.endlesssource.mediarelay.protocol.crypto.CryptoPrimitives;
import org.endlesssource.mediarelay.protocol.crypto.EphemeralKeyPair;
import org.endlesssource.mediarelay.protocol.crypto.IdentityKeyPair;
import org.endlesssource.mediarelay.protocol.crypto.InvalidKeyMaterialException;
import org.endlesssource.mediarelay.protocol.crypto.PairingKeys;
import org.endlesssource.mediarelay.protocol.crypto.PairingTranscript;
import org.endlesssource.mediarelay.protocol.message.Message;
import org.endlesssource.mediarelay.protocol.message.PairChallenge;
import org.endlesssource.mediarelay.protocol.message.PairConfirm;
import org.endlesssource.mediarelay.protocol.message.PairHello;
import org.endlesssource.mediarelay.protocol.message.PairResult;
import org.endlesssource.mediarelay.protocol.message.PairingFailure;
import org.endlesssource.mediarelay.protocol.message.PairingOutcome;
import org.endlesssource.mediarelay.protocol.tls.TlsSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Client side of the pairing handshake. The agent's TLS certificate is accepted unseen and bound
 * into the transcript; the resulting fingerprint is what later relay connections pin.
 */
public final class PairingClient {
    private static final Logger logger = LoggerFactory.getLogger(PairingClient.class);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(90);

    private final IdentityKeyPair identity;
    private final String clientName;
    private final Duration timeout;

    public PairingClient(IdentityKeyPair identity, String clientName) {
        this(identity, clientName, DEFAULT_TIMEOUT);
    }

    public PairingClient(IdentityKeyPair identity, String clientName, Duration timeout) {
        this.identity = Objects.requireNonNull(identity, "identity must not be null");
        this.clientName = Objects.requireNonNull(clientName, "clientName must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /**
     * Pair with the agent listening on {@code host:port}.
     *
     * @param confirmation asked to compare the code; returning false rejects the pairing
     * @throws PairingFailedException when the pairing ended without trust, with the reason
     * @throws IOException            on connection or protocol failures
     */
    public PairingResult pair(String host, int port, SasConfirmation confirmation)
            throws IOException, PairingFailedException {
        int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        try (SSLSocket socket = TlsSockets.connect(host, port, null, timeoutMillis);
             EphemeralKeyPair ephemeral = EphemeralKeyPair.generate()) {
            byte[] agentFingerprint = TlsSockets.peerFingerprint(socket);
            MessageReader reader = new MessageReader(socket.getInputStream());
            MessageWriter writer = new MessageWriter(socket.getOutputStream());

            writer.write(new PairHello(Protocol.VERSION, clientName, identity.identity(), identity.publicKey(),
                    ephemeral.publicKey()));
            Message reply = reader.require();
            if (reply instanceof PairResult result) {
                throw failure(result);
            }
            if (!(reply instanceof PairChallenge challenge)) {
                throw new ProtocolException("Expected pair_challenge but got " + reply.getClass().getSimpleName());
            }

            byte[] transcript = PairingTranscript.of(challenge.sessionId(), ephemeral.publicKey(),
                    challenge.ephemeralKey(), identity.publicKey(), agentFingerprint);
            try (PairingKeys keys = deriveKeys(ephemeral, challenge, transcript)) {
                logger.debug("Pairing session {} derived code", challenge.sessionId());
                if (!confirmation.confirm(keys.sas())) {
                    writer.write(new PairConfirm(challenge.sessionId(), false, null, null));
                    throw new PairingFailedException(PairingFailure.REJECTED_BY_CLIENT, "Code rejected locally");
                }
                writer.write(new PairConfirm(challenge.sessionId(), true, keys.clientConfirmation(transcript),
                        identity.sign(transcript)));
                PairResult result = reader.require(PairResult.class);
                if (result.outcome() != PairingOutcome.ESTABLISHED) {
                    throw failure(result);
                }
                if (!keys.verifyAgentConfirmation(transcript, result.confirmation())) {
                    throw new PairingFailedException(PairingFailure.CODE_MISMATCH,
                            "Agent confirmation does not verify");
                }
                logger.info("Paired with agent at {}:{} as {}", host, port, identity.identity());
                return new PairingResult(identity.identity(), keys.trustToken(), keys.sas(), agentFingerprint);
            }
        }
    }

    private static PairingKeys deriveKeys(EphemeralKeyPair ephemeral, PairChallenge challenge, byte[] transcript)
            throws ProtocolException {
        byte[] secret = null;
        try {
            secret = ephemeral.agree(challenge.ephemeralKey());
            return PairingKeys.derive(secret, transcript, challenge.sasDigits());
        } catch (InvalidKeyMaterialException | IllegalArgumentException e) {
            throw new ProtocolException("Unusable pair_challenge: " + e.getMessage(), e);
        } finally {
            CryptoPrimitives.wipe(secret);
        }
    }

    private static PairingFailedException failure(PairResult result) {
        PairingFailure reason = result.reason() == null ? PairingFailure.PROTOCOL_ERROR : result.reason();
        return new PairingFailedException(reason, "Pairing " + result.outcome() + ": " + reason);
    }
}
