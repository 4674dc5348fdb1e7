package org.endlesssource.mediarelay.client;

import org.endlesssource.mediarelay.protocol.Protocol;
import org.endlesssource.mediarelay.protocol.crypto.CryptoPrimitives;
import org.endlesssource.mediarelay.protocol.crypto.RelayProof;
import org.endlesssource.mediarelay.protocol.message.Authenticate;
import org.endlesssource.mediarelay.protocol.message.Authenticated;
import org.endlesssource.mediarelay.protocol.message.Challenge;
import org.endlesssource.mediarelay.protocol.message.ErrorCode;
import org.endlesssource.mediarelay.protocol.message.ErrorMessage;
import org.endlesssource.mediarelay.protocol.message.EventKind;
import org.endlesssource.mediarelay.protocol.message.EventMessage;
import org.endlesssource.mediarelay.protocol.message.Ping;
import org.endlesssource.mediarelay.protocol.message.Pong;
import org.endlesssource.mediarelay.protocol.message.Snapshot;
import org.endlesssource.mediarelay.protocol.message.Subscribe;
import org.endlesssource.mediarelay.protocol.tls.AgentCertificate;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLHandshakeException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RelayClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private final byte[] token = CryptoPrimitives.randomBytes(32);

    @Test
    void refusedAuthenticationThrowsWithCode() throws Exception {
        try (ScriptedServer server = new ScriptedServer((reader, writer) -> {
            writer.write(new Challenge(Protocol.VERSION, CryptoPrimitives.randomBytes(32)));
            reader.require(Authenticate.class);
            writer.write(new ErrorMessage(ErrorCode.AUTHENTICATION_FAILED, "unknown identity"));
        })) {
            RelayClosedException e = assertThrows(RelayClosedException.class, () -> RelayClient.connect(
                    server.host(), server.port(), server.fingerprint(), "abc", token, event -> { }, TIMEOUT));
            assertEquals(ErrorCode.AUTHENTICATION_FAILED, e.getCode());
        }
    }

    @Test
    void agentWithWrongProofIsRejected() throws Exception {
        try (ScriptedServer server = new ScriptedServer((reader, writer) -> {
            writer.write(new Challenge(Protocol.VERSION, CryptoPrimitives.randomBytes(32)));
            reader.require(Authenticate.class);
            writer.write(new Authenticated(new byte[32]));
        })) {
            RelayClosedException e = assertThrows(RelayClosedException.class, () -> RelayClient.connect(
                    server.host(), server.port(), server.fingerprint(), "abc", token, event -> { }, TIMEOUT));
            assertEquals(ErrorCode.AUTHENTICATION_FAILED, e.getCode());
        }
    }

    @Test
    void agentWithOtherCertificateIsRejectedBeforeAuthentication() throws Exception {
        byte[] pairedFingerprint = AgentCertificate.generate("paired agent").fingerprint();
        try (ScriptedServer server = new ScriptedServer((reader, writer) -> {
            writer.write(new Challenge(Protocol.VERSION, CryptoPrimitives.randomBytes(32)));
            reader.require(Authenticate.class);
        })) {
            assertThrows(SSLHandshakeException.class, () -> RelayClient.connect(
                    server.host(), server.port(), pairedFingerprint, "abc", token, event -> { }, TIMEOUT));
            ExecutionException e = assertThrows(ExecutionException.class, () -> server.done.get(5, TimeUnit.SECONDS));
            assertNotNull(e.getCause());
        }
    }

    @Test
    void responsesCompleteRequestsAndEventsReachListener() throws Exception {
        LinkedBlockingQueue<EventMessage> events = new LinkedBlockingQueue<>();
        CompletableFuture<ErrorCode> closed = new CompletableFuture<>();
        try (ScriptedServer server = new ScriptedServer((reader, writer) -> {
            byte[] nonce = CryptoPrimitives.randomBytes(32);
            writer.write(new Challenge(Protocol.VERSION, nonce));
            Authenticate auth = reader.require(Authenticate.class);
            assertTrue(RelayProof.verifyClient(token, auth.identity(), nonce, auth.nonce(), auth.proof()));
            writer.write(new Authenticated(RelayProof.agent(token, auth.identity(), nonce, auth.nonce())));

            Subscribe subscribe = reader.require(Subscribe.class);
            writer.write(new Snapshot(subscribe.requestId(), List.of()));
            writer.write(new EventMessage(EventKind.PLAYER_DISAPPEARED, "vlc", null));
            Ping ping = reader.require(Ping.class);
            writer.write(new Pong(ping.requestId()));
            writer.write(new ErrorMessage(ErrorCode.SHUTTING_DOWN, null));
        });
             RelayClient client = RelayClient.connect(server.host(), server.port(), server.fingerprint(), "abc", token,
                     new RelayListener() {
                         @Override
                         public void onEvent(EventMessage event) {
                             events.add(event);
                         }

                         @Override
                         public void onClosed(ErrorCode reason) {
                             closed.complete(reason);
                         }
                     }, TIMEOUT)) {
            Snapshot snapshot = client.subscribeAll().get(5, TimeUnit.SECONDS);
            assertTrue(snapshot.players().isEmpty());
            assertEquals("vlc", events.poll(5, TimeUnit.SECONDS).playerId());
            assertNotNull(client.ping().get(5, TimeUnit.SECONDS));
            assertEquals(ErrorCode.SHUTTING_DOWN, closed.get(5, TimeUnit.SECONDS));
            assertTrue(client.isClosed());
            assertEquals(ErrorCode.SHUTTING_DOWN, client.getCloseReason());

            ExecutionException e = assertThrows(ExecutionException.class, () -> client.ping().get(5, TimeUnit.SECONDS));
            assertInstanceOf(RelayClosedException.class, e.getCause());
        }
    }
}
