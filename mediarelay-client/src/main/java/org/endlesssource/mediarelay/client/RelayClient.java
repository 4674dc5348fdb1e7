package org.endlesssource.mediarelay.client;

import org.endlesssource.mediarelay.protocol.MessageReader;
import org.endlesssource.mediarelay.protocol.MessageWriter;
import org.endlesssource.mediarelay.protocol.Protocol;
import org.endlesssource.mediarelay.protocol.ProtocolException;
import org.endlesssource.mediarelay.protocol.crypto.CryptoPrimitives;
import org.endlesssource.mediarelay.protocol.crypto.RelayProof;
import org.endlesssource.mediarelay.protocol.message.Ack;
import org.endlesssource.mediarelay.protocol.message.Authenticate;
import org.endlesssource.mediarelay.protocol.message.Authenticated;
import org.endlesssource.mediarelay.protocol.message.Challenge;
import org.endlesssource.mediarelay.protocol.message.Command;
import org.endlesssource.mediarelay.protocol.message.CommandResultMessage;
import org.endlesssource.mediarelay.protocol.message.ErrorCode;
import org.endlesssource.mediarelay.protocol.message.ErrorMessage;
import org.endlesssource.mediarelay.protocol.message.EventMessage;
import org.endlesssource.mediarelay.protocol.message.Message;
import org.endlesssource.mediarelay.protocol.message.Ping;
import org.endlesssource.mediarelay.protocol.message.Pong;
import org.endlesssource.mediarelay.protocol.message.Snapshot;
import org.endlesssource.mediarelay.protocol.message.Subscribe;
import org.endlesssource.mediarelay.protocol.message.Unsubscribe;
import org.endlesssource.mediarelay.protocol.tls.TlsSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Socket;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An authenticated connection to an agent's relay port, over TLS pinned to the agent certificate
 * seen while pairing.
 * <p>
 * Requests return futures completed when the matching response arrives. Events are passed to the
 * {@link RelayListener}. A snapshot future completes before any event that follows it is delivered.
 */
public final class RelayClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RelayClient.class);

    private final Socket socket;
    private final MessageReader reader;
    private final MessageWriter writer;
    private final RelayListener listener;
    private final String identity;
    private final Map<String, PendingRequest<?>> pending = new ConcurrentHashMap<>();
    private final AtomicLong requestIds = new AtomicLong();
    private final Thread readerThread;

    private volatile boolean closed;
    private volatile ErrorCode closeReason;

    private RelayClient(Socket socket, MessageReader reader, MessageWriter writer, String identity,
                        RelayListener listener) {
        this.socket = socket;
        this.reader = reader;
        this.writer = writer;
        this.identity = identity;
        this.listener = listener;
        this.readerThread = new Thread(this::readLoop, "mediarelay-client-" + identity);
        this.readerThread.setDaemon(true);
    }

    /**
     * Connect with paired credentials.
     */
    public static RelayClient connect(ClientCredentials credentials, RelayListener listener, Duration timeout)
            throws IOException {
        if (!credentials.isPaired()) {
            throw new IllegalArgumentException("Credentials are not paired with an agent");
        }
        return connect(credentials.agentHost(), credentials.relayPort(), credentials.agentFingerprint(),
                credentials.identity(), credentials.trustToken(), listener, timeout);
    }

    /**
     * Connect and authenticate.
     *
     * @param agentFingerprint SHA-256 of the agent's TLS certificate
     * @throws javax.net.ssl.SSLHandshakeException when the agent presents another certificate
     * @throws RelayClosedException with {@link ErrorCode#AUTHENTICATION_FAILED} when the agent does
     *                              not accept the identity and token, or the agent's own proof is wrong
     */
    public static RelayClient connect(String host, int port, byte[] agentFingerprint, String identity,
                                      byte[] trustToken, RelayListener listener, Duration timeout)
            throws IOException {
        Objects.requireNonNull(agentFingerprint, "agentFingerprint must not be null");
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(trustToken, "trustToken must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        Socket socket = TlsSockets.connect(host, port, agentFingerprint, timeoutMillis);
        try {
            MessageReader reader = new MessageReader(socket.getInputStream());
            MessageWriter writer = new MessageWriter(socket.getOutputStream());

            Challenge challenge = expect(reader.require(), Challenge.class);
            if (challenge.protocolVersion() != Protocol.VERSION) {
                throw new ProtocolException("Agent speaks protocol version " + challenge.protocolVersion());
            }
            byte[] clientNonce = CryptoPrimitives.randomBytes(Protocol.NONCE_LENGTH);
            writer.write(new Authenticate(Protocol.VERSION, identity, clientNonce,
                    RelayProof.client(trustToken, identity, challenge.nonce(), clientNonce)));
            Authenticated authenticated = expect(reader.require(), Authenticated.class);
            if (!RelayProof.verifyAgent(trustToken, identity, challenge.nonce(), clientNonce, authenticated.proof())) {
                throw new RelayClosedException(ErrorCode.AUTHENTICATION_FAILED, "Agent proof does not verify");
            }
            socket.setSoTimeout(0);
            RelayClient client = new RelayClient(socket, reader, writer, identity, listener);
            client.readerThread.start();
            logger.info("Connected to relay at {}:{} as {}", host, port, identity);
            return client;
        } catch (IOException | RuntimeException e) {
            closeQuietly(socket);
            throw e;
        }
    }

    private static <T extends Message> T expect(Message message, Class<T> type) throws IOException {
        if (message instanceof ErrorMessage error) {
            throw new RelayClosedException(error.code(), "Agent refused connection: " + error.code()
                    + (error.message() == null ? "" : " (" + error.message() + ")"));
        }
        if (!type.isInstance(message)) {
            throw new ProtocolException("Expected " + type.getSimpleName() + " but got "
                    + message.getClass().getSimpleName());
        }
        return type.cast(message);
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * @return the error code the agent closed the connection with, or null
     */
    public ErrorCode getCloseReason() {
        return closeReason;
    }

    public CompletableFuture<Snapshot> subscribeAll() {
        String id = nextRequestId();
        return request(id, Subscribe.all(id), Snapshot.class);
    }

    public CompletableFuture<Snapshot> subscribe(List<String> players) {
        String id = nextRequestId();
        return request(id, Subscribe.players(id, players), Snapshot.class);
    }

    public CompletableFuture<Ack> unsubscribeAll() {
        String id = nextRequestId();
        return request(id, new Unsubscribe(id, true, List.of()), Ack.class);
    }

    public CompletableFuture<Ack> unsubscribe(List<String> players) {
        String id = nextRequestId();
        return request(id, new Unsubscribe(id, false, players), Ack.class);
    }

    /**
     * Send PLAY, PAUSE, STOP, NEXT or PREVIOUS to a player.
     */
    public CompletableFuture<CommandResultMessage> command(String playerId, String action) {
        String id = nextRequestId();
        return request(id, Command.of(id, playerId, action), CommandResultMessage.class);
    }

    public CompletableFuture<CommandResultMessage> seek(String playerId, Duration position) {
        String id = nextRequestId();
        return request(id, Command.seek(id, playerId, position.toMillis()), CommandResultMessage.class);
    }

    public CompletableFuture<CommandResultMessage> setRate(String playerId, double rate) {
        String id = nextRequestId();
        return request(id, Command.setRate(id, playerId, rate), CommandResultMessage.class);
    }

    public CompletableFuture<Pong> ping() {
        String id = nextRequestId();
        return request(id, new Ping(id), Pong.class);
    }

    private String nextRequestId() {
        return Long.toString(requestIds.incrementAndGet());
    }

    private <T extends Message> CompletableFuture<T> request(String requestId, Message message, Class<T> type) {
        PendingRequest<T> request = new PendingRequest<>(type);
        if (closed) {
            request.future.completeExceptionally(closedException());
            return request.future;
        }
        pending.put(requestId, request);
        try {
            writer.write(message);
        } catch (IOException e) {
            pending.remove(requestId);
            request.future.completeExceptionally(e);
        }
        if (closed) {
            failPending();
        }
        return request.future;
    }

    private void readLoop() {
        try {
            Message message;
            while (!closed && (message = reader.read()) != null) {
                dispatch(message);
                if (message instanceof ErrorMessage) {
                    break;
                }
            }
        } catch (IOException e) {
            if (!closed) {
                logger.warn("Relay connection lost: {}", e.getMessage());
            }
        } finally {
            shutdown();
        }
    }

    private void dispatch(Message message) {
        if (message instanceof EventMessage event) {
            listener.onEvent(event);
        } else if (message instanceof Snapshot snapshot) {
            complete(snapshot.requestId(), snapshot);
        } else if (message instanceof CommandResultMessage result) {
            complete(result.requestId(), result);
        } else if (message instanceof Ack ack) {
            complete(ack.requestId(), ack);
        } else if (message instanceof Pong pong) {
            complete(pong.requestId(), pong);
        } else if (message instanceof ErrorMessage error) {
            closeReason = error.code();
            logger.info("Agent closed relay connection: {} {}", error.code(),
                    error.message() == null ? "" : error.message());
        } else {
            logger.debug("Ignoring unexpected {}", message.getClass().getSimpleName());
        }
    }

    private void complete(String requestId, Message message) {
        PendingRequest<?> request = requestId == null ? null : pending.remove(requestId);
        if (request == null) {
            logger.debug("No pending request {} for {}", requestId, message.getClass().getSimpleName());
            return;
        }
        request.complete(message);
    }

    // Runs on the reader thread once reading stopped.
    private void shutdown() {
        synchronized (this) {
            closed = true;
        }
        closeQuietly(socket);
        failPending();
        listener.onClosed(closeReason);
    }

    private void failPending() {
        RelayClosedException cause = closedException();
        for (String requestId : pending.keySet()) {
            PendingRequest<?> request = pending.remove(requestId);
            if (request != null) {
                request.future.completeExceptionally(cause);
            }
        }
    }

    private RelayClosedException closedException() {
        return new RelayClosedException(closeReason, closeReason == null
                ? "Relay connection closed"
                : "Relay connection closed by agent: " + closeReason);
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        closeQuietly(socket);
        try {
            readerThread.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing relay socket: {}", e.getMessage());
        }
    }

    private static final class PendingRequest<T extends Message> {
        final Class<T> type;
        final CompletableFuture<T> future = new CompletableFuture<>();

        PendingRequest(Class<T> type) {
            this.type = type;
        }

        void complete(Message message) {
            if (type.isInstance(message)) {
                future.complete(type.cast(message));
            } else {
                future.completeExceptionally(new ProtocolException("Expected " + type.getSimpleName()
                        + " but got " + message.getClass().getSimpleName()));
            }
        }
    }
}
