package org.endlesssource.mediarelay.agent.pairing;

import org.endlesssource.mediarelay.NamedThreadFactory;
import org.endlesssource.mediarelay.agent.AgentOptions;
import org.endlesssource.mediarelay.agent.store.CredentialStore;
import org.endlesssource.mediarelay.protocol.MessageReader;
import org.endlesssource.mediarelay.protocol.MessageWriter;
import org.endlesssource.mediarelay.protocol.Protocol;
import org.endlesssource.mediarelay.protocol.ProtocolException;
import org.endlesssource.mediarelay.protocol.crypto.EphemeralKeyPair;
import org.endlesssource.mediarelay.protocol.crypto.Identities;
import org.endlesssource.mediarelay.protocol.message.PairChallenge;
import org.endlesssource.mediarelay.protocol.message.PairConfirm;
import org.endlesssource.mediarelay.protocol.message.PairHello;
import org.endlesssource.mediarelay.protocol.message.PairResult;
import org.endlesssource.mediarelay.protocol.message.PairingFailure;
import org.endlesssource.mediarelay.protocol.tls.AgentCertificate;
import org.endlesssource.mediarelay.protocol.tls.TlsSockets;
import org.endlesssource.mediarelay.spi.DesktopNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Listens on the pairing port and runs one handshake per connection.
 * <p>
 * A handshake agrees on a key with the client, shows the derived code to the operator and to the
 * client's user, and stores a trust record only when both accepted and the client proved it derived
 * the same keys. The transcript includes the fingerprint of the agent's TLS certificate, so the
 * client learns which certificate to pin. Sessions are identified by ids this class generates; nothing a client sends can
 * address another client's session.
 */
public final class PairingAuthenticator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PairingAuthenticator.class);

    private final CredentialStore store;
    private final ConfirmationPrompt prompt;
    private final DesktopNotifier notifier;
    private final AgentOptions options;
    private final AgentCertificate certificate;
    private final ExecutorService acceptor;
    private final ExecutorService handlers;
    private final ExecutorService promptExecutor;
    private final Semaphore pendingPermits;
    private final Set<InetAddress> blocked = ConcurrentHashMap.newKeySet();
    private final Map<Socket, Connection> connections = new ConcurrentHashMap<>();
    private final Map<String, PairingSession> sessions = new ConcurrentHashMap<>();

    private volatile ServerSocket serverSocket;
    private volatile boolean closed;

    public PairingAuthenticator(CredentialStore store, ConfirmationPrompt prompt, DesktopNotifier notifier,
                                AgentOptions options, AgentCertificate certificate) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.certificate = Objects.requireNonNull(certificate, "certificate must not be null");
        this.prompt = Objects.requireNonNull(prompt, "prompt must not be null");
        this.notifier = notifier == null ? DesktopNotifier.NONE : notifier;
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.acceptor = Executors.newSingleThreadExecutor(new NamedThreadFactory("mediarelay-pairing-accept"));
        this.handlers = Executors.newCachedThreadPool(new NamedThreadFactory("mediarelay-pairing"));
        // one prompt at a time
        this.promptExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("mediarelay-pairing-prompt"));
        this.pendingPermits = new Semaphore(options.getMaxPendingPairings());
    }

    /**
     * Bind the pairing port and start accepting connections.
     *
     * @return the bound port
     */
    public synchronized int start() throws IOException {
        if (serverSocket != null) {
            throw new IllegalStateException("Pairing authenticator already started");
        }
        if (closed) {
            throw new IllegalStateException("Pairing authenticator is closed");
        }
        ServerSocket socket = TlsSockets.bind(certificate,
                new InetSocketAddress(options.getBindAddress(), options.getPairingPort()));
        serverSocket = socket;
        acceptor.execute(this::acceptLoop);
        logger.info("Pairing listener on {}:{}", options.getBindAddress(), socket.getLocalPort());
        return socket.getLocalPort();
    }

    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    public boolean isBlocked(InetAddress address) {
        return blocked.contains(address);
    }

    /**
     * @return number of handshakes currently in progress
     */
    public int activeSessions() {
        return sessions.size();
    }

    private void acceptLoop() {
        ServerSocket socket = serverSocket;
        while (!closed) {
            try {
                Socket client = socket.accept();
                handlers.execute(() -> handle(client));
            } catch (SocketException e) {
                if (!closed) {
                    logger.error("Pairing listener failed", e);
                }
                return;
            } catch (IOException e) {
                logger.warn("Failed to accept pairing connection: {}", e.getMessage());
            } catch (RejectedExecutionException e) {
                logger.debug("Dropping pairing connection during shutdown");
                return;
            }
        }
    }

    private void handle(Socket socket) {
        InetAddress address = socket.getInetAddress();
        Connection connection;
        try {
            connection = new Connection(socket);
        } catch (IOException e) {
            logger.debug("Pairing connection from {} unusable: {}", address, e.getMessage());
            closeQuietly(socket);
            return;
        }
        connections.put(socket, connection);
        boolean permit = false;
        try {
            socket.setSoTimeout(toMillis(options.getHandshakeTimeout()));
            PairHello hello = connection.reader.require(PairHello.class);
            if (isBlocked(address)) {
                throw new PairingException(PairingFailure.BLOCKED, "Address " + address.getHostAddress() + " is blocked");
            }
            checkHello(hello);
            if (!pendingPermits.tryAcquire()) {
                throw new PairingException(PairingFailure.TOO_MANY_PENDING,
                        "Already " + options.getMaxPendingPairings() + " pairing(s) in progress");
            }
            permit = true;
            PairingSession session = new PairingSession(address.getHostAddress(), hello.clientName(),
                    hello.identity(), hello.identityKey(), certificate.fingerprint());
            connection.session = session;
            sessions.put(session.sessionId(), session);
            if (closed) {
                throw new PairingException(PairingFailure.SHUTTING_DOWN, "Agent is shutting down");
            }
            logger.info("Pairing session {} started for \"{}\" ({}) from {}", session.sessionId(),
                    session.clientName(), session.identity(), session.remoteAddress());
            run(session, connection, hello);
        } catch (PairingException e) {
            fail(connection, e.getFailure(), e.getMessage());
        } catch (SocketTimeoutException e) {
            fail(connection, PairingFailure.TIMED_OUT, "Client did not respond in time");
        } catch (ProtocolException e) {
            fail(connection, PairingFailure.PROTOCOL_ERROR, e.getMessage());
        } catch (IOException e) {
            logger.debug("Pairing connection from {} dropped: {}", address, e.getMessage());
            fail(connection, closed ? PairingFailure.SHUTTING_DOWN : PairingFailure.PROTOCOL_ERROR,
                    "Connection lost: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(connection, PairingFailure.SHUTTING_DOWN, "Interrupted");
        } finally {
            if (permit) {
                pendingPermits.release();
            }
            PairingSession session = connection.session;
            if (session != null) {
                sessions.remove(session.sessionId());
                session.close();
            }
            connections.remove(socket);
            closeQuietly(socket);
        }
    }

    private void run(PairingSession session, Connection connection, PairHello hello)
            throws PairingException, IOException, InterruptedException {
        session.keyExchange(hello.ephemeralKey(), options.getSasDigits());
        connection.writer.write(new PairChallenge(session.sessionId(), session.localPublicKey(),
                options.getSasDigits()));
        session.awaitConfirmation();

        Instant deadline = Instant.now().plus(options.getPairingTimeout());
        PairingRequest request = new PairingRequest(session.sessionId(), session.clientName(), session.identity(),
                session.remoteAddress(), session.sas(), deadline);
        notifier.show("Pairing request from " + session.clientName(),
                "Confirm on the agent if the client shows code " + request.sas());

        PairConfirm confirm = awaitConfirmations(request, connection);
        if (!session.sessionId().equals(confirm.sessionId())) {
            throw new PairingException(PairingFailure.PROTOCOL_ERROR, "Confirmation for a foreign session");
        }
        if (!session.verify(confirm)) {
            throw new PairingException(PairingFailure.CODE_MISMATCH, "Client confirmation does not verify");
        }
        PairingSession.Established established = session.establish(store);
        connection.writer.write(PairResult.established(session.sessionId(), established.agentConfirmation()));
        logger.info("Paired with \"{}\" ({})", session.clientName(), session.identity());
        notifier.show("Paired", session.clientName() + " can now control media players");
    }

    /**
     * Wait for both the operator and the client, failing as soon as either declines.
     */
    private PairConfirm awaitConfirmations(PairingRequest request, Connection connection)
            throws PairingException, IOException, InterruptedException {
        connection.socket.setSoTimeout(toMillis(options.getPairingTimeout()));
        CompletableFuture<OperatorDecision> operator = new CompletableFuture<>();
        Future<?> promptTask = promptExecutor.submit(() -> {
            try {
                operator.complete(prompt.confirm(request));
            } catch (InterruptedException e) {
                operator.cancel(false);
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                operator.completeExceptionally(e);
            }
        });
        CompletableFuture<PairConfirm> client = CompletableFuture.supplyAsync(() -> {
            try {
                return connection.reader.require(PairConfirm.class);
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, handlers);
        try {
            CompletableFuture.anyOf(operator, client).get(remainingNanos(request), TimeUnit.NANOSECONDS);
            if (operator.isDone()) {
                checkDecision(operator.get(), connection);
            }
            if (client.isDone()) {
                checkClient(client.get());
            }
            checkDecision(operator.get(remainingNanos(request), TimeUnit.NANOSECONDS), connection);
            PairConfirm confirm = client.get(remainingNanos(request), TimeUnit.NANOSECONDS);
            checkClient(confirm);
            return confirm;
        } catch (TimeoutException e) {
            throw new PairingException(PairingFailure.TIMED_OUT, "No confirmation within "
                    + options.getPairingTimeout().toSeconds() + "s");
        } catch (CancellationException e) {
            throw new PairingException(PairingFailure.SHUTTING_DOWN, "Operator prompt cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException ce ? ce.getCause() : e.getCause();
            if (cause instanceof SocketTimeoutException) {
                throw new PairingException(PairingFailure.TIMED_OUT, "Client did not confirm in time");
            }
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new PairingException(PairingFailure.PROTOCOL_ERROR, "Confirmation failed: " + cause, cause);
        } finally {
            promptTask.cancel(true);
        }
    }

    private void checkDecision(OperatorDecision decision, Connection connection) throws PairingException {
        if (decision == OperatorDecision.BLOCK) {
            InetAddress address = connection.socket.getInetAddress();
            blocked.add(address);
            logger.info("Blocked pairing requests from {}", address.getHostAddress());
            throw new PairingException(PairingFailure.BLOCKED, "Operator blocked " + address.getHostAddress());
        }
        if (decision != OperatorDecision.ACCEPT) {
            throw new PairingException(PairingFailure.REJECTED_BY_OPERATOR, "Operator rejected");
        }
    }

    private static void checkClient(PairConfirm confirm) throws PairingException {
        if (!confirm.accepted()) {
            throw new PairingException(PairingFailure.REJECTED_BY_CLIENT, "Client rejected the code");
        }
    }

    private static void checkHello(PairHello hello) throws PairingException {
        if (hello.protocolVersion() != Protocol.VERSION) {
            throw new PairingException(PairingFailure.PROTOCOL_ERROR,
                    "Unsupported protocol version " + hello.protocolVersion());
        }
        if (!Identities.matches(hello.identity(), hello.identityKey())) {
            throw new PairingException(PairingFailure.PROTOCOL_ERROR, "Identity does not match identity key");
        }
        if (hello.ephemeralKey() == null || hello.ephemeralKey().length != EphemeralKeyPair.KEY_LENGTH) {
            throw new PairingException(PairingFailure.PROTOCOL_ERROR, "Missing or malformed ephemeral key");
        }
    }

    private void fail(Connection connection, PairingFailure reason, String detail) {
        PairingSession session = connection.session;
        String sessionId = null;
        if (session != null) {
            if (!session.fail(reason)) {
                return;
            }
            sessionId = session.sessionId();
            logger.info("Pairing session {} with \"{}\" failed: {} ({})", sessionId, session.clientName(),
                    reason, detail);
        } else {
            logger.info("Pairing attempt from {} refused: {} ({})", connection.socket.getInetAddress(), reason, detail);
        }
        try {
            connection.writer.write(PairResult.failed(sessionId, reason));
        } catch (IOException e) {
            logger.debug("Could not report pairing failure: {}", e.getMessage());
        }
    }

    private static long remainingNanos(PairingRequest request) {
        return Math.max(0, Duration.between(Instant.now(), request.deadline()).toNanos());
    }

    private static int toMillis(Duration duration) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, duration.toMillis()));
    }

    /**
     * Stop listening and end every handshake in progress with {@link PairingFailure#SHUTTING_DOWN}.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        ServerSocket socket = serverSocket;
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                logger.debug("Error closing pairing listener: {}", e.getMessage());
            }
        }
        for (Connection connection : connections.values()) {
            fail(connection, PairingFailure.SHUTTING_DOWN, "Agent is shutting down");
            closeQuietly(connection.socket);
        }
        acceptor.shutdownNow();
        promptExecutor.shutdownNow();
        handlers.shutdownNow();
        try {
            if (!handlers.awaitTermination(2, TimeUnit.SECONDS)) {
                logger.warn("Pairing handlers did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.debug("Pairing authenticator closed");
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing pairing connection: {}", e.getMessage());
        }
    }

    private static final class Connection {
        final Socket socket;
        final MessageReader reader;
        final MessageWriter writer;
        volatile PairingSession session;

        Connection(Socket socket) throws IOException {
            this.socket = socket;
            this.reader = new MessageReader(socket.getInputStream());
            this.writer = new MessageWriter(socket.getOutputStream());
        }
    }
}
