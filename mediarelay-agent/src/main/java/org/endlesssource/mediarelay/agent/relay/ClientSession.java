package org.endlesssource.mediarelay.agent.relay;

import org.endlesssource.mediarelay.agent.AgentOptions;
import org.endlesssource.mediarelay.agent.store.CredentialStore;
import org.endlesssource.mediarelay.agent.store.TrustRecord;
import org.endlesssource.mediarelay.api.CommandResult;
import org.endlesssource.mediarelay.api.PlayerCommand;
import org.endlesssource.mediarelay.api.PlayerSnapshot;
import org.endlesssource.mediarelay.api.RejectionReason;
import org.endlesssource.mediarelay.monitor.PlayerMonitor;
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
import org.endlesssource.mediarelay.protocol.message.PlayerState;
import org.endlesssource.mediarelay.protocol.message.Pong;
import org.endlesssource.mediarelay.protocol.message.Snapshot;
import org.endlesssource.mediarelay.protocol.message.Subscribe;
import org.endlesssource.mediarelay.protocol.message.Unsubscribe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * One relay connection.
 * <p>
 * The thread running {@link #run()} authenticates the client and then reads and answers its
 * messages one at a time. After authentication a second thread drains the {@link OutboundQueue}
 * to the socket. Events arrive on the monitor's dispatcher thread through
 * {@link #deliver(String, EventMessage)} and never block it.
 */
final class ClientSession implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ClientSession.class);
    static final Duration CLOSE_GRACE = Duration.ofSeconds(2);

    private final Socket socket;
    private final MessageReader reader;
    private final MessageWriter writer;
    private final CredentialStore store;
    private final PlayerMonitor monitor;
    private final AgentOptions options;
    private final Executor writerExecutor;
    private final ScheduledExecutorService timer;
    private final Consumer<ClientSession> onClosed;
    private final OutboundQueue queue;
    private final String remote;

    private volatile String identity;
    private volatile byte[] trustToken;
    private volatile boolean streaming;

    // Confined to the monitor's dispatcher thread.
    private boolean allPlayers;
    private final Set<String> players = new HashSet<>();

    ClientSession(Socket socket, CredentialStore store, PlayerMonitor monitor, AgentOptions options,
                  Executor writerExecutor, ScheduledExecutorService timer, Consumer<ClientSession> onClosed)
            throws IOException {
        this.socket = socket;
        this.reader = new MessageReader(socket.getInputStream());
        this.writer = new MessageWriter(socket.getOutputStream());
        this.store = store;
        this.monitor = monitor;
        this.options = options;
        this.writerExecutor = writerExecutor;
        this.timer = timer;
        this.onClosed = onClosed;
        this.queue = new OutboundQueue(options.getClientQueueCapacity());
        this.remote = socket.getInetAddress().getHostAddress() + ":" + socket.getPort();
    }

    /**
     * @return the authenticated identity, or null before authentication
     */
    String identity() {
        return identity;
    }

    /**
     * Authenticated and not yet ending.
     */
    boolean isAuthenticated() {
        return streaming && !queue.isFinished();
    }

    @Override
    public void run() {
        try {
            if (!authenticate()) {
                return;
            }
            startWriter();
            readLoop();
        } catch (SocketTimeoutException e) {
            refuse(ErrorCode.AUTHENTICATION_FAILED, "No authentication within "
                    + options.getHandshakeTimeout().toSeconds() + "s");
        } catch (ProtocolException e) {
            end(streaming ? ErrorCode.PROTOCOL_ERROR : ErrorCode.AUTHENTICATION_FAILED, e.getMessage());
        } catch (IOException e) {
            logger.debug("Relay connection {} dropped: {}", remote, e.getMessage());
        } finally {
            onClosed.accept(this);
            if (streaming) {
                // the writer closes the socket once it sent what is left
                if (queue.isFinished()) {
                    scheduleForcedClose();
                } else {
                    queue.abort();
                }
            } else {
                closeSocket();
            }
        }
    }

    private boolean authenticate() throws IOException {
        socket.setSoTimeout(toMillis(options.getHandshakeTimeout()));
        byte[] agentNonce = CryptoPrimitives.randomBytes(Protocol.NONCE_LENGTH);
        writer.write(new Challenge(Protocol.VERSION, agentNonce));
        Authenticate auth = reader.require(Authenticate.class);
        if (auth.protocolVersion() != Protocol.VERSION) {
            refuse(ErrorCode.AUTHENTICATION_FAILED, "Unsupported protocol version " + auth.protocolVersion());
            return false;
        }
        if (auth.identity() == null || auth.nonce() == null || auth.nonce().length != Protocol.NONCE_LENGTH) {
            refuse(ErrorCode.AUTHENTICATION_FAILED, "Malformed authentication");
            return false;
        }
        Optional<TrustRecord> record = store.get(auth.identity());
        if (record.isEmpty()) {
            refuse(ErrorCode.AUTHENTICATION_FAILED, "Unknown identity " + auth.identity());
            return false;
        }
        byte[] token = record.get().trustToken();
        if (!RelayProof.verifyClient(token, auth.identity(), agentNonce, auth.nonce(), auth.proof())) {
            refuse(ErrorCode.AUTHENTICATION_FAILED, "Bad proof from " + auth.identity());
            return false;
        }
        identity = auth.identity();
        trustToken = token;
        writer.write(new Authenticated(RelayProof.agent(token, auth.identity(), agentNonce, auth.nonce())));
        socket.setSoTimeout(0);
        logger.info("Relay client \"{}\" ({}) connected from {}", record.get().clientName(), identity, remote);
        return true;
    }

    private void refuse(ErrorCode code, String detail) {
        logger.info("Refusing relay connection from {}: {}", remote, detail);
        try {
            writer.write(new ErrorMessage(code, null));
        } catch (IOException e) {
            logger.debug("Could not report refusal to {}: {}", remote, e.getMessage());
        }
    }

    private void startWriter() {
        streaming = true;
        try {
            writerExecutor.execute(this::writeLoop);
        } catch (RejectedExecutionException e) {
            logger.debug("Relay server stopping, dropping {}", remote);
            queue.abort();
            closeSocket();
        }
    }

    private void writeLoop() {
        try {
            Message message;
            while ((message = queue.take()) != null) {
                writer.write(message);
                if (message instanceof ErrorMessage) {
                    break;
                }
            }
        } catch (IOException e) {
            logger.debug("Writing to {} failed: {}", remote, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            closeSocket();
        }
    }

    private void readLoop() throws IOException {
        Message message;
        while (!queue.isFinished() && (message = reader.read()) != null) {
            if (!stillTrusted()) {
                end(ErrorCode.AUTHENTICATION_FAILED, "Trust for " + identity + " was revoked");
                return;
            }
            if (!handle(message)) {
                return;
            }
        }
    }

    private boolean stillTrusted() {
        return store.get(identity)
                .map(record -> CryptoPrimitives.constantTimeEquals(trustToken, record.trustToken()))
                .orElse(false);
    }

    private boolean handle(Message message) throws ProtocolException {
        if (message instanceof Subscribe subscribe) {
            return serialized(() -> subscribe(subscribe));
        } else if (message instanceof Unsubscribe unsubscribe) {
            return serialized(() -> unsubscribe(unsubscribe));
        } else if (message instanceof Command command) {
            queue.offer(execute(command));
        } else if (message instanceof Ping ping) {
            queue.offer(new Pong(ping.requestId()));
        } else {
            throw new ProtocolException("Unexpected " + message.getClass().getSimpleName() + " on relay connection");
        }
        return true;
    }

    /**
     * Run a subscription change on the dispatcher so that its answer is queued between two events.
     */
    private boolean serialized(Runnable change) {
        try {
            monitor.runSerialized(() -> {
                change.run();
                return null;
            }).get(options.getCommandTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            end(ErrorCode.SHUTTING_DOWN, "Interrupted");
        } catch (ExecutionException e) {
            logger.warn("Subscription change for {} failed: {}", identity, e.getCause().getMessage());
            end(ErrorCode.SHUTTING_DOWN, "Player monitor unavailable");
        } catch (TimeoutException e) {
            logger.warn("Player monitor did not answer within {}", options.getCommandTimeout());
            end(ErrorCode.SHUTTING_DOWN, "Player monitor unavailable");
        }
        return false;
    }

    private void subscribe(Subscribe subscribe) {
        List<PlayerState> added = new ArrayList<>();
        if (subscribe.all()) {
            if (!allPlayers) {
                for (PlayerSnapshot snapshot : monitor.snapshots()) {
                    if (!players.contains(snapshot.playerId())) {
                        added.add(WireMapping.toWire(snapshot));
                    }
                }
                allPlayers = true;
            }
        } else {
            for (String name : subscribe.players()) {
                Optional<PlayerSnapshot> found = monitor.find(name);
                String playerId = found.map(PlayerSnapshot::playerId).orElse(name);
                if (!allPlayers && players.add(playerId)) {
                    found.ifPresent(snapshot -> added.add(WireMapping.toWire(snapshot)));
                }
            }
        }
        logger.debug("{} subscribed, {} new player(s)", identity, added.size());
        queue.offer(new Snapshot(subscribe.requestId(), added));
    }

    private void unsubscribe(Unsubscribe unsubscribe) {
        if (unsubscribe.all()) {
            allPlayers = false;
            players.clear();
        } else {
            for (String name : unsubscribe.players()) {
                players.remove(monitor.find(name).map(PlayerSnapshot::playerId).orElse(name));
            }
        }
        queue.offer(new Ack(unsubscribe.requestId()));
    }

    private CommandResultMessage execute(Command command) {
        if (command.playerId() == null) {
            return WireMapping.toWire(command.requestId(),
                    CommandResult.rejected(RejectionReason.INVALID_ARGUMENT, "Missing playerId"));
        }
        PlayerCommand playerCommand;
        try {
            playerCommand = WireMapping.toCommand(command);
        } catch (IllegalArgumentException | NullPointerException e) {
            return WireMapping.toWire(command.requestId(),
                    CommandResult.rejected(RejectionReason.INVALID_ARGUMENT, e.getMessage()));
        }
        CommandResult result;
        try {
            result = monitor.execute(command.playerId(), playerCommand)
                    .get(options.getCommandTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = CommandResult.rejected(RejectionReason.FAILED, "Agent is shutting down");
        } catch (ExecutionException e) {
            result = CommandResult.rejected(RejectionReason.FAILED, String.valueOf(e.getCause().getMessage()));
        } catch (TimeoutException e) {
            result = CommandResult.rejected(RejectionReason.FAILED, "Player did not answer within "
                    + options.getCommandTimeout().toMillis() + "ms");
        }
        logger.debug("{} {} on {} from {}: {}", playerCommand.action(), result.accepted() ? "accepted" : "rejected",
                command.playerId(), identity, result.reason());
        return WireMapping.toWire(command.requestId(), result);
    }

    /**
     * Queue an event if this session subscribed to the player. Called on the monitor's dispatcher thread.
     */
    void deliver(String playerId, EventMessage event) {
        if (!streaming || !(allPlayers || players.contains(playerId))) {
            return;
        }
        if (!queue.offer(event) && queue.isOverflowed()) {
            logger.warn("Relay client {} is not keeping up, disconnecting", identity);
            scheduleForcedClose();
        }
    }

    /**
     * Send a terminal error and let the writer close the connection.
     */
    void end(ErrorCode code, String detail) {
        if (streaming) {
            if (queue.finish(new ErrorMessage(code, null))) {
                logger.info("Closing relay connection of {}: {} ({})", identity, code, detail);
                scheduleForcedClose();
            }
        } else {
            refuse(code, detail);
            closeSocket();
        }
    }

    private void scheduleForcedClose() {
        try {
            timer.schedule(this::closeSocket, CLOSE_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            closeSocket();
        }
    }

    void closeSocket() {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing relay connection {}: {}", remote, e.getMessage());
        }
    }

    private static int toMillis(Duration duration) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, duration.toMillis()));
    }
}
