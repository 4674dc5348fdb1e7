package org.endlesssource.mediarelay.agent.relay;

import org.endlesssource.mediarelay.NamedThreadFactory;
import org.endlesssource.mediarelay.agent.AgentOptions;
import org.endlesssource.mediarelay.agent.store.CredentialStore;
import org.endlesssource.mediarelay.api.PlayerEvent;
import org.endlesssource.mediarelay.api.PlayerEventListener;
import org.endlesssource.mediarelay.monitor.PlayerMonitor;
import org.endlesssource.mediarelay.protocol.message.ErrorCode;
import org.endlesssource.mediarelay.protocol.message.EventMessage;
import org.endlesssource.mediarelay.protocol.tls.AgentCertificate;
import org.endlesssource.mediarelay.protocol.tls.TlsSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Listens on the relay port, authenticates paired clients and streams player events to them.
 * Connections are TLS with the agent certificate; a record that fails its integrity check ends the
 * connection before the message in it is read.
 * <p>
 * Every connection must prove possession of the trust token its identity was issued when it paired;
 * nothing about players is sent before that. Subscriptions are answered with a snapshot queued on
 * the monitor's dispatcher thread, so the events that follow it are exactly those after the snapshot.
 */
public final class RelayServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RelayServer.class);

    private final CredentialStore store;
    private final PlayerMonitor monitor;
    private final AgentOptions options;
    private final AgentCertificate certificate;
    private final ExecutorService acceptor;
    private final ExecutorService workers;
    private final ScheduledExecutorService timer;
    private final Set<ClientSession> sessions = ConcurrentHashMap.newKeySet();
    private final PlayerEventListener fanOut = this::fanOut;

    private volatile ServerSocket serverSocket;
    private volatile boolean closed;

    public RelayServer(CredentialStore store, PlayerMonitor monitor, AgentOptions options,
                       AgentCertificate certificate) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.monitor = Objects.requireNonNull(monitor, "monitor must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.certificate = Objects.requireNonNull(certificate, "certificate must not be null");
        this.acceptor = Executors.newSingleThreadExecutor(new NamedThreadFactory("mediarelay-relay-accept"));
        this.workers = Executors.newCachedThreadPool(new NamedThreadFactory("mediarelay-relay"));
        this.timer = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("mediarelay-relay-timer"));
    }

    /**
     * Bind the relay port and start accepting connections.
     *
     * @return the bound port
     */
    public synchronized int start() throws IOException {
        if (serverSocket != null) {
            throw new IllegalStateException("Relay server already started");
        }
        if (closed) {
            throw new IllegalStateException("Relay server is closed");
        }
        ServerSocket socket = TlsSockets.bind(certificate,
                new InetSocketAddress(options.getBindAddress(), options.getRelayPort()));
        serverSocket = socket;
        monitor.addListener(fanOut);
        acceptor.execute(this::acceptLoop);
        logger.info("Relay listener on {}:{}", options.getBindAddress(), socket.getLocalPort());
        return socket.getLocalPort();
    }

    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    /**
     * @return identities of the authenticated clients still being served, leaving out sessions that are
     * being closed, such as one that fell too far behind
     */
    public List<String> connectedClients() {
        return sessions.stream()
                .filter(ClientSession::isAuthenticated)
                .map(ClientSession::identity)
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Disconnect every session of the identity with {@link ErrorCode#AUTHENTICATION_FAILED}.
     * Sessions also notice a revocation on their next message; this does not wait for one.
     *
     * @return the number of sessions closed
     */
    public int disconnect(String identity) {
        int count = 0;
        for (ClientSession session : sessions) {
            if (identity.equals(session.identity())) {
                session.end(ErrorCode.AUTHENTICATION_FAILED, "Disconnected by operator");
                count++;
            }
        }
        return count;
    }

    private void acceptLoop() {
        ServerSocket socket = serverSocket;
        while (!closed) {
            try {
                Socket client = socket.accept();
                accept(client);
            } catch (SocketException e) {
                if (!closed) {
                    logger.error("Relay listener failed", e);
                }
                return;
            } catch (IOException e) {
                logger.warn("Failed to accept relay connection: {}", e.getMessage());
            }
        }
    }

    private void accept(Socket client) {
        ClientSession session;
        try {
            client.setTcpNoDelay(true);
            // Bounds how long close waits for a writer stuck on a stalled peer.
            client.setSoLinger(true, 1);
            session = new ClientSession(client, store, monitor, options, workers, timer, sessions::remove);
        } catch (IOException e) {
            logger.debug("Relay connection from {} unusable: {}", client.getInetAddress(), e.getMessage());
            closeQuietly(client);
            return;
        }
        sessions.add(session);
        try {
            workers.execute(session);
        } catch (RejectedExecutionException e) {
            sessions.remove(session);
            session.closeSocket();
        }
    }

    private void fanOut(PlayerEvent event) {
        if (sessions.isEmpty()) {
            return;
        }
        EventMessage message = WireMapping.toWire(event);
        for (ClientSession session : sessions) {
            session.deliver(event.playerId(), message);
        }
    }

    /**
     * Stop listening and close every connection with {@link ErrorCode#SHUTTING_DOWN}.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        monitor.removeListener(fanOut);
        ServerSocket socket = serverSocket;
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                logger.debug("Error closing relay listener: {}", e.getMessage());
            }
        }
        acceptor.shutdownNow();
        for (ClientSession session : sessions) {
            session.end(ErrorCode.SHUTTING_DOWN, "Agent is shutting down");
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(ClientSession.CLOSE_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Relay sessions did not stop in time, closing {} connection(s)", sessions.size());
                sessions.forEach(ClientSession::closeSocket);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sessions.forEach(ClientSession::closeSocket);
            workers.shutdownNow();
        }
        timer.shutdownNow();
        logger.debug("Relay server closed");
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing relay connection: {}", e.getMessage());
        }
    }
}
