package org.endlesssource.mediarelay.agent.relay;

import org.endlesssource.mediarelay.agent.AgentOptions;
import org.endlesssource.mediarelay.agent.store.InMemoryCredentialStore;
import org.endlesssource.mediarelay.agent.store.TrustMaterial;
import org.endlesssource.mediarelay.client.RelayClient;
import org.endlesssource.mediarelay.client.RelayClosedException;
import org.endlesssource.mediarelay.facade.FacadeSelector;
import org.endlesssource.mediarelay.monitor.MonitorOptions;
import org.endlesssource.mediarelay.monitor.MonitorState;
import org.endlesssource.mediarelay.monitor.PlayerMonitor;
import org.endlesssource.mediarelay.protocol.MessageReader;
import org.endlesssource.mediarelay.protocol.MessageWriter;
import org.endlesssource.mediarelay.protocol.Protocol;
import org.endlesssource.mediarelay.protocol.crypto.CryptoPrimitives;
import org.endlesssource.mediarelay.protocol.crypto.IdentityKeyPair;
import org.endlesssource.mediarelay.protocol.crypto.RelayProof;
import org.endlesssource.mediarelay.protocol.message.Authenticate;
import org.endlesssource.mediarelay.protocol.message.Authenticated;
import org.endlesssource.mediarelay.protocol.message.Challenge;
import org.endlesssource.mediarelay.protocol.message.CommandResultMessage;
import org.endlesssource.mediarelay.protocol.message.ErrorCode;
import org.endlesssource.mediarelay.protocol.message.ErrorMessage;
import org.endlesssource.mediarelay.protocol.message.EventKind;
import org.endlesssource.mediarelay.protocol.message.EventMessage;
import org.endlesssource.mediarelay.protocol.message.Message;
import org.endlesssource.mediarelay.protocol.message.Snapshot;
import org.endlesssource.mediarelay.protocol.message.Subscribe;
import org.endlesssource.mediarelay.protocol.tls.AgentCertificate;
import org.endlesssource.mediarelay.protocol.tls.TlsSockets;
import org.endlesssource.mediarelay.test.Await;
import org.endlesssource.mediarelay.test.FakeMediaBus;
import org.endlesssource.mediarelay.test.FakePlayerEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.net.ssl.SSLHandshakeException;
import javax.net.ssl.SSLSocket;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RelayServerTest {
    private static final String HOST = "127.0.0.1";
    private static final AgentCertificate CERTIFICATE = AgentCertificate.generate("test agent");
    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final MonitorOptions FAST = MonitorOptions.defaults()
            .withPollInterval(Duration.ofMillis(100))
            .withProbeBackoff(Duration.ofMillis(10))
            .withProbeAttempts(2)
            .withRefreshDelay(Duration.ofMillis(10));

    @TempDir
    Path dir;

    private final FakeMediaBus bus = new FakeMediaBus();
    private final InMemoryCredentialStore store = new InMemoryCredentialStore();
    private final List<RelayClient> clients = new ArrayList<>();
    private final IdentityKeyPair identity = IdentityKeyPair.generate();
    private final byte[] token = CryptoPrimitives.randomBytes(32);
    private PlayerMonitor monitor;
    private RelayServer relay;
    private int port;

    @BeforeEach
    void setUp() throws Exception {
        monitor = new PlayerMonitor(bus, FAST, FacadeSelector.byName());
        monitor.start();
        Await.until(() -> monitor.state() == MonitorState.RUNNING, "monitor to run");
        startRelay(options());
        store.put(identity.identity(), new TrustMaterial(identity.publicKey(), "phone", token));
    }

    private AgentOptions options() {
        return AgentOptions.defaults()
                .withBindAddress(HOST)
                .withPorts(0, 0)
                .withStateDirectory(dir)
                .withCommandTimeout(Duration.ofSeconds(2));
    }

    private void startRelay(AgentOptions options) throws Exception {
        if (relay != null) {
            relay.close();
        }
        relay = new RelayServer(store, monitor, options, CERTIFICATE);
        port = relay.start();
    }

    @AfterEach
    void tearDown() {
        clients.forEach(RelayClient::close);
        relay.close();
        monitor.close();
        store.close();
    }

    private RelayClient connect(RecordingRelayListener listener) throws Exception {
        return connect(port, listener);
    }

    private RelayClient connect(int targetPort, RecordingRelayListener listener) throws Exception {
        RelayClient client = RelayClient.connect(HOST, targetPort, CERTIFICATE.fingerprint(), identity.identity(),
                token, listener, TIMEOUT);
        clients.add(client);
        return client;
    }

    private SSLSocket openRaw() throws Exception {
        SSLSocket socket = TlsSockets.connect(HOST, port, CERTIFICATE.fingerprint(), 5000);
        socket.setSoTimeout(5000);
        return socket;
    }

    private FakePlayerEndpoint addPlayer(String shortName, String name) {
        FakePlayerEndpoint player = FakePlayerEndpoint.compliant(shortName, name);
        bus.addPlayer(player);
        Await.until(() -> monitor.find(player.busName()).isPresent(), name + " to register");
        return player;
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    @Test
    void emptySnapshot_thenAppearanceBeforeStateChange() throws Exception {
        RecordingRelayListener listener = new RecordingRelayListener();
        RelayClient client = connect(listener);

        Snapshot snapshot = await(client.subscribeAll());
        assertTrue(snapshot.players().isEmpty());

        FakePlayerEndpoint player = FakePlayerEndpoint.compliant("mpd", "MPD")
                .set("PlaybackStatus", "Playing")
                .set("Metadata", FakePlayerEndpoint.track("/t/1", "A", "Artist"));
        bus.addPlayer(player);
        EventMessage appeared = listener.next();
        EventMessage changed = listener.next();

        assertEquals(EventKind.PLAYER_APPEARED, appeared.kind());
        assertEquals(player.busName(), appeared.playerId());
        assertEquals(EventKind.STATE_CHANGED, changed.kind());
        assertEquals("PLAYING", changed.player().playbackState());
        assertEquals("A", changed.player().title());
    }

    @Test
    void snapshot_containsPlayersPresentAtSubscription() throws Exception {
        addPlayer("vlc", "VLC");
        RecordingRelayListener listener = new RecordingRelayListener();

        Snapshot snapshot = await(connect(listener).subscribeAll());

        assertEquals(1, snapshot.players().size());
        assertEquals("VLC", snapshot.players().get(0).identity());
        assertNull(listener.quiet());
    }

    @Test
    void unsupportedSeek_isRejectedAndStateUnchanged() throws Exception {
        FakePlayerEndpoint player = FakePlayerEndpoint.compliant("mpd", "MPD").set("CanSeek", false);
        bus.addPlayer(player);
        Await.until(() -> monitor.find(player.busName()).isPresent(), "player");
        RecordingRelayListener listener = new RecordingRelayListener();
        RelayClient client = connect(listener);
        Snapshot before = await(client.subscribeAll());
        assertFalse(before.players().get(0).capabilities().contains("SEEK"));

        CommandResultMessage result = await(client.seek(player.busName(), Duration.ofSeconds(120)));

        assertFalse(result.accepted());
        assertEquals("UNSUPPORTED", result.reason());
        assertTrue(player.calls().isEmpty());
        assertNull(listener.quiet());
        assertEquals(before.players().get(0).positionMs(), monitor.find(player.busName()).orElseThrow().position().toMillis());
    }

    @Test
    void unpairedClient_isRefusedWithoutPlayerData() throws Exception {
        addPlayer("vlc", "VLC");
        IdentityKeyPair stranger = IdentityKeyPair.generate();

        try (SSLSocket socket = openRaw()) {
            MessageReader reader = new MessageReader(socket.getInputStream());
            MessageWriter writer = new MessageWriter(socket.getOutputStream());
            Challenge challenge = reader.require(Challenge.class);
            byte[] nonce = CryptoPrimitives.randomBytes(Protocol.NONCE_LENGTH);
            writer.write(new Authenticate(Protocol.VERSION, stranger.identity(), nonce,
                    RelayProof.client(CryptoPrimitives.randomBytes(32), stranger.identity(), challenge.nonce(), nonce)));

            ErrorMessage error = reader.require(ErrorMessage.class);
            assertEquals(ErrorCode.AUTHENTICATION_FAILED, error.code());
            assertNull(reader.read());
        }
        assertTrue(relay.connectedClients().isEmpty());
    }

    @Test
    void requestBeforeAuthentication_isRefused() throws Exception {
        try (SSLSocket socket = openRaw()) {
            MessageReader reader = new MessageReader(socket.getInputStream());
            reader.require(Challenge.class);
            new MessageWriter(socket.getOutputStream()).write(Subscribe.all("1"));

            assertEquals(ErrorCode.AUTHENTICATION_FAILED, reader.require(ErrorMessage.class).code());
            assertNull(reader.read());
        }
    }

    @Test
    void wrongToken_forKnownIdentity_isRefused() {
        RelayClosedException e = assertThrows(RelayClosedException.class, () -> RelayClient.connect(HOST, port,
                CERTIFICATE.fingerprint(), identity.identity(), CryptoPrimitives.randomBytes(32),
                new RecordingRelayListener(), TIMEOUT));
        assertEquals(ErrorCode.AUTHENTICATION_FAILED, e.getCode());
    }

    @Test
    void clientPinningAnotherCertificate_neverAuthenticates() {
        byte[] otherAgent = AgentCertificate.generate("other agent").fingerprint();

        assertThrows(SSLHandshakeException.class, () -> RelayClient.connect(HOST, port, otherAgent,
                identity.identity(), token, new RecordingRelayListener(), TIMEOUT));
        assertTrue(relay.connectedClients().isEmpty());
    }

    @Test
    void tamperedRecordAfterAuthentication_endsConnectionWithoutRunningCommand() throws Exception {
        FakePlayerEndpoint player = addPlayer("mpd", "MPD");
        try (TamperingProxy proxy = new TamperingProxy(port)) {
            RecordingRelayListener listener = new RecordingRelayListener();
            RelayClient client = connect(proxy.port(), listener);
            assertNotNull(await(client.ping()));

            proxy.armOnce();
            CompletableFuture<CommandResultMessage> result = client.command(player.busName(), "PLAY");

            assertThrows(ExecutionException.class, () -> await(result));
            listener.closed.get(5, TimeUnit.SECONDS);
            Await.until(() -> relay.connectedClients().isEmpty(), "session to end");
        }
        assertTrue(player.calls().isEmpty());
    }

    @Test
    void stalledClient_isToldItIsTooSlowAndDropped() throws Exception {
        startRelay(options().withClientQueueCapacity(4));
        FakePlayerEndpoint player = addPlayer("mpd", "MPD");
        try (SSLSocket socket = openRaw()) {
            socket.setSoTimeout(10_000);
            MessageReader reader = new MessageReader(socket.getInputStream());
            MessageWriter writer = new MessageWriter(socket.getOutputStream());
            Challenge challenge = reader.require(Challenge.class);
            byte[] nonce = CryptoPrimitives.randomBytes(Protocol.NONCE_LENGTH);
            writer.write(new Authenticate(Protocol.VERSION, identity.identity(), nonce,
                    RelayProof.client(token, identity.identity(), challenge.nonce(), nonce)));
            reader.require(Authenticated.class);
            writer.write(Subscribe.all("1"));
            reader.require(Snapshot.class);
            assertEquals(List.of(identity.identity()), relay.connectedClients());

            // Stop reading; large titles fill the socket buffers before the queue.
            String filler = "x".repeat(50_000);
            for (int i = 0; i < 2_000 && !relay.connectedClients().isEmpty(); i++) {
                player.emitChanged("Metadata", FakePlayerEndpoint.track("/t/" + i, i + filler, "Artist"));
                monitor.runSerialized(() -> null).get(5, TimeUnit.SECONDS);
            }
            assertTrue(relay.connectedClients().isEmpty(), "client was never dropped");

            ErrorMessage error = null;
            Message message;
            while (error == null && (message = reader.read()) != null) {
                if (message instanceof ErrorMessage e) {
                    error = e;
                }
            }
            assertNotNull(error);
            assertEquals(ErrorCode.SLOW_CONSUMER, error.code());
        }
    }

    @Test
    void repeatedSubscription_sendsSnapshotOnce() throws Exception {
        FakePlayerEndpoint player = addPlayer("mpd", "MPD");
        RecordingRelayListener listener = new RecordingRelayListener();
        RelayClient client = connect(listener);

        assertEquals(1, await(client.subscribe(List.of(player.busName()))).players().size());
        assertTrue(await(client.subscribe(List.of("MPD"))).players().isEmpty());
        assertTrue(await(client.subscribeAll()).players().isEmpty());
        assertTrue(await(client.subscribeAll()).players().isEmpty());

        player.emitChanged("PlaybackStatus", "Playing");
        assertEquals(EventKind.STATE_CHANGED, listener.next().kind());
        assertNull(listener.quiet());
    }

    @Test
    void explicitSubscription_filtersOtherPlayers() throws Exception {
        FakePlayerEndpoint mpd = addPlayer("mpd", "MPD");
        FakePlayerEndpoint vlc = addPlayer("vlc", "VLC");
        RecordingRelayListener listener = new RecordingRelayListener();
        RelayClient client = connect(listener);
        await(client.subscribe(List.of("VLC")));

        mpd.emitChanged("PlaybackStatus", "Playing");
        vlc.emitChanged("PlaybackStatus", "Paused");

        EventMessage event = listener.next();
        assertEquals(vlc.busName(), event.playerId());
        assertNull(listener.quiet());
    }

    @Test
    void commandToMissingPlayer_isNotFound() throws Exception {
        RelayClient client = connect(new RecordingRelayListener());

        CommandResultMessage result = await(client.command("org.mpris.MediaPlayer2.ghost", "PLAY"));

        assertFalse(result.accepted());
        assertEquals("NOT_FOUND", result.reason());
    }

    @Test
    void unknownAction_isInvalidArgument() throws Exception {
        FakePlayerEndpoint player = addPlayer("mpd", "MPD");
        RelayClient client = connect(new RecordingRelayListener());

        CommandResultMessage result = await(client.command(player.busName(), "SHUFFLE_ALL"));

        assertEquals("INVALID_ARGUMENT", result.reason());
        assertTrue(player.calls().isEmpty());
    }

    @Test
    void commandEffect_reachesEverySubscriberIncludingIssuer() throws Exception {
        FakePlayerEndpoint player = addPlayer("mpd", "MPD");
        RecordingRelayListener first = new RecordingRelayListener();
        RecordingRelayListener second = new RecordingRelayListener();
        RelayClient issuer = connect(first);
        RelayClient watcher = connect(second);
        await(issuer.subscribeAll());
        await(watcher.subscribeAll());

        CommandResultMessage result = await(issuer.command(player.busName(), "PLAY"));

        assertTrue(result.accepted());
        assertEquals("PLAYING", first.next().player().playbackState());
        assertEquals("PLAYING", second.next().player().playbackState());
        assertEquals(List.of("Play"), player.calls());
        assertEquals(2, relay.connectedClients().size());
    }

    @Test
    void unsubscribe_stopsEvents() throws Exception {
        FakePlayerEndpoint player = addPlayer("mpd", "MPD");
        RecordingRelayListener listener = new RecordingRelayListener();
        RelayClient client = connect(listener);
        await(client.subscribeAll());

        assertNotNull(await(client.unsubscribeAll()));
        player.emitChanged("PlaybackStatus", "Playing");

        assertNull(listener.quiet());
    }

    @Test
    void revokedIdentity_isDisconnected() throws Exception {
        RecordingRelayListener listener = new RecordingRelayListener();
        RelayClient client = connect(listener);
        assertNotNull(await(client.ping()));

        store.revoke(identity.identity());

        ExecutionException e = assertThrows(ExecutionException.class, () -> await(client.ping()));
        assertInstanceOf(RelayClosedException.class, e.getCause());
        assertEquals(ErrorCode.AUTHENTICATION_FAILED, listener.closed.get(5, TimeUnit.SECONDS));
        Await.until(() -> relay.connectedClients().isEmpty(), "session to end");
    }

    @Test
    void disconnect_endsSessionsOfIdentity() throws Exception {
        RecordingRelayListener listener = new RecordingRelayListener();
        connect(listener);

        assertEquals(1, relay.disconnect(identity.identity()));

        assertEquals(ErrorCode.AUTHENTICATION_FAILED, listener.closed.get(5, TimeUnit.SECONDS));
    }

    @Test
    void close_tellsClientsAgentIsShuttingDown() throws Exception {
        RecordingRelayListener listener = new RecordingRelayListener();
        RelayClient client = connect(listener);
        await(client.subscribeAll());

        relay.close();

        assertEquals(ErrorCode.SHUTTING_DOWN, listener.closed.get(5, TimeUnit.SECONDS));
        assertTrue(client.isClosed());
    }
}
