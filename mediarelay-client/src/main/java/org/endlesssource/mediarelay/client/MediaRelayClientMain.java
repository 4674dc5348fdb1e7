package org.endlesssource.mediarelay.client;

import org.endlesssource.mediarelay.protocol.Protocol;
import org.endlesssource.mediarelay.protocol.message.CommandResultMessage;
import org.endlesssource.mediarelay.protocol.message.ErrorCode;
import org.endlesssource.mediarelay.protocol.message.EventMessage;
import org.endlesssource.mediarelay.protocol.message.PlayerState;
import org.endlesssource.mediarelay.protocol.message.Snapshot;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command line client: pair with an agent, list players, watch events and send commands.
 */
@Command(
        name = "mediarelay-client",
        mixinStandardHelpOptions = true,
        description = "Pair with and control a mediarelay agent",
        subcommands = {
                MediaRelayClientMain.PairCommand.class,
                MediaRelayClientMain.PlayersCommand.class,
                MediaRelayClientMain.WatchCommand.class,
                MediaRelayClientMain.SendCommand.class
        }
)
public final class MediaRelayClientMain implements Runnable {
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    @Option(names = {"--credentials"},
            defaultValue = "${env:XDG_CONFIG_HOME:-${sys:user.home}/.config}/mediarelay/client.json",
            description = "Credentials file (default: ${DEFAULT-VALUE})")
    Path credentials;

    @Option(names = {"--log-level"}, defaultValue = "${env:MEDIARELAY_LOG_LEVEL:-warn}",
            description = "trace, debug, info, warn or error (default: ${DEFAULT-VALUE})")
    String logLevel;

    public static void main(String[] args) {
        System.exit(new CommandLine(new MediaRelayClientMain()).execute(args));
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: pair | players | watch | send");
    }

    void applyLogLevel() {
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", logLevel.toLowerCase(Locale.ROOT));
    }

    ClientCredentials pairedCredentials() throws IOException {
        ClientCredentials loaded = CredentialsFile.load(credentials).orElse(null);
        if (loaded == null || !loaded.isPaired()) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                    "Not paired yet, run: mediarelay-client pair --host <agent>");
        }
        return loaded;
    }

    static String describe(PlayerState player) {
        StringBuilder sb = new StringBuilder();
        sb.append(player.identity()).append(" [").append(player.playerId()).append("] ")
                .append(player.playbackState());
        if ("DEGRADED".equals(player.status())) {
            sb.append(" (degraded)");
        }
        if (player.title() != null) {
            sb.append(" - ").append(player.title());
            if (player.artist() != null) {
                sb.append(" by ").append(player.artist());
            }
        }
        sb.append(" @ ").append(player.positionMs() / 1000).append('s');
        if (!player.capabilities().isEmpty()) {
            sb.append(" ").append(player.capabilities());
        }
        return sb.toString();
    }

    @Command(name = "pair", description = "Pair with an agent")
    static final class PairCommand implements Callable<Integer> {
        @ParentCommand
        MediaRelayClientMain parent;

        @Option(names = {"--host"}, required = true, description = "Agent host")
        String host;

        @Option(names = {"--pairing-port"}, defaultValue = "" + Protocol.DEFAULT_PAIRING_PORT,
                description = "Agent pairing port (default: ${DEFAULT-VALUE})")
        int pairingPort;

        @Option(names = {"--relay-port"}, defaultValue = "" + Protocol.DEFAULT_RELAY_PORT,
                description = "Agent relay port (default: ${DEFAULT-VALUE})")
        int relayPort;

        @Option(names = {"--name"}, defaultValue = "mediarelay-client", description = "Name shown to the operator")
        String name;

        @Override
        public Integer call() throws IOException {
            parent.applyLogLevel();
            ClientCredentials current = CredentialsFile.load(parent.credentials)
                    .orElseGet(() -> ClientCredentials.newIdentity(name));
            PairingClient client = new PairingClient(current.identityKeyPair(), name);
            System.out.printf("Pairing with %s:%d as %s%n", host, pairingPort, current.identity());
            try {
                PairingResult result = client.pair(host, pairingPort, MediaRelayClientMain::askUser);
                CredentialsFile.save(parent.credentials, current.paired(result, host, relayPort));
                System.out.println("Paired. Credentials saved to " + parent.credentials);
                return 0;
            } catch (PairingFailedException e) {
                System.err.println("Pairing failed: " + e.getFailure());
                return 2;
            }
        }
    }

    static boolean askUser(String sas) {
        System.out.printf("Code: %s%nDoes the agent show the same code? [y/N]: ", sas);
        System.out.flush();
        try {
            String line = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)).readLine();
            return line != null && line.trim().toLowerCase(Locale.ROOT).startsWith("y");
        } catch (IOException e) {
            return false;
        }
    }

    @Command(name = "players", description = "List the agent's players")
    static final class PlayersCommand implements Callable<Integer> {
        @ParentCommand
        MediaRelayClientMain parent;

        @Override
        public Integer call() throws Exception {
            parent.applyLogLevel();
            try (RelayClient client = RelayClient.connect(parent.pairedCredentials(), event -> { }, REQUEST_TIMEOUT)) {
                Snapshot snapshot = client.subscribeAll().get(REQUEST_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (snapshot.players().isEmpty()) {
                    System.out.println("No players");
                }
                snapshot.players().forEach(player -> System.out.println(describe(player)));
            }
            return 0;
        }
    }

    @Command(name = "watch", description = "Print player events until interrupted")
    static final class WatchCommand implements Callable<Integer> {
        @ParentCommand
        MediaRelayClientMain parent;

        @Override
        public Integer call() throws Exception {
            parent.applyLogLevel();
            CountDownLatch closed = new CountDownLatch(1);
            RelayListener listener = new RelayListener() {
                @Override
                public void onEvent(EventMessage event) {
                    System.out.println(event.kind() + " " + (event.player() == null
                            ? event.playerId() : describe(event.player())));
                }

                @Override
                public void onClosed(ErrorCode reason) {
                    System.out.println("Disconnected" + (reason == null ? "" : ": " + reason));
                    closed.countDown();
                }
            };
            try (RelayClient client = RelayClient.connect(parent.pairedCredentials(), listener, REQUEST_TIMEOUT)) {
                Snapshot snapshot = client.subscribeAll().get(REQUEST_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                snapshot.players().forEach(player -> System.out.println("PRESENT " + describe(player)));
                closed.await();
            }
            return 0;
        }
    }

    @Command(name = "send", description = "Send a command to a player")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        MediaRelayClientMain parent;

        @Parameters(index = "0", description = "Player id or name")
        String player;

        @Parameters(index = "1", description = "play, pause, stop, next, previous, seek or set-rate")
        String action;

        @Option(names = {"--position"}, description = "Seek target in seconds")
        Double positionSeconds;

        @Option(names = {"--rate"}, description = "Playback rate for set-rate")
        Double rate;

        @Override
        public Integer call() throws Exception {
            parent.applyLogLevel();
            String normalized = action.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            try (RelayClient client = RelayClient.connect(parent.pairedCredentials(), event -> { }, REQUEST_TIMEOUT)) {
                CommandResultMessage result;
                if ("SEEK".equals(normalized)) {
                    if (positionSeconds == null) {
                        System.err.println("seek needs --position");
                        return 2;
                    }
                    result = client.seek(player, Duration.ofMillis(Math.round(positionSeconds * 1000)))
                            .get(REQUEST_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                } else if ("SET_RATE".equals(normalized)) {
                    if (rate == null) {
                        System.err.println("set-rate needs --rate");
                        return 2;
                    }
                    result = client.setRate(player, rate).get(REQUEST_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                } else {
                    result = client.command(player, normalized).get(REQUEST_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                }
                if (result.accepted()) {
                    System.out.println("OK");
                    return 0;
                }
                System.err.println("Rejected: " + result.reason()
                        + (result.message() == null || result.message().isBlank() ? "" : " (" + result.message() + ")"));
                return 1;
            }
        }
    }
}
