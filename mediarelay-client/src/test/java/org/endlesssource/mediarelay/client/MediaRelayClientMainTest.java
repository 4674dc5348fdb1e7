package org.endlesssource.mediarelay.client;

import org.endlesssource.mediarelay.protocol.message.PlayerState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MediaRelayClientMainTest {

    @TempDir
    Path dir;

    @Test
    void describe_includesTrackAndCapabilities() {
        PlayerState player = new PlayerState("org.mpris.MediaPlayer2.vlc", "VLC", "PLAYING", "HEALTHY",
                "/track/1", "Song", "Band", null, 200_000L, null, 65_400, 1.0, List.of("PAUSE", "SEEK"));

        assertEquals("VLC [org.mpris.MediaPlayer2.vlc] PLAYING - Song by Band @ 65s [PAUSE, SEEK]",
                MediaRelayClientMain.describe(player));
    }

    @Test
    void describe_marksDegradedPlayers() {
        PlayerState player = new PlayerState("org.mpris.MediaPlayer2.spotify", "Spotify", "UNKNOWN", "DEGRADED",
                null, null, null, null, null, null, 0, 1.0, List.of());

        assertEquals("Spotify [org.mpris.MediaPlayer2.spotify] UNKNOWN (degraded) @ 0s",
                MediaRelayClientMain.describe(player));
    }

    @Test
    void players_refusesWithoutPairing() {
        int exit = new CommandLine(new MediaRelayClientMain())
                .execute("--credentials", dir.resolve("client.json").toString(), "players");

        assertNotEquals(0, exit);
    }

    @Test
    void send_parsesSeekPosition() {
        MediaRelayClientMain main = new MediaRelayClientMain();
        CommandLine.ParseResult result = new CommandLine(main)
                .parseArgs("--credentials", dir.resolve("client.json").toString(),
                        "send", "VLC", "seek", "--position", "12.5");

        MediaRelayClientMain.SendCommand send = result.subcommand().commandSpec().commandLine().getCommand();
        assertEquals("VLC", send.player);
        assertEquals("seek", send.action);
        assertEquals(12.5, send.positionSeconds);
        assertEquals(dir.resolve("client.json"), main.credentials);
    }
}
