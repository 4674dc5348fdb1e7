package org.endlesssource.mediarelay.agent.relay;

import org.endlesssource.mediarelay.api.CommandAction;
import org.endlesssource.mediarelay.api.CommandResult;
import org.endlesssource.mediarelay.api.PlaybackState;
import org.endlesssource.mediarelay.api.PlayerCommand;
import org.endlesssource.mediarelay.api.PlayerEvent;
import org.endlesssource.mediarelay.api.PlayerSnapshot;
import org.endlesssource.mediarelay.api.PlayerStatus;
import org.endlesssource.mediarelay.api.RejectionReason;
import org.endlesssource.mediarelay.api.TrackMetadata;
import org.endlesssource.mediarelay.api.TransportCapabilities;
import org.endlesssource.mediarelay.protocol.message.Command;
import org.endlesssource.mediarelay.protocol.message.CommandResultMessage;
import org.endlesssource.mediarelay.protocol.message.EventKind;
import org.endlesssource.mediarelay.protocol.message.EventMessage;
import org.endlesssource.mediarelay.protocol.message.PlayerState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WireMappingTest {

    private static final PlayerSnapshot SNAPSHOT = new PlayerSnapshot("org.mpris.MediaPlayer2.vlc", "VLC",
            PlaybackState.PLAYING, PlayerStatus.HEALTHY,
            new TrackMetadata("/t/1", "A", "Artist", null, Duration.ofSeconds(240), null, Map.of()),
            Duration.ofMillis(61_500), 1.0d, TransportCapabilities.NONE.withSeek(true).withStop(true),
            Instant.now());

    @Test
    void snapshot_usesMillisecondsAndNames() {
        PlayerState state = WireMapping.toWire(SNAPSHOT);
        assertEquals("org.mpris.MediaPlayer2.vlc", state.playerId());
        assertEquals("PLAYING", state.playbackState());
        assertEquals("HEALTHY", state.status());
        assertEquals("A", state.title());
        assertNull(state.album());
        assertEquals(240_000L, state.lengthMs());
        assertEquals(61_500L, state.positionMs());
        assertEquals(List.of("STOP", "SEEK"), state.capabilities());
    }

    @Test
    void disappearance_hasNoPlayer() {
        EventMessage event = WireMapping.toWire(PlayerEvent.disappeared("org.mpris.MediaPlayer2.vlc"));
        assertEquals(EventKind.PLAYER_DISAPPEARED, event.kind());
        assertNull(event.player());
        assertEquals(EventKind.STATE_CHANGED, WireMapping.toWire(PlayerEvent.changed(SNAPSHOT)).kind());
    }

    @Test
    void rejection_carriesReasonName() {
        CommandResultMessage message = WireMapping.toWire("7",
                CommandResult.rejected(RejectionReason.UNSUPPORTED, "no seek"));
        assertFalse(message.accepted());
        assertEquals("UNSUPPORTED", message.reason());
        assertNull(WireMapping.toWire("8", CommandResult.ok()).reason());
    }

    @Test
    void command_actionsAndArguments() {
        assertEquals(PlayerCommand.play(), WireMapping.toCommand(Command.of("1", "p", "play")));
        PlayerCommand seek = WireMapping.toCommand(Command.seek("2", "p", 120_000));
        assertEquals(CommandAction.SEEK, seek.action());
        assertEquals(Duration.ofSeconds(120), seek.position());
        assertEquals(1.5d, WireMapping.toCommand(Command.setRate("3", "p", 1.5d)).rate());
    }

    @Test
    void command_invalidInputIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> WireMapping.toCommand(Command.of("1", "p", "JUMP")));
        assertThrows(IllegalArgumentException.class, () -> WireMapping.toCommand(Command.of("1", "p", null)));
        assertThrows(IllegalArgumentException.class, () -> WireMapping.toCommand(Command.of("1", "p", "SEEK")));
        assertThrows(IllegalArgumentException.class, () -> WireMapping.toCommand(Command.seek("1", "p", -5)));
        assertThrows(IllegalArgumentException.class,
                () -> WireMapping.toCommand(Command.setRate("1", "p", Double.NaN)));
    }
}
