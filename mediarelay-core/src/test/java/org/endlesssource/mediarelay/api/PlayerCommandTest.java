package org.endlesssource.mediarelay.api;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PlayerCommandTest {

    @Test
    void seek_requiresNonNegativePosition() {
        assertThrows(NullPointerException.class, () -> PlayerCommand.seek(null));
        assertThrows(IllegalArgumentException.class, () -> PlayerCommand.seek(Duration.ofSeconds(-1)));
        assertEquals(Duration.ofSeconds(120), PlayerCommand.seek(Duration.ofSeconds(120)).position());
    }

    @Test
    void setRate_requiresFiniteRate() {
        assertThrows(IllegalArgumentException.class, () -> PlayerCommand.setRate(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> PlayerCommand.setRate(Double.POSITIVE_INFINITY));
        assertEquals(1.5d, PlayerCommand.setRate(1.5d).rate());
    }

    @Test
    void rejectedResult_needsReason() {
        assertThrows(IllegalArgumentException.class, () -> new CommandResult(false, null, "nope"));
        CommandResult rejected = CommandResult.rejected(RejectionReason.NOT_FOUND, "gone");
        assertFalse(rejected.accepted());
        assertEquals(RejectionReason.NOT_FOUND, rejected.reason());
        assertTrue(CommandResult.ok().accepted());
    }

    @Test
    void playbackState_parsesMprisStatus() {
        assertEquals(PlaybackState.PLAYING, PlaybackState.fromMpris("Playing"));
        assertEquals(PlaybackState.PAUSED, PlaybackState.fromMpris("paused"));
        assertEquals(PlaybackState.STOPPED, PlaybackState.fromMpris("Stopped"));
        assertEquals(PlaybackState.UNKNOWN, PlaybackState.fromMpris("Buffering"));
        assertEquals(PlaybackState.UNKNOWN, PlaybackState.fromMpris(null));
    }

    @Test
    void snapshotEquality_ignoresTimestamp() {
        PlayerSnapshot a = PlayerSnapshot.degraded("org.mpris.MediaPlayer2.vlc", "VLC");
        PlayerSnapshot b = PlayerSnapshot.degraded("org.mpris.MediaPlayer2.vlc", "VLC");
        assertTrue(a.sameStateAs(b));
        assertFalse(a.sameStateAs(b.withIdentity("VLC (2)")));
        assertFalse(a.sameStateAs(null));
    }
}
