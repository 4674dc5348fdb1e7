package org.endlesssource.mediarelay.api;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class PlaybackStateTest {

    @Test
    void fromMpris_ignoresCaseAndWhitespace() {
        assertEquals(PlaybackState.PLAYING, PlaybackState.fromMpris(" Playing "));
        assertEquals(PlaybackState.PAUSED, PlaybackState.fromMpris("PAUSED"));
        assertEquals(PlaybackState.STOPPED, PlaybackState.fromMpris("stopped"));
        assertEquals(PlaybackState.UNKNOWN, PlaybackState.fromMpris("Buffering"));
        assertEquals(PlaybackState.UNKNOWN, PlaybackState.fromMpris(null));
    }

    @Test
    void fromMpris_isIndependentOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals(PlaybackState.PLAYING, PlaybackState.fromMpris("PLAYING"));
            assertEquals(PlaybackState.PLAYING, PlaybackState.fromMpris("Playing"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
