package org.endlesssource.mediarelay.api;

import java.util.EnumSet;
import java.util.Set;

/**
 * Transport capabilities - what controls are supported
 */
public record TransportCapabilities(boolean canPlay, boolean canPause, boolean canStop, boolean canNext,
                                    boolean canPrevious, boolean canSeek, boolean canSetRate) {

    public static final TransportCapabilities NONE =
            new TransportCapabilities(false, false, false, false, false, false, false);

    public static final TransportCapabilities ALL =
            new TransportCapabilities(true, true, true, true, true, true, true);

    public boolean supports(CommandAction action) {
        return switch (action) {
            case PLAY -> canPlay;
            case PAUSE -> canPause;
            case STOP -> canStop;
            case NEXT -> canNext;
            case PREVIOUS -> canPrevious;
            case SEEK -> canSeek;
            case SET_RATE -> canSetRate;
        };
    }

    public Set<CommandAction> toActions() {
        Set<CommandAction> actions = EnumSet.noneOf(CommandAction.class);
        for (CommandAction action : CommandAction.values()) {
            if (supports(action)) {
                actions.add(action);
            }
        }
        return actions;
    }

    public TransportCapabilities withSeek(boolean seek) {
        return new TransportCapabilities(canPlay, canPause, canStop, canNext, canPrevious, seek, canSetRate);
    }

    public TransportCapabilities withStop(boolean stop) {
        return new TransportCapabilities(canPlay, canPause, stop, canNext, canPrevious, canSeek, canSetRate);
    }

    public TransportCapabilities withSetRate(boolean setRate) {
        return new TransportCapabilities(canPlay, canPause, canStop, canNext, canPrevious, canSeek, setRate);
    }
}
