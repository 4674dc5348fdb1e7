package org.endlesssource.mediarelay.agent.relay;

import org.endlesssource.mediarelay.api.CommandAction;
import org.endlesssource.mediarelay.api.CommandResult;
import org.endlesssource.mediarelay.api.PlayerCommand;
import org.endlesssource.mediarelay.api.PlayerEvent;
import org.endlesssource.mediarelay.api.PlayerSnapshot;
import org.endlesssource.mediarelay.api.TrackMetadata;
import org.endlesssource.mediarelay.protocol.message.Command;
import org.endlesssource.mediarelay.protocol.message.CommandResultMessage;
import org.endlesssource.mediarelay.protocol.message.EventKind;
import org.endlesssource.mediarelay.protocol.message.EventMessage;
import org.endlesssource.mediarelay.protocol.message.PlayerState;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Converts between the canonical player model and its wire form.
 */
final class WireMapping {

    private WireMapping() {
    }

    static PlayerState toWire(PlayerSnapshot snapshot) {
        TrackMetadata metadata = snapshot.metadata();
        List<String> capabilities = snapshot.capabilities().toActions().stream()
                .map(Enum::name)
                .collect(Collectors.toList());
        return new PlayerState(snapshot.playerId(),
                snapshot.identity(),
                snapshot.playbackState().name(),
                snapshot.status().name(),
                metadata.trackId(),
                metadata.title(),
                metadata.artist(),
                metadata.album(),
                metadata.length() == null ? null : metadata.length().toMillis(),
                metadata.artUrl(),
                snapshot.position().toMillis(),
                snapshot.rate(),
                capabilities);
    }

    static EventMessage toWire(PlayerEvent event) {
        EventKind kind = switch (event.type()) {
            case PLAYER_APPEARED -> EventKind.PLAYER_APPEARED;
            case STATE_CHANGED -> EventKind.STATE_CHANGED;
            case PLAYER_DISAPPEARED -> EventKind.PLAYER_DISAPPEARED;
        };
        return new EventMessage(kind, event.playerId(), event.snapshot() == null ? null : toWire(event.snapshot()));
    }

    static CommandResultMessage toWire(String requestId, CommandResult result) {
        return new CommandResultMessage(requestId, result.accepted(),
                result.reason() == null ? null : result.reason().name(), result.message());
    }

    /**
     * @throws IllegalArgumentException when the action is unknown or its argument is missing or invalid
     */
    static PlayerCommand toCommand(Command command) {
        if (command.action() == null || command.action().isBlank()) {
            throw new IllegalArgumentException("Missing action");
        }
        CommandAction action;
        try {
            action = CommandAction.valueOf(command.action().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action " + command.action());
        }
        return switch (action) {
            case SEEK -> {
                if (command.positionMs() == null) {
                    throw new IllegalArgumentException("SEEK requires positionMs");
                }
                yield PlayerCommand.seek(Duration.ofMillis(command.positionMs()));
            }
            case SET_RATE -> {
                if (command.rate() == null) {
                    throw new IllegalArgumentException("SET_RATE requires rate");
                }
                yield PlayerCommand.setRate(command.rate());
            }
            default -> PlayerCommand.of(action);
        };
    }
}
