package org.endlesssource.mediarelay.facade;

import org.endlesssource.mediarelay.api.CommandAction;
import org.endlesssource.mediarelay.api.CommandResult;
import org.endlesssource.mediarelay.api.PlaybackState;
import org.endlesssource.mediarelay.api.PlayerCommand;
import org.endlesssource.mediarelay.api.PlayerSnapshot;
import org.endlesssource.mediarelay.api.RejectionReason;
import org.endlesssource.mediarelay.api.TrackMetadata;
import org.endlesssource.mediarelay.api.TransportCapabilities;
import org.endlesssource.mediarelay.spi.BusException;
import org.endlesssource.mediarelay.spi.PlayerEndpoint;

import java.util.Map;
import java.util.Optional;

/**
 * Firefox keeps its last {@code PlaybackStatus} after the page's media is gone and
 * leaves only empty metadata behind; that combination is reported as stopped.
 * Its {@code SetPosition} is unreliable, so only a jump back to the start is offered,
 * performed as stop then play.
 */
public class FirefoxPlayerFacade extends PlayerFacade {

    public FirefoxPlayerFacade(PlayerEndpoint endpoint, String identity, FacadeSettings settings) {
        super(endpoint, identity, settings);
    }

    @Override
    public FacadeKind kind() {
        return FacadeKind.FIREFOX;
    }

    @Override
    protected PlaybackState playbackState(Map<String, Object> props, TrackMetadata metadata) {
        if (metadata.isEmpty()) {
            return PlaybackState.STOPPED;
        }
        return super.playbackState(props, metadata);
    }

    @Override
    protected TransportCapabilities capabilities(Map<String, Object> props) {
        return super.capabilities(props).withSeek(false);
    }

    @Override
    protected Optional<CommandResult> checkCommand(PlayerCommand command, PlayerSnapshot current) {
        if (command.action() == CommandAction.SEEK) {
            TransportCapabilities capabilities = current.capabilities();
            if (command.position().isZero() && capabilities.canStop() && capabilities.canPlay()) {
                return Optional.empty();
            }
            return Optional.of(CommandResult.rejected(RejectionReason.UNSUPPORTED,
                    current.identity() + " can only seek to the start of a track"));
        }
        return super.checkCommand(command, current);
    }

    @Override
    protected void perform(PlayerCommand command) throws BusException {
        if (command.action() == CommandAction.SEEK) {
            endpoint.stop();
            endpoint.play();
            return;
        }
        super.perform(command);
    }
}
