package org.endlesssource.mediarelay.spi;

/**
 * Raised by {@link ControlService#export(AgentControl)} when the session already has an agent.
 */
public class AgentAlreadyRunningException extends BusException {

    public AgentAlreadyRunningException(String message) {
        super(message);
    }
}
