package org.endlesssource.mediarelay.spi;

import java.util.Optional;

/**
 * Publishes the agent's {@link AgentControl} on the platform bus and finds it from other processes.
 * At most one agent per user session can be published at a time.
 */
public interface ControlService {

    /**
     * Does nothing: agents are not reachable and never conflict.
     */
    ControlService NONE = new ControlService() {
        @Override
        public Registration export(AgentControl control) {
            return () -> { };
        }

        @Override
        public Optional<RemoteAgent> connect() {
            return Optional.empty();
        }
    };

    /**
     * Make the control reachable until the registration is closed.
     *
     * @throws AgentAlreadyRunningException if another agent is published in this session
     * @throws BusException                 if the bus cannot be reached
     */
    Registration export(AgentControl control) throws BusException;

    /**
     * @return the running agent, or empty when none is published
     * @throws BusException if the bus cannot be reached
     */
    Optional<RemoteAgent> connect() throws BusException;

    /**
     * Handle on a published control.
     */
    @FunctionalInterface
    interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * Control of an agent in another process. Closing it releases the connection, not the agent.
     */
    interface RemoteAgent extends AgentControl, AutoCloseable {
        @Override
        void close();
    }
}
