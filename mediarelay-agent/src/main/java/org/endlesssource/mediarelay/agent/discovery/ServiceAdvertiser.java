package org.endlesssource.mediarelay.agent.discovery;

import java.io.IOException;

/**
 * Announces a running agent so clients can find it without knowing its address.
 */
public interface ServiceAdvertiser extends AutoCloseable {

    ServiceAdvertiser NONE = new ServiceAdvertiser() {
        @Override
        public void advertise(ServiceAnnouncement announcement) {
        }

        @Override
        public void close() {
        }
    };

    /**
     * Start answering queries for the announcement until {@link #close()}.
     */
    void advertise(ServiceAnnouncement announcement) throws IOException;

    /**
     * Withdraw the announcement. Never throws.
     */
    @Override
    void close();
}
