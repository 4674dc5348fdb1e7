package org.endlesssource.mediarelay.agent.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.jmdns.JmDNS;
import javax.jmdns.ServiceInfo;
import java.io.IOException;
import java.net.InetAddress;

/**
 * Multicast DNS announcement through JmDNS.
 */
public final class JmDnsAdvertiser implements ServiceAdvertiser {
    private static final Logger logger = LoggerFactory.getLogger(JmDnsAdvertiser.class);

    private final InetAddress address;
    private JmDNS jmdns;

    /**
     * @param address interface to announce on, or null to let JmDNS choose
     */
    public JmDnsAdvertiser(InetAddress address) {
        this.address = address;
    }

    @Override
    public synchronized void advertise(ServiceAnnouncement announcement) throws IOException {
        if (jmdns != null) {
            throw new IllegalStateException("Already advertising");
        }
        JmDNS created = address == null ? JmDNS.create() : JmDNS.create(address);
        ServiceInfo info = ServiceInfo.create(ServiceAnnouncement.SERVICE_TYPE, announcement.instanceName(),
                announcement.relayPort(), 0, 0, announcement.properties());
        try {
            created.registerService(info);
        } catch (IOException | RuntimeException e) {
            closeQuietly(created);
            throw e;
        }
        jmdns = created;
        logger.info("Advertising \"{}\" as {} on port {}", announcement.instanceName(),
                ServiceAnnouncement.SERVICE_TYPE, announcement.relayPort());
    }

    @Override
    public synchronized void close() {
        if (jmdns == null) {
            return;
        }
        jmdns.unregisterAllServices();
        closeQuietly(jmdns);
        jmdns = null;
    }

    private static void closeQuietly(JmDNS jmdns) {
        try {
            jmdns.close();
        } catch (IOException e) {
            logger.debug("Failed to close mDNS responder: {}", e.getMessage());
        }
    }
}
