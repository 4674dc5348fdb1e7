package org.endlesssource.mediarelay.agent;

import org.endlesssource.mediarelay.MediaBusFactory;
import org.endlesssource.mediarelay.agent.discovery.JmDnsAdvertiser;
import org.endlesssource.mediarelay.agent.discovery.ServiceAdvertiser;
import org.endlesssource.mediarelay.agent.discovery.ServiceAnnouncement;
import org.endlesssource.mediarelay.agent.pairing.ConfirmationPrompt;
import org.endlesssource.mediarelay.agent.pairing.PairingAuthenticator;
import org.endlesssource.mediarelay.agent.relay.RelayServer;
import org.endlesssource.mediarelay.agent.store.CredentialStore;
import org.endlesssource.mediarelay.agent.store.FileCredentialStore;
import org.endlesssource.mediarelay.agent.store.TrustRecord;
import org.endlesssource.mediarelay.facade.FacadeSelector;
import org.endlesssource.mediarelay.monitor.PlayerMonitor;
import org.endlesssource.mediarelay.protocol.tls.AgentCertificate;
import org.endlesssource.mediarelay.spi.AgentAlreadyRunningException;
import org.endlesssource.mediarelay.spi.AgentControl;
import org.endlesssource.mediarelay.spi.BusException;
import org.endlesssource.mediarelay.spi.ControlService;
import org.endlesssource.mediarelay.spi.DesktopNotifier;
import org.endlesssource.mediarelay.spi.MediaBus;
import org.endlesssource.mediarelay.spi.MediaBusProvider;
import org.endlesssource.mediarelay.spi.PairingEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Collectors;

/**
 * The running agent: player monitor, pairing listener and relay listener over one credential store.
 * <p>
 * Owns everything it is given. {@link #close()} withdraws the network announcement and the control
 * object, stops both listeners, ends every session, stops monitoring the bus and releases the
 * credential store.
 */
public final class MediaRelayAgent implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MediaRelayAgent.class);
    static final String CERTIFICATE_NAME = "mediarelay agent";

    private final AgentOptions options;
    private final CredentialStore store;
    private final DesktopNotifier notifier;
    private final AgentCertificate certificate;
    private final ServiceAdvertiser advertiser;
    private final ControlService controlService;
    private final PlayerMonitor monitor;
    private final PairingAuthenticator authenticator;
    private final RelayServer relay;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private ControlService.Registration registration;
    private boolean started;
    private boolean closed;

    public MediaRelayAgent(AgentOptions options, MediaBus bus, DesktopNotifier notifier, CredentialStore store,
                           ConfirmationPrompt prompt, AgentCertificate certificate, ServiceAdvertiser advertiser,
                           ControlService controlService) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.certificate = Objects.requireNonNull(certificate, "certificate must not be null");
        this.notifier = notifier == null ? DesktopNotifier.NONE : notifier;
        this.advertiser = advertiser == null ? ServiceAdvertiser.NONE : advertiser;
        this.controlService = controlService == null ? ControlService.NONE : controlService;
        this.monitor = new PlayerMonitor(bus, options.getMonitorOptions(), FacadeSelector.byName());
        this.authenticator = new PairingAuthenticator(store, prompt, this.notifier, options, certificate);
        this.relay = new RelayServer(store, monitor, options, certificate);
    }

    /**
     * Agent for the current platform's media bus, keeping trust records and the TLS certificate in
     * the options' state directory.
     *
     * @throws UnsupportedOperationException if no media bus is available on this platform
     * @throws IOException                   if the certificate can neither be read nor created
     */
    public static MediaRelayAgent create(AgentOptions options, ConfirmationPrompt prompt) throws IOException {
        MediaBusProvider provider = MediaBusFactory.selectProvider();
        AgentCertificate certificate = AgentCertificate.loadOrCreate(options.getStateDirectory(), CERTIFICATE_NAME);
        CredentialStore store = FileCredentialStore.open(options.getStateDirectory());
        return new MediaRelayAgent(options, provider.create(), provider.createNotifier(), store, prompt,
                certificate, new JmDnsAdvertiser(announceAddress(options.getBindAddress())),
                provider.createControlService());
    }

    /**
     * Publish the control object, start monitoring, open both ports and announce them.
     *
     * @throws IllegalStateException if another agent already runs in this session
     */
    public synchronized void start() throws IOException {
        if (started) {
            throw new IllegalStateException("Agent already started");
        }
        started = true;
        publishControl();
        monitor.start();
        try {
            relay.start();
            authenticator.start();
        } catch (IOException | RuntimeException e) {
            close();
            throw e;
        }
        logger.info("Agent running: relay port {}, pairing port {}, {} paired client(s)",
                relay.getLocalPort(), authenticator.getLocalPort(), store.list().size());
        logger.info("Agent certificate fingerprint {}", certificate.fingerprintHex());
        if (options.isAdvertise()) {
            advertise();
        }
    }

    private void publishControl() {
        try {
            registration = controlService.export(new Control());
        } catch (AgentAlreadyRunningException e) {
            close();
            throw new IllegalStateException(e.getMessage(), e);
        } catch (BusException e) {
            logger.warn("Agent control unavailable, pairings can only be managed while stopped: {}",
                    e.getMessage());
        }
    }

    private void advertise() {
        try {
            advertiser.advertise(ServiceAnnouncement.forThisHost(relay.getLocalPort(), authenticator.getLocalPort(),
                    certificate.fingerprintHex()));
        } catch (IOException | RuntimeException e) {
            logger.warn("Could not announce the agent on the local network: {}", e.getMessage());
        }
    }

    public int getRelayPort() {
        return relay.getLocalPort();
    }

    public int getPairingPort() {
        return authenticator.getLocalPort();
    }

    public PlayerMonitor getMonitor() {
        return monitor;
    }

    public AgentCertificate getCertificate() {
        return certificate;
    }

    /**
     * Block until {@link #close()} has finished, whoever called it.
     */
    public void awaitStopped() throws InterruptedException {
        stopped.await();
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        logger.info("Stopping agent");
        advertiser.close();
        if (registration != null) {
            registration.close();
        }
        authenticator.close();
        relay.close();
        monitor.close();
        notifier.close();
        store.close();
        stopped.countDown();
    }

    /**
     * Wildcard and unresolvable bind addresses leave the choice of interface to JmDNS.
     */
    static InetAddress announceAddress(String bindAddress) {
        try {
            InetAddress address = InetAddress.getByName(bindAddress);
            return address.isAnyLocalAddress() ? null : address;
        } catch (UnknownHostException e) {
            logger.debug("Announcing on the default interface, {} does not resolve", bindAddress);
            return null;
        }
    }

    private final class Control implements AgentControl {

        @Override
        public String ping() {
            return String.format("mediarelay agent: relay port %d, pairing port %d, %d paired, %d connected",
                    relay.getLocalPort(), authenticator.getLocalPort(), store.list().size(),
                    relay.connectedClients().size());
        }

        @Override
        public List<PairingEntry> listPairings() {
            return store.list().stream()
                    .map(record -> new PairingEntry(record.identity(), record.clientName(), record.createdAt()))
                    .collect(Collectors.toList());
        }

        @Override
        public boolean revokePairing(String identity) {
            boolean revoked = store.revoke(identity);
            int dropped = relay.disconnect(identity);
            logger.info("Revoked pairing {} on request, {} connection(s) closed", identity, dropped);
            return revoked;
        }

        @Override
        public int resetPairings() {
            Set<String> identities = new LinkedHashSet<>(relay.connectedClients());
            store.list().stream().map(TrustRecord::identity).forEach(identities::add);
            int revoked = store.revokeAll();
            identities.forEach(relay::disconnect);
            logger.info("Reset {} pairing(s) on request", revoked);
            return revoked;
        }

        @Override
        public void quit() {
            logger.info("Stop requested over the control interface");
            new Thread(MediaRelayAgent.this::close, "mediarelay-quit").start();
        }
    }
}
