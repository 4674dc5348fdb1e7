package org.endlesssource.mediarelay.agent.discovery;

import org.endlesssource.mediarelay.protocol.Protocol;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What the agent announces on the local network: an instance name, the relay port as the service
 * port and TXT properties pointing at the pairing port.
 */
public record ServiceAnnouncement(String instanceName, int relayPort, Map<String, String> properties) {
    public static final String SERVICE_TYPE = "_mediarelay._tcp.local.";
    public static final String PAIRING_PORT = "pairing_port";
    public static final String PROTOCOL_VERSION = "version";
    public static final String FINGERPRINT = "fingerprint";

    public ServiceAnnouncement {
        Objects.requireNonNull(instanceName, "instanceName must not be null");
        properties = Map.copyOf(properties);
    }

    /**
     * @param fingerprintHex hex SHA-256 fingerprint of the agent certificate
     */
    public static ServiceAnnouncement of(String user, String host, int relayPort, int pairingPort,
                                         String fingerprintHex) {
        Map<String, String> properties = new LinkedHashMap<>();
        properties.put(PAIRING_PORT, Integer.toString(pairingPort));
        properties.put(PROTOCOL_VERSION, Integer.toString(Protocol.VERSION));
        properties.put(FINGERPRINT, fingerprintHex);
        return new ServiceAnnouncement("Media relay on " + user + "@" + host, relayPort, properties);
    }

    /**
     * Announcement named after the current user and host.
     */
    public static ServiceAnnouncement forThisHost(int relayPort, int pairingPort, String fingerprintHex) {
        return of(System.getProperty("user.name", "user"), hostName(), relayPort, pairingPort, fingerprintHex);
    }

    static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String env = System.getenv("HOSTNAME");
            return env == null || env.isBlank() ? "localhost" : env;
        }
    }
}
