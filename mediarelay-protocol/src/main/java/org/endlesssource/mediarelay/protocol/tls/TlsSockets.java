package org.endlesssource.mediarelay.protocol.tls;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.SSLServerSocket;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.TrustManager;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.security.GeneralSecurityException;
import java.security.cert.Certificate;

/**
 * TLS 1.3 sockets for both ports. The agent authenticates with its {@link AgentCertificate}; clients
 * authenticate inside the protocol, never with certificates.
 */
public final class TlsSockets {
    public static final String PROTOCOL = "TLSv1.3";
    private static final String[] PROTOCOLS = {PROTOCOL};

    private TlsSockets() {
    }

    /**
     * Bind a listening socket presenting {@code certificate}.
     */
    public static SSLServerSocket bind(AgentCertificate certificate, InetSocketAddress address) throws IOException {
        SSLServerSocket socket = (SSLServerSocket) certificate.serverContext().getServerSocketFactory()
                .createServerSocket();
        socket.setEnabledProtocols(PROTOCOLS);
        socket.setNeedClientAuth(false);
        socket.setReuseAddress(true);
        socket.bind(address);
        return socket;
    }

    /**
     * Connect and complete the TLS handshake.
     *
     * @param pinnedFingerprint fingerprint the agent certificate must have, or null to accept any
     *                          certificate and read it from {@link #peerFingerprint(SSLSocket)}
     * @throws javax.net.ssl.SSLHandshakeException when the agent certificate does not match the pin
     */
    public static SSLSocket connect(String host, int port, byte[] pinnedFingerprint, int timeoutMillis)
            throws IOException {
        SSLSocket socket = (SSLSocket) clientContext(pinnedFingerprint).getSocketFactory().createSocket();
        try {
            socket.setEnabledProtocols(PROTOCOLS);
            socket.connect(new InetSocketAddress(host, port), timeoutMillis);
            socket.setSoTimeout(timeoutMillis);
            socket.startHandshake();
            return socket;
        } catch (IOException | RuntimeException e) {
            try {
                socket.close();
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
    }

    /**
     * Fingerprint of the certificate the agent presented on {@code socket}.
     */
    public static byte[] peerFingerprint(SSLSocket socket) throws SSLPeerUnverifiedException {
        Certificate[] chain = socket.getSession().getPeerCertificates();
        return AgentCertificate.fingerprint(chain[0]);
    }

    static SSLContext clientContext(byte[] pinnedFingerprint) {
        try {
            SSLContext context = SSLContext.getInstance(PROTOCOL);
            context.init(null, new TrustManager[]{new PinnedTrustManager(pinnedFingerprint)}, null);
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(PROTOCOL + " is not available", e);
        }
    }
}
