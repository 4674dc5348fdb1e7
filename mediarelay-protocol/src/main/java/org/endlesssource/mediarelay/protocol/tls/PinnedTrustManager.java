package org.endlesssource.mediarelay.protocol.tls;

import org.endlesssource.mediarelay.protocol.crypto.CryptoPrimitives;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.X509ExtendedTrustManager;
import java.net.Socket;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;

/**
 * Trusts an agent certificate by its fingerprint instead of by a CA chain.
 * Without a pin any certificate is accepted, which is only safe when the caller binds the
 * certificate's fingerprint into an authenticated transcript afterwards.
 */
final class PinnedTrustManager extends X509ExtendedTrustManager {
    private final byte[] pinnedFingerprint;

    PinnedTrustManager(byte[] pinnedFingerprint) {
        this.pinnedFingerprint = pinnedFingerprint == null ? null : pinnedFingerprint.clone();
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        if (chain == null || chain.length == 0) {
            throw new CertificateException("Agent presented no certificate");
        }
        if (pinnedFingerprint == null) {
            return;
        }
        if (!CryptoPrimitives.constantTimeEquals(pinnedFingerprint, AgentCertificate.fingerprint(chain[0]))) {
            throw new CertificateException("Agent certificate does not match the paired fingerprint");
        }
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket)
            throws CertificateException {
        checkServerTrusted(chain, authType);
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine)
            throws CertificateException {
        checkServerTrusted(chain, authType);
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        throw new CertificateException("Client certificates are not used");
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket)
            throws CertificateException {
        checkClientTrusted(chain, authType);
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine)
            throws CertificateException {
        checkClientTrusted(chain, authType);
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
        return new X509Certificate[0];
    }
}
