package org.endlesssource.mediarelay.protocol.crypto;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.Arrays;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

/**
 * Low-level primitives used by pairing and relay authentication.
 * Wraps BouncyCastle HKDF, HMAC and SHA-256.
 */
public final class CryptoPrimitives {
    public static final int HASH_LENGTH = 32;

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final byte[] EMPTY_SALT = new byte[HASH_LENGTH];

    private CryptoPrimitives() {
    }

    /**
     * HKDF-Extract(salt, ikm) = HMAC-SHA256(salt, ikm). Empty salt uses 32 zero bytes.
     */
    public static byte[] hkdfExtract(byte[] salt, byte[] ikm) {
        byte[] actualSalt = (salt == null || salt.length == 0) ? EMPTY_SALT : salt;
        return hmacSha256(actualSalt, ikm);
    }

    /**
     * HKDF-Expand(prk, info, len) per RFC 5869 section 2.3.
     */
    public static byte[] hkdfExpand(byte[] prk, byte[] info, int len) {
        if (len <= 0 || len > 255 * HASH_LENGTH) {
            throw new IllegalArgumentException("Invalid HKDF output length " + len);
        }
        HMac hmac = new HMac(new SHA256Digest());
        hmac.init(new KeyParameter(prk));
        byte[] result = new byte[len];
        byte[] t = new byte[0];
        int copied = 0;
        int counter = 1;
        while (copied < len) {
            hmac.reset();
            hmac.update(t, 0, t.length);
            hmac.update(info, 0, info.length);
            hmac.update((byte) counter);
            t = new byte[HASH_LENGTH];
            hmac.doFinal(t, 0);
            int toCopy = Math.min(len - copied, HASH_LENGTH);
            System.arraycopy(t, 0, result, copied, toCopy);
            copied += toCopy;
            counter++;
        }
        return result;
    }

    public static byte[] hkdfExpand(byte[] prk, String label, int len) {
        return hkdfExpand(prk, label.getBytes(StandardCharsets.US_ASCII), len);
    }

    public static byte[] hmacSha256(byte[] key, byte[] data) {
        HMac hmac = new HMac(new SHA256Digest());
        hmac.init(new KeyParameter(key));
        hmac.update(data, 0, data.length);
        byte[] out = new byte[HASH_LENGTH];
        hmac.doFinal(out, 0);
        return out;
    }

    public static byte[] sha256(byte[] data) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(data, 0, data.length);
        byte[] out = new byte[HASH_LENGTH];
        digest.doFinal(out, 0);
        return out;
    }

    public static byte[] randomBytes(int len) {
        byte[] out = new byte[len];
        RANDOM.nextBytes(out);
        return out;
    }

    /**
     * Constant-time comparison; false when either side is null.
     */
    public static boolean constantTimeEquals(byte[] expected, byte[] actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return Arrays.constantTimeAreEqual(expected, actual);
    }

    /**
     * Concatenate fields, each prefixed with its two byte big-endian length, so that no two
     * different field lists encode to the same bytes.
     */
    public static byte[] lengthPrefixed(byte[]... fields) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] field : fields) {
            byte[] value = field == null ? new byte[0] : field;
            if (value.length > 0xFFFF) {
                throw new IllegalArgumentException("Field too long: " + value.length);
            }
            out.write((value.length >>> 8) & 0xFF);
            out.write(value.length & 0xFF);
            out.write(value, 0, value.length);
        }
        return out.toByteArray();
    }

    public static byte[] utf8(String value) {
        return value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8);
    }

    public static void wipe(byte[] secret) {
        if (secret != null) {
            java.util.Arrays.fill(secret, (byte) 0);
        }
    }
}
