package org.endlesssource.mediarelay.protocol.crypto;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PairingKeysTest {

    @Test
    void bothSidesDeriveTheSameCode() throws InvalidKeyMaterialException {
        IdentityKeyPair identity = IdentityKeyPair.generate();
        try (EphemeralKeyPair agent = EphemeralKeyPair.generate();
             EphemeralKeyPair client = EphemeralKeyPair.generate()) {
            byte[] transcript = PairingTranscript.of("session-1", client.publicKey(), agent.publicKey(),
                    identity.publicKey(), new byte[32]);

            PairingKeys agentKeys = PairingKeys.derive(agent.agree(client.publicKey()), transcript, 6);
            PairingKeys clientKeys = PairingKeys.derive(client.agree(agent.publicKey()), transcript, 6);

            assertEquals(agentKeys.sas(), clientKeys.sas());
            assertEquals(6, agentKeys.sas().length());
            assertTrue(agentKeys.sas().chars().allMatch(Character::isDigit));
            assertArrayEquals(agentKeys.trustToken(), clientKeys.trustToken());
            assertTrue(agentKeys.verifyClientConfirmation(transcript, clientKeys.clientConfirmation(transcript)));
            assertTrue(clientKeys.verifyAgentConfirmation(transcript, agentKeys.agentConfirmation(transcript)));
        }
    }

    @Test
    void sameInputsAlwaysGiveSameCode() {
        byte[] secret = new byte[32];
        secret[0] = 7;
        byte[] transcript = PairingTranscript.of("s", new byte[32], new byte[32], new byte[32], new byte[32]);
        String first = PairingKeys.derive(secret, transcript, 4).sas();
        for (int i = 0; i < 10; i++) {
            assertEquals(first, PairingKeys.derive(secret.clone(), transcript.clone(), 4).sas());
        }
        assertEquals(4, first.length());
    }

    @Test
    void confirmationsAreRoleBound() {
        byte[] transcript = PairingTranscript.of("s", new byte[32], new byte[32], new byte[32], new byte[32]);
        PairingKeys keys = PairingKeys.derive(new byte[32], transcript, 6);
        byte[] clientMac = keys.clientConfirmation(transcript);
        assertFalse(keys.verifyAgentConfirmation(transcript, clientMac));
        assertFalse(keys.verifyClientConfirmation(transcript, null));

        byte[] otherTranscript = PairingTranscript.of("t", new byte[32], new byte[32], new byte[32], new byte[32]);
        assertFalse(keys.verifyClientConfirmation(otherTranscript, clientMac));
    }

    @Test
    void differentAgentCertificate_changesCode() throws InvalidKeyMaterialException {
        IdentityKeyPair identity = IdentityKeyPair.generate();
        try (EphemeralKeyPair agent = EphemeralKeyPair.generate();
             EphemeralKeyPair client = EphemeralKeyPair.generate()) {
            byte[] secret = agent.agree(client.publicKey());
            byte[] genuine = PairingTranscript.of("s", client.publicKey(), agent.publicKey(), identity.publicKey(),
                    CryptoPrimitives.sha256(new byte[]{1}));
            byte[] intercepted = PairingTranscript.of("s", client.publicKey(), agent.publicKey(), identity.publicKey(),
                    CryptoPrimitives.sha256(new byte[]{2}));

            PairingKeys agentKeys = PairingKeys.derive(secret, genuine, 8);
            PairingKeys clientKeys = PairingKeys.derive(secret, intercepted, 8);

            assertNotEquals(agentKeys.sas(), clientKeys.sas());
            assertFalse(agentKeys.verifyClientConfirmation(genuine, clientKeys.clientConfirmation(intercepted)));
        }
    }

    @Test
    void rejectsOutOfRangeDigits() {
        assertThrows(IllegalArgumentException.class, () -> PairingKeys.derive(new byte[32], new byte[1], 3));
        assertThrows(IllegalArgumentException.class, () -> PairingKeys.derive(new byte[32], new byte[1], 9));
    }

    @Test
    void closedKeyPairCannotAgree() {
        EphemeralKeyPair pair = EphemeralKeyPair.generate();
        pair.close();
        assertTrue(pair.isDestroyed());
        assertThrows(IllegalStateException.class, () -> pair.agree(new byte[32]));
    }

    @Test
    void agreementRejectsMalformedKeys() {
        try (EphemeralKeyPair pair = EphemeralKeyPair.generate()) {
            assertThrows(InvalidKeyMaterialException.class, () -> pair.agree(new byte[5]));
            assertThrows(InvalidKeyMaterialException.class, () -> pair.agree(null));
            // The all-zero point yields an all-zero secret.
            assertThrows(InvalidKeyMaterialException.class, () -> pair.agree(new byte[32]));
        }
    }

    @Test
    void hkdfMatchesRfc5869TestCase1() {
        byte[] ikm = new byte[22];
        java.util.Arrays.fill(ikm, (byte) 0x0b);
        byte[] salt = org.bouncycastle.util.encoders.Hex.decode("000102030405060708090a0b0c");
        byte[] info = org.bouncycastle.util.encoders.Hex.decode("f0f1f2f3f4f5f6f7f8f9");
        byte[] okm = CryptoPrimitives.hkdfExpand(CryptoPrimitives.hkdfExtract(salt, ikm), info, 42);
        assertEquals("3cb25f25faacd57a90434f64d0362f2a2d2d0a90cf1a5a4c5db02d56ecc4c5bf34007208d5b887185865",
                org.bouncycastle.util.encoders.Hex.toHexString(okm));
    }
}
