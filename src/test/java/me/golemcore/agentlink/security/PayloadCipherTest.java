package me.golemcore.agentlink.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PayloadCipherTest {

    private static final byte[] PLAINTEXT = "{\"task\":\"deploy\"}".getBytes(StandardCharsets.UTF_8);

    private PayloadCipher cipher;
    private AgentKeyPair alice;
    private AgentKeyPair bob;

    @BeforeEach
    void setUp() {
        cipher = new PayloadCipher();
        alice = cipher.generateKeyPair();
        bob = cipher.generateKeyPair();
    }

    @Test
    void shouldRoundTripBetweenPeers() {
        String wire = cipher.encrypt(PLAINTEXT, alice, bob.getPublicKey());

        byte[] decrypted = cipher.decrypt(wire, bob, alice.getPublicKey());

        assertArrayEquals(PLAINTEXT, decrypted);
    }

    @Test
    void shouldUseNonceTagCiphertextLayout() {
        String wire = cipher.encrypt(PLAINTEXT, alice, bob.getPublicKey());

        byte[] raw = Base64.getDecoder().decode(wire);

        assertEquals(12 + 16 + PLAINTEXT.length, raw.length);
    }

    @Test
    void shouldUseFreshNonceEachTime() {
        String first = cipher.encrypt(PLAINTEXT, alice, bob.getPublicKey());
        String second = cipher.encrypt(PLAINTEXT, alice, bob.getPublicKey());

        assertNotEquals(first, second);
    }

    @Test
    void shouldExposeX509PublicKeyOnly() {
        byte[] der = Base64.getDecoder().decode(alice.getPublicKey());

        assertTrue(der.length > 64);
        assertEquals("EC", alice.getAlgorithm());
        assertFalse(alice.toString().contains(alice.getPublicKey()));
    }

    @Test
    void shouldRejectTamperedCiphertext() {
        byte[] raw = Base64.getDecoder().decode(cipher.encrypt(PLAINTEXT, alice, bob.getPublicKey()));
        raw[raw.length - 1] ^= 0x01;
        String tampered = Base64.getEncoder().encodeToString(raw);

        assertThrows(CryptoOperationException.class, () -> cipher.decrypt(tampered, bob, alice.getPublicKey()));
    }

    @Test
    void shouldRejectWrongPeer() {
        AgentKeyPair eve = cipher.generateKeyPair();
        String wire = cipher.encrypt(PLAINTEXT, alice, bob.getPublicKey());

        assertThrows(CryptoOperationException.class, () -> cipher.decrypt(wire, eve, alice.getPublicKey()));
    }

    @Test
    void shouldRejectMalformedInput() {
        assertThrows(CryptoOperationException.class, () -> cipher.decrypt("not base64!", bob, alice.getPublicKey()));
        assertThrows(CryptoOperationException.class, () -> cipher.decrypt("AAAA", bob, alice.getPublicKey()));
        assertThrows(CryptoOperationException.class, () -> cipher.encrypt(PLAINTEXT, alice, "garbage"));
        assertThrows(CryptoOperationException.class, () -> cipher.encrypt(PLAINTEXT, null, bob.getPublicKey()));
    }
}
