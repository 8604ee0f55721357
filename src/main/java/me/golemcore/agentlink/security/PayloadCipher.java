package me.golemcore.agentlink.security;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.KeyAgreement;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.Base64;

/**
 * Pairwise payload encryption between two agents.
 *
 * <p>
 * Scheme:
 * <ul>
 * <li>Key agreement: ECDH over P-256 (secp256r1), shared secret truncated to
 * 32 bytes and used as an AES-256 key</li>
 * <li>Cipher: AES-GCM with a fresh random 12-byte nonce and a 128-bit tag</li>
 * <li>Wire format: {@code base64(nonce(12) || tag(16) || ciphertext)}</li>
 * </ul>
 *
 * <p>
 * Both directions of a pair derive the same key, so the recipient decrypts
 * with its own private key and the sender's public key. Every failure surfaces
 * as {@link CryptoOperationException}.
 *
 * @since 1.0
 */
@Component
public class PayloadCipher {

    public static final String CURVE = "secp256r1";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_LENGTH = 12;
    private static final int TAG_LENGTH = 16;
    private static final int KEY_LENGTH = 32;

    private final SecureRandom secureRandom = new SecureRandom();

    public AgentKeyPair generateKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(new ECGenParameterSpec(CURVE), secureRandom);
            return new AgentKeyPair(generator.generateKeyPair());
        } catch (GeneralSecurityException e) {
            throw new CryptoOperationException("Key pair generation failed", e);
        }
    }

    /**
     * Encrypt {@code plaintext} for the owner of {@code peerPublicKey}.
     */
    public String encrypt(byte[] plaintext, AgentKeyPair own, String peerPublicKey) {
        byte[] key = deriveKey(own, peerPublicKey);
        try {
            byte[] nonce = new byte[NONCE_LENGTH];
            secureRandom.nextBytes(nonce);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            // JCA emits ciphertext || tag
            byte[] sealed = cipher.doFinal(plaintext);
            int ciphertextLength = sealed.length - TAG_LENGTH;

            byte[] wire = new byte[NONCE_LENGTH + sealed.length];
            System.arraycopy(nonce, 0, wire, 0, NONCE_LENGTH);
            System.arraycopy(sealed, ciphertextLength, wire, NONCE_LENGTH, TAG_LENGTH);
            System.arraycopy(sealed, 0, wire, NONCE_LENGTH + TAG_LENGTH, ciphertextLength);
            return Base64.getEncoder().encodeToString(wire);
        } catch (GeneralSecurityException e) {
            throw new CryptoOperationException("Encryption failed", e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    /**
     * Decrypt a wire string produced by the owner of {@code peerPublicKey}.
     */
    public byte[] decrypt(String wireText, AgentKeyPair own, String peerPublicKey) {
        byte[] wire;
        try {
            wire = Base64.getDecoder().decode(wireText);
        } catch (IllegalArgumentException e) {
            throw new CryptoOperationException("Ciphertext is not valid base64", e);
        }
        if (wire.length < NONCE_LENGTH + TAG_LENGTH) {
            throw new CryptoOperationException("Ciphertext too short");
        }
        byte[] key = deriveKey(own, peerPublicKey);
        try {
            int ciphertextLength = wire.length - NONCE_LENGTH - TAG_LENGTH;
            byte[] sealed = new byte[ciphertextLength + TAG_LENGTH];
            System.arraycopy(wire, NONCE_LENGTH + TAG_LENGTH, sealed, 0, ciphertextLength);
            System.arraycopy(wire, NONCE_LENGTH, sealed, ciphertextLength, TAG_LENGTH);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_LENGTH * 8, wire, 0, NONCE_LENGTH));
            return cipher.doFinal(sealed);
        } catch (GeneralSecurityException e) {
            throw new CryptoOperationException("Decryption failed", e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    private byte[] deriveKey(AgentKeyPair own, String peerPublicKey) {
        if (own == null) {
            throw new CryptoOperationException("Encryption not initialized");
        }
        try {
            KeyAgreement agreement = KeyAgreement.getInstance("ECDH");
            agreement.init(own.privateKey());
            agreement.doPhase(decodePublicKey(peerPublicKey), true);
            byte[] secret = agreement.generateSecret();
            byte[] key = Arrays.copyOf(secret, KEY_LENGTH);
            Arrays.fill(secret, (byte) 0);
            return key;
        } catch (GeneralSecurityException | IllegalStateException e) {
            throw new CryptoOperationException("Key agreement failed", e);
        }
    }

    private PublicKey decodePublicKey(String encoded) throws GeneralSecurityException {
        if (encoded == null || encoded.isBlank()) {
            throw new CryptoOperationException("Peer public key missing");
        }
        byte[] der;
        try {
            der = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new CryptoOperationException("Peer public key is not valid base64", e);
        }
        return KeyFactory.getInstance("EC").generatePublic(new X509EncodedKeySpec(der));
    }
}
