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

import java.security.KeyPair;
import java.security.PrivateKey;
import java.util.Base64;

/**
 * An agent's EC P-256 key pair. Only the public half is exposed outside this
 * package; the private key is reachable solely through {@link PayloadCipher}.
 */
public final class AgentKeyPair {

    private final KeyPair keyPair;
    private final String publicKey;

    AgentKeyPair(KeyPair keyPair) {
        this.keyPair = keyPair;
        this.publicKey = Base64.getEncoder().encodeToString(keyPair.getPublic().getEncoded());
    }

    /**
     * Base64 of the X.509 SubjectPublicKeyInfo encoding.
     */
    public String getPublicKey() {
        return publicKey;
    }

    public String getAlgorithm() {
        return keyPair.getPublic().getAlgorithm();
    }

    PrivateKey privateKey() {
        return keyPair.getPrivate();
    }

    @Override
    public String toString() {
        return "AgentKeyPair{algorithm=" + getAlgorithm() + "}";
    }
}
