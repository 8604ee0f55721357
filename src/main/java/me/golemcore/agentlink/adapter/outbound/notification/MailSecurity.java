package me.golemcore.agentlink.adapter.outbound.notification;

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

import java.util.Locale;

/**
 * Connection security modes for SMTP connections.
 */
public enum MailSecurity {

    /** Implicit SSL/TLS on a dedicated port (e.g. 465). */
    SSL,

    /** STARTTLS upgrade on a plain-text port (e.g. 587). */
    STARTTLS,

    /** No encryption (not recommended). */
    NONE;

    /**
     * Parses a security mode from a string value (case-insensitive). Blank
     * values select {@link #STARTTLS}.
     *
     * @throws IllegalArgumentException
     *             if the value is not recognized
     */
    public static MailSecurity fromString(String value) {
        if (value == null || value.isBlank()) {
            return STARTTLS;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
