package me.golemcore.agentlink.domain.service;

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

import java.time.Instant;
import java.util.UUID;

/**
 * Identifier factory. Ids embed the owner and creation time and end with a
 * random suffix, e.g. {@code msg_agent-1_1718000000000_3f9a1c2e}.
 */
public final class IdGenerator {

    private IdGenerator() {
    }

    public static String messageId(String senderId, Instant now) {
        return "msg_" + senderId + "_" + now.toEpochMilli() + "_" + suffix();
    }

    public static String channelId(String ownerId, Instant now) {
        return "ch_" + ownerId + "_" + now.toEpochMilli() + "_" + suffix();
    }

    public static String prefixed(String prefix, Instant now) {
        return prefix + "_" + now.toEpochMilli() + "_" + suffix();
    }

    private static String suffix() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
