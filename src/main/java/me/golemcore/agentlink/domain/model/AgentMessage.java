package me.golemcore.agentlink.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A direct message between two channel members.
 *
 * <p>
 * On encrypted channels {@code payload} holds the base64 wire string until the
 * recipient decrypts it; handlers always see the decrypted value.
 */
@Data
@Builder(toBuilder = true)
public class AgentMessage {

    private String id;
    private String channelId;
    private String senderId;
    private String recipientId;
    private Object payload;
    private String type;
    @Builder.Default
    private MessagePriority priority = MessagePriority.NORMAL;
    @Builder.Default
    private DeliveryStatus status = DeliveryStatus.PENDING;
    private Instant timestamp;
    private Instant expiresAt;
    private boolean encrypted;

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
