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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A message addressed to every member of a channel except the sender.
 *
 * <p>
 * Encrypted channels carry one ciphertext per recipient in
 * {@code encryptedPayloads}, sealed with that recipient's pairwise key.
 */
@Data
@Builder
public class BroadcastMessage {

    private String id;
    private String channelId;
    private String senderId;
    private Object payload;
    @Builder.Default
    private Map<String, String> encryptedPayloads = new LinkedHashMap<>();
    private String type;
    @Builder.Default
    private MessagePriority priority = MessagePriority.NORMAL;
    @Builder.Default
    private List<String> recipients = new ArrayList<>();
    private Instant timestamp;
    private Instant expiresAt;
    private boolean encrypted;

    /**
     * The direct-message view of this broadcast for one recipient.
     */
    public AgentMessage toDirectMessage(String recipientId) {
        Object view = encrypted ? encryptedPayloads.get(recipientId) : payload;
        return AgentMessage.builder()
                .id(id)
                .channelId(channelId)
                .senderId(senderId)
                .recipientId(recipientId)
                .payload(view)
                .type(type)
                .priority(priority)
                .status(DeliveryStatus.SENT)
                .timestamp(timestamp)
                .expiresAt(expiresAt)
                .encrypted(encrypted)
                .build();
    }
}
