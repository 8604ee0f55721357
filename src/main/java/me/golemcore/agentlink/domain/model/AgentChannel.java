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
import java.util.List;

/**
 * A named group of agents exchanging messages under one encryption and schema
 * policy. The owner is always the first participant.
 */
@Data
@Builder(toBuilder = true)
public class AgentChannel {

    private String id;
    private String name;
    @Builder.Default
    private List<String> participants = new ArrayList<>();
    private String ownerId;
    private EncryptionMode encryption;
    private JsonSchema messageSchema;
    private ChannelConfig config;
    private boolean open;
    private Instant createdAt;

    public boolean hasParticipant(String agentId) {
        return participants != null && participants.contains(agentId);
    }

    /**
     * Detached copy safe to hand out of the registry.
     */
    public AgentChannel copy() {
        return toBuilder()
                .participants(new ArrayList<>(participants))
                .config(config != null ? config.toBuilder().build() : null)
                .build();
    }
}
