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

@Data
@Builder
public class MessageAck {

    private String messageId;
    private String responderId;
    private AckStatus status;
    private Instant timestamp;
    private String error;

    public static MessageAck delivered(String messageId, String responderId, Instant timestamp) {
        return MessageAck.builder()
                .messageId(messageId)
                .responderId(responderId)
                .status(AckStatus.DELIVERED)
                .timestamp(timestamp)
                .build();
    }

    public static MessageAck read(String messageId, String responderId, Instant timestamp) {
        return MessageAck.builder()
                .messageId(messageId)
                .responderId(responderId)
                .status(AckStatus.READ)
                .timestamp(timestamp)
                .build();
    }

    public static MessageAck failed(String messageId, String responderId, Instant timestamp, String error) {
        return MessageAck.builder()
                .messageId(messageId)
                .responderId(responderId)
                .status(AckStatus.FAILED)
                .timestamp(timestamp)
                .error(error)
                .build();
    }
}
