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
public class NotificationResult {

    private NotificationChannel channel;
    private boolean success;
    private String messageId;
    private String error;
    private Instant timestamp;

    public static NotificationResult success(NotificationChannel channel, String messageId, Instant timestamp) {
        return NotificationResult.builder()
                .channel(channel)
                .success(true)
                .messageId(messageId)
                .timestamp(timestamp)
                .build();
    }

    public static NotificationResult failure(NotificationChannel channel, String error, Instant timestamp) {
        return NotificationResult.builder()
                .channel(channel)
                .success(false)
                .error(error)
                .timestamp(timestamp)
                .build();
    }
}
