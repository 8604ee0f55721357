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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;
import me.golemcore.agentlink.domain.model.ApprovalRequest;
import me.golemcore.agentlink.domain.model.NotificationPriority;

import java.time.Instant;

/**
 * Provider-neutral operator alert built from an approval request.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationPayload {

    private String title;
    private String message;
    private NotificationPriority priority;
    private ApprovalRequest approval;
    private String actionUrl;
    private Instant expiresAt;
}
