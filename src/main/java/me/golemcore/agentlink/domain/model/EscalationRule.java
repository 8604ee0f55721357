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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;

/**
 * Policy rule raising the escalation level when its condition matches. Only
 * rules at {@link EscalationLevel#HARD_BLOCK} or above force an approval on
 * their own; every matching rule contributes its notification channels and
 * reason requirement to an approval request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationRule {

    private EscalationCondition condition;
    private EscalationLevel level;
    private List<NotificationChannel> notifyChannels;
    private Duration timeout;
    private boolean autoApproveOnTimeout;
    private boolean requiresReason;

    public boolean forcesApproval() {
        return level != null && level.isAtLeast(EscalationLevel.HARD_BLOCK);
    }
}
