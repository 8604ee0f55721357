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

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Per-agent governance configuration supplied when governance is attached.
 *
 * <p>
 * Builder defaults reproduce the stock policy: supervised mode, confidence
 * threshold 0.8, risk threshold 0.5, financial/admin/delete always escalated,
 * read always approved, a ten minute approval timeout and the two stock
 * escalation rules from {@link #defaultEscalationRules()}.
 */
@Data
@Builder(toBuilder = true)
public class GovernancePolicy {

    @Builder.Default
    private GovernanceMode mode = GovernanceMode.SUPERVISED;
    @Builder.Default
    private double confidenceThreshold = 0.8;
    @Builder.Default
    private double riskThreshold = 0.5;
    @Builder.Default
    private Set<ActionCategory> alwaysApproveCategories = EnumSet.of(ActionCategory.FINANCIAL,
            ActionCategory.ADMIN, ActionCategory.DELETE);
    @Builder.Default
    private Set<ActionCategory> neverApproveCategories = EnumSet.of(ActionCategory.READ);
    @Builder.Default
    private List<EscalationRule> escalationRules = defaultEscalationRules();
    @Builder.Default
    private Duration approvalTimeout = Duration.ofMinutes(10);
    private boolean autoApproveOnTimeout;
    @Builder.Default
    private int maxAutonomousActions = 100;
    @Builder.Default
    private boolean auditLogEnabled = true;
    @Builder.Default
    private boolean rollbackEnabled = true;
    @Builder.Default
    private Duration rollbackRetention = Duration.ofHours(24);
    @Builder.Default
    private List<NotificationChannel> notificationChannels = new ArrayList<>();
    @Builder.Default
    private List<String> approvedOperators = new ArrayList<>();
    @Builder.Default
    private List<ConstitutionalRule> constitution = new ArrayList<>();

    /**
     * An empty allowlist admits every operator.
     */
    public boolean isOperatorApproved(String operator) {
        if (approvedOperators == null || approvedOperators.isEmpty()) {
            return true;
        }
        return operator != null && approvedOperators.contains(operator);
    }

    public static List<EscalationRule> defaultEscalationRules() {
        List<EscalationRule> rules = new ArrayList<>();
        rules.add(EscalationRule.builder()
                .condition(EscalationCondition.confidenceBelow(0.5))
                .level(EscalationLevel.HARD_BLOCK)
                .notifyChannels(List.of(NotificationChannel.EMAIL, NotificationChannel.PUSH))
                .timeout(Duration.ofMinutes(5))
                .requiresReason(true)
                .build());
        rules.add(EscalationRule.builder()
                .condition(EscalationCondition.riskAbove(0.8))
                .level(EscalationLevel.EMERGENCY_STOP)
                .notifyChannels(List.of(NotificationChannel.EMAIL, NotificationChannel.PUSH,
                        NotificationChannel.SMS))
                .timeout(Duration.ZERO)
                .requiresReason(true)
                .build());
        return rules;
    }
}
