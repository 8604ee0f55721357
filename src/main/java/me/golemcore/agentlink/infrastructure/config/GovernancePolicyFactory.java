package me.golemcore.agentlink.infrastructure.config;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.agentlink.domain.model.ActionCategory;
import me.golemcore.agentlink.domain.model.GovernancePolicy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Builds governance policies from the {@code agentlink.governance.*} defaults.
 */
@Component
@RequiredArgsConstructor
public class GovernancePolicyFactory {

    private final AgentLinkProperties properties;

    public GovernancePolicy defaultPolicy() {
        AgentLinkProperties.GovernanceProperties governance = properties.getGovernance();
        GovernancePolicy.GovernancePolicyBuilder builder = GovernancePolicy.builder()
                .mode(governance.getMode())
                .confidenceThreshold(governance.getConfidenceThreshold())
                .riskThreshold(governance.getRiskThreshold())
                .alwaysApproveCategories(toSet(governance.getAlwaysApproveCategories()))
                .neverApproveCategories(toSet(governance.getNeverApproveCategories()))
                .approvalTimeout(governance.getApprovalTimeout())
                .autoApproveOnTimeout(governance.isAutoApproveOnTimeout())
                .maxAutonomousActions(governance.getMaxAutonomousActions())
                .auditLogEnabled(governance.isAuditLogEnabled())
                .rollbackEnabled(governance.isRollbackEnabled())
                .rollbackRetention(governance.getRollbackRetention())
                .notificationChannels(new ArrayList<>(governance.getNotificationChannels()))
                .approvedOperators(new ArrayList<>(governance.getApprovedOperators()));
        if (!governance.isDefaultEscalationRules()) {
            builder.escalationRules(new ArrayList<>());
        }
        return builder.build();
    }

    private static Set<ActionCategory> toSet(Collection<ActionCategory> categories) {
        if (categories == null || categories.isEmpty()) {
            return EnumSet.noneOf(ActionCategory.class);
        }
        return EnumSet.copyOf(categories);
    }
}
