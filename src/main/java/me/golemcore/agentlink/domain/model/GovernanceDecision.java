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

import java.util.List;

/**
 * Committed result of an action request: either approved to run now, or
 * parked behind {@code approvalRequest}.
 */
@Data
@Builder
public class GovernanceDecision {

    private String agentId;
    private String action;
    private boolean approved;
    private String reason;
    private EscalationLevel escalationLevel;
    private boolean violation;
    private List<String> violatedRuleIds;
    private ApprovalRequest approvalRequest;
    private String checkpointId;
    private String auditEntryId;

    public static GovernanceDecision notAttached(String agentId, String action) {
        return GovernanceDecision.builder()
                .agentId(agentId)
                .action(action)
                .approved(false)
                .reason("Governance not attached")
                .escalationLevel(EscalationLevel.HARD_BLOCK)
                .violatedRuleIds(List.of())
                .build();
    }
}
