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
 * Side-effect free verdict for an action intent.
 */
@Data
@Builder
public class ActionEvaluation {

    private boolean approved;
    private String reason;
    private EscalationLevel escalationLevel;
    private boolean violation;
    private List<ConstitutionalRule> violations;
    private double effectiveConfidence;

    public static ActionEvaluation approve(String reason, double effectiveConfidence) {
        return ActionEvaluation.builder()
                .approved(true)
                .reason(reason)
                .escalationLevel(EscalationLevel.NONE)
                .violations(List.of())
                .effectiveConfidence(effectiveConfidence)
                .build();
    }

    public static ActionEvaluation requireApproval(String reason, EscalationLevel level, double effectiveConfidence) {
        return ActionEvaluation.builder()
                .approved(false)
                .reason(reason)
                .escalationLevel(level)
                .violations(List.of())
                .effectiveConfidence(effectiveConfidence)
                .build();
    }

    public static ActionEvaluation violation(ConstitutionalVerdict verdict, double confidence) {
        String ids = String.join(", ", verdict.violatedRuleIds());
        return ActionEvaluation.builder()
                .approved(false)
                .reason("Constitutional violation: " + ids)
                .escalationLevel(verdict.escalationLevel())
                .violation(true)
                .violations(verdict.violations())
                .effectiveConfidence(confidence)
                .build();
    }
}
