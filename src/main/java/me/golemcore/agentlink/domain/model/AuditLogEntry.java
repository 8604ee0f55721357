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
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Immutable record of one governance decision. A later outcome (completion or
 * rollback) is recorded by replacing the entry with a copy carrying the same
 * id.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AuditLogEntry {

    String id;
    Instant timestamp;
    String agentId;
    String action;
    ActionCategory category;
    AuditDecision decision;
    double confidence;
    double riskScore;
    String approver;
    String reason;
    AuditOutcome outcome;
    boolean rollbackAvailable;
    String rollbackId;
    boolean violation;
    List<String> violatedRuleIds;

    public AuditLogEntry withOutcome(AuditOutcome newOutcome) {
        return toBuilder().outcome(newOutcome).build();
    }
}
