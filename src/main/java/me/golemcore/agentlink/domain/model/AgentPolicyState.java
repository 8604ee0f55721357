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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Governance session of one agent: mode, approval requests, audit trail,
 * rollback checkpoints and the adaptive trust table. Lives from attach to
 * detach.
 */
@Data
@Builder
public class AgentPolicyState {

    private String agentId;
    private GovernanceMode currentMode;
    private GovernancePolicy policy;
    @Builder.Default
    private List<ApprovalRequest> pendingApprovals = new ArrayList<>();
    @Builder.Default
    private List<AuditLogEntry> auditLog = new ArrayList<>();
    @Builder.Default
    private List<RollbackCheckpoint> rollbackCheckpoints = new ArrayList<>();
    private int actionCountThisSession;
    private Instant lastEscalationTime;
    private Instant sessionStartTime;
    @Builder.Default
    private Map<String, TrustRecord> trust = new LinkedHashMap<>();

    public Optional<ApprovalRequest> findApproval(String requestId) {
        return pendingApprovals.stream().filter(r -> r.getId().equals(requestId)).findFirst();
    }

    public Optional<RollbackCheckpoint> findCheckpoint(String checkpointId) {
        return rollbackCheckpoints.stream().filter(c -> c.getId().equals(checkpointId)).findFirst();
    }

    public List<ApprovalRequest> openApprovals() {
        return pendingApprovals.stream().filter(ApprovalRequest::isPending).toList();
    }

    /**
     * Replaces the audit entry linked to a checkpoint. Returns the new entry or
     * {@code null} when nothing is linked.
     */
    public AuditLogEntry replaceLinkedAuditEntry(String checkpointId, AuditOutcome outcome) {
        for (int i = 0; i < auditLog.size(); i++) {
            AuditLogEntry entry = auditLog.get(i);
            if (checkpointId.equals(entry.getRollbackId())) {
                AuditLogEntry updated = entry.withOutcome(outcome);
                auditLog.set(i, updated);
                return updated;
            }
        }
        return null;
    }
}
