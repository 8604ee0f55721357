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
import java.util.List;
import java.util.Map;

/**
 * Operator approval request raised for an action that may not run
 * autonomously.
 *
 * <p>
 * Created {@link ApprovalStatus#PENDING}; once a terminal status is set the
 * governance service never touches the request again. A {@code null}
 * {@code expiresAt} means the request waits for an operator indefinitely.
 */
@Data
@Builder
public class ApprovalRequest {

    private String id;
    private Instant timestamp;
    private String agentId;
    private String action;
    private ActionCategory category;
    private String description;
    private double confidence;
    private double riskScore;
    private Map<String, Object> context;
    @Builder.Default
    private ApprovalStatus status = ApprovalStatus.PENDING;
    private String approver;
    private Instant approvalTime;
    private Instant expiresAt;

    private EscalationLevel escalationLevel;
    private String reason;
    private boolean requiresReason;
    private List<String> violatedRuleIds;

    public boolean isPending() {
        return status == ApprovalStatus.PENDING;
    }

    public boolean isOverdue(Instant now) {
        return isPending() && expiresAt != null && !expiresAt.isAfter(now);
    }
}
