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

/**
 * Audit query filter. Unset fields match everything; results are newest first
 * with {@code offset} and {@code limit} applied last.
 */
@Data
@Builder
public class AuditLogFilter {

    private String agentId;
    private String action;
    private AuditDecision decision;
    private Instant from;
    private Instant to;
    private Integer offset;
    private Integer limit;

    public boolean matches(AuditLogEntry entry) {
        if (agentId != null && !agentId.equals(entry.getAgentId())) {
            return false;
        }
        if (action != null && !action.equals(entry.getAction())) {
            return false;
        }
        if (decision != null && decision != entry.getDecision()) {
            return false;
        }
        Instant ts = entry.getTimestamp();
        if (from != null && (ts == null || ts.isBefore(from))) {
            return false;
        }
        return to == null || (ts != null && !ts.isAfter(to));
    }
}
