package me.golemcore.agentlink.port.outbound;

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

import me.golemcore.agentlink.domain.model.AuditLogEntry;
import me.golemcore.agentlink.domain.model.AuditLogFilter;
import me.golemcore.agentlink.domain.model.RollbackCheckpoint;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the durable governance audit trail.
 */
public interface AuditPort {

    /**
     * Store an entry. An entry with an already known id replaces the earlier
     * version.
     */
    CompletableFuture<Void> persist(AuditLogEntry entry);

    /**
     * Archive the checkpoints of a detached session.
     */
    CompletableFuture<Void> archiveCheckpoints(String agentId, List<RollbackCheckpoint> checkpoints);

    List<AuditLogEntry> query(AuditLogFilter filter);
}
