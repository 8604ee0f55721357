package me.golemcore.agentlink.adapter.outbound.audit;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentlink.domain.model.AuditLogEntry;
import me.golemcore.agentlink.domain.model.AuditLogFilter;
import me.golemcore.agentlink.domain.model.RollbackCheckpoint;
import me.golemcore.agentlink.infrastructure.config.AgentLinkProperties;
import me.golemcore.agentlink.port.outbound.AuditPort;
import me.golemcore.agentlink.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Audit trail kept in memory and appended to JSONL files under
 * {@code <audit dir>/<agentId>/<yyyy-MM-dd>.jsonl}.
 *
 * <p>
 * A changed entry is appended again with the same id; appends to one file are
 * chained in call order, and on startup later lines win, so the index always
 * reflects the latest version of each entry.
 * Detached sessions archive their checkpoints to
 * {@code <audit dir>/checkpoints/<agentId>.json}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageAuditAdapter implements AuditPort {

    private static final String LOG_PREFIX = "[Audit]";
    private static final String JSONL_EXTENSION = ".jsonl";
    private static final String CHECKPOINTS_DIR = "checkpoints/";
    private static final String NEWLINE = "\n";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final AgentLinkProperties properties;

    private final Map<String, AuditLogEntry> entries = new ConcurrentHashMap<>();
    // Tail of the append chain per file; lines reach a file in persist() order.
    private final Map<String, CompletableFuture<Void>> pendingAppends = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        if (!properties.getAudit().isPersistEnabled()) {
            return;
        }
        try {
            List<String> files = storagePort.listObjects(directory(), "").join();
            int loaded = 0;
            for (String file : files) {
                if (file.endsWith(JSONL_EXTENSION)) {
                    loaded += loadFile(file);
                }
            }
            log.info("{} Loaded {} audit entries", LOG_PREFIX, loaded);
        } catch (RuntimeException e) {
            log.warn("{} Failed to load persisted audit entries: {}", LOG_PREFIX, e.getMessage());
        }
    }

    private int loadFile(String file) {
        String content = storagePort.getText(directory(), file).join();
        if (content == null || content.isBlank()) {
            return 0;
        }
        int loaded = 0;
        for (String line : content.split(NEWLINE)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                AuditLogEntry entry = objectMapper.readValue(line, AuditLogEntry.class);
                entries.put(entry.getId(), entry);
                loaded++;
            } catch (JsonProcessingException e) {
                log.warn("{} Skipping malformed line in {}: {}", LOG_PREFIX, file, e.getOriginalMessage());
            }
        }
        return loaded;
    }

    @Override
    public CompletableFuture<Void> persist(AuditLogEntry entry) {
        entries.put(entry.getId(), entry);
        if (!properties.getAudit().isPersistEnabled()) {
            return CompletableFuture.completedFuture(null);
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(entry) + NEWLINE;
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }
        return appendInOrder(fileFor(entry), json);
    }

    private CompletableFuture<Void> appendInOrder(String file, String line) {
        CompletableFuture<Void> append = pendingAppends.compute(file, (key, previous) -> {
            if (previous == null) {
                return storagePort.appendText(directory(), key, line);
            }
            // A failed earlier append must not block later lines.
            return previous.exceptionally(error -> null)
                    .thenCompose(ignored -> storagePort.appendText(directory(), key, line));
        });
        append.whenComplete((ignored, error) -> pendingAppends.remove(file, append));
        return append;
    }

    @Override
    public CompletableFuture<Void> archiveCheckpoints(String agentId, List<RollbackCheckpoint> checkpoints) {
        if (!properties.getAudit().isPersistEnabled()) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(checkpoints);
            log.debug("{} Archiving {} checkpoints of {}", LOG_PREFIX, checkpoints.size(), agentId);
            return storagePort.putText(directory(), CHECKPOINTS_DIR + agentId + ".json", json);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public List<AuditLogEntry> query(AuditLogFilter filter) {
        AuditLogFilter effective = filter != null ? filter : AuditLogFilter.builder().build();
        Stream<AuditLogEntry> matches = entries.values().stream()
                .filter(effective::matches)
                .sorted(Comparator.comparing(AuditLogEntry::getTimestamp,
                        Comparator.nullsLast(Comparator.reverseOrder())));
        if (effective.getOffset() != null && effective.getOffset() > 0) {
            matches = matches.skip(effective.getOffset());
        }
        if (effective.getLimit() != null && effective.getLimit() >= 0) {
            matches = matches.limit(effective.getLimit());
        }
        return matches.toList();
    }

    private String fileFor(AuditLogEntry entry) {
        Instant timestamp = entry.getTimestamp() != null ? entry.getTimestamp() : Instant.EPOCH;
        LocalDate day = LocalDate.ofInstant(timestamp, ZoneOffset.UTC);
        return entry.getAgentId() + "/" + day + JSONL_EXTENSION;
    }

    private String directory() {
        return properties.getAudit().getDirectory();
    }
}
