package me.golemcore.agentlink.domain.service;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentlink.infrastructure.config.AgentLinkProperties;
import me.golemcore.agentlink.port.outbound.DomainEventPublisher;
import me.golemcore.agentlink.security.PayloadCipher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the lifetime of {@link AgentMessenger} instances, one per agent id, all
 * bound to the shared {@link ChannelRegistry}.
 *
 * <p>
 * Also runs the periodic sweep that expires stale pending messages.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentMessengerRegistry {

    private final ChannelRegistry channelRegistry;
    private final MessageSchemaValidator schemaValidator;
    private final PayloadCipher cipher;
    private final ObjectMapper objectMapper;
    private final DomainEventPublisher eventPublisher;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final AgentLinkProperties properties;

    private final Map<String, AgentMessenger> messengers = new ConcurrentHashMap<>();
    private ScheduledFuture<?> cleanupTask;

    @PostConstruct
    public void init() {
        cleanupTask = taskScheduler.scheduleAtFixedRate(this::cleanupExpired,
                properties.getMessaging().getCleanupInterval());
        log.info("[Messaging] Pending-message sweep every {}", properties.getMessaging().getCleanupInterval());
    }

    @PreDestroy
    public void shutdown() {
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
        }
        messengers.values().forEach(AgentMessenger::dispose);
        messengers.clear();
    }

    /**
     * Return the messenger of {@code agentId}, creating it on first use.
     */
    public AgentMessenger open(String agentId) {
        return messengers.computeIfAbsent(agentId, id -> {
            log.debug("[Messaging] Opening messenger for {}", id);
            return new AgentMessenger(id, channelRegistry, schemaValidator, cipher, objectMapper, eventPublisher,
                    taskScheduler, clock, properties.getMessaging());
        });
    }

    public Optional<AgentMessenger> get(String agentId) {
        return Optional.ofNullable(messengers.get(agentId));
    }

    public boolean close(String agentId) {
        AgentMessenger messenger = messengers.remove(agentId);
        if (messenger == null) {
            return false;
        }
        messenger.dispose();
        log.debug("[Messaging] Closed messenger for {}", agentId);
        return true;
    }

    public Set<String> getAgentIds() {
        return Set.copyOf(messengers.keySet());
    }

    /**
     * Expire stale pending messages across all messengers.
     *
     * @return total number of expired messages
     */
    public int cleanupExpired() {
        int total = 0;
        for (AgentMessenger messenger : messengers.values()) {
            try {
                total += messenger.cleanupExpired();
            } catch (RuntimeException e) {
                log.error("[Messaging] Cleanup failed for {}: {}", messenger.getAgentId(), e.getMessage(), e);
            }
        }
        return total;
    }
}
