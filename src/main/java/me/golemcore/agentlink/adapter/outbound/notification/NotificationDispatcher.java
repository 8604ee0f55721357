package me.golemcore.agentlink.adapter.outbound.notification;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentlink.domain.model.ActionCategory;
import me.golemcore.agentlink.domain.model.ApprovalRequest;
import me.golemcore.agentlink.domain.model.NotificationChannel;
import me.golemcore.agentlink.domain.model.NotificationPriority;
import me.golemcore.agentlink.domain.model.NotificationResult;
import me.golemcore.agentlink.infrastructure.config.AgentLinkProperties;
import me.golemcore.agentlink.port.outbound.NotificationPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * {@link NotificationPort} fan-out over the registered
 * {@link NotificationProvider}s.
 *
 * <p>
 * Channels without a provider (SMS, push) or without configuration report an
 * unsuccessful result; a provider that throws is reported the same way.
 */
@Component
@Slf4j
public class NotificationDispatcher implements NotificationPort {

    private final Map<NotificationChannel, NotificationProvider> providers = new EnumMap<>(
            NotificationChannel.class);
    private final AgentLinkProperties properties;
    private final Clock clock;

    public NotificationDispatcher(List<NotificationProvider> providers, AgentLinkProperties properties,
            Clock clock) {
        providers.forEach(provider -> this.providers.put(provider.getChannel(), provider));
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<List<NotificationResult>> notify(ApprovalRequest request,
            Collection<NotificationChannel> channels) {
        NotificationPayload payload = buildPayload(request);
        List<CompletableFuture<NotificationResult>> futures = new ArrayList<>();
        for (NotificationChannel channel : channels) {
            futures.add(sendVia(channel, payload));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<NotificationResult> results = futures.stream().map(CompletableFuture::join).toList();
                    long delivered = results.stream().filter(NotificationResult::isSuccess).count();
                    log.info("[Notify] Sent {}/{} notifications for {}", delivered, results.size(),
                            request.getId());
                    return results;
                });
    }

    private CompletableFuture<NotificationResult> sendVia(NotificationChannel channel,
            NotificationPayload payload) {
        NotificationProvider provider = providers.get(channel);
        if (provider == null) {
            return CompletableFuture.completedFuture(
                    NotificationResult.failure(channel, "No provider for channel: " + channel.key(),
                            clock.instant()));
        }
        if (!provider.isConfigured()) {
            return CompletableFuture.completedFuture(
                    NotificationResult.failure(channel, "No configuration for channel: " + channel.key(),
                            clock.instant()));
        }
        try {
            return provider.send(payload)
                    .exceptionally(error -> NotificationResult.failure(channel, error.getMessage(),
                            clock.instant()));
        } catch (RuntimeException e) {
            log.warn("[Notify] {} provider failed: {}", channel.key(), e.getMessage());
            return CompletableFuture.completedFuture(
                    NotificationResult.failure(channel, e.getMessage(), clock.instant()));
        }
    }

    NotificationPayload buildPayload(ApprovalRequest request) {
        String actionUrlBase = properties.getNotifications().getActionUrlBase();
        String actionUrl = actionUrlBase != null && !actionUrlBase.isBlank()
                ? actionUrlBase.replaceAll("/+$", "") + "/" + request.getAgentId() + "/approvals/" + request.getId()
                : null;
        String message = request.getDescription() != null && !request.getDescription().isBlank()
                ? request.getDescription()
                : String.format(Locale.ROOT, "Agent %s requests %s (%s)", request.getAgentId(),
                        request.getAction(), request.getCategory() != null ? request.getCategory().key() : "unknown");
        return NotificationPayload.builder()
                .title("Approval Required: " + request.getAction())
                .message(message)
                .priority(determinePriority(request))
                .approval(request)
                .actionUrl(actionUrl)
                .expiresAt(request.getExpiresAt())
                .build();
    }

    static NotificationPriority determinePriority(ApprovalRequest request) {
        if (request.getRiskScore() > 0.8) {
            return NotificationPriority.CRITICAL;
        }
        if (request.getRiskScore() > 0.5 || request.getConfidence() < 0.5) {
            return NotificationPriority.HIGH;
        }
        if (request.getCategory() == ActionCategory.FINANCIAL || request.getCategory() == ActionCategory.ADMIN) {
            return NotificationPriority.HIGH;
        }
        return NotificationPriority.NORMAL;
    }
}
