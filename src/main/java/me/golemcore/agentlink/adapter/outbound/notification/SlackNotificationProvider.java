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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentlink.domain.model.ApprovalRequest;
import me.golemcore.agentlink.domain.model.NotificationChannel;
import me.golemcore.agentlink.domain.model.NotificationPriority;
import me.golemcore.agentlink.domain.model.NotificationResult;
import me.golemcore.agentlink.infrastructure.config.AgentLinkProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Posts approval requests to a Slack incoming webhook as Block Kit messages.
 */
@Component
@Slf4j
public class SlackNotificationProvider implements NotificationProvider {

    private final AgentLinkProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final WebClient webClient;

    @Autowired
    public SlackNotificationProvider(AgentLinkProperties properties, ObjectMapper objectMapper, Clock clock) {
        this(properties, objectMapper, clock, WebClient.builder().build());
    }

    SlackNotificationProvider(AgentLinkProperties properties, ObjectMapper objectMapper, Clock clock,
            WebClient webClient) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.webClient = webClient;
    }

    @Override
    public NotificationChannel getChannel() {
        return NotificationChannel.SLACK;
    }

    @Override
    public boolean isConfigured() {
        String url = config().getWebhookUrl();
        return url != null && !url.isBlank();
    }

    @Override
    public CompletableFuture<NotificationResult> send(NotificationPayload payload) {
        AgentLinkProperties.SlackProperties config = config();
        String body;
        try {
            body = objectMapper.writeValueAsString(buildMessage(payload, config));
        } catch (JsonProcessingException e) {
            return CompletableFuture.completedFuture(
                    NotificationResult.failure(getChannel(), e.getOriginalMessage(), clock.instant()));
        }
        return webClient.post()
                .uri(config.getWebhookUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .timeout(config.getTimeout())
                .doOnSuccess(response -> log.info("[Notify] Slack message posted for {}",
                        payload.getApproval() != null ? payload.getApproval().getId() : payload.getTitle()))
                .then(Mono.fromSupplier(() -> NotificationResult.success(getChannel(),
                        "slack_" + clock.millis(), clock.instant())))
                .onErrorResume(error -> {
                    log.error("[Notify] Slack post failed: {}", error.getMessage());
                    return Mono.just(NotificationResult.failure(getChannel(), error.getMessage(), clock.instant()));
                })
                .toFuture();
    }

    Map<String, Object> buildMessage(NotificationPayload payload, AgentLinkProperties.SlackProperties config) {
        Map<String, Object> message = new LinkedHashMap<>();
        if (config.getChannel() != null && !config.getChannel().isBlank()) {
            message.put("channel", config.getChannel());
        }
        message.put("username", config.getUsername());
        message.put("icon_emoji", config.getIconEmoji());
        message.put("text", payload.getTitle());

        List<Map<String, Object>> blocks = new ArrayList<>();
        blocks.add(Map.of("type", "header",
                "text", Map.of("type", "plain_text", "text", emoji(payload.getPriority()) + " " + payload.getTitle())));
        blocks.add(Map.of("type", "section",
                "text", Map.of("type", "mrkdwn", "text", payload.getMessage())));

        ApprovalRequest approval = payload.getApproval();
        if (approval != null) {
            List<Map<String, Object>> fields = new ArrayList<>();
            fields.add(field("Agent", approval.getAgentId()));
            fields.add(field("Action", approval.getAction()));
            fields.add(field("Category", approval.getCategory() != null ? approval.getCategory().key() : "-"));
            fields.add(field("Confidence", String.format(Locale.ROOT, "%.0f%%", approval.getConfidence() * 100)));
            fields.add(field("Risk", String.format(Locale.ROOT, "%.0f%%", approval.getRiskScore() * 100)));
            fields.add(field("Expires", payload.getExpiresAt() != null ? payload.getExpiresAt().toString() : "never"));
            blocks.add(Map.of("type", "section", "fields", fields));
        }
        if (payload.getActionUrl() != null) {
            blocks.add(Map.of("type", "actions", "elements", List.of(Map.of(
                    "type", "button",
                    "text", Map.of("type", "plain_text", "text", "Review"),
                    "url", payload.getActionUrl(),
                    "style", "primary"))));
        }
        message.put("blocks", blocks);
        return message;
    }

    private static Map<String, Object> field(String label, String value) {
        return Map.of("type", "mrkdwn", "text", "*" + label + ":*\n" + value);
    }

    private static String emoji(NotificationPriority priority) {
        if (priority == null) {
            return ":large_blue_circle:";
        }
        return switch (priority) {
        case CRITICAL -> ":rotating_light:";
        case HIGH -> ":warning:";
        case NORMAL -> ":large_blue_circle:";
        case LOW -> ":white_circle:";
        };
    }

    private AgentLinkProperties.SlackProperties config() {
        return properties.getNotifications().getSlack();
    }
}
