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
import me.golemcore.agentlink.domain.model.NotificationChannel;
import me.golemcore.agentlink.domain.model.NotificationResult;
import me.golemcore.agentlink.infrastructure.config.AgentLinkProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Posts approval requests as JSON to a configured webhook. Uses
 * {@link WebClient} (reactive) with exponential backoff retry.
 *
 * <p>
 * When a signature secret is configured the raw body is signed with
 * HMAC-SHA256 and sent as {@code X-Agentlink-Signature: sha256=<hex>}.
 */
@Component
@Slf4j
public class WebhookNotificationProvider implements NotificationProvider {

    static final String SIGNATURE_HEADER = "X-Agentlink-Signature";
    static final String EVENT_TYPE = "hitl_approval_request";

    private static final Duration FIRST_BACKOFF = Duration.ofSeconds(1);

    private final AgentLinkProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final WebClient webClient;

    @Autowired
    public WebhookNotificationProvider(AgentLinkProperties properties, ObjectMapper objectMapper, Clock clock) {
        this(properties, objectMapper, clock, createDefaultWebClient());
    }

    WebhookNotificationProvider(AgentLinkProperties properties, ObjectMapper objectMapper, Clock clock,
            WebClient webClient) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.webClient = webClient;
    }

    private static WebClient createDefaultWebClient() {
        return WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(256 * 1024))
                .build();
    }

    @Override
    public NotificationChannel getChannel() {
        return NotificationChannel.WEBHOOK;
    }

    @Override
    public boolean isConfigured() {
        String url = config().getUrl();
        return url != null && !url.isBlank();
    }

    @Override
    public CompletableFuture<NotificationResult> send(NotificationPayload payload) {
        AgentLinkProperties.WebhookProperties config = config();
        String body;
        try {
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("type", EVENT_TYPE);
            envelope.put("payload", payload);
            envelope.put("timestamp", clock.instant());
            body = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            return CompletableFuture.completedFuture(
                    NotificationResult.failure(getChannel(), "Cannot serialize payload: " + e.getOriginalMessage(),
                            clock.instant()));
        }

        return buildSendMono(config, body)
                .then(Mono.fromSupplier(() -> NotificationResult.success(getChannel(),
                        "webhook_" + clock.millis(), clock.instant())))
                .onErrorResume(error -> Mono.just(NotificationResult.failure(getChannel(), error.getMessage(),
                        clock.instant())))
                .toFuture();
    }

    protected Mono<Void> buildSendMono(AgentLinkProperties.WebhookProperties config, String body) {
        String url = config.getUrl();
        String signature = sign(body, config.getSignatureSecret());
        return webClient.method(HttpMethod.valueOf(config.getMethod().toUpperCase(Locale.ROOT)))
                .uri(url)
                .headers(headers -> {
                    headers.setContentType(MediaType.APPLICATION_JSON);
                    config.getHeaders().forEach(headers::set);
                    if (signature != null) {
                        headers.set(SIGNATURE_HEADER, signature);
                    }
                })
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .timeout(config.getTimeout())
                .retryWhen(buildRetry(config)
                        .doBeforeRetry(signal -> log.debug(
                                "[Notify] Retrying webhook to {} (attempt {})",
                                url, signal.totalRetries() + 1)))
                .doOnSuccess(response -> log.info("[Notify] Webhook delivered to {}", url))
                .doOnError(error -> log.error("[Notify] Webhook to {} failed after retries: {}", url,
                        error.getMessage()))
                .then();
    }

    protected RetryBackoffSpec buildRetry(AgentLinkProperties.WebhookProperties config) {
        return Retry.backoff(config.getMaxRetries(), FIRST_BACKOFF);
    }

    static String sign(String body, String secret) {
        if (secret == null || secret.isBlank()) {
            return null;
        }
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] digest = mac.doFinal(body.getBytes(StandardCharsets.UTF_8));
            return "sha256=" + HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    private AgentLinkProperties.WebhookProperties config() {
        return properties.getNotifications().getWebhook();
    }
}
