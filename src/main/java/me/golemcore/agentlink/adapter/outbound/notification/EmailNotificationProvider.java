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

import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentlink.domain.model.ApprovalRequest;
import me.golemcore.agentlink.domain.model.NotificationChannel;
import me.golemcore.agentlink.domain.model.NotificationResult;
import me.golemcore.agentlink.infrastructure.config.AgentLinkProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Date;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Sends approval alerts by SMTP to the configured operator recipients.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@SuppressWarnings("PMD.ReplaceJavaUtilDate") // jakarta.mail.internet.MimeMessage.setSentDate requires java.util.Date
public class EmailNotificationProvider implements NotificationProvider {

    private final AgentLinkProperties properties;
    private final Clock clock;

    @Override
    public NotificationChannel getChannel() {
        return NotificationChannel.EMAIL;
    }

    @Override
    public boolean isConfigured() {
        AgentLinkProperties.EmailProperties config = config();
        return config.getHost() != null && !config.getHost().isBlank()
                && config.getFrom() != null && !config.getFrom().isBlank()
                && config.getRecipients() != null && !config.getRecipients().isEmpty();
    }

    @Override
    public CompletableFuture<NotificationResult> send(NotificationPayload payload) {
        AgentLinkProperties.EmailProperties config = config();
        return CompletableFuture.supplyAsync(() -> {
            try {
                Session session = MailSessionFactory.createSmtpSession(config);
                MimeMessage message = new MimeMessage(session);
                message.setFrom(new InternetAddress(config.getFrom()));
                message.setRecipients(Message.RecipientType.TO,
                        InternetAddress.parse(String.join(",", config.getRecipients())));
                message.setSubject("[" + payload.getPriority() + "] " + payload.getTitle(), "UTF-8");
                message.setContent(formatBody(payload), "text/plain; charset=UTF-8");
                message.setSentDate(Date.from(clock.instant()));

                deliver(message);

                log.info("[Notify] Email sent to {} recipients", config.getRecipients().size());
                String messageId = message.getMessageID();
                return NotificationResult.success(getChannel(),
                        messageId != null ? messageId : "email_" + clock.millis(), clock.instant());
            } catch (MessagingException e) {
                log.error("[Notify] Email delivery failed: {}", e.getMessage());
                return NotificationResult.failure(getChannel(), e.getMessage(), clock.instant());
            }
        });
    }

    protected void deliver(MimeMessage message) throws MessagingException {
        Transport.send(message);
    }

    String formatBody(NotificationPayload payload) {
        StringBuilder body = new StringBuilder();
        body.append(payload.getMessage()).append("\n\n");
        ApprovalRequest approval = payload.getApproval();
        if (approval != null) {
            body.append("Agent: ").append(approval.getAgentId()).append('\n');
            body.append("Action: ").append(approval.getAction()).append('\n');
            body.append("Category: ").append(approval.getCategory() != null ? approval.getCategory().key() : "-")
                    .append('\n');
            body.append(String.format(Locale.ROOT, "Confidence: %.0f%%%n", approval.getConfidence() * 100));
            body.append(String.format(Locale.ROOT, "Risk: %.0f%%%n", approval.getRiskScore() * 100));
            if (approval.getReason() != null) {
                body.append("Reason: ").append(approval.getReason()).append('\n');
            }
            body.append("Request: ").append(approval.getId()).append('\n');
        }
        body.append("Expires: ").append(payload.getExpiresAt() != null ? payload.getExpiresAt() : "never")
                .append('\n');
        if (payload.getActionUrl() != null) {
            body.append("\nReview: ").append(payload.getActionUrl()).append('\n');
        }
        return body.toString();
    }

    private AgentLinkProperties.EmailProperties config() {
        return properties.getNotifications().getEmail();
    }
}
