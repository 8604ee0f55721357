package me.golemcore.agentlink.infrastructure.config;

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

import lombok.Data;
import me.golemcore.agentlink.domain.model.ActionCategory;
import me.golemcore.agentlink.domain.model.EncryptionMode;
import me.golemcore.agentlink.domain.model.GovernanceMode;
import me.golemcore.agentlink.domain.model.NotificationChannel;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.yml.
 *
 * <p>
 * Everything lives under the {@code agentlink.*} prefix:
 * <ul>
 * <li>{@link MessagingProperties} - retry, timeout and queue limits of agent
 * messengers</li>
 * <li>{@link ChannelDefaultsProperties} - defaults for new channels</li>
 * <li>{@link GovernanceProperties} - default governance policy</li>
 * <li>{@link NotificationProperties} - operator alerting providers</li>
 * <li>{@link AuditProperties} and {@link StorageProperties} - audit
 * persistence</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "agentlink")
@Data
public class AgentLinkProperties {

    private MessagingProperties messaging = new MessagingProperties();
    private ChannelDefaultsProperties channels = new ChannelDefaultsProperties();
    private GovernanceProperties governance = new GovernanceProperties();
    private NotificationProperties notifications = new NotificationProperties();
    private AuditProperties audit = new AuditProperties();
    private StorageProperties storage = new StorageProperties();

    // ==================== MESSAGING ====================

    @Data
    public static class MessagingProperties {
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofSeconds(1);
        private Duration messageTimeout = Duration.ofSeconds(30);
        private int maxQueueSize = 1000;
        private Duration cleanupInterval = Duration.ofSeconds(10);
    }

    @Data
    public static class ChannelDefaultsProperties {
        private EncryptionMode encryption = EncryptionMode.NONE;
        private long maxMessageSize = 1024L * 1024L;
        private Duration messageTtl = Duration.ofSeconds(60);
        private boolean requireAck = false;
        private int retryCount = 3;
    }

    // ==================== GOVERNANCE ====================

    @Data
    public static class GovernanceProperties {
        private GovernanceMode mode = GovernanceMode.SUPERVISED;
        private double confidenceThreshold = 0.8;
        private double riskThreshold = 0.5;
        private List<ActionCategory> alwaysApproveCategories = new ArrayList<>(
                List.of(ActionCategory.FINANCIAL, ActionCategory.ADMIN, ActionCategory.DELETE));
        private List<ActionCategory> neverApproveCategories = new ArrayList<>(List.of(ActionCategory.READ));
        private boolean defaultEscalationRules = true;
        private Duration approvalTimeout = Duration.ofMinutes(10);
        private boolean autoApproveOnTimeout = false;
        private int maxAutonomousActions = 100;
        private boolean auditLogEnabled = true;
        private boolean rollbackEnabled = true;
        private Duration rollbackRetention = Duration.ofHours(24);
        private List<NotificationChannel> notificationChannels = new ArrayList<>();
        private List<String> approvedOperators = new ArrayList<>();
        private Duration tickInterval = Duration.ofSeconds(1);
    }

    // ==================== NOTIFICATIONS ====================

    @Data
    public static class NotificationProperties {
        private String actionUrlBase;
        private WebhookProperties webhook = new WebhookProperties();
        private SlackProperties slack = new SlackProperties();
        private EmailProperties email = new EmailProperties();
    }

    @Data
    public static class WebhookProperties {
        private String url;
        private String method = "POST";
        private Map<String, String> headers = new LinkedHashMap<>();
        private String signatureSecret;
        private Duration timeout = Duration.ofSeconds(10);
        private int maxRetries = 3;
    }

    @Data
    public static class SlackProperties {
        private String webhookUrl;
        private String channel;
        private String username = "Agentlink HITL";
        private String iconEmoji = ":robot_face:";
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class EmailProperties {
        private String host;
        private int port = 587;
        private String username;
        private String password;
        private String security = "starttls";
        private boolean sslTrust = false;
        private String from;
        private List<String> recipients = new ArrayList<>();
        private int connectTimeout = 10000;
        private int readTimeout = 30000;
    }

    // ==================== AUDIT & STORAGE ====================

    @Data
    public static class AuditProperties {
        private boolean persistEnabled = true;
        private String directory = "audit";
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/agentlink";
    }
}
