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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentlink.domain.model.AckStatus;
import me.golemcore.agentlink.domain.model.AgentChannel;
import me.golemcore.agentlink.domain.model.AgentMessage;
import me.golemcore.agentlink.domain.model.BroadcastMessage;
import me.golemcore.agentlink.domain.model.ChannelConfig;
import me.golemcore.agentlink.domain.model.DeliveryStatus;
import me.golemcore.agentlink.domain.model.HandlerErrorEvent;
import me.golemcore.agentlink.domain.model.MessageAck;
import me.golemcore.agentlink.domain.model.MessageAckedEvent;
import me.golemcore.agentlink.domain.model.MessageBroadcastEvent;
import me.golemcore.agentlink.domain.model.MessageExpiredEvent;
import me.golemcore.agentlink.domain.model.MessageFailedEvent;
import me.golemcore.agentlink.domain.model.MessagePriority;
import me.golemcore.agentlink.domain.model.MessageReceivedEvent;
import me.golemcore.agentlink.domain.model.MessageRetryEvent;
import me.golemcore.agentlink.domain.model.MessageSentEvent;
import me.golemcore.agentlink.domain.model.MessagingErrorEvent;
import me.golemcore.agentlink.domain.model.RetryQueueFullEvent;
import me.golemcore.agentlink.domain.model.SchemaValidationResult;
import me.golemcore.agentlink.infrastructure.config.AgentLinkProperties;
import me.golemcore.agentlink.port.outbound.DomainEventPublisher;
import me.golemcore.agentlink.security.AgentKeyPair;
import me.golemcore.agentlink.security.CryptoOperationException;
import me.golemcore.agentlink.security.PayloadCipher;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Message bus endpoint of one agent identity.
 *
 * <p>
 * Sending side: validates membership, size and schema, encrypts for the
 * recipient on encrypted channels and tracks every sent message in a pending
 * table until it is acknowledged, fails terminally or times out. Receiving
 * side: {@link #handleMessage(AgentMessage)} checks addressing and expiry,
 * decrypts and dispatches to channel and type subscribers.
 *
 * <p>
 * No exception crosses a public method. Send-side problems publish a
 * {@link MessagingErrorEvent} and return {@code null}; receive-side problems
 * produce a {@link AckStatus#FAILED} ack. Instances are created and disposed by
 * {@link AgentMessengerRegistry}.
 *
 * @since 1.0
 */
@Slf4j
public class AgentMessenger {

    private final String agentId;
    private final ChannelRegistry channelRegistry;
    private final MessageSchemaValidator schemaValidator;
    private final PayloadCipher cipher;
    private final ObjectMapper objectMapper;
    private final DomainEventPublisher eventPublisher;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final AgentLinkProperties.MessagingProperties settings;

    private final Map<String, List<MessageHandler>> channelHandlers = new ConcurrentHashMap<>();
    private final Map<String, List<MessageHandler>> typeHandlers = new ConcurrentHashMap<>();
    private final Map<String, PendingMessage> pending = new LinkedHashMap<>();
    private final AtomicInteger scheduledRetries = new AtomicInteger();

    private volatile AgentKeyPair keyPair;

    public AgentMessenger(String agentId, ChannelRegistry channelRegistry, MessageSchemaValidator schemaValidator,
            PayloadCipher cipher, ObjectMapper objectMapper, DomainEventPublisher eventPublisher,
            TaskScheduler taskScheduler, Clock clock, AgentLinkProperties.MessagingProperties settings) {
        this.agentId = agentId;
        this.channelRegistry = channelRegistry;
        this.schemaValidator = schemaValidator;
        this.cipher = cipher;
        this.objectMapper = objectMapper;
        this.eventPublisher = eventPublisher;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.settings = settings;
    }

    public String getAgentId() {
        return agentId;
    }

    // ==================== KEYS ====================

    /**
     * Generate this agent's key pair, replacing any earlier one. Returns
     * {@code null} when the platform cannot generate P-256 keys.
     */
    public AgentKeyPair initializeEncryption() {
        try {
            keyPair = cipher.generateKeyPair();
            log.debug("[Messaging] Encryption initialized for {}", agentId);
            return keyPair;
        } catch (CryptoOperationException e) {
            log.error("[Messaging] Key generation failed for {}: {}", agentId, e.getMessage());
            return null;
        }
    }

    public String getPublicKey() {
        AgentKeyPair current = keyPair;
        return current != null ? current.getPublicKey() : null;
    }

    // ==================== CHANNELS ====================

    public AgentChannel createChannel(Collection<String> participantIds, ChannelConfig config) {
        AgentChannel channel = channelRegistry.createChannel(agentId, participantIds, config);
        String publicKey = getPublicKey();
        if (publicKey != null) {
            channelRegistry.setPublicKey(channel.getId(), agentId, publicKey);
        }
        return channel;
    }

    public boolean joinChannel(String channelId) {
        return channelRegistry.joinChannel(channelId, agentId, getPublicKey());
    }

    public boolean leaveChannel(String channelId) {
        channelHandlers.remove(channelId);
        return channelRegistry.leaveChannel(channelId, agentId);
    }

    public boolean closeChannel(String channelId) {
        channelHandlers.remove(channelId);
        return channelRegistry.closeChannel(channelId, agentId);
    }

    public List<AgentChannel> getChannels() {
        return channelRegistry.getAgentChannels(agentId);
    }

    // ==================== SENDING ====================

    public synchronized AgentMessage send(String channelId, String recipientId, String type, Object payload,
            MessagePriority priority) {
        AgentChannel channel = channelRegistry.getChannel(channelId).orElse(null);
        if (channel == null) {
            return fail("Channel not found", channelId, List.of());
        }
        if (!channelRegistry.isMember(channelId, agentId)) {
            return fail("Not a member of channel", channelId, List.of());
        }
        if (recipientId == null || !channelRegistry.isMember(channelId, recipientId)) {
            return fail("Recipient not in channel", channelId, recipientId != null ? List.of(recipientId) : List.of());
        }
        byte[] serialized = serializeChecked(channel, payload);
        if (serialized == null) {
            return null;
        }

        Object wirePayload = payload;
        if (channel.getEncryption().isEncrypted()) {
            String ciphertext = encryptFor(channel, recipientId, serialized);
            if (ciphertext == null) {
                return null;
            }
            wirePayload = ciphertext;
        }

        Instant now = clock.instant();
        AgentMessage message = AgentMessage.builder()
                .id(IdGenerator.messageId(agentId, now))
                .channelId(channelId)
                .senderId(agentId)
                .recipientId(recipientId)
                .payload(wirePayload)
                .type(type)
                .priority(priority != null ? priority : MessagePriority.NORMAL)
                .status(DeliveryStatus.SENT)
                .timestamp(now)
                .expiresAt(now.plus(channel.getConfig().getMessageTtl()))
                .encrypted(channel.getEncryption().isEncrypted())
                .build();

        pending.put(message.getId(), new PendingMessage(message, now, retryLimit(channel)));
        log.debug("[Messaging] {} sent {} to {} on {}", agentId, message.getId(), recipientId, channelId);
        eventPublisher.publish(new MessageSentEvent(agentId, message));
        return message;
    }

    public AgentMessage reply(AgentMessage original, String type, Object payload) {
        return send(original.getChannelId(), original.getSenderId(), type, payload, original.getPriority());
    }

    /**
     * Broadcast to every other member. Encrypted channels get one ciphertext per
     * recipient; a single missing recipient key fails the whole broadcast.
     */
    public synchronized BroadcastMessage broadcast(String channelId, String type, Object payload,
            MessagePriority priority) {
        AgentChannel channel = channelRegistry.getChannel(channelId).orElse(null);
        if (channel == null) {
            return failBroadcast("Channel not found", channelId, List.of());
        }
        if (!channelRegistry.isMember(channelId, agentId)) {
            return failBroadcast("Not a member of channel", channelId, List.of());
        }
        byte[] serialized = serializeChecked(channel, payload);
        if (serialized == null) {
            return null;
        }

        List<String> recipients = new ArrayList<>(channel.getParticipants());
        recipients.remove(agentId);

        Map<String, String> ciphertexts = new LinkedHashMap<>();
        boolean encrypted = channel.getEncryption().isEncrypted();
        if (encrypted) {
            for (String recipient : recipients) {
                String ciphertext = encryptFor(channel, recipient, serialized);
                if (ciphertext == null) {
                    return null;
                }
                ciphertexts.put(recipient, ciphertext);
            }
        }

        Instant now = clock.instant();
        BroadcastMessage message = BroadcastMessage.builder()
                .id(IdGenerator.messageId(agentId, now))
                .channelId(channelId)
                .senderId(agentId)
                .payload(encrypted ? null : payload)
                .encryptedPayloads(ciphertexts)
                .type(type)
                .priority(priority != null ? priority : MessagePriority.NORMAL)
                .recipients(recipients)
                .timestamp(now)
                .expiresAt(now.plus(channel.getConfig().getMessageTtl()))
                .encrypted(encrypted)
                .build();

        log.debug("[Messaging] {} broadcast {} to {} recipients on {}", agentId, message.getId(),
                recipients.size(), channelId);
        eventPublisher.publish(new MessageBroadcastEvent(agentId, message));
        return message;
    }

    private byte[] serializeChecked(AgentChannel channel, Object payload) {
        byte[] serialized;
        try {
            serialized = objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            fail("Payload is not serializable", channel.getId(), List.of(e.getOriginalMessage()));
            return null;
        }
        Long maxSize = channel.getConfig().getMaxMessageSize();
        if (maxSize != null && serialized.length > maxSize) {
            fail("Message exceeds maximum size", channel.getId(),
                    List.of(serialized.length + " > " + maxSize + " bytes"));
            return null;
        }
        if (channel.getMessageSchema() != null) {
            SchemaValidationResult result = schemaValidator.validate(payload, channel.getMessageSchema());
            if (!result.valid()) {
                fail("Schema validation failed", channel.getId(), result.errors());
                return null;
            }
        }
        return serialized;
    }

    private String encryptFor(AgentChannel channel, String recipientId, byte[] serialized) {
        AgentKeyPair own = keyPair;
        if (own == null) {
            fail("Encryption not initialized", channel.getId(), List.of());
            return null;
        }
        String recipientKey = channelRegistry.getPublicKey(channel.getId(), recipientId);
        if (recipientKey == null) {
            fail("Recipient public key not registered", channel.getId(), List.of(recipientId));
            return null;
        }
        try {
            return cipher.encrypt(serialized, own, recipientKey);
        } catch (CryptoOperationException e) {
            fail("Encryption failed", channel.getId(), List.of(e.getMessage()));
            return null;
        }
    }

    private int retryLimit(AgentChannel channel) {
        Integer channelLimit = channel.getConfig().getRetryCount();
        return channelLimit != null ? channelLimit : settings.getMaxRetries();
    }

    private AgentMessage fail(String error, String channelId, List<String> details) {
        log.debug("[Messaging] {} send refused on {}: {}", agentId, channelId, error);
        eventPublisher.publish(new MessagingErrorEvent(agentId, error, channelId, details));
        return null;
    }

    private BroadcastMessage failBroadcast(String error, String channelId, List<String> details) {
        fail(error, channelId, details);
        return null;
    }

    // ==================== RECEIVING ====================

    public MessageAck handleMessage(AgentMessage message) {
        Instant now = clock.instant();
        if (message.getRecipientId() != null && !message.getRecipientId().equals(agentId)) {
            return MessageAck.failed(message.getId(), agentId, now, "Not intended recipient");
        }
        if (message.isExpired(now)) {
            return MessageAck.failed(message.getId(), agentId, now, "Message expired");
        }

        Object payload = message.getPayload();
        if (message.isEncrypted()) {
            Decrypted decrypted = decryptPayload(message);
            if (decrypted == null) {
                return MessageAck.failed(message.getId(), agentId, now, "Decryption failed");
            }
            payload = decrypted.value();
        }

        AgentMessage delivered = message.toBuilder()
                .payload(payload)
                .status(DeliveryStatus.DELIVERED)
                .build();

        channelRegistry.getChannel(message.getChannelId()).ifPresent(channel -> {
            dispatch(channelHandlers.get(channel.getId()), delivered, channel);
            dispatch(typeHandlers.get(delivered.getType()), delivered, channel);
        });

        eventPublisher.publish(new MessageReceivedEvent(agentId, delivered));
        return MessageAck.delivered(message.getId(), agentId, now);
    }

    public MessageAck handleBroadcast(BroadcastMessage broadcast) {
        if (broadcast.getRecipients() == null || !broadcast.getRecipients().contains(agentId)) {
            return MessageAck.failed(broadcast.getId(), agentId, clock.instant(), "Not intended recipient");
        }
        return handleMessage(broadcast.toDirectMessage(agentId));
    }

    public MessageAck markAsRead(String messageId) {
        return MessageAck.read(messageId, agentId, clock.instant());
    }

    private Decrypted decryptPayload(AgentMessage message) {
        AgentKeyPair own = keyPair;
        String senderKey = channelRegistry.getPublicKey(message.getChannelId(), message.getSenderId());
        if (own == null || senderKey == null || !(message.getPayload() instanceof String ciphertext)) {
            log.warn("[Messaging] {} cannot decrypt {}: missing key or ciphertext", agentId, message.getId());
            return null;
        }
        try {
            byte[] plaintext = cipher.decrypt(ciphertext, own, senderKey);
            return new Decrypted(objectMapper.readValue(plaintext, Object.class));
        } catch (CryptoOperationException | IOException e) {
            log.warn("[Messaging] {} failed to decrypt {}: {}", agentId, message.getId(), e.getMessage());
            return null;
        }
    }

    private void dispatch(List<MessageHandler> handlers, AgentMessage message, AgentChannel channel) {
        if (handlers == null) {
            return;
        }
        for (MessageHandler handler : handlers) {
            try {
                handler.onMessage(message, channel);
            } catch (RuntimeException e) {
                log.warn("[Messaging] Handler failed for {} on {}: {}", message.getId(), agentId, e.getMessage());
                eventPublisher.publish(new HandlerErrorEvent(agentId, message, e.getMessage()));
            }
        }
    }

    // ==================== SUBSCRIPTIONS ====================

    public Subscription subscribe(String channelId, MessageHandler handler) {
        return register(channelHandlers, channelId, handler);
    }

    public Subscription subscribeToType(String type, MessageHandler handler) {
        return register(typeHandlers, type, handler);
    }

    public void clearSubscriptions() {
        channelHandlers.clear();
        typeHandlers.clear();
    }

    private Subscription register(Map<String, List<MessageHandler>> registry, String key,
            MessageHandler handler) {
        registry.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(handler);
        return () -> registry.computeIfPresent(key, (k, handlers) -> {
            handlers.remove(handler);
            return handlers.isEmpty() ? null : handlers;
        });
    }

    // ==================== ACKS & RETRIES ====================

    public synchronized void handleAck(MessageAck ack) {
        PendingMessage entry = pending.get(ack.getMessageId());
        if (entry == null) {
            return;
        }
        AgentMessage message = entry.message;
        switch (ack.getStatus()) {
        case DELIVERED, READ -> {
            pending.remove(message.getId());
            message.setStatus(ack.getStatus() == AckStatus.READ
                    ? DeliveryStatus.ACKNOWLEDGED
                    : DeliveryStatus.DELIVERED);
            eventPublisher.publish(new MessageAckedEvent(agentId, message, ack));
        }
        case FAILED -> {
            if (entry.retries < entry.maxRetries) {
                entry.retries++;
                scheduleRetry(entry);
            } else {
                pending.remove(message.getId());
                message.setStatus(DeliveryStatus.FAILED);
                log.warn("[Messaging] {} gave up on {} after {} retries: {}", agentId, message.getId(),
                        entry.retries, ack.getError());
                eventPublisher.publish(new MessageFailedEvent(agentId, message, ack));
            }
        }
        default -> {
            // PENDING acks carry no transition
        }
        }
    }

    private void scheduleRetry(PendingMessage entry) {
        AgentMessage message = entry.message;
        if (scheduledRetries.get() >= settings.getMaxQueueSize()) {
            log.warn("[Messaging] Retry queue full for {}, dropping retry of {}", agentId, message.getId());
            eventPublisher.publish(new RetryQueueFullEvent(agentId, message, settings.getMaxQueueSize()));
            return;
        }
        int attempt = entry.retries;
        Duration delay = settings.getRetryDelay().multipliedBy(attempt);
        scheduledRetries.incrementAndGet();
        try {
            taskScheduler.schedule(() -> emitRetry(message.getId(), attempt), clock.instant().plus(delay));
        } catch (TaskRejectedException e) {
            scheduledRetries.decrementAndGet();
            log.warn("[Messaging] Retry of {} rejected by scheduler: {}", message.getId(), e.getMessage());
        }
    }

    private void emitRetry(String messageId, int attempt) {
        scheduledRetries.decrementAndGet();
        AgentMessage message;
        synchronized (this) {
            PendingMessage entry = pending.get(messageId);
            if (entry == null) {
                return;
            }
            message = entry.message;
        }
        log.debug("[Messaging] {} retrying {} (attempt {})", agentId, messageId, attempt);
        eventPublisher.publish(new MessageRetryEvent(agentId, message, attempt));
    }

    /**
     * Expire pending messages older than the message timeout.
     *
     * @return number of expired messages
     */
    public synchronized int cleanupExpired() {
        Instant now = clock.instant();
        Duration timeout = settings.getMessageTimeout();
        List<AgentMessage> expired = new ArrayList<>();
        Iterator<PendingMessage> iterator = pending.values().iterator();
        while (iterator.hasNext()) {
            PendingMessage entry = iterator.next();
            if (Duration.between(entry.queuedAt, now).compareTo(timeout) > 0) {
                iterator.remove();
                entry.message.setStatus(DeliveryStatus.EXPIRED);
                expired.add(entry.message);
            }
        }
        for (AgentMessage message : expired) {
            eventPublisher.publish(new MessageExpiredEvent(agentId, message));
        }
        if (!expired.isEmpty()) {
            log.debug("[Messaging] {} expired {} pending messages", agentId, expired.size());
        }
        return expired.size();
    }

    public synchronized int getPendingCount() {
        return pending.size();
    }

    public synchronized Optional<AgentMessage> getPendingMessage(String messageId) {
        return Optional.ofNullable(pending.get(messageId)).map(entry -> entry.message);
    }

    public synchronized void dispose() {
        clearSubscriptions();
        pending.clear();
        keyPair = null;
    }

    private static final class PendingMessage {
        private final AgentMessage message;
        private final Instant queuedAt;
        private final int maxRetries;
        private int retries;

        private PendingMessage(AgentMessage message, Instant queuedAt, int maxRetries) {
            this.message = message;
            this.queuedAt = queuedAt;
            this.maxRetries = maxRetries;
        }
    }

    private record Decrypted(Object value) {
    }
}
