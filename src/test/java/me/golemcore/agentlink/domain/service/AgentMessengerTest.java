package me.golemcore.agentlink.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentlink.domain.model.AckStatus;
import me.golemcore.agentlink.domain.model.AgentChannel;
import me.golemcore.agentlink.domain.model.AgentMessage;
import me.golemcore.agentlink.domain.model.BroadcastMessage;
import me.golemcore.agentlink.domain.model.ChannelConfig;
import me.golemcore.agentlink.domain.model.DeliveryStatus;
import me.golemcore.agentlink.domain.model.EncryptionMode;
import me.golemcore.agentlink.domain.model.HandlerErrorEvent;
import me.golemcore.agentlink.domain.model.JsonSchema;
import me.golemcore.agentlink.domain.model.MessageAck;
import me.golemcore.agentlink.domain.model.MessageAckedEvent;
import me.golemcore.agentlink.domain.model.MessageExpiredEvent;
import me.golemcore.agentlink.domain.model.MessageFailedEvent;
import me.golemcore.agentlink.domain.model.MessagePriority;
import me.golemcore.agentlink.domain.model.MessageRetryEvent;
import me.golemcore.agentlink.domain.model.MessageSentEvent;
import me.golemcore.agentlink.domain.model.MessagingErrorEvent;
import me.golemcore.agentlink.domain.model.RetryQueueFullEvent;
import me.golemcore.agentlink.infrastructure.config.AgentLinkProperties;
import me.golemcore.agentlink.port.outbound.DomainEventPublisher;
import me.golemcore.agentlink.security.PayloadCipher;
import me.golemcore.agentlink.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentMessengerTest {

    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");
    private static final String ALICE = "alice";
    private static final String BOB = "bob";
    private static final String CAROL = "carol";
    private static final String TASK_TYPE = "task";
    private static final Map<String, Object> PAYLOAD = Map.of("task", "deploy", "priority", 2);

    private MutableClock clock;
    private DomainEventPublisher eventPublisher;
    private TaskScheduler taskScheduler;
    private AgentLinkProperties properties;
    private ChannelRegistry channelRegistry;
    private MessageSchemaValidator schemaValidator;
    private PayloadCipher cipher;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        eventPublisher = mock(DomainEventPublisher.class);
        taskScheduler = mock(TaskScheduler.class);
        when(taskScheduler.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(invocation -> {
            Runnable task = invocation.getArgument(0);
            task.run();
            return null;
        });
        properties = new AgentLinkProperties();
        objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        channelRegistry = new ChannelRegistry(eventPublisher, properties, clock);
        schemaValidator = new MessageSchemaValidator(objectMapper);
        cipher = new PayloadCipher();
    }

    private AgentMessenger messenger(String agentId) {
        return new AgentMessenger(agentId, channelRegistry, schemaValidator, cipher, objectMapper, eventPublisher,
                taskScheduler, clock, properties.getMessaging());
    }

    private String lastError() {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, atLeastOnce()).publish(captor.capture());
        return captor.getAllValues().stream()
                .filter(MessagingErrorEvent.class::isInstance)
                .map(MessagingErrorEvent.class::cast)
                .reduce((first, second) -> second)
                .map(MessagingErrorEvent::error)
                .orElse(null);
    }

    // ===== Sending =====

    @Test
    void shouldSendToChannelMember() {
        AgentMessenger alice = messenger(ALICE);
        AgentChannel channel = alice.createChannel(List.of(BOB), null);

        AgentMessage message = alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, null);

        assertNotNull(message);
        assertTrue(message.getId().startsWith("msg_" + ALICE + "_" + START.toEpochMilli() + "_"));
        assertEquals(DeliveryStatus.SENT, message.getStatus());
        assertEquals(MessagePriority.NORMAL, message.getPriority());
        assertEquals(PAYLOAD, message.getPayload());
        assertEquals(START.plusSeconds(60), message.getExpiresAt());
        assertEquals(1, alice.getPendingCount());
        verify(eventPublisher).publish(any(MessageSentEvent.class));
    }

    @Test
    void shouldRefuseSendToUnknownChannel() {
        AgentMessenger alice = messenger(ALICE);

        assertNull(alice.send("ch_missing", BOB, TASK_TYPE, PAYLOAD, null));
        assertEquals("Channel not found", lastError());
    }

    @Test
    void shouldRefuseSendFromNonMember() {
        AgentChannel channel = messenger(ALICE).createChannel(List.of(BOB), null);
        AgentMessenger carol = messenger(CAROL);

        assertNull(carol.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, null));
        assertEquals("Not a member of channel", lastError());
        assertEquals(0, carol.getPendingCount());
    }

    @Test
    void shouldRefuseRecipientOutsideChannel() {
        AgentMessenger alice = messenger(ALICE);
        AgentChannel channel = alice.createChannel(List.of(BOB), null);

        assertNull(alice.send(channel.getId(), CAROL, TASK_TYPE, PAYLOAD, null));
        assertEquals("Recipient not in channel", lastError());
    }

    @Test
    void shouldRefuseOversizedPayload() {
        AgentMessenger alice = messenger(ALICE);
        AgentChannel channel = alice.createChannel(List.of(BOB), ChannelConfig.builder().maxMessageSize(10L).build());

        assertNull(alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, null));
        assertEquals("Message exceeds maximum size", lastError());
    }

    @Test
    void shouldRefusePayloadViolatingSchema() {
        AgentMessenger alice = messenger(ALICE);
        JsonSchema schema = JsonSchema.builder()
                .type("object")
                .required(List.of("task", "owner"))
                .build();
        AgentChannel channel = alice.createChannel(List.of(BOB),
                ChannelConfig.builder().messageSchema(schema).build());

        assertNull(alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, null));
        assertEquals("Schema validation failed", lastError());
    }

    // ===== Encryption =====

    @Test
    void shouldEncryptAndDecryptDirectMessage() {
        AgentMessenger alice = messenger(ALICE);
        AgentMessenger bob = messenger(BOB);
        alice.initializeEncryption();
        bob.initializeEncryption();
        AgentChannel channel = alice.createChannel(List.of(BOB),
                ChannelConfig.builder().encryption(EncryptionMode.END_TO_END).build());
        assertTrue(bob.joinChannel(channel.getId()));
        List<Object> received = new ArrayList<>();
        bob.subscribe(channel.getId(), (message, ch) -> received.add(message.getPayload()));

        AgentMessage sent = alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, MessagePriority.HIGH);

        assertNotNull(sent);
        assertTrue(sent.isEncrypted());
        assertInstanceOf(String.class, sent.getPayload());
        MessageAck ack = bob.handleMessage(sent);
        assertEquals(AckStatus.DELIVERED, ack.getStatus());
        assertEquals(List.of(PAYLOAD), received);
    }

    @Test
    void shouldRefuseEncryptedSendWithoutRecipientKey() {
        AgentMessenger alice = messenger(ALICE);
        alice.initializeEncryption();
        AgentChannel channel = alice.createChannel(List.of(BOB),
                ChannelConfig.builder().encryption(EncryptionMode.END_TO_END).build());

        assertNull(alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, null));
        assertEquals("Recipient public key not registered", lastError());
    }

    @Test
    void shouldRefuseEncryptedSendWithoutOwnKeys() {
        AgentMessenger alice = messenger(ALICE);
        AgentChannel channel = alice.createChannel(List.of(BOB),
                ChannelConfig.builder().encryption(EncryptionMode.END_TO_END).build());

        assertNull(alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, null));
        assertEquals("Encryption not initialized", lastError());
    }

    // Offsets cover the nonce (0-11), the GCM tag (12-27) and the ciphertext (28+); -1 is the last byte.
    @ParameterizedTest
    @ValueSource(ints = { 0, 11, 12, 27, 28, -1 })
    void shouldFailAckWhenAnyWireByteIsFlipped(int offset) {
        AgentMessenger alice = messenger(ALICE);
        AgentMessenger bob = messenger(BOB);
        alice.initializeEncryption();
        bob.initializeEncryption();
        AgentChannel channel = alice.createChannel(List.of(BOB),
                ChannelConfig.builder().encryption(EncryptionMode.END_TO_END).build());
        bob.joinChannel(channel.getId());
        List<AgentMessage> received = new ArrayList<>();
        bob.subscribe(channel.getId(), (message, ch) -> received.add(message));
        AgentMessage sent = alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, null);

        byte[] wire = Base64.getDecoder().decode((String) sent.getPayload());
        int index = offset < 0 ? wire.length + offset : offset;
        wire[index] ^= 0x01;
        AgentMessage tampered = sent.toBuilder().payload(Base64.getEncoder().encodeToString(wire)).build();

        MessageAck ack = bob.handleMessage(tampered);

        assertEquals(AckStatus.FAILED, ack.getStatus());
        assertEquals("Decryption failed", ack.getError());
        assertTrue(received.isEmpty());
    }

    @Test
    void shouldEncryptBroadcastPairwise() {
        AgentMessenger alice = messenger(ALICE);
        AgentMessenger bob = messenger(BOB);
        AgentMessenger carol = messenger(CAROL);
        alice.initializeEncryption();
        bob.initializeEncryption();
        carol.initializeEncryption();
        AgentChannel channel = alice.createChannel(List.of(BOB, CAROL),
                ChannelConfig.builder().encryption(EncryptionMode.END_TO_END).build());
        bob.joinChannel(channel.getId());
        carol.joinChannel(channel.getId());

        BroadcastMessage broadcast = alice.broadcast(channel.getId(), TASK_TYPE, PAYLOAD, null);

        assertNotNull(broadcast);
        assertEquals(List.of(BOB, CAROL), broadcast.getRecipients());
        assertNull(broadcast.getPayload());
        assertNotEquals(broadcast.getEncryptedPayloads().get(BOB), broadcast.getEncryptedPayloads().get(CAROL));
        assertEquals(AckStatus.DELIVERED, bob.handleBroadcast(broadcast).getStatus());
        assertEquals(AckStatus.DELIVERED, carol.handleBroadcast(broadcast).getStatus());

        AgentMessage bobsCopyForCarol = broadcast.toDirectMessage(BOB).toBuilder().recipientId(CAROL).build();
        assertEquals("Decryption failed", carol.handleMessage(bobsCopyForCarol).getError());
    }

    @Test
    void shouldFailWholeBroadcastWhenOneKeyMissing() {
        AgentMessenger alice = messenger(ALICE);
        AgentMessenger bob = messenger(BOB);
        alice.initializeEncryption();
        bob.initializeEncryption();
        AgentChannel channel = alice.createChannel(List.of(BOB, CAROL),
                ChannelConfig.builder().encryption(EncryptionMode.END_TO_END).build());
        bob.joinChannel(channel.getId());

        assertNull(alice.broadcast(channel.getId(), TASK_TYPE, PAYLOAD, null));
        assertEquals("Recipient public key not registered", lastError());
    }

    // ===== Receiving =====

    @Test
    void shouldRejectMessageForSomeoneElse() {
        AgentMessenger alice = messenger(ALICE);
        AgentChannel channel = alice.createChannel(List.of(BOB), null);
        AgentMessage sent = alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, null);

        MessageAck ack = messenger(CAROL).handleMessage(sent);

        assertEquals(AckStatus.FAILED, ack.getStatus());
        assertEquals("Not intended recipient", ack.getError());
    }

    @Test
    void shouldRejectExpiredMessage() {
        AgentMessenger alice = messenger(ALICE);
        AgentChannel channel = alice.createChannel(List.of(BOB), null);
        AgentMessage sent = alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, null);
        clock.advance(Duration.ofSeconds(61));

        MessageAck ack = messenger(BOB).handleMessage(sent);

        assertEquals("Message expired", ack.getError());
    }

    @Test
    void shouldIsolateFailingHandler() {
        AgentMessenger alice = messenger(ALICE);
        AgentMessenger bob = messenger(BOB);
        AgentChannel channel = alice.createChannel(List.of(BOB), null);
        List<String> seen = new ArrayList<>();
        bob.subscribe(channel.getId(), (message, ch) -> {
            throw new IllegalStateException("boom");
        });
        bob.subscribeToType(TASK_TYPE, (message, ch) -> seen.add(message.getId()));
        AgentMessage sent = alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, null);

        MessageAck ack = bob.handleMessage(sent);

        assertEquals(AckStatus.DELIVERED, ack.getStatus());
        assertEquals(List.of(sent.getId()), seen);
        verify(eventPublisher).publish(any(HandlerErrorEvent.class));
    }

    @Test
    void shouldStopDeliveringAfterUnsubscribe() {
        AgentMessenger alice = messenger(ALICE);
        AgentMessenger bob = messenger(BOB);
        AgentChannel channel = alice.createChannel(List.of(BOB), null);
        List<String> seen = new ArrayList<>();
        Subscription subscription = bob.subscribe(channel.getId(), (message, ch) -> seen.add(message.getId()));

        bob.handleMessage(alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, null));
        subscription.unsubscribe();
        bob.handleMessage(alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, null));

        assertEquals(1, seen.size());
    }

    @Test
    void shouldReplyToSender() {
        AgentMessenger alice = messenger(ALICE);
        AgentMessenger bob = messenger(BOB);
        AgentChannel channel = alice.createChannel(List.of(BOB), null);
        AgentMessage sent = alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, MessagePriority.HIGH);

        AgentMessage reply = bob.reply(sent, "result", Map.of("ok", true));

        assertEquals(ALICE, reply.getRecipientId());
        assertEquals(MessagePriority.HIGH, reply.getPriority());
    }

    // ===== Acks and retries =====

    @Test
    void shouldSettleOnDeliveredAndReadAcks() {
        AgentMessenger alice = messenger(ALICE);
        AgentChannel channel = alice.createChannel(List.of(BOB), null);
        AgentMessage first = alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, null);
        AgentMessage second = alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, null);

        alice.handleAck(MessageAck.delivered(first.getId(), BOB, clock.instant()));
        alice.handleAck(MessageAck.read(second.getId(), BOB, clock.instant()));

        assertEquals(0, alice.getPendingCount());
        assertEquals(DeliveryStatus.DELIVERED, first.getStatus());
        assertEquals(DeliveryStatus.ACKNOWLEDGED, second.getStatus());
        verify(eventPublisher, times(2)).publish(any(MessageAckedEvent.class));
    }

    @Test
    void shouldRetryUpToLimitThenFail() {
        AgentMessenger alice = messenger(ALICE);
        AgentChannel channel = alice.createChannel(List.of(BOB), ChannelConfig.builder().retryCount(2).build());
        AgentMessage sent = alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, null);
        MessageAck failure = MessageAck.failed(sent.getId(), BOB, clock.instant(), "busy");

        alice.handleAck(failure);
        alice.handleAck(failure);

        verify(eventPublisher, times(2)).publish(any(MessageRetryEvent.class));
        verify(taskScheduler).schedule(any(Runnable.class), eq(START.plusSeconds(1)));
        verify(taskScheduler).schedule(any(Runnable.class), eq(START.plusSeconds(2)));
        assertEquals(1, alice.getPendingCount());

        alice.handleAck(failure);

        verify(eventPublisher).publish(new MessageFailedEvent(ALICE, sent, failure));
        assertEquals(DeliveryStatus.FAILED, sent.getStatus());
        assertEquals(0, alice.getPendingCount());
    }

    @Test
    void shouldDropRetryWhenQueueFull() {
        properties.getMessaging().setMaxQueueSize(0);
        AgentMessenger alice = messenger(ALICE);
        AgentChannel channel = alice.createChannel(List.of(BOB), null);
        AgentMessage sent = alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, null);

        alice.handleAck(MessageAck.failed(sent.getId(), BOB, clock.instant(), "busy"));

        verify(eventPublisher).publish(any(RetryQueueFullEvent.class));
        verify(eventPublisher, never()).publish(any(MessageRetryEvent.class));
    }

    @Test
    void shouldIgnoreAckForUnknownMessage() {
        AgentMessenger alice = messenger(ALICE);

        alice.handleAck(MessageAck.delivered("msg_unknown", BOB, clock.instant()));

        verify(eventPublisher, never()).publish(any(MessageAckedEvent.class));
    }

    @Test
    void shouldExpireStalePendingMessages() {
        AgentMessenger alice = messenger(ALICE);
        AgentChannel channel = alice.createChannel(List.of(BOB), null);
        AgentMessage sent = alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, null);

        clock.advance(Duration.ofSeconds(30));
        assertEquals(0, alice.cleanupExpired());
        clock.advance(Duration.ofSeconds(1));
        assertEquals(1, alice.cleanupExpired());

        assertEquals(DeliveryStatus.EXPIRED, sent.getStatus());
        assertTrue(alice.getPendingMessage(sent.getId()).isEmpty());
        verify(eventPublisher).publish(any(MessageExpiredEvent.class));
    }

    @Test
    void shouldForgetEverythingOnDispose() {
        AgentMessenger alice = messenger(ALICE);
        alice.initializeEncryption();
        AgentChannel channel = alice.createChannel(List.of(BOB), null);
        alice.send(channel.getId(), BOB, TASK_TYPE, PAYLOAD, null);

        alice.dispose();

        assertEquals(0, alice.getPendingCount());
        assertNull(alice.getPublicKey());
    }
}
