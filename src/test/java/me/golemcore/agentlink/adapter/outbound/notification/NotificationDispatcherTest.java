package me.golemcore.agentlink.adapter.outbound.notification;

import me.golemcore.agentlink.domain.model.ActionCategory;
import me.golemcore.agentlink.domain.model.ApprovalRequest;
import me.golemcore.agentlink.domain.model.NotificationChannel;
import me.golemcore.agentlink.domain.model.NotificationPriority;
import me.golemcore.agentlink.domain.model.NotificationResult;
import me.golemcore.agentlink.infrastructure.config.AgentLinkProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NotificationDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private AgentLinkProperties properties;
    private NotificationProvider emailProvider;
    private NotificationProvider webhookProvider;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        properties = new AgentLinkProperties();
        emailProvider = mock(NotificationProvider.class);
        when(emailProvider.getChannel()).thenReturn(NotificationChannel.EMAIL);
        webhookProvider = mock(NotificationProvider.class);
        when(webhookProvider.getChannel()).thenReturn(NotificationChannel.WEBHOOK);
        dispatcher = new NotificationDispatcher(List.of(emailProvider, webhookProvider), properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ApprovalRequest request(ActionCategory category, double confidence, double risk) {
        return ApprovalRequest.builder()
                .id("approval_1")
                .agentId("agent-1")
                .action("run_job")
                .category(category)
                .confidence(confidence)
                .riskScore(risk)
                .build();
    }

    // ===== Dispatch =====

    @Test
    void shouldReturnOneResultPerChannel() {
        when(emailProvider.isConfigured()).thenReturn(true);
        when(emailProvider.send(any())).thenReturn(CompletableFuture.completedFuture(
                NotificationResult.success(NotificationChannel.EMAIL, "m1", NOW)));

        List<NotificationResult> results = dispatcher.notify(request(ActionCategory.WRITE, 0.9, 0.1),
                List.of(NotificationChannel.EMAIL, NotificationChannel.SMS)).join();

        assertEquals(2, results.size());
        assertTrue(results.get(0).isSuccess());
        assertFalse(results.get(1).isSuccess());
        assertEquals("No provider for channel: sms", results.get(1).getError());
    }

    @Test
    void shouldSkipUnconfiguredProvider() {
        when(webhookProvider.isConfigured()).thenReturn(false);

        List<NotificationResult> results = dispatcher.notify(request(ActionCategory.WRITE, 0.9, 0.1),
                List.of(NotificationChannel.WEBHOOK)).join();

        assertEquals("No configuration for channel: webhook", results.get(0).getError());
        verify(webhookProvider, never()).send(any());
    }

    @Test
    void shouldReportThrowingProviderAsFailure() {
        when(emailProvider.isConfigured()).thenReturn(true);
        when(emailProvider.send(any())).thenThrow(new IllegalStateException("boom"));
        when(webhookProvider.isConfigured()).thenReturn(true);
        when(webhookProvider.send(any())).thenReturn(CompletableFuture.failedFuture(
                new IllegalStateException("async boom")));

        List<NotificationResult> results = dispatcher.notify(request(ActionCategory.WRITE, 0.9, 0.1),
                List.of(NotificationChannel.EMAIL, NotificationChannel.WEBHOOK)).join();

        assertEquals("boom", results.get(0).getError());
        assertEquals(NotificationChannel.WEBHOOK, results.get(1).getChannel());
        assertFalse(results.get(1).isSuccess());
    }

    @Test
    void shouldCompleteWithNoChannels() {
        assertTrue(dispatcher.notify(request(ActionCategory.WRITE, 0.9, 0.1), List.of()).join().isEmpty());
    }

    // ===== Payload =====

    @Test
    void shouldBuildPayloadWithActionUrl() {
        properties.getNotifications().setActionUrlBase("https://ops.example/api/governance/");
        ApprovalRequest request = request(ActionCategory.WRITE, 0.9, 0.1);
        request.setExpiresAt(NOW.plusSeconds(600));

        NotificationPayload payload = dispatcher.buildPayload(request);

        assertEquals("Approval Required: run_job", payload.getTitle());
        assertEquals("Agent agent-1 requests run_job (write)", payload.getMessage());
        assertEquals("https://ops.example/api/governance/agent-1/approvals/approval_1", payload.getActionUrl());
        assertEquals(NOW.plusSeconds(600), payload.getExpiresAt());
    }

    @Test
    void shouldUseDescriptionAndOmitUrlWithoutBase() {
        ApprovalRequest request = request(ActionCategory.WRITE, 0.9, 0.1);
        request.setDescription("Rebuild the index");

        NotificationPayload payload = dispatcher.buildPayload(request);

        assertEquals("Rebuild the index", payload.getMessage());
        assertNull(payload.getActionUrl());
    }

    @Test
    void shouldDerivePriorityFromRiskConfidenceAndCategory() {
        assertEquals(NotificationPriority.CRITICAL,
                NotificationDispatcher.determinePriority(request(ActionCategory.READ, 0.9, 0.81)));
        assertEquals(NotificationPriority.HIGH,
                NotificationDispatcher.determinePriority(request(ActionCategory.READ, 0.9, 0.6)));
        assertEquals(NotificationPriority.HIGH,
                NotificationDispatcher.determinePriority(request(ActionCategory.READ, 0.4, 0.1)));
        assertEquals(NotificationPriority.HIGH,
                NotificationDispatcher.determinePriority(request(ActionCategory.FINANCIAL, 0.9, 0.1)));
        assertEquals(NotificationPriority.NORMAL,
                NotificationDispatcher.determinePriority(request(ActionCategory.WRITE, 0.9, 0.5)));
    }
}
