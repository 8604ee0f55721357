package me.golemcore.agentlink.adapter.inbound.web.controller;

import me.golemcore.agentlink.domain.model.ActionCategory;
import me.golemcore.agentlink.domain.model.AgentPolicyState;
import me.golemcore.agentlink.domain.model.ApprovalRequest;
import me.golemcore.agentlink.domain.model.ApprovalResolution;
import me.golemcore.agentlink.domain.model.ApprovalStatus;
import me.golemcore.agentlink.domain.model.AuditDecision;
import me.golemcore.agentlink.domain.model.AuditLogEntry;
import me.golemcore.agentlink.domain.model.AuditLogFilter;
import me.golemcore.agentlink.domain.model.GovernanceMode;
import me.golemcore.agentlink.domain.model.GovernancePolicy;
import me.golemcore.agentlink.domain.model.RollbackCheckpoint;
import me.golemcore.agentlink.domain.service.GovernanceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GovernanceControllerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final String AGENT = "agent-1";

    private GovernanceService governanceService;
    private GovernanceController controller;
    private AgentPolicyState state;

    @BeforeEach
    void setUp() {
        governanceService = mock(GovernanceService.class);
        controller = new GovernanceController(governanceService);
        state = AgentPolicyState.builder()
                .agentId(AGENT)
                .currentMode(GovernanceMode.SUPERVISED)
                .policy(GovernancePolicy.builder().approvedOperators(new ArrayList<>(List.of("alice"))).build())
                .sessionStartTime(T0)
                .actionCountThisSession(3)
                .build();
        when(governanceService.getState(AGENT)).thenReturn(Optional.of(state));
        when(governanceService.getState("ghost")).thenReturn(Optional.empty());
    }

    private ApprovalRequest addApproval(String id, Instant createdAt, ApprovalStatus status) {
        ApprovalRequest request = ApprovalRequest.builder()
                .id(id)
                .timestamp(createdAt)
                .agentId(AGENT)
                .action("transfer")
                .category(ActionCategory.FINANCIAL)
                .confidence(0.9)
                .riskScore(0.2)
                .status(status)
                .build();
        state.getPendingApprovals().add(request);
        return request;
    }

    private static HttpStatus statusOf(ResponseStatusException e) {
        return HttpStatus.valueOf(e.getStatusCode().value());
    }

    // ===== State =====

    @Test
    void shouldListAttachedAgentsSorted() {
        when(governanceService.getAttachedAgents()).thenReturn(Set.of("b", "a"));

        StepVerifier.create(controller.getAttachedAgents())
                .assertNext(resp -> assertEquals(List.of("a", "b"), resp.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldReturnSessionState() {
        addApproval("approval_1", T0, ApprovalStatus.PENDING);
        addApproval("approval_2", T0, ApprovalStatus.APPROVED);
        state.getRollbackCheckpoints().add(RollbackCheckpoint.builder()
                .id("checkpoint_1").action("transfer").timestamp(T0).canRollback(true).build());
        state.getRollbackCheckpoints().add(RollbackCheckpoint.builder()
                .id("checkpoint_0").action("transfer").timestamp(T0).canRollback(false).build());

        StepVerifier.create(controller.getState(AGENT))
                .assertNext(resp -> {
                    GovernanceController.GovernanceStateResponse body = resp.getBody();
                    assertNotNull(body);
                    assertEquals("SUPERVISED", body.mode());
                    assertEquals(3, body.actionCount());
                    assertEquals(100, body.maxAutonomousActions());
                    assertEquals(T0.toString(), body.sessionStartTime());
                    assertEquals(1, body.pendingApprovals());
                    assertEquals(1, body.checkpoints().size());
                    assertEquals("checkpoint_1", body.checkpoints().get(0).id());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectUnknownAgent() {
        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> controller.getState("ghost"));
        assertEquals(HttpStatus.NOT_FOUND, statusOf(e));
    }

    @Test
    void shouldListApprovalsNewestFirstAndFilterByStatus() {
        addApproval("approval_1", T0, ApprovalStatus.PENDING);
        addApproval("approval_2", T0.plusSeconds(5), ApprovalStatus.REJECTED);

        StepVerifier.create(controller.getApprovals(AGENT, null))
                .assertNext(resp -> assertEquals(List.of("approval_2", "approval_1"),
                        resp.getBody().stream().map(GovernanceController.ApprovalDto::id).toList()))
                .verifyComplete();
        StepVerifier.create(controller.getApprovals(AGENT, "pending"))
                .assertNext(resp -> assertEquals(1, resp.getBody().size()))
                .verifyComplete();

        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> controller.getApprovals(AGENT, "maybe"));
        assertEquals(HttpStatus.BAD_REQUEST, statusOf(e));
    }

    // ===== Approvals =====

    private void givenResolution(String approvalId, boolean approved, String operator, String reason,
            ApprovalResolution.Outcome outcome, ApprovalRequest request) {
        when(governanceService.resolveApprovalRequest(AGENT, approvalId, approved, operator, reason))
                .thenReturn(ApprovalResolution.of(outcome, request));
    }

    private ResponseStatusException resolveExpectingError(String approvalId, boolean approved, String operator,
            String reason) {
        return assertThrows(ResponseStatusException.class,
                () -> controller.resolveApproval(AGENT, approvalId,
                        new GovernanceController.ApprovalDecisionRequest(approved, operator, reason)));
    }

    @Test
    void shouldResolveApproval() {
        ApprovalRequest request = addApproval("approval_1", T0, ApprovalStatus.APPROVED);
        request.setApprover("alice");
        givenResolution("approval_1", true, "alice", null, ApprovalResolution.Outcome.RESOLVED, request);

        StepVerifier.create(controller.resolveApproval(AGENT, "approval_1",
                new GovernanceController.ApprovalDecisionRequest(true, "alice", null)))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.OK, resp.getStatusCode());
                    assertEquals("APPROVED", resp.getBody().status());
                    assertEquals("alice", resp.getBody().approver());
                })
                .verifyComplete();
    }

    @Test
    void shouldRequireDecisionAndOperator() {
        ResponseStatusException missingDecision = assertThrows(ResponseStatusException.class,
                () -> controller.resolveApproval(AGENT, "approval_1",
                        new GovernanceController.ApprovalDecisionRequest(null, "alice", null)));
        ResponseStatusException missingOperator = resolveExpectingError("approval_1", true, " ", null);

        assertEquals(HttpStatus.BAD_REQUEST, statusOf(missingDecision));
        assertEquals(HttpStatus.BAD_REQUEST, statusOf(missingOperator));
        verify(governanceService, never()).resolveApprovalRequest(anyString(), anyString(), anyBoolean(), any(),
                any());
    }

    @Test
    void shouldMapUnauthorizedOperatorToForbidden() {
        givenResolution("approval_1", true, "mallory", null, ApprovalResolution.Outcome.UNAUTHORIZED, null);

        ResponseStatusException e = resolveExpectingError("approval_1", true, "mallory", null);

        assertEquals(HttpStatus.FORBIDDEN, statusOf(e));
        verify(governanceService).resolveApprovalRequest(AGENT, "approval_1", true, "mallory", null);
    }

    @Test
    void shouldMapClosedRequestToConflict() {
        ApprovalRequest request = addApproval("approval_1", T0, ApprovalStatus.EXPIRED);
        givenResolution("approval_1", false, "alice", "no", ApprovalResolution.Outcome.ALREADY_RESOLVED, request);

        ResponseStatusException e = resolveExpectingError("approval_1", false, "alice", "no");

        assertEquals(HttpStatus.CONFLICT, statusOf(e));
        assertEquals("Approval request already expired", e.getReason());
    }

    @Test
    void shouldMapMissingReasonToBadRequest() {
        ApprovalRequest request = addApproval("approval_1", T0, ApprovalStatus.PENDING);
        givenResolution("approval_1", true, "alice", "", ApprovalResolution.Outcome.REASON_REQUIRED, request);

        ResponseStatusException e = resolveExpectingError("approval_1", true, "alice", "");

        assertEquals(HttpStatus.BAD_REQUEST, statusOf(e));
    }

    @Test
    void shouldMapUnknownApprovalOrAgentToNotFound() {
        givenResolution("approval_9", true, "alice", null, ApprovalResolution.Outcome.NOT_FOUND, null);
        when(governanceService.resolveApprovalRequest("ghost", "approval_1", true, "alice", null))
                .thenReturn(ApprovalResolution.of(ApprovalResolution.Outcome.NOT_GOVERNED, null));

        ResponseStatusException missingApproval = resolveExpectingError("approval_9", true, "alice", null);
        ResponseStatusException missingAgent = assertThrows(ResponseStatusException.class,
                () -> controller.resolveApproval("ghost", "approval_1",
                        new GovernanceController.ApprovalDecisionRequest(true, "alice", null)));

        assertEquals(HttpStatus.NOT_FOUND, statusOf(missingApproval));
        assertEquals(HttpStatus.NOT_FOUND, statusOf(missingAgent));
    }

    // ===== Mode and rollback =====

    @Test
    void shouldChangeMode() {
        when(governanceService.requestModeChange(AGENT, GovernanceMode.AUTONOMOUS, "alice")).thenAnswer(inv -> {
            state.setCurrentMode(GovernanceMode.AUTONOMOUS);
            return true;
        });

        StepVerifier.create(controller.changeMode(AGENT, new GovernanceController.ModeChangeRequest("autonomous",
                "alice")))
                .assertNext(resp -> assertEquals("AUTONOMOUS", resp.getBody().mode()))
                .verifyComplete();
    }

    @Test
    void shouldRejectInvalidOrUnauthorizedModeChange() {
        ResponseStatusException invalid = assertThrows(ResponseStatusException.class,
                () -> controller.changeMode(AGENT, new GovernanceController.ModeChangeRequest("chaotic", "alice")));
        ResponseStatusException refused = assertThrows(ResponseStatusException.class,
                () -> controller.changeMode(AGENT, new GovernanceController.ModeChangeRequest("manual", "mallory")));

        assertEquals(HttpStatus.BAD_REQUEST, statusOf(invalid));
        assertEquals(HttpStatus.FORBIDDEN, statusOf(refused));
    }

    @Test
    void shouldRollbackCheckpoint() {
        when(governanceService.rollback(AGENT, "checkpoint_1")).thenReturn(Optional.of(Map.of("balance", 100)));

        StepVerifier.create(controller.rollback(AGENT, "checkpoint_1"))
                .assertNext(resp -> {
                    assertEquals("checkpoint_1", resp.getBody().checkpointId());
                    assertEquals(100, resp.getBody().stateBefore().get("balance"));
                })
                .verifyComplete();
    }

    @Test
    void shouldReportUnavailableRollback() {
        when(governanceService.rollback(AGENT, "checkpoint_1")).thenReturn(Optional.empty());

        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> controller.rollback(AGENT, "checkpoint_1"));

        assertEquals(HttpStatus.CONFLICT, statusOf(e));
        assertEquals("Rollback not available: checkpoint_1", e.getReason());
    }

    // ===== Audit =====

    @Test
    void shouldBuildAuditFilterFromParameters() {
        AuditLogEntry entry = AuditLogEntry.builder()
                .id("audit_1").timestamp(T0).agentId(AGENT).action("transfer")
                .decision(AuditDecision.APPROVED).approver("alice").build();
        when(governanceService.queryAudit(any())).thenReturn(List.of(entry));

        StepVerifier.create(controller.queryAudit(AGENT, "transfer", "approved", T0.toString(), null, 10, 0))
                .assertNext(resp -> {
                    assertEquals(1, resp.getBody().size());
                    assertEquals("APPROVED", resp.getBody().get(0).decision());
                })
                .verifyComplete();

        ArgumentCaptor<AuditLogFilter> filter = ArgumentCaptor.forClass(AuditLogFilter.class);
        verify(governanceService).queryAudit(filter.capture());
        assertEquals(AuditDecision.APPROVED, filter.getValue().getDecision());
        assertEquals(T0, filter.getValue().getFrom());
        assertEquals(10, filter.getValue().getLimit());
    }

    @Test
    void shouldRejectMalformedAuditParameters() {
        ResponseStatusException badInstant = assertThrows(ResponseStatusException.class,
                () -> controller.queryAudit(null, null, null, "yesterday", null, null, null));
        ResponseStatusException negative = assertThrows(ResponseStatusException.class,
                () -> controller.queryAudit(null, null, null, null, null, -1, null));

        assertEquals(HttpStatus.BAD_REQUEST, statusOf(badInstant));
        assertTrue(badInstant.getReason().contains("from"));
        assertEquals(HttpStatus.BAD_REQUEST, statusOf(negative));
    }
}
