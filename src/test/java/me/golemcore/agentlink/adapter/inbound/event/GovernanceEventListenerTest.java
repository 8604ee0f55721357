package me.golemcore.agentlink.adapter.inbound.event;

import me.golemcore.agentlink.domain.model.ActionCategory;
import me.golemcore.agentlink.domain.model.ActionIntent;
import me.golemcore.agentlink.domain.model.ActionIntentEvent;
import me.golemcore.agentlink.domain.model.ApprovalResolution;
import me.golemcore.agentlink.domain.model.GovernanceDecision;
import me.golemcore.agentlink.domain.model.GovernanceMode;
import me.golemcore.agentlink.domain.model.ModeChangeRequestEvent;
import me.golemcore.agentlink.domain.model.OperatorDecisionEvent;
import me.golemcore.agentlink.domain.model.RollbackRequestEvent;
import me.golemcore.agentlink.domain.service.GovernanceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GovernanceEventListenerTest {

    private GovernanceService governanceService;
    private GovernanceEventListener listener;

    @BeforeEach
    void setUp() {
        governanceService = mock(GovernanceService.class);
        listener = new GovernanceEventListener(governanceService);
    }

    @Test
    void shouldEvaluateActionIntent() {
        ActionIntent intent = ActionIntent.builder()
                .action("write_file")
                .category(ActionCategory.WRITE)
                .confidence(0.9)
                .riskScore(0.1)
                .build();
        when(governanceService.handleActionRequest("agent-1", intent))
                .thenReturn(GovernanceDecision.notAttached("agent-1", "write_file"));

        listener.onActionIntent(new ActionIntentEvent("agent-1", intent));

        verify(governanceService).handleActionRequest("agent-1", intent);
    }

    @Test
    void shouldForwardOperatorDecision() {
        when(governanceService.resolveApprovalRequest("agent-1", "approval_1", false, "alice", "too risky"))
                .thenReturn(ApprovalResolution.of(ApprovalResolution.Outcome.NOT_FOUND, null));

        listener.onOperatorDecision(new OperatorDecisionEvent("agent-1", "approval_1", false, "alice", "too risky"));

        verify(governanceService).resolveApprovalRequest("agent-1", "approval_1", false, "alice", "too risky");
    }

    @Test
    void shouldForwardModeChange() {
        listener.onModeChangeRequest(new ModeChangeRequestEvent("agent-1", GovernanceMode.MANUAL, "alice"));

        verify(governanceService).requestModeChange("agent-1", GovernanceMode.MANUAL, "alice");
    }

    @Test
    void shouldForwardRollback() {
        when(governanceService.rollback("agent-1", "checkpoint_1")).thenReturn(Optional.empty());

        listener.onRollbackRequest(new RollbackRequestEvent("agent-1", "checkpoint_1"));

        verify(governanceService).rollback("agent-1", "checkpoint_1");
    }
}
