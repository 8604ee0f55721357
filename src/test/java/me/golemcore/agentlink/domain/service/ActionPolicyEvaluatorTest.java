package me.golemcore.agentlink.domain.service;

import me.golemcore.agentlink.domain.model.ActionCategory;
import me.golemcore.agentlink.domain.model.ActionEvaluation;
import me.golemcore.agentlink.domain.model.ActionIntent;
import me.golemcore.agentlink.domain.model.AgentPolicyState;
import me.golemcore.agentlink.domain.model.EscalationCondition;
import me.golemcore.agentlink.domain.model.EscalationLevel;
import me.golemcore.agentlink.domain.model.EscalationRule;
import me.golemcore.agentlink.domain.model.GovernanceMode;
import me.golemcore.agentlink.domain.model.GovernancePolicy;
import me.golemcore.agentlink.domain.model.TrustRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionPolicyEvaluatorTest {

    private static final Instant NOON = Instant.parse("2026-03-01T12:00:00Z");
    private static final double DELTA = 1e-9;

    private ActionPolicyEvaluator evaluator;
    private GovernancePolicy policy;
    private AgentPolicyState state;

    @BeforeEach
    void setUp() {
        evaluator = new ActionPolicyEvaluator(new ConstitutionalValidator(), Clock.fixed(NOON, ZoneOffset.UTC));
        policy = GovernancePolicy.builder().build();
        state = AgentPolicyState.builder()
                .agentId("agent-1")
                .currentMode(GovernanceMode.SUPERVISED)
                .policy(policy)
                .sessionStartTime(NOON)
                .build();
    }

    private static ActionIntent intent(String action, ActionCategory category, double confidence, double risk) {
        return ActionIntent.builder()
                .action(action)
                .category(category)
                .confidence(confidence)
                .riskScore(risk)
                .build();
    }

    private ActionEvaluation evaluate(ActionIntent intent) {
        return evaluator.evaluate(state, state.getPolicy(), intent, NOON);
    }

    // ===== Precedence =====

    @Test
    void shouldBlockConstitutionalViolationBeforeCategoryChecks() {
        ActionEvaluation evaluation = evaluate(intent("export_credentials", ActionCategory.READ, 0.99, 0.0));

        assertFalse(evaluation.isApproved());
        assertTrue(evaluation.isViolation());
        assertEquals(EscalationLevel.EMERGENCY_STOP, evaluation.getEscalationLevel());
        assertEquals("builtin.no-credential-exfiltration", evaluation.getViolations().get(0).getId());
    }

    @Test
    void shouldRequireApprovalForEverythingInManualMode() {
        state.setCurrentMode(GovernanceMode.MANUAL);

        ActionEvaluation evaluation = evaluate(intent("list_files", ActionCategory.READ, 0.99, 0.0));

        assertFalse(evaluation.isApproved());
        assertEquals(EscalationLevel.HARD_BLOCK, evaluation.getEscalationLevel());
    }

    @Test
    void shouldAutoApproveNeverApproveCategoryDespiteLowConfidence() {
        ActionEvaluation evaluation = evaluate(intent("list_files", ActionCategory.READ, 0.1, 0.9));

        assertTrue(evaluation.isApproved());
        assertEquals(EscalationLevel.NONE, evaluation.getEscalationLevel());
    }

    @Test
    void shouldRequireApprovalForFinancialActionEvenWhenConfident() {
        ActionEvaluation evaluation = evaluate(intent("transfer_funds", ActionCategory.FINANCIAL, 0.95, 0.3));

        assertFalse(evaluation.isApproved());
        assertEquals(EscalationLevel.HARD_BLOCK, evaluation.getEscalationLevel());
        assertEquals("Category financial always requires approval", evaluation.getReason());
    }

    // ===== Thresholds =====

    @Test
    void shouldSoftBlockModeratelyLowConfidence() {
        ActionEvaluation evaluation = evaluate(intent("write_file", ActionCategory.WRITE, 0.7, 0.1));

        assertFalse(evaluation.isApproved());
        assertEquals(EscalationLevel.SOFT_BLOCK, evaluation.getEscalationLevel());
        assertEquals("Confidence 0.70 below threshold 0.80", evaluation.getReason());
    }

    @Test
    void shouldHardBlockVeryLowConfidence() {
        ActionEvaluation evaluation = evaluate(intent("write_file", ActionCategory.WRITE, 0.4, 0.1));

        assertEquals(EscalationLevel.HARD_BLOCK, evaluation.getEscalationLevel());
    }

    @Test
    void shouldEscalateByRisk() {
        assertEquals(EscalationLevel.HARD_BLOCK,
                evaluate(intent("run_job", ActionCategory.EXECUTE, 0.9, 0.6)).getEscalationLevel());
        assertEquals(EscalationLevel.EMERGENCY_STOP,
                evaluate(intent("run_job", ActionCategory.EXECUTE, 0.9, 0.9)).getEscalationLevel());
    }

    @Test
    void shouldApproveWithinLimits() {
        ActionEvaluation evaluation = evaluate(intent("write_file", ActionCategory.WRITE, 0.9, 0.2));

        assertTrue(evaluation.isApproved());
        assertEquals(0.9, evaluation.getEffectiveConfidence(), DELTA);
    }

    // ===== Trust =====

    @Test
    void shouldAddTrustBonusToConfidence() {
        TrustRecord trust = new TrustRecord();
        trust.setApprovals(10);
        trust.setConfidenceBonus(0.10);
        state.getTrust().put("write:deploy", trust);

        ActionEvaluation evaluation = evaluate(intent("deploy", ActionCategory.WRITE, 0.75, 0.2));

        assertTrue(evaluation.isApproved());
        assertEquals(0.85, evaluation.getEffectiveConfidence(), DELTA);
    }

    @Test
    void shouldNotShareTrustAcrossActions() {
        TrustRecord trust = new TrustRecord();
        trust.setApprovals(10);
        trust.setConfidenceBonus(0.10);
        state.getTrust().put("write:deploy", trust);

        assertFalse(evaluate(intent("rollout", ActionCategory.WRITE, 0.75, 0.2)).isApproved());
    }

    // ===== Escalation rules =====

    @Test
    void shouldBlockOnHardEscalationRule() {
        state.setPolicy(policy.toBuilder()
                .escalationRules(List.of(EscalationRule.builder()
                        .condition(EscalationCondition.keywordMatch("prod"))
                        .level(EscalationLevel.HARD_BLOCK)
                        .build()))
                .build());

        ActionEvaluation evaluation = evaluate(intent("deploy_PROD", ActionCategory.EXECUTE, 0.9, 0.1));

        assertFalse(evaluation.isApproved());
        assertEquals(EscalationLevel.HARD_BLOCK, evaluation.getEscalationLevel());
        assertEquals("Escalation rule matched: KEYWORD_MATCH", evaluation.getReason());
    }

    @Test
    void shouldTakeLevelFromFirstMatchingBlockingRule() {
        state.setPolicy(policy.toBuilder()
                .escalationRules(List.of(
                        EscalationRule.builder()
                                .condition(EscalationCondition.categoryMatch(ActionCategory.EXECUTE))
                                .level(EscalationLevel.NOTIFY)
                                .build(),
                        EscalationRule.builder()
                                .condition(EscalationCondition.keywordMatch("prod"))
                                .level(EscalationLevel.HARD_BLOCK)
                                .build(),
                        EscalationRule.builder()
                                .condition(EscalationCondition.categoryMatch(ActionCategory.EXECUTE))
                                .level(EscalationLevel.EMERGENCY_STOP)
                                .build()))
                .build());

        ActionEvaluation evaluation = evaluate(intent("deploy_prod", ActionCategory.EXECUTE, 0.9, 0.1));

        assertFalse(evaluation.isApproved());
        assertEquals(EscalationLevel.HARD_BLOCK, evaluation.getEscalationLevel());
        assertEquals("Escalation rule matched: KEYWORD_MATCH", evaluation.getReason());
    }

    @Test
    void shouldApproveWhenOnlyNotifyRuleMatches() {
        state.setPolicy(policy.toBuilder()
                .escalationRules(List.of(EscalationRule.builder()
                        .condition(EscalationCondition.categoryMatch(ActionCategory.EXECUTE))
                        .level(EscalationLevel.NOTIFY)
                        .build()))
                .build());

        assertTrue(evaluate(intent("run_job", ActionCategory.EXECUTE, 0.9, 0.1)).isApproved());
    }

    @Test
    void shouldMatchActionCountRule() {
        EscalationRule rule = EscalationRule.builder()
                .condition(EscalationCondition.actionCountAtLeast(5))
                .level(EscalationLevel.HARD_BLOCK)
                .build();
        state.setPolicy(policy.toBuilder().escalationRules(List.of(rule)).build());
        ActionIntent intent = intent("run_job", ActionCategory.EXECUTE, 0.9, 0.1);

        state.setActionCountThisSession(4);
        assertTrue(evaluate(intent).isApproved());
        state.setActionCountThisSession(5);
        assertFalse(evaluate(intent).isApproved());
    }

    @Test
    void shouldMatchTimeWindowsIncludingWrapAround() {
        EscalationRule daytime = EscalationRule.builder()
                .condition(EscalationCondition.timeWindow("11:00-13:00"))
                .level(EscalationLevel.NOTIFY)
                .build();
        EscalationRule overnight = EscalationRule.builder()
                .condition(EscalationCondition.timeWindow("22:00-06:00"))
                .level(EscalationLevel.NOTIFY)
                .build();
        GovernancePolicy windowed = policy.toBuilder().escalationRules(List.of(daytime, overnight)).build();
        ActionIntent intent = intent("run_job", ActionCategory.EXECUTE, 0.9, 0.1);

        assertEquals(List.of(daytime), evaluator.matchingRules(state, windowed, intent, NOON));
        assertEquals(List.of(overnight),
                evaluator.matchingRules(state, windowed, intent, Instant.parse("2026-03-01T23:30:00Z")));
        assertEquals(List.of(overnight),
                evaluator.matchingRules(state, windowed, intent, Instant.parse("2026-03-02T05:59:00Z")));
    }

    @Test
    void shouldIgnoreMalformedTimeWindow() {
        EscalationRule broken = EscalationRule.builder()
                .condition(EscalationCondition.timeWindow("noon"))
                .level(EscalationLevel.HARD_BLOCK)
                .build();
        GovernancePolicy windowed = policy.toBuilder().escalationRules(List.of(broken)).build();

        assertTrue(evaluator.matchingRules(state, windowed,
                intent("run_job", ActionCategory.EXECUTE, 0.9, 0.1), NOON).isEmpty());
    }

    // ===== Determinism =====

    @Test
    void shouldReturnSameVerdictForSameInputs() {
        ActionIntent intent = intent("write_file", ActionCategory.WRITE, 0.7, 0.1);

        assertEquals(evaluate(intent), evaluate(intent));
        assertEquals(0, state.getActionCountThisSession());
        assertTrue(state.getTrust().isEmpty());
    }
}
