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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentlink.domain.model.ActionApprovedEvent;
import me.golemcore.agentlink.domain.model.ActionEvaluation;
import me.golemcore.agentlink.domain.model.ActionIntent;
import me.golemcore.agentlink.domain.model.AgentPolicyState;
import me.golemcore.agentlink.domain.model.ApprovalRequest;
import me.golemcore.agentlink.domain.model.ApprovalRequiredEvent;
import me.golemcore.agentlink.domain.model.ApprovalResolution;
import me.golemcore.agentlink.domain.model.ApprovalResolvedEvent;
import me.golemcore.agentlink.domain.model.ApprovalStatus;
import me.golemcore.agentlink.domain.model.AuditDecision;
import me.golemcore.agentlink.domain.model.AuditLogEntry;
import me.golemcore.agentlink.domain.model.AuditLogFilter;
import me.golemcore.agentlink.domain.model.AuditOutcome;
import me.golemcore.agentlink.domain.model.ConstitutionalRule;
import me.golemcore.agentlink.domain.model.EscalationRule;
import me.golemcore.agentlink.domain.model.GovernanceAttachedEvent;
import me.golemcore.agentlink.domain.model.GovernanceDecision;
import me.golemcore.agentlink.domain.model.GovernanceDetachedEvent;
import me.golemcore.agentlink.domain.model.GovernanceMode;
import me.golemcore.agentlink.domain.model.GovernancePolicy;
import me.golemcore.agentlink.domain.model.ModeChangedEvent;
import me.golemcore.agentlink.domain.model.NotificationChannel;
import me.golemcore.agentlink.domain.model.NotificationResult;
import me.golemcore.agentlink.domain.model.RollbackCheckpoint;
import me.golemcore.agentlink.domain.model.RollbackExecutedEvent;
import me.golemcore.agentlink.domain.model.TrustRecord;
import me.golemcore.agentlink.domain.model.UnauthorizedOperatorEvent;
import me.golemcore.agentlink.domain.model.ViolationCaughtEvent;
import me.golemcore.agentlink.infrastructure.config.GovernancePolicyFactory;
import me.golemcore.agentlink.port.outbound.AuditPort;
import me.golemcore.agentlink.port.outbound.DomainEventPublisher;
import me.golemcore.agentlink.port.outbound.NotificationPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Human-in-the-loop governance of agent actions.
 *
 * <p>
 * Each attached agent owns an {@link AgentPolicyState}. An action request is
 * evaluated by {@link ActionPolicyEvaluator} and the verdict is committed here:
 * auto-approved actions get a rollback checkpoint and an {@code AUTONOMOUS}
 * audit entry, everything else becomes an {@link ApprovalRequest} that
 * operators are notified about and later resolve.
 *
 * <p>
 * All mutations of one session happen while holding that session's monitor.
 * Notification and audit writes are asynchronous; their failures are logged
 * and never reach the caller.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GovernanceService {

    private static final String STATE_BEFORE = ActionIntent.STATE_BEFORE_KEY;

    private final ActionPolicyEvaluator evaluator;
    private final NotificationPort notificationPort;
    private final AuditPort auditPort;
    private final DomainEventPublisher eventPublisher;
    private final GovernancePolicyFactory policyFactory;
    private final Clock clock;

    private final Map<String, AgentPolicyState> sessions = new ConcurrentHashMap<>();

    // ==================== ATTACH / DETACH ====================

    public AgentPolicyState attach(String agentId) {
        return attach(agentId, policyFactory.defaultPolicy());
    }

    /**
     * Start governing {@code agentId}. Attaching an already governed agent
     * returns its existing session unchanged.
     */
    public AgentPolicyState attach(String agentId, GovernancePolicy policy) {
        boolean[] created = new boolean[1];
        AgentPolicyState state = sessions.computeIfAbsent(agentId, id -> {
            created[0] = true;
            return AgentPolicyState.builder()
                    .agentId(id)
                    .currentMode(policy.getMode())
                    .policy(policy)
                    .sessionStartTime(clock.instant())
                    .build();
        });
        if (created[0]) {
            log.info("[Governance] Attached to {} (mode={}, confidence>={}, risk<={})", agentId, policy.getMode(),
                    policy.getConfidenceThreshold(), policy.getRiskThreshold());
            eventPublisher.publish(new GovernanceAttachedEvent(agentId, policy.getMode(),
                    policy.getConfidenceThreshold(), policy.getRiskThreshold()));
        }
        return state;
    }

    /**
     * Stop governing {@code agentId}, archiving its checkpoints.
     */
    public boolean detach(String agentId) {
        AgentPolicyState state = sessions.remove(agentId);
        if (state == null) {
            return false;
        }
        List<AuditLogEntry> auditLog;
        List<RollbackCheckpoint> checkpoints;
        synchronized (state) {
            auditLog = List.copyOf(state.getAuditLog());
            checkpoints = List.copyOf(state.getRollbackCheckpoints());
        }
        if (state.getPolicy().isAuditLogEnabled()) {
            fireAndForget("archive checkpoints of " + agentId,
                    () -> auditPort.archiveCheckpoints(agentId, checkpoints));
        }
        log.info("[Governance] Detached from {} ({} audit entries, {} checkpoints)", agentId, auditLog.size(),
                checkpoints.size());
        eventPublisher.publish(new GovernanceDetachedEvent(agentId, auditLog, checkpoints));
        return true;
    }

    public Optional<AgentPolicyState> getState(String agentId) {
        return Optional.ofNullable(sessions.get(agentId));
    }

    public Set<String> getAttachedAgents() {
        return Set.copyOf(sessions.keySet());
    }

    // ==================== ACTION REQUESTS ====================

    public GovernanceDecision handleActionRequest(String agentId, ActionIntent intent) {
        AgentPolicyState state = sessions.get(agentId);
        if (state == null) {
            log.warn("[Governance] Action {} from ungoverned agent {}", intent.getAction(), agentId);
            return GovernanceDecision.notAttached(agentId, intent.getAction());
        }
        synchronized (state) {
            Instant now = clock.instant();
            ActionEvaluation evaluation = evaluator.evaluate(state, state.getPolicy(), intent, now);
            if (evaluation.isApproved()) {
                return commitAutonomous(state, intent, evaluation, now);
            }
            return commitApprovalRequired(state, intent, evaluation, now);
        }
    }

    private GovernanceDecision commitAutonomous(AgentPolicyState state, ActionIntent intent,
            ActionEvaluation evaluation, Instant now) {
        GovernancePolicy policy = state.getPolicy();
        state.setActionCountThisSession(state.getActionCountThisSession() + 1);

        RollbackCheckpoint checkpoint = createCheckpoint(state, intent.getAction(), stateBefore(intent.getMetadata()),
                now);
        AuditLogEntry entry = appendAudit(state, AuditLogEntry.builder()
                .agentId(state.getAgentId())
                .action(intent.getAction())
                .category(intent.getCategory())
                .decision(AuditDecision.AUTONOMOUS)
                .confidence(intent.getConfidence())
                .riskScore(intent.getRiskScore())
                .reason(evaluation.getReason())
                .rollbackAvailable(checkpoint != null)
                .rollbackId(checkpoint != null ? checkpoint.getId() : null)
                .violatedRuleIds(List.of()), now);

        log.debug("[Governance] {} auto-approved {}: {}", state.getAgentId(), intent.getAction(),
                evaluation.getReason());
        eventPublisher.publish(new ActionApprovedEvent(state.getAgentId(), intent.getAction(),
                evaluation.getReason(), true, null, checkpoint != null ? checkpoint.getId() : null));

        if (state.getCurrentMode() == GovernanceMode.AUTONOMOUS
                && state.getActionCountThisSession() >= policy.getMaxAutonomousActions()) {
            changeMode(state, GovernanceMode.SUPERVISED, "max_autonomous_actions_reached");
        }

        return GovernanceDecision.builder()
                .agentId(state.getAgentId())
                .action(intent.getAction())
                .approved(true)
                .reason(evaluation.getReason())
                .escalationLevel(evaluation.getEscalationLevel())
                .violatedRuleIds(List.of())
                .checkpointId(checkpoint != null ? checkpoint.getId() : null)
                .auditEntryId(entry != null ? entry.getId() : null)
                .build();
    }

    private GovernanceDecision commitApprovalRequired(AgentPolicyState state, ActionIntent intent,
            ActionEvaluation evaluation, Instant now) {
        GovernancePolicy policy = state.getPolicy();
        List<EscalationRule> matchedRules = evaluator.matchingRules(state, policy, intent, now);
        List<String> violatedRuleIds = evaluation.getViolations().stream().map(ConstitutionalRule::getId).toList();
        Duration timeout = policy.getApprovalTimeout();

        ApprovalRequest request = ApprovalRequest.builder()
                .id(IdGenerator.prefixed("approval", now))
                .timestamp(now)
                .agentId(state.getAgentId())
                .action(intent.getAction())
                .category(intent.getCategory())
                .description(intent.getDescription())
                .confidence(intent.getConfidence())
                .riskScore(intent.getRiskScore())
                .context(intent.getMetadata() != null ? new LinkedHashMap<>(intent.getMetadata()) : Map.of())
                .expiresAt(timeout == null || timeout.isZero() ? null : now.plus(timeout))
                .escalationLevel(evaluation.getEscalationLevel())
                .reason(evaluation.getReason())
                .requiresReason(matchedRules.stream().anyMatch(EscalationRule::isRequiresReason))
                .violatedRuleIds(violatedRuleIds)
                .build();
        state.getPendingApprovals().add(request);
        state.setLastEscalationTime(now);

        AuditLogEntry entry = appendAudit(state, AuditLogEntry.builder()
                .agentId(state.getAgentId())
                .action(intent.getAction())
                .category(intent.getCategory())
                .decision(AuditDecision.ESCALATED)
                .confidence(intent.getConfidence())
                .riskScore(intent.getRiskScore())
                .reason(evaluation.getReason())
                .violation(evaluation.isViolation())
                .violatedRuleIds(violatedRuleIds), now);

        if (evaluation.isViolation()) {
            log.warn("[Governance] {} violated constitution with {}: {}", state.getAgentId(), intent.getAction(),
                    violatedRuleIds);
            eventPublisher.publish(new ViolationCaughtEvent(state.getAgentId(), intent.getAction(),
                    violatedRuleIds, evaluation.getEscalationLevel()));
        }

        notifyOperators(request, alertChannels(policy, matchedRules));

        log.info("[Governance] {} needs approval for {} ({}): {}", state.getAgentId(), intent.getAction(),
                evaluation.getEscalationLevel(), evaluation.getReason());
        eventPublisher.publish(new ApprovalRequiredEvent(state.getAgentId(), request,
                evaluation.getEscalationLevel(), evaluation.getReason()));

        return GovernanceDecision.builder()
                .agentId(state.getAgentId())
                .action(intent.getAction())
                .approved(false)
                .reason(evaluation.getReason())
                .escalationLevel(evaluation.getEscalationLevel())
                .violation(evaluation.isViolation())
                .violatedRuleIds(violatedRuleIds)
                .approvalRequest(request)
                .auditEntryId(entry != null ? entry.getId() : null)
                .build();
    }

    private static List<NotificationChannel> alertChannels(GovernancePolicy policy, List<EscalationRule> rules) {
        Set<NotificationChannel> channels = new LinkedHashSet<>();
        if (policy.getNotificationChannels() != null) {
            channels.addAll(policy.getNotificationChannels());
        }
        for (EscalationRule rule : rules) {
            if (rule.getNotifyChannels() != null) {
                channels.addAll(rule.getNotifyChannels());
            }
        }
        return new ArrayList<>(channels);
    }

    private void notifyOperators(ApprovalRequest request, List<NotificationChannel> channels) {
        if (channels.isEmpty()) {
            return;
        }
        try {
            notificationPort.notify(request, channels).whenComplete((results, error) -> {
                if (error != null) {
                    log.error("[Governance] Notification for {} failed: {}", request.getId(), error.getMessage());
                } else {
                    long delivered = results.stream().filter(NotificationResult::isSuccess).count();
                    log.debug("[Governance] Notified {}/{} channels for {}", delivered, results.size(),
                            request.getId());
                }
            });
        } catch (RuntimeException e) {
            log.error("[Governance] Notification dispatch for {} failed: {}", request.getId(), e.getMessage());
        }
    }

    // ==================== OPERATOR DECISIONS ====================

    public boolean resolveApproval(String agentId, String requestId, boolean approved, String operator,
            String reason) {
        return resolveApprovalRequest(agentId, requestId, approved, operator, reason).isResolved();
    }

    /**
     * Applies an operator decision and reports why it was refused, if it was.
     * Refusals leave the request untouched.
     */
    public ApprovalResolution resolveApprovalRequest(String agentId, String requestId, boolean approved,
            String operator, String reason) {
        AgentPolicyState state = sessions.get(agentId);
        if (state == null) {
            return ApprovalResolution.of(ApprovalResolution.Outcome.NOT_GOVERNED, null);
        }
        synchronized (state) {
            GovernancePolicy policy = state.getPolicy();
            if (!policy.isOperatorApproved(operator)) {
                log.warn("[Governance] Unauthorized operator {} tried to resolve {}", operator, requestId);
                eventPublisher.publish(new UnauthorizedOperatorEvent(agentId, operator, "resolve:" + requestId));
                return ApprovalResolution.of(ApprovalResolution.Outcome.UNAUTHORIZED, null);
            }
            ApprovalRequest request = state.findApproval(requestId).orElse(null);
            if (request == null) {
                log.debug("[Governance] Ignoring resolution of unknown request {}", requestId);
                return ApprovalResolution.of(ApprovalResolution.Outcome.NOT_FOUND, null);
            }
            if (request.getStatus().isTerminal()) {
                log.debug("[Governance] Ignoring resolution of closed request {}", requestId);
                return ApprovalResolution.of(ApprovalResolution.Outcome.ALREADY_RESOLVED, request);
            }
            if (request.isRequiresReason() && (reason == null || reason.isBlank())) {
                log.warn("[Governance] Resolution of {} by {} rejected: reason required", requestId, operator);
                return ApprovalResolution.of(ApprovalResolution.Outcome.REASON_REQUIRED, request);
            }

            Instant now = clock.instant();
            request.setStatus(approved ? ApprovalStatus.APPROVED : ApprovalStatus.REJECTED);
            request.setApprover(operator);
            request.setApprovalTime(now);

            RollbackCheckpoint checkpoint = approved
                    ? createCheckpoint(state, request.getAction(), stateBefore(request.getContext()), now)
                    : null;
            String resolutionReason = reason != null && !reason.isBlank()
                    ? reason
                    : (approved ? "Approved by operator" : "Rejected by operator");
            appendAudit(state, AuditLogEntry.builder()
                    .agentId(agentId)
                    .action(request.getAction())
                    .category(request.getCategory())
                    .decision(approved ? AuditDecision.APPROVED : AuditDecision.REJECTED)
                    .confidence(request.getConfidence())
                    .riskScore(request.getRiskScore())
                    .approver(operator)
                    .reason(resolutionReason)
                    .rollbackAvailable(checkpoint != null)
                    .rollbackId(checkpoint != null ? checkpoint.getId() : null)
                    .violation(request.getViolatedRuleIds() != null && !request.getViolatedRuleIds().isEmpty())
                    .violatedRuleIds(request.getViolatedRuleIds()), now);

            if (approved) {
                TrustRecord trust = AdaptiveTrust.recordApproval(state, request.getCategory(), request.getAction());
                log.debug("[Governance] Trust for {} now {} approvals, bonus {}",
                        AdaptiveTrust.key(request.getCategory(), request.getAction()), trust.getApprovals(),
                        trust.getConfidenceBonus());
            }

            log.info("[Governance] {} {} request {} for {}", operator, approved ? "approved" : "rejected",
                    requestId, request.getAction());
            eventPublisher.publish(new ApprovalResolvedEvent(agentId, request, resolutionReason));
            if (approved) {
                eventPublisher.publish(new ActionApprovedEvent(agentId, request.getAction(), resolutionReason,
                        false, request.getId(), checkpoint != null ? checkpoint.getId() : null));
            }
            return ApprovalResolution.of(ApprovalResolution.Outcome.RESOLVED, request);
        }
    }

    public boolean requestModeChange(String agentId, GovernanceMode mode, String operator) {
        AgentPolicyState state = sessions.get(agentId);
        if (state == null || mode == null) {
            return false;
        }
        synchronized (state) {
            if (!state.getPolicy().isOperatorApproved(operator)) {
                log.warn("[Governance] Unauthorized operator {} tried to switch {} to {}", operator, agentId, mode);
                eventPublisher.publish(new UnauthorizedOperatorEvent(agentId, operator, "mode:" + mode));
                return false;
            }
            if (mode == GovernanceMode.AUTONOMOUS) {
                state.setActionCountThisSession(0);
            }
            changeMode(state, mode, "operator:" + operator);
            return true;
        }
    }

    private void changeMode(AgentPolicyState state, GovernanceMode mode, String trigger) {
        GovernanceMode previous = state.getCurrentMode();
        state.setCurrentMode(mode);
        log.info("[Governance] {} mode {} -> {} ({})", state.getAgentId(), previous, mode, trigger);
        eventPublisher.publish(new ModeChangedEvent(state.getAgentId(), previous, mode, trigger));
    }

    // ==================== TICK ====================

    /**
     * Periodic maintenance of one session: settles overdue approval requests,
     * purges expired checkpoints and demotes an autonomous agent that used up
     * its action budget.
     *
     * @return number of approval requests settled by timeout
     */
    public int tick(String agentId) {
        AgentPolicyState state = sessions.get(agentId);
        if (state == null) {
            return 0;
        }
        synchronized (state) {
            Instant now = clock.instant();
            GovernancePolicy policy = state.getPolicy();
            int settled = 0;
            for (ApprovalRequest request : state.getPendingApprovals()) {
                if (request.isOverdue(now)) {
                    settleByTimeout(state, request, policy.isAutoApproveOnTimeout(), now);
                    settled++;
                }
            }

            int before = state.getRollbackCheckpoints().size();
            state.getRollbackCheckpoints().removeIf(checkpoint -> checkpoint.isExpired(now));
            int purged = before - state.getRollbackCheckpoints().size();
            if (purged > 0) {
                log.debug("[Governance] Purged {} expired checkpoints of {}", purged, agentId);
            }

            if (state.getCurrentMode() == GovernanceMode.AUTONOMOUS
                    && state.getActionCountThisSession() >= policy.getMaxAutonomousActions()) {
                changeMode(state, GovernanceMode.SUPERVISED, "max_autonomous_actions_reached");
            }
            return settled;
        }
    }

    public void tickAll() {
        for (String agentId : sessions.keySet()) {
            tick(agentId);
        }
    }

    private void settleByTimeout(AgentPolicyState state, ApprovalRequest request, boolean autoApprove,
            Instant now) {
        request.setStatus(autoApprove ? ApprovalStatus.AUTO_APPROVED : ApprovalStatus.EXPIRED);
        request.setApprovalTime(now);

        RollbackCheckpoint checkpoint = autoApprove
                ? createCheckpoint(state, request.getAction(), stateBefore(request.getContext()), now)
                : null;
        String reason = autoApprove ? "Auto-approved after approval timeout" : "Approval request expired";
        appendAudit(state, AuditLogEntry.builder()
                .agentId(state.getAgentId())
                .action(request.getAction())
                .category(request.getCategory())
                .decision(autoApprove ? AuditDecision.APPROVED : AuditDecision.REJECTED)
                .confidence(request.getConfidence())
                .riskScore(request.getRiskScore())
                .reason(reason)
                .rollbackAvailable(checkpoint != null)
                .rollbackId(checkpoint != null ? checkpoint.getId() : null)
                .violatedRuleIds(request.getViolatedRuleIds()), now);

        log.info("[Governance] Request {} for {} {}", request.getId(), request.getAction(),
                autoApprove ? "auto-approved on timeout" : "expired");
        eventPublisher.publish(new ApprovalResolvedEvent(state.getAgentId(), request, reason));
        if (autoApprove) {
            eventPublisher.publish(new ActionApprovedEvent(state.getAgentId(), request.getAction(), reason, false,
                    request.getId(), checkpoint != null ? checkpoint.getId() : null));
        }
    }

    // ==================== ROLLBACK ====================

    /**
     * Roll back an approved action. The checkpoint can be used once.
     *
     * @return the pre-action state, empty if the checkpoint is unknown, spent
     *         or expired
     */
    public Optional<Map<String, Object>> rollback(String agentId, String checkpointId) {
        AgentPolicyState state = sessions.get(agentId);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            Instant now = clock.instant();
            if (!state.getPolicy().isRollbackEnabled()) {
                return Optional.empty();
            }
            RollbackCheckpoint checkpoint = state.findCheckpoint(checkpointId).orElse(null);
            if (checkpoint == null || !checkpoint.isCanRollback() || checkpoint.isExpired(now)) {
                log.debug("[Governance] Rollback {} of {} not available", checkpointId, agentId);
                return Optional.empty();
            }
            checkpoint.setCanRollback(false);
            AuditLogEntry updated = state.replaceLinkedAuditEntry(checkpointId, AuditOutcome.ROLLBACK);
            if (updated != null) {
                persistAudit(updated);
            }
            Map<String, Object> stateBefore = new LinkedHashMap<>(checkpoint.getStateBefore());
            log.info("[Governance] Rolled back {} of {} via {}", checkpoint.getAction(), agentId, checkpointId);
            eventPublisher.publish(new RollbackExecutedEvent(agentId, checkpointId, checkpoint.getAction(),
                    stateBefore));
            return Optional.of(stateBefore);
        }
    }

    /**
     * Record how an approved action ended and its post-action state.
     */
    public boolean completeAction(String agentId, String checkpointId, AuditOutcome outcome,
            Map<String, Object> stateAfter) {
        AgentPolicyState state = sessions.get(agentId);
        if (state == null || outcome == null) {
            return false;
        }
        synchronized (state) {
            RollbackCheckpoint checkpoint = state.findCheckpoint(checkpointId).orElse(null);
            if (checkpoint == null) {
                return false;
            }
            checkpoint.setStateAfter(stateAfter != null ? new LinkedHashMap<>(stateAfter) : null);
            AuditLogEntry updated = state.replaceLinkedAuditEntry(checkpointId, outcome);
            if (updated != null) {
                persistAudit(updated);
            }
            return true;
        }
    }

    // ==================== AUDIT ====================

    public List<AuditLogEntry> queryAudit(AuditLogFilter filter) {
        return auditPort.query(filter);
    }

    private AuditLogEntry appendAudit(AgentPolicyState state, AuditLogEntry.AuditLogEntryBuilder builder,
            Instant now) {
        if (!state.getPolicy().isAuditLogEnabled()) {
            return null;
        }
        AuditLogEntry entry = builder
                .id(IdGenerator.prefixed("audit", now))
                .timestamp(now)
                .build();
        state.getAuditLog().add(entry);
        persistAudit(entry);
        return entry;
    }

    private void persistAudit(AuditLogEntry entry) {
        fireAndForget("persist audit entry " + entry.getId(), () -> auditPort.persist(entry));
    }

    private void fireAndForget(String what, Supplier<CompletableFuture<Void>> call) {
        try {
            call.get().whenComplete((ignored, error) -> {
                if (error != null) {
                    log.error("[Audit] Failed to {}: {}", what, error.getMessage());
                }
            });
        } catch (RuntimeException e) {
            log.error("[Audit] Failed to {}: {}", what, e.getMessage());
        }
    }

    private RollbackCheckpoint createCheckpoint(AgentPolicyState state, String action,
            Map<String, Object> stateBefore, Instant now) {
        GovernancePolicy policy = state.getPolicy();
        if (!policy.isRollbackEnabled()) {
            return null;
        }
        RollbackCheckpoint checkpoint = RollbackCheckpoint.builder()
                .id(IdGenerator.prefixed("rollback", now))
                .timestamp(now)
                .agentId(state.getAgentId())
                .action(action)
                .stateBefore(stateBefore)
                .canRollback(true)
                .expiresAt(now.plus(policy.getRollbackRetention()))
                .build();
        state.getRollbackCheckpoints().add(checkpoint);
        return checkpoint;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> stateBefore(Map<String, Object> source) {
        if (source != null && source.get(STATE_BEFORE) instanceof Map<?, ?> snapshot) {
            return new LinkedHashMap<>((Map<String, Object>) snapshot);
        }
        return new LinkedHashMap<>();
    }
}
