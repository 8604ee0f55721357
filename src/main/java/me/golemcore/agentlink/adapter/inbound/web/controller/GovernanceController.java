package me.golemcore.agentlink.adapter.inbound.web.controller;

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
import me.golemcore.agentlink.domain.model.AgentPolicyState;
import me.golemcore.agentlink.domain.model.ApprovalRequest;
import me.golemcore.agentlink.domain.model.ApprovalResolution;
import me.golemcore.agentlink.domain.model.ApprovalStatus;
import me.golemcore.agentlink.domain.model.AuditDecision;
import me.golemcore.agentlink.domain.model.AuditLogEntry;
import me.golemcore.agentlink.domain.model.AuditLogFilter;
import me.golemcore.agentlink.domain.model.GovernanceMode;
import me.golemcore.agentlink.domain.model.RollbackCheckpoint;
import me.golemcore.agentlink.domain.service.GovernanceService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Operator endpoints for governed agents: session state, pending approvals,
 * mode switches, rollbacks and the audit trail.
 */
@RestController
@RequestMapping("/api/governance")
@RequiredArgsConstructor
public class GovernanceController {

    private static final String AGENT_NOT_GOVERNED = "Agent is not governed: ";

    private final GovernanceService governanceService;

    @GetMapping
    public Mono<ResponseEntity<List<String>>> getAttachedAgents() {
        List<String> agents = governanceService.getAttachedAgents().stream().sorted().toList();
        return Mono.just(ResponseEntity.ok(agents));
    }

    @GetMapping("/audit")
    public Mono<ResponseEntity<List<AuditEntryDto>>> queryAudit(
            @RequestParam(required = false) String agentId,
            @RequestParam(required = false) String action,
            @RequestParam(required = false) String decision,
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        if ((limit != null && limit < 0) || (offset != null && offset < 0)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit and offset must not be negative");
        }
        AuditLogFilter filter = AuditLogFilter.builder()
                .agentId(blankToNull(agentId))
                .action(blankToNull(action))
                .decision(parseEnum(AuditDecision.class, decision, "decision"))
                .from(parseInstant(from, "from"))
                .to(parseInstant(to, "to"))
                .limit(limit)
                .offset(offset)
                .build();
        List<AuditEntryDto> entries = governanceService.queryAudit(filter).stream()
                .map(GovernanceController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(entries));
    }

    @GetMapping("/{agentId}")
    public Mono<ResponseEntity<GovernanceStateResponse>> getState(@PathVariable String agentId) {
        AgentPolicyState state = requireState(agentId);
        GovernanceStateResponse response;
        synchronized (state) {
            response = new GovernanceStateResponse(
                    state.getAgentId(),
                    state.getCurrentMode().name(),
                    state.getActionCountThisSession(),
                    state.getPolicy().getMaxAutonomousActions(),
                    toIso(state.getSessionStartTime()),
                    toIso(state.getLastEscalationTime()),
                    state.openApprovals().size(),
                    state.getRollbackCheckpoints().stream()
                            .filter(RollbackCheckpoint::isCanRollback)
                            .map(GovernanceController::toDto)
                            .toList());
        }
        return Mono.just(ResponseEntity.ok(response));
    }

    @GetMapping("/{agentId}/approvals")
    public Mono<ResponseEntity<List<ApprovalDto>>> getApprovals(@PathVariable String agentId,
            @RequestParam(required = false) String status) {
        AgentPolicyState state = requireState(agentId);
        ApprovalStatus wanted = parseEnum(ApprovalStatus.class, status, "status");
        List<ApprovalDto> approvals;
        synchronized (state) {
            approvals = state.getPendingApprovals().stream()
                    .filter(request -> wanted == null || request.getStatus() == wanted)
                    .sorted(Comparator.comparing(ApprovalRequest::getTimestamp).reversed())
                    .map(GovernanceController::toDto)
                    .toList();
        }
        return Mono.just(ResponseEntity.ok(approvals));
    }

    @PostMapping("/{agentId}/approvals/{approvalId}")
    public Mono<ResponseEntity<ApprovalDto>> resolveApproval(@PathVariable String agentId,
            @PathVariable String approvalId, @RequestBody(required = false) ApprovalDecisionRequest request) {
        if (request == null || request.approved() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "approved is required");
        }
        if (request.operator() == null || request.operator().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "operator is required");
        }
        ApprovalResolution resolution = governanceService.resolveApprovalRequest(agentId, approvalId,
                request.approved(), request.operator(), request.reason());
        return switch (resolution.outcome()) {
        case RESOLVED -> Mono.just(ResponseEntity.ok(toDto(resolution.request())));
        case NOT_GOVERNED -> throw new ResponseStatusException(HttpStatus.NOT_FOUND, AGENT_NOT_GOVERNED + agentId);
        case NOT_FOUND -> throw new ResponseStatusException(HttpStatus.NOT_FOUND,
                "Approval request not found: " + approvalId);
        case UNAUTHORIZED -> throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Operator is not approved");
        case ALREADY_RESOLVED -> throw new ResponseStatusException(HttpStatus.CONFLICT,
                "Approval request already "
                        + resolution.request().getStatus().name().toLowerCase(Locale.ROOT));
        case REASON_REQUIRED -> throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "reason is required for this request");
        };
    }

    @PostMapping("/{agentId}/mode")
    public Mono<ResponseEntity<GovernanceStateResponse>> changeMode(@PathVariable String agentId,
            @RequestBody(required = false) ModeChangeRequest request) {
        if (request == null || request.mode() == null || request.mode().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "mode is required");
        }
        GovernanceMode mode = parseEnum(GovernanceMode.class, request.mode(), "mode");
        requireState(agentId);
        if (!governanceService.requestModeChange(agentId, mode, request.operator())) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Operator is not approved");
        }
        return getState(agentId);
    }

    @PostMapping("/{agentId}/rollback/{checkpointId}")
    public Mono<ResponseEntity<RollbackResponse>> rollback(@PathVariable String agentId,
            @PathVariable String checkpointId) {
        requireState(agentId);
        Map<String, Object> stateBefore = governanceService.rollback(agentId, checkpointId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.CONFLICT,
                        "Rollback not available: " + checkpointId));
        return Mono.just(ResponseEntity.ok(new RollbackResponse(checkpointId, stateBefore)));
    }

    private AgentPolicyState requireState(String agentId) {
        return governanceService.getState(agentId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, AGENT_NOT_GOVERNED + agentId));
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String field) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid " + field + ": " + value, e);
        }
    }

    private static Instant parseInstant(String value, String field) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid " + field + ": " + value, e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String toIso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    private static ApprovalDto toDto(ApprovalRequest request) {
        return new ApprovalDto(
                request.getId(),
                request.getAction(),
                request.getCategory() != null ? request.getCategory().name() : null,
                request.getDescription(),
                request.getConfidence(),
                request.getRiskScore(),
                request.getStatus().name(),
                request.getEscalationLevel() != null ? request.getEscalationLevel().name() : null,
                request.getReason(),
                request.isRequiresReason(),
                request.getApprover(),
                toIso(request.getTimestamp()),
                toIso(request.getExpiresAt()),
                request.getViolatedRuleIds() != null ? request.getViolatedRuleIds() : List.of());
    }

    private static CheckpointDto toDto(RollbackCheckpoint checkpoint) {
        return new CheckpointDto(
                checkpoint.getId(),
                checkpoint.getAction(),
                toIso(checkpoint.getTimestamp()),
                toIso(checkpoint.getExpiresAt()));
    }

    private static AuditEntryDto toDto(AuditLogEntry entry) {
        return new AuditEntryDto(
                entry.getId(),
                toIso(entry.getTimestamp()),
                entry.getAgentId(),
                entry.getAction(),
                entry.getCategory() != null ? entry.getCategory().name() : null,
                entry.getDecision() != null ? entry.getDecision().name() : null,
                entry.getConfidence(),
                entry.getRiskScore(),
                entry.getApprover(),
                entry.getReason(),
                entry.getOutcome() != null ? entry.getOutcome().name() : null,
                entry.getRollbackId(),
                entry.isViolation());
    }

    public record ApprovalDecisionRequest(Boolean approved, String operator, String reason) {
    }

    public record ModeChangeRequest(String mode, String operator) {
    }

    public record GovernanceStateResponse(
            String agentId,
            String mode,
            int actionCount,
            int maxAutonomousActions,
            String sessionStartTime,
            String lastEscalationTime,
            int pendingApprovals,
            List<CheckpointDto> checkpoints) {
    }

    public record ApprovalDto(
            String id,
            String action,
            String category,
            String description,
            double confidence,
            double riskScore,
            String status,
            String escalationLevel,
            String reason,
            boolean requiresReason,
            String approver,
            String createdAt,
            String expiresAt,
            List<String> violatedRuleIds) {
    }

    public record CheckpointDto(String id, String action, String createdAt, String expiresAt) {
    }

    public record AuditEntryDto(
            String id,
            String timestamp,
            String agentId,
            String action,
            String category,
            String decision,
            double confidence,
            double riskScore,
            String approver,
            String reason,
            String outcome,
            String rollbackId,
            boolean violation) {
    }

    public record RollbackResponse(String checkpointId, Map<String, Object> stateBefore) {
    }
}
