package me.golemcore.agentlink.adapter.inbound.event;

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
import me.golemcore.agentlink.domain.model.ActionIntentEvent;
import me.golemcore.agentlink.domain.model.ApprovalResolution;
import me.golemcore.agentlink.domain.model.GovernanceDecision;
import me.golemcore.agentlink.domain.model.ModeChangeRequestEvent;
import me.golemcore.agentlink.domain.model.OperatorDecisionEvent;
import me.golemcore.agentlink.domain.model.RollbackRequestEvent;
import me.golemcore.agentlink.domain.service.GovernanceService;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Feeds inbound governance events published on the application event bus into
 * {@link GovernanceService}. Outcomes are reported through the service's own
 * outbound events.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GovernanceEventListener {

    private final GovernanceService governanceService;

    @EventListener
    public void onActionIntent(ActionIntentEvent event) {
        GovernanceDecision decision = governanceService.handleActionRequest(event.agentId(), event.intent());
        log.debug("[Governance] intent {} from {} -> approved={}, level={}", event.intent().getAction(),
                event.agentId(), decision.isApproved(), decision.getEscalationLevel());
    }

    @EventListener
    public void onOperatorDecision(OperatorDecisionEvent event) {
        ApprovalResolution resolution = governanceService.resolveApprovalRequest(event.agentId(),
                event.approvalId(), event.approved(), event.operator(), event.reason());
        if (!resolution.isResolved()) {
            log.debug("[Governance] decision on {} by {} not applied: {}", event.approvalId(), event.operator(),
                    resolution.outcome());
        }
    }

    @EventListener
    public void onModeChangeRequest(ModeChangeRequestEvent event) {
        if (!governanceService.requestModeChange(event.agentId(), event.mode(), event.operator())) {
            log.debug("[Governance] mode change of {} to {} not applied", event.agentId(), event.mode());
        }
    }

    @EventListener
    public void onRollbackRequest(RollbackRequestEvent event) {
        if (governanceService.rollback(event.agentId(), event.checkpointId()).isEmpty()) {
            log.debug("[Governance] rollback {} of {} not available", event.checkpointId(), event.agentId());
        }
    }
}
