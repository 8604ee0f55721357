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
import me.golemcore.agentlink.domain.model.ActionCategory;
import me.golemcore.agentlink.domain.model.ActionEvaluation;
import me.golemcore.agentlink.domain.model.ActionIntent;
import me.golemcore.agentlink.domain.model.AgentPolicyState;
import me.golemcore.agentlink.domain.model.ConstitutionalVerdict;
import me.golemcore.agentlink.domain.model.EscalationCondition;
import me.golemcore.agentlink.domain.model.EscalationLevel;
import me.golemcore.agentlink.domain.model.EscalationRule;
import me.golemcore.agentlink.domain.model.GovernanceMode;
import me.golemcore.agentlink.domain.model.GovernancePolicy;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether an action may run autonomously.
 *
 * <p>
 * Checks run in a fixed order and the first decisive one wins:
 * <ol>
 * <li>constitutional rules (a violation always blocks)</li>
 * <li>adaptive trust bonus added to the confidence</li>
 * <li>manual mode</li>
 * <li>never-approve categories (auto-approved) and always-approve categories
 * (hard block)</li>
 * <li>effective confidence below threshold</li>
 * <li>risk above threshold</li>
 * <li>escalation rules at hard block or above</li>
 * </ol>
 *
 * <p>
 * Evaluation reads the session state but never modifies it, so the same
 * inputs always produce the same verdict.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ActionPolicyEvaluator {

    private static final double LOW_CONFIDENCE = 0.5;
    private static final double EXTREME_RISK = 0.8;

    private final ConstitutionalValidator constitutionalValidator;
    private final Clock clock;

    public ActionEvaluation evaluate(AgentPolicyState state, GovernancePolicy policy, ActionIntent intent,
            Instant now) {
        ConstitutionalVerdict verdict = constitutionalValidator.validate(intent, policy.getConstitution());
        if (!verdict.allowed()) {
            return ActionEvaluation.violation(verdict, intent.getConfidence());
        }

        double effectiveConfidence = intent.getConfidence()
                + AdaptiveTrust.bonus(state, intent.getCategory(), intent.getAction());

        if (state.getCurrentMode() == GovernanceMode.MANUAL) {
            return ActionEvaluation.requireApproval("Manual mode requires approval for every action",
                    EscalationLevel.HARD_BLOCK, effectiveConfidence);
        }

        if (contains(policy.getNeverApproveCategories(), intent)) {
            return ActionEvaluation.approve("Category " + intent.getCategory().key() + " never requires approval",
                    effectiveConfidence);
        }
        if (contains(policy.getAlwaysApproveCategories(), intent)) {
            return ActionEvaluation.requireApproval(
                    "Category " + intent.getCategory().key() + " always requires approval",
                    EscalationLevel.HARD_BLOCK, effectiveConfidence);
        }

        if (effectiveConfidence < policy.getConfidenceThreshold()) {
            EscalationLevel level = effectiveConfidence < LOW_CONFIDENCE
                    ? EscalationLevel.HARD_BLOCK
                    : EscalationLevel.SOFT_BLOCK;
            return ActionEvaluation.requireApproval(
                    String.format(Locale.ROOT, "Confidence %.2f below threshold %.2f", effectiveConfidence,
                            policy.getConfidenceThreshold()),
                    level, effectiveConfidence);
        }

        if (intent.getRiskScore() > policy.getRiskThreshold()) {
            EscalationLevel level = intent.getRiskScore() > EXTREME_RISK
                    ? EscalationLevel.EMERGENCY_STOP
                    : EscalationLevel.HARD_BLOCK;
            return ActionEvaluation.requireApproval(
                    String.format(Locale.ROOT, "Risk %.2f above threshold %.2f", intent.getRiskScore(),
                            policy.getRiskThreshold()),
                    level, effectiveConfidence);
        }

        // First blocking rule in policy order decides the level.
        for (EscalationRule rule : matchingRules(state, policy, intent, now)) {
            if (rule.forcesApproval()) {
                return ActionEvaluation.requireApproval(
                        "Escalation rule matched: " + rule.getCondition().getType(), rule.getLevel(),
                        effectiveConfidence);
            }
        }

        return ActionEvaluation.approve("Within autonomous limits", effectiveConfidence);
    }

    /**
     * Escalation rules whose condition holds for this action, at any level.
     */
    public List<EscalationRule> matchingRules(AgentPolicyState state, GovernancePolicy policy,
            ActionIntent intent, Instant now) {
        if (policy.getEscalationRules() == null) {
            return List.of();
        }
        return policy.getEscalationRules().stream()
                .filter(rule -> rule.getCondition() != null && conditionHolds(rule.getCondition(), state, intent, now))
                .toList();
    }

    private boolean conditionHolds(EscalationCondition condition, AgentPolicyState state, ActionIntent intent,
            Instant now) {
        if (condition.getType() == null) {
            return false;
        }
        return switch (condition.getType()) {
        case CONFIDENCE_BELOW -> condition.getThreshold() != null
                && intent.getConfidence() < condition.getThreshold();
        case RISK_ABOVE -> condition.getThreshold() != null && intent.getRiskScore() > condition.getThreshold();
        case CATEGORY_MATCH -> intent.getCategory() != null && condition.getValues() != null
                && condition.getValues().stream().anyMatch(v -> v.equalsIgnoreCase(intent.getCategory().name()));
        case KEYWORD_MATCH -> condition.getValues() != null
                && condition.getValues().stream().anyMatch(keyword -> mentions(intent, keyword));
        case ACTION_COUNT -> condition.getThreshold() != null
                && state.getActionCountThisSession() >= condition.getThreshold();
        case TIME_BASED -> inWindow(condition.getWindow(), now);
        };
    }

    private static boolean mentions(ActionIntent intent, String keyword) {
        String needle = keyword.toLowerCase(Locale.ROOT);
        return containsIgnoreCase(intent.getAction(), needle) || containsIgnoreCase(intent.getDescription(), needle);
    }

    private static boolean containsIgnoreCase(String text, String lowerNeedle) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(lowerNeedle);
    }

    private boolean inWindow(String window, Instant now) {
        if (window == null) {
            return false;
        }
        String[] bounds = window.split("-");
        if (bounds.length != 2) {
            log.debug("[Governance] Ignoring malformed time window '{}'", window);
            return false;
        }
        try {
            LocalTime start = LocalTime.parse(bounds[0].trim());
            LocalTime end = LocalTime.parse(bounds[1].trim());
            LocalTime current = LocalTime.ofInstant(now, clock.getZone());
            if (start.isBefore(end)) {
                return !current.isBefore(start) && current.isBefore(end);
            }
            // window wraps past midnight
            return !current.isBefore(start) || current.isBefore(end);
        } catch (DateTimeParseException e) {
            log.debug("[Governance] Ignoring malformed time window '{}'", window);
            return false;
        }
    }

    private static boolean contains(Set<ActionCategory> categories, ActionIntent intent) {
        return categories != null && intent.getCategory() != null && categories.contains(intent.getCategory());
    }
}
