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

import me.golemcore.agentlink.domain.model.ActionCategory;
import me.golemcore.agentlink.domain.model.AgentPolicyState;
import me.golemcore.agentlink.domain.model.TrustRecord;

/**
 * Confidence bonus earned through operator approvals of the same
 * {@code category:action} pair: +0.05 per 5 approvals, at most +0.20.
 */
public final class AdaptiveTrust {

    static final int APPROVALS_PER_STEP = 5;
    static final int MAX_STEPS = 4;
    static final int PERCENT_PER_STEP = 5;

    private AdaptiveTrust() {
    }

    public static String key(ActionCategory category, String action) {
        return (category != null ? category.key() : "unknown") + ":" + action;
    }

    /**
     * Bonus for an approval count. Computed from whole percent steps so the
     * values stay exact multiples of 0.05.
     */
    public static double bonusFor(int approvals) {
        int steps = Math.min(MAX_STEPS, approvals / APPROVALS_PER_STEP);
        return steps * PERCENT_PER_STEP / 100.0;
    }

    public static double bonus(AgentPolicyState state, ActionCategory category, String action) {
        TrustRecord trust = state.getTrust().get(key(category, action));
        return trust != null ? trust.getConfidenceBonus() : 0.0;
    }

    /**
     * Record one operator approval and return the updated record.
     */
    public static TrustRecord recordApproval(AgentPolicyState state, ActionCategory category, String action) {
        TrustRecord trust = state.getTrust().computeIfAbsent(key(category, action), k -> new TrustRecord());
        trust.setApprovals(trust.getApprovals() + 1);
        trust.setConfidenceBonus(bonusFor(trust.getApprovals()));
        return trust;
    }
}
