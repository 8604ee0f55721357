package me.golemcore.agentlink.domain.model;

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

import java.util.List;

/**
 * Result of checking an action against the constitution. The escalation level
 * is the highest severity among the matched rules.
 */
public record ConstitutionalVerdict(boolean allowed, List<ConstitutionalRule> violations,
        EscalationLevel escalationLevel) {

    public static ConstitutionalVerdict clean() {
        return new ConstitutionalVerdict(true, List.of(), EscalationLevel.NONE);
    }

    public List<String> violatedRuleIds() {
        return violations.stream().map(ConstitutionalRule::getId).toList();
    }
}
