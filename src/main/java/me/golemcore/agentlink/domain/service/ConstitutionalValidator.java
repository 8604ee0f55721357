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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentlink.domain.model.ActionIntent;
import me.golemcore.agentlink.domain.model.ConstitutionalRule;
import me.golemcore.agentlink.domain.model.ConstitutionalVerdict;
import me.golemcore.agentlink.domain.model.EscalationLevel;
import me.golemcore.agentlink.domain.model.RuleSeverity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Stateless matcher of actions against constitutional rules.
 *
 * <p>
 * The built-in rules are always evaluated in addition to the caller's rules
 * and cannot be switched off. A rule matches when its category equals the
 * action's category and it either pins no action name or pins this one, or
 * when its pattern is found in the action name or description.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ConstitutionalValidator {

    public static final List<ConstitutionalRule> BUILTIN_RULES = List.of(
            ConstitutionalRule.builder()
                    .id("builtin.no-governance-bypass")
                    .description("Agents must not disable or bypass human oversight")
                    .severity(RuleSeverity.CRITICAL)
                    .pattern("(?i)(disable|bypass|override)[_\\s-]*(hitl|governance|safety|audit)")
                    .build(),
            ConstitutionalRule.builder()
                    .id("builtin.no-credential-exfiltration")
                    .description("Agents must not export credentials or key material")
                    .severity(RuleSeverity.CRITICAL)
                    .pattern("(?i)(exfiltrate|leak|export)[_\\s-]*(credentials?|secrets?|private[_\\s-]*keys?"
                            + "|passwords?)")
                    .build(),
            ConstitutionalRule.builder()
                    .id("builtin.no-bulk-destruction")
                    .description("Agents must not wipe data stores wholesale")
                    .severity(RuleSeverity.HARD)
                    .pattern("(?i)(delete|drop|wipe|purge)[_\\s-]*(all|everything|database|\\*)")
                    .build());

    private final Map<String, Optional<Pattern>> patternCache = new ConcurrentHashMap<>();

    public ConstitutionalVerdict validate(ActionIntent intent, List<ConstitutionalRule> rules) {
        List<ConstitutionalRule> violations = new ArrayList<>();
        EscalationLevel level = EscalationLevel.NONE;
        for (ConstitutionalRule rule : allRules(rules)) {
            if (matches(rule, intent)) {
                violations.add(rule);
                level = EscalationLevel.max(level, rule.getSeverity().toEscalationLevel());
            }
        }
        if (violations.isEmpty()) {
            return ConstitutionalVerdict.clean();
        }
        return new ConstitutionalVerdict(false, List.copyOf(violations), level);
    }

    private List<ConstitutionalRule> allRules(List<ConstitutionalRule> rules) {
        if (rules == null || rules.isEmpty()) {
            return BUILTIN_RULES;
        }
        List<ConstitutionalRule> all = new ArrayList<>(BUILTIN_RULES);
        all.addAll(rules);
        return all;
    }

    private boolean matches(ConstitutionalRule rule, ActionIntent intent) {
        if (rule.getSeverity() == null) {
            return false;
        }
        if (rule.getCategory() != null && rule.getCategory() == intent.getCategory()
                && (rule.getAction() == null || rule.getAction().equals(intent.getAction()))) {
            return true;
        }
        if (rule.getPattern() == null) {
            return false;
        }
        Optional<Pattern> pattern = patternCache.computeIfAbsent(rule.getPattern(), this::compile);
        return pattern.map(p -> find(p, intent.getAction()) || find(p, intent.getDescription())).orElse(false);
    }

    private Optional<Pattern> compile(String regex) {
        try {
            return Optional.of(Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            log.warn("[Governance] Skipping constitutional rule with invalid pattern '{}': {}", regex,
                    e.getDescription());
            return Optional.empty();
        }
    }

    private static boolean find(Pattern pattern, String text) {
        return text != null && pattern.matcher(text).find();
    }
}
