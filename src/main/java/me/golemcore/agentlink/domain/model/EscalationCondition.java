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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.List;

/**
 * Condition half of an {@link EscalationRule}. Numeric conditions read
 * {@code threshold}, list conditions read {@code values} and
 * {@link ConditionType#TIME_BASED} reads {@code window}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationCondition {

    private ConditionType type;
    private Double threshold;
    private List<String> values;
    private String window;

    public static EscalationCondition confidenceBelow(double threshold) {
        return EscalationCondition.builder().type(ConditionType.CONFIDENCE_BELOW).threshold(threshold).build();
    }

    public static EscalationCondition riskAbove(double threshold) {
        return EscalationCondition.builder().type(ConditionType.RISK_ABOVE).threshold(threshold).build();
    }

    public static EscalationCondition categoryMatch(ActionCategory... categories) {
        List<String> names = Arrays.stream(categories).map(ActionCategory::name).toList();
        return EscalationCondition.builder().type(ConditionType.CATEGORY_MATCH).values(names).build();
    }

    public static EscalationCondition keywordMatch(String... keywords) {
        return EscalationCondition.builder().type(ConditionType.KEYWORD_MATCH).values(List.of(keywords)).build();
    }

    public static EscalationCondition actionCountAtLeast(int count) {
        return EscalationCondition.builder().type(ConditionType.ACTION_COUNT).threshold((double) count).build();
    }

    public static EscalationCondition timeWindow(String window) {
        return EscalationCondition.builder().type(ConditionType.TIME_BASED).window(window).build();
    }
}
