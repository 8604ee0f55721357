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

/**
 * Kinds of escalation rule conditions.
 */
public enum ConditionType {

    /** Raw confidence strictly below the threshold. */
    CONFIDENCE_BELOW,

    /** Risk score strictly above the threshold. */
    RISK_ABOVE,

    /** Action category is one of the listed values. */
    CATEGORY_MATCH,

    /** Any keyword occurs in the action name or description, ignoring case. */
    KEYWORD_MATCH,

    /** Autonomous actions this session reached the threshold. */
    ACTION_COUNT,

    /** Current local time falls inside an {@code HH:mm-HH:mm} window. */
    TIME_BASED
}
