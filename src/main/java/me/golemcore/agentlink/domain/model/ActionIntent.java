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

import java.util.Map;

/**
 * An agent's request to perform a world-affecting operation.
 *
 * <p>
 * {@code metadata} may carry a {@code stateBefore} map which becomes the
 * rollback snapshot when the action is approved.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionIntent {

    public static final String STATE_BEFORE_KEY = "stateBefore";

    private String action;
    private ActionCategory category;
    private double confidence;
    private double riskScore;
    private String description;
    private Map<String, Object> metadata;
}
