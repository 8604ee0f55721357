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
 * Outcome of validating a payload against a {@link JsonSchema}. Errors carry a
 * JSON path prefix such as {@code $.items[2].name}.
 */
public record SchemaValidationResult(boolean valid, List<String> errors) {

    public static SchemaValidationResult ok() {
        return new SchemaValidationResult(true, List.of());
    }

    public static SchemaValidationResult failed(List<String> errors) {
        return new SchemaValidationResult(false, List.copyOf(errors));
    }
}
