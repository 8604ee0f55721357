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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Subset of JSON Schema used to constrain channel payloads.
 *
 * <p>
 * Supported keywords: {@code type} (object, array, string, number, integer,
 * boolean, null), {@code properties}, {@code required}, {@code items},
 * {@code enum}, {@code minimum}, {@code maximum}, {@code minLength},
 * {@code maxLength}, {@code pattern}, {@code minItems}, {@code maxItems} and a
 * boolean {@code additionalProperties}. Any keyword left {@code null} is not
 * checked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JsonSchema {

    private String type;
    private Map<String, JsonSchema> properties;
    private List<String> required;
    private JsonSchema items;

    @JsonProperty("enum")
    private List<Object> enumValues;

    private Double minimum;
    private Double maximum;
    private Integer minLength;
    private Integer maxLength;
    private String pattern;
    private Integer minItems;
    private Integer maxItems;
    private Boolean additionalProperties;
    private String description;

    public static JsonSchema ofType(String type) {
        return JsonSchema.builder().type(type).build();
    }
}
