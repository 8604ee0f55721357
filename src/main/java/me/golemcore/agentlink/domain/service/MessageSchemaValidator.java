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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentlink.domain.model.JsonSchema;
import me.golemcore.agentlink.domain.model.SchemaValidationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Recursive validator for the {@link JsonSchema} subset.
 *
 * <p>
 * Payloads are converted to a Jackson tree first, so any value the shared
 * {@link ObjectMapper} can serialize is accepted as input. Validation collects
 * every error instead of stopping at the first one, except that a type
 * mismatch stops descent into that node.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MessageSchemaValidator {

    private static final String ROOT = "$";

    private final ObjectMapper objectMapper;

    public SchemaValidationResult validate(Object payload, JsonSchema schema) {
        if (schema == null) {
            return SchemaValidationResult.ok();
        }
        JsonNode node;
        try {
            node = objectMapper.valueToTree(payload);
        } catch (IllegalArgumentException e) {
            return SchemaValidationResult.failed(List.of(ROOT + ": payload is not JSON serializable"));
        }
        List<String> errors = new ArrayList<>();
        validateNode(node, schema, ROOT, errors);
        return errors.isEmpty() ? SchemaValidationResult.ok() : SchemaValidationResult.failed(errors);
    }

    private void validateNode(JsonNode node, JsonSchema schema, String path, List<String> errors) {
        if (schema.getType() != null && !matchesType(node, schema.getType())) {
            errors.add(path + ": expected " + schema.getType() + " but was " + describe(node));
            return;
        }
        if (schema.getEnumValues() != null && !schema.getEnumValues().isEmpty()) {
            checkEnum(node, schema.getEnumValues(), path, errors);
        }
        if (node.isTextual()) {
            checkString(node.asText(), schema, path, errors);
        } else if (node.isNumber()) {
            checkNumber(node.asDouble(), schema, path, errors);
        } else if (node.isObject()) {
            checkObject(node, schema, path, errors);
        } else if (node.isArray()) {
            checkArray(node, schema, path, errors);
        }
    }

    private boolean matchesType(JsonNode node, String type) {
        return switch (type) {
        case "object" -> node.isObject();
        case "array" -> node.isArray();
        case "string" -> node.isTextual();
        case "number" -> node.isNumber();
        case "integer" -> node.isIntegralNumber()
                || (node.isNumber() && node.asDouble() == Math.rint(node.asDouble()));
        case "boolean" -> node.isBoolean();
        case "null" -> node.isNull() || node.isMissingNode();
        default -> false;
        };
    }

    private void checkEnum(JsonNode node, List<Object> allowed, String path, List<String> errors) {
        for (Object candidate : allowed) {
            JsonNode candidateNode = objectMapper.valueToTree(candidate);
            if (candidateNode.equals(node)
                    || (candidateNode.isNumber() && node.isNumber()
                            && candidateNode.asDouble() == node.asDouble())) {
                return;
            }
        }
        errors.add(path + ": value not in enum " + allowed);
    }

    private void checkString(String value, JsonSchema schema, String path, List<String> errors) {
        int length = value.codePointCount(0, value.length());
        if (schema.getMinLength() != null && length < schema.getMinLength()) {
            errors.add(path + ": string shorter than " + schema.getMinLength());
        }
        if (schema.getMaxLength() != null && length > schema.getMaxLength()) {
            errors.add(path + ": string longer than " + schema.getMaxLength());
        }
        if (schema.getPattern() != null) {
            try {
                if (!Pattern.compile(schema.getPattern()).matcher(value).find()) {
                    errors.add(path + ": does not match pattern " + schema.getPattern());
                }
            } catch (PatternSyntaxException e) {
                log.warn("[Schema] Invalid pattern '{}': {}", schema.getPattern(), e.getDescription());
                errors.add(path + ": invalid pattern " + schema.getPattern());
            }
        }
    }

    private void checkNumber(double value, JsonSchema schema, String path, List<String> errors) {
        if (schema.getMinimum() != null && value < schema.getMinimum()) {
            errors.add(path + ": " + value + " is below minimum " + schema.getMinimum());
        }
        if (schema.getMaximum() != null && value > schema.getMaximum()) {
            errors.add(path + ": " + value + " is above maximum " + schema.getMaximum());
        }
    }

    private void checkObject(JsonNode node, JsonSchema schema, String path, List<String> errors) {
        if (schema.getRequired() != null) {
            for (String field : schema.getRequired()) {
                if (!node.has(field)) {
                    errors.add(path + "." + field + ": required property missing");
                }
            }
        }
        Map<String, JsonSchema> properties = schema.getProperties();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonSchema fieldSchema = properties != null ? properties.get(field.getKey()) : null;
            if (fieldSchema != null) {
                validateNode(field.getValue(), fieldSchema, path + "." + field.getKey(), errors);
            } else if (Boolean.FALSE.equals(schema.getAdditionalProperties())) {
                errors.add(path + "." + field.getKey() + ": additional property not allowed");
            }
        }
    }

    private void checkArray(JsonNode node, JsonSchema schema, String path, List<String> errors) {
        if (schema.getMinItems() != null && node.size() < schema.getMinItems()) {
            errors.add(path + ": fewer than " + schema.getMinItems() + " items");
        }
        if (schema.getMaxItems() != null && node.size() > schema.getMaxItems()) {
            errors.add(path + ": more than " + schema.getMaxItems() + " items");
        }
        if (schema.getItems() != null) {
            for (int i = 0; i < node.size(); i++) {
                validateNode(node.get(i), schema.getItems(), path + "[" + i + "]", errors);
            }
        }
    }

    private static String describe(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "null";
        }
        if (node.isIntegralNumber()) {
            return "integer";
        }
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
