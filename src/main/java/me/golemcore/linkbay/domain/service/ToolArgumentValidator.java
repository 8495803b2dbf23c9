package me.golemcore.linkbay.domain.service;

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

import me.golemcore.linkbay.domain.exception.ToolValidationException;
import me.golemcore.linkbay.domain.model.ToolArguments;
import me.golemcore.linkbay.domain.model.ToolDefinition;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks decoded tool arguments against the JSON Schema declared by the tool:
 * required names, JSON types, enum values and unknown names. Declared defaults
 * are applied to absent optional arguments.
 *
 * <p>
 * Unknown argument names are rejected unless the schema sets
 * {@code additionalProperties} to {@code true}. A property schema given as a
 * boolean follows JSON Schema: {@code true} leaves the value unconstrained,
 * {@code false} rejects it.
 */
public class ToolArgumentValidator {

    @SuppressWarnings("unchecked")
    public ToolArguments validate(ToolDefinition definition, Map<String, Object> rawArguments) {
        Map<String, Object> schema = definition.getParameters() != null
                ? definition.getParameters()
                : ToolDefinition.emptySchema();
        Map<String, Object> properties = schema.get("properties") instanceof Map<?, ?> map
                ? (Map<String, Object>) map
                : Map.of();
        Collection<Object> required = schema.get("required") instanceof Collection<?> list
                ? (Collection<Object>) list
                : List.of();
        boolean additionalAllowed = Boolean.TRUE.equals(schema.get("additionalProperties"));

        Map<String, Object> arguments = rawArguments != null ? rawArguments : Map.of();
        List<String> violations = new ArrayList<>();
        Map<String, Object> validated = new LinkedHashMap<>();

        for (Object name : required) {
            if (arguments.get(String.valueOf(name)) == null) {
                violations.add("missing required argument '" + name + "'");
            }
        }

        for (Map.Entry<String, Object> entry : arguments.entrySet()) {
            String name = entry.getKey();
            Object value = entry.getValue();
            Object propertySchema = properties.get(name);
            if (propertySchema == null) {
                if (!additionalAllowed) {
                    violations.add("unknown argument '" + name + "'");
                } else if (value != null) {
                    validated.put(name, value);
                }
                continue;
            }
            if (value == null) {
                continue;
            }
            if (!(propertySchema instanceof Map<?, ?> constraints)) {
                // boolean schemas: true accepts anything, false accepts nothing
                if (Boolean.FALSE.equals(propertySchema)) {
                    violations.add("argument '" + name + "' is not allowed");
                } else {
                    validated.put(name, value);
                }
                continue;
            }
            String violation = checkValue(name, value, (Map<String, Object>) constraints);
            if (violation != null) {
                violations.add(violation);
            } else {
                validated.put(name, normalize(value, (Map<String, Object>) constraints));
            }
        }

        for (Map.Entry<String, Object> entry : properties.entrySet()) {
            if (!validated.containsKey(entry.getKey()) && entry.getValue() instanceof Map<?, ?> propertySchema
                    && propertySchema.get("default") != null) {
                validated.put(entry.getKey(), propertySchema.get("default"));
            }
        }

        if (!violations.isEmpty()) {
            throw new ToolValidationException(definition.getName(), violations);
        }
        return ToolArguments.of(validated);
    }

    private String checkValue(String name, Object value, Map<String, Object> propertySchema) {
        Object type = propertySchema.get("type");
        if (type instanceof String expected && !matchesType(value, expected)) {
            return "argument '" + name + "' must be of type " + expected + " but was "
                    + jsonTypeOf(value);
        }
        Object enumValues = propertySchema.get("enum");
        if (enumValues instanceof Collection<?> allowed) {
            boolean found = allowed.stream().anyMatch(candidate -> String.valueOf(candidate)
                    .equals(String.valueOf(value)));
            if (!found) {
                return "argument '" + name + "' must be one of " + allowed + " but was '" + value + "'";
            }
        }
        return null;
    }

    private boolean matchesType(Object value, String expected) {
        return switch (expected) {
        case "string" -> value instanceof CharSequence;
        case "integer" -> isInteger(value);
        case "number" -> value instanceof Number;
        case "boolean" -> value instanceof Boolean;
        case "array" -> value instanceof Collection<?> || value.getClass().isArray();
        case "object" -> value instanceof Map<?, ?>;
        default -> true;
        };
    }

    private Object normalize(Object value, Map<String, Object> propertySchema) {
        if ("integer".equals(propertySchema.get("type")) && value instanceof Number number) {
            return number.longValue();
        }
        return value;
    }

    private static boolean isInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        return false;
    }

    private static String jsonTypeOf(Object value) {
        if (value instanceof CharSequence) {
            return "string";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Number) {
            return isInteger(value) ? "integer" : "number";
        }
        if (value instanceof Collection<?>) {
            return "array";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        return value.getClass().getSimpleName();
    }
}
