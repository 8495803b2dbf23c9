package me.golemcore.linkbay.domain.model;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated, read-only arguments handed to a tool handler. Defaults declared
 * in the tool schema are already applied.
 */
public final class ToolArguments {

    private static final ToolArguments EMPTY = new ToolArguments(Map.of());

    private final Map<String, Object> values;

    private ToolArguments(Map<String, Object> values) {
        this.values = values;
    }

    public static ToolArguments of(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new ToolArguments(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static ToolArguments empty() {
        return EMPTY;
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public String getString(String name) {
        Object value = values.get(name);
        return value != null ? value.toString() : null;
    }

    public String getString(String name, String defaultValue) {
        String value = getString(name);
        return value != null ? value : defaultValue;
    }

    public Long getLong(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        throw new IllegalArgumentException("Argument '" + name + "' is not a number");
    }

    public int getInt(String name, int defaultValue) {
        Long value = getLong(name);
        return value != null ? Math.toIntExact(value) : defaultValue;
    }

    public Double getDouble(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalArgumentException("Argument '" + name + "' is not a number");
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        throw new IllegalArgumentException("Argument '" + name + "' is not a boolean");
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(String name) {
        Object value = values.get(name);
        return value instanceof List<?> list ? (List<Object>) list : List.of();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
