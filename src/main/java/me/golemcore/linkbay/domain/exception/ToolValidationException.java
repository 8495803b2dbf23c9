package me.golemcore.linkbay.domain.exception;

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
 * Tool arguments do not match the declared schema, or the handler rejected
 * them.
 */
public class ToolValidationException extends ToolExecutionException {

    private static final long serialVersionUID = 1L;

    private final transient List<String> violations;

    public ToolValidationException(String toolName, List<String> violations) {
        super(toolName, "Invalid arguments for tool '" + toolName + "': " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ToolValidationException(String toolName, String message, Throwable cause) {
        super(toolName, "Invalid arguments for tool '" + toolName + "': " + message, cause);
        this.violations = List.of(message);
    }

    public List<String> getViolations() {
        return violations;
    }
}
