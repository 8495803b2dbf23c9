package me.golemcore.linkbay.domain.component;

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

import me.golemcore.linkbay.domain.model.ToolDefinition;

/**
 * Component representing a tool the model can call. Tools expose their JSON
 * Schema definition for function calling and implement the execution logic.
 * Spring-managed tools are picked up by the tool registry at startup.
 */
public interface ToolComponent extends ToolHandler {

    /**
     * Returns the tool definition with JSON Schema for function calling. The
     * definition includes the tool name, description, and parameter schema.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
