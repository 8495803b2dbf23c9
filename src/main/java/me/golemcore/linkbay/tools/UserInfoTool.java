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

package me.golemcore.linkbay.tools;

import me.golemcore.linkbay.domain.component.ToolComponent;
import me.golemcore.linkbay.domain.model.ToolArguments;
import me.golemcore.linkbay.domain.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tool returning the profile of a known user.
 */
@Component
public class UserInfoTool implements ToolComponent {

    private final Map<String, Map<String, Object>> users = new ConcurrentHashMap<>();

    public void registerUser(String userId, Map<String, Object> profile) {
        Map<String, Object> stored = new LinkedHashMap<>(profile);
        stored.put("user_id", userId);
        users.put(userId, Map.copyOf(stored));
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("get_user_info")
                .description("Get profile information of a user by id.")
                .parameters(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "user_id", Map.of(
                                        "type", "string",
                                        "description", "User identifier")),
                        "required", List.of("user_id")))
                .build();
    }

    @Override
    public Object handle(ToolArguments arguments) {
        String userId = arguments.getString("user_id");
        Map<String, Object> profile = userId != null ? users.get(userId) : null;
        if (profile == null) {
            throw new IllegalArgumentException("Unknown user: " + userId);
        }
        return profile;
    }
}
