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

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.linkbay.domain.component.ToolComponent;
import me.golemcore.linkbay.domain.model.ToolArguments;
import me.golemcore.linkbay.domain.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tool sending a notification to a user over email, SMS or push.
 *
 * <p>
 * Notifications are handed to the configured {@link NotificationSender}; the
 * default sender only keeps them in an in-memory outbox.
 */
@Component
@Slf4j
public class NotificationTool implements ToolComponent {

    static final List<String> CHANNELS = List.of("email", "sms", "push");

    private final List<Notification> outbox = new CopyOnWriteArrayList<>();
    private volatile NotificationSender sender = outbox::add;

    public void setSender(NotificationSender sender) {
        this.sender = sender;
    }

    public List<Notification> getOutbox() {
        return List.copyOf(outbox);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("send_notification")
                .description("Send a notification to a user.")
                .parameters(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "user_id", Map.of(
                                        "type", "string",
                                        "description", "Recipient user identifier"),
                                "message", Map.of(
                                        "type", "string",
                                        "description", "Notification text"),
                                "channel", Map.of(
                                        "type", "string",
                                        "description", "Delivery channel",
                                        "enum", CHANNELS,
                                        "default", "email")),
                        "required", List.of("user_id", "message")))
                .build();
    }

    @Override
    public Object handle(ToolArguments arguments) throws Exception {
        String userId = arguments.getString("user_id");
        String message = arguments.getString("message");
        String channel = arguments.getString("channel", "email");
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Message must not be blank");
        }
        if (!CHANNELS.contains(channel)) {
            throw new IllegalArgumentException("Unsupported channel: " + channel);
        }

        Notification notification = Notification.builder()
                .userId(userId)
                .message(message)
                .channel(channel)
                .sentAt(Instant.now())
                .build();
        sender.send(notification);
        log.info("[Tools] Notification sent to {} via {}", userId, channel);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("sent", true);
        result.put("user_id", userId);
        result.put("channel", channel);
        return result;
    }

    @FunctionalInterface
    public interface NotificationSender {
        void send(Notification notification) throws Exception;
    }

    @Value
    @Builder
    public static class Notification {
        String userId;
        String message;
        String channel;
        Instant sentAt;
    }
}
