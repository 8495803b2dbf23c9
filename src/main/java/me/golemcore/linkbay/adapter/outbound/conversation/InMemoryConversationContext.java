package me.golemcore.linkbay.adapter.outbound.conversation;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.linkbay.domain.model.ConversationConfig;
import me.golemcore.linkbay.domain.model.ConversationStats;
import me.golemcore.linkbay.domain.model.Message;
import me.golemcore.linkbay.port.outbound.ConversationPort;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

/**
 * Conversation context kept in memory.
 *
 * <p>
 * At most {@code maxMessages} messages are retained and the oldest are dropped
 * while the total token count exceeds {@code contextWindow}. When
 * {@code summarizeOldMessages} is enabled, dropped messages are folded into a
 * running summary that is sent as a leading system message.
 */
@Slf4j
public class InMemoryConversationContext implements ConversationPort {

    private static final int MAX_SUMMARY_LINE_LENGTH = 200;
    private static final String SUMMARY_HEADER = "Summary of the earlier conversation:\n";

    private final ConversationConfig config;
    private final Clock clock;

    private final LinkedList<Message> history = new LinkedList<>();
    private final StringBuilder summary = new StringBuilder();
    private long totalTokens;
    private long droppedMessages;

    public InMemoryConversationContext(ConversationConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    @Override
    public synchronized void addMessage(String role, String content, int tokens) {
        if (!Message.isValidRole(role)) {
            throw new IllegalArgumentException("Invalid message role: " + role);
        }
        if (tokens < 0) {
            throw new IllegalArgumentException("Message tokens must not be negative: " + tokens);
        }
        history.addLast(Message.builder()
                .role(role)
                .content(content != null ? content : "")
                .tokens(tokens)
                .timestamp(clock.instant())
                .build());
        totalTokens += tokens;
        trim();
    }

    @Override
    public synchronized List<Message> getMessages() {
        List<Message> messages = new ArrayList<>(history.size() + 1);
        if (summary.length() > 0) {
            messages.add(Message.builder()
                    .role(Message.ROLE_SYSTEM)
                    .content(SUMMARY_HEADER + summary)
                    .timestamp(clock.instant())
                    .build());
        }
        messages.addAll(history);
        return messages;
    }

    @Override
    public synchronized List<Message> getMessages(int lastN) {
        if (lastN <= 0) {
            return List.of();
        }
        int from = Math.max(0, history.size() - lastN);
        return List.copyOf(history.subList(from, history.size()));
    }

    @Override
    public synchronized void clear() {
        history.clear();
        summary.setLength(0);
        totalTokens = 0;
        droppedMessages = 0;
    }

    @Override
    public synchronized ConversationStats getStats() {
        return ConversationStats.builder()
                .messageCount(history.size())
                .totalTokens(totalTokens)
                .maxMessages(config.getMaxMessages())
                .contextWindow(config.getContextWindow())
                .droppedMessages(droppedMessages)
                .summarized(summary.length() > 0)
                .build();
    }

    private void trim() {
        while (history.size() > config.getMaxMessages()
                || (totalTokens > config.getContextWindow() && history.size() > 1)) {
            Message dropped = history.removeFirst();
            totalTokens -= dropped.getTokens();
            droppedMessages++;
            if (config.isSummarizeOldMessages()) {
                fold(dropped);
            }
        }
    }

    private void fold(Message dropped) {
        String content = dropped.getContent();
        if (content.length() > MAX_SUMMARY_LINE_LENGTH) {
            content = content.substring(0, MAX_SUMMARY_LINE_LENGTH) + "...";
        }
        summary.append(dropped.getRole()).append(": ").append(content).append('\n');

        int overflow = summary.length() - config.getSummaryMaxChars();
        if (overflow > 0) {
            // Keep the most recent part, starting at a line boundary
            int cut = summary.indexOf("\n", overflow);
            summary.delete(0, cut >= 0 ? cut + 1 : summary.length());
        }
        log.debug("[Conversation] Folded {} message into summary ({} chars)", dropped.getRole(), summary.length());
    }
}
