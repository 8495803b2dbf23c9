package me.golemcore.linkbay.port.outbound;

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

import me.golemcore.linkbay.domain.model.ConversationStats;
import me.golemcore.linkbay.domain.model.Message;

import java.util.List;

/**
 * Multi-turn conversation context sent along with orchestrated prompts.
 */
public interface ConversationPort {

    /**
     * Appends a message, trimming the oldest ones when limits are exceeded.
     *
     * @throws IllegalArgumentException
     *             if the role is not one of user, assistant, system or tool
     */
    void addMessage(String role, String content, int tokens);

    /**
     * Returns the messages to send, including the running summary when old
     * messages were folded into one.
     */
    List<Message> getMessages();

    /**
     * Returns the last {@code lastN} retained messages.
     */
    List<Message> getMessages(int lastN);

    void clear();

    ConversationStats getStats();
}
