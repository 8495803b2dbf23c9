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

import me.golemcore.linkbay.domain.model.Message;

import java.util.List;

/**
 * Estimates the token count of text before it is sent to a provider.
 */
@FunctionalInterface
public interface TokenEstimator {

    int DEFAULT_CHARS_PER_TOKEN = 4;

    long estimate(String text);

    default long estimate(List<Message> messages) {
        long total = 0;
        for (Message message : messages) {
            total += estimate(message.getContent());
        }
        return total;
    }

    /**
     * Character-ratio estimate: one token per {@code charsPerToken} characters,
     * rounded up.
     */
    static TokenEstimator characterRatio(int charsPerToken) {
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be positive");
        }
        return text -> text == null || text.isEmpty() ? 0 : (text.length() + charsPerToken - 1) / charsPerToken;
    }
}
