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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.linkbay.domain.model.AiResponse;
import me.golemcore.linkbay.domain.model.ChatOptions;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Ready-made tasks built on top of the orchestrator.
 */
@Slf4j
public class AiTaskService {

    private static final TypeReference<Map<String, String>> FIELDS_TYPE_REF = new TypeReference<>() {
    };

    private final AiOrchestrator orchestrator;
    private final ObjectMapper objectMapper;
    private final String generationModel;
    private final String analysisModel;

    public AiTaskService(AiOrchestrator orchestrator, ObjectMapper objectMapper, String generationModel,
            String analysisModel) {
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
        this.generationModel = generationModel;
        this.analysisModel = analysisModel;
    }

    /**
     * Generates an HTML snippet styled with Tailwind CSS.
     */
    public CompletableFuture<String> generateHtmlTailwind(String description) {
        return ask(PromptLibrary.generateHtml(description), generationModel)
                .thenApply(AiTaskService::stripCodeFence);
    }

    /**
     * Extracts form field values from free-form user input. Fields the input
     * does not mention map to {@code null}.
     *
     * @return future completed exceptionally with {@link IllegalStateException}
     *         if the model did not answer with a JSON object
     */
    public CompletableFuture<Map<String, String>> fillFormFields(String userInput, List<String> fields) {
        if (fields == null || fields.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("At least one field is required"));
        }
        return ask(PromptLibrary.fillForm(userInput, fields), generationModel)
                .thenApply(this::parseFields);
    }

    public CompletableFuture<String> analyzeSalesData(String csvData) {
        return ask(PromptLibrary.analyzeData(csvData, "sales"), analysisModel);
    }

    public CompletableFuture<String> analyzeTrafficData(String logData) {
        return ask(PromptLibrary.analyzeData(logData, "web traffic"), analysisModel);
    }

    private CompletableFuture<String> ask(String prompt, String model) {
        ChatOptions options = ChatOptions.builder().model(model).build();
        return orchestrator.chat(prompt, options).thenApply(AiResponse::getContent);
    }

    private Map<String, String> parseFields(String content) {
        String json = stripCodeFence(content);
        try {
            return objectMapper.readValue(json, FIELDS_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("[Tasks] Form response is not a JSON object: {}", e.getOriginalMessage());
            throw new CompletionException(new IllegalStateException("Failed to parse AI response as JSON", e));
        }
    }

    static String stripCodeFence(String content) {
        if (content == null) {
            return "";
        }
        String trimmed = content.strip();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstLineEnd = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstLineEnd < 0 || closing <= firstLineEnd) {
            return trimmed;
        }
        return trimmed.substring(firstLineEnd + 1, closing).strip();
    }
}
