package me.golemcore.linkbay.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.linkbay.adapter.outbound.cache.SemanticResponseCache;
import me.golemcore.linkbay.adapter.outbound.conversation.InMemoryConversationContext;
import me.golemcore.linkbay.adapter.outbound.llm.BackoffScheduler;
import me.golemcore.linkbay.adapter.outbound.llm.ProviderFactory;
import me.golemcore.linkbay.domain.component.ToolComponent;
import me.golemcore.linkbay.domain.model.ProviderType;
import me.golemcore.linkbay.domain.service.AiOrchestrator;
import me.golemcore.linkbay.domain.service.AiTaskService;
import me.golemcore.linkbay.domain.service.CostController;
import me.golemcore.linkbay.domain.service.TokenEstimator;
import me.golemcore.linkbay.domain.service.ToolArgumentValidator;
import me.golemcore.linkbay.domain.service.ToolRegistry;
import me.golemcore.linkbay.port.outbound.ConversationPort;
import me.golemcore.linkbay.port.outbound.EmbeddingPort;
import me.golemcore.linkbay.port.outbound.LlmProvider;
import me.golemcore.linkbay.port.outbound.OrchestrationEventPort;
import me.golemcore.linkbay.port.outbound.ResponseCachePort;
import me.golemcore.linkbay.usage.RequestHistory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Wires the orchestrator and its collaborators from {@link LinkbayProperties}.
 *
 * <p>
 * Providers listed under {@code linkbay.providers} are registered at startup.
 * Remote providers without an API key are skipped; the local provider is
 * always registered when listed.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OrchestratorConfiguration {

    private final LinkbayProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public BackoffScheduler backoffScheduler() {
        return BackoffScheduler.DELAYED_EXECUTOR;
    }

    @Bean
    public CostController costController(Clock clock, OrchestrationEventPort events) {
        return new CostController(properties.getBudget(), clock, events);
    }

    @Bean
    public ToolRegistry toolRegistry(List<ToolComponent> tools, OrchestrationEventPort events) {
        ToolRegistry registry = new ToolRegistry(new ToolArgumentValidator(), events);
        if (properties.getTools().isEnabled()) {
            tools.forEach(registry::registerTool);
            log.info("[Tools] Registered {} tools: {}", tools.size(), registry.listTools());
        } else {
            log.info("[Tools] Predefined tools disabled");
        }
        return registry;
    }

    @Bean
    public ConversationPort conversationPort(Clock clock) {
        return new InMemoryConversationContext(properties.getConversation(), clock);
    }

    @Bean
    public ResponseCachePort responseCachePort(EmbeddingPort embeddingPort, Clock clock) {
        return new SemanticResponseCache(embeddingPort, properties.getCache(), clock);
    }

    @Bean
    public ProviderFactory providerFactory(ObjectMapper objectMapper, BackoffScheduler backoffScheduler,
            OrchestrationEventPort events) {
        return new ProviderFactory(objectMapper, backoffScheduler, events);
    }

    @Bean
    public AiOrchestrator aiOrchestrator(CostController costController, ToolRegistry toolRegistry,
            ConversationPort conversationPort, ResponseCachePort responseCachePort,
            ProviderFactory providerFactory, OrchestrationEventPort events, Clock clock) {
        AiOrchestrator orchestrator = AiOrchestrator.builder()
                .costController(costController)
                .toolRegistry(toolRegistry)
                .conversation(conversationPort)
                .cache(properties.getCache().isEnabled() ? responseCachePort : null)
                .history(new RequestHistory(properties.getHistory().getMaxEntries()))
                .tokenEstimator(TokenEstimator.characterRatio(properties.getCharsPerToken()))
                .events(events)
                .clock(clock)
                .build();

        for (LinkbayProperties.ProviderProperties provider : properties.getProviders()) {
            if (!provider.isEnabled()) {
                continue;
            }
            if (provider.getType() == null) {
                log.warn("[Orchestrator] Skipping provider '{}': no type configured", provider.getName());
                continue;
            }
            boolean hasApiKey = provider.getApiKey() != null && !provider.getApiKey().isBlank();
            if (provider.getType() != ProviderType.LOCAL && !hasApiKey) {
                log.info("[Orchestrator] Skipping provider '{}': API key not configured",
                        provider.getName() != null ? provider.getName() : provider.getType().getId());
                continue;
            }
            orchestrator.registerProvider(providerFactory.create(provider.toConfig(properties.getRetry())));
        }

        log.info("LinkBay AI orchestrator ready, providers: {}",
                orchestrator.getProviders().stream().map(LlmProvider::getName).toList());
        return orchestrator;
    }

    @Bean
    public AiTaskService aiTaskService(AiOrchestrator orchestrator, ObjectMapper objectMapper) {
        return new AiTaskService(orchestrator, objectMapper,
                properties.getTasks().getGenerationModel(), properties.getTasks().getAnalysisModel());
    }
}
