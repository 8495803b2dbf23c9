package me.golemcore.linkbay;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for LinkBay AI.
 *
 * <p>
 * LinkBay AI routes chat requests across several LLM providers with bounded
 * retries, priority failover, token and cost budgets, and tool dispatch.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Multi-provider</b> - DeepSeek, OpenAI and Anthropic via langchain4j,
 * plus an offline local fallback</li>
 * <li><b>Resilience</b> - per-provider retry with exponential backoff, then
 * failover to the next provider by priority</li>
 * <li><b>Budget control</b> - hourly and daily token ceilings and an hourly cost
 * ceiling, checked before any network call</li>
 * <li><b>Tools</b> - schema-validated dispatch of model-requested tool
 * calls</li>
 * <li><b>Context</b> - conversation memory and a semantic response cache</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Domain Layer       → AiOrchestrator, CostController, ToolRegistry
 * Ports              → LlmProvider, ChatBackendPort, ConversationPort, ResponseCachePort
 * Adapters           → langchain4j backends, in-memory conversation, semantic cache
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code linkbay.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class LinkbayApplication {

    public static void main(String[] args) {
        SpringApplication.run(LinkbayApplication.class, args);
    }

}
