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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tool searching the product catalog by free-text query and optional
 * category. The catalog is held in memory and filled by the application.
 */
@Component
@Slf4j
public class SearchProductsTool implements ToolComponent {

    static final int DEFAULT_MAX_RESULTS = 10;
    static final int MAX_RESULTS_LIMIT = 100;

    private final List<Product> catalog = new CopyOnWriteArrayList<>();

    public void addProduct(Product product) {
        catalog.add(product);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("search_products")
                .description("Search products in the catalog by name or description.")
                .parameters(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "query", Map.of(
                                        "type", "string",
                                        "description", "Search text"),
                                "category", Map.of(
                                        "type", "string",
                                        "description", "Optional category filter"),
                                "max_results", Map.of(
                                        "type", "integer",
                                        "description", "Maximum number of results (1-100)",
                                        "minimum", 1,
                                        "maximum", MAX_RESULTS_LIMIT,
                                        "default", DEFAULT_MAX_RESULTS)),
                        "required", List.of("query")))
                .build();
    }

    @Override
    public Object handle(ToolArguments arguments) {
        String query = arguments.getString("query");
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query is required");
        }
        int maxResults = arguments.getInt("max_results", DEFAULT_MAX_RESULTS);
        if (maxResults < 1 || maxResults > MAX_RESULTS_LIMIT) {
            throw new IllegalArgumentException("max_results must be between 1 and " + MAX_RESULTS_LIMIT);
        }
        String category = arguments.getString("category");

        String needle = query.toLowerCase(Locale.ROOT).strip();
        List<Map<String, Object>> matches = catalog.stream()
                .filter(product -> category == null || category.equalsIgnoreCase(product.getCategory()))
                .filter(product -> product.matches(needle))
                .limit(maxResults)
                .map(Product::toMap)
                .toList();

        log.debug("[Tools] search_products '{}' ({}) -> {} results", query, category, matches.size());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("query", query);
        result.put("count", matches.size());
        result.put("products", matches);
        return result;
    }

    @Value
    @Builder
    public static class Product {
        String id;
        String name;
        String description;
        String category;
        double price;

        boolean matches(String needle) {
            return contains(name, needle) || contains(description, needle);
        }

        Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("id", id);
            map.put("name", name);
            map.put("category", category);
            map.put("price", price);
            return map;
        }

        private static boolean contains(String text, String needle) {
            return text != null && text.toLowerCase(Locale.ROOT).contains(needle);
        }
    }
}
