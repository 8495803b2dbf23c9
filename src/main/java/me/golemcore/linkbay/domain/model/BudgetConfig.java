package me.golemcore.linkbay.domain.model;

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

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token and cost ceilings enforced by the cost controller. Unit prices are
 * expressed in USD per million tokens.
 */
@Data
public class BudgetConfig {

    private long maxTokensPerHour = 100_000;
    private long maxTokensPerDay = 1_000_000;
    private double maxCostPerHour = 10.0;
    private double alertThreshold = 0.8;
    private Map<String, Double> pricePerMillionTokens = defaultPrices();
    private double defaultPricePerMillionTokens = 1000.0;

    private static Map<String, Double> defaultPrices() {
        Map<String, Double> prices = new LinkedHashMap<>();
        prices.put("deepseek-chat", 0.14);
        prices.put("deepseek-reasoner", 0.55);
        prices.put("gpt-3.5-turbo", 0.5);
        prices.put("gpt-4", 30.0);
        return prices;
    }

    /**
     * Returns the USD price of a single token for the given model.
     */
    public double unitPrice(String model) {
        Double perMillion = model != null && pricePerMillionTokens != null
                ? pricePerMillionTokens.get(model)
                : null;
        double price = perMillion != null ? perMillion : defaultPricePerMillionTokens;
        return price / 1_000_000.0;
    }
}
