/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.zephyr.agent.provider;

import dev.mars.zephyr.core.TokenUsage;

import java.util.Locale;
import java.util.Map;

/**
 * Estimates the USD cost of a model call from its token usage.
 *
 * <p>Prices are per million tokens, keyed by model family. Unknown models are
 * priced as sonnet.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class CostCalculator {

    // {input, output} USD per million tokens
    private static final Map<String, double[]> MODEL_PRICING = Map.of(
        "haiku", new double[]{0.25, 1.25},
        "sonnet", new double[]{3.0, 15.0},
        "opus", new double[]{15.0, 75.0}
    );

    private static final String DEFAULT_FAMILY = "sonnet";

    private CostCalculator() {
    }

    public static double calculate(String model, TokenUsage usage) {
        if (usage == null) {
            return 0.0;
        }
        double[] pricing = MODEL_PRICING.get(family(model));
        double inputCost = (usage.getInputTokens() * pricing[0]) / 1_000_000.0;
        double outputCost = (usage.getOutputTokens() * pricing[1]) / 1_000_000.0;
        return inputCost + outputCost;
    }

    /**
     * Pricing family of a model id such as {@code claude-3-5-haiku-20241022}.
     */
    static String family(String model) {
        if (model == null) {
            return DEFAULT_FAMILY;
        }
        String lower = model.toLowerCase(Locale.ROOT);
        for (String family : MODEL_PRICING.keySet()) {
            if (lower.contains(family)) {
                return family;
            }
        }
        return DEFAULT_FAMILY;
    }
}
