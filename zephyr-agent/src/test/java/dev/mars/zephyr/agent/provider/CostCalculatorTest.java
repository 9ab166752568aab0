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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CostCalculatorTest {

    @Test
    @DisplayName("Model ids map to their pricing family")
    void testFamily() {
        assertEquals("haiku", CostCalculator.family("claude-3-5-haiku-20241022"));
        assertEquals("opus", CostCalculator.family("Claude-Opus-4"));
        assertEquals("sonnet", CostCalculator.family("claude-sonnet-4-20250514"));
        assertEquals("sonnet", CostCalculator.family("gpt-something"));
        assertEquals("sonnet", CostCalculator.family(null));
    }

    @Test
    @DisplayName("Cost is priced per million input and output tokens")
    void testCalculate() {
        TokenUsage usage = new TokenUsage(2_000, 1_000);

        assertEquals(0.021, CostCalculator.calculate("claude-sonnet-4", usage), 1e-9);
        assertEquals(0.00175, CostCalculator.calculate("claude-3-haiku", usage), 1e-9);
        assertEquals(0.105, CostCalculator.calculate("claude-opus-4", usage), 1e-9);
        assertEquals(0.0, CostCalculator.calculate("claude-opus-4", null));
        assertEquals(0.0, CostCalculator.calculate("claude-opus-4", TokenUsage.NONE));
    }
}
