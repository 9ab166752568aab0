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

import java.util.Map;

/**
 * Builds the prompt sent to the model for a task.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class PromptBuilder {

    static final String PREAMBLE =
            "You are ZephyrOS Executor, an AI assistant that completes coding and development tasks.";

    private PromptBuilder() {
    }

    public static String build(String description, Map<String, ?> context) {
        StringBuilder prompt = new StringBuilder()
                .append(PREAMBLE).append('\n')
                .append('\n')
                .append("TASK:").append('\n')
                .append(description == null ? "" : description).append('\n');

        if (context != null && !context.isEmpty()) {
            prompt.append('\n').append("ADDITIONAL CONTEXT:").append('\n');
            context.forEach((key, value) -> prompt.append(key).append(": ").append(value).append('\n'));
        }

        prompt.append('\n')
                .append("Please complete this task and provide detailed output including:").append('\n')
                .append("1. Your approach and reasoning").append('\n')
                .append("2. Any code or artifacts generated").append('\n')
                .append("3. Next steps or recommendations");
        return prompt.toString();
    }
}
