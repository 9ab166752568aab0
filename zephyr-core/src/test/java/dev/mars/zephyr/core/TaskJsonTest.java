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

package dev.mars.zephyr.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wire format of tasks and results as exchanged with the task API.
 */
class TaskJsonTest {

    private final ObjectMapper mapper = JsonMapping.mapper();

    @Test
    void parsesBackendTaskWithObjectiveAliasAndUnknownFields() throws Exception {
        String json = "{\"id\":\"t-1\",\"objective\":\"Write a README\",\"status\":\"in_progress\","
                + "\"priority\":\"high\",\"mode\":\"dry_run\",\"context\":{\"repo_url\":\"https://x/y.git\"},"
                + "\"guardrails\":{\"cost_cap_usd\":2.5,\"requires_approval\":true},"
                + "\"retry_count\":1,\"max_retries\":3,\"created_at\":\"2026-03-02T09:00:00Z\","
                + "\"tenant_color\":\"purple\"}";

        Task task = mapper.readValue(json, Task.class);

        assertEquals("t-1", task.getId());
        assertEquals("Write a README", task.getDescription());
        assertEquals(TaskStatus.RUNNING, task.getStatus());
        assertEquals(TaskPriority.HIGH, task.getPriority());
        assertEquals(ExecutionMode.DRY_RUN, task.getMode());
        assertEquals("https://x/y.git", task.getContext().get("repo_url"));
        assertEquals(2.5, task.getGuardrails().getCostCapUsd());
        assertTrue(task.getGuardrails().isRequiresApproval());
        assertTrue(task.canRetry());
        assertEquals(Instant.parse("2026-03-02T09:00:00Z"), task.getCreatedAt());
    }

    @Test
    void defaultsApplyWhenFieldsAreMissing() throws Exception {
        Task task = mapper.readValue("{\"id\":\"t-2\",\"description\":\"d\"}", Task.class);

        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertEquals(ExecutionMode.EXECUTE, task.getMode());
        assertEquals(TaskPriority.NORMAL, task.getPriority());
        assertTrue(task.getContext().isEmpty());
        assertFalse(task.canRetry());
    }

    @Test
    void withStatusCopiesAndStampsWithoutTouchingOriginal() {
        Task pending = new Task("t-3", "d");
        Instant at = Instant.parse("2026-03-02T10:00:00Z");

        Task accepted = pending.withStatus(TaskStatus.ACCEPTED, at);
        Task completed = accepted.withStatus(TaskStatus.COMPLETED, at.plusSeconds(30));

        assertEquals(TaskStatus.PENDING, pending.getStatus());
        assertNull(pending.getAcceptedAt());
        assertEquals(at, accepted.getAcceptedAt());
        assertEquals(100, completed.getProgress());
        assertEquals(30, completed.getElapsed().getSeconds());
    }

    @Test
    void resultSerializesSnakeCaseUsage() throws Exception {
        TaskResult result = new TaskResult("done", new TokenUsage(100, 50), "claude-sonnet-4", 1.5, 0.00105);

        ObjectNode node = mapper.valueToTree(result);

        assertEquals("done", node.get("response").asText());
        assertEquals(100, node.get("usage").get("input_tokens").asInt());
        assertEquals(150, node.get("usage").get("total_tokens").asInt());
        assertEquals(1.5, node.get("execution_time_seconds").asDouble());
    }

    @Test
    void serializedTaskUsesWireStatusAndSkipsNulls() throws Exception {
        Task running = new Task("t-4", "d").withStatus(TaskStatus.RUNNING, Instant.now());

        ObjectNode node = mapper.valueToTree(running);

        assertEquals("in_progress", node.get("status").asText());
        assertFalse(node.has("error"));
        assertFalse(node.has("elapsed"));
    }
}
