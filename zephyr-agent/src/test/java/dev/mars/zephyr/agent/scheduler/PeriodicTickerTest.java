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

package dev.mars.zephyr.agent.scheduler;

import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
class PeriodicTickerTest {

    @Test
    @DisplayName("Fires immediately and then on each interval")
    void testTicks(Vertx vertx) {
        AtomicInteger runs = new AtomicInteger();
        PeriodicTicker ticker = new PeriodicTicker(vertx, "test", 50, true, runs::incrementAndGet);

        ticker.start();
        assertEquals(1, runs.get());
        assertTrue(ticker.isActive());

        await().atMost(Duration.ofSeconds(2)).until(() -> runs.get() >= 4);
        assertTrue(ticker.cancel());
        assertFalse(ticker.isActive());
        assertFalse(ticker.cancel());

        int afterCancel = runs.get();
        await().pollDelay(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1)).until(() -> true);
        assertEquals(afterCancel, runs.get());
        assertEquals(afterCancel, ticker.getTickCount());
    }

    @Test
    @DisplayName("A failing action does not stop the ticker")
    void testFailingAction(Vertx vertx) {
        AtomicInteger runs = new AtomicInteger();
        PeriodicTicker ticker = new PeriodicTicker(vertx, "failing", 30, false, () -> {
            runs.incrementAndGet();
            throw new IllegalStateException("boom");
        });

        ticker.start();
        assertEquals(0, runs.get());
        await().atMost(Duration.ofSeconds(2)).until(() -> runs.get() >= 3);
        ticker.cancel();
    }

    @Test
    @DisplayName("Starting twice keeps a single timer")
    void testStartIsIdempotent(Vertx vertx) {
        AtomicInteger runs = new AtomicInteger();
        PeriodicTicker ticker = new PeriodicTicker(vertx, "twice", 10_000, true, runs::incrementAndGet);

        ticker.start();
        ticker.start();

        assertEquals(1, runs.get());
        ticker.cancel();
    }

    @Test
    @DisplayName("Interval must be positive")
    void testInvalidInterval(Vertx vertx) {
        assertThrows(IllegalArgumentException.class, () -> new PeriodicTicker(vertx, "bad", 0, false, () -> { }));
    }
}
