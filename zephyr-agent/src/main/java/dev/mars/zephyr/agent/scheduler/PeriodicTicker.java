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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs an action at a fixed interval on a Vert.x periodic timer.
 *
 * <p>An exception thrown by the action is logged and the ticker keeps going.
 * {@link #cancel()} takes effect immediately: no tick starts after it returns.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class PeriodicTicker {

    private static final Logger logger = LoggerFactory.getLogger(PeriodicTicker.class);

    private static final long NOT_STARTED = -1;

    private final Vertx vertx;
    private final String name;
    private final long intervalMs;
    private final boolean fireImmediately;
    private final Runnable action;
    private final AtomicLong timerId = new AtomicLong(NOT_STARTED);
    private final AtomicLong ticks = new AtomicLong();

    /**
     * @param vertx           Vert.x instance whose timers drive the ticker
     * @param name            used in log lines
     * @param intervalMs      time between ticks
     * @param fireImmediately run the action once on the calling thread when started
     * @param action          what to do on each tick
     */
    public PeriodicTicker(Vertx vertx, String name, long intervalMs, boolean fireImmediately, Runnable action) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive, got: " + intervalMs);
        }
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.name = Objects.requireNonNull(name, "name");
        this.intervalMs = intervalMs;
        this.fireImmediately = fireImmediately;
        this.action = Objects.requireNonNull(action, "action");
    }

    /**
     * Start ticking. Starting an active ticker does nothing.
     */
    public synchronized void start() {
        if (timerId.get() != NOT_STARTED) {
            logger.debug("{} ticker already active", name);
            return;
        }
        long id = vertx.setPeriodic(intervalMs, tid -> tick());
        timerId.set(id);
        logger.info("{} ticker started (interval: {}ms) [Vert.x timer ID: {}]", name, intervalMs, id);
        if (fireImmediately) {
            tick();
        }
    }

    /**
     * Stop ticking.
     *
     * @return true if the ticker was active
     */
    public synchronized boolean cancel() {
        long id = timerId.getAndSet(NOT_STARTED);
        if (id == NOT_STARTED) {
            return false;
        }
        boolean cancelled = vertx.cancelTimer(id);
        logger.info("{} ticker cancelled: {} [ID: {}]", name, cancelled, id);
        return true;
    }

    public boolean isActive() {
        return timerId.get() != NOT_STARTED;
    }

    public long getTickCount() {
        return ticks.get();
    }

    private void tick() {
        if (!isActive()) {
            return;
        }
        ticks.incrementAndGet();
        try {
            action.run();
        } catch (RuntimeException e) {
            logger.error("Error in {} tick", name, e);
        }
    }
}
