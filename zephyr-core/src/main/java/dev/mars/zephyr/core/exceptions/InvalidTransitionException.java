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

package dev.mars.zephyr.core.exceptions;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a task or workspace is asked to move to a status that its
 * transition table does not allow from the current one.
 *
 * <p>Carries the current state, the requested state and the legal targets so
 * the rejection can be logged without another lookup.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class InvalidTransitionException extends ZephyrException {

    private final String entityId;
    private final Enum<?> currentState;
    private final Enum<?> requestedState;
    private final List<Enum<?>> validTransitions;

    /**
     * @param entityId         id of the task or workspace whose transition was rejected
     * @param currentState     the state the entity is in
     * @param requestedState   the rejected target state
     * @param validTransitions the targets that are legal from {@code currentState}
     */
    public InvalidTransitionException(String entityId, Enum<?> currentState,
                                      Enum<?> requestedState, Collection<? extends Enum<?>> validTransitions) {
        super(String.format("Invalid transition for '%s': %s -> %s. Valid targets: %s",
                entityId, currentState, requestedState, formatTransitions(validTransitions)));
        this.entityId = entityId;
        this.currentState = currentState;
        this.requestedState = requestedState;
        this.validTransitions = List.copyOf(validTransitions);
    }

    public String getEntityId() {
        return entityId;
    }

    public Enum<?> getCurrentState() {
        return currentState;
    }

    public Enum<?> getRequestedState() {
        return requestedState;
    }

    public List<Enum<?>> getValidTransitions() {
        return validTransitions;
    }

    private static String formatTransitions(Collection<? extends Enum<?>> transitions) {
        return transitions.stream()
                .map(Enum::name)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
