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

package dev.mars.weft.core.exceptions;

import java.util.Collection;
import java.util.List;

/**
 * Thrown when a state machine is asked to move to a label that is not an
 * allowed target of its current state.
 *
 * <p>This exception captures the current label, the requested target label,
 * and the set of valid targets from the current label, enabling
 * informative error messages in logs and status reports.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class InvalidTransitionException extends WeftException {

    private final String entityId;
    private final Enum<?> currentState;
    private final Enum<?> requestedState;
    private final List<Enum<?>> validTransitions;

    /**
     * Constructs an InvalidTransitionException with full context.
     *
     * @param entityId         the identifier of the machine whose transition was rejected
     * @param currentState     the current label, or null when the machine has not been initialised
     * @param requestedState   the label that was requested but is not valid
     * @param validTransitions the labels that are valid targets from the current label
     */
    public InvalidTransitionException(String entityId, Enum<?> currentState,
                                      Enum<?> requestedState, Collection<? extends Enum<?>> validTransitions) {
        super(String.format("Invalid transition for '%s': %s → %s. Valid targets: %s",
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
        if (transitions == null || transitions.isEmpty()) {
            return "[]";
        }
        StringBuilder sb = new StringBuilder("[");
        boolean first = true;
        for (Enum<?> transition : transitions) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(transition.name());
            first = false;
        }
        sb.append("]");
        return sb.toString();
    }
}
