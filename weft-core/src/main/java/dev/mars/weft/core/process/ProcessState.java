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

package dev.mars.weft.core.process;

import dev.mars.weft.core.statemachine.TransitionTable;

import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle labels of a {@link Process}.
 *
 * The typical flow is:
 * CREATED -> RUNNING -> FINISHED
 *
 * Alternative flows:
 * RUNNING -> WAITING -> RUNNING (suspension and resumption)
 * RUNNING/WAITING -> RUNNING (continue with the next step)
 * any non-terminal label -> EXCEPTED (step or transition failure)
 * any non-terminal label -> KILLED (kill request)
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum ProcessState {

    /**
     * Process has been constructed and its inputs validated.
     * This is the initial state.
     */
    CREATED("Process created", false),

    /**
     * Process is executing, or is scheduled to execute, a step.
     */
    RUNNING("Process running", false),

    /**
     * Process is suspended until its resumption trigger completes.
     */
    WAITING("Process waiting", false),

    /**
     * Process completed and carries its outputs.
     * This is a terminal state.
     */
    FINISHED("Process finished", true),

    /**
     * Process failed and carries the exception.
     * This is a terminal state.
     */
    EXCEPTED("Process excepted", true),

    /**
     * Process was killed and carries the kill message.
     * This is a terminal state.
     */
    KILLED("Process killed", true);

    /** Transition table shared by every process. */
    public static final TransitionTable<ProcessState> TRANSITIONS =
            TransitionTable.builder(ProcessState.class, CREATED)
                    .allow(CREATED, RUNNING, KILLED, EXCEPTED)
                    .allow(RUNNING, RUNNING, WAITING, FINISHED, KILLED, EXCEPTED)
                    .allow(WAITING, RUNNING, WAITING, FINISHED, KILLED, EXCEPTED)
                    .build();

    private final String description;
    private final boolean terminal;

    ProcessState(String description, boolean terminal) {
        this.description = description;
        this.terminal = terminal;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Check if this label is terminal.
     * Terminal labels cannot transition to other labels.
     */
    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Check if transition from this label to the target label is valid.
     *
     * @param target the target label
     * @return true if the transition is valid
     */
    public boolean canTransitionTo(ProcessState target) {
        return TRANSITIONS.isAllowed(this, target);
    }

    public Set<ProcessState> getValidTransitions() {
        return TRANSITIONS.allowedFrom(this);
    }

    /**
     * Wire and bundle representation, the lower-case label name.
     */
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException if the value names no label
     */
    public static ProcessState fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Process state value cannot be null");
        }
        return ProcessState.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
