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

package dev.mars.weft.core.statemachine;

import java.util.Objects;

/**
 * A state of a {@link StateMachine}. A state instance exists only while it is
 * current; only its label outlives it.
 *
 * @param <L> the label enum
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public abstract class State<L extends Enum<L>> {

    private final StateMachine<L> machine;
    private final L label;

    protected State(StateMachine<L> machine, L label) {
        this.machine = Objects.requireNonNull(machine, "Owning state machine cannot be null");
        this.label = Objects.requireNonNull(label, "Label cannot be null");
    }

    public final L getLabel() {
        return label;
    }

    public StateMachine<L> getMachine() {
        return machine;
    }

    public boolean isTerminal() {
        return machine.getTransitionTable().isTerminal(label);
    }

    /**
     * Called when this state is entered, before it becomes current. Throw
     * {@link StateEntryFailedException} to enter a different state instead.
     */
    protected void enter() throws Exception {
    }

    /** Called when this state is left. */
    protected void exit() throws Exception {
    }

    @Override
    public String toString() {
        return label.name();
    }
}
