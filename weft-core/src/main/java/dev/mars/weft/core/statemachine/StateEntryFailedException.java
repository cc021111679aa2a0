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
 * Thrown from {@link State#enter()} to redirect a transition to another state.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class StateEntryFailedException extends Exception {

    private final transient State<?> state;

    public StateEntryFailedException(State<?> state, String reason) {
        super(reason);
        this.state = Objects.requireNonNull(state, "Replacement state cannot be null");
    }

    public State<?> getState() {
        return state;
    }
}
