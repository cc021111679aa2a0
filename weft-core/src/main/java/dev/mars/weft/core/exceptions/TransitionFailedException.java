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

/**
 * Raised out of a state machine when a transition failed and the machine's
 * failure policy decided not to absorb it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class TransitionFailedException extends RuntimeException {

    private final Enum<?> initialState;
    private final Enum<?> targetState;

    public TransitionFailedException(Enum<?> initialState, Enum<?> targetState, Throwable cause) {
        super(String.format("Transition %s → %s failed: %s", initialState, targetState,
                cause == null ? "unknown cause" : cause.getMessage()), cause);
        this.initialState = initialState;
        this.targetState = targetState;
    }

    public Enum<?> getInitialState() {
        return initialState;
    }

    public Enum<?> getTargetState() {
        return targetState;
    }
}
