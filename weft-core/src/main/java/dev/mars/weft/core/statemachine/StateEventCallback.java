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

/**
 * Callback registered on a {@link StateMachine} for a {@link StateEventHook}.
 *
 * @param <L> the label enum
 */
@FunctionalInterface
public interface StateEventCallback<L extends Enum<L>> {

    /**
     * @param machine the machine undergoing the transition
     * @param hook    the hook being fired
     * @param state   the next state for ENTERING/EXITING, the previous state (possibly null) for ENTERED
     */
    void onStateEvent(StateMachine<L> machine, StateEventHook hook, State<L> state) throws Exception;
}
