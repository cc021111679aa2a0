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

import dev.mars.weft.core.statemachine.State;

/**
 * Base of the concrete process states.
 */
public abstract class AbstractProcessState extends State<ProcessState> {

    protected AbstractProcessState(Process process, ProcessState label) {
        super(process, label);
    }

    protected Process process() {
        return (Process) getMachine();
    }

    /**
     * Performs this state's unit of work and returns the state to move to.
     *
     * @throws IllegalStateException if the state has no work to perform
     */
    AbstractProcessState execute() {
        throw new IllegalStateException("Cannot execute a process in state " + getLabel());
    }
}
