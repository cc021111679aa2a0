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

import dev.mars.weft.core.statemachine.StateEntryFailedException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Terminal state carrying the outputs. Entering a successful finish validates
 * the outputs; invalid outputs demote it to an unsuccessful finish.
 */
public class FinishedState extends AbstractProcessState {

    private final Map<String, Object> outputs;
    private final boolean successful;

    public FinishedState(Process process, Map<String, Object> outputs, boolean successful) {
        super(process, ProcessState.FINISHED);
        this.outputs = outputs == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        this.successful = successful;
    }

    public Map<String, Object> getOutputs() {
        return outputs;
    }

    public boolean isSuccessful() {
        return successful;
    }

    @Override
    protected void enter() throws StateEntryFailedException {
        Process process = process();
        process.mergeOutputs(outputs);
        if (successful) {
            Optional<String> invalid = process.getValidator().validateOutputs(process.getOutputs());
            if (invalid.isPresent()) {
                throw new StateEntryFailedException(new FinishedState(process, outputs, false), invalid.get());
            }
        }
    }
}
