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

package dev.mars.weft.workflow;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ends the outline immediately. A non-zero exit code finishes the workflow unsuccessfully.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public final class Return implements Instruction {

    private final int exitCode;

    public Return(int exitCode) {
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }

    @Override
    public Stepper createStepper(WorkflowProcess process) {
        return new Stepper() {
            @Override
            public StepperResult step() {
                return StepperResult.returned(exitCode);
            }

            @Override
            public Map<String, Object> save() {
                return new LinkedHashMap<>();
            }
        };
    }

    @Override
    public Stepper recreateStepper(Map<String, Object> cursor, WorkflowProcess process) {
        return createStepper(process);
    }

    @Override
    public Object getDescription() {
        return "return(" + exitCode + ")";
    }
}
