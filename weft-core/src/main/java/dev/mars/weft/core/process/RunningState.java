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

import java.util.Objects;

/**
 * RUNNING with the name of the step to execute next. Executing the state runs
 * the step and maps its {@link StepResult} onto the next state.
 */
public class RunningState extends AbstractProcessState {

    private final String stepName;

    public RunningState(Process process, String stepName) {
        super(process, ProcessState.RUNNING);
        this.stepName = Objects.requireNonNull(stepName, "Step name cannot be null");
    }

    public String getStepName() {
        return stepName;
    }

    @Override
    AbstractProcessState execute() {
        Process process = process();
        StepResult result;
        try {
            result = process.invokeStep(stepName);
        } catch (Exception e) {
            return new ExceptedState(process, e);
        }

        if (result instanceof StepResult.Continue next) {
            return new RunningState(process, next.nextStep());
        } else if (result instanceof StepResult.Wait wait) {
            return new WaitingState(process, wait.nextStep(), wait.reason(), wait.trigger());
        } else if (result instanceof StepResult.Finish finish) {
            return new FinishedState(process, finish.outputs(), finish.successful());
        } else if (result instanceof StepResult.Raise raise) {
            return new ExceptedState(process, raise.error());
        }
        throw new IllegalStateException("Unknown step result " + result);
    }
}
