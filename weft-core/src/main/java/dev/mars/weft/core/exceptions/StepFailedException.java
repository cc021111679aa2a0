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
 * Wraps a failure raised by a process step so that the process identity and
 * the step name travel with the original cause.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class StepFailedException extends WeftException {

    private final String pid;
    private final String stepName;

    public StepFailedException(String pid, String stepName, String message) {
        super(String.format("Step '%s' of process %s failed: %s", stepName, pid, message));
        this.pid = pid;
        this.stepName = stepName;
    }

    public StepFailedException(String pid, String stepName, Throwable cause) {
        super(String.format("Step '%s' of process %s failed: %s", stepName, pid, cause.getMessage()), cause);
        this.pid = pid;
        this.stepName = stepName;
    }

    public String getPid() {
        return pid;
    }

    public String getStepName() {
        return stepName;
    }
}
