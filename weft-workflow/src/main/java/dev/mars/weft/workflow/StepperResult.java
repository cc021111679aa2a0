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

/**
 * Result of advancing a {@link Stepper}. A non-null exit code means a
 * {@code return} instruction ended the whole outline.
 */
public record StepperResult(boolean finished, Integer exitCode) {

    public static final StepperResult CONTINUE = new StepperResult(false, null);
    public static final StepperResult FINISHED = new StepperResult(true, null);

    public static StepperResult returned(int exitCode) {
        return new StepperResult(true, exitCode);
    }

    public boolean returned() {
        return exitCode != null;
    }
}
