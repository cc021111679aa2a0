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

import java.util.Map;

/**
 * Walks one {@link Instruction} a unit of work at a time. The saved form of the
 * outermost stepper is the cursor persisted with the process.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public interface Stepper {

    /**
     * Executes the next unit of work.
     *
     * @throws Exception whatever the step or predicate raised
     */
    StepperResult step() throws Exception;

    /**
     * Captures the position of this stepper and of its open child.
     */
    Map<String, Object> save();
}
