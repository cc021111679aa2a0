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
 * A node of a workflow outline. Instructions are immutable and shared by every
 * run of the outline; the per-run position lives in the {@link Stepper} they create.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public interface Instruction {

    /**
     * Creates a stepper positioned before the first unit of work of this instruction.
     */
    Stepper createStepper(WorkflowProcess process);

    /**
     * Recreates a stepper from the cursor a previous stepper of this instruction saved.
     *
     * @throws IllegalArgumentException if the cursor does not fit this instruction
     */
    Stepper recreateStepper(Map<String, Object> cursor, WorkflowProcess process);

    /**
     * Human-readable description: a step name, a list for a block, or a map
     * from a conditional header to the description of its body.
     */
    Object getDescription();
}
