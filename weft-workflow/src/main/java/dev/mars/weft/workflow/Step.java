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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named unit of work. Finishes after a single execution.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public final class Step implements Instruction {

    private static final Logger logger = LoggerFactory.getLogger(Step.class);

    private final String name;
    private final WorkflowStep action;

    public Step(String name, WorkflowStep action) {
        this.name = Objects.requireNonNull(name, "Step name cannot be null");
        this.action = Objects.requireNonNull(action, "Step action cannot be null");
    }

    public String getName() {
        return name;
    }

    @Override
    public Stepper createStepper(WorkflowProcess process) {
        return new StepStepper(process);
    }

    @Override
    public Stepper recreateStepper(Map<String, Object> cursor, WorkflowProcess process) {
        Object saved = cursor.get(Cursors.STEP);
        if (!name.equals(saved)) {
            throw new IllegalArgumentException("Outline cursor names step '" + saved + "' where the outline has '" + name + "'");
        }
        return new StepStepper(process);
    }

    @Override
    public Object getDescription() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }

    private final class StepStepper implements Stepper {

        private final WorkflowProcess process;

        StepStepper(WorkflowProcess process) {
            this.process = process;
        }

        @Override
        public StepperResult step() throws Exception {
            logger.debug("Process<{}>: outline step '{}'", process.getPid(), name);
            action.execute();
            return StepperResult.FINISHED;
        }

        @Override
        public Map<String, Object> save() {
            Map<String, Object> cursor = new LinkedHashMap<>();
            cursor.put(Cursors.STEP, name);
            return cursor;
        }
    }
}
