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
import java.util.Objects;

/**
 * Repeats its body while the predicate holds. The predicate is evaluated
 * before every entry into the body, never in the middle of it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public final class While implements Instruction {

    private final String predicateName;
    private final Condition condition;
    private final Block body;

    public While(String predicateName, Condition condition, Block body) {
        this.predicateName = Objects.requireNonNull(predicateName, "Predicate name cannot be null");
        this.condition = Objects.requireNonNull(condition, "Condition cannot be null");
        this.body = Objects.requireNonNull(body, "Body cannot be null");
    }

    public String getPredicateName() {
        return predicateName;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public Stepper createStepper(WorkflowProcess process) {
        return new WhileStepper(process, null);
    }

    @Override
    public Stepper recreateStepper(Map<String, Object> cursor, WorkflowProcess process) {
        Map<String, Object> childCursor = Cursors.child(cursor);
        return new WhileStepper(process, childCursor == null ? null : body.recreateStepper(childCursor, process));
    }

    @Override
    public Object getDescription() {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("while(" + predicateName + ")", body.getDescription());
        return description;
    }

    private final class WhileStepper implements Stepper {

        private final WorkflowProcess process;
        private Stepper child;

        WhileStepper(WorkflowProcess process, Stepper child) {
            this.process = process;
            this.child = child;
        }

        @Override
        public StepperResult step() throws Exception {
            if (child == null) {
                if (!Predicates.isTrue(process, predicateName, condition)) {
                    return StepperResult.FINISHED;
                }
                child = body.createStepper(process);
            }
            StepperResult result = child.step();
            if (result.returned()) {
                return result;
            }
            if (result.finished()) {
                child = null;
            }
            return StepperResult.CONTINUE;
        }

        @Override
        public Map<String, Object> save() {
            Map<String, Object> cursor = new LinkedHashMap<>();
            if (child != null) {
                cursor.put(Cursors.CHILD, child.save());
            }
            return cursor;
        }
    }
}
