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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A sequence of instructions executed in order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public final class Block implements Instruction {

    private final List<Instruction> instructions;

    public Block(List<Instruction> instructions) {
        Objects.requireNonNull(instructions, "Instructions cannot be null");
        this.instructions = List.copyOf(instructions);
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public int size() {
        return instructions.size();
    }

    @Override
    public Stepper createStepper(WorkflowProcess process) {
        return new BlockStepper(process, 0, instructions.isEmpty() ? null : instructions.get(0).createStepper(process));
    }

    @Override
    public Stepper recreateStepper(Map<String, Object> cursor, WorkflowProcess process) {
        int position = Cursors.intValue(cursor, Cursors.POSITION, 0, instructions.size());
        Stepper child = null;
        if (position < instructions.size()) {
            Map<String, Object> childCursor = Cursors.child(cursor);
            Instruction current = instructions.get(position);
            child = childCursor == null ? current.createStepper(process) : current.recreateStepper(childCursor, process);
        }
        return new BlockStepper(process, position, child);
    }

    @Override
    public Object getDescription() {
        List<Object> description = new ArrayList<>();
        for (Instruction instruction : instructions) {
            description.add(instruction.getDescription());
        }
        return description;
    }

    @Override
    public String toString() {
        return String.valueOf(getDescription());
    }

    private final class BlockStepper implements Stepper {

        private final WorkflowProcess process;
        private int position;
        private Stepper child;

        BlockStepper(WorkflowProcess process, int position, Stepper child) {
            this.process = process;
            this.position = position;
            this.child = child;
        }

        @Override
        public StepperResult step() throws Exception {
            if (finished()) {
                return StepperResult.FINISHED;
            }
            StepperResult result = child.step();
            if (result.returned()) {
                return result;
            }
            if (result.finished()) {
                position++;
                child = finished() ? null : instructions.get(position).createStepper(process);
            }
            return finished() ? StepperResult.FINISHED : StepperResult.CONTINUE;
        }

        private boolean finished() {
            return position >= instructions.size();
        }

        @Override
        public Map<String, Object> save() {
            Map<String, Object> cursor = new LinkedHashMap<>();
            cursor.put(Cursors.POSITION, position);
            if (child != null) {
                cursor.put(Cursors.CHILD, child.save());
            }
            return cursor;
        }
    }
}
