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

import java.util.Arrays;

/**
 * Static builders for workflow outlines, meant to be imported statically:
 *
 * <pre>{@code
 * sequence(
 *     step("prepare", this::prepare),
 *     when("needsRetry", this::needsRetry, step("retry", this::retry))
 *         .otherwise(step("report", this::report)),
 *     repeatWhile("hasMore", this::hasMore, step("consume", this::consume)),
 *     returnWith(0));
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public final class Outline {

    private Outline() {
    }

    public static Block sequence(Instruction... instructions) {
        return block(instructions);
    }

    public static Step step(String name, WorkflowStep action) {
        return new Step(name, action);
    }

    public static If when(String predicateName, Condition condition, Instruction... body) {
        return new If(predicateName, condition, block(body));
    }

    public static While repeatWhile(String predicateName, Condition condition, Instruction... body) {
        return new While(predicateName, condition, block(body));
    }

    public static Return returnWith(int exitCode) {
        return new Return(exitCode);
    }

    static Block block(Instruction... instructions) {
        return new Block(Arrays.asList(instructions));
    }
}
