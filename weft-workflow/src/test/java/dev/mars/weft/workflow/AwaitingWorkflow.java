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

import dev.mars.weft.core.process.ProcessEnvironment;
import io.vertx.core.Promise;

import java.util.Map;

import static dev.mars.weft.workflow.Outline.*;

/**
 * Submits two pieces of work, waits for both and combines their results.
 */
class AwaitingWorkflow extends TracingWorkflow {

    final Promise<Integer> left = Promise.promise();
    final Promise<Integer> right = Promise.promise();

    AwaitingWorkflow(ProcessEnvironment environment, String pid, Map<String, Object> inputs) {
        super(environment, pid, inputs);
    }

    @Override
    protected Instruction defineOutline() {
        return sequence(
                Outline.step("submit", this::submit),
                Outline.step("combine", this::combine));
    }

    private void submit() {
        trace("submit");
        toContext("left", left.future());
        toContext("right", right.future());
    }

    private void combine() {
        trace("combine");
        Object l = getContextValue("left");
        Object r = getContextValue("right");
        if (l != null && r != null) {
            out("sum", ((Number) l).intValue() + ((Number) r).intValue());
        }
    }
}
