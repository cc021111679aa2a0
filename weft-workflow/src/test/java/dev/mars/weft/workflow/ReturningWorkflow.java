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

import java.util.Map;

import static dev.mars.weft.workflow.Outline.*;

/**
 * Ticks in an endless loop and returns {@code code} from inside it after two ticks.
 */
class ReturningWorkflow extends TracingWorkflow {

    ReturningWorkflow(ProcessEnvironment environment, String pid, Map<String, Object> inputs) {
        super(environment, pid, inputs);
    }

    @Override
    protected Instruction defineOutline() {
        int code = ((Number) getInputs().get("code")).intValue();
        return sequence(
                repeatWhile("forever", () -> true,
                        Outline.step("tick", this::increment),
                        when("enough", () -> counter() >= 2, returnWith(code))),
                traced("unreachable"));
    }
}
