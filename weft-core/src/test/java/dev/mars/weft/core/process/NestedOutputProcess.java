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

package dev.mars.weft.core.process;

import io.vertx.core.Promise;

import java.util.Map;

/**
 * Test process that writes {@code a.b}, waits, then adds {@code a.c} to the same nested output.
 */
public class NestedOutputProcess extends Process {

    private final Promise<Void> trigger = Promise.promise();

    public NestedOutputProcess(ProcessEnvironment environment, String pid, Map<String, Object> inputs) {
        super(environment, pid, inputs);
        registerStep("extend", this::extend);
    }

    @Override
    protected StepResult run() {
        out("a.b", 1);
        return StepResult.waitFor("extend", "awaiting release", trigger.future());
    }

    private StepResult extend() {
        out("a.c", 2);
        return StepResult.finish(Map.of());
    }
}
