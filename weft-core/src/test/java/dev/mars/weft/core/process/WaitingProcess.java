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
 * Test process that waits for a value, then finishes with it.
 */
public class WaitingProcess extends Process {

    static final String RECEIVED_KEY = "received";

    private final Promise<String> trigger = Promise.promise();
    private String received;

    public WaitingProcess(ProcessEnvironment environment, String pid, Map<String, Object> inputs) {
        super(environment, pid, inputs);
        registerStep("collect", this::collect);
    }

    @Override
    protected StepResult run() {
        out("started", true);
        return StepResult.waitFor("collect", "awaiting value", trigger.future());
    }

    private StepResult collect() {
        return StepResult.finish(Map.of("value", received == null ? "resumed" : received));
    }

    public void deliver(String value) {
        trigger.complete(value);
    }

    public void fail(Throwable cause) {
        trigger.fail(cause);
    }

    @Override
    protected void onWaitCompleted(Object triggerValue) {
        received = (String) triggerValue;
    }

    @Override
    protected void saveInstanceState(Map<String, Object> continuation) {
        super.saveInstanceState(continuation);
        if (received != null) {
            continuation.put(RECEIVED_KEY, received);
        }
    }

    @Override
    protected void loadInstanceState(Map<String, Object> continuation) {
        super.loadInstanceState(continuation);
        Object value = continuation.get(RECEIVED_KEY);
        received = value == null ? null : value.toString();
    }
}
