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

import io.vertx.core.Future;

import java.util.Objects;

/**
 * WAITING until a trigger completes. Holds the step to continue with, which
 * is the continuation restored on the WAITING to RUNNING edge.
 *
 * <p>A waiting state rebuilt from a checkpoint has no trigger and is resumed
 * explicitly with {@link Process#resume()}.</p>
 */
public class WaitingState extends AbstractProcessState {

    private final String nextStep;
    private final String reason;
    private final Future<?> trigger;

    public WaitingState(Process process, String nextStep, String reason, Future<?> trigger) {
        super(process, ProcessState.WAITING);
        this.nextStep = Objects.requireNonNull(nextStep, "Next step cannot be null");
        this.reason = reason;
        this.trigger = trigger;
    }

    public String getNextStep() {
        return nextStep;
    }

    public String getReason() {
        return reason;
    }

    public Future<?> getTrigger() {
        return trigger;
    }

    @Override
    protected void enter() {
        if (trigger != null) {
            Process process = process();
            trigger.onComplete(ar -> process.getScheduler().schedule(() -> process.onTriggerCompleted(this, ar)));
        }
    }
}
