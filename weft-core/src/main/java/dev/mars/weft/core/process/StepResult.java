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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one step of a process. Exactly one of four directives.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public sealed interface StepResult permits StepResult.Continue, StepResult.Wait, StepResult.Finish, StepResult.Raise {

    static Continue next(String nextStep) {
        return new Continue(nextStep);
    }

    static Wait waitFor(String nextStep, Future<?> trigger) {
        return new Wait(nextStep, null, trigger);
    }

    static Wait waitFor(String nextStep, String reason, Future<?> trigger) {
        return new Wait(nextStep, reason, trigger);
    }

    static Finish finish(Map<String, Object> outputs) {
        return new Finish(outputs, true);
    }

    static Finish finish(Map<String, Object> outputs, boolean successful) {
        return new Finish(outputs, successful);
    }

    static Raise raise(Throwable error) {
        return new Raise(error);
    }

    /**
     * Stay RUNNING and execute {@code nextStep} on a later scheduler turn.
     */
    record Continue(String nextStep) implements StepResult {
        public Continue {
            Objects.requireNonNull(nextStep, "Next step cannot be null");
        }
    }

    /**
     * Suspend in WAITING until {@code trigger} completes, then continue with
     * {@code nextStep}. A null trigger leaves resumption to {@link Process#resume()}.
     */
    record Wait(String nextStep, String reason, Future<?> trigger) implements StepResult {
        public Wait {
            Objects.requireNonNull(nextStep, "Next step cannot be null");
        }
    }

    /**
     * Terminate in FINISHED with the given outputs.
     */
    record Finish(Map<String, Object> outputs, boolean successful) implements StepResult {
        public Finish {
            outputs = outputs == null
                    ? Collections.emptyMap()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        }
    }

    /**
     * Terminate in EXCEPTED with the given error.
     */
    record Raise(Throwable error) implements StepResult {
        public Raise {
            Objects.requireNonNull(error, "Error cannot be null");
        }
    }
}
