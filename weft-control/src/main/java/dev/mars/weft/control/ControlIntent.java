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

package dev.mars.weft.control;

import java.util.Arrays;
import java.util.Optional;

/**
 * The {@code kind} of a control message.
 *
 * <p>Process intents are sent to one process, host intents are broadcast to
 * every live process and task intents go to the launcher task queue.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public enum ControlIntent {

    // ==================== Process Intents ====================

    PLAY("play", Target.PROCESS),
    PAUSE("pause", Target.PROCESS),
    KILL("kill", Target.PROCESS),
    STATUS("status", Target.PROCESS),

    /** Published by a process after every transition */
    STATE_CHANGED("state_changed", Target.PROCESS),

    // ==================== Host Intents ====================

    PAUSE_ALL("pause_all", Target.ALL),
    PLAY_ALL("play_all", Target.ALL),
    KILL_ALL("kill_all", Target.ALL),

    // ==================== Task Intents ====================

    LAUNCH("launch", Target.TASK),
    CREATE("create", Target.TASK),
    CONTINUE("continue", Target.TASK);

    /**
     * Who handles an intent.
     */
    public enum Target {
        PROCESS,
        ALL,
        TASK
    }

    private final String value;
    private final Target target;

    ControlIntent(String value, Target target) {
        this.value = value;
        this.target = target;
    }

    public String getValue() {
        return value;
    }

    public Target getTarget() {
        return target;
    }

    public boolean isTask() {
        return target == Target.TASK;
    }

    public static Optional<ControlIntent> fromValue(String value) {
        return Arrays.stream(values())
                .filter(i -> i.value.equals(value))
                .findFirst();
    }
}
