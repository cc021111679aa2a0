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

import java.util.Map;

/**
 * Observer of process lifecycle events. Every callback receives the process,
 * so listeners need not keep a reference to it. All listeners of a process
 * are dropped when it terminates.
 */
public interface ProcessListener {

    default void onProcessCreated(Process process) {
    }

    default void onProcessRunning(Process process) {
    }

    default void onProcessWaiting(Process process) {
    }

    default void onProcessPaused(Process process) {
    }

    default void onProcessPlayed(Process process) {
    }

    default void onOutputEmitted(Process process, String name, Object value) {
    }

    default void onProcessFinished(Process process, Map<String, Object> outputs) {
    }

    default void onProcessExcepted(Process process, Throwable cause) {
    }

    default void onProcessKilled(Process process, String message) {
    }

    /**
     * A checkpoint taken on entering WAITING could not be stored, so the
     * process cannot be resumed after a restart.
     */
    default void onCheckpointFailed(Process process, Throwable cause) {
    }
}
