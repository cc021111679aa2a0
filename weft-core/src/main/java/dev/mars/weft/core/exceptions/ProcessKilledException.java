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

package dev.mars.weft.core.exceptions;

/**
 * Fails the result future of a process that was killed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class ProcessKilledException extends WeftException {

    private final String pid;
    private final String killMessage;

    public ProcessKilledException(String pid, String killMessage) {
        super(killMessage == null
                ? String.format("Process %s was killed", pid)
                : String.format("Process %s was killed: %s", pid, killMessage));
        this.pid = pid;
        this.killMessage = killMessage;
    }

    public String getPid() {
        return pid;
    }

    public String getKillMessage() {
        return killMessage;
    }
}
