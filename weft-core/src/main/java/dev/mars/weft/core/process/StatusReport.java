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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time status of a process as returned by a STATUS request.
 *
 * @param pid           the process id
 * @param label         the current label
 * @param terminal      whether the label is terminal
 * @param paused        whether the process is paused
 * @param status        the free-text status, may be null
 * @param creationTime  when the process entered CREATED, may be null
 * @param processString human-readable description of the process
 */
public record StatusReport(String pid,
                           ProcessState label,
                           boolean terminal,
                           boolean paused,
                           String status,
                           Instant creationTime,
                           String processString) {

    public static final String PID = "pid";
    public static final String LABEL = "label";
    public static final String IS_TERMINAL = "is_terminal";
    public static final String PAUSED = "paused";
    public static final String STATUS = "status";
    public static final String CTIME = "ctime";
    public static final String PROCESS_STRING = "process_string";

    public StatusReport {
        Objects.requireNonNull(pid, "Pid cannot be null");
        Objects.requireNonNull(label, "Label cannot be null");
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(PID, pid);
        map.put(LABEL, label.getValue());
        map.put(IS_TERMINAL, terminal);
        map.put(PAUSED, paused);
        map.put(STATUS, status);
        map.put(CTIME, creationTime == null ? null : creationTime.toEpochMilli());
        map.put(PROCESS_STRING, processString);
        return map;
    }

    /**
     * @throws IllegalArgumentException if a mandatory field is missing or invalid
     */
    public static StatusReport fromMap(Map<String, Object> map) {
        Object pid = map.get(PID);
        Object label = map.get(LABEL);
        if (!(pid instanceof String) || !(label instanceof String)) {
            throw new IllegalArgumentException("Status report requires string '" + PID + "' and '" + LABEL + "'");
        }
        Object ctime = map.get(CTIME);
        return new StatusReport(
                (String) pid,
                ProcessState.fromValue((String) label),
                Boolean.TRUE.equals(map.get(IS_TERMINAL)),
                Boolean.TRUE.equals(map.get(PAUSED)),
                (String) map.get(STATUS),
                ctime instanceof Number ? Instant.ofEpochMilli(((Number) ctime).longValue()) : null,
                (String) map.get(PROCESS_STRING));
    }
}
