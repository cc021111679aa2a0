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

import java.util.Objects;

/**
 * Event bus addresses of a Weft host, all under one prefix:
 * {@code <prefix>.process.<pid>} for per-process RPCs,
 * {@code <prefix>.broadcast} for broadcasts and {@code <prefix>.tasks}
 * for the launcher task queue.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public final class ControlAddresses {

    private final String prefix;

    public ControlAddresses(String prefix) {
        Objects.requireNonNull(prefix, "Address prefix cannot be null");
        if (prefix.isBlank()) {
            throw new IllegalArgumentException("Address prefix cannot be blank");
        }
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    public String process(String pid) {
        Objects.requireNonNull(pid, "Pid cannot be null");
        return prefix + ".process." + pid;
    }

    public String broadcast() {
        return prefix + ".broadcast";
    }

    public String tasks() {
        return prefix + ".tasks";
    }

    @Override
    public String toString() {
        return "ControlAddresses{prefix='" + prefix + "'}";
    }
}
