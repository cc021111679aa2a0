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

package dev.mars.weft.core.persistence;

import java.util.Objects;

/**
 * Identifies a stored checkpoint.
 *
 * @param pid the process id
 * @param tag optional tag distinguishing several checkpoints of one process, null for the default
 */
public record PersistedCheckpoint(String pid, String tag) {

    public PersistedCheckpoint {
        Objects.requireNonNull(pid, "Pid cannot be null");
    }

    public static PersistedCheckpoint of(String pid) {
        return new PersistedCheckpoint(pid, null);
    }
}
