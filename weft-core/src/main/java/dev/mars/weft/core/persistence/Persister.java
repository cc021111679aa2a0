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

import dev.mars.weft.core.exceptions.PersistenceException;
import dev.mars.weft.core.process.Process;

import java.util.List;

/**
 * Durable store of process checkpoints.
 *
 * <p>A checkpoint is identified by the pid and an optional tag. Saving a
 * checkpoint for an existing pid and tag replaces it.</p>
 */
public interface Persister {

    /**
     * Saves the current state of the process under the default tag.
     */
    default PersistedCheckpoint saveCheckpoint(Process process) throws PersistenceException {
        return saveCheckpoint(process, null);
    }

    /**
     * Saves the current state of the process.
     *
     * @param process the process to snapshot
     * @param tag     optional tag, null for the default
     * @return the identity of the stored checkpoint
     * @throws PersistenceException if the process cannot be bundled or the bundle cannot be stored
     */
    PersistedCheckpoint saveCheckpoint(Process process, String tag) throws PersistenceException;

    default Bundle loadCheckpoint(String pid) throws PersistenceException {
        return loadCheckpoint(pid, null);
    }

    /**
     * @throws PersistenceException if no such checkpoint exists or it cannot be read
     */
    Bundle loadCheckpoint(String pid, String tag) throws PersistenceException;

    List<PersistedCheckpoint> getCheckpoints() throws PersistenceException;

    List<PersistedCheckpoint> getProcessCheckpoints(String pid) throws PersistenceException;

    /**
     * Deletes a checkpoint. Deleting one that does not exist is not an error.
     */
    void deleteCheckpoint(String pid, String tag) throws PersistenceException;

    void deleteProcessCheckpoints(String pid) throws PersistenceException;
}
