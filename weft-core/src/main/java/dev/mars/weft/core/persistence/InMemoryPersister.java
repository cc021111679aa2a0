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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link Persister} keeping bundles in memory. Checkpoints do not survive the
 * JVM but do survive the processes, which makes it suitable for tests and for
 * hosts that only need in-process resumption.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 * @version 1.0
 */
public class InMemoryPersister implements Persister {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryPersister.class);

    private final ProcessBundler bundler;
    private final Map<PersistedCheckpoint, Bundle> checkpoints = new ConcurrentHashMap<>();

    public InMemoryPersister(ProcessBundler bundler) {
        this.bundler = Objects.requireNonNull(bundler, "Bundler cannot be null");
    }

    @Override
    public PersistedCheckpoint saveCheckpoint(Process process, String tag) throws PersistenceException {
        Bundle bundle = bundler.save(process);
        PersistedCheckpoint checkpoint = new PersistedCheckpoint(process.getPid(), tag);
        checkpoints.put(checkpoint, bundle);
        logger.debug("Saved checkpoint {} in {}", checkpoint, process.getStateLabel());
        return checkpoint;
    }

    @Override
    public Bundle loadCheckpoint(String pid, String tag) throws PersistenceException {
        Bundle bundle = checkpoints.get(new PersistedCheckpoint(pid, tag));
        if (bundle == null) {
            throw new PersistenceException("No checkpoint for pid " + pid + (tag == null ? "" : " with tag '" + tag + "'"));
        }
        return bundle;
    }

    @Override
    public List<PersistedCheckpoint> getCheckpoints() {
        return new ArrayList<>(checkpoints.keySet());
    }

    @Override
    public List<PersistedCheckpoint> getProcessCheckpoints(String pid) {
        List<PersistedCheckpoint> result = new ArrayList<>();
        for (PersistedCheckpoint checkpoint : checkpoints.keySet()) {
            if (checkpoint.pid().equals(pid)) {
                result.add(checkpoint);
            }
        }
        return result;
    }

    @Override
    public void deleteCheckpoint(String pid, String tag) {
        Bundle removed = checkpoints.remove(new PersistedCheckpoint(pid, tag));
        if (removed != null) {
            logger.debug("Deleted checkpoint for pid {} tag {}", pid, tag);
        }
    }

    @Override
    public void deleteProcessCheckpoints(String pid) {
        checkpoints.keySet().removeIf(checkpoint -> checkpoint.pid().equals(pid));
    }

    public int getCheckpointCount() {
        return checkpoints.size();
    }

    public void clearAll() {
        int count = checkpoints.size();
        checkpoints.clear();
        logger.info("Cleared {} checkpoints", count);
    }
}
