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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live processes of a host, keyed by pid. A process is added when it enters
 * CREATED (or is reconstructed) and removed when it terminates. All access is
 * serialised by a single lock.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class ProcessRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ProcessRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Process> processes = new LinkedHashMap<>();

    /**
     * @throws IllegalStateException if another process with the same pid is registered
     */
    public void register(Process process) {
        Objects.requireNonNull(process, "Process cannot be null");
        lock.lock();
        try {
            Process existing = processes.get(process.getPid());
            if (existing != null && existing != process) {
                throw new IllegalStateException("A process with pid " + process.getPid() + " is already registered");
            }
            processes.put(process.getPid(), process);
        } finally {
            lock.unlock();
        }
        logger.debug("Registered Process<{}>", process.getPid());
    }

    public void unregister(Process process) {
        lock.lock();
        try {
            processes.remove(process.getPid(), process);
        } finally {
            lock.unlock();
        }
        logger.debug("Unregistered Process<{}>", process.getPid());
    }

    public Optional<Process> get(String pid) {
        lock.lock();
        try {
            return Optional.ofNullable(processes.get(pid));
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String pid) {
        lock.lock();
        try {
            return processes.containsKey(pid);
        } finally {
            lock.unlock();
        }
    }

    public List<Process> getAll() {
        lock.lock();
        try {
            return new ArrayList<>(processes.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return processes.size();
        } finally {
            lock.unlock();
        }
    }
}
