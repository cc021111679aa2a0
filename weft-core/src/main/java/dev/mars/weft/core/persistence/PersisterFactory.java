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

import dev.mars.weft.core.config.WeftConfiguration;
import dev.mars.weft.core.exceptions.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Factory for creating {@link Persister} instances based on configuration.
 *
 * <p>Supported checkpoint stores:</p>
 * <ul>
 *   <li><b>memory</b> (default) - checkpoints held in the host heap, lost on restart</li>
 *   <li><b>file</b> - one JSON document per checkpoint under {@code weft.persistence.path}</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-03
 */
public final class PersisterFactory {

    private static final Logger logger = LoggerFactory.getLogger(PersisterFactory.class);

    /**
     * Supported checkpoint store types.
     */
    public enum PersisterType {
        /** Heap-only store (testing, not durable) */
        MEMORY,
        /** JSON documents on the local file system */
        FILE
    }

    private PersisterFactory() {
        // Utility class
    }

    /**
     * Creates the checkpoint store selected by the configuration.
     */
    public static Persister create(WeftConfiguration config, ProcessBundler bundler) throws PersistenceException {
        return create(config.getPersistenceType(), Path.of(config.getPersistencePath()),
                config.getPersistenceFsync(), bundler);
    }

    /**
     * @param type      "memory" or "file"
     * @param directory checkpoint directory, ignored for memory
     * @param fsync     whether file writes are forced to disk, ignored for memory
     * @throws PersistenceException     if the checkpoint directory cannot be opened
     * @throws IllegalArgumentException if the type is unknown
     */
    public static Persister create(String type, Path directory, boolean fsync, ProcessBundler bundler)
            throws PersistenceException {
        PersisterType persisterType = parsePersisterType(type);
        logger.info("Creating Persister: type={}, path={}, fsync={}", persisterType, directory, fsync);

        return switch (persisterType) {
            case MEMORY -> {
                logger.warn("Using InMemoryPersister - CHECKPOINTS WILL NOT SURVIVE RESTART!");
                yield new InMemoryPersister(bundler);
            }
            case FILE -> new FilePersister(bundler, directory, fsync);
        };
    }

    /**
     * @throws IllegalArgumentException if the type is unknown
     */
    public static PersisterType parsePersisterType(String type) {
        if (type == null || type.isBlank()) {
            return PersisterType.MEMORY;
        }
        try {
            return PersisterType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown persistence type '" + type + "', expected memory or file", e);
        }
    }
}
