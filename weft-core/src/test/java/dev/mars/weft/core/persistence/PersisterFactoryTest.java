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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PersisterFactoryTest {

    private final ProcessBundler bundler = new ProcessBundler(new DefaultTypeRegistry());

    @TempDir
    Path tempDir;

    @Test
    void memoryTypeCreatesInMemoryPersister() throws PersistenceException {
        assertInstanceOf(InMemoryPersister.class, PersisterFactory.create("memory", tempDir, true, bundler));
    }

    @Test
    void fileTypeCreatesDirectory() throws PersistenceException {
        Path directory = tempDir.resolve("checkpoints");

        Persister persister = PersisterFactory.create("FILE", directory, false, bundler);

        assertInstanceOf(FilePersister.class, persister);
        assertTrue(Files.isDirectory(directory));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  "})
    void blankTypeDefaultsToMemory(String type) {
        assertEquals(PersisterFactory.PersisterType.MEMORY, PersisterFactory.parsePersisterType(type));
    }

    @Test
    void unknownTypeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> PersisterFactory.parsePersisterType("rocksdb"));
    }
}
