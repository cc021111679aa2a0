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
import dev.mars.weft.core.exceptions.ReconstructionException;
import dev.mars.weft.core.process.ManualScheduler;
import dev.mars.weft.core.process.Process;
import dev.mars.weft.core.process.ProcessEnvironment;
import dev.mars.weft.core.process.ProcessRegistry;
import dev.mars.weft.core.process.ProcessState;
import dev.mars.weft.core.process.WaitingProcess;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FilePersisterTest {

    @TempDir
    Path tempDir;

    private ManualScheduler scheduler;
    private ProcessBundler bundler;
    private FilePersister persister;

    @BeforeEach
    void setUp() throws PersistenceException {
        scheduler = new ManualScheduler();
        bundler = new ProcessBundler(new DefaultTypeRegistry().register(WaitingProcess.class, WaitingProcess::new));
        persister = new FilePersister(bundler, tempDir.resolve("checkpoints"), false);
    }

    private WaitingProcess waitingProcess(String pid) {
        ProcessEnvironment environment = ProcessEnvironment.builder()
                .scheduler(scheduler)
                .persister(persister)
                .build();
        WaitingProcess process = new WaitingProcess(environment, pid, Map.of("n", 3));
        process.initialize();
        process.start();
        scheduler.runAll();
        return process;
    }

    @Test
    void processTransitionsAreWrittenAsJsonDocuments() throws Exception {
        waitingProcess("p1");

        Path file = tempDir.resolve("checkpoints").resolve("p1.json");
        assertTrue(Files.exists(file));
        String json = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(json.contains("\"label\" : \"waiting\""), json);
        assertTrue(json.contains("\"savedAt\""), json);
        assertFalse(Files.exists(tempDir.resolve("checkpoints").resolve("p1.json.tmp")));
    }

    @Test
    void numbersReadBackAsTheyWereBundled() throws Exception {
        ProcessEnvironment environment = ProcessEnvironment.builder().scheduler(scheduler).build();
        Map<String, Object> inputs = Map.of(
                "small", 5L,
                "large", 5_000_000_000L,
                "short", (short) 3,
                "ratio", 0.1f,
                "nested", List.of(7L, 2.5f));
        WaitingProcess process = new WaitingProcess(environment, "p-numbers", inputs);
        process.initialize();

        Bundle bundled = bundler.save(process);
        persister.saveCheckpoint(process);
        Bundle reloaded = new FilePersister(bundler, tempDir.resolve("checkpoints"), false).loadCheckpoint("p-numbers");

        assertEquals(bundled.getInputs(), reloaded.getInputs());
        assertEquals(Map.of("small", 5, "large", 5_000_000_000L, "short", 3, "ratio", 0.1, "nested", List.of(7, 2.5)),
                reloaded.getInputs());
    }

    @Test
    void checkpointSurvivesRestart() throws Exception {
        WaitingProcess original = waitingProcess("p2");

        FilePersister reopened = new FilePersister(bundler, tempDir.resolve("checkpoints"), false);
        Bundle bundle = reopened.loadCheckpoint("p2");
        ProcessEnvironment host = ProcessEnvironment.builder()
                .scheduler(scheduler)
                .registry(new ProcessRegistry())
                .build();
        Process loaded = bundler.load(bundle, host);

        assertEquals(ProcessState.WAITING, loaded.getStateLabel());
        assertEquals(original.getInputs(), loaded.getInputs());
        assertEquals(original.getOutputs(), loaded.getOutputs());
        assertEquals(original.getCreationTime(), loaded.getCreationTime());

        loaded.resume();
        scheduler.runAll();
        assertEquals(ProcessState.FINISHED, loaded.getStateLabel());
    }

    @Test
    void checkpointsAreListedByPidAndTag() throws Exception {
        WaitingProcess process = waitingProcess("p3");
        persister.saveCheckpoint(process, "manual");
        waitingProcess("p4");

        assertEquals(Set.of(PersistedCheckpoint.of("p3"), new PersistedCheckpoint("p3", "manual"), PersistedCheckpoint.of("p4")),
                Set.copyOf(persister.getCheckpoints()));
        assertEquals(2, persister.getProcessCheckpoints("p3").size());
        assertEquals(ProcessState.WAITING, persister.loadCheckpoint("p3", "manual").getLabel());
    }

    @Test
    void deleteRemovesFiles() throws Exception {
        WaitingProcess process = waitingProcess("p5");
        persister.saveCheckpoint(process, "extra");

        persister.deleteCheckpoint("p5", "extra");
        assertEquals(List.of(PersistedCheckpoint.of("p5")), persister.getProcessCheckpoints("p5"));

        persister.deleteProcessCheckpoints("p5");
        assertTrue(persister.getCheckpoints().isEmpty());
    }

    @Test
    void missingCheckpointIsAnError() {
        assertThrows(PersistenceException.class, () -> persister.loadCheckpoint("absent"));
    }

    @Test
    void corruptDocumentIsReconstructionError() throws Exception {
        Files.writeString(tempDir.resolve("checkpoints").resolve("broken.json"), "{ not json", StandardCharsets.UTF_8);

        assertThrows(ReconstructionException.class, () -> persister.loadCheckpoint("broken"));
    }

    @Test
    void unsafeNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> persister.loadCheckpoint("../escape"));
        assertThrows(IllegalArgumentException.class, () -> persister.deleteCheckpoint("p", "a.b"));
    }
}
