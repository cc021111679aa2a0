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

import dev.mars.weft.core.exceptions.PersistenceException;
import dev.mars.weft.core.persistence.DefaultTypeRegistry;
import dev.mars.weft.core.persistence.InMemoryPersister;
import dev.mars.weft.core.persistence.ProcessBundler;
import dev.mars.weft.core.process.DoublingProcess;
import dev.mars.weft.core.process.ManualScheduler;
import dev.mars.weft.core.process.ProcessEnvironment;
import dev.mars.weft.core.process.ProcessSpecValidator;
import dev.mars.weft.core.process.ProcessState;
import dev.mars.weft.core.process.WaitingProcess;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Process launcher")
class ProcessLauncherTest {

    private static final String DOUBLING = DoublingProcess.class.getName();
    private static final String WAITING = WaitingProcess.class.getName();
    private static final String STRICT = "strict-doubling";

    private DefaultTypeRegistry typeRegistry;
    private ProcessBundler bundler;
    private InMemoryPersister persister;
    private ManualScheduler scheduler;
    private ProcessEnvironment environment;
    private ProcessLauncher launcher;

    @BeforeEach
    void setUp() {
        typeRegistry = new DefaultTypeRegistry()
            .register(DoublingProcess.class, DoublingProcess::new)
            .register(WaitingProcess.class, WaitingProcess::new)
            .register(STRICT, DoublingProcess.class, (env, pid, inputs) ->
                new DoublingProcess(env.withValidator(ProcessSpecValidator.requiringInputs("x")), pid, inputs));
        bundler = new ProcessBundler(typeRegistry);
        persister = new InMemoryPersister(bundler);
        scheduler = new ManualScheduler();
        environment = ProcessEnvironment.builder().scheduler(scheduler).persister(persister).build();
        launcher = new ProcessLauncher(environment, bundler);
    }

    private JsonObject run(ProcessLauncher target, ManualScheduler turns, ControlMessage task) {
        Future<JsonObject> reply = target.handle(task.toJson());
        turns.runAll();
        assertTrue(reply.succeeded(), "launcher did not reply");
        return reply.result();
    }

    private JsonObject run(ControlMessage task) {
        return run(launcher, scheduler, task);
    }

    private static String errorCode(JsonObject reply) {
        assertEquals("error", reply.getString("status"), () -> "expected an error reply: " + reply.encode());
        return reply.getJsonObject("error_detail").getString("code");
    }

    private String launchWaiting() {
        JsonObject reply = run(ControlMessages.launch(WAITING, Map.of(), true, true));
        return reply.getString("result");
    }

    @Nested
    @DisplayName("Launch")
    class LaunchTests {

        @Test
        @DisplayName("launch without nowait replies with the outputs")
        void launchAndWait() {
            JsonObject reply = run(ControlMessages.launch(DOUBLING, Map.of("x", 5), false, false));

            assertEquals("ok", reply.getString("status"));
            assertEquals(10, reply.getJsonObject("result").getInteger("y"));
        }

        @Test
        @DisplayName("launch with nowait replies with the pid")
        void launchNoWait() {
            JsonObject reply = run(ControlMessages.launch(WAITING, Map.of(), false, true));

            String pid = reply.getString("result");
            assertNotNull(pid);
            assertEquals(ProcessState.WAITING, environment.getRegistry().get(pid).orElseThrow().getStateLabel());
        }

        @Test
        @DisplayName("unpersisted launch writes no checkpoint")
        void unpersistedLaunch() {
            run(ControlMessages.launch(DOUBLING, Map.of("x", 1), false, false));

            assertEquals(0, persister.getCheckpointCount());
        }

        @Test
        @DisplayName("persisted launch checkpoints every transition")
        void persistedLaunch() throws PersistenceException {
            String pid = launchWaiting();

            assertEquals(ProcessState.WAITING, persister.loadCheckpoint(pid).getLabel());
        }

        @Test
        @DisplayName("persisting without a persister is rejected")
        void persistWithoutPersister() {
            ProcessLauncher bare = new ProcessLauncher(
                ProcessEnvironment.builder().scheduler(scheduler).build(), bundler);

            assertEquals("TASK_REJECTED", errorCode(run(bare, scheduler, ControlMessages.launch(DOUBLING, Map.of("x", 1), true, true))));
        }

        @Test
        @DisplayName("unknown process type is rejected")
        void unknownType() {
            assertEquals("TASK_REJECTED", errorCode(run(ControlMessages.launch("no.such.Process", Map.of(), false, true))));
        }

        @Test
        @DisplayName("inputs refused by the validator are rejected")
        void invalidInputs() {
            JsonObject reply = run(ControlMessages.launch(STRICT, Map.of("z", 1), false, true));

            assertEquals("TASK_REJECTED", errorCode(reply));
            assertTrue(reply.getJsonObject("error_detail").getString("message").contains("Missing required input 'x'"));
            assertEquals(0, environment.getRegistry().size());
        }
    }

    @Nested
    @DisplayName("Create and continue")
    class CreateAndContinueTests {

        @Test
        @DisplayName("create checkpoints the process without starting it")
        void create() throws PersistenceException {
            String pid = run(ControlMessages.create(DOUBLING, Map.of("x", 4), true)).getString("result");

            assertEquals(ProcessState.CREATED, persister.loadCheckpoint(pid).getLabel());
            assertFalse(environment.getRegistry().contains(pid));
        }

        @Test
        @DisplayName("continue runs a created process to completion")
        void continueCreated() {
            String pid = run(ControlMessages.create(DOUBLING, Map.of("x", 4), true)).getString("result");

            JsonObject reply = run(ControlMessages.continueTask(pid, null, false));

            assertEquals(8, reply.getJsonObject("result").getInteger("y"));
        }

        @Test
        @DisplayName("continue after a restart resumes a waiting process")
        void continueAfterRestart() {
            String pid = launchWaiting();

            ManualScheduler restartedScheduler = new ManualScheduler();
            ProcessLauncher restarted = new ProcessLauncher(
                ProcessEnvironment.builder().scheduler(restartedScheduler).persister(persister).build(), bundler);
            JsonObject reply = run(restarted, restartedScheduler, ControlMessages.continueTask(pid, null, false));

            JsonObject outputs = reply.getJsonObject("result");
            assertEquals("resumed", outputs.getString("value"));
            assertTrue(outputs.getBoolean("started"));
        }

        @Test
        @DisplayName("continue of a live process leaves it running where it is")
        void continueLive() {
            String pid = launchWaiting();

            JsonObject reply = run(ControlMessages.continueTask(pid, null, true));

            assertEquals(pid, reply.getString("result"));
            assertEquals(ProcessState.WAITING, environment.getRegistry().get(pid).orElseThrow().getStateLabel());
        }

        @Test
        @DisplayName("continue of a killed process reports the failure")
        void continueKilled() {
            String pid = launchWaiting();
            environment.getRegistry().get(pid).orElseThrow().kill("stopped");

            ManualScheduler restartedScheduler = new ManualScheduler();
            ProcessLauncher restarted = new ProcessLauncher(
                ProcessEnvironment.builder().scheduler(restartedScheduler).persister(persister).build(), bundler);

            assertEquals("PROCESS_FAILED", errorCode(run(restarted, restartedScheduler,
                ControlMessages.continueTask(pid, null, false))));
        }

        @Test
        @DisplayName("continue of an unknown pid reports the missing checkpoint")
        void continueUnknown() {
            assertEquals("CHECKPOINT_UNAVAILABLE", errorCode(run(ControlMessages.continueTask("missing", null, false))));
        }

        @Test
        @DisplayName("continue without a persister is rejected")
        void continueWithoutPersister() {
            ProcessLauncher bare = new ProcessLauncher(
                ProcessEnvironment.builder().scheduler(scheduler).build(), bundler);

            assertEquals("TASK_REJECTED", errorCode(run(bare, scheduler, ControlMessages.continueTask("p1", null, false))));
        }
    }

    @Nested
    @DisplayName("Rejected tasks")
    class RejectedTaskTests {

        @Test
        @DisplayName("process intent on the task queue is rejected")
        void processIntent() {
            assertEquals("TASK_REJECTED", errorCode(run(ControlMessages.status("p1"))));
        }

        @Test
        @DisplayName("launch without a type id is malformed")
        void missingTypeId() {
            ControlMessage task = new ControlMessage(MessageType.RPC, ControlIntent.LAUNCH, null, "c1",
                new JsonObject().put("inputs", new JsonObject()));

            assertEquals("MALFORMED_MESSAGE", errorCode(run(task)));
        }

        @Test
        @DisplayName("error reply keeps the correlation id")
        void correlationIdKept() {
            ControlMessage task = ControlMessages.launch("no.such.Process", Map.of(), false, true);

            assertEquals(task.correlationId(), run(task).getString("correlation_id"));
        }
    }
}
