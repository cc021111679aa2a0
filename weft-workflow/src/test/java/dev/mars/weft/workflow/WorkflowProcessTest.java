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

package dev.mars.weft.workflow;

import dev.mars.weft.core.exceptions.ReconstructionException;
import dev.mars.weft.core.persistence.Bundle;
import dev.mars.weft.core.persistence.DefaultTypeRegistry;
import dev.mars.weft.core.persistence.InMemoryPersister;
import dev.mars.weft.core.persistence.ProcessBundler;
import dev.mars.weft.core.process.ManualScheduler;
import dev.mars.weft.core.process.Process;
import dev.mars.weft.core.process.ProcessEnvironment;
import dev.mars.weft.core.process.ProcessRegistry;
import dev.mars.weft.core.process.ProcessState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link WorkflowProcess} outlines driven turn by turn through a {@link ManualScheduler}.
 */
class WorkflowProcessTest {

    private ManualScheduler scheduler;
    private ProcessBundler bundler;
    private InMemoryPersister persister;
    private ProcessEnvironment environment;

    @BeforeEach
    void setUp() {
        scheduler = new ManualScheduler();
        bundler = new ProcessBundler(new DefaultTypeRegistry()
                .register(CountingWorkflow.class, CountingWorkflow::new)
                .register(AwaitingWorkflow.class, AwaitingWorkflow::new)
                .register(ReturningWorkflow.class, ReturningWorkflow::new));
        persister = new InMemoryPersister(bundler);
        environment = ProcessEnvironment.builder()
                .scheduler(scheduler)
                .persister(persister)
                .build();
    }

    private <P extends WorkflowProcess> P run(P process) {
        process.initialize();
        process.start();
        scheduler.runAll();
        return process;
    }

    private static Map<String, Object> inputs(String key, Object value) {
        Map<String, Object> inputs = new HashMap<>();
        inputs.put(key, value);
        return inputs;
    }

    static Stream<Arguments> chainCases() {
        return Stream.of(
                Arguments.of(5, true, List.of("small", "done")),
                Arguments.of(50, true, List.of("medium", "done")),
                Arguments.of(500, true, List.of("large", "done")),
                Arguments.of(500, false, List.of("done")));
    }

    @Nested
    @DisplayName("Conditionals")
    class ConditionalTests {

        @Test
        @DisplayName("false predicate runs A, C, D")
        void falseBranch() {
            BranchingWorkflow workflow = run(new BranchingWorkflow(environment, "w-1", inputs("flag", false)));

            assertEquals(ProcessState.FINISHED, workflow.getStateLabel());
            assertTrue(workflow.isSuccessful());
            assertEquals(List.of("A", "C", "D"), workflow.getTrace());
        }

        @Test
        @DisplayName("true predicate runs A, B, D")
        void trueBranch() {
            BranchingWorkflow workflow = run(new BranchingWorkflow(environment, "w-1", inputs("flag", true)));

            assertEquals(List.of("A", "B", "D"), workflow.getTrace());
        }

        @Test
        @DisplayName("zero counts as false")
        void zeroIsFalse() {
            BranchingWorkflow workflow = run(new BranchingWorkflow(environment, "w-1", inputs("flag", 0)));

            assertEquals(List.of("A", "C", "D"), workflow.getTrace());
        }

        @ParameterizedTest(name = "flag = {0} takes the if branch")
        @ValueSource(doubles = {1, -2, 0.5})
        void nonZeroNumberIsTrue(double flag) {
            BranchingWorkflow workflow = run(new BranchingWorkflow(environment, "w-1", inputs("flag", flag)));

            assertEquals(List.of("A", "B", "D"), workflow.getTrace());
        }

        @Test
        @DisplayName("null predicate result counts as false")
        void nullIsFalse() {
            BranchingWorkflow workflow = run(new BranchingWorkflow(environment, "w-1", inputs("flag", null)));

            assertEquals(List.of("A", "C", "D"), workflow.getTrace());
        }

        @Test
        @DisplayName("non boolean-like predicate result excepts the workflow")
        void typeMismatch() {
            BranchingWorkflow workflow = run(new BranchingWorkflow(environment, "w-1", inputs("flag", "yes")));

            assertEquals(ProcessState.EXCEPTED, workflow.getStateLabel());
            PredicateTypeMismatchException e = assertInstanceOf(PredicateTypeMismatchException.class, workflow.getException());
            assertEquals("flag", e.getPredicateName());
            assertEquals("yes", e.getValue());
            assertEquals(List.of("A"), workflow.getTrace());
        }

        @ParameterizedTest(name = "n = {0}, else branch = {1} runs {2}")
        @MethodSource("dev.mars.weft.workflow.WorkflowProcessTest#chainCases")
        void elifChain(int n, boolean closed, List<String> expected) {
            Map<String, Object> inputs = Map.of("n", n, "closed", closed);
            ChainWorkflow workflow = run(new ChainWorkflow(environment, "w-1", inputs));

            assertEquals(expected, workflow.getTrace());
            assertTrue(workflow.isSuccessful());
        }

        @Test
        @DisplayName("else cannot be followed by another branch")
        void sealedChain() {
            If chain = Outline.when("a", () -> true).otherwise();

            assertThrows(IllegalStateException.class, () -> chain.elseIf("b", () -> true));
            assertThrows(IllegalStateException.class, () -> chain.otherwise());
        }
    }

    @Nested
    @DisplayName("Loops and return")
    class LoopTests {

        @Test
        @DisplayName("while(counter < 3) runs its body three times")
        void whileLoop() {
            CountingWorkflow workflow = run(new CountingWorkflow(environment, "w-1", Map.of()));

            assertEquals(ProcessState.FINISHED, workflow.getStateLabel());
            assertEquals(Map.of("counter", 3), workflow.getOutputs());
            assertEquals(List.of("increment", "increment", "increment", "report"), workflow.getTrace());
        }

        @Test
        @DisplayName("each unit of work takes its own scheduler turn")
        void oneUnitPerTurn() {
            CountingWorkflow workflow = new CountingWorkflow(environment, "w-1", Map.of());
            workflow.initialize();
            workflow.start();

            scheduler.runNext();
            assertEquals(ProcessState.RUNNING, workflow.getStateLabel());
            assertEquals(List.of(), workflow.getTrace());

            scheduler.runNext();
            assertEquals(List.of("increment"), workflow.getTrace());
            scheduler.runNext();
            assertEquals(List.of("increment", "increment"), workflow.getTrace());
        }

        @Test
        @DisplayName("return(0) inside a loop stops the outline successfully")
        void returnZero() {
            ReturningWorkflow workflow = run(new ReturningWorkflow(environment, "w-1", Map.of("code", 0)));

            assertEquals(ProcessState.FINISHED, workflow.getStateLabel());
            assertTrue(workflow.isSuccessful());
            assertEquals(0, workflow.getExitCode().orElseThrow());
            assertEquals(List.of("increment", "increment"), workflow.getTrace());
        }

        @Test
        @DisplayName("non-zero exit code finishes unsuccessfully and survives a reload")
        void returnNonZero() throws Exception {
            ReturningWorkflow workflow = run(new ReturningWorkflow(environment, "w-1", Map.of("code", 3)));

            assertFalse(workflow.isSuccessful());
            assertEquals(3, workflow.getExitCode().orElseThrow());

            Process loaded = bundler.load(persister.loadCheckpoint("w-1"), freshEnvironment(new ManualScheduler()));
            assertEquals(ProcessState.FINISHED, loaded.getStateLabel());
            assertFalse(loaded.isSuccessful());
            assertEquals(3, ((ReturningWorkflow) loaded).getExitCode().orElseThrow());
        }

        @Test
        @DisplayName("workflow without steps finishes on its first turn")
        void emptyOutline() {
            WorkflowProcess workflow = run(new WorkflowProcess(environment, "w-1", Map.of()) {
                @Override
                protected Instruction defineOutline() {
                    return Outline.sequence();
                }
            });

            assertEquals(ProcessState.FINISHED, workflow.getStateLabel());
            assertTrue(workflow.isSuccessful());
        }
    }

    @Nested
    @DisplayName("Context")
    class ContextTests {

        @Test
        @DisplayName("workflow waits for every awaited future before the next step")
        void waitsForAll() {
            AwaitingWorkflow workflow = run(new AwaitingWorkflow(environment, "w-1", Map.of()));
            assertEquals(ProcessState.WAITING, workflow.getStateLabel());

            workflow.left.complete(20);
            scheduler.runAll();
            assertEquals(ProcessState.WAITING, workflow.getStateLabel());

            workflow.right.complete(22);
            scheduler.runAll();

            assertEquals(ProcessState.FINISHED, workflow.getStateLabel());
            assertEquals(Map.of("sum", 42), workflow.getOutputs());
            assertEquals(20, workflow.getContextValue("left"));
            assertEquals(22, workflow.getContextValue("right"));
        }

        @Test
        @DisplayName("failed future excepts the workflow")
        void failedFuture() {
            AwaitingWorkflow workflow = run(new AwaitingWorkflow(environment, "w-1", Map.of()));

            workflow.left.fail(new IllegalStateException("worker lost"));
            scheduler.runAll();

            assertEquals(ProcessState.EXCEPTED, workflow.getStateLabel());
            assertEquals("worker lost", workflow.getException().getMessage());
        }

        @Test
        @DisplayName("awaiting outside a running step is rejected")
        void toContextOutsideStep() {
            AwaitingWorkflow workflow = new AwaitingWorkflow(environment, "w-1", Map.of());
            workflow.initialize();

            assertThrows(IllegalStateException.class, () -> workflow.toContext("x", workflow.left.future()));
        }
    }

    @Nested
    @DisplayName("Persistence")
    class PersistenceTests {

        @Test
        @DisplayName("reloaded mid-loop workflow continues without repeating work")
        void resumeMidLoop() throws Exception {
            CountingWorkflow workflow = new CountingWorkflow(environment, "w-1", Map.of());
            workflow.initialize();
            workflow.start();
            while (workflow.counter() < 2) {
                assertTrue(scheduler.runNext());
            }

            Bundle bundle = bundler.save(workflow);
            assertEquals(WorkflowProcess.OUTLINE_STEP, bundle.getContinuation().get(Process.STEP_KEY));
            assertNotNull(bundle.getContinuation().get(WorkflowProcess.CURSOR_KEY));

            ManualScheduler restarted = new ManualScheduler();
            CountingWorkflow loaded = (CountingWorkflow) bundler.load(bundle, freshEnvironment(restarted));
            assertEquals(ProcessState.RUNNING, loaded.getStateLabel());
            loaded.start();
            restarted.runAll();

            assertEquals(ProcessState.FINISHED, loaded.getStateLabel());
            assertEquals(Map.of("counter", 3), loaded.getOutputs());
            assertEquals(List.of("increment", "increment", "increment", "report"), loaded.getTrace());
        }

        @Test
        @DisplayName("waiting checkpoint resumes at the step after the wait")
        void resumeAfterWait() throws Exception {
            run(new AwaitingWorkflow(environment, "w-1", Map.of()));
            Bundle checkpoint = persister.loadCheckpoint("w-1");
            assertEquals(ProcessState.WAITING, checkpoint.getLabel());

            ManualScheduler restarted = new ManualScheduler();
            AwaitingWorkflow loaded = (AwaitingWorkflow) bundler.load(checkpoint, freshEnvironment(restarted));
            assertTrue(loaded.resume());
            restarted.runAll();

            assertEquals(ProcessState.FINISHED, loaded.getStateLabel());
            assertEquals(List.of("submit", "combine"), loaded.getTrace());
        }

        @Test
        @DisplayName("cursor that does not fit the outline is rejected")
        void malformedCursor() throws Exception {
            CountingWorkflow workflow = new CountingWorkflow(environment, "w-1", Map.of());
            workflow.initialize();
            workflow.start();
            scheduler.runNext();
            scheduler.runNext();
            Bundle bundle = bundler.save(workflow);
            Map<String, Object> document = new LinkedHashMap<>(bundle.toMap());
            Map<String, Object> continuation = new LinkedHashMap<>(bundle.getContinuation());
            continuation.put(WorkflowProcess.CURSOR_KEY, Map.of("pos", 7));
            document.put(Bundle.CONTINUATION, continuation);
            Bundle tampered = Bundle.fromMap(document);

            assertThrows(ReconstructionException.class,
                    () -> bundler.load(tampered, freshEnvironment(new ManualScheduler())));
        }
    }

    @Test
    @DisplayName("outline description mirrors its structure")
    void description() {
        BranchingWorkflow workflow = new BranchingWorkflow(environment, "w-1", Map.of());

        Object expected = List.of("A", Map.of("if(flag)", List.of("B"), "else", List.of("C")), "D");
        assertEquals(expected, workflow.describeOutline());
        assertEquals(List.of(Map.of("while(belowThree)", List.of("increment")), "report"),
                new CountingWorkflow(environment, "w-2", Map.of()).describeOutline());
    }

    private ProcessEnvironment freshEnvironment(ManualScheduler restarted) {
        return ProcessEnvironment.builder()
                .scheduler(restarted)
                .registry(new ProcessRegistry())
                .persister(persister)
                .build();
    }
}
