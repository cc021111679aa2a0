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

import dev.mars.weft.core.process.Process;
import dev.mars.weft.core.process.ProcessEnvironment;
import dev.mars.weft.core.process.ProcessState;
import dev.mars.weft.core.process.StepResult;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A process whose steps are driven by a declarative outline.
 *
 * <p>Each scheduler turn advances the outline by one unit of work: a step, or
 * the evaluation of a conditional or loop predicate followed by the first unit
 * of the chosen body. The position in the outline is a cursor saved with every
 * checkpoint, so a process rebuilt from a bundle continues at the node where
 * the original stopped.
 *
 * <p>Steps share a context map. A step may register futures with
 * {@link #toContext(String, Future)}; the process then waits until all of them
 * complete and stores their results in the context under the given keys before
 * the next step runs. Context values must be representable in a bundle.
 *
 * <p>Subclasses define the outline in {@link #defineOutline()}, typically with
 * the builders of {@link Outline} and method references to their steps.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public abstract class WorkflowProcess extends Process {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowProcess.class);

    /** Step name under which the outline is advanced after the first turn. */
    public static final String OUTLINE_STEP = "outline";

    public static final String CURSOR_KEY = "cursor";
    public static final String CONTEXT_KEY = "context";
    public static final String EXIT_CODE_KEY = "exit_code";

    private final Map<String, Object> context = new LinkedHashMap<>();
    private final Map<String, Future<?>> awaiting = new LinkedHashMap<>();
    private Instruction outline;
    private Stepper stepper;
    private Integer exitCode;

    protected WorkflowProcess(ProcessEnvironment environment, String pid, Map<String, Object> inputs) {
        super(environment, pid, inputs);
        registerStep(OUTLINE_STEP, this::advance);
    }

    /**
     * Builds the outline of this workflow. Called once per instance, on first use.
     */
    protected abstract Instruction defineOutline();

    public final Instruction getOutline() {
        if (outline == null) {
            outline = Objects.requireNonNull(defineOutline(), "Outline cannot be null");
        }
        return outline;
    }

    public Object describeOutline() {
        return getOutline().getDescription();
    }

    @Override
    protected final StepResult run() throws Exception {
        stepper = getOutline().createStepper(this);
        return advance();
    }

    private StepResult advance() throws Exception {
        if (stepper == null) {
            throw new IllegalStateException("Process<" + getPid() + "> has no outline cursor");
        }
        awaiting.clear();
        StepperResult result = stepper.step();

        if (result.returned()) {
            exitCode = result.exitCode();
            logger.info("Process<{}>: outline returned with exit code {}", getPid(), exitCode);
            return StepResult.finish(Collections.emptyMap(), exitCode == 0);
        }
        if (result.finished()) {
            logger.debug("Process<{}>: outline complete", getPid());
            return StepResult.finish(Collections.emptyMap());
        }
        if (!awaiting.isEmpty()) {
            logger.debug("Process<{}>: waiting for {} context value(s) {}", getPid(), awaiting.size(), awaiting.keySet());
            return StepResult.waitFor(OUTLINE_STEP, "Waiting before next step", awaitAll());
        }
        return StepResult.next(OUTLINE_STEP);
    }

    private Future<Map<String, Object>> awaitAll() {
        List<String> keys = new ArrayList<>(awaiting.keySet());
        List<Future<?>> futures = new ArrayList<>(awaiting.values());
        return Future.all(futures).map(all -> {
            Map<String, Object> results = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                results.put(keys.get(i), all.resultAt(i));
            }
            return results;
        });
    }

    @Override
    protected void onWaitCompleted(Object triggerValue) {
        if (triggerValue instanceof Map<?, ?> results) {
            results.forEach((key, value) -> context.put(String.valueOf(key), value));
        }
    }

    // ==================== Context ====================

    /**
     * Registers a future whose result is stored in the context under {@code key}
     * before the next step runs.
     *
     * @throws IllegalStateException if called outside a running step
     */
    public void toContext(String key, Future<?> future) {
        Objects.requireNonNull(key, "Context key cannot be null");
        Objects.requireNonNull(future, "Future cannot be null");
        if (getStateLabel() != ProcessState.RUNNING) {
            throw new IllegalStateException("Process<" + getPid() + "> can only await context values while RUNNING, it is " + getStateLabel());
        }
        awaiting.put(key, future);
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    public Object getContextValue(String key) {
        return context.get(key);
    }

    public void putContext(String key, Object value) {
        context.put(Objects.requireNonNull(key, "Context key cannot be null"), value);
    }

    /**
     * The exit code of a {@code return} instruction, empty when the outline ran to its end.
     */
    public Optional<Integer> getExitCode() {
        return Optional.ofNullable(exitCode);
    }

    // ==================== Continuation ====================

    @Override
    protected void saveInstanceState(Map<String, Object> continuation) {
        super.saveInstanceState(continuation);
        if (stepper != null && !isTerminated()) {
            continuation.put(CURSOR_KEY, stepper.save());
        }
        if (!context.isEmpty()) {
            continuation.put(CONTEXT_KEY, new LinkedHashMap<>(context));
        }
        if (exitCode != null) {
            continuation.put(EXIT_CODE_KEY, exitCode);
        }
    }

    @Override
    protected void loadInstanceState(Map<String, Object> continuation) {
        super.loadInstanceState(continuation);
        context.clear();
        Map<String, Object> savedContext = Cursors.asMap(continuation.get(CONTEXT_KEY), CONTEXT_KEY);
        if (savedContext != null) {
            context.putAll(savedContext);
        }
        Map<String, Object> cursor = Cursors.asMap(continuation.get(CURSOR_KEY), CURSOR_KEY);
        stepper = cursor == null ? null : getOutline().recreateStepper(cursor, this);
        Object savedExitCode = continuation.get(EXIT_CODE_KEY);
        exitCode = savedExitCode instanceof Number ? ((Number) savedExitCode).intValue() : null;
    }
}
