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

import dev.mars.weft.core.exceptions.PersistenceException;
import dev.mars.weft.core.exceptions.ProcessKilledException;
import dev.mars.weft.core.exceptions.StepFailedException;
import dev.mars.weft.core.exceptions.TransitionFailedException;
import dev.mars.weft.core.exceptions.WeftException;
import dev.mars.weft.core.persistence.Bundle;
import dev.mars.weft.core.persistence.Persister;
import dev.mars.weft.core.statemachine.State;
import dev.mars.weft.core.statemachine.StateMachine;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * A long-running, resumable unit of computation built on {@link StateMachine}.
 *
 * <p>A process is a set of named steps. Execution starts at {@link #RUN_STEP},
 * bound to {@link #run()}, and each step returns a {@link StepResult} that
 * selects the next step, suspends the process, finishes it or raises. Steps
 * run one per scheduler turn, never synchronously one after the other.</p>
 *
 * <p>Lifecycle:</p>
 * <ul>
 *   <li>{@link #initialize()} enters CREATED, validating the inputs and
 *       registering the process with the host registry and control binding.</li>
 *   <li>{@link #start()} schedules the first step.</li>
 *   <li>{@link #pause(String)} and {@link #play()} toggle an orthogonal paused
 *       flag. While paused no step runs; a completing wait trigger is queued
 *       and runs on the turn after {@link #play()}.</li>
 *   <li>{@link #kill(String)} forces KILLED, pre-empting an in-flight step or
 *       pending resumption.</li>
 * </ul>
 *
 * <p>Every entered state is checkpointed through the host {@link Persister}
 * and broadcast through the {@link ControlBinding}. Neither can fail a
 * transition. Failures inside the process (a raising step, an invalid
 * transition) are absorbed into EXCEPTED.</p>
 *
 * <p>Processes are not thread-safe. All calls must be made on the turns of
 * the process {@link Scheduler}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public abstract class Process extends StateMachine<ProcessState> {

    private static final Logger logger = LoggerFactory.getLogger(Process.class);

    /** Name of the first step, bound to {@link #run()}. */
    public static final String RUN_STEP = "run";

    /** Continuation key holding the name of the next step. */
    public static final String STEP_KEY = "step";

    /** Continuation key holding the reason a process is waiting. */
    public static final String WAIT_REASON_KEY = "wait_reason";

    private final ProcessEnvironment environment;
    private final String pid;
    private final Map<String, Object> inputs;
    private final Map<String, Object> outputs = new LinkedHashMap<>();
    private final Map<String, StepFunction> steps = new LinkedHashMap<>();
    private final List<ProcessListener> listeners = new ArrayList<>();
    private final Promise<Map<String, Object>> result = Promise.promise();

    private Instant creationTime;
    private boolean paused;
    private String status;
    private String pausedStatus;
    private boolean stepping;
    private boolean stepScheduled;
    private boolean pendingStep;
    private Runnable pendingResume;
    private boolean killRequested;
    private String requestedKillMessage;

    protected Process(ProcessEnvironment environment, String pid, Map<String, Object> inputs) {
        super(ProcessState.TRANSITIONS);
        this.environment = Objects.requireNonNull(environment, "Process environment cannot be null");
        this.pid = pid != null ? pid : UUID.randomUUID().toString();
        this.inputs = inputs == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        registerStep(RUN_STEP, this::run);
    }

    /**
     * The first step of the process.
     */
    protected abstract StepResult run() throws Exception;

    /**
     * Binds a step name to a step function. A {@link StepResult.Continue}
     * naming an unregistered step excepts the process.
     */
    protected final void registerStep(String name, StepFunction function) {
        Objects.requireNonNull(name, "Step name cannot be null");
        Objects.requireNonNull(function, "Step function cannot be null");
        steps.put(name, function);
    }

    @Override
    protected State<ProcessState> createInitialState() {
        return new CreatedState(this);
    }

    // ==================== Accessors ====================

    public String getPid() {
        return pid;
    }

    public Map<String, Object> getInputs() {
        return inputs;
    }

    public Map<String, Object> getOutputs() {
        return Collections.unmodifiableMap(outputs);
    }

    public Instant getCreationTime() {
        return creationTime;
    }

    public boolean isPaused() {
        return paused;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Scheduler getScheduler() {
        return environment.getScheduler();
    }

    public ProcessEnvironment getEnvironment() {
        return environment;
    }

    public ProcessSpecValidator getValidator() {
        return environment.getValidator();
    }

    /**
     * Completes with the outputs when the process finishes, fails with the
     * exception when it excepts and with a {@link ProcessKilledException} when
     * it is killed.
     */
    public Future<Map<String, Object>> getFuture() {
        return result.future();
    }

    public boolean isSuccessful() {
        return getState() instanceof FinishedState finished && finished.isSuccessful();
    }

    public boolean isKilled() {
        return getStateLabel() == ProcessState.KILLED;
    }

    public String getKillMessage() {
        return getState() instanceof KilledState killed ? killed.getMessage() : null;
    }

    public boolean isExcepted() {
        return getStateLabel() == ProcessState.EXCEPTED;
    }

    public Throwable getException() {
        return getState() instanceof ExceptedState excepted ? excepted.getException() : null;
    }

    public StatusReport getStatusReport() {
        ProcessState label = getStateLabel();
        return new StatusReport(pid, label, label.isTerminal(), paused, status, creationTime, toString());
    }

    @Override
    protected String getMachineId() {
        return "Process<" + pid + ">";
    }

    // ==================== Listeners ====================

    public void addProcessListener(ProcessListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public void removeProcessListener(ProcessListener listener) {
        listeners.remove(listener);
    }

    private void fireEvent(Consumer<ProcessListener> event) {
        for (ProcessListener listener : new ArrayList<>(listeners)) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("Process<{}>: listener {} failed: {}", pid, listener, e.getMessage(), e);
            }
        }
    }

    // ==================== Execution ====================

    /**
     * Schedules the first step. Has no effect on a terminated process.
     */
    public void start() {
        if (isTerminated()) {
            logger.debug("Process<{}>: already terminated in {}, not starting", pid, getStateLabel());
            return;
        }
        scheduleStep();
    }

    /**
     * Starts the process and returns its result future.
     */
    public Future<Map<String, Object>> stepUntilTerminated() {
        start();
        return getFuture();
    }

    /**
     * Executes the current state once and moves to the state it returns.
     * Ignored when terminated or waiting; deferred until {@link #play()} when paused.
     */
    public void step() {
        stepScheduled = false;
        if (isTerminated()) {
            logger.debug("Process<{}>: step ignored, process is {}", pid, getStateLabel());
            return;
        }
        if (paused) {
            logger.debug("Process<{}>: step deferred, process is paused", pid);
            pendingStep = true;
            return;
        }
        if (getStateLabel() == ProcessState.WAITING) {
            logger.debug("Process<{}>: step ignored, process is waiting", pid);
            return;
        }
        if (isTransitioning()) {
            throw new IllegalStateException("Cannot step " + getMachineId() + " while it is transitioning");
        }

        AbstractProcessState next;
        stepping = true;
        try {
            next = ((AbstractProcessState) getState()).execute();
        } finally {
            stepping = false;
        }

        if (killRequested) {
            killRequested = false;
            next = new KilledState(this, requestedKillMessage);
            applyKillStatus(requestedKillMessage);
        }

        transitionTo(next);
        scheduleStepIfRunning();
    }

    StepResult invokeStep(String stepName) throws Exception {
        StepFunction function = steps.get(stepName);
        if (function == null) {
            throw new StepFailedException(pid, stepName, "no step registered with that name");
        }
        logger.debug("Process<{}>: executing step '{}'", pid, stepName);
        StepResult stepResult = function.execute();
        if (stepResult == null) {
            throw new StepFailedException(pid, stepName, "step returned no result");
        }
        return stepResult;
    }

    private void scheduleStepIfRunning() {
        if (getStateLabel() == ProcessState.RUNNING || getStateLabel() == ProcessState.CREATED) {
            scheduleStep();
        }
    }

    private void scheduleStep() {
        if (paused) {
            pendingStep = true;
            return;
        }
        if (stepScheduled) {
            return;
        }
        stepScheduled = true;
        getScheduler().schedule(this::step);
    }

    void onTriggerCompleted(WaitingState waiting, AsyncResult<?> triggerResult) {
        if (getState() != waiting) {
            logger.debug("Process<{}>: ignoring stale wait trigger, process is {}", pid, getStateLabel());
            return;
        }
        if (paused) {
            logger.debug("Process<{}>: wait trigger completed while paused, queued until play", pid);
            pendingResume = () -> onTriggerCompleted(waiting, triggerResult);
            return;
        }
        if (triggerResult.failed()) {
            logger.debug("Process<{}>: wait trigger failed: {}", pid, triggerResult.cause().getMessage());
            transitionTo(new ExceptedState(this, triggerResult.cause()));
            return;
        }
        try {
            onWaitCompleted(triggerResult.result());
        } catch (RuntimeException e) {
            transitionTo(new ExceptedState(this, e));
            return;
        }
        transitionTo(new RunningState(this, waiting.getNextStep()));
        scheduleStepIfRunning();
    }

    /**
     * Called on the resuming turn, before re-entering RUNNING, with the value of
     * the completed wait trigger. A runtime exception excepts the process.
     */
    protected void onWaitCompleted(Object triggerValue) {
    }

    /**
     * Resumes a WAITING process without its trigger, as needed after the
     * process was rebuilt from a checkpoint. Queued until {@link #play()} when paused.
     *
     * @return true if the process was waiting
     */
    public boolean resume() {
        if (!(getState() instanceof WaitingState waiting)) {
            return false;
        }
        if (paused) {
            pendingResume = this::resume;
            return true;
        }
        logger.debug("Process<{}>: resuming at step '{}'", pid, waiting.getNextStep());
        transitionTo(new RunningState(this, waiting.getNextStep()));
        scheduleStepIfRunning();
        return true;
    }

    // ==================== Outputs ====================

    /**
     * Records an output. Dotted names create nested maps, so {@code out("a.b", 1)}
     * yields {@code {a: {b: 1}}}.
     *
     * @throws IllegalStateException if the process is not RUNNING
     */
    public void out(String name, Object value) {
        Objects.requireNonNull(name, "Output name cannot be null");
        if (getStateLabel() != ProcessState.RUNNING) {
            throw new IllegalStateException("Process<" + pid + "> can only emit outputs while RUNNING, it is " + getStateLabel());
        }
        putNested(outputs, name, value);
        logger.debug("Process<{}>: emitted output '{}'", pid, name);
        fireEvent(l -> l.onOutputEmitted(this, name, value));
    }

    void mergeOutputs(Map<String, Object> finalOutputs) {
        for (Map.Entry<String, Object> entry : finalOutputs.entrySet()) {
            putNested(outputs, entry.getKey(), entry.getValue());
        }
    }

    @SuppressWarnings("unchecked")
    private static void putNested(Map<String, Object> target, String name, Object value) {
        String[] parts = name.split("\\.");
        Map<String, Object> current = target;
        for (int i = 0; i < parts.length - 1; i++) {
            Object child = current.get(parts[i]);
            if (!(child instanceof Map)) {
                child = new LinkedHashMap<String, Object>();
                current.put(parts[i], child);
            }
            current = (Map<String, Object>) child;
        }
        current.put(parts[parts.length - 1], value);
    }

    // ==================== Pause / play / kill ====================

    public boolean pause() {
        return pause(null);
    }

    /**
     * Pauses the process without changing its label.
     *
     * @param message status text to show while paused, may be null
     * @return false if the process has terminated, true otherwise
     */
    public boolean pause(String message) {
        if (isTerminated()) {
            return false;
        }
        if (paused) {
            return true;
        }
        paused = true;
        pausedStatus = status;
        status = message;
        logger.info("Process<{}>: paused{}", pid, message == null ? "" : ": " + message);
        fireEvent(l -> l.onProcessPaused(this));
        checkpoint(false);
        return true;
    }

    /**
     * Unpauses the process. A step or resumption deferred while paused is
     * scheduled for the next turn.
     *
     * @return false if the process has terminated, true otherwise
     */
    public boolean play() {
        if (isTerminated()) {
            return false;
        }
        if (!paused) {
            return true;
        }
        paused = false;
        status = pausedStatus;
        pausedStatus = null;
        logger.info("Process<{}>: played", pid);
        fireEvent(l -> l.onProcessPlayed(this));
        checkpoint(false);

        if (pendingResume != null) {
            Runnable resumption = pendingResume;
            pendingResume = null;
            getScheduler().schedule(resumption);
        } else if (pendingStep) {
            pendingStep = false;
            scheduleStep();
        }
        return true;
    }

    public boolean kill() {
        return kill(null);
    }

    /**
     * Forces the process into KILLED. A kill requested by the running step takes
     * effect when the step returns; one requested during a transition takes
     * effect on the next turn.
     *
     * @param message the kill message, may be null
     * @return true if the process is or will be killed, false if it already terminated otherwise
     */
    public boolean kill(String message) {
        if (getStateLabel() == ProcessState.KILLED) {
            return true;
        }
        if (isTerminated()) {
            return false;
        }
        if (killRequested) {
            return true;
        }
        if (stepping) {
            logger.debug("Process<{}>: kill requested during step, deferring", pid);
            killRequested = true;
            requestedKillMessage = message;
            return true;
        }
        if (isTransitioning()) {
            killRequested = true;
            requestedKillMessage = message;
            getScheduler().schedule(this::killRequestedNow);
            return true;
        }
        killNow(message);
        return true;
    }

    private void killRequestedNow() {
        if (killRequested) {
            killRequested = false;
            killNow(requestedKillMessage);
        }
    }

    private void killNow(String message) {
        if (isTerminated()) {
            return;
        }
        pendingResume = null;
        pendingStep = false;
        applyKillStatus(message);
        transitionTo(new KilledState(this, message));
    }

    private void applyKillStatus(String message) {
        status = message;
        paused = false;
        pausedStatus = null;
    }

    // ==================== State hooks ====================

    @Override
    protected void onEntering(State<ProcessState> nextState) {
        if (nextState.getLabel() == ProcessState.CREATED) {
            creationTime = Instant.now().truncatedTo(ChronoUnit.MILLIS);
            Optional<String> invalid = getValidator().validateInputs(inputs);
            if (invalid.isPresent()) {
                throw new IllegalArgumentException("Invalid inputs for Process<" + pid + ">: " + invalid.get());
            }
        }
    }

    @Override
    protected void onEntered(State<ProcessState> previousState) {
        ProcessState from = previousState == null ? null : previousState.getLabel();
        ProcessState to = getStateLabel();
        logger.debug("Process<{}>: {} → {}", pid, from, to);

        if (to == ProcessState.CREATED) {
            environment.getRegistry().register(this);
            environment.getControlBinding().ifPresent(binding -> binding.attach(this));
            logger.info("Process<{}>: created", pid);
        }

        checkpoint(to == ProcessState.WAITING);
        fireStateEntered(to);
        environment.getControlBinding().ifPresent(binding -> binding.stateChanged(this, from, to));
    }

    private void fireStateEntered(ProcessState label) {
        switch (label) {
            case CREATED:
                fireEvent(l -> l.onProcessCreated(this));
                break;
            case RUNNING:
                fireEvent(l -> l.onProcessRunning(this));
                break;
            case WAITING:
                fireEvent(l -> l.onProcessWaiting(this));
                break;
            case FINISHED:
                Map<String, Object> finalOutputs = getOutputs();
                fireEvent(l -> l.onProcessFinished(this, finalOutputs));
                break;
            case EXCEPTED:
                Throwable cause = getException();
                fireEvent(l -> l.onProcessExcepted(this, cause));
                break;
            case KILLED:
                String message = getKillMessage();
                fireEvent(l -> l.onProcessKilled(this, message));
                break;
            default:
                break;
        }
    }

    @Override
    protected void onTerminated() {
        ProcessState label = getStateLabel();
        switch (label) {
            case FINISHED:
                logger.info("Process<{}>: finished{}", pid, isSuccessful() ? "" : " unsuccessfully");
                result.tryComplete(Collections.unmodifiableMap(new LinkedHashMap<>(outputs)));
                break;
            case EXCEPTED:
                logger.info("Process<{}>: excepted: {}", pid, getException().toString());
                result.tryFail(getException());
                break;
            case KILLED:
                logger.info("Process<{}>: killed{}", pid, getKillMessage() == null ? "" : ": " + getKillMessage());
                result.tryFail(new ProcessKilledException(pid, getKillMessage()));
                break;
            default:
                break;
        }
        paused = false;
        pendingResume = null;
        pendingStep = false;
        environment.getRegistry().unregister(this);
        environment.getControlBinding().ifPresent(binding -> binding.detach(this));
        listeners.clear();
        clearStateEventCallbacks();
    }

    @Override
    protected void transitionFailed(ProcessState initialLabel, ProcessState targetLabel, Exception cause) {
        if (isTerminated() || targetLabel == ProcessState.CREATED || initialLabel == null) {
            throw new TransitionFailedException(initialLabel, targetLabel, cause);
        }
        logger.warn("Process<{}>: transition {} → {} failed, excepting: {}", pid, initialLabel, targetLabel, cause.toString());
        transitionTo(new ExceptedState(this, cause));
    }

    // ==================== Checkpointing ====================

    private void checkpoint(boolean critical) {
        Optional<Persister> persister = environment.getPersister();
        if (persister.isEmpty()) {
            return;
        }
        try {
            persister.get().saveCheckpoint(this);
        } catch (PersistenceException | RuntimeException e) {
            if (critical) {
                logger.error("Process<{}>: failed to checkpoint on entering WAITING, the process cannot be resumed after a restart",
                        pid, e);
                fireEvent(l -> l.onCheckpointFailed(this, e));
            } else {
                logger.warn("Process<{}>: failed to checkpoint in {}: {}", pid, getStateLabel(), e.getMessage());
            }
        }
    }

    // ==================== Continuation ====================

    /**
     * Captures the continuation of the process: the next step and whatever a
     * subclass adds through {@link #saveInstanceState(Map)}.
     */
    public final Map<String, Object> snapshotContinuation() {
        Map<String, Object> continuation = new LinkedHashMap<>();
        saveInstanceState(continuation);
        return continuation;
    }

    protected void saveInstanceState(Map<String, Object> continuation) {
        State<ProcessState> state = getState();
        if (state instanceof RunningState running) {
            continuation.put(STEP_KEY, running.getStepName());
        } else if (state instanceof WaitingState waiting) {
            continuation.put(STEP_KEY, waiting.getNextStep());
            if (waiting.getReason() != null) {
                continuation.put(WAIT_REASON_KEY, waiting.getReason());
            }
        }
    }

    /**
     * Restores what {@link #saveInstanceState(Map)} stored.
     *
     * @throws IllegalArgumentException if the continuation is malformed
     */
    protected void loadInstanceState(Map<String, Object> continuation) {
    }

    /**
     * Rebuilds this freshly constructed process from a bundle, installing the
     * saved state without running any hooks. Live processes are registered
     * with the host; terminal ones only complete their result future.
     *
     * @throws IllegalArgumentException if the bundle content is malformed
     * @throws IllegalStateException    if the process was already initialised
     */
    public final void restoreFrom(Bundle bundle) {
        Objects.requireNonNull(bundle, "Bundle cannot be null");
        if (!pid.equals(bundle.getPid())) {
            throw new IllegalArgumentException("Bundle pid " + bundle.getPid() + " does not match Process<" + pid + ">");
        }
        outputs.clear();
        outputs.putAll(Bundle.mutableCopy(bundle.getOutputs()));
        creationTime = bundle.getCreationTime();
        paused = bundle.isPaused();
        status = bundle.getStatus();

        Map<String, Object> continuation = Bundle.mutableCopy(bundle.getContinuation());
        loadInstanceState(continuation);

        restoreState(recreateState(bundle, continuation));
        logger.info("Process<{}>: restored in {}{}", pid, getStateLabel(), paused ? " (paused)" : "");

        if (isTerminated()) {
            onTerminated();
        } else {
            environment.getRegistry().register(this);
            environment.getControlBinding().ifPresent(binding -> binding.attach(this));
        }
    }

    private AbstractProcessState recreateState(Bundle bundle, Map<String, Object> continuation) {
        ProcessState label = bundle.getLabel();
        switch (label) {
            case CREATED:
                return new CreatedState(this);
            case RUNNING:
                return new RunningState(this, requireStep(continuation));
            case WAITING:
                Object reason = continuation.get(WAIT_REASON_KEY);
                return new WaitingState(this, requireStep(continuation), reason == null ? null : reason.toString(), null);
            case FINISHED:
                return new FinishedState(this, Bundle.mutableCopy(bundle.getOutputs()), bundle.isSuccessful());
            case EXCEPTED:
                String text = bundle.getExceptionText();
                return new ExceptedState(this, new WeftException(text == null ? "Process excepted before checkpoint" : text));
            case KILLED:
                return new KilledState(this, bundle.getKillMessage());
            default:
                throw new IllegalArgumentException("Unsupported label " + label);
        }
    }

    private static String requireStep(Map<String, Object> continuation) {
        Object step = continuation.get(STEP_KEY);
        if (!(step instanceof String)) {
            throw new IllegalArgumentException("Continuation is missing the '" + STEP_KEY + "' entry");
        }
        return (String) step;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "<" + pid + "> (" + getStateLabel() + ")";
    }
}
