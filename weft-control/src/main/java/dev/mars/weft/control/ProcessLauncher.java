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
import dev.mars.weft.core.exceptions.ReconstructionException;
import dev.mars.weft.core.exceptions.TransitionFailedException;
import dev.mars.weft.core.persistence.Bundle;
import dev.mars.weft.core.persistence.Persister;
import dev.mars.weft.core.persistence.ProcessBundler;
import dev.mars.weft.core.process.Process;
import dev.mars.weft.core.process.ProcessEnvironment;
import dev.mars.weft.core.process.ProcessFactory;
import dev.mars.weft.core.process.ProcessRegistry;
import dev.mars.weft.core.process.ProcessState;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Handles the task queue of a host: {@code launch}, {@code create} and
 * {@code continue} tasks.
 *
 * <ul>
 *   <li><b>launch</b> creates a process, optionally persisting it, and starts it.
 *       Replies with the pid, or with the outputs when {@code nowait} is false.</li>
 *   <li><b>create</b> creates a process and checkpoints it without starting it.
 *       Replies with the pid. The instance itself is discarded.</li>
 *   <li><b>continue</b> starts the live process with the pid, or rebuilds it from
 *       its checkpoint (optionally a tagged one) and runs it. Replies with the
 *       outputs, or with the pid when {@code nowait} is true.</li>
 * </ul>
 *
 * <p>A task the launcher cannot honour is answered with
 * {@link ControlErrorCode#TASK_REJECTED}. Processes are created and driven on
 * the scheduler of the host environment.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public class ProcessLauncher {

    private static final Logger logger = LoggerFactory.getLogger(ProcessLauncher.class);

    private final ProcessEnvironment environment;
    private final ProcessBundler bundler;

    public ProcessLauncher(ProcessEnvironment environment, ProcessBundler bundler) {
        this.environment = Objects.requireNonNull(environment, "Environment cannot be null");
        this.bundler = Objects.requireNonNull(bundler, "Bundler cannot be null");
    }

    /**
     * Handles one task message and completes with the reply. The returned
     * future never fails: errors become error replies.
     */
    public Future<JsonObject> handle(JsonObject json) {
        String correlationId = ControlMessage.peekCorrelationId(json);
        Future<Object> result;
        try {
            result = dispatch(ControlMessage.fromJson(json));
        } catch (ControlException e) {
            result = Future.failedFuture(e);
        }
        return result.transform(ar -> {
            if (ar.succeeded()) {
                return Future.succeededFuture(ControlResponse.ok(correlationId, ar.result()).toJson());
            }
            Throwable cause = ar.cause();
            if (cause instanceof ControlException) {
                logger.warn("Task not completed: {}", cause.getMessage());
            } else {
                logger.error("Task failed unexpectedly", cause);
            }
            return Future.succeededFuture(ControlResponse.error(correlationId, cause).toJson());
        });
    }

    private Future<Object> dispatch(ControlMessage task) throws ControlException {
        logger.debug("Received {} task", task.kind().getValue());
        switch (task.kind()) {
            case LAUNCH:
                return launch(task);
            case CREATE:
                return create(task);
            case CONTINUE:
                return continueProcess(task);
            default:
                throw new TaskRejectedException("'" + task.kind().getValue() + "' is not a task");
        }
    }

    // ==================== Tasks ====================

    private Future<Object> launch(ControlMessage task) throws ControlException {
        String typeId = requireTypeId(task);
        Map<String, Object> inputs = task.payloadMap(ControlMessage.INPUTS_KEY);
        boolean persist = task.payloadBoolean(ControlMessage.PERSIST_KEY, false);
        boolean nowait = task.payloadBoolean(ControlMessage.NOWAIT_KEY, true);
        requirePersisterIf(persist, "cannot persist process, no persister");
        ProcessFactory factory = resolve(typeId);

        ProcessEnvironment launchEnvironment = persist
            ? environment
            : environment.toBuilder().persister(null).build();
        return onScheduler(() -> {
            Process process = instantiate(typeId, factory, launchEnvironment, inputs);
            logger.info("Launching Process<{}> of type {}", process.getPid(), typeId);
            if (nowait) {
                process.start();
                return Future.succeededFuture(process.getPid());
            }
            return outcome(process, process.stepUntilTerminated());
        });
    }

    private Future<Object> create(ControlMessage task) throws ControlException {
        String typeId = requireTypeId(task);
        Map<String, Object> inputs = task.payloadMap(ControlMessage.INPUTS_KEY);
        boolean persist = task.payloadBoolean(ControlMessage.PERSIST_KEY, true);
        requirePersisterIf(persist, "cannot persist process, no persister");
        ProcessFactory factory = resolve(typeId);

        // The created instance lives only as its checkpoint, so it stays out of the host registry.
        ProcessEnvironment detached = environment.toBuilder()
            .registry(new ProcessRegistry())
            .controlBinding(null)
            .persister(persist ? environment.getPersister().orElse(null) : null)
            .build();
        return onScheduler(() -> {
            Process process = instantiate(typeId, factory, detached, inputs);
            logger.info("Created Process<{}> of type {}", process.getPid(), typeId);
            return Future.succeededFuture(process.getPid());
        });
    }

    private Future<Object> continueProcess(ControlMessage task) throws ControlException {
        String pid = task.pid();
        if (pid == null) {
            throw ControlException.malformed("continue task without a pid");
        }
        String tag = task.payloadString(ControlMessage.TAG_KEY);
        boolean nowait = task.payloadBoolean(ControlMessage.NOWAIT_KEY, false);
        Optional<Persister> persister = environment.getPersister();
        if (persister.isEmpty()) {
            logger.warn("Rejecting task: cannot continue Process<{}> because no persister is available", pid);
            throw new TaskRejectedException("cannot continue process, no persister");
        }

        return onScheduler(() -> {
            Process process = environment.getRegistry().get(pid).orElse(null);
            if (process != null) {
                logger.info("Continuing live Process<{}> in {}", pid, process.getStateLabel());
                process.start();
            } else {
                process = reconstruct(persister.get(), pid, tag);
                logger.info("Continuing Process<{}> from checkpoint in {}", pid, process.getStateLabel());
                if (process.getStateLabel() == ProcessState.WAITING) {
                    process.resume();
                } else {
                    process.start();
                }
            }
            if (nowait) {
                return Future.succeededFuture(pid);
            }
            return outcome(process, process.getFuture());
        });
    }

    // ==================== Helpers ====================

    private Process reconstruct(Persister persister, String pid, String tag) throws ControlException {
        try {
            Bundle bundle = persister.loadCheckpoint(pid, tag);
            return bundler.load(bundle, environment);
        } catch (PersistenceException e) {
            throw new ControlException(ControlErrorCode.CHECKPOINT_UNAVAILABLE,
                ControlErrorCode.CHECKPOINT_UNAVAILABLE.formatMessage(pid, e.getMessage()), e);
        }
    }

    private static Process instantiate(String typeId, ProcessFactory factory, ProcessEnvironment environment,
                                       Map<String, Object> inputs) throws TaskRejectedException {
        Process process = factory.create(environment, null, inputs);
        try {
            process.initialize();
        } catch (TransitionFailedException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TaskRejectedException("cannot create process of type '" + typeId + "': " + cause.getMessage(), e);
        }
        return process;
    }

    private static Future<Object> outcome(Process process, Future<Map<String, Object>> result) {
        return result.transform(ar -> {
            if (ar.succeeded()) {
                return Future.succeededFuture(JsonValues.toJson(ar.result()));
            }
            return Future.failedFuture(ControlException.of(ControlErrorCode.PROCESS_FAILED,
                process.getPid(), ar.cause().getMessage()));
        });
    }

    private ProcessFactory resolve(String typeId) throws TaskRejectedException {
        try {
            return bundler.getTypeRegistry().resolve(typeId);
        } catch (ReconstructionException e) {
            throw new TaskRejectedException("unknown process type '" + typeId + "'", e);
        }
    }

    private void requirePersisterIf(boolean persist, String reason) throws TaskRejectedException {
        if (persist && environment.getPersister().isEmpty()) {
            logger.warn("Rejecting task: {}", reason);
            throw new TaskRejectedException(reason);
        }
    }

    private static String requireTypeId(ControlMessage task) throws ControlException {
        String typeId = task.payloadString(ControlMessage.TYPE_ID_KEY);
        if (typeId == null) {
            throw ControlException.malformed("task without '" + ControlMessage.TYPE_ID_KEY + "'");
        }
        return typeId;
    }

    private Future<Object> onScheduler(TaskAction action) {
        Promise<Object> promise = Promise.promise();
        environment.getScheduler().schedule(() -> {
            try {
                action.run().onComplete(promise);
            } catch (ControlException | RuntimeException e) {
                promise.fail(e);
            }
        });
        return promise.future();
    }

    @FunctionalInterface
    private interface TaskAction {
        Future<Object> run() throws ControlException;
    }
}
