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

import dev.mars.weft.core.config.WeftConfiguration;
import dev.mars.weft.core.process.StatusReport;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Non-blocking controller of remote processes. Every call is an RPC whose
 * reply completes the returned future.
 *
 * <p>Failures arrive as a failed future carrying a {@link ControlException}:
 * {@link ControlTimeoutException} when no reply came back in time,
 * {@link ControlErrorCode#UNKNOWN_PROCESS} when nothing answers for the pid (it never
 * existed, or terminated and is no longer retained) and the code of the error
 * reply otherwise.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public class RemoteProcessController {

    private static final Logger logger = LoggerFactory.getLogger(RemoteProcessController.class);

    private final Communicator communicator;
    private final ControlAddresses addresses;
    private final long rpcTimeoutMs;

    public RemoteProcessController(Communicator communicator, ControlAddresses addresses, long rpcTimeoutMs) {
        this.communicator = Objects.requireNonNull(communicator, "Communicator cannot be null");
        this.addresses = Objects.requireNonNull(addresses, "Addresses cannot be null");
        if (rpcTimeoutMs <= 0) {
            throw new IllegalArgumentException("RPC timeout must be positive: " + rpcTimeoutMs);
        }
        this.rpcTimeoutMs = rpcTimeoutMs;
    }

    /**
     * Creates a controller on the event bus of the given Vert.x instance, with
     * the address prefix and RPC timeout of the configuration.
     */
    public static RemoteProcessController create(Vertx vertx, WeftConfiguration config) {
        return new RemoteProcessController(new VertxCommunicator(vertx),
            new ControlAddresses(config.getAddressPrefix()), config.getRpcTimeoutMs());
    }

    public long getRpcTimeoutMs() {
        return rpcTimeoutMs;
    }

    // ==================== Process commands ====================

    public Future<StatusReport> getStatus(String pid) {
        return processRpc(ControlMessages.status(pid)).compose(RemoteProcessController::asStatusReport);
    }

    public Future<Boolean> pauseProcess(String pid) {
        return pauseProcess(pid, null);
    }

    public Future<Boolean> pauseProcess(String pid, String message) {
        return processRpc(ControlMessages.pause(pid, message)).compose(RemoteProcessController::asBoolean);
    }

    public Future<Boolean> playProcess(String pid) {
        return processRpc(ControlMessages.play(pid)).compose(RemoteProcessController::asBoolean);
    }

    public Future<Boolean> killProcess(String pid) {
        return killProcess(pid, null);
    }

    public Future<Boolean> killProcess(String pid, String message) {
        return processRpc(ControlMessages.kill(pid, message)).compose(RemoteProcessController::asBoolean);
    }

    // ==================== Tasks ====================

    /**
     * Launches a process without persisting it and completes with its pid
     * once it has started.
     */
    public Future<String> launchProcess(String typeId, Map<String, Object> inputs) {
        return launchProcess(typeId, inputs, false);
    }

    public Future<String> launchProcess(String typeId, Map<String, Object> inputs, boolean persist) {
        return taskRpc(ControlMessages.launch(typeId, inputs, persist, true)).compose(RemoteProcessController::asString);
    }

    /**
     * Launches a process and completes with its outputs when it finishes.
     */
    public Future<Map<String, Object>> launchProcessAndWait(String typeId, Map<String, Object> inputs, boolean persist) {
        return taskRpc(ControlMessages.launch(typeId, inputs, persist, false)).compose(RemoteProcessController::asMap);
    }

    /**
     * Creates and checkpoints a process without starting it.
     *
     * @return the pid to pass to {@link #continueProcess(String)}
     */
    public Future<String> createProcess(String typeId, Map<String, Object> inputs) {
        return taskRpc(ControlMessages.create(typeId, inputs, true)).compose(RemoteProcessController::asString);
    }

    /**
     * Continues a process from its latest checkpoint and completes with its outputs.
     */
    public Future<Map<String, Object>> continueProcess(String pid) {
        return continueProcess(pid, null);
    }

    public Future<Map<String, Object>> continueProcess(String pid, String tag) {
        return taskRpc(ControlMessages.continueTask(pid, tag, false)).compose(RemoteProcessController::asMap);
    }

    /**
     * Continues a process from a checkpoint and completes with its pid once it runs.
     */
    public Future<String> continueProcessNoWait(String pid, String tag) {
        return taskRpc(ControlMessages.continueTask(pid, tag, true)).compose(RemoteProcessController::asString);
    }

    /**
     * Creates a persisted process, then continues it to completion.
     */
    public Future<Map<String, Object>> executeProcess(String typeId, Map<String, Object> inputs) {
        return createProcess(typeId, inputs).compose(this::continueProcess);
    }

    // ==================== Broadcasts ====================

    public Future<Void> pauseAll(String message) {
        return broadcast(ControlMessages.broadcast(ControlIntent.PAUSE_ALL, message));
    }

    public Future<Void> playAll() {
        return broadcast(ControlMessages.broadcast(ControlIntent.PLAY_ALL, null));
    }

    public Future<Void> killAll(String message) {
        return broadcast(ControlMessages.broadcast(ControlIntent.KILL_ALL, message));
    }

    // ==================== Transport ====================

    private Future<Object> processRpc(ControlMessage message) {
        return rpc(addresses.process(message.pid()), message).recover(err -> {
            if (err instanceof ControlException
                    && ((ControlException) err).getErrorCode() == ControlErrorCode.NO_RECIPIENT) {
                return Future.failedFuture(ControlException.of(ControlErrorCode.UNKNOWN_PROCESS, message.pid()));
            }
            return Future.failedFuture(err);
        });
    }

    private Future<Object> taskRpc(ControlMessage message) {
        return rpc(addresses.tasks(), message);
    }

    private Future<Object> rpc(String address, ControlMessage message) {
        logger.debug("Sending {} to {}", message.kind().getValue(), address);
        return communicator.rpcSend(address, message.toJson(), rpcTimeoutMs).compose(reply -> {
            ControlResponse response;
            try {
                response = ControlResponse.fromJson(reply);
            } catch (ControlException e) {
                return Future.failedFuture(e);
            }
            if (response.correlationId() != null && !response.correlationId().equals(message.correlationId())) {
                return Future.failedFuture(ControlException.malformed(
                    "reply for '" + response.correlationId() + "' to request '" + message.correlationId() + "'"));
            }
            return response.toFuture();
        });
    }

    private Future<Void> broadcast(ControlMessage message) {
        logger.debug("Broadcasting {}", message.kind().getValue());
        return communicator.publish(addresses.broadcast(), message.toJson());
    }

    // ==================== Result conversion ====================

    private static Future<Boolean> asBoolean(Object result) {
        if (result instanceof Boolean) {
            return Future.succeededFuture((Boolean) result);
        }
        return Future.failedFuture(ControlException.malformed("expected a boolean result, got " + result));
    }

    private static Future<String> asString(Object result) {
        if (result instanceof String) {
            return Future.succeededFuture((String) result);
        }
        return Future.failedFuture(ControlException.malformed("expected a pid result, got " + result));
    }

    private static Future<Map<String, Object>> asMap(Object result) {
        if (result instanceof JsonObject) {
            return Future.succeededFuture(JsonValues.toMap((JsonObject) result));
        }
        return Future.failedFuture(ControlException.malformed("expected an object result, got " + result));
    }

    private static Future<StatusReport> asStatusReport(Object result) {
        if (!(result instanceof JsonObject)) {
            return Future.failedFuture(ControlException.malformed("expected a status report, got " + result));
        }
        try {
            return Future.succeededFuture(StatusReport.fromMap(JsonValues.toMap((JsonObject) result)));
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(ControlException.malformed(e.getMessage()));
        }
    }
}
