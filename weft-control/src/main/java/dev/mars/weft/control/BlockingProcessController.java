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

import dev.mars.weft.core.process.StatusReport;
import io.vertx.core.Future;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;

/**
 * Blocking flavour of {@link RemoteProcessController}. Each call sends the same
 * message as its non-blocking counterpart and waits for the reply.
 *
 * <p>Must not be called from a Vert.x event-loop thread.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class BlockingProcessController {

    private final RemoteProcessController controller;

    public BlockingProcessController(RemoteProcessController controller) {
        this.controller = Objects.requireNonNull(controller, "Controller cannot be null");
    }

    public StatusReport getStatus(String pid) throws ControlException {
        return await(controller.getStatus(pid));
    }

    public boolean pauseProcess(String pid, String message) throws ControlException {
        return await(controller.pauseProcess(pid, message));
    }

    public boolean playProcess(String pid) throws ControlException {
        return await(controller.playProcess(pid));
    }

    public boolean killProcess(String pid, String message) throws ControlException {
        return await(controller.killProcess(pid, message));
    }

    public String launchProcess(String typeId, Map<String, Object> inputs, boolean persist) throws ControlException {
        return await(controller.launchProcess(typeId, inputs, persist));
    }

    public Map<String, Object> launchProcessAndWait(String typeId, Map<String, Object> inputs, boolean persist)
            throws ControlException {
        return await(controller.launchProcessAndWait(typeId, inputs, persist));
    }

    public String createProcess(String typeId, Map<String, Object> inputs) throws ControlException {
        return await(controller.createProcess(typeId, inputs));
    }

    public Map<String, Object> continueProcess(String pid, String tag) throws ControlException {
        return await(controller.continueProcess(pid, tag));
    }

    public Map<String, Object> executeProcess(String typeId, Map<String, Object> inputs) throws ControlException {
        return await(controller.executeProcess(typeId, inputs));
    }

    public void pauseAll(String message) throws ControlException {
        await(controller.pauseAll(message));
    }

    public void playAll() throws ControlException {
        await(controller.playAll());
    }

    public void killAll(String message) throws ControlException {
        await(controller.killAll(message));
    }

    // Every future of the remote controller completes: the transport bounds each RPC by its timeout.
    private static <T> T await(Future<T> future) throws ControlException {
        try {
            return future.toCompletionStage().toCompletableFuture().get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ControlException) {
                throw (ControlException) cause;
            }
            throw ControlException.internal(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ControlException(ControlErrorCode.INTERNAL_ERROR, "Interrupted while waiting for a reply", e);
        }
    }
}
