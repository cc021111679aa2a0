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

import dev.mars.weft.core.process.ControlBinding;
import dev.mars.weft.core.process.Process;
import dev.mars.weft.core.process.ProcessState;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Connects processes to the control plane: attaches them to the
 * {@link ProcessControlRouter} and broadcasts every state change.
 *
 * <p>A broadcast that fails, or is not handed over within the broadcast
 * timeout, is dropped with a warning. It never fails the transition.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class CommunicatorBinding implements ControlBinding {

    private static final Logger logger = LoggerFactory.getLogger(CommunicatorBinding.class);

    private final Vertx vertx;
    private final Communicator communicator;
    private final ProcessControlRouter router;
    private final ControlAddresses addresses;
    private final long broadcastTimeoutMs;

    public CommunicatorBinding(Vertx vertx, Communicator communicator, ProcessControlRouter router,
                               ControlAddresses addresses, long broadcastTimeoutMs) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.communicator = Objects.requireNonNull(communicator, "Communicator cannot be null");
        this.router = Objects.requireNonNull(router, "Router cannot be null");
        this.addresses = Objects.requireNonNull(addresses, "Addresses cannot be null");
        if (broadcastTimeoutMs <= 0) {
            throw new IllegalArgumentException("Broadcast timeout must be positive: " + broadcastTimeoutMs);
        }
        this.broadcastTimeoutMs = broadcastTimeoutMs;
    }

    @Override
    public void attach(Process process) {
        router.attach(process);
    }

    @Override
    public void detach(Process process) {
        router.detach(process);
    }

    @Override
    public void stateChanged(Process process, ProcessState from, ProcessState to) {
        ControlMessage message = ControlMessages.stateChanged(process.getPid(), from, to);
        JsonObject payload = message.payload();
        String subject = payload.getString(ControlMessage.SUBJECT_KEY);
        logger.debug("Process<{}>: broadcasting {}", process.getPid(), subject);

        Future<Void> published;
        try {
            published = communicator.publish(addresses.broadcast(), message.toJson());
        } catch (RuntimeException e) {
            published = Future.failedFuture(e);
        }
        withTimeout(published).onFailure(err ->
            logger.warn("Process<{}>: dropped broadcast {}: {}", process.getPid(), subject, err.getMessage()));
    }

    private Future<Void> withTimeout(Future<Void> published) {
        if (published.isComplete()) {
            return published;
        }
        Promise<Void> delivery = Promise.promise();
        long timerId = vertx.setTimer(broadcastTimeoutMs, id -> delivery.tryFail(
            new TimeoutException("not delivered within " + broadcastTimeoutMs + " ms")));
        published.onComplete(ar -> {
            vertx.cancelTimer(timerId);
            if (ar.succeeded()) {
                delivery.tryComplete();
            } else {
                delivery.tryFail(ar.cause());
            }
        });
        return delivery.future();
    }
}
