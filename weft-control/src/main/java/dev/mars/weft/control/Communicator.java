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

import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Message transport of the control plane: point-to-point RPCs with a reply
 * and best-effort broadcasts.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public interface Communicator {

    /**
     * Sends a request and completes with the reply body.
     *
     * @return a future failing with {@link ControlTimeoutException} if no reply
     *         arrives within the timeout and with {@link ControlException} if the
     *         message cannot be delivered
     */
    Future<JsonObject> rpcSend(String address, JsonObject message, long timeoutMs);

    /**
     * Publishes a message to every subscriber of the address. Completion means
     * the message was handed to the transport, not that anyone received it.
     */
    Future<Void> publish(String address, JsonObject message);

    /**
     * Handles requests sent to the address. The handler's future becomes the reply;
     * a failed future is returned to the sender as a recipient failure.
     */
    Subscription addRpcSubscriber(String address, Function<JsonObject, Future<JsonObject>> handler);

    Subscription addBroadcastSubscriber(String address, Consumer<JsonObject> handler);

    /**
     * Handle of a registered subscriber.
     */
    interface Subscription {

        String address();

        Future<Void> unsubscribe();
    }
}
