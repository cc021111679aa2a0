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
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.DeliveryOptions;
import io.vertx.core.eventbus.EventBus;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.eventbus.ReplyException;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * {@link Communicator} over the Vert.x event bus. Works unchanged on a
 * clustered event bus, where the addresses span hosts.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public class VertxCommunicator implements Communicator {

    private static final Logger logger = LoggerFactory.getLogger(VertxCommunicator.class);

    /** Failure code used when an RPC handler fails. */
    static final int HANDLER_FAILURE_CODE = 500;

    private final EventBus eventBus;

    public VertxCommunicator(Vertx vertx) {
        this.eventBus = Objects.requireNonNull(vertx, "Vertx cannot be null").eventBus();
    }

    @Override
    public Future<JsonObject> rpcSend(String address, JsonObject message, long timeoutMs) {
        logger.debug("RPC to {}: {}", address, message.getValue(ControlMessage.KIND));
        DeliveryOptions options = new DeliveryOptions().setSendTimeout(timeoutMs);
        return eventBus.<JsonObject>request(address, message, options)
            .map(Message::body)
            .recover(err -> Future.failedFuture(translateFailure(address, timeoutMs, err)));
    }

    @Override
    public Future<Void> publish(String address, JsonObject message) {
        try {
            eventBus.publish(address, message);
            return Future.succeededFuture();
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }

    @Override
    public Subscription addRpcSubscriber(String address, Function<JsonObject, Future<JsonObject>> handler) {
        MessageConsumer<JsonObject> consumer = eventBus.consumer(address, message -> {
            Future<JsonObject> reply;
            try {
                reply = handler.apply(message.body());
            } catch (RuntimeException e) {
                reply = Future.failedFuture(e);
            }
            reply.onComplete(ar -> {
                if (ar.succeeded()) {
                    message.reply(ar.result());
                } else {
                    logger.error("RPC handler at {} failed", address, ar.cause());
                    message.fail(HANDLER_FAILURE_CODE, String.valueOf(ar.cause().getMessage()));
                }
            });
        });
        logger.debug("Added RPC subscriber at {}", address);
        return new ConsumerSubscription(address, consumer);
    }

    @Override
    public Subscription addBroadcastSubscriber(String address, Consumer<JsonObject> handler) {
        MessageConsumer<JsonObject> consumer = eventBus.consumer(address, message -> {
            try {
                handler.accept(message.body());
            } catch (RuntimeException e) {
                logger.warn("Broadcast subscriber at {} failed: {}", address, e.getMessage(), e);
            }
        });
        logger.debug("Added broadcast subscriber at {}", address);
        return new ConsumerSubscription(address, consumer);
    }

    static ControlException translateFailure(String address, long timeoutMs, Throwable err) {
        if (err instanceof ReplyException) {
            ReplyException reply = (ReplyException) err;
            switch (reply.failureType()) {
                case TIMEOUT:
                    return new ControlTimeoutException(address, timeoutMs);
                case NO_HANDLERS:
                    return ControlException.of(ControlErrorCode.NO_RECIPIENT, address);
                default:
                    return new ControlException(ControlErrorCode.INTERNAL_ERROR,
                        ControlErrorCode.INTERNAL_ERROR.formatMessage(reply.getMessage()), reply);
            }
        }
        return ControlException.internal(err);
    }

    private static final class ConsumerSubscription implements Subscription {

        private final String address;
        private final MessageConsumer<JsonObject> consumer;

        private ConsumerSubscription(String address, MessageConsumer<JsonObject> consumer) {
            this.address = address;
            this.consumer = consumer;
        }

        @Override
        public String address() {
            return address;
        }

        @Override
        public Future<Void> unsubscribe() {
            logger.debug("Removing subscriber at {}", address);
            return consumer.unregister();
        }
    }
}
