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
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.Checkpoint;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
@DisplayName("Event bus communicator")
class VertxCommunicatorTest {

    private VertxCommunicator communicator;

    @BeforeEach
    void setUp(Vertx vertx) {
        communicator = new VertxCommunicator(vertx);
    }

    @Test
    @DisplayName("rpc completes with the subscriber's reply")
    void rpcReply(VertxTestContext testContext) {
        communicator.addRpcSubscriber("test.echo", message ->
            Future.succeededFuture(new JsonObject().put("echo", message.getString("text"))));

        communicator.rpcSend("test.echo", new JsonObject().put("text", "hello"), 1000)
            .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
                assertEquals("hello", reply.getString("echo"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("rpc without a reply fails with a control timeout")
    void rpcTimeout(VertxTestContext testContext) {
        communicator.addRpcSubscriber("test.silent", message -> Future.future(promise -> { }));

        communicator.rpcSend("test.silent", new JsonObject(), 200)
            .onComplete(testContext.failing(err -> testContext.verify(() -> {
                ControlTimeoutException timeout = assertInstanceOf(ControlTimeoutException.class, err);
                assertEquals(ControlErrorCode.TIMEOUT, timeout.getErrorCode());
                assertEquals("test.silent", timeout.getAddress());
                assertEquals(200, timeout.getTimeoutMs());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("rpc to an address without subscribers fails with no recipient")
    void rpcNoRecipient(VertxTestContext testContext) {
        communicator.rpcSend("test.nobody", new JsonObject(), 1000)
            .onComplete(testContext.failing(err -> testContext.verify(() -> {
                ControlException e = assertInstanceOf(ControlException.class, err);
                assertEquals(ControlErrorCode.NO_RECIPIENT, e.getErrorCode());
                assertFalse(e instanceof ControlTimeoutException);
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("failing handler is reported as an internal error")
    void rpcHandlerFailure(VertxTestContext testContext) {
        communicator.addRpcSubscriber("test.broken", message -> {
            throw new IllegalStateException("handler broke");
        });

        communicator.rpcSend("test.broken", new JsonObject(), 1000)
            .onComplete(testContext.failing(err -> testContext.verify(() -> {
                ControlException e = assertInstanceOf(ControlException.class, err);
                assertEquals(ControlErrorCode.INTERNAL_ERROR, e.getErrorCode());
                assertTrue(e.getMessage().contains("handler broke"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("broadcast reaches every subscriber")
    void broadcastReachesAll(VertxTestContext testContext) {
        Checkpoint received = testContext.checkpoint(2);
        communicator.addBroadcastSubscriber("test.all", message -> received.flag());
        communicator.addBroadcastSubscriber("test.all", message -> received.flag());

        communicator.publish("test.all", new JsonObject().put("kind", "pause_all"))
            .onComplete(testContext.succeeding(v -> { }));
    }

    @Test
    @DisplayName("unsubscribed rpc handler no longer answers")
    void unsubscribe(VertxTestContext testContext) {
        Communicator.Subscription subscription = communicator.addRpcSubscriber("test.gone", message ->
            Future.succeededFuture(new JsonObject()));

        subscription.unsubscribe()
            .compose(v -> communicator.rpcSend("test.gone", new JsonObject(), 1000))
            .onComplete(testContext.failing(err -> testContext.verify(() -> {
                assertEquals(ControlErrorCode.NO_RECIPIENT, ((ControlException) err).getErrorCode());
                testContext.completeNow();
            })));
    }
}
