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

import dev.mars.weft.core.process.ProcessState;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Control message wire format")
class ControlMessageTest {

    @Nested
    @DisplayName("Envelope")
    class EnvelopeTests {

        @Test
        @DisplayName("pause message carries type, kind, pid, correlation id and payload")
        void pauseEnvelope() {
            JsonObject json = ControlMessages.pause("p1", "maintenance").toJson();

            assertEquals("rpc", json.getString("type"));
            assertEquals("pause", json.getString("kind"));
            assertEquals("p1", json.getString("pid"));
            assertNotNull(json.getString("correlation_id"));
            assertEquals("maintenance", json.getJsonObject("payload").getString("message"));
        }

        @Test
        @DisplayName("every rpc gets a fresh correlation id")
        void freshCorrelationIds() {
            assertNotEquals(ControlMessages.play("p1").correlationId(), ControlMessages.play("p1").correlationId());
        }

        @Test
        @DisplayName("decoding an encoded message yields the same message")
        void decodeEncoded() throws ControlException {
            ControlMessage message = ControlMessages.launch("demo.Type", Map.of("x", 5), true, false);

            ControlMessage decoded = ControlMessage.fromJson(message.toJson());

            assertEquals(message.kind(), decoded.kind());
            assertEquals(message.correlationId(), decoded.correlationId());
            assertEquals("demo.Type", decoded.payloadString(ControlMessage.TYPE_ID_KEY));
            assertEquals(Map.of("x", 5), decoded.payloadMap(ControlMessage.INPUTS_KEY));
            assertTrue(decoded.payloadBoolean(ControlMessage.PERSIST_KEY, false));
            assertFalse(decoded.payloadBoolean(ControlMessage.NOWAIT_KEY, true));
        }

        @Test
        @DisplayName("broadcasts have no correlation id")
        void broadcastWithoutCorrelationId() {
            JsonObject json = ControlMessages.broadcast(ControlIntent.KILL_ALL, "shutdown").toJson();

            assertEquals("broadcast", json.getString("type"));
            assertEquals("kill_all", json.getString("kind"));
            assertFalse(json.containsKey("correlation_id"));
            assertFalse(json.containsKey("pid"));
        }

        @ParameterizedTest
        @EnumSource(value = ControlIntent.class, names = {"PLAY", "PAUSE", "KILL", "STATUS", "LAUNCH"})
        @DisplayName("only host intents can be broadcast to all processes")
        void onlyHostIntentsBroadcast(ControlIntent intent) {
            assertThrows(IllegalArgumentException.class, () -> ControlMessages.broadcast(intent, null));
        }

        @Test
        @DisplayName("state change subject names both labels")
        void stateChangedSubject() {
            ControlMessage message = ControlMessages.stateChanged("p1", ProcessState.RUNNING, ProcessState.WAITING);

            assertEquals("state_changed.running.waiting", message.payload().getString("subject"));
            assertEquals("running", message.payload().getString("from"));
            assertEquals("waiting", message.payload().getString("to"));
        }
    }

    @Nested
    @DisplayName("Decoding failures")
    class DecodingFailureTests {

        @Test
        @DisplayName("unknown kind is reported as an unknown intent")
        void unknownKind() {
            JsonObject json = ControlMessages.play("p1").toJson().put("kind", "resume");

            ControlException e = assertThrows(ControlException.class, () -> ControlMessage.fromJson(json));
            assertEquals(ControlErrorCode.UNKNOWN_INTENT, e.getErrorCode());
        }

        @Test
        @DisplayName("rpc without correlation id is malformed")
        void missingCorrelationId() {
            JsonObject json = ControlMessages.play("p1").toJson();
            json.remove("correlation_id");

            ControlException e = assertThrows(ControlException.class, () -> ControlMessage.fromJson(json));
            assertEquals(ControlErrorCode.MALFORMED_MESSAGE, e.getErrorCode());
        }

        @Test
        @DisplayName("unknown type is malformed")
        void unknownType() {
            JsonObject json = ControlMessages.play("p1").toJson().put("type", "multicast");

            ControlException e = assertThrows(ControlException.class, () -> ControlMessage.fromJson(json));
            assertEquals(ControlErrorCode.MALFORMED_MESSAGE, e.getErrorCode());
        }

        @Test
        @DisplayName("non-object payload is malformed")
        void payloadNotAnObject() {
            JsonObject json = ControlMessages.play("p1").toJson().put("payload", "stop");

            assertThrows(ControlException.class, () -> ControlMessage.fromJson(json));
        }

        @Test
        @DisplayName("payload value of the wrong type is malformed")
        void payloadValueOfWrongType() throws ControlException {
            ControlMessage message = ControlMessage.fromJson(ControlMessages.pause("p1", null).toJson()
                .put("payload", new JsonObject().put("message", 42)));

            assertThrows(ControlException.class, () -> message.payloadString(ControlMessage.MESSAGE_KEY));
        }
    }

    @Nested
    @DisplayName("Responses")
    class ResponseTests {

        @Test
        @DisplayName("ok response keeps its result")
        void okResponse() throws ControlException {
            ControlResponse response = ControlResponse.fromJson(ControlResponse.ok("c1", true).toJson());

            assertTrue(response.isOk());
            assertEquals("c1", response.correlationId());
            assertEquals(true, response.result());
        }

        @Test
        @DisplayName("error response keeps code and message")
        void errorResponse() throws ControlException {
            JsonObject json = ControlResponse.error("c1", ControlErrorCode.TASK_REJECTED, "no persister").toJson();

            assertEquals("error", json.getString("status"));
            assertEquals("TASK_REJECTED", json.getJsonObject("error_detail").getString("code"));

            ControlResponse response = ControlResponse.fromJson(json);
            assertFalse(response.isOk());
            assertEquals(ControlErrorCode.TASK_REJECTED, response.errorCode());
            assertEquals("no persister", response.errorMessage());
        }

        @Test
        @DisplayName("unknown error code becomes an internal error")
        void unknownErrorCode() throws ControlException {
            JsonObject json = new JsonObject()
                .put("correlation_id", "c1")
                .put("status", "error")
                .put("error_detail", new JsonObject().put("code", "NOPE").put("message", "odd"));

            assertEquals(ControlErrorCode.INTERNAL_ERROR, ControlResponse.fromJson(json).errorCode());
        }

        @Test
        @DisplayName("error reply fails its future with a control exception")
        void errorReplyFailsFuture() {
            ControlResponse response = ControlResponse.error("c1", ControlErrorCode.UNKNOWN_PROCESS, "gone");

            Throwable cause = response.toFuture().cause();
            assertInstanceOf(ControlException.class, cause);
            assertEquals(ControlErrorCode.UNKNOWN_PROCESS, ((ControlException) cause).getErrorCode());
        }

        @Test
        @DisplayName("reply without a valid status is malformed")
        void invalidStatus() {
            JsonObject json = new JsonObject().put("correlation_id", "c1").put("status", "maybe");

            assertThrows(ControlException.class, () -> ControlResponse.fromJson(json));
        }
    }
}
