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

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Builds the control messages sent by controllers and processes. Both
 * controller flavours go through these methods, so a blocking and a
 * non-blocking call produce the same envelope.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public final class ControlMessages {

    /** Subject prefix of state-change broadcasts, e.g. {@code state_changed.running.waiting}. */
    public static final String STATE_CHANGED_SUBJECT = "state_changed";

    private ControlMessages() {
        // Utility class
    }

    // ==================== Process RPCs ====================

    public static ControlMessage play(String pid) {
        return rpc(ControlIntent.PLAY, requirePid(pid), new JsonObject());
    }

    public static ControlMessage pause(String pid, String message) {
        return rpc(ControlIntent.PAUSE, requirePid(pid), new JsonObject().put(ControlMessage.MESSAGE_KEY, message));
    }

    public static ControlMessage kill(String pid, String message) {
        return rpc(ControlIntent.KILL, requirePid(pid), new JsonObject().put(ControlMessage.MESSAGE_KEY, message));
    }

    public static ControlMessage status(String pid) {
        return rpc(ControlIntent.STATUS, requirePid(pid), new JsonObject());
    }

    // ==================== Tasks ====================

    public static ControlMessage launch(String typeId, Map<String, Object> inputs, boolean persist, boolean nowait) {
        return rpc(ControlIntent.LAUNCH, null, new JsonObject()
            .put(ControlMessage.TYPE_ID_KEY, Objects.requireNonNull(typeId, "Type id cannot be null"))
            .put(ControlMessage.INPUTS_KEY, JsonValues.toJson(inputs))
            .put(ControlMessage.PERSIST_KEY, persist)
            .put(ControlMessage.NOWAIT_KEY, nowait));
    }

    public static ControlMessage create(String typeId, Map<String, Object> inputs, boolean persist) {
        return rpc(ControlIntent.CREATE, null, new JsonObject()
            .put(ControlMessage.TYPE_ID_KEY, Objects.requireNonNull(typeId, "Type id cannot be null"))
            .put(ControlMessage.INPUTS_KEY, JsonValues.toJson(inputs))
            .put(ControlMessage.PERSIST_KEY, persist));
    }

    public static ControlMessage continueTask(String pid, String tag, boolean nowait) {
        return rpc(ControlIntent.CONTINUE, requirePid(pid), new JsonObject()
            .put(ControlMessage.TAG_KEY, tag)
            .put(ControlMessage.NOWAIT_KEY, nowait));
    }

    // ==================== Broadcasts ====================

    /**
     * A host-wide intent addressed to every live process.
     *
     * @throws IllegalArgumentException if the intent is not a host intent
     */
    public static ControlMessage broadcast(ControlIntent intent, String message) {
        if (intent.getTarget() != ControlIntent.Target.ALL) {
            throw new IllegalArgumentException(intent + " cannot be broadcast to all processes");
        }
        return new ControlMessage(MessageType.BROADCAST, intent, null, null,
            new JsonObject().put(ControlMessage.MESSAGE_KEY, message));
    }

    /**
     * The broadcast a process publishes after a transition.
     *
     * @param from the previous label, null for the initial transition
     */
    public static ControlMessage stateChanged(String pid, ProcessState from, ProcessState to) {
        String fromValue = from == null ? null : from.getValue();
        return new ControlMessage(MessageType.BROADCAST, ControlIntent.STATE_CHANGED, requirePid(pid), null,
            new JsonObject()
                .put(ControlMessage.FROM_KEY, fromValue)
                .put(ControlMessage.TO_KEY, to.getValue())
                .put(ControlMessage.SUBJECT_KEY, STATE_CHANGED_SUBJECT + "." + fromValue + "." + to.getValue()));
    }

    private static ControlMessage rpc(ControlIntent intent, String pid, JsonObject payload) {
        return new ControlMessage(MessageType.RPC, intent, pid, UUID.randomUUID().toString(), payload);
    }

    private static String requirePid(String pid) {
        return Objects.requireNonNull(pid, "Pid cannot be null");
    }
}
