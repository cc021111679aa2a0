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

import io.vertx.core.json.JsonObject;

import java.util.Map;
import java.util.Objects;

/**
 * The control-plane envelope. Transmitted, never persisted.
 *
 * <p>Wire form:</p>
 * <pre>{@code
 * {
 *   "type": "rpc",
 *   "kind": "pause",
 *   "pid": "0f8c...",
 *   "correlation_id": "5b1e...",
 *   "payload": { "message": "maintenance" }
 * }
 * }</pre>
 *
 * <p>{@code correlation_id} is present on RPCs only; {@code pid} is absent on
 * host broadcasts and on launch/create tasks.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public record ControlMessage(
    MessageType type,
    ControlIntent kind,
    String pid,
    String correlationId,
    JsonObject payload
) {
    public static final String TYPE = "type";
    public static final String KIND = "kind";
    public static final String PID = "pid";
    public static final String CORRELATION_ID = "correlation_id";
    public static final String PAYLOAD = "payload";

    // ==================== Payload Keys ====================

    public static final String MESSAGE_KEY = "message";
    public static final String TYPE_ID_KEY = "type_id";
    public static final String INPUTS_KEY = "inputs";
    public static final String PERSIST_KEY = "persist";
    public static final String NOWAIT_KEY = "nowait";
    public static final String TAG_KEY = "tag";
    public static final String FROM_KEY = "from";
    public static final String TO_KEY = "to";
    public static final String SUBJECT_KEY = "subject";

    public ControlMessage {
        Objects.requireNonNull(type, "Message type cannot be null");
        Objects.requireNonNull(kind, "Message kind cannot be null");
        if (type == MessageType.RPC) {
            Objects.requireNonNull(correlationId, "RPC messages require a correlation id");
        }
        payload = payload == null ? new JsonObject() : payload;
    }

    /**
     * Reads an optional string from the payload.
     *
     * @throws ControlException if the value is present but not a string
     */
    public String payloadString(String key) throws ControlException {
        Object value = payload.getValue(key);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw ControlException.malformed("payload '" + key + "' must be a string");
    }

    /**
     * Reads an optional boolean from the payload.
     *
     * @throws ControlException if the value is present but not a boolean
     */
    public boolean payloadBoolean(String key, boolean defaultValue) throws ControlException {
        Object value = payload.getValue(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw ControlException.malformed("payload '" + key + "' must be a boolean");
    }

    /**
     * Reads an optional object from the payload as a plain map.
     *
     * @throws ControlException if the value is present but not an object
     */
    public Map<String, Object> payloadMap(String key) throws ControlException {
        Object value = payload.getValue(key);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof JsonObject) {
            return JsonValues.toMap((JsonObject) value);
        }
        throw ControlException.malformed("payload '" + key + "' must be an object");
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put(TYPE, type.getValue())
            .put(KIND, kind.getValue());
        if (pid != null) {
            json.put(PID, pid);
        }
        if (correlationId != null) {
            json.put(CORRELATION_ID, correlationId);
        }
        return json.put(PAYLOAD, payload);
    }

    /**
     * Decodes an envelope.
     *
     * @throws ControlException with {@link ControlErrorCode#MALFORMED_MESSAGE} for a
     *                          structurally invalid envelope and
     *                          {@link ControlErrorCode#UNKNOWN_INTENT} for an unknown kind
     */
    public static ControlMessage fromJson(JsonObject json) throws ControlException {
        if (json == null) {
            throw ControlException.malformed("empty message");
        }
        String typeValue = requireString(json, TYPE);
        MessageType type = MessageType.fromValue(typeValue)
            .orElseThrow(() -> ControlException.malformed("unknown type '" + typeValue + "'"));
        String kindValue = requireString(json, KIND);
        ControlIntent kind = ControlIntent.fromValue(kindValue)
            .orElseThrow(() -> ControlException.of(ControlErrorCode.UNKNOWN_INTENT, kindValue));
        String pid = optionalString(json, PID);
        String correlationId = optionalString(json, CORRELATION_ID);
        if (type == MessageType.RPC && correlationId == null) {
            throw ControlException.malformed("rpc message without '" + CORRELATION_ID + "'");
        }

        Object payload = json.getValue(PAYLOAD);
        if (payload != null && !(payload instanceof JsonObject)) {
            throw ControlException.malformed("'" + PAYLOAD + "' must be an object");
        }
        return new ControlMessage(type, kind, pid, correlationId, (JsonObject) payload);
    }

    /**
     * The correlation id of a raw envelope, or null, for replying to a message
     * that cannot be decoded.
     */
    public static String peekCorrelationId(JsonObject json) {
        if (json == null) {
            return null;
        }
        Object value = json.getValue(CORRELATION_ID);
        return value instanceof String ? (String) value : null;
    }

    private static String requireString(JsonObject json, String key) throws ControlException {
        String value = optionalString(json, key);
        if (value == null) {
            throw ControlException.malformed("missing '" + key + "'");
        }
        return value;
    }

    private static String optionalString(JsonObject json, String key) throws ControlException {
        Object value = json.getValue(key);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw ControlException.malformed("'" + key + "' must be a string");
    }
}
