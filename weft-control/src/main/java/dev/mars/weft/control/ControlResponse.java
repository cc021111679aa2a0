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

/**
 * Reply to a control RPC.
 *
 * <p>Example JSON output:</p>
 * <pre>{@code
 * { "correlation_id": "5b1e...", "status": "ok", "result": true }
 * { "correlation_id": "5b1e...", "status": "error",
 *   "error_detail": { "code": "UNKNOWN_INTENT", "message": "Unknown intent 'resume'" } }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public record ControlResponse(
    String correlationId,
    String status,
    Object result,
    ControlErrorCode errorCode,
    String errorMessage
) {
    public static final String CORRELATION_ID = "correlation_id";
    public static final String STATUS = "status";
    public static final String RESULT = "result";
    public static final String ERROR_DETAIL = "error_detail";
    public static final String CODE = "code";
    public static final String MESSAGE = "message";

    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";

    public static ControlResponse ok(String correlationId, Object result) {
        return new ControlResponse(correlationId, STATUS_OK, result, null, null);
    }

    public static ControlResponse error(String correlationId, ControlErrorCode code, String message) {
        return new ControlResponse(correlationId, STATUS_ERROR, null, code, message);
    }

    /**
     * Creates an error reply from a failure, keeping the code of a {@link ControlException}.
     */
    public static ControlResponse error(String correlationId, Throwable cause) {
        if (cause instanceof ControlException) {
            return error(correlationId, ((ControlException) cause).getErrorCode(), cause.getMessage());
        }
        return error(correlationId, ControlErrorCode.INTERNAL_ERROR,
            ControlErrorCode.INTERNAL_ERROR.formatMessage(cause.getMessage()));
    }

    public boolean isOk() {
        return STATUS_OK.equals(status);
    }

    /**
     * The result of a successful reply, or a failed future carrying a
     * {@link ControlException} for an error reply.
     */
    public Future<Object> toFuture() {
        if (isOk()) {
            return Future.succeededFuture(result);
        }
        return Future.failedFuture(new ControlException(errorCode, errorMessage));
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put(CORRELATION_ID, correlationId)
            .put(STATUS, status);
        if (isOk()) {
            return json.put(RESULT, result);
        }
        return json.put(ERROR_DETAIL, new JsonObject()
            .put(CODE, errorCode.code())
            .put(MESSAGE, errorMessage));
    }

    /**
     * @throws ControlException with {@link ControlErrorCode#MALFORMED_MESSAGE} if the
     *                          reply is not a valid response
     */
    public static ControlResponse fromJson(JsonObject json) throws ControlException {
        if (json == null) {
            throw ControlException.malformed("empty reply");
        }
        Object correlationId = json.getValue(CORRELATION_ID);
        if (correlationId != null && !(correlationId instanceof String)) {
            throw ControlException.malformed("'" + CORRELATION_ID + "' must be a string");
        }
        Object status = json.getValue(STATUS);
        if (STATUS_OK.equals(status)) {
            return ok((String) correlationId, json.getValue(RESULT));
        }
        if (!STATUS_ERROR.equals(status)) {
            throw ControlException.malformed("reply status must be '" + STATUS_OK + "' or '" + STATUS_ERROR + "'");
        }
        Object detail = json.getValue(ERROR_DETAIL);
        if (!(detail instanceof JsonObject)) {
            throw ControlException.malformed("error reply without '" + ERROR_DETAIL + "'");
        }
        JsonObject errorDetail = (JsonObject) detail;
        Object code = errorDetail.getValue(CODE);
        ControlErrorCode errorCode = code instanceof String
            ? ControlErrorCode.fromCode((String) code).orElse(ControlErrorCode.INTERNAL_ERROR)
            : ControlErrorCode.INTERNAL_ERROR;
        Object message = errorDetail.getValue(MESSAGE);
        return error((String) correlationId, errorCode, message == null ? null : message.toString());
    }
}
