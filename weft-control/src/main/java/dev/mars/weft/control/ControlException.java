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

import dev.mars.weft.core.exceptions.WeftException;

import java.util.Objects;

/**
 * A control-plane failure: an error reply from the remote side, an undeliverable
 * message or a message that cannot be decoded.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class ControlException extends WeftException {

    private final ControlErrorCode errorCode;

    public ControlException(ControlErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "Error code cannot be null");
    }

    public ControlException(ControlErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "Error code cannot be null");
    }

    public ControlErrorCode getErrorCode() {
        return errorCode;
    }

    // ==================== Factory Methods ====================

    /**
     * Creates an exception whose message is the code's template filled with the arguments.
     */
    public static ControlException of(ControlErrorCode code, Object... args) {
        return new ControlException(code, code.formatMessage(args));
    }

    public static ControlException malformed(String detail) {
        return of(ControlErrorCode.MALFORMED_MESSAGE, detail);
    }

    public static ControlException internal(Throwable cause) {
        return new ControlException(ControlErrorCode.INTERNAL_ERROR,
                ControlErrorCode.INTERNAL_ERROR.formatMessage(cause.getMessage()), cause);
    }
}
