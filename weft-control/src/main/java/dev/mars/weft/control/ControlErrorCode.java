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

import java.util.Arrays;
import java.util.Optional;

/**
 * Error codes carried by error replies on the control plane.
 *
 * <p>The string code travels in the {@code error_detail} of a
 * {@link ControlResponse} and is mapped back to the enum by the controller.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public enum ControlErrorCode {

    // ==================== Addressing Errors ====================

    /** No live process answers for the pid */
    UNKNOWN_PROCESS("UNKNOWN_PROCESS", "Process '%s' is not reachable"),

    /** Nothing is subscribed at the address */
    NO_RECIPIENT("NO_RECIPIENT", "No subscriber at address '%s'"),

    // ==================== Message Errors ====================

    /** The envelope could not be decoded */
    MALFORMED_MESSAGE("MALFORMED_MESSAGE", "Malformed control message: %s"),

    /** The envelope names an intent the receiver does not handle */
    UNKNOWN_INTENT("UNKNOWN_INTENT", "Unknown intent '%s'"),

    // ==================== Task Errors ====================

    /** The launcher cannot honour the task */
    TASK_REJECTED("TASK_REJECTED", "Task rejected: %s"),

    /** The checkpoint to continue from cannot be loaded */
    CHECKPOINT_UNAVAILABLE("CHECKPOINT_UNAVAILABLE", "Cannot load checkpoint of process '%s': %s"),

    /** A launched or continued process excepted or was killed */
    PROCESS_FAILED("PROCESS_FAILED", "Process '%s' did not finish: %s"),

    // ==================== Transport Errors ====================

    /** No reply arrived within the RPC timeout */
    TIMEOUT("TIMEOUT", "No reply from '%s' within %d ms"),

    /** Unexpected failure on either side */
    INTERNAL_ERROR("INTERNAL_ERROR", "Internal error: %s");

    private final String code;
    private final String messageTemplate;

    ControlErrorCode(String code, String messageTemplate) {
        this.code = code;
        this.messageTemplate = messageTemplate;
    }

    public String code() {
        return code;
    }

    /**
     * Returns the message template (may contain %s placeholders).
     */
    public String messageTemplate() {
        return messageTemplate;
    }

    public String formatMessage(Object... args) {
        return String.format(messageTemplate, args);
    }

    /**
     * Looks up a ControlErrorCode by its string code.
     */
    public static Optional<ControlErrorCode> fromCode(String code) {
        return Arrays.stream(values())
                .filter(e -> e.code.equals(code))
                .findFirst();
    }
}
