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

/**
 * No reply arrived within the RPC timeout. Distinct from an error reply: the
 * command may or may not have been applied.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class ControlTimeoutException extends ControlException {

    private final String address;
    private final long timeoutMs;

    public ControlTimeoutException(String address, long timeoutMs) {
        super(ControlErrorCode.TIMEOUT, ControlErrorCode.TIMEOUT.formatMessage(address, timeoutMs));
        this.address = address;
        this.timeoutMs = timeoutMs;
    }

    public String getAddress() {
        return address;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
