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
 * Raised by the {@link ProcessLauncher} for a task it cannot honour.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class TaskRejectedException extends ControlException {

    public TaskRejectedException(String reason) {
        super(ControlErrorCode.TASK_REJECTED, ControlErrorCode.TASK_REJECTED.formatMessage(reason));
    }

    public TaskRejectedException(String reason, Throwable cause) {
        super(ControlErrorCode.TASK_REJECTED, ControlErrorCode.TASK_REJECTED.formatMessage(reason), cause);
    }
}
