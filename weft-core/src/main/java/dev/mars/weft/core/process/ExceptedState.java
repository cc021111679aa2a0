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

package dev.mars.weft.core.process;

import java.util.Objects;

/**
 * Terminal state carrying the exception that excepted the process.
 */
public class ExceptedState extends AbstractProcessState {

    private final Throwable exception;

    public ExceptedState(Process process, Throwable exception) {
        super(process, ProcessState.EXCEPTED);
        this.exception = Objects.requireNonNull(exception, "Exception cannot be null");
    }

    public Throwable getException() {
        return exception;
    }

    /**
     * @return the exception class and message, as stored in bundles
     */
    public String getExceptionText() {
        return exception.getClass().getName() + ": " + exception.getMessage();
    }
}
