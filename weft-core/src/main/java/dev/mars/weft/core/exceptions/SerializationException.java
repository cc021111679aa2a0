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

package dev.mars.weft.core.exceptions;

/**
 * Thrown when a process attribute cannot be represented in a bundle.
 * The path names the offending attribute, for example {@code outputs.result.handle}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class SerializationException extends PersistenceException {

    private final String path;

    public SerializationException(String path, String message) {
        super(String.format("Cannot serialize '%s': %s", path, message));
        this.path = path;
    }

    public SerializationException(String path, String message, Throwable cause) {
        super(String.format("Cannot serialize '%s': %s", path, message), cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
