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

import java.util.Map;

/**
 * Constructor of a process type. Used both for launching and for rebuilding
 * a process from its bundle.
 */
@FunctionalInterface
public interface ProcessFactory {

    /**
     * @param environment the host collaborators
     * @param pid         the pid to use, or null to generate one
     * @param inputs      the raw inputs
     * @return an uninitialised process
     */
    Process create(ProcessEnvironment environment, String pid, Map<String, Object> inputs);
}
