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

/**
 * Connects a live process to the remote-control surface. Implementations
 * subscribe the process to its control address when attached and publish
 * state-change broadcasts. Delivery problems must be logged, never thrown.
 */
public interface ControlBinding {

    void attach(Process process);

    void stateChanged(Process process, ProcessState from, ProcessState to);

    void detach(Process process);
}
