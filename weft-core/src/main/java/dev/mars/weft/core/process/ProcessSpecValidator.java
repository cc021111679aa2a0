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
import java.util.Optional;

/**
 * Validates the inputs of a process on creation and the outputs of a
 * successful finish. An empty result means valid.
 */
public interface ProcessSpecValidator {

    ProcessSpecValidator ACCEPT_ALL = new ProcessSpecValidator() {
        @Override
        public Optional<String> validateInputs(Map<String, Object> inputs) {
            return Optional.empty();
        }

        @Override
        public Optional<String> validateOutputs(Map<String, Object> outputs) {
            return Optional.empty();
        }
    };

    Optional<String> validateInputs(Map<String, Object> inputs);

    Optional<String> validateOutputs(Map<String, Object> outputs);

    /**
     * Validator that requires each of the given input names to be present.
     */
    static ProcessSpecValidator requiringInputs(String... names) {
        return new ProcessSpecValidator() {
            @Override
            public Optional<String> validateInputs(Map<String, Object> inputs) {
                for (String name : names) {
                    if (!inputs.containsKey(name)) {
                        return Optional.of("Missing required input '" + name + "'");
                    }
                }
                return Optional.empty();
            }

            @Override
            public Optional<String> validateOutputs(Map<String, Object> outputs) {
                return Optional.empty();
            }
        };
    }
}
