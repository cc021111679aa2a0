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

package dev.mars.weft.core.persistence;

import dev.mars.weft.core.exceptions.ReconstructionException;
import dev.mars.weft.core.process.Process;
import dev.mars.weft.core.process.ProcessFactory;

/**
 * Maps process types to the type ids stored in bundles and back to a
 * constructor.
 */
public interface TypeRegistry {

    String typeIdOf(Process process);

    /**
     * @throws ReconstructionException if no process type is known under the id
     */
    ProcessFactory resolve(String typeId) throws ReconstructionException;
}
