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

package dev.mars.weft.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates outline predicates with the boolean-like conversion rules of {@link Condition}.
 */
final class Predicates {

    private static final Logger logger = LoggerFactory.getLogger(Predicates.class);

    private Predicates() {
    }

    static boolean isTrue(WorkflowProcess process, String name, Condition condition) throws Exception {
        Object value = condition.evaluate();
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        logger.warn("Process<{}>: predicate '{}' returned {} ({}), which is not boolean-like",
                process.getPid(), name, value, value.getClass().getSimpleName());
        throw new PredicateTypeMismatchException(name, value);
    }
}
