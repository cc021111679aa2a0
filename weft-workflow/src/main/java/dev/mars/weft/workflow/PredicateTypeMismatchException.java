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

import dev.mars.weft.core.exceptions.WeftException;

/**
 * Raised when a conditional or loop predicate returns a value that is not boolean-like.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public class PredicateTypeMismatchException extends WeftException {

    private final String predicateName;
    private final transient Object value;

    public PredicateTypeMismatchException(String predicateName, Object value) {
        super(String.format("Predicate '%s' returned %s of type %s, expected a boolean",
                predicateName, value, value.getClass().getName()));
        this.predicateName = predicateName;
        this.value = value;
    }

    public String getPredicateName() {
        return predicateName;
    }

    public Object getValue() {
        return value;
    }
}
