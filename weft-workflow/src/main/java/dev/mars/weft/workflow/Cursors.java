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

import java.util.Map;

/**
 * Readers for the saved form of steppers.
 */
final class Cursors {

    static final String POSITION = "pos";
    static final String BRANCH = "branch";
    static final String CHILD = "child";
    static final String STEP = "step";

    private Cursors() {
    }

    static int intValue(Map<String, Object> cursor, String key, int min, int max) {
        Object value = cursor.get(key);
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Malformed outline cursor, '" + key + "' is missing: " + cursor);
        }
        int number = ((Number) value).intValue();
        if (number < min || number > max) {
            throw new IllegalArgumentException("Malformed outline cursor, '" + key + "' = " + number
                    + " is outside [" + min + ", " + max + "]");
        }
        return number;
    }

    static Map<String, Object> child(Map<String, Object> cursor) {
        return asMap(cursor.get(CHILD), CHILD);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asMap(Object value, String name) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Malformed outline cursor, '" + name + "' is not a map: " + value);
        }
        return (Map<String, Object>) value;
    }
}
