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

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between event bus JSON values and the plain maps and lists that
 * processes hold as inputs and outputs.
 */
final class JsonValues {

    private JsonValues() {
        // Utility class
    }

    static Map<String, Object> toMap(JsonObject json) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : json) {
            map.put(entry.getKey(), unwrap(entry.getValue()));
        }
        return map;
    }

    static JsonObject toJson(Map<String, Object> map) {
        return new JsonObject(map == null ? new LinkedHashMap<>() : new LinkedHashMap<>(map));
    }

    private static Object unwrap(Object value) {
        if (value instanceof JsonObject) {
            return toMap((JsonObject) value);
        }
        if (value instanceof JsonArray) {
            List<Object> list = new ArrayList<>();
            for (Object element : (JsonArray) value) {
                list.add(unwrap(element));
            }
            return list;
        }
        return value;
    }
}
