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
import dev.mars.weft.core.process.ProcessState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Portable, ordered snapshot of a process. Every value is a JSON-representable
 * type: null, string, number, boolean, list or string-keyed map.
 *
 * <pre>
 * {
 *   "type_id": "com.example.Doubler",
 *   "pid": "6a1f...",
 *   "label": "waiting",
 *   "inputs": {"x": 5},
 *   "outputs": {},
 *   "continuation": {"step": "collect"},
 *   "paused": false,
 *   "status": null,
 *   "ctime": 1767225600000
 * }
 * </pre>
 *
 * <p>Terminal bundles additionally carry {@code successful}, {@code exception}
 * or {@code kill_message}.</p>
 *
 * <p>A bundle is deeply immutable: nested maps and lists are copied on
 * construction and cannot be changed through the getters. A process rebuilt
 * from a bundle works on a {@link #mutableCopy(Map)} of its maps.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 * @version 1.0
 */
public final class Bundle {

    public static final String TYPE_ID = "type_id";
    public static final String PID = "pid";
    public static final String LABEL = "label";
    public static final String INPUTS = "inputs";
    public static final String OUTPUTS = "outputs";
    public static final String CONTINUATION = "continuation";
    public static final String PAUSED = "paused";
    public static final String STATUS = "status";
    public static final String CTIME = "ctime";
    public static final String SUCCESSFUL = "successful";
    public static final String EXCEPTION = "exception";
    public static final String KILL_MESSAGE = "kill_message";

    private final Map<String, Object> entries;

    Bundle(Map<String, Object> entries) {
        this.entries = frozenMap(entries);
    }

    /**
     * Wraps a decoded document, checking the mandatory entries.
     *
     * @throws ReconstructionException if an entry is missing or has the wrong type
     */
    public static Bundle fromMap(Map<String, Object> document) throws ReconstructionException {
        if (document == null) {
            throw new ReconstructionException("Bundle document cannot be null");
        }
        requireType(document, TYPE_ID, String.class);
        requireType(document, PID, String.class);
        requireType(document, LABEL, String.class);
        requireType(document, INPUTS, Map.class);
        requireType(document, OUTPUTS, Map.class);
        requireType(document, CONTINUATION, Map.class);
        try {
            ProcessState.fromValue((String) document.get(LABEL));
        } catch (IllegalArgumentException e) {
            throw new ReconstructionException("Bundle has unknown label '" + document.get(LABEL) + "'", e);
        }
        return new Bundle(document);
    }

    private static void requireType(Map<String, Object> document, String key, Class<?> type)
            throws ReconstructionException {
        Object value = document.get(key);
        if (!type.isInstance(value)) {
            throw new ReconstructionException(String.format("Bundle entry '%s' must be a %s but was %s",
                    key, type.getSimpleName(), value == null ? "missing" : value.getClass().getSimpleName()));
        }
    }

    public Map<String, Object> toMap() {
        return entries;
    }

    public Object get(String key) {
        return entries.get(key);
    }

    public String getTypeId() {
        return (String) entries.get(TYPE_ID);
    }

    public String getPid() {
        return (String) entries.get(PID);
    }

    public ProcessState getLabel() {
        return ProcessState.fromValue((String) entries.get(LABEL));
    }

    public Map<String, Object> getInputs() {
        return asMap(entries.get(INPUTS));
    }

    public Map<String, Object> getOutputs() {
        return asMap(entries.get(OUTPUTS));
    }

    public Map<String, Object> getContinuation() {
        return asMap(entries.get(CONTINUATION));
    }

    public boolean isPaused() {
        return Boolean.TRUE.equals(entries.get(PAUSED));
    }

    public String getStatus() {
        Object status = entries.get(STATUS);
        return status == null ? null : status.toString();
    }

    public Instant getCreationTime() {
        Object ctime = entries.get(CTIME);
        return ctime instanceof Number ? Instant.ofEpochMilli(((Number) ctime).longValue()) : null;
    }

    public boolean isSuccessful() {
        return !Boolean.FALSE.equals(entries.get(SUCCESSFUL));
    }

    public String getExceptionText() {
        Object text = entries.get(EXCEPTION);
        return text == null ? null : text.toString();
    }

    public String getKillMessage() {
        Object message = entries.get(KILL_MESSAGE);
        return message == null ? null : message.toString();
    }

    /**
     * Deep copy of a bundle map that the caller may change freely.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> mutableCopy(Map<String, Object> map) {
        return (Map<String, Object>) copy(map, false);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> frozenMap(Map<String, Object> map) {
        return (Map<String, Object>) copy(map, true);
    }

    private static Object copy(Object value, boolean frozen) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), copy(entry.getValue(), frozen));
            }
            return frozen ? Collections.unmodifiableMap(copy) : copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(copy(element, frozen));
            }
            return frozen ? Collections.unmodifiableList(copy) : copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : Collections.emptyMap();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Bundle)) {
            return false;
        }
        return entries.equals(((Bundle) o).entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries);
    }

    @Override
    public String toString() {
        return "Bundle{" +
                "typeId='" + getTypeId() + '\'' +
                ", pid='" + getPid() + '\'' +
                ", label=" + entries.get(LABEL) +
                '}';
    }
}
