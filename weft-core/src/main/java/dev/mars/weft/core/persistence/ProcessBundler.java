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
import dev.mars.weft.core.exceptions.SerializationException;
import dev.mars.weft.core.process.Process;
import dev.mars.weft.core.process.ProcessEnvironment;
import dev.mars.weft.core.process.ProcessFactory;
import dev.mars.weft.core.process.ProcessState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts processes to and from {@link Bundle}s.
 *
 * <p>{@link #save(Process)} deep-copies the process attributes, rejecting any
 * value that a schemaless JSON document cannot hold. {@link #load(Bundle, ProcessEnvironment)}
 * resolves the type id, constructs the process and restores it in its saved
 * label; it either returns a complete process or throws. The rebuilt process
 * shares no mutable state with the bundle.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 * @version 1.0
 */
public class ProcessBundler {

    private static final Logger logger = LoggerFactory.getLogger(ProcessBundler.class);

    private final TypeRegistry typeRegistry;

    public ProcessBundler(TypeRegistry typeRegistry) {
        this.typeRegistry = Objects.requireNonNull(typeRegistry, "Type registry cannot be null");
    }

    public TypeRegistry getTypeRegistry() {
        return typeRegistry;
    }

    /**
     * Captures a snapshot of the process.
     *
     * @throws SerializationException if an attribute is not representable
     */
    public Bundle save(Process process) throws SerializationException {
        Objects.requireNonNull(process, "Process cannot be null");
        ProcessState label = process.getStateLabel();
        if (label == null) {
            throw new SerializationException(Bundle.LABEL, "Process<" + process.getPid() + "> is not initialised");
        }

        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put(Bundle.TYPE_ID, typeRegistry.typeIdOf(process));
        entries.put(Bundle.PID, process.getPid());
        entries.put(Bundle.LABEL, label.getValue());
        entries.put(Bundle.INPUTS, copyRepresentable(Bundle.INPUTS, process.getInputs()));
        entries.put(Bundle.OUTPUTS, copyRepresentable(Bundle.OUTPUTS, process.getOutputs()));
        entries.put(Bundle.CONTINUATION, copyRepresentable(Bundle.CONTINUATION, process.snapshotContinuation()));
        entries.put(Bundle.PAUSED, process.isPaused());
        entries.put(Bundle.STATUS, process.getStatus());
        entries.put(Bundle.CTIME, process.getCreationTime() == null ? null : process.getCreationTime().toEpochMilli());

        switch (label) {
            case FINISHED:
                entries.put(Bundle.SUCCESSFUL, process.isSuccessful());
                break;
            case EXCEPTED:
                Throwable exception = process.getException();
                entries.put(Bundle.EXCEPTION, exception.getClass().getName() + ": " + exception.getMessage());
                break;
            case KILLED:
                entries.put(Bundle.KILL_MESSAGE, process.getKillMessage());
                break;
            default:
                break;
        }

        logger.debug("Bundled Process<{}> in {}", process.getPid(), label);
        return new Bundle(entries);
    }

    /**
     * Rebuilds a process from a bundle.
     *
     * @param bundle      the snapshot
     * @param environment the host collaborators for the rebuilt process
     * @throws ReconstructionException if the type id is unknown or the bundle is malformed
     */
    public Process load(Bundle bundle, ProcessEnvironment environment) throws ReconstructionException {
        Objects.requireNonNull(bundle, "Bundle cannot be null");
        Objects.requireNonNull(environment, "Process environment cannot be null");
        Bundle checked = Bundle.fromMap(bundle.toMap());
        ProcessFactory factory = typeRegistry.resolve(checked.getTypeId());

        Process process = null;
        try {
            process = factory.create(environment, checked.getPid(), Bundle.mutableCopy(checked.getInputs()));
            process.restoreFrom(checked);
        } catch (RuntimeException e) {
            if (process != null) {
                environment.getRegistry().unregister(process);
            }
            throw new ReconstructionException("Cannot rebuild Process<" + checked.getPid() + "> of type '"
                    + checked.getTypeId() + "': " + e.getMessage(), e);
        }
        logger.debug("Loaded Process<{}> of type '{}' in {}", process.getPid(), checked.getTypeId(), process.getStateLabel());
        return process;
    }

    /**
     * Deep-copies a value, checking that every element is representable.
     *
     * <p>Numbers are stored in the form a JSON reader hands them back, so a
     * bundle reads the same from every store: whole numbers as the narrowest of
     * {@code Integer}, {@code Long} and {@code BigInteger}, and fractional
     * numbers as {@code Double}.</p>
     *
     * @param path the attribute path used in error messages
     * @throws SerializationException naming the path of the first unrepresentable value
     */
    public static Object copyRepresentable(String path, Object value) throws SerializationException {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number number) {
            return normalize(path, number);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw new SerializationException(path, "map key " + entry.getKey() + " is not a string");
                }
                String key = (String) entry.getKey();
                copy.put(key, copyRepresentable(path + "." + key, entry.getValue()));
            }
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            int index = 0;
            for (Object element : collection) {
                copy.add(copyRepresentable(path + "[" + index + "]", element));
                index++;
            }
            return copy;
        }
        throw new SerializationException(path, "value of type " + value.getClass().getName() + " is not representable");
    }

    private static Number normalize(String path, Number number) throws SerializationException {
        if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return number.intValue();
        }
        if (number instanceof Long) {
            long value = number.longValue();
            return value == (int) value ? Integer.valueOf((int) value) : Long.valueOf(value);
        }
        if (number instanceof BigInteger big) {
            return big.bitLength() < Long.SIZE ? normalize(path, big.longValue()) : big;
        }
        if (number instanceof Double) {
            return number;
        }
        if (number instanceof Float) {
            // Through the decimal text, so 0.1f is stored as 0.1
            return Double.valueOf(number.toString());
        }
        if (number instanceof BigDecimal) {
            return number.doubleValue();
        }
        throw new SerializationException(path, "number of type " + number.getClass().getName() + " is not representable");
    }
}
