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
import dev.mars.weft.core.process.ProcessEnvironment;
import dev.mars.weft.core.process.ProcessFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TypeRegistry} keyed by explicit registrations, falling back to the
 * fully qualified class name.
 *
 * <p>A type id that was never registered is resolved by loading the class of
 * that name and using its public {@code (ProcessEnvironment, String, Map)}
 * constructor. Only public, concrete process classes qualify; anything else
 * must be registered.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 * @version 1.0
 */
public class DefaultTypeRegistry implements TypeRegistry {

    private static final Logger logger = LoggerFactory.getLogger(DefaultTypeRegistry.class);

    private final Map<String, ProcessFactory> factories = new ConcurrentHashMap<>();
    private final Map<Class<?>, String> typeIds = new ConcurrentHashMap<>();

    /**
     * Registers a process type under its class name.
     */
    public DefaultTypeRegistry register(Class<? extends Process> type, ProcessFactory factory) {
        return register(type.getName(), type, factory);
    }

    public DefaultTypeRegistry register(String typeId, Class<? extends Process> type, ProcessFactory factory) {
        Objects.requireNonNull(typeId, "Type id cannot be null");
        Objects.requireNonNull(type, "Type cannot be null");
        Objects.requireNonNull(factory, "Factory cannot be null");
        factories.put(typeId, factory);
        typeIds.put(type, typeId);
        logger.debug("Registered process type {} as '{}'", type.getName(), typeId);
        return this;
    }

    public boolean isRegistered(String typeId) {
        return factories.containsKey(typeId);
    }

    @Override
    public String typeIdOf(Process process) {
        String typeId = typeIds.get(process.getClass());
        return typeId != null ? typeId : process.getClass().getName();
    }

    @Override
    public ProcessFactory resolve(String typeId) throws ReconstructionException {
        Objects.requireNonNull(typeId, "Type id cannot be null");
        ProcessFactory factory = factories.get(typeId);
        if (factory != null) {
            return factory;
        }
        return reflectiveFactory(typeId);
    }

    private ProcessFactory reflectiveFactory(String typeId) throws ReconstructionException {
        Class<?> type;
        try {
            type = Class.forName(typeId, false, Thread.currentThread().getContextClassLoader());
        } catch (ClassNotFoundException e) {
            throw new ReconstructionException("Unknown process type '" + typeId + "'", e);
        }
        if (!Process.class.isAssignableFrom(type)) {
            throw new ReconstructionException("Type '" + typeId + "' is not a process");
        }
        int modifiers = type.getModifiers();
        if (!Modifier.isPublic(modifiers) || Modifier.isAbstract(modifiers)) {
            throw new ReconstructionException(
                    "Process type '" + typeId + "' is not a public concrete class and must be registered");
        }
        Constructor<?> constructor;
        try {
            constructor = type.getConstructor(ProcessEnvironment.class, String.class, Map.class);
        } catch (NoSuchMethodException e) {
            throw new ReconstructionException(
                    "Process type '" + typeId + "' has no public (ProcessEnvironment, String, Map) constructor", e);
        }
        logger.debug("Resolved unregistered process type '{}' by class name", typeId);
        return (environment, pid, inputs) -> {
            try {
                return (Process) constructor.newInstance(environment, pid, inputs);
            } catch (InvocationTargetException e) {
                throw new IllegalStateException("Constructor of '" + typeId + "' failed", e.getCause());
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Cannot instantiate '" + typeId + "'", e);
            }
        };
    }
}
