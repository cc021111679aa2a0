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

import dev.mars.weft.core.persistence.Persister;

import java.util.Objects;
import java.util.Optional;

/**
 * Host collaborators shared by the processes of one host: the scheduler, the
 * process registry, and the optional checkpoint store, control binding and
 * spec validator.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class ProcessEnvironment {

    private final Scheduler scheduler;
    private final ProcessRegistry registry;
    private final Persister persister;
    private final ControlBinding controlBinding;
    private final ProcessSpecValidator validator;

    private ProcessEnvironment(Builder builder) {
        this.scheduler = Objects.requireNonNull(builder.scheduler, "Scheduler cannot be null");
        this.registry = builder.registry != null ? builder.registry : new ProcessRegistry();
        this.persister = builder.persister;
        this.controlBinding = builder.controlBinding;
        this.validator = builder.validator != null ? builder.validator : ProcessSpecValidator.ACCEPT_ALL;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public ProcessRegistry getRegistry() {
        return registry;
    }

    public Optional<Persister> getPersister() {
        return Optional.ofNullable(persister);
    }

    public Optional<ControlBinding> getControlBinding() {
        return Optional.ofNullable(controlBinding);
    }

    public ProcessSpecValidator getValidator() {
        return validator;
    }

    /**
     * Copy of this environment with a different validator, for process types
     * that declare their own input/output spec.
     */
    public ProcessEnvironment withValidator(ProcessSpecValidator validator) {
        return toBuilder().validator(validator).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .scheduler(scheduler)
                .registry(registry)
                .persister(persister)
                .controlBinding(controlBinding)
                .validator(validator);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Scheduler scheduler;
        private ProcessRegistry registry;
        private Persister persister;
        private ControlBinding controlBinding;
        private ProcessSpecValidator validator;

        public Builder scheduler(Scheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder registry(ProcessRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder persister(Persister persister) {
            this.persister = persister;
            return this;
        }

        public Builder controlBinding(ControlBinding controlBinding) {
            this.controlBinding = controlBinding;
            return this;
        }

        public Builder validator(ProcessSpecValidator validator) {
            this.validator = validator;
            return this;
        }

        public ProcessEnvironment build() {
            return new ProcessEnvironment(this);
        }
    }
}
