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

package dev.mars.weft.core.statemachine;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable table of the labels a state machine may move between.
 *
 * <p>A label with no outgoing edges is terminal. The table also names the
 * initial label, the only label a machine without a current state may enter.</p>
 *
 * <pre>{@code
 * TransitionTable<Light> table = TransitionTable.builder(Light.class, Light.RED)
 *         .allow(Light.RED, Light.GREEN)
 *         .allow(Light.GREEN, Light.AMBER)
 *         .allow(Light.AMBER, Light.RED)
 *         .build();
 * }</pre>
 *
 * @param <L> the label enum
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class TransitionTable<L extends Enum<L>> {

    private final Class<L> labelType;
    private final L initialLabel;
    private final Map<L, Set<L>> allowed;

    private TransitionTable(Builder<L> builder) {
        this.labelType = builder.labelType;
        this.initialLabel = builder.initialLabel;
        Map<L, Set<L>> copy = new EnumMap<>(labelType);
        for (L label : labelType.getEnumConstants()) {
            Set<L> targets = builder.allowed.get(label);
            copy.put(label, targets == null
                    ? Collections.unmodifiableSet(EnumSet.noneOf(labelType))
                    : Collections.unmodifiableSet(EnumSet.copyOf(targets)));
        }
        this.allowed = Collections.unmodifiableMap(copy);
    }

    public static <L extends Enum<L>> Builder<L> builder(Class<L> labelType, L initialLabel) {
        return new Builder<>(labelType, initialLabel);
    }

    public Class<L> getLabelType() {
        return labelType;
    }

    public L getInitialLabel() {
        return initialLabel;
    }

    /**
     * Checks whether a move from one label to another is in the table.
     *
     * @param from the source label
     * @param to   the target label
     * @return true if the edge exists
     */
    public boolean isAllowed(L from, L to) {
        Objects.requireNonNull(from, "Source label cannot be null");
        Objects.requireNonNull(to, "Target label cannot be null");
        return allowed.get(from).contains(to);
    }

    public Set<L> allowedFrom(L from) {
        Objects.requireNonNull(from, "Source label cannot be null");
        return allowed.get(from);
    }

    public boolean isTerminal(L label) {
        return allowedFrom(label).isEmpty();
    }

    public Set<L> getLabels() {
        return Collections.unmodifiableSet(EnumSet.allOf(labelType));
    }

    @Override
    public String toString() {
        return "TransitionTable{" +
                "labelType=" + labelType.getSimpleName() +
                ", initialLabel=" + initialLabel +
                ", allowed=" + allowed +
                '}';
    }

    public static final class Builder<L extends Enum<L>> {
        private final Class<L> labelType;
        private final L initialLabel;
        private final Map<L, Set<L>> allowed;

        private Builder(Class<L> labelType, L initialLabel) {
            this.labelType = Objects.requireNonNull(labelType, "Label type cannot be null");
            this.initialLabel = Objects.requireNonNull(initialLabel, "Initial label cannot be null");
            this.allowed = new EnumMap<>(labelType);
        }

        @SafeVarargs
        public final Builder<L> allow(L from, L... targets) {
            Objects.requireNonNull(from, "Source label cannot be null");
            Set<L> set = allowed.computeIfAbsent(from, k -> EnumSet.noneOf(labelType));
            for (L target : targets) {
                set.add(Objects.requireNonNull(target, "Target label cannot be null"));
            }
            return this;
        }

        public TransitionTable<L> build() {
            return new TransitionTable<>(this);
        }
    }
}
