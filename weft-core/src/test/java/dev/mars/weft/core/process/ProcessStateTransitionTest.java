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

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parameterized tests for ProcessState transition validation.
 * Covers every (source, target) pair to ensure complete transition map coverage.
 */
class ProcessStateTransitionTest {

    // --- Valid transition map ---

    private static final EnumSet<ProcessState> FROM_CREATED =
            EnumSet.of(ProcessState.RUNNING, ProcessState.KILLED, ProcessState.EXCEPTED);

    private static final EnumSet<ProcessState> FROM_RUNNING =
            EnumSet.of(ProcessState.RUNNING, ProcessState.WAITING, ProcessState.FINISHED,
                       ProcessState.KILLED, ProcessState.EXCEPTED);

    private static final EnumSet<ProcessState> FROM_WAITING =
            EnumSet.of(ProcessState.RUNNING, ProcessState.WAITING, ProcessState.FINISHED,
                       ProcessState.KILLED, ProcessState.EXCEPTED);

    private static final EnumSet<ProcessState> NONE = EnumSet.noneOf(ProcessState.class);

    private static EnumSet<ProcessState> validTargets(ProcessState from) {
        return switch (from) {
            case CREATED -> FROM_CREATED;
            case RUNNING -> FROM_RUNNING;
            case WAITING -> FROM_WAITING;
            case FINISHED, EXCEPTED, KILLED -> NONE;
        };
    }

    static Stream<Arguments> allProcessStatePairs() {
        List<Arguments> pairs = new ArrayList<>();
        for (ProcessState from : ProcessState.values()) {
            Set<ProcessState> valid = validTargets(from);
            for (ProcessState to : ProcessState.values()) {
                pairs.add(Arguments.of(from, to, valid.contains(to)));
            }
        }
        return pairs.stream();
    }

    static Stream<ProcessState> allProcessStates() {
        return Arrays.stream(ProcessState.values());
    }

    @ParameterizedTest(name = "{0} → {1} should be {2}")
    @MethodSource("allProcessStatePairs")
    void canTransitionTo_coversAllPairs(ProcessState from, ProcessState to, boolean expected) {
        assertEquals(expected, from.canTransitionTo(to),
                () -> String.format("%s → %s should be %s", from, to, expected ? "valid" : "invalid"));
    }

    @ParameterizedTest(name = "terminal flag consistent for {0}")
    @MethodSource("allProcessStates")
    void terminalFlag_matchesTransitionTable(ProcessState state) {
        assertEquals(state.isTerminal(), ProcessState.TRANSITIONS.isTerminal(state));
        assertEquals(state.isTerminal(), state.getValidTransitions().isEmpty());
    }

    @ParameterizedTest(name = "wire value round trip for {0}")
    @MethodSource("allProcessStates")
    void fromValue_acceptsWireValue(ProcessState state) {
        assertEquals(state, ProcessState.fromValue(state.getValue()));
        assertEquals(state.name().toLowerCase(), state.getValue());
    }
}
