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

import dev.mars.weft.core.exceptions.InvalidTransitionException;
import dev.mars.weft.core.exceptions.TransitionFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Finite state machine with guarded transitions, lifecycle hooks, a history
 * of entered labels and failure capture.
 *
 * <p>Exactly one state is current once the machine is initialised. A
 * transition validates the target against the {@link TransitionTable}, exits
 * the current state, enters the new one and records its label. Any exception
 * raised along the way is captured as the machine's failure and handed to
 * {@link #transitionFailed}, whose default is to rethrow it as a
 * {@link TransitionFailedException}.</p>
 *
 * <p>Machines are single writer: a transition may not begin while another one
 * is in progress. The one exception is the transition started by
 * {@link #transitionFailed}, which skips exiting the state whose transition failed.</p>
 *
 * @param <L> the label enum
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public abstract class StateMachine<L extends Enum<L>> {

    private static final Logger logger = LoggerFactory.getLogger(StateMachine.class);

    private final TransitionTable<L> transitionTable;
    private final Map<StateEventHook, List<StateEventCallback<L>>> eventCallbacks =
            new EnumMap<>(StateEventHook.class);
    private final List<L> history = new ArrayList<>();

    private State<L> state;
    private boolean transitioning;
    private boolean transitionFailing;
    private Throwable failure;

    protected StateMachine(TransitionTable<L> transitionTable) {
        this.transitionTable = Objects.requireNonNull(transitionTable, "Transition table cannot be null");
    }

    /**
     * Enters the initial state.
     *
     * @throws IllegalStateException if the machine already has a state
     */
    public void initialize() {
        if (state != null) {
            throw new IllegalStateException(getMachineId() + " is already initialised in state " + state.getLabel());
        }
        transitionTo(createInitialState());
    }

    /**
     * Creates the state entered by {@link #initialize()}. Its label must be
     * the initial label of the transition table.
     */
    protected abstract State<L> createInitialState();

    // ==================== Accessors ====================

    public TransitionTable<L> getTransitionTable() {
        return transitionTable;
    }

    public State<L> getState() {
        return state;
    }

    /**
     * @return the current label, or null before {@link #initialize()}
     */
    public L getStateLabel() {
        return state == null ? null : state.getLabel();
    }

    public boolean isTerminated() {
        return state != null && state.isTerminal();
    }

    public List<L> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /**
     * @return the exception captured by the last failed transition, or null
     */
    public Throwable getFailure() {
        return failure;
    }

    protected boolean isTransitioning() {
        return transitioning;
    }

    /**
     * Identifier used in logs and in transition errors.
     */
    protected String getMachineId() {
        return getClass().getSimpleName();
    }

    // ==================== Event callbacks ====================

    public void addStateEventCallback(StateEventHook hook, StateEventCallback<L> callback) {
        Objects.requireNonNull(hook, "Hook cannot be null");
        Objects.requireNonNull(callback, "Callback cannot be null");
        eventCallbacks.computeIfAbsent(hook, h -> new ArrayList<>()).add(callback);
    }

    /**
     * @throws IllegalArgumentException if the callback is not registered for the hook
     */
    public void removeStateEventCallback(StateEventHook hook, StateEventCallback<L> callback) {
        List<StateEventCallback<L>> callbacks = eventCallbacks.get(hook);
        if (callbacks == null || !callbacks.remove(callback)) {
            throw new IllegalArgumentException("Callback not set for hook '" + hook + "'");
        }
    }

    protected void clearStateEventCallbacks() {
        eventCallbacks.clear();
    }

    // ==================== Transitions ====================

    /**
     * Moves the machine to {@code newState}.
     *
     * @param newState the state to enter
     * @throws IllegalStateException     if called while a transition is in progress
     * @throws TransitionFailedException if the transition failed and the failure policy rethrew it
     */
    public final void transitionTo(State<L> newState) {
        Objects.requireNonNull(newState, "Target state cannot be null");
        if (transitioning) {
            throw new IllegalStateException(
                    "Cannot transition " + getMachineId() + " to " + newState.getLabel() + " while already transitioning");
        }

        L initialLabel = getStateLabel();
        L targetLabel = newState.getLabel();
        try {
            transitioning = true;

            if (!transitionFailing) {
                exitCurrentState(newState);
            }

            try {
                enterNextState(newState);
            } catch (StateEntryFailedException e) {
                State<L> redirected = redirectTarget(e);
                targetLabel = redirected.getLabel();
                logger.debug("{}: entry of {} redirected to {}: {}",
                        getMachineId(), newState.getLabel(), targetLabel, e.getMessage());
                checkAllowed(redirected);
                enterNextState(redirected);
            }

            if (state != null && state.isTerminal()) {
                onTerminated();
            }
        } catch (Exception e) {
            transitioning = false;
            failure = e;
            if (transitionFailing) {
                if (e instanceof RuntimeException) {
                    throw (RuntimeException) e;
                }
                throw new TransitionFailedException(initialLabel, targetLabel, e);
            }
            transitionFailing = true;
            logger.debug("{}: transition {} → {} failed: {}", getMachineId(), initialLabel, targetLabel, e.toString());
            transitionFailed(initialLabel, targetLabel, e);
        } finally {
            transitionFailing = false;
            transitioning = false;
        }
    }

    /**
     * Failure policy, called when a transition raised. The default rethrows.
     *
     * @param initialLabel the label before the failed transition, null if uninitialised
     * @param targetLabel  the label that was being entered
     * @param cause        the captured failure
     */
    protected void transitionFailed(L initialLabel, L targetLabel, Exception cause) {
        throw new TransitionFailedException(initialLabel, targetLabel, cause);
    }

    /**
     * Installs a state without validation or hooks. Used when rebuilding a
     * machine from a checkpoint.
     */
    protected void restoreState(State<L> restored) {
        Objects.requireNonNull(restored, "Restored state cannot be null");
        if (state != null) {
            throw new IllegalStateException(getMachineId() + " already has state " + state.getLabel());
        }
        this.state = restored;
        history.add(restored.getLabel());
    }

    // ==================== Template hooks ====================

    protected void onEntering(State<L> nextState) throws Exception {
    }

    protected void onEntered(State<L> previousState) throws Exception {
    }

    protected void onExiting(State<L> nextState) throws Exception {
    }

    /** Called once a terminal state has been entered. */
    protected void onTerminated() {
    }

    // ==================== Internals ====================

    private void exitCurrentState(State<L> next) throws Exception {
        checkAllowed(next);
        if (state == null) {
            return;
        }
        fireStateEvent(StateEventHook.EXITING_STATE, next);
        onExiting(next);
        state.exit();
    }

    private void checkAllowed(State<L> next) throws InvalidTransitionException {
        if (next.getMachine() != this) {
            throw new IllegalArgumentException("State " + next + " belongs to another machine");
        }
        if (state == null) {
            if (next.getLabel() != transitionTable.getInitialLabel()) {
                throw new InvalidTransitionException(getMachineId(), null, next.getLabel(),
                        Set.of(transitionTable.getInitialLabel()));
            }
            return;
        }
        if (!transitionTable.isAllowed(state.getLabel(), next.getLabel())) {
            throw new InvalidTransitionException(getMachineId(), state.getLabel(), next.getLabel(),
                    transitionTable.allowedFrom(state.getLabel()));
        }
    }

    private void enterNextState(State<L> next) throws Exception {
        State<L> last = state;
        fireStateEvent(StateEventHook.ENTERING_STATE, next);
        onEntering(next);
        next.enter();
        state = next;
        history.add(next.getLabel());
        onEntered(last);
        fireStateEvent(StateEventHook.ENTERED_STATE, last);
    }

    private void fireStateEvent(StateEventHook hook, State<L> subject) throws Exception {
        List<StateEventCallback<L>> callbacks = eventCallbacks.get(hook);
        if (callbacks == null || callbacks.isEmpty()) {
            return;
        }
        for (StateEventCallback<L> callback : new ArrayList<>(callbacks)) {
            callback.onStateEvent(this, hook, subject);
        }
    }

    @SuppressWarnings("unchecked")
    private State<L> redirectTarget(StateEntryFailedException e) {
        State<?> redirected = e.getState();
        if (redirected.getMachine() != this) {
            throw new IllegalArgumentException("Redirect state " + redirected + " belongs to another machine");
        }
        return (State<L>) redirected;
    }

    @Override
    public String toString() {
        return getMachineId() + "{" +
                "state=" + getStateLabel() +
                '}';
    }
}
