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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An if/elif/else chain. Predicates are evaluated in order, once, when the
 * chain is entered; the body of the first that holds runs and the rest are
 * skipped. With no match and no else branch the chain does nothing.
 *
 * <p>Instances are immutable: {@link #elseIf} and {@link #otherwise} return new chains.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public final class If implements Instruction {

    /** Sentinel of a stepper whose branch has not been chosen yet. */
    private static final int UNCHOSEN = -1;

    private final List<Branch> branches;
    private final boolean sealed;

    public If(String predicateName, Condition condition, Block body) {
        this(List.of(new Branch("if", predicateName, condition, body)), false);
    }

    private If(List<Branch> branches, boolean sealed) {
        this.branches = List.copyOf(branches);
        this.sealed = sealed;
    }

    /**
     * Adds an elif branch.
     *
     * @throws IllegalStateException if the chain already ends with an else branch
     */
    public If elseIf(String predicateName, Condition condition, Instruction... body) {
        return append(new Branch("elif", predicateName, condition, Outline.block(body)));
    }

    /**
     * Closes the chain with an else branch.
     *
     * @throws IllegalStateException if the chain already ends with an else branch
     */
    public If otherwise(Instruction... body) {
        If chain = append(new Branch("else", null, () -> Boolean.TRUE, Outline.block(body)));
        return new If(chain.branches, true);
    }

    private If append(Branch branch) {
        if (sealed) {
            throw new IllegalStateException("Cannot add a branch after else");
        }
        List<Branch> extended = new ArrayList<>(branches);
        extended.add(branch);
        return new If(extended, false);
    }

    public List<Branch> getBranches() {
        return branches;
    }

    public boolean hasElse() {
        return sealed;
    }

    @Override
    public Stepper createStepper(WorkflowProcess process) {
        return new IfStepper(process, UNCHOSEN, null);
    }

    @Override
    public Stepper recreateStepper(Map<String, Object> cursor, WorkflowProcess process) {
        int branch = Cursors.intValue(cursor, Cursors.BRANCH, UNCHOSEN, branches.size());
        Stepper child = null;
        if (branch != UNCHOSEN && branch < branches.size()) {
            Map<String, Object> childCursor = Cursors.child(cursor);
            Block body = branches.get(branch).body();
            child = childCursor == null ? body.createStepper(process) : body.recreateStepper(childCursor, process);
        }
        return new IfStepper(process, branch, child);
    }

    @Override
    public Object getDescription() {
        Map<String, Object> description = new LinkedHashMap<>();
        for (Branch branch : branches) {
            description.put(branch.header(), branch.body().getDescription());
        }
        return description;
    }

    /**
     * One arm of the chain. The else arm has no predicate name.
     */
    public record Branch(String keyword, String predicateName, Condition condition, Block body) {

        public Branch {
            Objects.requireNonNull(keyword, "Keyword cannot be null");
            Objects.requireNonNull(condition, "Condition cannot be null");
            Objects.requireNonNull(body, "Body cannot be null");
        }

        public String header() {
            return predicateName == null ? keyword : keyword + "(" + predicateName + ")";
        }
    }

    private final class IfStepper implements Stepper {

        private final WorkflowProcess process;
        private int branch;
        private Stepper child;

        IfStepper(WorkflowProcess process, int branch, Stepper child) {
            this.process = process;
            this.branch = branch;
            this.child = child;
        }

        @Override
        public StepperResult step() throws Exception {
            if (branch == UNCHOSEN) {
                branch = choose();
                if (branch == branches.size()) {
                    return StepperResult.FINISHED;
                }
                child = branches.get(branch).body().createStepper(process);
            }
            if (branch == branches.size()) {
                return StepperResult.FINISHED;
            }
            StepperResult result = child.step();
            if (result.returned()) {
                return result;
            }
            if (result.finished()) {
                branch = branches.size();
                child = null;
                return StepperResult.FINISHED;
            }
            return StepperResult.CONTINUE;
        }

        private int choose() throws Exception {
            for (int i = 0; i < branches.size(); i++) {
                Branch candidate = branches.get(i);
                String name = candidate.predicateName() == null ? candidate.keyword() : candidate.predicateName();
                if (Predicates.isTrue(process, name, candidate.condition())) {
                    return i;
                }
            }
            return branches.size();
        }

        @Override
        public Map<String, Object> save() {
            Map<String, Object> cursor = new LinkedHashMap<>();
            cursor.put(Cursors.BRANCH, branch);
            if (child != null) {
                cursor.put(Cursors.CHILD, child.save());
            }
            return cursor;
        }
    }
}
