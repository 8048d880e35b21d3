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

package dev.mars.cyclus.workflow.runtime;

import dev.mars.cyclus.cycling.CyclePoint;
import dev.mars.cyclus.expression.ExpressionNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The concrete, cycle-point-resolved form of one graph dependency for one
 * task instance.
 *
 * <p>Leaves are registered with {@link #add} and combined by the condition
 * set with {@link #setCondition}. With no condition all leaves must be
 * satisfied. The overall result is cached and the cache is refreshed only
 * when a leaf referenced by this prerequisite changes.
 *
 * <p>Instances belong to a single task instance and are not thread safe.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class Prerequisite {

    private final CyclePoint point;
    private final Map<PrerequisiteKey, SatisfactionState> satisfied = new LinkedHashMap<>();
    private final List<String> targetPointStrings = new ArrayList<>();
    private ExpressionNode<PrerequisiteKey> condition;
    private Boolean allSatisfied;

    public Prerequisite(CyclePoint point) {
        this.point = point;
    }

    public CyclePoint getPoint() {
        return point;
    }

    /**
     * Registers an upstream output. Pre-initial outputs start satisfied.
     */
    public void add(String name, String pointValue, String output, boolean preInitial) {
        PrerequisiteKey key = new PrerequisiteKey(name, pointValue, output);
        satisfied.put(key, preInitial ? SatisfactionState.SATISFIED_NATURALLY : SatisfactionState.UNSATISFIED);
        allSatisfied = null;
        if (!targetPointStrings.contains(pointValue)) {
            targetPointStrings.add(pointValue);
        }
    }

    public void add(String name, String pointValue, String output) {
        add(name, pointValue, output, false);
    }

    /**
     * Sets the boolean condition over the registered leaves.
     */
    public void setCondition(ExpressionNode<PrerequisiteKey> condition) {
        for (PrerequisiteKey key : condition.leaves()) {
            if (!satisfied.containsKey(key)) {
                throw new IllegalArgumentException("Condition refers to unregistered output: " + key);
            }
        }
        this.condition = condition;
        this.allSatisfied = null;
    }

    public ExpressionNode<PrerequisiteKey> getCondition() {
        return condition;
    }

    public boolean isSatisfied() {
        if (allSatisfied == null) {
            allSatisfied = evaluate();
        }
        return allSatisfied;
    }

    private boolean evaluate() {
        if (satisfied.isEmpty()) {
            return true;
        }
        if (condition == null) {
            for (SatisfactionState state : satisfied.values()) {
                if (!state.isSatisfied()) {
                    return false;
                }
            }
            return true;
        }
        return condition.evaluate(key -> satisfied.get(key).isSatisfied());
    }

    /**
     * Marks every registered leaf found in {@code outputs} as satisfied and
     * returns those leaves.
     */
    public Set<PrerequisiteKey> satisfyMe(Collection<PrerequisiteKey> outputs) {
        Set<PrerequisiteKey> relevant = new LinkedHashSet<>();
        for (PrerequisiteKey key : outputs) {
            if (satisfied.containsKey(key)) {
                satisfied.put(key, SatisfactionState.SATISFIED_NATURALLY);
                relevant.add(key);
            }
        }
        if (!relevant.isEmpty()) {
            allSatisfied = evaluate();
        }
        return relevant;
    }

    /**
     * Satisfies a single leaf. Returns true if the leaf belongs to this
     * prerequisite and was not already satisfied naturally.
     */
    public boolean satisfy(PrerequisiteKey key) {
        SatisfactionState previous = satisfied.get(key);
        if (previous == null || previous == SatisfactionState.SATISFIED_NATURALLY) {
            return false;
        }
        satisfied.put(key, SatisfactionState.SATISFIED_NATURALLY);
        allSatisfied = evaluate();
        return true;
    }

    /**
     * Forces every unsatisfied leaf into the force-satisfied state.
     */
    public void setSatisfied() {
        satisfied.replaceAll((key, state) -> state.isSatisfied() ? state : SatisfactionState.FORCE_SATISFIED);
        allSatisfied = evaluate();
    }

    /**
     * Resets every leaf to unsatisfied.
     */
    public void setNotSatisfied() {
        satisfied.replaceAll((key, state) -> SatisfactionState.UNSATISFIED);
        allSatisfied = evaluate();
    }

    public SatisfactionState getState(PrerequisiteKey key) {
        return satisfied.get(key);
    }

    public Set<PrerequisiteKey> getKeys() {
        return Collections.unmodifiableSet(satisfied.keySet());
    }

    public List<String> getTargetPointStrings() {
        return Collections.unmodifiableList(targetPointStrings);
    }

    /**
     * Task identifiers ({@code name.point}) of leaves satisfied naturally.
     */
    public List<String> getResolvedDependencies() {
        List<String> resolved = new ArrayList<>();
        for (Map.Entry<PrerequisiteKey, SatisfactionState> entry : satisfied.entrySet()) {
            if (entry.getValue() == SatisfactionState.SATISFIED_NATURALLY) {
                resolved.add(entry.getKey().getTaskId());
            }
        }
        return resolved;
    }

    /**
     * The condition as text, e.g. {@code foo.1 succeeded | bar.1 failed},
     * or {@code null} if there is no condition.
     */
    public String getConditionalExpression() {
        if (condition == null) {
            return null;
        }
        return condition.render(PrerequisiteKey::toString, " & ", " | ");
    }

    /**
     * One line per leaf in sorted order, {@code "foo.1 succeeded: satisfied naturally"},
     * preceded by the condition and overall result when there is one.
     */
    public List<String> dump() {
        List<String> lines = new ArrayList<>();
        if (condition != null) {
            lines.add(getConditionalExpression() + ": " + isSatisfied());
        }
        for (Map.Entry<PrerequisiteKey, SatisfactionState> entry : new TreeMap<>(satisfied).entrySet()) {
            lines.add(entry.getKey() + ": " + entry.getValue().getDescription());
        }
        return lines;
    }

    @Override
    public String toString() {
        return "Prerequisite{point=" + (point == null ? null : point.getValue())
                + ", satisfied=" + isSatisfied() + ", leaves=" + satisfied.size() + "}";
    }
}
