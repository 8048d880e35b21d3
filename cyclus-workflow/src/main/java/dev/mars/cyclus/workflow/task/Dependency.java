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

package dev.mars.cyclus.workflow.task;

import dev.mars.cyclus.cycling.CyclePoint;
import dev.mars.cyclus.expression.ExpressionNode;
import dev.mars.cyclus.workflow.runtime.Prerequisite;
import dev.mars.cyclus.workflow.runtime.PrerequisiteKey;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One graph rule in abstract form: a boolean expression of shared
 * {@link TaskTrigger}s that implies a downstream task, plus a suicide flag.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class Dependency {

    private final ExpressionNode<TaskTrigger> expression;
    private final Set<TaskTrigger> taskTriggers;
    private final boolean suicide;

    public Dependency(ExpressionNode<TaskTrigger> expression, Set<TaskTrigger> taskTriggers, boolean suicide) {
        this.expression = Objects.requireNonNull(expression, "Expression cannot be null");
        this.taskTriggers = Collections.unmodifiableSet(new LinkedHashSet<>(taskTriggers));
        this.suicide = suicide;
    }

    public ExpressionNode<TaskTrigger> getExpression() {
        return expression;
    }

    public Set<TaskTrigger> getTaskTriggers() {
        return taskTriggers;
    }

    public boolean isSuicide() {
        return suicide;
    }

    /**
     * Builds the prerequisite of the dependent task at {@code point}.
     *
     * <p>Outputs whose point falls before the task's start point, while
     * {@code point} itself does not, are pre-initial and start satisfied.
     * Offsets that reach into the future update
     * {@link TaskDef#getMaxFuturePrereqOffset()}.
     */
    public Prerequisite getPrerequisite(CyclePoint point, TaskDef taskDef) {
        Prerequisite prerequisite = new Prerequisite(point);
        CyclePoint startPoint = taskDef.getStartPoint();
        for (TaskTrigger trigger : taskTriggers) {
            CyclePoint triggerPoint = trigger.getPoint(point);
            boolean preInitial = false;
            if (trigger.getCyclePointOffset() != null) {
                if (triggerPoint.compareTo(point) > 0) {
                    taskDef.updateMaxFuturePrereqOffset(triggerPoint.intervalSince(point));
                }
                preInitial = startPoint != null
                        && triggerPoint.compareTo(startPoint) < 0
                        && point.compareTo(startPoint) >= 0;
            }
            prerequisite.add(trigger.getTaskName(), triggerPoint.getValue(), trigger.getOutput(), preInitial);
        }
        prerequisite.setCondition(bind(point));
        return prerequisite;
    }

    /**
     * The expression with every trigger resolved to its concrete output at {@code point}.
     */
    public ExpressionNode<PrerequisiteKey> bind(CyclePoint point) {
        return expression.map(trigger ->
                new PrerequisiteKey(trigger.getTaskName(), trigger.getPoint(point).getValue(), trigger.getOutput()));
    }

    /**
     * The expression at {@code point} as text, e.g. {@code foo.1 succeeded & bar.0 x}.
     */
    public String getExpression(CyclePoint point) {
        return bind(point).render(PrerequisiteKey::toString, " & ", " | ");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Dependency that = (Dependency) o;
        return suicide == that.suicide && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, suicide);
    }

    @Override
    public String toString() {
        return (suicide ? "!" : "") + expression.render(TaskTrigger::toString, " & ", " | ");
    }
}
