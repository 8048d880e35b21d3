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

import dev.mars.cyclus.cycling.CycleInterval;
import dev.mars.cyclus.cycling.CyclePoint;
import dev.mars.cyclus.cycling.CycleSequence;
import dev.mars.cyclus.expression.BooleanExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static definition of a task, independent of any cycle point.
 *
 * <p>Populated by the graph compiler and read-only afterwards, apart from
 * {@link #updateMaxFuturePrereqOffset}, which runtime prerequisite
 * resolution widens as it discovers future offsets.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class TaskDef {

    private final String name;
    private final TaskOutputRegistry outputs = new TaskOutputRegistry();
    private final Set<CycleSequence> sequences = new LinkedHashSet<>();
    private final Map<CycleSequence, List<Dependency>> dependencies = new LinkedHashMap<>();
    private final Map<CycleSequence, Map<String, List<GraphLink>>> graphChildren = new LinkedHashMap<>();
    private final Map<CycleSequence, Map<String, Set<GraphLink>>> graphParents = new LinkedHashMap<>();
    private final Map<CycleSequence, Set<String>> xtriggerLabels = new LinkedHashMap<>();

    private final CyclePoint initialPoint;
    private final CyclePoint startPoint;
    private boolean usedInOffsetTrigger;
    private WorkflowPollingReference pollingReference;
    private String explicitCompletion;
    private BooleanExpression completion;
    private CycleInterval maxFuturePrereqOffset;

    public TaskDef(String name, CyclePoint initialPoint, CyclePoint startPoint) {
        this.name = Objects.requireNonNull(name, "Task name cannot be null");
        this.initialPoint = initialPoint;
        this.startPoint = startPoint;
    }

    public String getName() {
        return name;
    }

    public TaskOutputRegistry getOutputs() {
        return outputs;
    }

    public CyclePoint getInitialPoint() {
        return initialPoint;
    }

    public CyclePoint getStartPoint() {
        return startPoint;
    }

    public void addSequence(CycleSequence sequence) {
        sequences.add(sequence);
    }

    public Set<CycleSequence> getSequences() {
        return Collections.unmodifiableSet(sequences);
    }

    public boolean isUsedInOffsetTrigger() {
        return usedInOffsetTrigger;
    }

    public void setUsedInOffsetTrigger(boolean usedInOffsetTrigger) {
        this.usedInOffsetTrigger = usedInOffsetTrigger;
    }

    public void addDependency(Dependency dependency, CycleSequence sequence) {
        dependencies.computeIfAbsent(sequence, s -> new ArrayList<>()).add(dependency);
    }

    public List<Dependency> getDependencies(CycleSequence sequence) {
        return Collections.unmodifiableList(dependencies.getOrDefault(sequence, List.of()));
    }

    public Map<CycleSequence, List<Dependency>> getDependencies() {
        return Collections.unmodifiableMap(dependencies);
    }

    /**
     * Records that {@code childName} depends on {@code trigger}, an output of this task.
     */
    public void addGraphChild(TaskTrigger trigger, String childName, CycleSequence sequence) {
        List<GraphLink> links = graphChildren
                .computeIfAbsent(sequence, s -> new LinkedHashMap<>())
                .computeIfAbsent(trigger.getOutput(), o -> new ArrayList<>());
        GraphLink link = new GraphLink(childName, trigger);
        if (!links.contains(link)) {
            links.add(link);
        }
    }

    /**
     * Records that this task depends on {@code trigger}, an output of {@code parentName}.
     */
    public void addGraphParent(TaskTrigger trigger, String parentName, CycleSequence sequence) {
        graphParents
                .computeIfAbsent(sequence, s -> new LinkedHashMap<>())
                .computeIfAbsent(trigger.getOutput(), o -> new LinkedHashSet<>())
                .add(new GraphLink(parentName, trigger));
    }

    /**
     * Children by sequence, then by the output of this task they wait for.
     */
    public Map<CycleSequence, Map<String, List<GraphLink>>> getGraphChildren() {
        return Collections.unmodifiableMap(graphChildren);
    }

    /**
     * Parents by sequence, then by the upstream output this task waits for.
     */
    public Map<CycleSequence, Map<String, Set<GraphLink>>> getGraphParents() {
        return Collections.unmodifiableMap(graphParents);
    }

    public void addXtriggerLabel(String label, CycleSequence sequence) {
        xtriggerLabels.computeIfAbsent(sequence, s -> new LinkedHashSet<>()).add(label);
    }

    public Map<CycleSequence, Set<String>> getXtriggerLabels() {
        return Collections.unmodifiableMap(xtriggerLabels);
    }

    public WorkflowPollingReference getPollingReference() {
        return pollingReference;
    }

    public void setPollingReference(WorkflowPollingReference pollingReference) {
        this.pollingReference = pollingReference;
    }

    /**
     * The completion expression from runtime configuration, or {@code null}.
     */
    public String getExplicitCompletion() {
        return explicitCompletion;
    }

    public void setExplicitCompletion(String explicitCompletion) {
        this.explicitCompletion = explicitCompletion;
    }

    public BooleanExpression getCompletion() {
        return completion;
    }

    public void setCompletion(BooleanExpression completion) {
        this.completion = completion;
    }

    public synchronized CycleInterval getMaxFuturePrereqOffset() {
        return maxFuturePrereqOffset;
    }

    public synchronized void updateMaxFuturePrereqOffset(CycleInterval offset) {
        if (maxFuturePrereqOffset == null || offset.compareTo(maxFuturePrereqOffset) > 0) {
            maxFuturePrereqOffset = offset;
        }
    }

    @Override
    public String toString() {
        return "TaskDef{" +
                "name='" + name + '\'' +
                ", sequences=" + sequences.size() +
                ", completion=" + completion +
                '}';
    }
}
