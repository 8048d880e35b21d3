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

package dev.mars.cyclus.workflow.compiler;

import dev.mars.cyclus.cycling.CycleSequence;
import dev.mars.cyclus.workflow.graph.OutputOptionality;
import dev.mars.cyclus.workflow.task.TaskDef;
import dev.mars.cyclus.workflow.task.TaskTrigger;
import dev.mars.cyclus.workflow.task.WorkflowPollingReference;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The static model of a workflow produced by {@link WorkflowGraphCompiler}.
 *
 * <p>Task definitions are complete: outputs carry their optionality and every
 * task has a completion expression. A reload compiles a new instance; nothing
 * here is updated incrementally.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class CompiledWorkflow {

    private final String name;
    private final Map<String, TaskDef> taskDefs;
    private final List<CycleSequence> sequences;
    private final Map<CycleSequence, Set<GraphEdge>> edges;
    private final Collection<TaskTrigger> triggerTable;
    private final Set<String> implicitTasks;
    private final Map<String, WorkflowPollingReference> pollingReferences;
    private final OutputOptionality outputOptionality;

    CompiledWorkflow(String name, TriggerCompiler compiler, List<CycleSequence> sequences,
                     OutputOptionality outputOptionality) {
        this.name = name;
        this.taskDefs = Collections.unmodifiableMap(new LinkedHashMap<>(compiler.getTaskDefs()));
        this.sequences = List.copyOf(sequences);
        Map<CycleSequence, Set<GraphEdge>> edgeCopy = new LinkedHashMap<>();
        compiler.getEdges().forEach((sequence, sequenceEdges) ->
                edgeCopy.put(sequence, Collections.unmodifiableSet(new LinkedHashSet<>(sequenceEdges))));
        this.edges = Collections.unmodifiableMap(edgeCopy);
        this.triggerTable = List.copyOf(compiler.getTriggerTable());
        this.implicitTasks = Collections.unmodifiableSet(new LinkedHashSet<>(compiler.getImplicitTasks()));
        this.pollingReferences = Collections.unmodifiableMap(new LinkedHashMap<>(compiler.getPollingReferences()));
        this.outputOptionality = outputOptionality;
    }

    public String getName() {
        return name;
    }

    public Map<String, TaskDef> getTaskDefs() {
        return taskDefs;
    }

    public TaskDef getTaskDef(String taskName) {
        return taskDefs.get(taskName);
    }

    public List<CycleSequence> getSequences() {
        return sequences;
    }

    public Map<CycleSequence, Set<GraphEdge>> getEdges() {
        return edges;
    }

    public Set<GraphEdge> getEdges(CycleSequence sequence) {
        return edges.getOrDefault(sequence, Set.of());
    }

    /**
     * Every distinct task trigger, each the instance shared by all dependencies that use it.
     */
    public Collection<TaskTrigger> getTriggerTable() {
        return triggerTable;
    }

    public Set<String> getImplicitTasks() {
        return implicitTasks;
    }

    public Map<String, WorkflowPollingReference> getPollingReferences() {
        return pollingReferences;
    }

    public OutputOptionality getOutputOptionality() {
        return outputOptionality;
    }

    @Override
    public String toString() {
        return "CompiledWorkflow{" +
                "name='" + name + '\'' +
                ", tasks=" + taskDefs.size() +
                ", sequences=" + sequences.size() +
                ", triggers=" + triggerTable.size() +
                '}';
    }
}
