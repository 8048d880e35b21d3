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

import dev.mars.cyclus.cycling.CyclePoint;
import dev.mars.cyclus.cycling.CycleSequence;
import dev.mars.cyclus.cycling.CyclingSupport;
import dev.mars.cyclus.expression.ExpressionCompiler;
import dev.mars.cyclus.expression.ExpressionNode;
import dev.mars.cyclus.expression.ExpressionSyntaxException;
import dev.mars.cyclus.workflow.CompilerConfig;
import dev.mars.cyclus.workflow.GraphSemanticException;
import dev.mars.cyclus.workflow.GraphSyntaxException;
import dev.mars.cyclus.workflow.WorkflowParseException;
import dev.mars.cyclus.workflow.definition.WorkflowDefinition;
import dev.mars.cyclus.workflow.graph.GraphSyntax;
import dev.mars.cyclus.workflow.graph.ParsedGraph;
import dev.mars.cyclus.workflow.graph.TriggerSpec;
import dev.mars.cyclus.workflow.task.Dependency;
import dev.mars.cyclus.workflow.task.TaskDef;
import dev.mars.cyclus.workflow.task.TaskOutputNames;
import dev.mars.cyclus.workflow.task.TaskOutputRegistry;
import dev.mars.cyclus.workflow.task.TaskTrigger;
import dev.mars.cyclus.workflow.task.WorkflowPollingReference;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Turns parsed graph sections into task definitions, shared task triggers
 * and dependencies.
 *
 * <p>One compiler serves a whole workflow: task definitions and the trigger
 * table accumulate across sections, so a trigger referenced from several
 * sections or expressions is one object.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class TriggerCompiler {

    private static final Logger logger = Logger.getLogger(TriggerCompiler.class.getName());

    static final String WALL_CLOCK = "wall_clock";

    private static final Pattern QUALIFIER_SUFFIX = Pattern.compile(":[\\w\\-]+$");

    private final WorkflowDefinition definition;
    private final CyclingSupport cycling;
    private final CompilerConfig config;
    private final CyclePoint initialPoint;
    private final GraphNodeParser nodeParser;

    private final Map<String, TaskDef> taskDefs = new LinkedHashMap<>();
    private final Map<TaskTrigger.Key, TaskTrigger> triggerTable = new LinkedHashMap<>();
    private final Map<CycleSequence, Set<GraphEdge>> edges = new LinkedHashMap<>();
    private final Set<String> implicitTasks = new LinkedHashSet<>();
    private final Map<String, WorkflowPollingReference> pollingReferences = new LinkedHashMap<>();

    /**
     * @param initialPoint the initial cycle point, or {@code null} if the workflow has none
     */
    public TriggerCompiler(WorkflowDefinition definition, CyclingSupport cycling, CompilerConfig config,
                           CyclePoint initialPoint) {
        this.definition = Objects.requireNonNull(definition, "Workflow definition cannot be null");
        this.cycling = Objects.requireNonNull(cycling, "Cycling support cannot be null");
        this.config = Objects.requireNonNull(config, "Compiler config cannot be null");
        this.initialPoint = initialPoint;
        this.nodeParser = new GraphNodeParser(cycling);
    }

    /**
     * Adds one parsed section, applied on {@code sequence}.
     *
     * @param fieldPath configuration path of the section, for messages
     */
    public void process(ParsedGraph graph, CycleSequence sequence, String fieldPath) throws WorkflowParseException {
        pollingReferences.putAll(graph.pollingReferences());
        for (Map.Entry<String, Map<String, TriggerSpec>> entry : graph.triggers().entrySet()) {
            String right = entry.getKey();
            for (Map.Entry<String, TriggerSpec> expressions : entry.getValue().entrySet()) {
                String expression = expressions.getKey();
                TriggerSpec spec = expressions.getValue();
                generateEdges(expression, right, spec, sequence, fieldPath);
                generateTaskDefs(right, spec, sequence, fieldPath);
                generateTriggers(expression, right, spec, sequence, fieldPath);
            }
        }
        logger.fine(() -> "Processed " + graph.triggers().size() + " node(s) on " + sequence.getExpression()
                + (fieldPath == null ? "" : " from " + fieldPath));
    }

    private void generateEdges(String expression, String right, TriggerSpec spec, CycleSequence sequence,
                               String fieldPath) throws WorkflowParseException {
        Set<GraphEdge> sequenceEdges = edges.computeIfAbsent(sequence, s -> new LinkedHashSet<>());
        boolean conditional = expression.contains(GraphSyntax.OP_OR);
        if (spec.triggers().isEmpty()) {
            sequenceEdges.add(new GraphEdge(null, right, spec.suicide(), conditional));
            return;
        }
        for (String left : spec.triggers()) {
            if (left.startsWith(GraphSyntax.ACTION)) {
                continue;
            }
            NodeReference node = parseNode(left, fieldPath);
            if (node.name().equals(right)) {
                if (spec.suicide()) {
                    continue;
                }
                throw new GraphSemanticException(config.getWorkflowName(), fieldPath,
                        "self-edge detected: " + left + " => " + right);
            }
            String leftNode = QUALIFIER_SUFFIX.matcher(left).replaceFirst("");
            sequenceEdges.add(new GraphEdge(leftNode, right, spec.suicide(), conditional));
        }
    }

    private void generateTaskDefs(String right, TriggerSpec spec, CycleSequence sequence, String fieldPath)
            throws GraphSyntaxException {
        List<String> nodes = new ArrayList<>(spec.triggers());
        nodes.add(right);
        for (String node : nodes) {
            if (node.isEmpty() || node.startsWith(GraphSyntax.ACTION)) {
                continue;
            }
            NodeReference reference = parseNode(node, fieldPath);
            TaskDef taskDef = getTaskDef(reference.name());

            WorkflowPollingReference polling = pollingReferences.get(reference.name());
            if (polling != null) {
                taskDef.setPollingReference(polling);
            }

            if (reference.hasOffset()) {
                taskDef.setUsedInOffsetTrigger(true);
            } else if (node.equals(right) && spec.suicide()) {
                // A suicide rule never makes the task a member of the sequence.
                continue;
            } else {
                taskDef.addSequence(sequence);
            }
        }
    }

    private void generateTriggers(String expression, String right, TriggerSpec spec, CycleSequence sequence,
                                  String fieldPath) throws WorkflowParseException {
        if (spec.triggers().isEmpty()) {
            return;
        }
        ExpressionNode<String> tree;
        try {
            tree = ExpressionCompiler.forGraph().compile(expression);
        } catch (ExpressionSyntaxException e) {
            throw new GraphSyntaxException(config.getWorkflowName(), fieldPath,
                    "Error in expression \"" + expression + "\": " + e.getMessage(), e);
        }

        TaskDef downstream = getTaskDef(right);
        Map<String, TaskTrigger> resolved = new LinkedHashMap<>();
        for (String left : spec.triggers()) {
            if (left.startsWith(GraphSyntax.ACTION)) {
                String label = left.substring(1);
                if (!WALL_CLOCK.equals(label)
                        && !definition.getScheduling().getXtriggers().containsKey(label)) {
                    throw new GraphSemanticException(config.getWorkflowName(), fieldPath,
                            "xtrigger not defined: " + label);
                }
                downstream.addXtriggerLabel(label, sequence);
                continue;
            }
            NodeReference node = parseNode(left, fieldPath);
            TaskDef upstream = getTaskDef(node.name());
            String output = resolveOutput(upstream, node, fieldPath);
            TaskTrigger candidate = new TaskTrigger(node.name(), node.offset(), output,
                    node.irregular(), node.absolute(), node.fromInitialPoint(), initialPoint, cycling);
            TaskTrigger trigger = triggerTable.computeIfAbsent(candidate.getKey(), k -> candidate);
            resolved.put(left, trigger);
            upstream.addGraphChild(trigger, right, sequence);
            downstream.addGraphParent(trigger, node.name(), sequence);
        }

        ExpressionNode<String> pruned = pruneActions(tree);
        if (pruned == null) {
            return;
        }
        ExpressionNode<TaskTrigger> bound = pruned.map(resolved::get);
        Dependency dependency = new Dependency(bound, new LinkedHashSet<>(resolved.values()), spec.suicide());
        downstream.addDependency(dependency, sequence);
    }

    /**
     * The output a trigger waits for: the message of a custom output, or a standard output name.
     */
    private String resolveOutput(TaskDef upstream, NodeReference node, String fieldPath)
            throws GraphSemanticException {
        String qualifier = node.output() == null ? TaskOutputNames.SUCCEEDED : node.output();
        TaskOutputRegistry outputs = upstream.getOutputs();
        if (outputs.contains(qualifier)) {
            return outputs.getMessage(qualifier);
        }
        String standard = TaskOutputNames.standardise(qualifier);
        if (!TaskOutputNames.isStandard(standard)) {
            throw new GraphSemanticException(config.getWorkflowName(), fieldPath,
                    "Undefined custom output: " + node.name() + ":" + qualifier);
        }
        return standard;
    }

    /**
     * Removes xtrigger leaves; groups left with one child collapse to it.
     * Returns {@code null} if nothing is left.
     */
    private static ExpressionNode<String> pruneActions(ExpressionNode<String> node) {
        if (node instanceof ExpressionNode.Leaf) {
            return ((ExpressionNode.Leaf<String>) node).value().startsWith(GraphSyntax.ACTION) ? null : node;
        }
        boolean and = node instanceof ExpressionNode.And;
        List<ExpressionNode<String>> children = and
                ? ((ExpressionNode.And<String>) node).children()
                : ((ExpressionNode.Or<String>) node).children();
        List<ExpressionNode<String>> kept = new ArrayList<>();
        for (ExpressionNode<String> child : children) {
            ExpressionNode<String> prunedChild = pruneActions(child);
            if (prunedChild != null) {
                kept.add(prunedChild);
            }
        }
        if (kept.isEmpty()) {
            return null;
        }
        if (kept.size() == 1) {
            return kept.get(0);
        }
        return and ? new ExpressionNode.And<>(kept) : new ExpressionNode.Or<>(kept);
    }

    /**
     * The task definition for {@code name}, created on first reference.
     */
    TaskDef getTaskDef(String name) {
        TaskDef existing = taskDefs.get(name);
        if (existing != null) {
            return existing;
        }
        if (definition.getNamespace(name) == null) {
            implicitTasks.add(name);
            logger.fine(() -> "Implicit task (not defined in runtime): " + name);
        }
        TaskDef taskDef = new TaskDef(name, initialPoint, initialPoint);
        definition.getEffectiveOutputs(name).forEach((output, message) -> taskDef.getOutputs().add(output, message));
        taskDefs.put(name, taskDef);
        return taskDef;
    }

    private NodeReference parseNode(String node, String fieldPath) throws GraphSyntaxException {
        try {
            return nodeParser.parse(node);
        } catch (IllegalArgumentException e) {
            throw new GraphSyntaxException(config.getWorkflowName(), fieldPath, e.getMessage(), e);
        }
    }

    public Map<String, TaskDef> getTaskDefs() {
        return Collections.unmodifiableMap(taskDefs);
    }

    public Collection<TaskTrigger> getTriggerTable() {
        return Collections.unmodifiableCollection(triggerTable.values());
    }

    public Map<CycleSequence, Set<GraphEdge>> getEdges() {
        return Collections.unmodifiableMap(edges);
    }

    public Set<String> getImplicitTasks() {
        return Collections.unmodifiableSet(implicitTasks);
    }

    public Map<String, WorkflowPollingReference> getPollingReferences() {
        return Collections.unmodifiableMap(pollingReferences);
    }
}
