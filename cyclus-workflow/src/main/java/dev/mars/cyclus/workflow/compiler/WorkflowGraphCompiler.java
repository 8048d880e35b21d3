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
import dev.mars.cyclus.expression.BooleanExpression;
import dev.mars.cyclus.expression.ExpressionSyntaxException;
import dev.mars.cyclus.workflow.CompilerConfig;
import dev.mars.cyclus.workflow.GraphSemanticException;
import dev.mars.cyclus.workflow.WorkflowParseException;
import dev.mars.cyclus.workflow.completion.CompletionExpressionBuilder;
import dev.mars.cyclus.workflow.completion.CompletionExpressionValidator;
import dev.mars.cyclus.workflow.definition.WorkflowDefinition;
import dev.mars.cyclus.workflow.graph.GraphParameterExpander;
import dev.mars.cyclus.workflow.graph.GraphParser;
import dev.mars.cyclus.workflow.graph.OutputOptionality;
import dev.mars.cyclus.workflow.graph.ParameterExpander;
import dev.mars.cyclus.workflow.graph.ParsedGraph;
import dev.mars.cyclus.workflow.observability.GraphCompilerMetrics;
import dev.mars.cyclus.workflow.task.OutputRequirement;
import dev.mars.cyclus.workflow.task.TaskDef;
import dev.mars.cyclus.workflow.task.TaskOutputNames;
import dev.mars.cyclus.workflow.task.TaskOutputRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Compiles the graph of a workflow definition into its task definitions.
 *
 * <p>Each graph section is parsed and compiled against every sequence its
 * key names. Once all sections are in, output optionality is applied to
 * the task definitions and each task gets its completion expression, either
 * from runtime configuration or derived from the optionality of its outputs.
 *
 * <p>A compile either returns a complete {@link CompiledWorkflow} or throws;
 * nothing built by a failed compile is reachable afterwards.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class WorkflowGraphCompiler {

    private static final Logger logger = Logger.getLogger(WorkflowGraphCompiler.class.getName());

    /** Commas that separate sequences, not those inside parentheses. */
    private static final Pattern SEQUENCE_SEPARATOR = Pattern.compile("(?![^(]+\\)),");

    private final CyclingSupport cycling;
    private final CompilerConfig config;

    public WorkflowGraphCompiler(CyclingSupport cycling, CompilerConfig config) {
        this.cycling = Objects.requireNonNull(cycling, "Cycling support cannot be null");
        this.config = Objects.requireNonNull(config, "Compiler config cannot be null");
    }

    public WorkflowGraphCompiler(CyclingSupport cycling) {
        this(cycling, CompilerConfig.defaults());
    }

    public CompiledWorkflow compile(WorkflowDefinition definition) throws WorkflowParseException {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        CompilerConfig workflowConfig = config.withWorkflowName(definition.getName());
        GraphCompilerMetrics metrics = workflowConfig.isMetricsEnabled() ? GraphCompilerMetrics.getInstance() : null;
        Instant startTime = Instant.now();

        logger.info("Compiling workflow graph: " + definition.getName());
        if (metrics != null) {
            metrics.recordCompileStarted(definition.getName());
        }

        try {
            CompiledWorkflow compiled = doCompile(definition, workflowConfig);
            Duration duration = Duration.between(startTime, Instant.now());
            logger.info("Compiled workflow " + definition.getName() + ": "
                    + compiled.getTaskDefs().size() + " task(s), "
                    + compiled.getSequences().size() + " sequence(s), "
                    + compiled.getTriggerTable().size() + " trigger(s) in " + duration.toMillis() + "ms");
            if (metrics != null) {
                metrics.recordCompileSucceeded(definition.getName(), duration.toNanos() / 1_000_000_000.0,
                        compiled.getTaskDefs().size(), compiled.getTriggerTable().size());
            }
            return compiled;
        } catch (WorkflowParseException | RuntimeException e) {
            logger.log(Level.SEVERE, "Workflow graph compilation failed: " + definition.getName()
                    + " - " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Compilation exception details for: " + definition.getName(), e);
            }
            if (metrics != null) {
                metrics.recordCompileFailed(definition.getName(), e.getClass().getSimpleName());
            }
            throw e;
        }
    }

    private CompiledWorkflow doCompile(WorkflowDefinition definition, CompilerConfig workflowConfig)
            throws WorkflowParseException {
        String workflowName = workflowConfig.getWorkflowName();
        WorkflowDefinition.SchedulingConfig scheduling = definition.getScheduling();
        String icp = scheduling.getInitialCyclePoint();
        String fcp = scheduling.getFinalCyclePoint();
        CyclePoint initialPoint = icp == null ? null : cycling.getPoint(icp);

        Map<String, List<String>> familyMap = definition.getFamilyMap();
        ParameterExpander expander = definition.getParameters().isEmpty()
                ? ParameterExpander.NONE
                : new GraphParameterExpander(definition.getParameters().getValues(),
                        definition.getParameters().getTemplates(), workflowConfig.getMaxExpandedLines());
        OutputOptionality optionality = new OutputOptionality(workflowConfig);
        TriggerCompiler triggerCompiler = new TriggerCompiler(definition, cycling, workflowConfig, initialPoint);
        List<CycleSequence> sequences = new ArrayList<>();

        for (Map.Entry<String, String> section : scheduling.getGraph().entrySet()) {
            String fieldPath = "scheduling.graph." + section.getKey();
            String key = substitutePoints(section.getKey(), icp, fcp, workflowName, fieldPath);
            GraphParser parser = new GraphParser(familyMap, expander, optionality, workflowConfig, fieldPath);
            ParsedGraph parsed = parser.parse(section.getValue());

            for (String expression : SEQUENCE_SEPARATOR.split(key)) {
                CycleSequence sequence = getSequence(expression.trim(), icp, fcp, workflowName, fieldPath);
                sequences.add(sequence);
                triggerCompiler.process(parsed, sequence, fieldPath);
            }
        }

        Map<String, TaskDef> taskDefs = triggerCompiler.getTaskDefs();
        for (String label : scheduling.getXtriggers().keySet()) {
            if (taskDefs.containsKey(label)) {
                throw new GraphSemanticException(workflowName, "scheduling.xtriggers." + label,
                        "task and @xtrigger names clash: " + label);
            }
        }

        applyOptionality(optionality, taskDefs, workflowName);
        CompletionExpressionValidator validator = new CompletionExpressionValidator(workflowConfig);
        for (TaskDef taskDef : taskDefs.values()) {
            setImplicitSucceeded(taskDef.getOutputs());
            setCompletion(taskDef, definition.getEffectiveCompletion(taskDef.getName()), validator, workflowName);
        }

        if (!triggerCompiler.getImplicitTasks().isEmpty()) {
            logger.fine(() -> "Implicit tasks in " + workflowName + ": " + triggerCompiler.getImplicitTasks());
        }
        return new CompiledWorkflow(workflowName, triggerCompiler, sequences, optionality);
    }

    private static String substitutePoints(String key, String icp, String fcp, String workflowName,
                                           String fieldPath) throws GraphSemanticException {
        String result = key;
        if (result.contains("^")) {
            if (icp == null) {
                throw new GraphSemanticException(workflowName, fieldPath,
                        "Initial cycle point referenced (^) but not defined.");
            }
            result = result.replace("^", icp);
        }
        if (result.contains("$")) {
            if (fcp == null) {
                throw new GraphSemanticException(workflowName, fieldPath,
                        "Final cycle point referenced ($) but not defined.");
            }
            result = result.replace("$", fcp);
        }
        return result;
    }

    private CycleSequence getSequence(String expression, String icp, String fcp, String workflowName,
                                      String fieldPath) throws GraphSemanticException {
        try {
            return cycling.getSequence(expression, icp, fcp);
        } catch (IllegalArgumentException e) {
            throw new GraphSemanticException(workflowName, fieldPath,
                    "Cannot process recurrence " + expression
                            + " (initial cycle point=" + icp + ")"
                            + " (final cycle point=" + fcp + ")", e);
        }
    }

    /**
     * Writes graph optionality into the output registries. Plain task
     * references win over family references for the same output.
     */
    private static void applyOptionality(OutputOptionality optionality, Map<String, TaskDef> taskDefs,
                                         String workflowName) throws GraphSemanticException {
        for (Map.Entry<OutputOptionality.OutputKey, Boolean> entry : optionality.getTaskOutputs().entrySet()) {
            setRequirement(taskDefs, entry.getKey(), entry.getValue(), workflowName);
        }
        Map<OutputOptionality.OutputKey, Boolean> taskOutputs = optionality.getTaskOutputs();
        for (Map.Entry<OutputOptionality.OutputKey, Boolean> entry : optionality.getMemberOutputs().entrySet()) {
            if (!taskOutputs.containsKey(entry.getKey())) {
                setRequirement(taskDefs, entry.getKey(), entry.getValue(), workflowName);
            }
        }
    }

    private static void setRequirement(Map<String, TaskDef> taskDefs, OutputOptionality.OutputKey key,
                                       boolean optional, String workflowName) throws GraphSemanticException {
        TaskDef taskDef = taskDefs.get(key.taskName());
        if (taskDef == null) {
            return;
        }
        TaskOutputRegistry outputs = taskDef.getOutputs();
        if (!outputs.contains(key.output())) {
            throw new GraphSemanticException(workflowName, "scheduling.graph",
                    "Undefined custom output: " + key.taskName() + ":" + key.output());
        }
        outputs.setRequirement(key.output(), optional ? OutputRequirement.OPTIONAL : OutputRequirement.REQUIRED);
    }

    /**
     * A task the graph says nothing about either way must succeed.
     */
    private static void setImplicitSucceeded(TaskOutputRegistry outputs) {
        if (outputs.getRequirement(TaskOutputNames.SUCCEEDED) == OutputRequirement.UNSET
                && outputs.getRequirement(TaskOutputNames.FAILED) == OutputRequirement.UNSET) {
            outputs.setRequirement(TaskOutputNames.SUCCEEDED, OutputRequirement.REQUIRED);
        }
    }

    private static void setCompletion(TaskDef taskDef, String explicit, CompletionExpressionValidator validator,
                                      String workflowName) throws GraphSemanticException {
        if (explicit != null && !explicit.isBlank()) {
            BooleanExpression compiled = validator.validate(taskDef.getName(), explicit, taskDef.getOutputs());
            taskDef.setExplicitCompletion(explicit);
            taskDef.setCompletion(compiled);
            return;
        }
        String expression = CompletionExpressionBuilder.build(taskDef.getOutputs());
        try {
            taskDef.setCompletion(BooleanExpression.compile(expression));
        } catch (ExpressionSyntaxException e) {
            throw new GraphSemanticException(workflowName, "runtime." + taskDef.getName() + ".completion",
                    "Error in completion expression \"" + expression + "\": " + e.getMessage(), e);
        }
        logger.fine(() -> "Completion expression for " + taskDef.getName() + ": " + expression);
    }
}
