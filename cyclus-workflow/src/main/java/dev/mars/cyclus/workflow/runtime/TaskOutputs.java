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

import dev.mars.cyclus.expression.ExpressionNode;
import dev.mars.cyclus.workflow.task.TaskDef;
import dev.mars.cyclus.workflow.task.TaskOutputNames;
import dev.mars.cyclus.workflow.task.TaskOutputRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks which outputs of one task instance have been emitted and whether
 * the instance's completion condition is met.
 *
 * <p>Outputs are known by three names: the output name ({@code x}), the
 * message the job emits for it and the completion variable ({@code x} with
 * hyphens replaced by underscores).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class TaskOutputs {

    static final String FALLBACK_COMPLETION = "succeeded or failed or expired";

    private static final String DONE = "✓";
    private static final String NOT_DONE = "⨯";

    private final Map<String, String> outputToMessage = new LinkedHashMap<>();
    private final Map<String, String> messageToOutput = new LinkedHashMap<>();
    private final Map<String, String> variableToOutput = new LinkedHashMap<>();
    private final Map<String, Boolean> completed = new LinkedHashMap<>();
    private final TaskOutputRegistry registry;
    private ExpressionNode<String> completion;

    /**
     * @param taskDef the task definition, or {@code null} for a task with
     *        only standard outputs and the fallback completion condition
     */
    public TaskOutputs(TaskDef taskDef) {
        this.registry = taskDef == null ? new TaskOutputRegistry() : taskDef.getOutputs();
        for (String output : registry.getOutputNames()) {
            String message = registry.getMessage(output);
            outputToMessage.put(output, message);
            messageToOutput.put(message, output);
            variableToOutput.put(TaskOutputNames.toCompletionVariable(output), output);
            completed.put(message, false);
        }
        if (taskDef != null && taskDef.getCompletion() != null) {
            this.completion = taskDef.getCompletion().getTree();
        } else {
            this.completion = ExpressionNode.or(
                    ExpressionNode.leaf(TaskOutputNames.SUCCEEDED),
                    ExpressionNode.leaf(TaskOutputNames.FAILED),
                    ExpressionNode.leaf(TaskOutputNames.EXPIRED));
        }
    }

    /**
     * Replaces the completion condition, e.g. when a broadcast changes it.
     * Leaves are completion variables.
     */
    public void setCompletion(ExpressionNode<String> completion) {
        for (String variable : completion.leaves()) {
            if (!variableToOutput.containsKey(variable)) {
                throw new IllegalArgumentException("Unknown output in completion condition: " + variable);
            }
        }
        this.completion = completion;
    }

    public ExpressionNode<String> getCompletion() {
        return completion;
    }

    /**
     * Marks the output with the given message complete or incomplete.
     *
     * @return the output name, or {@code null} if the message is not an output of this task
     */
    public String setMessageComplete(String message, boolean value) {
        String output = messageToOutput.get(message);
        if (output == null) {
            return null;
        }
        completed.put(message, value);
        return output;
    }

    public String setMessageComplete(String message) {
        return setMessageComplete(message, true);
    }

    /**
     * Marks the output with the given trigger name complete or incomplete.
     */
    public boolean setTriggerComplete(String output, boolean value) {
        String message = outputToMessage.get(output);
        if (message == null) {
            return false;
        }
        completed.put(message, value);
        return true;
    }

    public boolean isMessageComplete(String message) {
        return Boolean.TRUE.equals(completed.get(message));
    }

    public boolean isOutputComplete(String output) {
        String message = outputToMessage.get(output);
        return message != null && isMessageComplete(message);
    }

    /**
     * True once the emitted outputs satisfy the completion condition.
     */
    public boolean isComplete() {
        return completion.evaluate(this::isVariableComplete);
    }

    private boolean isVariableComplete(String variable) {
        String output = variableToOutput.get(variable);
        return output != null && isOutputComplete(output);
    }

    /**
     * Messages of completed outputs, in standard output order.
     */
    public List<String> getCompletedMessages() {
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, String> entry : outputToMessage.entrySet()) {
            if (isMessageComplete(entry.getValue())) {
                result.add(entry.getValue());
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Required outputs not yet emitted. {@code submitted} counts as required
     * unless it or {@code submit-failed} is optional.
     */
    public List<String> getIncompleteRequired() {
        List<String> result = new ArrayList<>();
        for (String output : outputToMessage.keySet()) {
            boolean required = registry.isRequired(output);
            if (TaskOutputNames.SUBMITTED.equals(output)
                    && !registry.isOptional(TaskOutputNames.SUBMITTED)
                    && !registry.isOptional(TaskOutputNames.SUBMIT_FAILED)) {
                required = true;
            }
            if (required && !isOutputComplete(output)) {
                result.add(output);
            }
        }
        return result;
    }

    /**
     * Outputs implied by the completed ones but not recorded themselves:
     * a final state implies {@code submitted} and {@code started},
     * {@code started} implies {@code submitted}.
     */
    public List<String> getIncompleteImplied() {
        List<String> implied = new ArrayList<>();
        if (isOutputComplete(TaskOutputNames.SUCCEEDED) || isOutputComplete(TaskOutputNames.FAILED)) {
            implied.add(TaskOutputNames.SUBMITTED);
            implied.add(TaskOutputNames.STARTED);
        } else if (isOutputComplete(TaskOutputNames.STARTED)) {
            implied.add(TaskOutputNames.SUBMITTED);
        }
        implied.removeIf(this::isOutputComplete);
        return implied;
    }

    /**
     * Renders the completion condition one term per line, each prefixed by
     * a completion mark and a gutter.
     */
    public String formatCompletionStatus(int indent, int gutter) {
        List<String> lines = new ArrayList<>();
        format(completion, 0, "", true, indent, gutter, lines);
        return String.join("\n", lines);
    }

    private void format(ExpressionNode<String> node, int depth, String prefix, boolean root,
                        int indent, int gutter, List<String> lines) {
        if (node instanceof ExpressionNode.Leaf) {
            String variable = ((ExpressionNode.Leaf<String>) node).value();
            String mark = isVariableComplete(variable) ? DONE : NOT_DONE;
            lines.add(line(mark, depth, prefix + variable, indent, gutter));
            return;
        }
        List<ExpressionNode<String>> children;
        String operator;
        if (node instanceof ExpressionNode.And) {
            children = ((ExpressionNode.And<String>) node).children();
            operator = "and ";
        } else {
            children = ((ExpressionNode.Or<String>) node).children();
            operator = "or ";
        }
        boolean grouped = !root;
        int childDepth = depth;
        if (grouped) {
            lines.add(line(" ", depth, prefix + "(", indent, gutter));
            childDepth = depth + 1;
        }
        for (int i = 0; i < children.size(); i++) {
            format(children.get(i), childDepth, i == 0 ? "" : operator, false, indent, gutter, lines);
        }
        if (grouped) {
            lines.add(line(" ", depth, ")", indent, gutter));
        }
    }

    private static String line(String mark, int depth, String text, int indent, int gutter) {
        return mark + " ".repeat(Math.max(gutter - 1, 0)) + "┆"
                + " ".repeat(indent) + "  ".repeat(depth) + text;
    }

    @Override
    public String toString() {
        return "TaskOutputs{completed=" + getCompletedMessages() + ", complete=" + isComplete() + "}";
    }
}
