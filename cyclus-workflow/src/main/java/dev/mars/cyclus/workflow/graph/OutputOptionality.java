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

package dev.mars.cyclus.workflow.graph;

import dev.mars.cyclus.workflow.CompilerConfig;
import dev.mars.cyclus.workflow.GraphSemanticException;
import dev.mars.cyclus.workflow.task.TaskOutputNames;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Output optionality inferred from the graph, shared by all graph sections
 * of a workflow.
 *
 * <p>Two maps are kept. The task map holds what the graph says about a task
 * directly ({@code foo:x?}) and is checked for conflicts. The member map
 * holds what right-side family triggers imply for family members; a member
 * conflict makes the output optional without error. The task map wins
 * where both have an entry.
 *
 * <p>In back-compatibility mode conflicts in the task map are logged as
 * warnings and resolved by making the outputs optional.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class OutputOptionality {

    private static final Logger logger = Logger.getLogger(OutputOptionality.class.getName());

    /**
     * A task output.
     */
    public record OutputKey(String taskName, String output) {

        public OutputKey {
            Objects.requireNonNull(taskName, "Task name cannot be null");
            Objects.requireNonNull(output, "Output cannot be null");
        }

        @Override
        public String toString() {
            return taskName + ":" + output;
        }
    }

    private final Map<OutputKey, Boolean> taskOutputs = new LinkedHashMap<>();
    private final Map<OutputKey, Boolean> memberOutputs = new LinkedHashMap<>();
    private final CompilerConfig config;

    public OutputOptionality(CompilerConfig config) {
        this.config = Objects.requireNonNull(config, "Compiler config cannot be null");
    }

    /**
     * Records what the graph says about {@code taskName:output}.
     *
     * @throws GraphSemanticException if {@code finished} is marked optional,
     *         or the record conflicts with an earlier one for the same output
     *         or its opposite, outside back-compatibility mode
     */
    public void recordTaskOutput(String taskName, String output, boolean optional) throws GraphSemanticException {
        if (TaskOutputNames.FINISHED.equals(output)) {
            if (optional) {
                throw new GraphSemanticException(config.getWorkflowName(), null,
                        "Pseudo-output " + taskName + ":" + output + " can't be optional");
            }
            // finished is succeeded or failed, so neither can be required.
            recordTaskOutput(taskName, TaskOutputNames.SUCCEEDED, true);
            recordTaskOutput(taskName, TaskOutputNames.FAILED, true);
            return;
        }

        OutputKey key = new OutputKey(taskName, output);
        Boolean already = taskOutputs.get(key);
        if (already != null && already != optional) {
            String message = already
                    ? "Output " + key + " is optional so it can't also be required."
                    : "Output " + key + " is required so it can't also be optional.";
            conflict(message, " ... making it optional.");
            taskOutputs.put(key, true);
            return;
        }
        taskOutputs.put(key, optional);

        String opposite = TaskOutputNames.opposite(output);
        if (opposite == null) {
            return;
        }
        OutputKey oppositeKey = new OutputKey(taskName, opposite);
        Boolean oppositeOptional = taskOutputs.get(oppositeKey);
        if (oppositeOptional != null && !(oppositeOptional && optional)) {
            String message = "Output " + oppositeKey + " is " + describe(oppositeOptional)
                    + " so " + key + " can't be " + describe(optional) + ".";
            conflict(message, " ... making both optional.");
            taskOutputs.put(key, true);
            taskOutputs.put(oppositeKey, true);
        }
    }

    /**
     * Records what a right-side family trigger implies for one member.
     */
    public void recordMemberOutput(String memberName, String output, boolean optional) {
        OutputKey key = new OutputKey(memberName, output);
        Boolean already = memberOutputs.get(key);
        if (already != null && already != optional) {
            memberOutputs.put(key, true);
        } else {
            memberOutputs.put(key, optional);
        }
    }

    private void conflict(String message, String coercion) throws GraphSemanticException {
        if (!config.isBackCompat()) {
            throw new GraphSemanticException(config.getWorkflowName(), null, message);
        }
        logger.warning(message + coercion);
    }

    private static String describe(boolean optional) {
        return optional ? "optional" : "required";
    }

    public Map<OutputKey, Boolean> getTaskOutputs() {
        return Collections.unmodifiableMap(taskOutputs);
    }

    public Map<OutputKey, Boolean> getMemberOutputs() {
        return Collections.unmodifiableMap(memberOutputs);
    }

    /**
     * The effective optionality of an output, or {@code null} if the graph says nothing about it.
     */
    public Boolean isOptional(String taskName, String output) {
        OutputKey key = new OutputKey(taskName, output);
        Boolean optional = taskOutputs.get(key);
        return optional != null ? optional : memberOutputs.get(key);
    }

    @Override
    public String toString() {
        return "OutputOptionality{tasks=" + taskOutputs + ", members=" + memberOutputs + "}";
    }
}
