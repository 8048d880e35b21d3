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

package dev.mars.cyclus.workflow.completion;

import dev.mars.cyclus.expression.BooleanExpression;
import dev.mars.cyclus.expression.ExpressionSyntaxException;
import dev.mars.cyclus.workflow.CompilerConfig;
import dev.mars.cyclus.workflow.GraphSemanticException;
import dev.mars.cyclus.workflow.task.TaskOutputNames;
import dev.mars.cyclus.workflow.task.TaskOutputRegistry;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks a completion expression taken from runtime configuration.
 *
 * <p>The expression is not compared with the graph; it only has to be well
 * formed and refer to outputs the task has, by their completion variable
 * names.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class CompletionExpressionValidator {

    private static final Map<String, String> ALIASES = new LinkedHashMap<>();

    static {
        ALIASES.put("succeed", TaskOutputNames.SUCCEEDED);
        ALIASES.put("fail", TaskOutputNames.FAILED);
        ALIASES.put("submit", TaskOutputNames.SUBMITTED);
        ALIASES.put("submit_fail", "submit_failed");
        ALIASES.put("start", TaskOutputNames.STARTED);
        ALIASES.put("expire", TaskOutputNames.EXPIRED);
    }

    private final CompilerConfig config;

    public CompletionExpressionValidator(CompilerConfig config) {
        this.config = Objects.requireNonNull(config, "Compiler config cannot be null");
    }

    /**
     * Validates and compiles {@code expression} for the task {@code taskName}.
     *
     * @throws GraphSemanticException if the expression is not usable
     */
    public BooleanExpression validate(String taskName, String expression, TaskOutputRegistry outputs)
            throws GraphSemanticException {
        String fieldPath = "runtime." + taskName + ".completion";

        if (config.isBackCompat()) {
            throw error(fieldPath, "completion cannot be used in Cylc 7 compatibility mode.");
        }
        if (expression.contains(TaskOutputNames.SUBMIT_FAILED)) {
            throw error(fieldPath,
                    "Use \"submit_failed\" rather than \"submit-failed\" in completion expressions.");
        }
        for (String output : outputs.getOutputNames()) {
            if (output.contains("-") && mentions(expression, output)) {
                throw error(fieldPath,
                        "Replace hyphens with underscores in task outputs when used in completion expressions.");
            }
        }

        BooleanExpression compiled;
        try {
            compiled = BooleanExpression.compile(expression);
        } catch (ExpressionSyntaxException e) {
            throw new GraphSemanticException(config.getWorkflowName(), fieldPath,
                    "Error in completion expression \"" + expression + "\": " + e.getMessage(), e);
        }

        Set<String> variables = new HashSet<>();
        for (String output : outputs.getOutputNames()) {
            variables.add(TaskOutputNames.toCompletionVariable(output));
        }
        for (String identifier : compiled.getIdentifiers()) {
            String alias = ALIASES.get(identifier);
            if (alias != null) {
                throw error(fieldPath,
                        "Use \"" + alias + "\" not \"" + identifier + "\" in completion expressions");
            }
            if (TaskOutputNames.FINISHED.equals(identifier) || "finish".equals(identifier)) {
                throw error(fieldPath, "\"finished\" output cannot be used in completion expressions");
            }
            if (!variables.contains(identifier)) {
                throw error(fieldPath, "Input '" + identifier + "' is not defined in the completion expression");
            }
        }
        return compiled;
    }

    private static boolean mentions(String expression, String output) {
        return Pattern.compile("(?<![\\w-])" + Pattern.quote(output) + "(?![\\w-])").matcher(expression).find();
    }

    private GraphSemanticException error(String fieldPath, String message) {
        return new GraphSemanticException(config.getWorkflowName(), fieldPath, message);
    }
}
