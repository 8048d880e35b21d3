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

import dev.mars.cyclus.workflow.task.TaskOutputNames;
import dev.mars.cyclus.workflow.task.TaskOutputRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Derives a task's completion expression from the optionality of its outputs.
 *
 * <p>Required outputs must all be generated. Optional custom outputs add one
 * term that any of them satisfies. Optional {@code succeeded}/{@code failed},
 * {@code submitted}/{@code submit-failed} and {@code expired} each open an
 * alternative way to finish:
 *
 * <pre>
 *   no optional outputs           succeeded
 *   required x                    succeeded and x
 *   optional x, y, z              succeeded and (x or y or z)
 *   optional succeeded, failed    succeeded or failed
 *   required x, optional failed   (x and succeeded) or failed
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class CompletionExpressionBuilder {

    private static final String AND = " and ";
    private static final String OR = " or ";

    private CompletionExpressionBuilder() {
    }

    public static String build(TaskOutputRegistry outputs) {
        Objects.requireNonNull(outputs, "Outputs cannot be null");

        List<String> terms = new ArrayList<>();
        for (String output : outputs.getRequired()) {
            terms.add(TaskOutputNames.toCompletionVariable(output));
        }
        List<String> optionalCustom = new ArrayList<>();
        for (String output : outputs.getOptional()) {
            if (!TaskOutputNames.isStandard(output)) {
                optionalCustom.add(TaskOutputNames.toCompletionVariable(output));
            }
        }
        if (optionalCustom.size() == 1) {
            terms.add(optionalCustom.get(0));
        } else if (optionalCustom.size() > 1) {
            terms.add("(" + String.join(OR, optionalCustom) + ")");
        }
        String required = String.join(AND, terms);

        List<String> parts = new ArrayList<>();
        if (outputs.isOptional(TaskOutputNames.SUCCEEDED) || outputs.isOptional(TaskOutputNames.FAILED)) {
            if (terms.isEmpty()) {
                parts.add(TaskOutputNames.SUCCEEDED + OR + TaskOutputNames.FAILED);
            } else if (outputs.isRequired(TaskOutputNames.SUCCEEDED)) {
                parts.add(required);
                parts.add(TaskOutputNames.FAILED);
            } else {
                parts.add(required + AND + TaskOutputNames.SUCCEEDED);
                parts.add(TaskOutputNames.FAILED);
            }
        } else if (!terms.isEmpty()) {
            parts.add(required);
        }

        if (outputs.isOptional(TaskOutputNames.SUBMITTED) || outputs.isOptional(TaskOutputNames.SUBMIT_FAILED)) {
            parts.add(TaskOutputNames.toCompletionVariable(TaskOutputNames.SUBMIT_FAILED));
        }
        if (outputs.isOptional(TaskOutputNames.EXPIRED)) {
            parts.add(TaskOutputNames.EXPIRED);
        }

        if (parts.isEmpty()) {
            return TaskOutputNames.SUCCEEDED;
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        List<String> grouped = new ArrayList<>(parts.size());
        for (String part : parts) {
            grouped.add(part.contains(AND) ? "(" + part + ")" : part);
        }
        return String.join(OR, grouped);
    }
}
