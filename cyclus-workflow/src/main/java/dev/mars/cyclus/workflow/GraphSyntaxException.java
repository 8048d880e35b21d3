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

package dev.mars.cyclus.workflow;

/**
 * Thrown for malformed graph text: leading or dangling arrows, double
 * character operators, bad node format, bad spacing and mismatched
 * parentheses.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class GraphSyntaxException extends WorkflowParseException {

    public GraphSyntaxException(String message) {
        super(message);
    }

    public GraphSyntaxException(String workflowName, String fieldPath, String message) {
        super(workflowName, fieldPath, message);
    }

    public GraphSyntaxException(String workflowName, String fieldPath, String message, Throwable cause) {
        super(workflowName, -1, fieldPath, message, cause);
    }
}
