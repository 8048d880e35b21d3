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
 * Thrown for graph text that is well formed but meaningless: illegal family
 * triggers, suicide markers on the left, OR on the right, self-edges,
 * conflicting output optionality, undefined xtriggers and similar.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class GraphSemanticException extends WorkflowParseException {

    public GraphSemanticException(String message) {
        super(message);
    }

    public GraphSemanticException(String workflowName, String fieldPath, String message) {
        super(workflowName, fieldPath, message);
    }

    public GraphSemanticException(String workflowName, String fieldPath, String message, Throwable cause) {
        super(workflowName, -1, fieldPath, message, cause);
    }
}
