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
 * Thrown when a parameterised graph line refers to an undefined parameter
 * or to a parameter value that does not exist.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class ParameterExpansionException extends WorkflowParseException {

    public ParameterExpansionException(String message) {
        super(message);
    }

    public ParameterExpansionException(String workflowName, String fieldPath, String message) {
        super(workflowName, fieldPath, message);
    }

    public ParameterExpansionException(String workflowName, String fieldPath, String message, Throwable cause) {
        super(workflowName, -1, fieldPath, message, cause);
    }
}
