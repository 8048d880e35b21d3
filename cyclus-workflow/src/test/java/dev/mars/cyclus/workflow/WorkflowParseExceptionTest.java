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

import dev.mars.cyclus.core.exceptions.CyclusException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
/**
 * Description for WorkflowParseExceptionTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-20
 */

class WorkflowParseExceptionTest {

    @Test
    void testBasicConstructor() {
        WorkflowParseException exception = new WorkflowParseException("Failed to parse workflow definition");

        assertEquals("Failed to parse workflow definition", exception.getMessage());
        assertNull(exception.getCause());
        assertNull(exception.getWorkflowName());
        assertEquals(-1, exception.getLineNumber());
        assertNull(exception.getFieldPath());
    }

    @Test
    void testConstructorWithCause() {
        RuntimeException cause = new RuntimeException("Invalid YAML syntax");

        WorkflowParseException exception = new WorkflowParseException("YAML parsing failed", cause);

        assertEquals("YAML parsing failed", exception.getMessage());
        assertEquals(cause, exception.getCause());
    }

    @Test
    void testMessageFormatting() {
        WorkflowParseException withName = new WorkflowParseException("demo", null, "Error message");
        assertEquals("Workflow 'demo': Error message", withName.getMessage());

        WorkflowParseException withField = new WorkflowParseException("demo", "scheduling.graph.P1", "Bad node");
        assertEquals("Workflow 'demo': Field 'scheduling.graph.P1': Bad node", withField.getMessage());

        WorkflowParseException withLine = new WorkflowParseException("demo", 15, "scheduling.graph.R1", "Bad line");
        assertEquals("Workflow 'demo': Line 15: Field 'scheduling.graph.R1': Bad line", withLine.getMessage());
        assertEquals("Bad line", withLine.getDetail());
    }

    @Test
    void testNullWorkflowName() {
        WorkflowParseException exception = new WorkflowParseException(null, "name", "Workflow name is required");

        assertEquals("Field 'name': Workflow name is required", exception.getMessage());
        assertNull(exception.getWorkflowName());
    }

    @Test
    void testGraphExceptionsAreParseExceptions() {
        IllegalStateException cause = new IllegalStateException("inner");
        GraphSyntaxException syntax = new GraphSyntaxException("demo", "scheduling.graph.P1", "Null task name", cause);
        GraphSemanticException semantic = new GraphSemanticException("xtrigger not defined: x");

        assertTrue(syntax instanceof WorkflowParseException);
        assertTrue(semantic instanceof CyclusException);
        assertEquals(cause, syntax.getCause());
        assertEquals("scheduling.graph.P1", syntax.getFieldPath());
        assertEquals("xtrigger not defined: x", semantic.getMessage());
    }

    @Test
    void testToString() {
        WorkflowParseException exception = new WorkflowParseException("demo", null, "Test exception");

        String toString = exception.toString();
        assertTrue(toString.contains("WorkflowParseException"));
        assertTrue(toString.contains("demo"));
        assertTrue(toString.contains("Test exception"));
    }
}
