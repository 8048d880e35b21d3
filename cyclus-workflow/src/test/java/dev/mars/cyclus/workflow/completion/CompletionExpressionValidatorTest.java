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
import dev.mars.cyclus.workflow.task.TaskOutputRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link CompletionExpressionValidator}.
 */
@DisplayName("CompletionExpressionValidator Tests")
class CompletionExpressionValidatorTest {

    private final CompletionExpressionValidator validator =
            new CompletionExpressionValidator(CompilerConfig.defaults().withWorkflowName("wf"));

    private TaskOutputRegistry outputs;

    @BeforeEach
    void setUp() {
        outputs = new TaskOutputRegistry();
        outputs.add("x", "x message");
        outputs.add("file-ready", "file ready");
    }

    @Test
    @DisplayName("Valid expression is compiled")
    void testValid() throws GraphSemanticException {
        BooleanExpression expression = validator.validate("foo", "(succeeded and x) or failed", outputs);

        assertThat(expression.getSource()).isEqualTo("(succeeded and x) or failed");
        assertThat(expression.getIdentifiers()).containsExactlyInAnyOrder("succeeded", "x", "failed");
    }

    @Test
    @DisplayName("Underscored custom outputs and submit_failed are accepted")
    void testVariableNames() {
        assertThatCode(() -> validator.validate("foo", "file_ready or submit_failed", outputs))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Back-compat mode rejects explicit completion")
    void testBackCompat() {
        CompletionExpressionValidator backCompat =
                new CompletionExpressionValidator(CompilerConfig.defaults().withBackCompat(true));

        assertThatThrownBy(() -> backCompat.validate("foo", "succeeded", outputs))
                .isInstanceOf(GraphSemanticException.class)
                .hasMessageContaining("completion cannot be used in Cylc 7 compatibility mode.");
    }

    @Test
    @DisplayName("submit-failed must be written submit_failed")
    void testHyphenatedSubmitFailed() {
        assertThatThrownBy(() -> validator.validate("foo", "succeeded or submit-failed", outputs))
                .isInstanceOf(GraphSemanticException.class)
                .hasMessageContaining("Use \"submit_failed\" rather than \"submit-failed\"");
    }

    @Test
    @DisplayName("Hyphenated custom outputs must use underscores")
    void testHyphenatedCustomOutput() {
        assertThatThrownBy(() -> validator.validate("foo", "succeeded and file-ready", outputs))
                .isInstanceOf(GraphSemanticException.class)
                .hasMessageContaining("Replace hyphens with underscores");
    }

    @Test
    @DisplayName("Syntax errors keep the cause")
    void testSyntaxError() {
        assertThatThrownBy(() -> validator.validate("foo", "succeeded and (x", outputs))
                .isInstanceOf(GraphSemanticException.class)
                .hasMessageContaining("Error in completion expression \"succeeded and (x\"")
                .hasCauseInstanceOf(ExpressionSyntaxException.class);
    }

    @Test
    @DisplayName("Qualifier aliases are rejected")
    void testAlias() {
        assertThatThrownBy(() -> validator.validate("foo", "succeed or x", outputs))
                .isInstanceOf(GraphSemanticException.class)
                .hasMessageContaining("Use \"succeeded\" not \"succeed\" in completion expressions");
    }

    @Test
    @DisplayName("finished is not an output")
    void testFinished() {
        assertThatThrownBy(() -> validator.validate("foo", "finished", outputs))
                .isInstanceOf(GraphSemanticException.class)
                .hasMessageContaining("\"finished\" output cannot be used in completion expressions");
    }

    @Test
    @DisplayName("Unknown outputs are rejected")
    void testUnknownOutput() {
        assertThatThrownBy(() -> validator.validate("foo", "succeeded and z", outputs))
                .isInstanceOf(GraphSemanticException.class)
                .hasMessageContaining("Input 'z' is not defined in the completion expression");
    }

    @Test
    @DisplayName("Errors carry the task's completion path")
    void testFieldPath() {
        assertThatThrownBy(() -> validator.validate("foo", "succeeded and z", outputs))
                .isInstanceOfSatisfying(GraphSemanticException.class, e -> {
                    assertThat(e.getFieldPath()).isEqualTo("runtime.foo.completion");
                    assertThat(e.getWorkflowName()).isEqualTo("wf");
                });
    }
}
