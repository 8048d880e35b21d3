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

package dev.mars.cyclus.expression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static dev.mars.cyclus.expression.ExpressionNode.and;
import static dev.mars.cyclus.expression.ExpressionNode.leaf;
import static dev.mars.cyclus.expression.ExpressionNode.or;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link ExpressionCompiler}.
 */
@DisplayName("ExpressionCompiler Tests")
class ExpressionCompilerTest {

    @Nested
    @DisplayName("Graph syntax")
    class GraphSyntaxTests {

        private final ExpressionCompiler compiler = ExpressionCompiler.forGraph();

        @Test
        @DisplayName("Parenthesised single operand collapses to a leaf")
        void testSingleGroupCollapses() throws ExpressionSyntaxException {
            assertThat(compiler.compile("(foo)")).isEqualTo(leaf("foo"));
            assertThat(compiler.compile("((foo))")).isEqualTo(leaf("foo"));
        }

        @Test
        @DisplayName("Parentheses are preserved as nested nodes")
        void testNestedGroup() throws ExpressionSyntaxException {
            assertThat(compiler.compile("foo & (bar | baz)"))
                    .isEqualTo(and(leaf("foo"), or(leaf("bar"), leaf("baz"))));
        }

        @Test
        @DisplayName("Same-level operators flatten into one node")
        void testFlatten() throws ExpressionSyntaxException {
            assertThat(compiler.compile("a&b&c")).isEqualTo(and(leaf("a"), leaf("b"), leaf("c")));
            assertThat(compiler.compile("(a&b)&c")).isEqualTo(and(and(leaf("a"), leaf("b")), leaf("c")));
        }

        @Test
        @DisplayName("AND binds tighter than OR")
        void testPrecedence() throws ExpressionSyntaxException {
            assertThat(compiler.compile("a&b|c"))
                    .isEqualTo(or(and(leaf("a"), leaf("b")), leaf("c")));
        }

        @Test
        @DisplayName("Qualified nodes are single operands")
        void testQualifiedOperands() throws ExpressionSyntaxException {
            ExpressionNode<String> node = compiler.compile("foo[-P1D]:succeeded|bar:x");
            assertThat(node.leaves()).containsExactly("foo[-P1D]:succeeded", "bar:x");
        }

        @ParameterizedTest
        @ValueSource(strings = {"(a&b", "a&b)", "((a)", "a)&(b"})
        @DisplayName("Unbalanced parentheses are rejected")
        void testUnbalanced(String expression) {
            assertThatThrownBy(() -> compiler.compile(expression))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageContaining("Mismatched parentheses");
        }

        @Test
        @DisplayName("Missing operands are rejected")
        void testMissingOperand() {
            assertThatThrownBy(() -> compiler.compile("a&"))
                    .isInstanceOf(ExpressionSyntaxException.class);
            assertThatThrownBy(() -> compiler.compile("|a"))
                    .isInstanceOf(ExpressionSyntaxException.class);
            assertThatThrownBy(() -> compiler.compile(""))
                    .isInstanceOf(ExpressionSyntaxException.class);
        }
    }

    @Nested
    @DisplayName("Completion syntax")
    class CompletionSyntaxTests {

        private final ExpressionCompiler compiler = ExpressionCompiler.forCompletion();

        @Test
        void testWordsAsOperators() throws ExpressionSyntaxException {
            assertThat(compiler.compile("(succeeded and x) or failed"))
                    .isEqualTo(or(and(leaf("succeeded"), leaf("x")), leaf("failed")));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "not succeeded or x",
                "succeeded.real",
                "succeeded()",
                "x + y",
                "submit-failed",
                "succeeded and",
                "__import__('os')"
        })
        void testRejectsNonWhitelistedSyntax(String expression) {
            assertThatThrownBy(() -> compiler.compile(expression))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageContaining("Invalid expression");
        }
    }

    @Test
    void testMapRebindsLeaves() throws ExpressionSyntaxException {
        ExpressionNode<String> node = ExpressionCompiler.forGraph().compile("a & (b | c)");
        ExpressionNode<Integer> lengths = node.map(String::length);
        assertThat(lengths).isEqualTo(and(leaf(1), or(leaf(1), leaf(1))));
        assertThat(node.render(s -> s, " & ", " | ")).isEqualTo("a & (b | c)");
        assertThat(node.evaluate(List.of("a", "c")::contains)).isTrue();
        assertThat(node.evaluate(List.of("b", "c")::contains)).isFalse();
    }
}
