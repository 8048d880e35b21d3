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

import dev.mars.cyclus.workflow.ParameterExpansionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link GraphParameterExpander}.
 */
@DisplayName("GraphParameterExpander Tests")
class GraphParameterExpanderTest {

    private static GraphParameterExpander expander(Map<String, List<String>> values, Map<String, String> templates) {
        return new GraphParameterExpander(values, templates, 1000);
    }

    private static Map<String, List<String>> params(Object... pairs) {
        Map<String, List<String>> values = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            @SuppressWarnings("unchecked")
            List<String> list = (List<String>) pairs[i + 1];
            values.put((String) pairs[i], list);
        }
        return values;
    }

    @Test
    @DisplayName("Integer parameters get a zero-padded default template")
    void testDefaultTemplates() {
        assertThat(GraphParameterExpander.defaultTemplate("m", List.of("1", "2", "10")))
                .isEqualTo("_m%(m)02d");
        assertThat(GraphParameterExpander.defaultTemplate("s", List.of("a", "b")))
                .isEqualTo("_%(s)s");
    }

    @Test
    @DisplayName("Single parameter expands to one line per value")
    void testSingleParameter() throws ParameterExpansionException {
        GraphParameterExpander expander = expander(params("m", List.of("1", "2")), Map.of());

        assertThat(expander.expand("foo<m>=>bar<m>"))
                .containsExactly("foo_m1=>bar_m1", "foo_m2=>bar_m2");
    }

    @Test
    @DisplayName("Explicit templates are used")
    void testExplicitTemplate() throws ParameterExpansionException {
        GraphParameterExpander expander = expander(params("m", List.of("1", "2")), Map.of("m", "_mem%(m)03d"));

        assertThat(expander.expand("foo<m>")).containsExactly("foo_mem001", "foo_mem002");
    }

    @Test
    @DisplayName("Several parameters produce the cartesian product")
    void testCartesianProduct() throws ParameterExpansionException {
        GraphParameterExpander expander = expander(
                params("m", List.of("1", "2"), "s", List.of("a", "b")), Map.of());

        assertThat(expander.expand("foo<m,s>=>bar<m>"))
                .containsExactly("foo_m1_a=>bar_m1", "foo_m1_b=>bar_m1",
                        "foo_m2_a=>bar_m2", "foo_m2_b=>bar_m2");
    }

    @Test
    @DisplayName("Pinned value")
    void testPinnedValue() throws ParameterExpansionException {
        GraphParameterExpander expander = expander(params("m", List.of("1", "2")), Map.of());

        assertThat(expander.expand("foo<m=2>=>bar<m>"))
                .containsExactly("foo_m2=>bar_m1", "foo_m2=>bar_m2");
    }

    @Test
    @DisplayName("Pinned value must exist")
    void testPinnedValueOutOfRange() {
        GraphParameterExpander expander = expander(params("m", List.of("1", "2")), Map.of());

        assertThatThrownBy(() -> expander.expand("foo<m=3>=>bar"))
                .isInstanceOf(ParameterExpansionException.class)
                .hasMessage("parameter m out of range: m=3");
    }

    @Test
    @DisplayName("Index offsets outside the values produce the removal marker")
    void testOffsetOutOfRange() throws ParameterExpansionException {
        GraphParameterExpander expander = expander(params("m", List.of("1", "2")), Map.of());

        assertThat(expander.expand("foo<m-1>=>foo<m>"))
                .containsExactly("foo_m" + GraphSyntax.REMOVE_MARKER + "=>foo_m1", "foo_m1=>foo_m2");
    }

    @Test
    @DisplayName("Undefined parameter")
    void testUndefinedParameter() {
        GraphParameterExpander expander = expander(params("m", List.of("1")), Map.of());

        assertThatThrownBy(() -> expander.expand("foo<n>=>bar"))
                .isInstanceOf(ParameterExpansionException.class)
                .hasMessage("parameter n is not defined in <n>: foo<n>=>bar");
    }

    @Test
    @DisplayName("Expansion beyond the line limit is rejected")
    void testExpansionLimit() {
        GraphParameterExpander expander = new GraphParameterExpander(
                params("m", List.of("1", "2", "3"), "n", List.of("1", "2", "3")), Map.of(), 5);

        assertThatThrownBy(() -> expander.expand("foo<m,n>"))
                .isInstanceOf(ParameterExpansionException.class)
                .hasMessageContaining("exceeds 5 lines");
    }

    @Test
    @DisplayName("Without parameters any group fails")
    void testNoParameters() {
        assertThatThrownBy(() -> ParameterExpander.NONE.expand("foo<m>"))
                .isInstanceOf(ParameterExpansionException.class)
                .hasMessage("parameters are not defined: foo<m>");
    }
}
