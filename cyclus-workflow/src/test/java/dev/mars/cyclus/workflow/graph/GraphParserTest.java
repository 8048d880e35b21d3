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
import dev.mars.cyclus.workflow.GraphSyntaxException;
import dev.mars.cyclus.workflow.WorkflowParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link GraphParser}.
 */
@DisplayName("GraphParser Tests")
class GraphParserTest {

    private static final Map<String, List<String>> FAMILIES = Map.of(
            "FAM", List.of("m1", "m2"),
            "BAM", List.of("b1", "b2"));

    private OutputOptionality optionality;

    @BeforeEach
    void setUp() {
        optionality = new OutputOptionality(CompilerConfig.defaults());
    }

    private ParsedGraph parse(String graph) throws WorkflowParseException {
        return new GraphParser(FAMILIES, ParameterExpander.NONE, optionality, CompilerConfig.defaults(), null)
                .parse(graph);
    }

    @Nested
    @DisplayName("Pairs and chains")
    class PairTests {

        @Test
        @DisplayName("Chains become pairs and the first node has no prerequisite")
        void testChain() throws WorkflowParseException {
            ParsedGraph graph = parse("a => b => c");

            assertThat(graph.getTriggers("a")).containsOnlyKeys("");
            assertThat(graph.getTriggers("b")).containsOnlyKeys("a:succeeded");
            assertThat(graph.getTriggers("c")).containsOnlyKeys("b:succeeded");
            assertThat(graph.getTriggers("a").get("").triggers()).isEmpty();
        }

        @Test
        @DisplayName("Succeeded qualifier spellings are equivalent")
        void testSucceededSpellings() throws WorkflowParseException {
            Map<String, TriggerSpec> plain = parse("foo => bar").getTriggers("bar");
            setUp();
            Map<String, TriggerSpec> alias = parse("foo:succeed => bar").getTriggers("bar");
            setUp();
            Map<String, TriggerSpec> full = parse("foo:succeeded => bar").getTriggers("bar");

            assertThat(plain).isEqualTo(alias).isEqualTo(full);
        }

        @Test
        @DisplayName("Plain AND on the left splits into separate expressions")
        void testAndSplit() throws WorkflowParseException {
            ParsedGraph graph = parse("a & b => c");

            assertThat(graph.getTriggers("c")).containsOnlyKeys("a:succeeded", "b:succeeded");
        }

        @Test
        @DisplayName("Conditional left side is kept whole")
        void testConditionalKeptWhole() throws WorkflowParseException {
            ParsedGraph graph = parse("a & b | c => d");

            assertThat(graph.getTriggers("d")).containsOnlyKeys("a:succeeded&b:succeeded|c:succeeded");
            assertThat(graph.getTriggers("d").get("a:succeeded&b:succeeded|c:succeeded").triggers())
                    .containsExactly("a:succeeded", "b:succeeded", "c:succeeded");
        }

        @Test
        @DisplayName("AND on the right applies the left to each node")
        void testRightAnd() throws WorkflowParseException {
            ParsedGraph graph = parse("a => b & c");

            assertThat(graph.getTriggers("b")).containsOnlyKeys("a:succeeded");
            assertThat(graph.getTriggers("c")).containsOnlyKeys("a:succeeded");
        }

        @Test
        @DisplayName("Right-side qualifiers chain but are not triggers")
        void testRightQualifierChains() throws WorkflowParseException {
            ParsedGraph graph = parse("foo => bar:x => baz");

            assertThat(graph.getTriggers("bar")).containsOnlyKeys("foo:succeeded");
            assertThat(graph.getTriggers("baz")).containsOnlyKeys("bar:x");
            assertThat(optionality.isOptional("bar", "x")).isFalse();
        }

        @Test
        @DisplayName("Finished expands to succeeded or failed")
        void testFinished() throws WorkflowParseException {
            ParsedGraph graph = parse("foo:finish => bar");

            TriggerSpec spec = graph.getTriggers("bar").get("(foo:succeeded|foo:failed)");
            assertThat(spec).isNotNull();
            assertThat(spec.triggers()).containsExactly("foo:succeeded", "foo:failed");
        }

        @Test
        @DisplayName("Optional markers are removed from expressions")
        void testOptionalMarkerStripped() throws WorkflowParseException {
            ParsedGraph graph = parse("foo:fail? => bar");

            assertThat(graph.getTriggers("bar")).containsOnlyKeys("foo:failed");
            assertThat(optionality.isOptional("foo", "failed")).isTrue();
        }

        @Test
        @DisplayName("Suicide rights are flagged and do not record optionality")
        void testSuicide() throws WorkflowParseException {
            ParsedGraph graph = parse("foo:fail? => !bar");

            assertThat(graph.getTriggers("bar").get("foo:failed").suicide()).isTrue();
            assertThat(optionality.isOptional("bar", "succeeded")).isNull();
        }

        @Test
        @DisplayName("Xtrigger actions are kept as triggers")
        void testXtrigger() throws WorkflowParseException {
            ParsedGraph graph = parse("@clock & foo => bar");

            assertThat(graph.getTriggers("bar")).containsKeys("@clock", "foo:succeeded");
            assertThat(graph.getTriggers("@clock")).isEmpty();
        }

        @Test
        @DisplayName("Offset right nodes are only triggers")
        void testOffsetRightIgnored() throws WorkflowParseException {
            ParsedGraph graph = parse("foo[-P1] => bar");

            assertThat(graph.getTriggers("foo")).isEmpty();
            assertThat(graph.getTriggers("bar")).containsOnlyKeys("foo[-P1]:succeeded");
        }
    }

    @Nested
    @DisplayName("Families")
    class FamilyTests {

        @Test
        @DisplayName("succeed-all is an AND of members")
        void testSucceedAll() throws WorkflowParseException {
            ParsedGraph graph = parse("FAM:succeed-all => BAM");
            ParsedGraph plain = new GraphParser(Map.of(), ParameterExpander.NONE,
                    new OutputOptionality(CompilerConfig.defaults()), CompilerConfig.defaults(), null)
                    .parse("(m1 & m2) => b1 & b2");

            assertThat(graph.getTriggers("b1")).containsOnlyKeys("(m1:succeeded&m2:succeeded)");
            assertThat(graph.getTriggers("b1").keySet()).isEqualTo(plain.getTriggers("b1").keySet());
            assertThat(graph.getTriggers("b2").keySet()).isEqualTo(plain.getTriggers("b2").keySet());
            assertThat(graph.getTriggers("b2").get("(m1:succeeded&m2:succeeded)").triggers())
                    .isEqualTo(plain.getTriggers("b2").get("(m1:succeeded&m2:succeeded)").triggers());
        }

        @Test
        @DisplayName("fail-any is an OR of members")
        void testFailAny() throws WorkflowParseException {
            ParsedGraph graph = parse("FAM:fail-any => foo");

            assertThat(graph.getTriggers("foo")).containsOnlyKeys("(m1:failed|m2:failed)");
        }

        @Test
        @DisplayName("finish-all expands members to succeeded or failed")
        void testFinishAll() throws WorkflowParseException {
            ParsedGraph graph = parse("FAM:finish-all => foo");

            assertThat(graph.getTriggers("foo"))
                    .containsOnlyKeys("((m1:succeeded|m1:failed)&(m2:succeeded|m2:failed))");
        }

        @Test
        @DisplayName("Family on the right records member optionality")
        void testMemberOptionality() throws WorkflowParseException {
            parse("foo => FAM:succeed-any");

            assertThat(optionality.getMemberOutputs())
                    .containsEntry(new OutputOptionality.OutputKey("m1", "succeeded"), true)
                    .containsEntry(new OutputOptionality.OutputKey("m2", "succeeded"), true);
            assertThat(optionality.getTaskOutputs())
                    .doesNotContainKey(new OutputOptionality.OutputKey("m1", "succeeded"));
        }

        @Test
        @DisplayName("Bare family on the left is rejected")
        void testBareFamily() {
            assertThatThrownBy(() -> parse("FAM => foo"))
                    .isInstanceOf(GraphSemanticException.class)
                    .hasMessageStartingWith("Bad family trigger in");
        }

        @Test
        @DisplayName("Family triggers cannot be optional")
        void testOptionalFamily() {
            assertThatThrownBy(() -> parse("FAM:succeed-all? => foo"))
                    .isInstanceOf(GraphSemanticException.class)
                    .hasMessage("Family triggers can't be optional: FAM:succeed-all?");
            assertThatThrownBy(() -> parse("foo => FAM:succeed-all?"))
                    .isInstanceOf(GraphSemanticException.class)
                    .hasMessageStartingWith("Family triggers can't be optional");
        }

        @Test
        @DisplayName("Family qualifier on a task is rejected")
        void testFamilyQualifierOnTask() {
            assertThatThrownBy(() -> parse("foo:succeed-all => bar"))
                    .isInstanceOf(GraphSemanticException.class)
                    .hasMessageStartingWith("family trigger on non-family namespace");
        }

        @Test
        @DisplayName("Unknown family qualifier on the right is rejected")
        void testIllegalFamilyTrigger() {
            assertThatThrownBy(() -> parse("foo => FAM:x"))
                    .isInstanceOf(GraphSemanticException.class)
                    .hasMessage("Illegal family trigger: FAM:x");
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        void testOrOnRight() {
            assertThatThrownBy(() -> parse("a => b | c"))
                    .isInstanceOf(GraphSyntaxException.class)
                    .hasMessage("Illegal OR on right side: b|c");
        }

        @Test
        void testSuicideOnLeft() {
            assertThatThrownBy(() -> parse("!a => b"))
                    .isInstanceOf(GraphSyntaxException.class)
                    .hasMessageStartingWith("Suicide markers must be on the right of a trigger");
        }

        @Test
        void testMismatchedParentheses() {
            assertThatThrownBy(() -> parse("(a & b => c"))
                    .isInstanceOf(GraphSyntaxException.class)
                    .hasMessage("Mismatched parentheses in: \"(a&b\"");
        }

        @Test
        void testNullTaskName() {
            assertThatThrownBy(() -> parse("a & => c"))
                    .isInstanceOf(GraphSyntaxException.class)
                    .hasMessageStartingWith("Null task name in graph");
        }

        @Test
        void testTriggerAndSuicideConflict() {
            assertThatThrownBy(() -> parse("a => b\na => !b"))
                    .isInstanceOf(GraphSemanticException.class)
                    .hasMessage("a can't trigger both b and !b");
        }

        @Test
        void testOptionalityConflict() {
            assertThatThrownBy(() -> parse("a => c\na:fail => b"))
                    .isInstanceOf(GraphSemanticException.class)
                    .hasMessageContaining("a:succeeded")
                    .hasMessageContaining("a:failed");
        }

        @Test
        void testFinishedCannotBeOptional() {
            assertThatThrownBy(() -> parse("a => b:finish?"))
                    .isInstanceOf(GraphSemanticException.class)
                    .hasMessage("Pseudo-output b:finished can't be optional");
        }
    }

    @Test
    @DisplayName("Parameterised lines are expanded and deduplicated")
    void testParameterExpansion() throws WorkflowParseException {
        GraphParameterExpander expander = new GraphParameterExpander(
                Map.of("m", List.of("1", "2")), Map.of(), 100);
        ParsedGraph graph = new GraphParser(Map.of(), expander, optionality, CompilerConfig.defaults(), null)
                .parse("foo<m-1> => foo<m>\nprep => foo<m>");

        assertThat(graph.lines()).contains("foo_m1=>foo_m2", "prep=>foo_m1", "prep=>foo_m2");
        assertThat(graph.getTriggers("foo_m1")).containsOnlyKeys("", "prep:succeeded");
        assertThat(graph.getTriggers("foo_m2")).containsOnlyKeys("foo_m1:succeeded", "prep:succeeded");
    }

    @Test
    @DisplayName("Parsing the same text twice gives equal results")
    void testIdempotent() throws WorkflowParseException {
        String text = "a => b & c\nFAM:succeed-all => d\nd:x? | d:y? => e";
        ParsedGraph first = parse(text);
        Map<OutputOptionality.OutputKey, Boolean> firstOptionality = optionality.getTaskOutputs();
        setUp();
        ParsedGraph second = parse(text);

        assertThat(second.triggers()).isEqualTo(first.triggers());
        assertThat(optionality.getTaskOutputs()).isEqualTo(firstOptionality);
    }
}
