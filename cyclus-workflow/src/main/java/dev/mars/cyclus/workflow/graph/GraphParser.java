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
import dev.mars.cyclus.workflow.task.TaskOutputNames;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;

/**
 * Extracts dependencies from the text of one graph section.
 *
 * <p>The general form of a dependency is {@code EXPRESSION => NODE}: on the
 * right a task or family name, on the left an expression of nodes combined
 * with {@code &}, {@code |} and parentheses. Chains {@code a => b => c} are
 * processed as pairs, and the first node of every chain is also recorded
 * with no prerequisite. Qualifiers on the right are ignored as triggers so
 * that {@code foo => bar:x => baz} works, but they still state which
 * output of the right-side task the graph expects.
 *
 * <p>A parser holds the results of a single section. Output optionality is
 * written to the {@link OutputOptionality} passed in, which may be shared
 * across sections.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class GraphParser {

    private static final Logger logger = Logger.getLogger(GraphParser.class.getName());

    private record Pair(String left, String right) {
    }

    private final Map<String, List<String>> familyMap;
    private final ParameterExpander parameterExpander;
    private final OutputOptionality optionality;
    private final CompilerConfig config;
    private final String fieldPath;
    private final Map<String, Map<String, TriggerSpec>> triggers = new LinkedHashMap<>();

    /**
     * @param familyMap family name to member task names
     * @param parameterExpander expander for lines with {@code <param>} groups
     * @param optionality receives output optionality
     * @param config compiler settings
     * @param fieldPath configuration path of the section, for messages; may be null
     */
    public GraphParser(Map<String, List<String>> familyMap, ParameterExpander parameterExpander,
                       OutputOptionality optionality, CompilerConfig config, String fieldPath) {
        this.familyMap = familyMap == null ? Map.of() : familyMap;
        this.parameterExpander = parameterExpander == null ? ParameterExpander.NONE : parameterExpander;
        this.optionality = Objects.requireNonNull(optionality, "Optionality cannot be null");
        this.config = Objects.requireNonNull(config, "Compiler config cannot be null");
        this.fieldPath = fieldPath;
    }

    public ParsedGraph parse(String graphText) throws WorkflowParseException {
        NormalizedGraph normalized = new GraphNormalizer(config.getWorkflowName(), fieldPath).normalize(graphText);

        Set<String> lines = new LinkedHashSet<>();
        for (String line : normalized.lines()) {
            if (GraphSyntax.PARAMS_PRESENT.matcher(line).find()) {
                lines.addAll(parameterExpander.expand(line));
            } else {
                lines.add(line);
            }
        }

        // Parameter expansion can repeat dependencies.
        Set<Pair> pairs = new LinkedHashSet<>();
        for (String line : lines) {
            List<String> chain = chain(line);
            if (chain.isEmpty()) {
                continue;
            }
            Matcher matcher = GraphSyntax.NODES.matcher(chain.get(0));
            while (matcher.find()) {
                if (!matcher.group(1).startsWith(GraphSyntax.ACTION)) {
                    pairs.add(new Pair(null, matcher.group()));
                }
            }
            for (int i = 0; i < chain.size() - 1; i++) {
                pairs.add(new Pair(chain.get(i), chain.get(i + 1)));
            }
        }

        for (Pair pair : pairs) {
            processPair(pair.left(), pair.right());
        }
        logger.fine(() -> "Parsed " + pairs.size() + " dependency pair(s) from " + lines.size() + " line(s)"
                + (fieldPath == null ? "" : " in " + fieldPath));
        return new ParsedGraph(triggers, normalized.pollingReferences(), new ArrayList<>(lines));
    }

    /**
     * Splits a line into its nodes, stopping at the first node removed by
     * parameter expansion. Empty nodes are kept so that they fail later.
     */
    private static List<String> chain(String line) {
        List<String> chain = new ArrayList<>();
        for (String node : line.split(GraphSyntax.ARROW, -1)) {
            if (node.isEmpty()) {
                chain.add(node);
                continue;
            }
            String kept = GraphSyntax.NODE_OUT_OF_RANGE.matcher(node).replaceAll("");
            if (kept.isEmpty()) {
                break;
            }
            chain.add(kept);
        }
        return chain;
    }

    private void processPair(String left, String right) throws WorkflowParseException {
        if (right.contains(GraphSyntax.OP_OR)) {
            throw syntax("Illegal OR on right side: " + right);
        }
        if (left != null && left.contains(GraphSyntax.SUICIDE)) {
            throw syntax("Suicide markers must be on the right of a trigger: " + left);
        }
        // Offset nodes appear on the right of chains; they only matter as triggers.
        if (right.contains("[")) {
            return;
        }
        if (left != null && count(left, '(') != count(left, ')')) {
            throw syntax("Mismatched parentheses in: \"" + left + "\"");
        }

        List<String> rights = Arrays.asList(right.split(GraphSyntax.OP_AND, -1));
        if (rights.contains("")) {
            throw syntax("Null task name in graph: " + left + " => " + right);
        }

        List<String> lefts;
        if (left == null || left.contains(GraphSyntax.OP_OR) || left.contains("(")) {
            lefts = new ArrayList<>();
            lefts.add(left);
        } else {
            lefts = Arrays.asList(left.split(GraphSyntax.OP_AND, -1));
        }
        if (left != null && lefts.contains("")) {
            throw syntax("Null task name in graph: " + left + " => " + right);
        }

        for (String expression : lefts) {
            processLeft(expression, rights);
        }
    }

    /**
     * Rewrites one left-side expression with explicit qualifiers and family
     * members, then records it against every right-side node.
     */
    private void processLeft(String left, List<String> rights) throws WorkflowParseException {
        StringBuilder expr = new StringBuilder();
        StringBuilder original = new StringBuilder();
        Set<String> trigs = new LinkedHashSet<>();
        if (left != null) {
            Matcher matcher = GraphSyntax.NODES.matcher(left);
            int last = 0;
            while (matcher.find()) {
                String between = left.substring(last, matcher.start());
                expr.append(between);
                original.append(between);
                last = matcher.end();

                String name = matcher.group(1);
                if (name.startsWith(GraphSyntax.ACTION)) {
                    expr.append(name);
                    original.append(name);
                    trigs.add(name);
                    continue;
                }
                String offset = matcher.group(2) == null ? "" : matcher.group(2);
                String qualifier = matcher.group(3);
                String trigger = qualifier == null
                        ? TaskOutputNames.SUCCEEDED
                        : TaskOutputNames.standardise(qualifier.substring(1));
                boolean optional = GraphSyntax.OPTIONAL.equals(matcher.group(4));
                original.append(name).append(offset).append(':').append(trigger);

                List<String> members = familyMap.get(name);
                if (members != null) {
                    FamilyTrigger familyTrigger = FamilyTrigger.fromQualifier(trigger);
                    if (familyTrigger == null) {
                        throw semantic("Bad family trigger in " + left);
                    }
                    if (optional) {
                        throw semantic("Family triggers can't be optional: " + name + ":" + trigger + "?");
                    }
                    List<String> memberNodes = new ArrayList<>();
                    for (String member : members) {
                        memberNodes.add(node(member, offset, familyTrigger.getMemberOutput(), trigs));
                    }
                    String op = familyTrigger.isAll() ? GraphSyntax.OP_AND : GraphSyntax.OP_OR;
                    expr.append('(').append(String.join(op, memberNodes)).append(')');
                } else {
                    if (FamilyTrigger.fromQualifier(trigger) != null) {
                        throw semantic("family trigger on non-family namespace " + left);
                    }
                    expr.append(node(name, offset, trigger, trigs));
                }
            }
            String tail = left.substring(last);
            expr.append(tail);
            original.append(tail);
        }
        String expression = expr.toString();
        String originalExpression = original.toString();
        List<String> triggerList = new ArrayList<>(trigs);

        for (String right : rights) {
            Matcher matcher = GraphSyntax.RHS_NODE.matcher(right);
            if (!matcher.lookingAt()) {
                throw syntax("Illegal graph node: " + right);
            }
            boolean suicide = matcher.group(1) != null;
            String name = matcher.group(2);
            String output = matcher.group(3) == null ? null : matcher.group(3).substring(1);
            boolean optional = GraphSyntax.OPTIONAL.equals(matcher.group(4));

            List<String> members = familyMap.get(name);
            if (members == null) {
                output = output == null ? TaskOutputNames.SUCCEEDED : TaskOutputNames.standardise(output);
                setTriggers(name, expression, triggerList, suicide, originalExpression);
                if (!suicide) {
                    optionality.recordTaskOutput(name, output, optional);
                }
                continue;
            }

            if (optional) {
                throw semantic("Family triggers can't be optional: " + name
                        + (output == null ? "" : ":" + output) + "?");
            }
            FamilyTrigger familyTrigger = null;
            if (output != null) {
                familyTrigger = FamilyTrigger.fromQualifier(output);
                if (familyTrigger == null) {
                    throw semantic("Illegal family trigger: " + name + ":" + output);
                }
            }
            for (String member : members) {
                setTriggers(member, expression, triggerList, suicide, originalExpression);
                // A bare family on the right says nothing about member outputs.
                if (!suicide && familyTrigger != null) {
                    optionality.recordMemberOutput(member, familyTrigger.getImpliedOutput(),
                            familyTrigger.isImpliedOptional());
                }
            }
        }
    }

    /**
     * Renders one task node for the expanded expression; {@code finished}
     * becomes {@code (succeeded | failed)}.
     */
    private static String node(String name, String offset, String output, Set<String> trigs) {
        if (TaskOutputNames.FINISHED.equals(output)) {
            String succeeded = name + offset + ":" + TaskOutputNames.SUCCEEDED;
            String failed = name + offset + ":" + TaskOutputNames.FAILED;
            trigs.add(succeeded);
            trigs.add(failed);
            return "(" + succeeded + GraphSyntax.OP_OR + failed + ")";
        }
        String node = name + offset + ":" + output;
        trigs.add(node);
        return node;
    }

    private void setTriggers(String name, String expression, List<String> trigs, boolean suicide,
                             String originalExpression) throws GraphSemanticException {
        Map<String, TriggerSpec> expressions = triggers.computeIfAbsent(name, n -> new LinkedHashMap<>());
        TriggerSpec existing = expressions.get(expression);
        if (existing != null && !expression.isEmpty() && existing.suicide() != suicide) {
            String shown = originalExpression.replaceAll("([&|])", " $1 ").replace(":" + TaskOutputNames.SUCCEEDED, "");
            throw semantic(shown + " can't trigger both " + name + " and !" + name);
        }
        expressions.put(expression, new TriggerSpec(trigs, suicide, originalExpression));
    }

    private static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }

    private GraphSyntaxException syntax(String message) {
        return new GraphSyntaxException(config.getWorkflowName(), fieldPath, message);
    }

    private GraphSemanticException semantic(String message) {
        return new GraphSemanticException(config.getWorkflowName(), fieldPath, message);
    }
}
