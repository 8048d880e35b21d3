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

import dev.mars.cyclus.workflow.GraphSyntaxException;
import dev.mars.cyclus.workflow.task.TaskOutputNames;
import dev.mars.cyclus.workflow.task.WorkflowPollingReference;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;

/**
 * Turns the raw text of one graph section into complete, whitespace-free
 * dependency lines.
 *
 * <p>Comments and blank lines are dropped, lines that begin or end with an
 * arrow are joined to their neighbours, inter-workflow polling annotations
 * are extracted and every node is checked for legal format. Badly spaced
 * lines and badly formatted nodes are collected and reported together.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class GraphNormalizer {

    private static final Logger logger = Logger.getLogger(GraphNormalizer.class.getName());

    private final String workflowName;
    private final String fieldPath;

    public GraphNormalizer() {
        this(null, null);
    }

    /**
     * @param workflowName workflow name used in error messages, may be null
     * @param fieldPath configuration path of the graph section, may be null
     */
    public GraphNormalizer(String workflowName, String fieldPath) {
        this.workflowName = workflowName;
        this.fieldPath = fieldPath;
    }

    public NormalizedGraph normalize(String graphText) throws GraphSyntaxException {
        List<String> stripped = stripLines(graphText);
        Map<String, WorkflowPollingReference> polling = new LinkedHashMap<>();
        List<String> lines = new ArrayList<>();
        for (String line : joinContinuations(stripped)) {
            lines.add(extractPollingReferences(line, polling));
        }
        checkOperators(lines);
        checkNodeFormat(lines);
        logger.fine(() -> "Normalized " + lines.size() + " graph line(s)" + (fieldPath == null ? "" : " in " + fieldPath));
        return new NormalizedGraph(lines, polling);
    }

    private List<String> stripLines(String graphText) throws GraphSyntaxException {
        List<String> result = new ArrayList<>();
        List<String> badLines = new ArrayList<>();
        for (String line : graphText.split("\n", -1)) {
            String modified = GraphSyntax.COMMENT.matcher(line).replaceFirst("");
            if (modified.isBlank()) {
                continue;
            }
            if (GraphSyntax.BAD_SPACES.matcher(modified).find()) {
                badLines.add(line);
                continue;
            }
            result.add(GraphSyntax.WHITESPACE.matcher(modified).replaceAll(""));
        }
        if (!badLines.isEmpty()) {
            throw error(GraphSyntax.badNodeFormat(badLines));
        }
        return result;
    }

    private List<String> joinContinuations(List<String> lines) throws GraphSyntaxException {
        List<String> full = new ArrayList<>();
        StringBuilder part = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (i == 0 && line.startsWith(GraphSyntax.ARROW)) {
                throw error("Leading arrow: " + line);
            }
            String next = i + 1 < lines.size() ? lines.get(i + 1) : null;
            if (next == null && line.endsWith(GraphSyntax.ARROW)) {
                throw error("Trailing arrow: " + line);
            }
            if (next != null && line.endsWith(GraphSyntax.ARROW) && next.startsWith(GraphSyntax.ARROW)) {
                throw error("Consecutive lines end and start with an arrow:\n  " + line + "\n  " + next);
            }
            part.append(line);
            if (line.endsWith(GraphSyntax.ARROW) || (next != null && next.startsWith(GraphSyntax.ARROW))) {
                continue;
            }
            full.add(part.toString());
            part.setLength(0);
        }
        return full;
    }

    private static String extractPollingReferences(String line, Map<String, WorkflowPollingReference> polling) {
        Matcher matcher = GraphSyntax.WORKFLOW_STATE.matcher(line);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String localName = matcher.group(1);
            String status = matcher.group(5);
            status = status == null
                    ? TaskOutputNames.SUCCEEDED
                    : TaskOutputNames.standardise(status.substring(1));
            polling.put(localName, new WorkflowPollingReference(matcher.group(3), matcher.group(4), status, matcher.group(2)));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(localName));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private void checkOperators(List<String> lines) throws GraphSyntaxException {
        for (String line : lines) {
            if (line.contains(GraphSyntax.OP_AND_ERR)) {
                throw error("The graph AND operator is '" + GraphSyntax.OP_AND + "': " + line);
            }
            if (line.contains(GraphSyntax.OP_OR_ERR)) {
                throw error("The graph OR operator is '" + GraphSyntax.OP_OR + "': " + line);
            }
        }
    }

    private void checkNodeFormat(List<String> lines) throws GraphSyntaxException {
        List<String> badLines = new ArrayList<>();
        for (String line : lines) {
            String nodes = line;
            for (String structural : new String[]{GraphSyntax.ARROW, GraphSyntax.OP_OR, GraphSyntax.OP_AND,
                    GraphSyntax.SUICIDE, "(", ")"}) {
                nodes = nodes.replace(structural, " ");
            }
            // Longest first so that @a does not eat into @ab.
            List<String> actions = new ArrayList<>();
            Matcher matcher = GraphSyntax.ACTION_TOKEN.matcher(nodes);
            while (matcher.find()) {
                actions.add(matcher.group());
            }
            actions.sort((a, b) -> Integer.compare(b.length(), a.length()));
            for (String action : actions) {
                nodes = nodes.replace(action, "");
            }
            for (String node : nodes.trim().split("\\s+")) {
                if (!node.isEmpty() && !GraphSyntax.NODE_FULL.matcher(node).replaceFirst("").isEmpty()) {
                    badLines.add(line);
                    break;
                }
            }
        }
        if (!badLines.isEmpty()) {
            throw error(GraphSyntax.badNodeFormat(badLines));
        }
    }

    private GraphSyntaxException error(String message) {
        return new GraphSyntaxException(workflowName, fieldPath, message);
    }
}
