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

package dev.mars.cyclus.workflow.compiler;

import dev.mars.cyclus.cycling.CyclingSupport;
import dev.mars.cyclus.workflow.graph.GraphSyntax;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits graph nodes into name, offset and output.
 *
 * <p>Results are cached per node text; graphs repeat the same nodes many times.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class GraphNodeParser {

    private static final Pattern NODE = Pattern.compile(
            "^(" + GraphSyntax.NAME + ")(?:\\[([^\\]]*)\\])?(?::([\\w\\-]+))?$");

    private static final String INITIAL_POINT = "^";

    private final CyclingSupport cycling;
    private final ConcurrentMap<String, NodeReference> cache = new ConcurrentHashMap<>();

    public GraphNodeParser(CyclingSupport cycling) {
        this.cycling = Objects.requireNonNull(cycling, "Cycling support cannot be null");
    }

    /**
     * @throws IllegalArgumentException if {@code node} is not a task node
     */
    public NodeReference parse(String node) {
        NodeReference cached = cache.get(node);
        if (cached != null) {
            return cached;
        }
        NodeReference parsed = doParse(node);
        cache.putIfAbsent(node, parsed);
        return parsed;
    }

    private NodeReference doParse(String node) {
        Matcher matcher = NODE.matcher(node);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Illegal graph node: " + node);
        }
        String name = matcher.group(1);
        String offset = matcher.group(2);
        String output = matcher.group(3);
        if (offset == null || offset.isEmpty()) {
            return new NodeReference(name, null, output, false, false, false);
        }

        boolean fromInitialPoint = false;
        if (offset.startsWith(INITIAL_POINT)) {
            fromInitialPoint = true;
            offset = offset.substring(1);
            if (offset.isEmpty()) {
                offset = cycling.getNullInterval().getValue();
            }
        }
        boolean irregular = !cycling.isInterval(offset);
        boolean absolute = irregular && !fromInitialPoint;
        return new NodeReference(name, offset, output, fromInitialPoint, irregular, absolute);
    }
}
