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

import dev.mars.cyclus.workflow.task.WorkflowPollingReference;

import java.util.List;
import java.util.Map;

/**
 * Graph section text after normalization: one whitespace-free line per
 * dependency chain, plus the polling annotations that were stripped from it.
 *
 * @param lines normalized lines in source order
 * @param pollingReferences polling annotations keyed by local task name
 */
public record NormalizedGraph(List<String> lines, Map<String, WorkflowPollingReference> pollingReferences) {

    public NormalizedGraph {
        lines = List.copyOf(lines);
        pollingReferences = Map.copyOf(pollingReferences);
    }
}
