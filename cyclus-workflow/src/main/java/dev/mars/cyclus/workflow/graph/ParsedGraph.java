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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependencies found in one graph section.
 *
 * @param triggers for every right-side task, its left-side expressions
 *        (families expanded, qualifiers explicit) mapped to their trigger specs
 * @param pollingReferences polling annotations keyed by local task name
 * @param lines the expanded lines the dependencies came from
 */
public record ParsedGraph(Map<String, Map<String, TriggerSpec>> triggers,
                          Map<String, WorkflowPollingReference> pollingReferences,
                          List<String> lines) {

    public ParsedGraph {
        Map<String, Map<String, TriggerSpec>> copy = new LinkedHashMap<>();
        triggers.forEach((name, expressions) ->
                copy.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(expressions))));
        triggers = Collections.unmodifiableMap(copy);
        pollingReferences = Map.copyOf(pollingReferences);
        lines = List.copyOf(lines);
    }

    public Map<String, TriggerSpec> getTriggers(String taskName) {
        return triggers.getOrDefault(taskName, Map.of());
    }
}
