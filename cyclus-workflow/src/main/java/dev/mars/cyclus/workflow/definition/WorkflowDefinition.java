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

package dev.mars.cyclus.workflow.definition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A workflow as read from its definition file: scheduling settings, graph
 * sections, parameters and runtime namespaces.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class WorkflowDefinition {

    private final String name;
    private final SchedulingConfig scheduling;
    private final ParameterConfig parameters;
    private final Map<String, RuntimeNamespace> runtime;

    public WorkflowDefinition(String name, SchedulingConfig scheduling, ParameterConfig parameters,
                              Map<String, RuntimeNamespace> runtime) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.scheduling = Objects.requireNonNull(scheduling, "Scheduling cannot be null");
        this.parameters = parameters != null ? parameters : new ParameterConfig(Map.of(), Map.of());
        this.runtime = runtime != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(runtime))
                : Map.of();
    }

    public String getName() {
        return name;
    }

    public SchedulingConfig getScheduling() {
        return scheduling;
    }

    public ParameterConfig getParameters() {
        return parameters;
    }

    public Map<String, RuntimeNamespace> getRuntime() {
        return runtime;
    }

    public RuntimeNamespace getNamespace(String namespace) {
        return runtime.get(namespace);
    }

    /**
     * Task members of each family. A family is a namespace inherited by
     * others; its members are the descendants that nothing inherits from.
     */
    public Map<String, List<String>> getFamilyMap() {
        Map<String, List<String>> children = new LinkedHashMap<>();
        for (RuntimeNamespace namespace : runtime.values()) {
            for (String parent : namespace.getInherit()) {
                children.computeIfAbsent(parent, p -> new ArrayList<>()).add(namespace.getName());
            }
        }
        Map<String, List<String>> families = new LinkedHashMap<>();
        for (String family : children.keySet()) {
            Set<String> members = new LinkedHashSet<>();
            collectLeafDescendants(family, children, members, new LinkedHashSet<>());
            families.put(family, List.copyOf(members));
        }
        return families;
    }

    /**
     * The namespace followed by its ancestors, nearest first; each parent's
     * line is followed depth first and a namespace appears once.
     */
    public List<String> getAncestors(String namespace) {
        List<String> result = new ArrayList<>();
        collectAncestors(namespace, new LinkedHashSet<>(), result);
        return result;
    }

    private void collectAncestors(String namespace, Set<String> visiting, List<String> result) {
        if (result.contains(namespace) || !visiting.add(namespace)) {
            return;
        }
        result.add(namespace);
        RuntimeNamespace definition = runtime.get(namespace);
        if (definition != null) {
            for (String parent : definition.getInherit()) {
                collectAncestors(parent, visiting, result);
            }
        }
    }

    /**
     * Custom outputs of a task including those inherited; nearer namespaces win.
     */
    public Map<String, String> getEffectiveOutputs(String taskName) {
        List<String> ancestors = getAncestors(taskName);
        Map<String, String> outputs = new LinkedHashMap<>();
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            RuntimeNamespace definition = runtime.get(ancestors.get(i));
            if (definition != null) {
                outputs.putAll(definition.getOutputs());
            }
        }
        return outputs;
    }

    public String getEffectiveCompletion(String taskName) {
        for (String namespace : getAncestors(taskName)) {
            RuntimeNamespace definition = runtime.get(namespace);
            if (definition != null && definition.getCompletion() != null) {
                return definition.getCompletion();
            }
        }
        return null;
    }

    private static void collectLeafDescendants(String namespace, Map<String, List<String>> children,
                                               Set<String> members, Set<String> visited) {
        if (!visited.add(namespace)) {
            return;
        }
        for (String child : children.getOrDefault(namespace, List.of())) {
            if (children.containsKey(child)) {
                collectLeafDescendants(child, children, members, visited);
            } else {
                members.add(child);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(scheduling, that.scheduling) &&
               Objects.equals(parameters, that.parameters) &&
               Objects.equals(runtime, that.runtime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, scheduling, parameters, runtime);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "name='" + name + '\'' +
               ", scheduling=" + scheduling +
               ", parameters=" + parameters +
               ", runtime=" + runtime.keySet() +
               '}';
    }

    public static class SchedulingConfig {
        private final String initialCyclePoint;
        private final String finalCyclePoint;
        private final Map<String, String> xtriggers;
        private final Map<String, String> graph;

        /**
         * @param initialCyclePoint initial cycle point, may be null
         * @param finalCyclePoint final cycle point, may be null
         * @param xtriggers declared xtrigger labels mapped to their function signature
         * @param graph graph sections in definition order, recurrence to graph text
         */
        public SchedulingConfig(String initialCyclePoint, String finalCyclePoint,
                                Map<String, String> xtriggers, Map<String, String> graph) {
            this.initialCyclePoint = initialCyclePoint;
            this.finalCyclePoint = finalCyclePoint;
            this.xtriggers = xtriggers != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(xtriggers)) : Map.of();
            this.graph = graph != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(graph)) : Map.of();
        }

        public String getInitialCyclePoint() {
            return initialCyclePoint;
        }

        public String getFinalCyclePoint() {
            return finalCyclePoint;
        }

        public Map<String, String> getXtriggers() {
            return xtriggers;
        }

        public Map<String, String> getGraph() {
            return graph;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            SchedulingConfig that = (SchedulingConfig) o;
            return Objects.equals(initialCyclePoint, that.initialCyclePoint) &&
                   Objects.equals(finalCyclePoint, that.finalCyclePoint) &&
                   Objects.equals(xtriggers, that.xtriggers) &&
                   Objects.equals(graph, that.graph);
        }

        @Override
        public int hashCode() {
            return Objects.hash(initialCyclePoint, finalCyclePoint, xtriggers, graph);
        }

        @Override
        public String toString() {
            return "SchedulingConfig{" +
                   "initialCyclePoint='" + initialCyclePoint + '\'' +
                   ", finalCyclePoint='" + finalCyclePoint + '\'' +
                   ", xtriggers=" + xtriggers.keySet() +
                   ", graph=" + graph.keySet() +
                   '}';
        }
    }

    public static class ParameterConfig {
        private final Map<String, List<String>> values;
        private final Map<String, String> templates;

        public ParameterConfig(Map<String, List<String>> values, Map<String, String> templates) {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            if (values != null) {
                values.forEach((name, list) -> copy.put(name, List.copyOf(list)));
            }
            this.values = Collections.unmodifiableMap(copy);
            this.templates = templates != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(templates)) : Map.of();
        }

        public Map<String, List<String>> getValues() {
            return values;
        }

        public Map<String, String> getTemplates() {
            return templates;
        }

        public boolean isEmpty() {
            return values.isEmpty();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ParameterConfig that = (ParameterConfig) o;
            return Objects.equals(values, that.values) &&
                   Objects.equals(templates, that.templates);
        }

        @Override
        public int hashCode() {
            return Objects.hash(values, templates);
        }

        @Override
        public String toString() {
            return "ParameterConfig{values=" + values + ", templates=" + templates + '}';
        }
    }
}
