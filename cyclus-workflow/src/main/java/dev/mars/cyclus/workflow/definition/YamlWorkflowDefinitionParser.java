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

import dev.mars.cyclus.workflow.ValidationResult;
import dev.mars.cyclus.workflow.WorkflowParseException;
import dev.mars.cyclus.workflow.task.TaskOutputNames;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * YAML-based implementation of WorkflowDefinitionParser.
 * Parses YAML workflow definitions using SnakeYAML.
 *
 * <pre>
 * name: demo
 * scheduling:
 *   initial-cycle-point: 1
 *   final-cycle-point: 5
 *   xtriggers: { clock: wall_clock }
 *   graph:
 *     R1: "prep => foo"
 *     P1: "foo[-P1] => bar"
 * parameters:
 *   values: { m: [1, 2] }
 *   templates: { m: "_m%(m)s" }
 * runtime:
 *   FAM: {}
 *   m1: { inherit: FAM }
 *   foo:
 *     outputs: { x: "file written" }
 *     completion: "succeeded and x"
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlWorkflowDefinitionParser implements WorkflowDefinitionParser {

    private static final Logger logger = Logger.getLogger(YamlWorkflowDefinitionParser.class.getName());

    private static final Set<String> TOP_LEVEL_KEYS = Set.of("name", "scheduling", "parameters", "runtime");

    private final Yaml yaml;

    public YamlWorkflowDefinitionParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
    }

    @Override
    public WorkflowDefinition parse(Path yamlFile) throws WorkflowParseException {
        try {
            String content = Files.readString(yamlFile);
            return parseFromString(content);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read YAML file: " + yamlFile, e);
        }
    }

    @Override
    public WorkflowDefinition parseFromString(String yamlContent) throws WorkflowParseException {
        try {
            Object loaded = yaml.load(yamlContent);
            if (!(loaded instanceof Map)) {
                throw new WorkflowParseException("Empty or invalid YAML content");
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> data = (Map<String, Object>) loaded;
            WorkflowDefinition definition = parseWorkflowDefinition(data);
            logger.fine(() -> "Parsed workflow '" + definition.getName() + "' with "
                    + definition.getScheduling().getGraph().size() + " graph section(s)");
            return definition;
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed", e);
        }
    }

    @Override
    public ValidationResult validate(WorkflowDefinition definition) {
        ValidationResult result = new ValidationResult();

        if (definition.getName().trim().isEmpty()) {
            result.addError("name", "Workflow name cannot be empty");
        }

        validateScheduling(definition, result);
        validateRuntime(definition, result);

        return result;
    }

    @Override
    public ValidationResult validateSchema(String yamlContent) {
        ValidationResult result = new ValidationResult();

        try {
            Object loaded = yaml.load(yamlContent);
            if (!(loaded instanceof Map)) {
                result.addError(null, "Empty or invalid YAML content");
                return result;
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> data = (Map<String, Object>) loaded;
            validateRequiredFields(data, result);
        } catch (YAMLException e) {
            result.addError(null, "YAML syntax error: " + e.getMessage());
        }

        return result;
    }

    private WorkflowDefinition parseWorkflowDefinition(Map<String, Object> data) throws WorkflowParseException {
        String name = getStringValue(data, "name");
        if (name == null || name.trim().isEmpty()) {
            throw new WorkflowParseException(null, "name", "Workflow name is required");
        }

        WorkflowDefinition.SchedulingConfig scheduling = parseScheduling(name, getMapValue(data, "scheduling"));
        WorkflowDefinition.ParameterConfig parameters = parseParameters(name, getMapValue(data, "parameters"));
        Map<String, RuntimeNamespace> runtime = parseRuntime(name, getMapValue(data, "runtime"));

        return new WorkflowDefinition(name, scheduling, parameters, runtime);
    }

    private WorkflowDefinition.SchedulingConfig parseScheduling(String workflow, Map<String, Object> data)
            throws WorkflowParseException {
        if (data == null) {
            throw new WorkflowParseException(workflow, "scheduling", "Scheduling section is required");
        }
        String initial = getStringValue(data, "initial-cycle-point");
        String last = getStringValue(data, "final-cycle-point");

        Map<String, String> xtriggers = new LinkedHashMap<>();
        Map<String, Object> xtriggerMap = getMapValue(data, "xtriggers");
        if (xtriggerMap != null) {
            for (Map.Entry<String, Object> entry : xtriggerMap.entrySet()) {
                xtriggers.put(entry.getKey(), entry.getValue() == null ? "" : entry.getValue().toString());
            }
        }

        Map<String, String> graph = new LinkedHashMap<>();
        Map<String, Object> graphMap = getMapValue(data, "graph");
        if (graphMap != null) {
            for (Map.Entry<String, Object> entry : graphMap.entrySet()) {
                if (!(entry.getValue() instanceof String)) {
                    throw new WorkflowParseException(workflow, "scheduling.graph." + entry.getKey(),
                            "Graph section must be a string");
                }
                graph.put(String.valueOf(entry.getKey()), (String) entry.getValue());
            }
        }
        return new WorkflowDefinition.SchedulingConfig(initial, last, xtriggers, graph);
    }

    private WorkflowDefinition.ParameterConfig parseParameters(String workflow, Map<String, Object> data)
            throws WorkflowParseException {
        if (data == null) {
            return new WorkflowDefinition.ParameterConfig(Map.of(), Map.of());
        }
        Map<String, List<String>> values = new LinkedHashMap<>();
        Map<String, Object> valueMap = getMapValue(data, "values");
        if (valueMap != null) {
            for (Map.Entry<String, Object> entry : valueMap.entrySet()) {
                values.put(entry.getKey(), parseParameterValues(workflow, entry.getKey(), entry.getValue()));
            }
        }
        Map<String, String> templates = new LinkedHashMap<>();
        Map<String, Object> templateMap = getMapValue(data, "templates");
        if (templateMap != null) {
            for (Map.Entry<String, Object> entry : templateMap.entrySet()) {
                templates.put(entry.getKey(), String.valueOf(entry.getValue()));
            }
        }
        return new WorkflowDefinition.ParameterConfig(values, templates);
    }

    /**
     * Parameter values from a YAML list or a string of comma-separated
     * items, where an item may be an integer range {@code 1..5} or
     * {@code 0..10..2}.
     */
    private List<String> parseParameterValues(String workflow, String name, Object value) throws WorkflowParseException {
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                result.add(String.valueOf(item));
            }
            return result;
        }
        if (value == null) {
            return result;
        }
        for (String item : value.toString().split(",")) {
            String trimmed = item.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (!trimmed.contains("..")) {
                result.add(trimmed);
                continue;
            }
            String[] bounds = trimmed.split("\\.\\.");
            try {
                int lower = Integer.parseInt(bounds[0].trim());
                int upper = Integer.parseInt(bounds[1].trim());
                int step = bounds.length > 2 ? Integer.parseInt(bounds[2].trim()) : 1;
                if (bounds.length > 3 || step <= 0) {
                    throw new NumberFormatException(trimmed);
                }
                for (int i = lower; i <= upper; i += step) {
                    result.add(Integer.toString(i));
                }
            } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                throw new WorkflowParseException(workflow, -1, "parameters.values." + name,
                        "Illegal parameter range: " + trimmed, e);
            }
        }
        return result;
    }

    private Map<String, RuntimeNamespace> parseRuntime(String workflow, Map<String, Object> data)
            throws WorkflowParseException {
        Map<String, RuntimeNamespace> runtime = new LinkedHashMap<>();
        if (data == null) {
            return runtime;
        }
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            String namespace = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (value != null && !(value instanceof Map)) {
                throw new WorkflowParseException(workflow, "runtime." + namespace,
                        "Runtime namespace must be a mapping");
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> settings = (Map<String, Object>) value;
            List<String> inherit = parseInherit(getRawValue(settings, "inherit"));
            Map<String, String> outputs = new LinkedHashMap<>();
            Map<String, Object> outputMap = getMapValue(settings, "outputs");
            if (outputMap != null) {
                for (Map.Entry<String, Object> output : outputMap.entrySet()) {
                    outputs.put(String.valueOf(output.getKey()),
                            output.getValue() == null ? "" : output.getValue().toString());
                }
            }
            runtime.put(namespace, new RuntimeNamespace(namespace, inherit, outputs,
                    getStringValue(settings, "completion")));
        }
        return runtime;
    }

    private List<String> parseInherit(Object value) {
        List<String> inherit = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                inherit.add(String.valueOf(item).trim());
            }
        } else if (value != null) {
            for (String item : value.toString().split(",")) {
                if (!item.trim().isEmpty()) {
                    inherit.add(item.trim());
                }
            }
        }
        return inherit;
    }

    // Utility methods for safe type conversion
    private Object getRawValue(Map<String, Object> data, String key) {
        return data == null ? null : data.get(key);
    }

    private String getStringValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    private void validateRequiredFields(Map<String, Object> data, ValidationResult result) {
        if (!data.containsKey("name")) {
            result.addError("name", "Required field 'name' is missing");
        }

        Map<String, Object> scheduling = getMapValue(data, "scheduling");
        if (scheduling == null) {
            result.addError("scheduling", "Required field 'scheduling' is missing");
        } else if (getMapValue(scheduling, "graph") == null) {
            result.addError("scheduling.graph", "Required field 'scheduling.graph' is missing");
        }

        for (String key : data.keySet()) {
            if (!TOP_LEVEL_KEYS.contains(key)) {
                result.addWarning(key, "Unknown top-level field '" + key + "'");
            }
        }
    }

    private void validateScheduling(WorkflowDefinition definition, ValidationResult result) {
        WorkflowDefinition.SchedulingConfig scheduling = definition.getScheduling();
        if (scheduling.getGraph().isEmpty()) {
            result.addWarning("scheduling.graph", "No graph sections defined");
        }
        for (Map.Entry<String, String> section : scheduling.getGraph().entrySet()) {
            if (section.getValue().trim().isEmpty()) {
                result.addWarning("scheduling.graph." + section.getKey(), "Empty graph section");
            }
        }
        for (String label : scheduling.getXtriggers().keySet()) {
            if (definition.getRuntime().containsKey(label)) {
                result.addError("scheduling.xtriggers." + label, "Namespace and xtrigger names clash: " + label);
            }
        }
    }

    private void validateRuntime(WorkflowDefinition definition, ValidationResult result) {
        Map<String, RuntimeNamespace> runtime = definition.getRuntime();
        for (RuntimeNamespace namespace : runtime.values()) {
            String path = "runtime." + namespace.getName();
            for (String parent : namespace.getInherit()) {
                if (!runtime.containsKey(parent) && !"root".equals(parent)) {
                    result.addError(path + ".inherit", "Undefined parent namespace: " + parent);
                }
            }
            if (inheritsFrom(namespace.getName(), namespace.getName(), runtime, new HashSet<>())) {
                result.addError(path + ".inherit", "Circular inheritance involving namespace: " + namespace.getName());
            }
            for (Map.Entry<String, String> output : namespace.getOutputs().entrySet()) {
                String outputPath = path + ".outputs." + output.getKey();
                if (TaskOutputNames.isStandard(output.getKey())
                        || TaskOutputNames.FINISHED.equals(output.getKey())) {
                    result.addError(outputPath, "Custom output name is reserved: " + output.getKey());
                }
                if (output.getValue().trim().isEmpty()) {
                    result.addError(outputPath, "Output message cannot be empty");
                }
            }
            if (namespace.getCompletion() != null && namespace.getCompletion().trim().isEmpty()) {
                result.addWarning(path + ".completion", "Empty completion expression is ignored");
            }
        }
    }

    private boolean inheritsFrom(String start, String current, Map<String, RuntimeNamespace> runtime, Set<String> visited) {
        RuntimeNamespace namespace = runtime.get(current);
        if (namespace == null || !visited.add(current)) {
            return false;
        }
        for (String parent : namespace.getInherit()) {
            if (parent.equals(start) || inheritsFrom(start, parent, runtime, visited)) {
                return true;
            }
        }
        return false;
    }
}
