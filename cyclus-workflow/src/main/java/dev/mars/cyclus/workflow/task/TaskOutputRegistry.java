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

package dev.mars.cyclus.workflow.task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-task output registry: output name to message and requirement.
 *
 * <p>The standard outputs are always present with their own name as message.
 * Custom outputs are added from runtime configuration. The registry is only
 * mutated while a workflow is being compiled.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class TaskOutputRegistry {

    private final Map<String, String> messages = new LinkedHashMap<>();
    private final Map<String, OutputRequirement> requirements = new LinkedHashMap<>();

    public TaskOutputRegistry() {
        for (String output : TaskOutputNames.STANDARD_OUTPUTS) {
            messages.put(output, output);
            requirements.put(output, OutputRequirement.UNSET);
        }
    }

    public void add(String output, String message) {
        Objects.requireNonNull(output, "Output name cannot be null");
        Objects.requireNonNull(message, "Output message cannot be null");
        messages.put(output, message);
        requirements.putIfAbsent(output, OutputRequirement.UNSET);
    }

    public boolean contains(String output) {
        return messages.containsKey(output);
    }

    public String getMessage(String output) {
        return messages.get(output);
    }

    /**
     * Returns the output name registered for {@code message}, or {@code null}.
     */
    public String getOutputForMessage(String message) {
        for (Map.Entry<String, String> entry : messages.entrySet()) {
            if (entry.getValue().equals(message)) {
                return entry.getKey();
            }
        }
        return null;
    }

    public void setRequirement(String output, OutputRequirement requirement) {
        if (!messages.containsKey(output)) {
            throw new IllegalArgumentException("Unknown output: " + output);
        }
        requirements.put(output, requirement);
    }

    public OutputRequirement getRequirement(String output) {
        return requirements.getOrDefault(output, OutputRequirement.UNSET);
    }

    public boolean isRequired(String output) {
        return getRequirement(output) == OutputRequirement.REQUIRED;
    }

    public boolean isOptional(String output) {
        return getRequirement(output) == OutputRequirement.OPTIONAL;
    }

    /**
     * Output names in standard order.
     */
    public List<String> getOutputNames() {
        List<String> names = new ArrayList<>(messages.keySet());
        names.sort(TaskOutputNames.OUTPUT_ORDER);
        return names;
    }

    public List<String> getRequired() {
        return filter(OutputRequirement.REQUIRED);
    }

    public List<String> getOptional() {
        return filter(OutputRequirement.OPTIONAL);
    }

    public Map<String, String> getMessages() {
        return Collections.unmodifiableMap(messages);
    }

    private List<String> filter(OutputRequirement requirement) {
        List<String> result = new ArrayList<>();
        for (String name : getOutputNames()) {
            if (requirements.get(name) == requirement) {
                result.add(name);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "TaskOutputRegistry" + requirements;
    }
}
