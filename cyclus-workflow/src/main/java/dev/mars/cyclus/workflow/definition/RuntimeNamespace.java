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

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runtime configuration of one task or family namespace.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class RuntimeNamespace {

    private final String name;
    private final List<String> inherit;
    private final Map<String, String> outputs;
    private final String completion;

    /**
     * @param name namespace name
     * @param inherit parent namespaces, first parent first
     * @param outputs custom outputs, output name to task message
     * @param completion explicit completion expression, or {@code null}
     */
    public RuntimeNamespace(String name, List<String> inherit, Map<String, String> outputs, String completion) {
        this.name = Objects.requireNonNull(name, "Namespace name cannot be null");
        this.inherit = inherit != null ? List.copyOf(inherit) : List.of();
        this.outputs = outputs != null ? Map.copyOf(outputs) : Map.of();
        this.completion = completion;
    }

    public RuntimeNamespace(String name) {
        this(name, List.of(), Map.of(), null);
    }

    public String getName() {
        return name;
    }

    public List<String> getInherit() {
        return inherit;
    }

    public Map<String, String> getOutputs() {
        return outputs;
    }

    public String getCompletion() {
        return completion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RuntimeNamespace that = (RuntimeNamespace) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(inherit, that.inherit) &&
               Objects.equals(outputs, that.outputs) &&
               Objects.equals(completion, that.completion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, inherit, outputs, completion);
    }

    @Override
    public String toString() {
        return "RuntimeNamespace{" +
               "name='" + name + '\'' +
               ", inherit=" + inherit +
               ", outputs=" + outputs +
               ", completion='" + completion + '\'' +
               '}';
    }
}
