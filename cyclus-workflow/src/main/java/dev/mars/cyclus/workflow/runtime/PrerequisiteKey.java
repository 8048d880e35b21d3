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

package dev.mars.cyclus.workflow.runtime;

import java.util.Objects;

/**
 * One concrete upstream output: task name, cycle point and output message.
 *
 * @param taskName the upstream task
 * @param point    the upstream cycle point value
 * @param output   the output message
 */
public record PrerequisiteKey(String taskName, String point, String output) implements Comparable<PrerequisiteKey> {

    public PrerequisiteKey {
        Objects.requireNonNull(taskName, "Task name cannot be null");
        Objects.requireNonNull(point, "Point cannot be null");
        Objects.requireNonNull(output, "Output cannot be null");
    }

    /**
     * Task identifier without the output, e.g. {@code foo.1}.
     */
    public String getTaskId() {
        return taskName + "." + point;
    }

    @Override
    public int compareTo(PrerequisiteKey other) {
        int result = taskName.compareTo(other.taskName);
        if (result == 0) {
            result = point.compareTo(other.point);
        }
        if (result == 0) {
            result = output.compareTo(other.output);
        }
        return result;
    }

    @Override
    public String toString() {
        return getTaskId() + " " + output;
    }
}
