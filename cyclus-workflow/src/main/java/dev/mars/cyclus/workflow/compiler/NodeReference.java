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

/**
 * A graph node split into its parts, e.g. {@code foo[^+P1]:x}.
 *
 * @param name task name
 * @param offset cycle point offset without brackets or the leading {@code ^}; null if none
 * @param output output qualifier without the colon; null if none
 * @param fromInitialPoint the offset is relative to the initial cycle point
 * @param irregular the offset is not a plain interval
 * @param absolute the offset names a cycle point rather than an interval
 */
public record NodeReference(String name, String offset, String output,
                            boolean fromInitialPoint, boolean irregular, boolean absolute) {

    public boolean hasOffset() {
        return offset != null;
    }
}
