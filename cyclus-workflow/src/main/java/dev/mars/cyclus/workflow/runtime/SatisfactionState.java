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

/**
 * State of one prerequisite leaf.
 */
public enum SatisfactionState {
    UNSATISFIED("unsatisfied"),
    SATISFIED_NATURALLY("satisfied naturally"),
    FORCE_SATISFIED("force satisfied");

    private final String description;

    SatisfactionState(String description) {
        this.description = description;
    }

    public boolean isSatisfied() {
        return this != UNSATISFIED;
    }

    public String getDescription() {
        return description;
    }
}
