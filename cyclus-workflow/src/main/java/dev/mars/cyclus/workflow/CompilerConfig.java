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

package dev.mars.cyclus.workflow;

import dev.mars.cyclus.config.CyclusConfiguration;

import java.util.Objects;

/**
 * Immutable settings threaded through every stage of graph compilation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class CompilerConfig {

    private static final int DEFAULT_MAX_EXPANDED_LINES = 100000;

    private final String workflowName;
    private final boolean backCompat;
    private final int maxExpandedLines;
    private final boolean metricsEnabled;

    private CompilerConfig(String workflowName, boolean backCompat, int maxExpandedLines, boolean metricsEnabled) {
        this.workflowName = workflowName;
        this.backCompat = backCompat;
        this.maxExpandedLines = maxExpandedLines;
        this.metricsEnabled = metricsEnabled;
    }

    public static CompilerConfig defaults() {
        return new CompilerConfig(null, false, DEFAULT_MAX_EXPANDED_LINES, true);
    }

    public static CompilerConfig fromConfiguration(CyclusConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        return new CompilerConfig(null, configuration.isBackCompat(),
                configuration.getMaxExpandedLines(), configuration.isMetricsEnabled());
    }

    public CompilerConfig withWorkflowName(String name) {
        return new CompilerConfig(name, backCompat, maxExpandedLines, metricsEnabled);
    }

    public CompilerConfig withBackCompat(boolean enabled) {
        return new CompilerConfig(workflowName, enabled, maxExpandedLines, metricsEnabled);
    }

    public CompilerConfig withMaxExpandedLines(int maxLines) {
        if (maxLines <= 0) {
            throw new IllegalArgumentException("Maximum expanded lines must be positive");
        }
        return new CompilerConfig(workflowName, backCompat, maxLines, metricsEnabled);
    }

    public CompilerConfig withMetricsEnabled(boolean enabled) {
        return new CompilerConfig(workflowName, backCompat, maxExpandedLines, enabled);
    }

    public String getWorkflowName() {
        return workflowName;
    }

    /**
     * True when output optionality conflicts are coerced to optional with a
     * warning instead of failing, and explicit completion is refused.
     */
    public boolean isBackCompat() {
        return backCompat;
    }

    public int getMaxExpandedLines() {
        return maxExpandedLines;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    @Override
    public String toString() {
        return "CompilerConfig{" +
                "workflowName='" + workflowName + '\'' +
                ", backCompat=" + backCompat +
                ", maxExpandedLines=" + maxExpandedLines +
                ", metricsEnabled=" + metricsEnabled +
                '}';
    }
}
