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

package dev.mars.cyclus.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the workflow graph compiler.
 *
 * Provides 7 compiler metrics:
 * - cyclus.graph.compiles.active (gauge) - Compilations in progress
 * - cyclus.graph.compiles.total (counter) - Compilations started
 * - cyclus.graph.compiles.succeeded (counter) - Successful compilations
 * - cyclus.graph.compiles.failed (counter) - Failed compilations
 * - cyclus.graph.compile.duration.seconds (histogram) - Compilation duration
 * - cyclus.graph.tasks.per_workflow (histogram) - Task definitions per compiled workflow
 * - cyclus.graph.triggers.per_workflow (histogram) - Distinct triggers per compiled workflow
 *
 * With no OpenTelemetry SDK registered every instrument is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0 (OpenTelemetry)
 */
public class GraphCompilerMetrics {

    private static final Logger logger = Logger.getLogger(GraphCompilerMetrics.class.getName());
    private static final String METER_NAME = "cyclus-workflow";

    // Singleton instance
    private static GraphCompilerMetrics instance;

    // Counters
    private final LongCounter compilesTotal;
    private final LongCounter compilesSucceeded;
    private final LongCounter compilesFailed;

    // Histograms
    private final DoubleHistogram compileDuration;
    private final LongHistogram tasksPerWorkflow;
    private final LongHistogram triggersPerWorkflow;

    // Gauges (backed by AtomicLong)
    private final AtomicLong activeCompiles = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> FAILURE_TYPE_KEY = AttributeKey.stringKey("failure.type");

    private GraphCompilerMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        compilesTotal = meter.counterBuilder("cyclus.graph.compiles.total")
                .setDescription("Total number of workflow graph compilations started")
                .setUnit("1")
                .build();

        compilesSucceeded = meter.counterBuilder("cyclus.graph.compiles.succeeded")
                .setDescription("Number of successful workflow graph compilations")
                .setUnit("1")
                .build();

        compilesFailed = meter.counterBuilder("cyclus.graph.compiles.failed")
                .setDescription("Number of failed workflow graph compilations")
                .setUnit("1")
                .build();

        compileDuration = meter.histogramBuilder("cyclus.graph.compile.duration.seconds")
                .setDescription("Workflow graph compilation duration in seconds")
                .setUnit("s")
                .build();

        tasksPerWorkflow = meter.histogramBuilder("cyclus.graph.tasks.per_workflow")
                .setDescription("Number of task definitions per compiled workflow")
                .setUnit("1")
                .ofLongs()
                .build();

        triggersPerWorkflow = meter.histogramBuilder("cyclus.graph.triggers.per_workflow")
                .setDescription("Number of distinct task triggers per compiled workflow")
                .setUnit("1")
                .ofLongs()
                .build();

        meter.gaugeBuilder("cyclus.graph.compiles.active")
                .setDescription("Number of workflow graph compilations in progress")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeCompiles.get()));

        logger.info("GraphCompilerMetrics initialized");
    }

    /**
     * Get the singleton instance of GraphCompilerMetrics.
     */
    public static synchronized GraphCompilerMetrics getInstance() {
        if (instance == null) {
            instance = new GraphCompilerMetrics();
        }
        return instance;
    }

    public void recordCompileStarted(String workflowName) {
        compilesTotal.add(1, attributes(workflowName));
        activeCompiles.incrementAndGet();
    }

    public void recordCompileSucceeded(String workflowName, double durationSeconds, int taskCount, int triggerCount) {
        activeCompiles.decrementAndGet();

        Attributes attrs = attributes(workflowName);
        compilesSucceeded.add(1, attrs);
        compileDuration.record(durationSeconds, attrs);
        tasksPerWorkflow.record(taskCount, attrs);
        triggersPerWorkflow.record(triggerCount, attrs);
    }

    /**
     * Record a failed compilation; {@code failureType} is the simple name of the exception.
     */
    public void recordCompileFailed(String workflowName, String failureType) {
        activeCompiles.decrementAndGet();

        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName != null ? workflowName : "unknown")
                .put(FAILURE_TYPE_KEY, failureType != null ? failureType : "unknown")
                .build();
        compilesFailed.add(1, attrs);
    }

    public long getActiveCompiles() {
        return activeCompiles.get();
    }

    private static Attributes attributes(String workflowName) {
        return Attributes.of(WORKFLOW_NAME_KEY, workflowName != null ? workflowName : "unknown");
    }
}
