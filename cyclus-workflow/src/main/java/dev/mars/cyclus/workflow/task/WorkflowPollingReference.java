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

/**
 * A local task that stands in for a task in another workflow, written in the
 * graph as {@code NAME<WORKFLOW::TASK:STATUS>}.
 *
 * @param workflow      the remote workflow
 * @param task          the remote task
 * @param status        the standardised remote status, {@code succeeded} by default
 * @param rawAnnotation the annotation as written, e.g. {@code <other::foo:fail>}
 */
public record WorkflowPollingReference(String workflow, String task, String status, String rawAnnotation) {
}
