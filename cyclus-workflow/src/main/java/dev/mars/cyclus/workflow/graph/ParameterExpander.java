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

package dev.mars.cyclus.workflow.graph;

import dev.mars.cyclus.workflow.ParameterExpansionException;

import java.util.List;

/**
 * Expands a graph line containing {@code <param>} groups into concrete lines.
 *
 * <p>A node whose parameter offset falls outside the parameter's values is
 * rendered with {@link GraphSyntax#REMOVE_MARKER} so that the chain
 * processor can drop it.
 */
@FunctionalInterface
public interface ParameterExpander {

    /** Expander for workflows without parameters: every group is undefined. */
    ParameterExpander NONE = line -> {
        throw new ParameterExpansionException("parameters are not defined: " + line);
    };

    List<String> expand(String line) throws ParameterExpansionException;
}
