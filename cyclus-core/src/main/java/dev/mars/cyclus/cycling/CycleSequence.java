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

package dev.mars.cyclus.cycling;

/**
 * A recurring set of cycle points over which a graph section applies.
 *
 * <p>Implementations must provide value-based {@code equals} and
 * {@code hashCode}; sequences are used as map keys on task definitions.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public interface CycleSequence {

    /**
     * The expression this sequence was created from, e.g. {@code P1D}.
     */
    String getExpression();

    CyclePoint getStartPoint();

    /**
     * Returns the first point on the sequence at or after {@code point},
     * or {@code null} if there is none.
     */
    CyclePoint getFirstPoint(CyclePoint point);

    /**
     * Returns the next point on the sequence after {@code point},
     * or {@code null} if the sequence has ended.
     */
    CyclePoint getNextPoint(CyclePoint point);

    boolean isOnSequence(CyclePoint point);
}
