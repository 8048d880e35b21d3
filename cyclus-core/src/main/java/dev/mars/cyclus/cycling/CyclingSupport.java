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
 * Cycle point and interval arithmetic used by the compiler and by
 * runtime prerequisite resolution.
 *
 * <p>Parsing methods throw {@link IllegalArgumentException} for values they
 * cannot interpret.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public interface CyclingSupport {

    CyclePoint getPoint(String value);

    /**
     * Resolves an offset, regular ({@code -P1D}) or irregular ({@code T06}),
     * against {@code base}.
     */
    CyclePoint getPointRelative(String offset, CyclePoint base);

    CycleInterval getInterval(String value);

    /**
     * Returns true if {@code value} is a plain interval such as {@code -P1}.
     */
    boolean isInterval(String value);

    /**
     * The zero-length offset, used for {@code [^]} references.
     */
    CycleInterval getNullInterval();

    CycleSequence getSequence(String expression, String initialPoint, String finalPoint);
}
