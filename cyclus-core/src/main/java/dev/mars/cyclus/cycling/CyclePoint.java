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
 * An opaque cycle point supplied by the cycling implementation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public interface CyclePoint extends Comparable<CyclePoint> {

    CyclePoint add(CycleInterval interval);

    CyclePoint subtract(CycleInterval interval);

    /**
     * Returns the interval from {@code other} to this point.
     */
    CycleInterval intervalSince(CyclePoint other);

    /**
     * Returns the canonical form of this point.
     */
    CyclePoint standardise();

    String getValue();
}
