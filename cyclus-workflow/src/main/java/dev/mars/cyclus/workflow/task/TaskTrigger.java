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

import dev.mars.cyclus.cycling.CyclePoint;
import dev.mars.cyclus.cycling.CycleSequence;
import dev.mars.cyclus.cycling.CyclingSupport;

import java.util.Objects;

/**
 * A resolved reference to one output of one upstream task at one offset.
 *
 * <p>Instances are interned per compiled workflow by {@link Key}: every
 * dependency that names the same upstream output at the same offset holds
 * the same object. Equality is defined by the key so that separately
 * compiled workflows can still be compared.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class TaskTrigger {

    /**
     * Identity of a trigger within one compiled workflow.
     */
    public record Key(String taskName, String cyclePointOffset, String output,
                      boolean offsetIsIrregular, boolean offsetIsAbsolute,
                      boolean offsetIsFromInitialPoint, String initialPoint) {
    }

    private final Key key;
    private final CyclePoint initialPoint;
    private final CyclingSupport cycling;

    public TaskTrigger(String taskName, String cyclePointOffset, String output,
                       boolean offsetIsIrregular, boolean offsetIsAbsolute, boolean offsetIsFromInitialPoint,
                       CyclePoint initialPoint, CyclingSupport cycling) {
        Objects.requireNonNull(taskName, "Task name cannot be null");
        Objects.requireNonNull(output, "Output cannot be null");
        // Irregular offsets that are relative (-PT6H+P1D, T00) are never absolute.
        boolean absolute = offsetIsAbsolute;
        if (offsetIsIrregular && cyclePointOffset != null && startsWithRelativeMarker(cyclePointOffset)) {
            absolute = false;
        }
        this.key = new Key(taskName, cyclePointOffset, output, offsetIsIrregular, absolute,
                offsetIsFromInitialPoint, initialPoint == null ? null : initialPoint.getValue());
        this.initialPoint = initialPoint;
        this.cycling = cycling;
    }

    private static boolean startsWithRelativeMarker(String offset) {
        return offset.startsWith("P") || offset.startsWith("+") || offset.startsWith("-") || offset.startsWith("T");
    }

    public Key getKey() {
        return key;
    }

    public String getTaskName() {
        return key.taskName();
    }

    public String getCyclePointOffset() {
        return key.cyclePointOffset();
    }

    /**
     * The output message this trigger waits for.
     */
    public String getOutput() {
        return key.output();
    }

    public boolean isOffsetIrregular() {
        return key.offsetIsIrregular();
    }

    public boolean isOffsetAbsolute() {
        return key.offsetIsAbsolute();
    }

    public boolean isOffsetFromInitialPoint() {
        return key.offsetIsFromInitialPoint();
    }

    public CyclePoint getInitialPoint() {
        return initialPoint;
    }

    /**
     * Returns the point of the upstream output relative to the given parent point.
     */
    public CyclePoint getParentPoint(CyclePoint fromPoint) {
        String offset = key.cyclePointOffset();
        if (offset == null) {
            return fromPoint;
        }
        if (key.offsetIsAbsolute()) {
            return cycling.getPoint(offset).standardise();
        }
        CyclePoint base = key.offsetIsFromInitialPoint() ? initialPoint : fromPoint;
        return cycling.getPointRelative(offset, base);
    }

    /**
     * Returns the point of the first child spawned by this trigger when the
     * upstream task is at {@code fromPoint}.
     */
    public CyclePoint getChildPoint(CyclePoint fromPoint, CycleSequence sequence) {
        String offset = key.cyclePointOffset();
        if (offset == null) {
            return fromPoint;
        }
        if (key.offsetIsAbsolute() || key.offsetIsFromInitialPoint()) {
            return sequence.getStartPoint();
        }
        if (key.offsetIsIrregular()) {
            return cycling.getPointRelative(invertSigns(offset), fromPoint);
        }
        return fromPoint.subtract(cycling.getInterval(offset));
    }

    /**
     * Returns the point of the output this trigger refers to, for a
     * dependent task at {@code point}.
     */
    public CyclePoint getPoint(CyclePoint point) {
        String offset = key.cyclePointOffset();
        if (key.offsetIsAbsolute()) {
            return cycling.getPoint(offset).standardise();
        }
        if (key.offsetIsFromInitialPoint()) {
            return cycling.getPointRelative(offset, initialPoint);
        }
        if (offset != null) {
            return cycling.getPointRelative(offset, point);
        }
        return point;
    }

    private static String invertSigns(String offset) {
        StringBuilder sb = new StringBuilder(offset.length());
        for (char c : offset.toCharArray()) {
            sb.append(c == '-' ? '+' : c == '+' ? '-' : c);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return key.equals(((TaskTrigger) o).key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        String offset = key.cyclePointOffset();
        if (!key.offsetIsIrregular() && key.offsetIsAbsolute()) {
            return key.taskName() + "[" + cycling.getPoint(offset).standardise().getValue() + "]:" + key.output();
        }
        if (offset != null) {
            return key.taskName() + "[" + offset + "]:" + key.output();
        }
        return key.taskName() + ":" + key.output();
    }
}
