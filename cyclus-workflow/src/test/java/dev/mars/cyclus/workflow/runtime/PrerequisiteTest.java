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

import dev.mars.cyclus.expression.ExpressionNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Description for PrerequisiteTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
class PrerequisiteTest {

    private static final PrerequisiteKey FOO = new PrerequisiteKey("foo", "1", "succeeded");
    private static final PrerequisiteKey BAR = new PrerequisiteKey("bar", "1", "failed");

    private Prerequisite prerequisite;

    @BeforeEach
    void setUp() {
        prerequisite = new Prerequisite(null);
        prerequisite.add("foo", "1", "succeeded");
        prerequisite.add("bar", "1", "failed");
    }

    @Test
    void testEmptyPrerequisiteIsSatisfied() {
        assertTrue(new Prerequisite(null).isSatisfied());
    }

    @Test
    void testAllLeavesRequiredWithoutCondition() {
        assertFalse(prerequisite.isSatisfied());
        assertTrue(prerequisite.satisfy(FOO));
        assertFalse(prerequisite.isSatisfied());
        assertTrue(prerequisite.satisfy(BAR));
        assertTrue(prerequisite.isSatisfied());
    }

    @Test
    void testConditionalPrerequisite() {
        prerequisite.setCondition(ExpressionNode.or(ExpressionNode.leaf(FOO), ExpressionNode.leaf(BAR)));

        assertFalse(prerequisite.isSatisfied());
        prerequisite.satisfy(BAR);
        assertTrue(prerequisite.isSatisfied());
        assertEquals("foo.1 succeeded | bar.1 failed", prerequisite.getConditionalExpression());
    }

    @Test
    void testConditionMustUseRegisteredLeaves() {
        PrerequisiteKey other = new PrerequisiteKey("baz", "1", "succeeded");
        assertThrows(IllegalArgumentException.class,
                () -> prerequisite.setCondition(ExpressionNode.leaf(other)));
    }

    @Test
    void testPreInitialLeafStartsSatisfied() {
        Prerequisite withPreInitial = new Prerequisite(null);
        withPreInitial.add("foo", "0", "succeeded", true);

        assertTrue(withPreInitial.isSatisfied());
        assertEquals(SatisfactionState.SATISFIED_NATURALLY,
                withPreInitial.getState(new PrerequisiteKey("foo", "0", "succeeded")));
    }

    @Test
    void testSatisfyIgnoresUnknownAndRepeatedLeaves() {
        assertFalse(prerequisite.satisfy(new PrerequisiteKey("baz", "1", "succeeded")));
        assertTrue(prerequisite.satisfy(FOO));
        assertFalse(prerequisite.satisfy(FOO));
    }

    @Test
    void testSatisfyMe() {
        PrerequisiteKey unrelated = new PrerequisiteKey("baz", "1", "succeeded");

        assertEquals(Set.of(FOO), prerequisite.satisfyMe(List.of(FOO, unrelated)));
        assertEquals(SatisfactionState.SATISFIED_NATURALLY, prerequisite.getState(FOO));
        assertFalse(prerequisite.isSatisfied());
    }

    @Test
    void testForceSatisfyKeepsNaturalLeaves() {
        prerequisite.satisfy(FOO);
        prerequisite.setSatisfied();

        assertTrue(prerequisite.isSatisfied());
        assertEquals(SatisfactionState.SATISFIED_NATURALLY, prerequisite.getState(FOO));
        assertEquals(SatisfactionState.FORCE_SATISFIED, prerequisite.getState(BAR));
        assertEquals(List.of("foo.1"), prerequisite.getResolvedDependencies());
    }

    @Test
    void testSetNotSatisfied() {
        prerequisite.setSatisfied();
        prerequisite.setNotSatisfied();

        assertFalse(prerequisite.isSatisfied());
        assertEquals(SatisfactionState.UNSATISFIED, prerequisite.getState(FOO));
        assertTrue(prerequisite.getResolvedDependencies().isEmpty());
    }

    @Test
    void testTargetPointsAreDistinct() {
        prerequisite.add("baz", "2", "succeeded");
        assertEquals(List.of("1", "2"), prerequisite.getTargetPointStrings());
    }

    @Test
    void testDump() {
        prerequisite.setCondition(ExpressionNode.or(ExpressionNode.leaf(FOO), ExpressionNode.leaf(BAR)));
        prerequisite.satisfy(FOO);

        assertEquals(List.of(
                "foo.1 succeeded | bar.1 failed: true",
                "bar.1 failed: unsatisfied",
                "foo.1 succeeded: satisfied naturally"), prerequisite.dump());
    }
}
