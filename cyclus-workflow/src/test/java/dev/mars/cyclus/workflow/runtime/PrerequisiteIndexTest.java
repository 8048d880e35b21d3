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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Description for PrerequisiteIndexTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
class PrerequisiteIndexTest {

    private static final PrerequisiteKey FOO = new PrerequisiteKey("foo", "1", "succeeded");

    private PrerequisiteIndex index;
    private Prerequisite first;
    private Prerequisite second;

    @BeforeEach
    void setUp() {
        index = new PrerequisiteIndex();
        first = new Prerequisite(null);
        first.add("foo", "1", "succeeded");
        second = new Prerequisite(null);
        second.add("foo", "1", "succeeded");
        second.add("bar", "1", "succeeded");
        index.register(first);
        index.register(second);
    }

    @Test
    void testRegistration() {
        assertEquals(2, index.size());
        assertEquals(2, index.getWaitingCount(FOO));
        assertEquals(1, index.getWaitingCount(new PrerequisiteKey("bar", "1", "succeeded")));
    }

    @Test
    void testOutputCompletedUpdatesWaitingPrerequisites() {
        List<Prerequisite> changed = index.outputCompleted("foo", "1", "succeeded");

        assertEquals(2, changed.size());
        assertTrue(changed.contains(first));
        assertTrue(changed.contains(second));
        assertTrue(first.isSatisfied());
        assertFalse(second.isSatisfied());
    }

    @Test
    void testRepeatedOutputChangesNothing() {
        index.outputCompleted("foo", "1", "succeeded");
        assertTrue(index.outputCompleted("foo", "1", "succeeded").isEmpty());
    }

    @Test
    void testOtherPointIsIgnored() {
        assertTrue(index.outputCompleted("foo", "2", "succeeded").isEmpty());
        assertFalse(first.isSatisfied());
    }

    @Test
    void testUnregister() {
        index.unregister(second);

        assertEquals(1, index.size());
        assertEquals(1, index.getWaitingCount(FOO));
        assertEquals(List.of(first), index.outputCompleted("foo", "1", "succeeded"));
        assertFalse(second.isSatisfied());
    }
}
