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

import dev.mars.cyclus.workflow.CompilerConfig;
import dev.mars.cyclus.workflow.GraphSemanticException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link OutputOptionality}, including back-compatibility coercion.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
class OutputOptionalityTest {

    private final Logger optionalityLogger = Logger.getLogger(OutputOptionality.class.getName());
    private final List<LogRecord> records = new ArrayList<>();
    private final Handler handler = new Handler() {
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    @BeforeEach
    void setUp() {
        optionalityLogger.addHandler(handler);
    }

    @AfterEach
    void tearDown() {
        optionalityLogger.removeHandler(handler);
    }

    @Test
    void testRecordsOptionality() throws GraphSemanticException {
        OutputOptionality optionality = new OutputOptionality(CompilerConfig.defaults());
        optionality.recordTaskOutput("a", "succeeded", false);
        optionality.recordTaskOutput("a", "x", true);

        assertEquals(Boolean.FALSE, optionality.isOptional("a", "succeeded"));
        assertEquals(Boolean.TRUE, optionality.isOptional("a", "x"));
        assertNull(optionality.isOptional("a", "failed"));
    }

    @Test
    void testRepeatedRecordIsNotAConflict() throws GraphSemanticException {
        OutputOptionality optionality = new OutputOptionality(CompilerConfig.defaults());
        optionality.recordTaskOutput("a", "succeeded", false);
        optionality.recordTaskOutput("a", "succeeded", false);

        assertEquals(Boolean.FALSE, optionality.isOptional("a", "succeeded"));
    }

    @Test
    void testDirectConflict() throws GraphSemanticException {
        OutputOptionality optionality = new OutputOptionality(CompilerConfig.defaults());
        optionality.recordTaskOutput("a", "x", false);

        GraphSemanticException e = assertThrows(GraphSemanticException.class,
                () -> optionality.recordTaskOutput("a", "x", true));
        assertEquals("Output a:x is required so it can't also be optional.", e.getMessage());
    }

    @Test
    void testOppositeConflict() throws GraphSemanticException {
        OutputOptionality optionality = new OutputOptionality(CompilerConfig.defaults());
        optionality.recordTaskOutput("a", "submitted", false);

        GraphSemanticException e = assertThrows(GraphSemanticException.class,
                () -> optionality.recordTaskOutput("a", "submit-failed", true));
        assertEquals("Output a:submitted is required so a:submit-failed can't be optional.", e.getMessage());
    }

    @Test
    void testBothOppositesOptionalIsFine() throws GraphSemanticException {
        OutputOptionality optionality = new OutputOptionality(CompilerConfig.defaults());
        optionality.recordTaskOutput("a", "succeeded", true);
        optionality.recordTaskOutput("a", "failed", true);

        assertTrue(optionality.isOptional("a", "succeeded"));
        assertTrue(optionality.isOptional("a", "failed"));
    }

    @Test
    void testFinishedMakesSucceededAndFailedOptional() throws GraphSemanticException {
        OutputOptionality optionality = new OutputOptionality(CompilerConfig.defaults());
        optionality.recordTaskOutput("a", "finished", false);

        assertTrue(optionality.isOptional("a", "succeeded"));
        assertTrue(optionality.isOptional("a", "failed"));
        assertNull(optionality.isOptional("a", "finished"));
    }

    @Test
    void testFinishedCannotBeOptional() {
        OutputOptionality optionality = new OutputOptionality(CompilerConfig.defaults());

        GraphSemanticException e = assertThrows(GraphSemanticException.class,
                () -> optionality.recordTaskOutput("a", "finished", true));
        assertEquals("Pseudo-output a:finished can't be optional", e.getMessage());
    }

    @Test
    void testBackCompatCoercesDirectConflict() throws GraphSemanticException {
        OutputOptionality optionality = new OutputOptionality(CompilerConfig.defaults().withBackCompat(true));
        optionality.recordTaskOutput("a", "x", true);
        optionality.recordTaskOutput("a", "x", false);

        assertTrue(optionality.isOptional("a", "x"));
        assertEquals(1, records.size());
        assertEquals(Level.WARNING, records.get(0).getLevel());
        assertEquals("Output a:x is optional so it can't also be required. ... making it optional.",
                records.get(0).getMessage());
    }

    @Test
    void testBackCompatCoercesOpposites() throws GraphSemanticException {
        OutputOptionality optionality = new OutputOptionality(CompilerConfig.defaults().withBackCompat(true));
        optionality.recordTaskOutput("a", "succeeded", false);
        optionality.recordTaskOutput("a", "failed", false);

        assertTrue(optionality.isOptional("a", "succeeded"));
        assertTrue(optionality.isOptional("a", "failed"));
        assertEquals(1, records.size());
        assertTrue(records.get(0).getMessage().endsWith(" ... making both optional."));
    }

    @Test
    void testMemberConflictBecomesOptional() {
        OutputOptionality optionality = new OutputOptionality(CompilerConfig.defaults());
        optionality.recordMemberOutput("m1", "succeeded", false);
        optionality.recordMemberOutput("m1", "succeeded", true);
        optionality.recordMemberOutput("m1", "succeeded", false);

        assertTrue(optionality.isOptional("m1", "succeeded"));
        assertTrue(records.isEmpty());
    }

    @Test
    void testTaskEntryWinsOverMemberEntry() throws GraphSemanticException {
        OutputOptionality optionality = new OutputOptionality(CompilerConfig.defaults());
        optionality.recordMemberOutput("m1", "succeeded", true);
        optionality.recordTaskOutput("m1", "succeeded", false);

        assertEquals(Boolean.FALSE, optionality.isOptional("m1", "succeeded"));
    }
}
