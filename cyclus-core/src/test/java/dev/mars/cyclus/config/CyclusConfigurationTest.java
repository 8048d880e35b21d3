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

package dev.mars.cyclus.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for CyclusConfiguration.
 * Validates defaults, explicit properties, system property overrides and malformed values.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
class CyclusConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(CyclusConfiguration.BACK_COMPAT_KEY);
        System.clearProperty(CyclusConfiguration.MAX_EXPANDED_LINES_KEY);
    }

    // ========== Default Configuration Tests ==========

    @Test
    void testDefaults() {
        CyclusConfiguration config = new CyclusConfiguration(new Properties());
        assertFalse(config.isBackCompat());
        assertEquals(100000, config.getMaxExpandedLines());
        assertTrue(config.isMetricsEnabled());
    }

    @Test
    void testNullPropertiesUsesDefaults() {
        CyclusConfiguration config = new CyclusConfiguration(null);
        assertFalse(config.isBackCompat());
    }

    // ========== Explicit Properties Tests ==========

    @Test
    void testExplicitProperties() {
        Properties props = new Properties();
        props.setProperty(CyclusConfiguration.BACK_COMPAT_KEY, "true");
        props.setProperty(CyclusConfiguration.MAX_EXPANDED_LINES_KEY, "50");
        props.setProperty(CyclusConfiguration.METRICS_ENABLED_KEY, "false");

        CyclusConfiguration config = new CyclusConfiguration(props);
        assertTrue(config.isBackCompat());
        assertEquals(50, config.getMaxExpandedLines());
        assertFalse(config.isMetricsEnabled());
    }

    @Test
    void testInvalidIntegerFallsBackToDefault() {
        Properties props = new Properties();
        props.setProperty(CyclusConfiguration.MAX_EXPANDED_LINES_KEY, "lots");
        assertEquals(100000, new CyclusConfiguration(props).getMaxExpandedLines());

        props.setProperty(CyclusConfiguration.MAX_EXPANDED_LINES_KEY, "-3");
        assertEquals(100000, new CyclusConfiguration(props).getMaxExpandedLines());
    }

    @Test
    void testSetProperty() {
        CyclusConfiguration config = new CyclusConfiguration(new Properties());
        config.setProperty(CyclusConfiguration.BACK_COMPAT_KEY, " TRUE ");
        assertTrue(config.isBackCompat());
        assertEquals("fallback", config.getProperty("cyclus.unknown", "fallback"));
        assertNull(config.getProperty("cyclus.unknown"));
    }

    // ========== System Property Override Tests ==========

    @Test
    void testSystemPropertyOverride() {
        System.setProperty(CyclusConfiguration.BACK_COMPAT_KEY, "true");
        System.setProperty(CyclusConfiguration.MAX_EXPANDED_LINES_KEY, "7");

        CyclusConfiguration config = new CyclusConfiguration();
        assertTrue(config.isBackCompat());
        assertEquals(7, config.getMaxExpandedLines());
    }

    @Test
    void testToString() {
        String text = new CyclusConfiguration(new Properties()).toString();
        assertTrue(text.contains("backCompat=false"));
        assertTrue(text.contains("maxExpandedLines=100000"));
    }
}
