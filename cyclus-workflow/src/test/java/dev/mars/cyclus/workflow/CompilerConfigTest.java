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

package dev.mars.cyclus.workflow;

import dev.mars.cyclus.config.CyclusConfiguration;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class CompilerConfigTest {

    @Test
    void testDefaults() {
        CompilerConfig config = CompilerConfig.defaults();

        assertNull(config.getWorkflowName());
        assertFalse(config.isBackCompat());
        assertEquals(100000, config.getMaxExpandedLines());
        assertTrue(config.isMetricsEnabled());
    }

    @Test
    void testFromConfiguration() {
        Properties properties = new Properties();
        properties.setProperty(CyclusConfiguration.BACK_COMPAT_KEY, "true");
        properties.setProperty(CyclusConfiguration.MAX_EXPANDED_LINES_KEY, "50");
        properties.setProperty(CyclusConfiguration.METRICS_ENABLED_KEY, "false");

        CompilerConfig config = CompilerConfig.fromConfiguration(new CyclusConfiguration(properties));

        assertTrue(config.isBackCompat());
        assertEquals(50, config.getMaxExpandedLines());
        assertFalse(config.isMetricsEnabled());
    }

    @Test
    void testWithersCopy() {
        CompilerConfig base = CompilerConfig.defaults();
        CompilerConfig named = base.withWorkflowName("demo").withBackCompat(true).withMaxExpandedLines(10);

        assertNull(base.getWorkflowName());
        assertFalse(base.isBackCompat());
        assertEquals("demo", named.getWorkflowName());
        assertTrue(named.isBackCompat());
        assertEquals(10, named.getMaxExpandedLines());
    }

    @Test
    void testMaxExpandedLinesMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> CompilerConfig.defaults().withMaxExpandedLines(0));
    }
}
