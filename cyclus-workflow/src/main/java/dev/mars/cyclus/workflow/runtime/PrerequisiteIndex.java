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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Maps each concrete upstream output to the live prerequisites that wait
 * for it, so that an arriving output only touches those prerequisites.
 *
 * <p>Not thread safe: all calls must come from the owning scheduler loop.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class PrerequisiteIndex {

    private static final Logger logger = Logger.getLogger(PrerequisiteIndex.class.getName());

    private final Map<PrerequisiteKey, Set<Prerequisite>> waiting = new HashMap<>();

    public void register(Prerequisite prerequisite) {
        for (PrerequisiteKey key : prerequisite.getKeys()) {
            waiting.computeIfAbsent(key, k -> Collections.newSetFromMap(new IdentityHashMap<>()))
                    .add(prerequisite);
        }
    }

    public void unregister(Prerequisite prerequisite) {
        for (PrerequisiteKey key : prerequisite.getKeys()) {
            Set<Prerequisite> set = waiting.get(key);
            if (set != null) {
                set.remove(prerequisite);
                if (set.isEmpty()) {
                    waiting.remove(key);
                }
            }
        }
    }

    /**
     * Records that {@code taskName} at {@code point} emitted {@code output}
     * and returns the prerequisites whose leaf changed as a result.
     */
    public List<Prerequisite> outputCompleted(String taskName, String point, String output) {
        PrerequisiteKey key = new PrerequisiteKey(taskName, point, output);
        Set<Prerequisite> affected = waiting.get(key);
        if (affected == null) {
            return List.of();
        }
        List<Prerequisite> changed = new ArrayList<>(affected.size());
        for (Prerequisite prerequisite : affected) {
            if (prerequisite.satisfy(key)) {
                changed.add(prerequisite);
            }
        }
        logger.fine(() -> "Output " + key + " updated " + changed.size() + " prerequisite(s)");
        return changed;
    }

    public int getWaitingCount(PrerequisiteKey key) {
        Set<Prerequisite> set = waiting.get(key);
        return set == null ? 0 : set.size();
    }

    public int size() {
        return waiting.size();
    }
}
