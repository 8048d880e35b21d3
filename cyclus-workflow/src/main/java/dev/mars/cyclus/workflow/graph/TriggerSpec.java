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

import java.util.List;

/**
 * The left side of one parsed dependency.
 *
 * @param triggers node strings of the form {@code name[offset]:output} or
 *        {@code @xtrigger}, with families already expanded to members
 * @param suicide whether the dependency removes rather than triggers its target
 * @param originalExpression the left side before family expansion, used to
 *        recognise equivalent expressions and in messages
 */
public record TriggerSpec(List<String> triggers, boolean suicide, String originalExpression) {

    public TriggerSpec {
        triggers = List.copyOf(triggers);
    }
}
