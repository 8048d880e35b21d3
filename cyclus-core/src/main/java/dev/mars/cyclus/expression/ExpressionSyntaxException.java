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

package dev.mars.cyclus.expression;

import dev.mars.cyclus.core.exceptions.CyclusException;

/**
 * Thrown when a trigger or completion expression cannot be compiled,
 * for example because of unbalanced parentheses or a construct outside
 * the permitted grammar.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class ExpressionSyntaxException extends CyclusException {

    private final String expression;

    public ExpressionSyntaxException(String expression, String message) {
        super(message);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
