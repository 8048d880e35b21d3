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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A compiled boolean expression over named variables, using the
 * {@code and}/{@code or}/parentheses grammar of completion expressions.
 *
 * <p>Evaluation binds each identifier to a value from the supplied context;
 * identifiers missing from the context are false.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public final class BooleanExpression {

    private final String source;
    private final ExpressionNode<String> tree;
    private final Set<String> identifiers;

    private BooleanExpression(String source, ExpressionNode<String> tree) {
        this.source = source;
        this.tree = tree;
        this.identifiers = Collections.unmodifiableSet(new LinkedHashSet<>(tree.leaves()));
    }

    public static BooleanExpression compile(String source) throws ExpressionSyntaxException {
        return new BooleanExpression(source, ExpressionCompiler.forCompletion().compile(source));
    }

    public boolean evaluate(Map<String, Boolean> context) {
        return tree.evaluate(name -> Boolean.TRUE.equals(context.get(name)));
    }

    public String getSource() {
        return source;
    }

    public ExpressionNode<String> getTree() {
        return tree;
    }

    public Set<String> getIdentifiers() {
        return identifiers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BooleanExpression that = (BooleanExpression) o;
        return tree.equals(that.tree);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tree);
    }

    @Override
    public String toString() {
        return source;
    }
}
