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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Sealed interface for boolean AND/OR expression trees.
 *
 * <p>The same tree shape is used with string leaves (compiled trigger and
 * completion expressions), with {@code TaskTrigger} leaves (graph
 * dependencies) and with concrete prerequisite keys at runtime. Use
 * {@link #map(Function)} to rebind the leaves of an existing tree.
 *
 * <p>Trees are immutable. Two trees are equal when they have the same shape
 * and equal leaves.
 *
 * @param <T> leaf value type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public sealed interface ExpressionNode<T> {

    /**
     * Returns a tree of identical shape whose leaves are the mapped values.
     */
    <R> ExpressionNode<R> map(Function<? super T, ? extends R> mapper);

    /**
     * Evaluates the tree, asking {@code valuation} for the value of each leaf.
     * Evaluation short-circuits in child order.
     */
    boolean evaluate(Predicate<? super T> valuation);

    /**
     * Adds every leaf value to {@code sink}, depth first, left to right.
     */
    void collectLeaves(Collection<? super T> sink);

    /**
     * Renders the tree with the given leaf formatter and operator text.
     * Nested groups are parenthesised, the root is not.
     */
    String render(Function<? super T, String> formatter, String andOperator, String orOperator);

    default List<T> leaves() {
        List<T> result = new ArrayList<>();
        collectLeaves(result);
        return result;
    }

    static <T> ExpressionNode<T> leaf(T value) {
        return new Leaf<>(value);
    }

    @SafeVarargs
    static <T> ExpressionNode<T> and(ExpressionNode<T>... children) {
        return new And<>(Arrays.asList(children));
    }

    @SafeVarargs
    static <T> ExpressionNode<T> or(ExpressionNode<T>... children) {
        return new Or<>(Arrays.asList(children));
    }

    /**
     * A single operand.
     *
     * @param value the leaf value
     */
    record Leaf<T>(T value) implements ExpressionNode<T> {

        public Leaf {
            Objects.requireNonNull(value, "Leaf value cannot be null");
        }

        @Override
        public <R> ExpressionNode<R> map(Function<? super T, ? extends R> mapper) {
            return new Leaf<>(mapper.apply(value));
        }

        @Override
        public boolean evaluate(Predicate<? super T> valuation) {
            return valuation.test(value);
        }

        @Override
        public void collectLeaves(Collection<? super T> sink) {
            sink.add(value);
        }

        @Override
        public String render(Function<? super T, String> formatter, String andOperator, String orOperator) {
            return formatter.apply(value);
        }

        @Override
        public String toString() {
            return "Leaf(" + value + ")";
        }
    }

    /**
     * Conjunction of two or more children.
     *
     * @param children the operands, in source order
     */
    record And<T>(List<ExpressionNode<T>> children) implements ExpressionNode<T> {

        public And {
            children = List.copyOf(children);
        }

        @Override
        public <R> ExpressionNode<R> map(Function<? super T, ? extends R> mapper) {
            List<ExpressionNode<R>> mapped = new ArrayList<>(children.size());
            for (ExpressionNode<T> child : children) {
                mapped.add(child.map(mapper));
            }
            return new And<>(mapped);
        }

        @Override
        public boolean evaluate(Predicate<? super T> valuation) {
            for (ExpressionNode<T> child : children) {
                if (!child.evaluate(valuation)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public void collectLeaves(Collection<? super T> sink) {
            children.forEach(child -> child.collectLeaves(sink));
        }

        @Override
        public String render(Function<? super T, String> formatter, String andOperator, String orOperator) {
            return renderGroup(children, formatter, andOperator, orOperator, andOperator);
        }

        @Override
        public String toString() {
            return "And" + children;
        }
    }

    /**
     * Disjunction of two or more children.
     *
     * @param children the operands, in source order
     */
    record Or<T>(List<ExpressionNode<T>> children) implements ExpressionNode<T> {

        public Or {
            children = List.copyOf(children);
        }

        @Override
        public <R> ExpressionNode<R> map(Function<? super T, ? extends R> mapper) {
            List<ExpressionNode<R>> mapped = new ArrayList<>(children.size());
            for (ExpressionNode<T> child : children) {
                mapped.add(child.map(mapper));
            }
            return new Or<>(mapped);
        }

        @Override
        public boolean evaluate(Predicate<? super T> valuation) {
            for (ExpressionNode<T> child : children) {
                if (child.evaluate(valuation)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public void collectLeaves(Collection<? super T> sink) {
            children.forEach(child -> child.collectLeaves(sink));
        }

        @Override
        public String render(Function<? super T, String> formatter, String andOperator, String orOperator) {
            return renderGroup(children, formatter, andOperator, orOperator, orOperator);
        }

        @Override
        public String toString() {
            return "Or" + children;
        }
    }

    private static <T> String renderGroup(List<ExpressionNode<T>> children, Function<? super T, String> formatter,
                                          String andOperator, String orOperator, String joiner) {
        StringBuilder sb = new StringBuilder();
        for (ExpressionNode<T> child : children) {
            if (sb.length() > 0) {
                sb.append(joiner);
            }
            String rendered = child.render(formatter, andOperator, orOperator);
            if (child instanceof Leaf) {
                sb.append(rendered);
            } else {
                sb.append('(').append(rendered).append(')');
            }
        }
        return sb.toString();
    }
}
