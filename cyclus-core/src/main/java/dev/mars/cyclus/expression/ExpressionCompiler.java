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
import java.util.List;

/**
 * Compiles logical expression strings into {@link ExpressionNode} trees.
 *
 * <p>Grammar (AND binds tighter than OR):
 * <pre>
 *   or      := and ( OR and )*
 *   and     := primary ( AND primary )*
 *   primary := OPERAND | '(' or ')'
 * </pre>
 * Operators at one nesting level are flattened into a single n-ary node,
 * explicit parentheses always produce a nested node, and a parenthesised
 * single operand collapses to that operand.
 *
 * <p>Two dialects are supported. {@link Syntax#GRAPH} uses {@code &} and
 * {@code |} and treats any other run of characters as an operand, so that
 * {@code foo[-P1D]:succeeded} is a single leaf. {@link Syntax#COMPLETION}
 * uses the words {@code and} and {@code or}, and only accepts identifiers
 * as operands.
 *
 * <p>Compilers hold no state between calls and may be shared.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public final class ExpressionCompiler {

    public enum Syntax {
        GRAPH,
        COMPLETION
    }

    private static final ExpressionCompiler GRAPH_COMPILER = new ExpressionCompiler(Syntax.GRAPH);
    private static final ExpressionCompiler COMPLETION_COMPILER = new ExpressionCompiler(Syntax.COMPLETION);

    private final Syntax syntax;

    private ExpressionCompiler(Syntax syntax) {
        this.syntax = syntax;
    }

    public static ExpressionCompiler forGraph() {
        return GRAPH_COMPILER;
    }

    public static ExpressionCompiler forCompletion() {
        return COMPLETION_COMPILER;
    }

    public Syntax getSyntax() {
        return syntax;
    }

    /**
     * Compiles {@code expression} into a tree of string leaves.
     *
     * @throws ExpressionSyntaxException if the expression is empty, has
     *         unbalanced parentheses, a missing operand, or (completion
     *         syntax) any construct other than identifiers, operators and
     *         parentheses
     */
    public ExpressionNode<String> compile(String expression) throws ExpressionSyntaxException {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionSyntaxException(expression, "Empty expression");
        }
        List<Token> tokens = syntax == Syntax.GRAPH ? tokenizeGraph(expression) : tokenizeCompletion(expression);
        Parser parser = new Parser(expression, tokens);
        ExpressionNode<String> node = parser.parseOr();
        if (parser.hasNext()) {
            Token extra = parser.peek();
            if (extra.type == TokenType.RIGHT_PAREN) {
                throw new ExpressionSyntaxException(expression, "Mismatched parentheses in: \"" + expression + "\"");
            }
            throw invalid(expression, "unexpected '" + extra.text + "'");
        }
        return node;
    }

    private List<Token> tokenizeGraph(String expression) {
        List<Token> tokens = new ArrayList<>();
        StringBuilder operand = new StringBuilder();
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            TokenType type;
            switch (c) {
                case '(':
                    type = TokenType.LEFT_PAREN;
                    break;
                case ')':
                    type = TokenType.RIGHT_PAREN;
                    break;
                case '&':
                    type = TokenType.AND;
                    break;
                case '|':
                    type = TokenType.OR;
                    break;
                default:
                    type = null;
            }
            if (type == null) {
                operand.append(c);
                continue;
            }
            flushOperand(operand, tokens);
            tokens.add(new Token(type, String.valueOf(c)));
        }
        flushOperand(operand, tokens);
        return tokens;
    }

    private static void flushOperand(StringBuilder operand, List<Token> tokens) {
        String text = operand.toString().trim();
        if (!text.isEmpty()) {
            tokens.add(new Token(TokenType.OPERAND, text));
        }
        operand.setLength(0);
    }

    private List<Token> tokenizeCompletion(String expression) throws ExpressionSyntaxException {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LEFT_PAREN, "("));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RIGHT_PAREN, ")"));
                i++;
            } else if (c == '_' || Character.isLetter(c)) {
                int start = i;
                while (i < expression.length()
                        && (expression.charAt(i) == '_' || Character.isLetterOrDigit(expression.charAt(i)))) {
                    i++;
                }
                String word = expression.substring(start, i);
                if ("and".equals(word)) {
                    tokens.add(new Token(TokenType.AND, word));
                } else if ("or".equals(word)) {
                    tokens.add(new Token(TokenType.OR, word));
                } else {
                    tokens.add(new Token(TokenType.OPERAND, word));
                }
            } else {
                throw invalid(expression, "'" + c + "' is not permitted");
            }
        }
        return tokens;
    }

    private static ExpressionSyntaxException invalid(String expression, String detail) {
        return new ExpressionSyntaxException(expression, "Invalid expression: " + expression + " (" + detail + ")");
    }

    private enum TokenType {
        OPERAND,
        AND,
        OR,
        LEFT_PAREN,
        RIGHT_PAREN
    }

    private static final class Token {
        private final TokenType type;
        private final String text;

        private Token(TokenType type, String text) {
            this.type = type;
            this.text = text;
        }
    }

    private static final class Parser {
        private final String expression;
        private final List<Token> tokens;
        private int position;

        private Parser(String expression, List<Token> tokens) {
            this.expression = expression;
            this.tokens = tokens;
        }

        boolean hasNext() {
            return position < tokens.size();
        }

        Token peek() {
            return tokens.get(position);
        }

        ExpressionNode<String> parseOr() throws ExpressionSyntaxException {
            List<ExpressionNode<String>> operands = new ArrayList<>();
            operands.add(parseAnd());
            while (hasNext() && peek().type == TokenType.OR) {
                position++;
                operands.add(parseAnd());
            }
            return operands.size() == 1 ? operands.get(0) : new ExpressionNode.Or<>(operands);
        }

        ExpressionNode<String> parseAnd() throws ExpressionSyntaxException {
            List<ExpressionNode<String>> operands = new ArrayList<>();
            operands.add(parsePrimary());
            while (hasNext() && peek().type == TokenType.AND) {
                position++;
                operands.add(parsePrimary());
            }
            return operands.size() == 1 ? operands.get(0) : new ExpressionNode.And<>(operands);
        }

        ExpressionNode<String> parsePrimary() throws ExpressionSyntaxException {
            if (!hasNext()) {
                throw invalid(expression, "missing operand at end");
            }
            Token token = tokens.get(position++);
            switch (token.type) {
                case OPERAND:
                    return new ExpressionNode.Leaf<>(token.text);
                case LEFT_PAREN:
                    ExpressionNode<String> inner = parseOr();
                    if (!hasNext() || peek().type != TokenType.RIGHT_PAREN) {
                        throw new ExpressionSyntaxException(expression,
                                "Mismatched parentheses in: \"" + expression + "\"");
                    }
                    position++;
                    return inner;
                case RIGHT_PAREN:
                    throw new ExpressionSyntaxException(expression,
                            "Mismatched parentheses in: \"" + expression + "\"");
                default:
                    throw invalid(expression, "missing operand before '" + token.text + "'");
            }
        }
    }
}
