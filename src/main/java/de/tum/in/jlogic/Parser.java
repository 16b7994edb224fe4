/*
 * This file is part of JLogic.
 * Copyright (c) 2026 (See AUTHORS).
 *
 * JLogic is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JLogic is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JLogic. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jlogic;

import java.util.List;
import javax.annotation.Nullable;

/**
 * Recursive-descent parser for token streams produced by the {@link Lexer}.
 *
 * <pre>
 * expression := nandTerm ( ( OR | XOR | NOR ) nandTerm )*
 * nandTerm   := andTerm ( NAND andTerm )*
 * andTerm    := atom ( AND atom | atom )*
 * atom       := IDENTIFIER | CONSTANT | NOT atom | '(' expression ')'
 * </pre>
 *
 * <p>All binary levels nest to the left. Each parenthesis pair becomes a {@link Expression.Group}
 * node. Parentheses and negations may be nested at most {@code maximumDepth} levels deep; binary
 * chains are read iteratively and may be arbitrarily long.</p>
 */
public final class Parser {
    private static final String OPERAND = "operand";
    private static final String CLOSING_PARENTHESIS = "')'";

    private final List<Token> tokens;
    private final int endPosition;
    private final int maximumDepth;
    private int index = 0;
    private int depth = 0;

    private Parser(List<Token> tokens, int maximumDepth) {
        this.tokens = tokens;
        this.endPosition = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).end();
        this.maximumDepth = maximumDepth;
    }

    public static Expression parse(String text) throws ExpressionParseException {
        return parse(text, LogicConfiguration.DEFAULT_MAXIMUM_EXPRESSION_DEPTH);
    }

    public static Expression parse(String text, int maximumDepth) throws ExpressionParseException {
        return parse(Lexer.tokenize(text), maximumDepth);
    }

    public static Expression parse(List<Token> tokens) throws ExpressionParseException {
        return parse(tokens, LogicConfiguration.DEFAULT_MAXIMUM_EXPRESSION_DEPTH);
    }

    public static Expression parse(List<Token> tokens, int maximumDepth) throws ExpressionParseException {
        Util.checkArgument(maximumDepth > 0, "Maximum depth must be positive, got %d", maximumDepth);
        Parser parser = new Parser(tokens, maximumDepth);
        Expression expression = parser.expression();
        Token trailing = parser.peek();
        if (trailing != null) {
            throw new SyntaxException(trailing.position(), SyntaxException.END_OF_INPUT, describe(trailing));
        }
        return expression;
    }

    private Expression expression() throws ExpressionParseException {
        Expression left = nandTerm();
        while (true) {
            Token token = peek();
            if (token == null) {
                return left;
            }
            Token.Kind kind = token.kind();
            if (kind != Token.Kind.OR && kind != Token.Kind.XOR && kind != Token.Kind.NOR) {
                return left;
            }
            index += 1;
            left = Expression.binary(kind.operator(), left, nandTerm());
        }
    }

    private Expression nandTerm() throws ExpressionParseException {
        Expression left = andTerm();
        while (true) {
            Token token = peek();
            if (token == null || token.kind() != Token.Kind.NAND) {
                return left;
            }
            index += 1;
            left = Expression.nand(left, andTerm());
        }
    }

    private Expression andTerm() throws ExpressionParseException {
        Expression left = atom();
        while (true) {
            Token token = peek();
            if (token == null) {
                return left;
            }
            if (token.kind() == Token.Kind.AND) {
                index += 1;
            } else if (!token.startsOperand()) {
                return left;
            }
            left = Expression.and(left, atom());
        }
    }

    private Expression atom() throws ExpressionParseException {
        Token token = peek();
        if (token == null) {
            throw new SyntaxException(endPosition, OPERAND, SyntaxException.END_OF_INPUT);
        }
        switch (token.kind()) {
            case IDENTIFIER:
                index += 1;
                return Expression.variable(token.text());
            case CONSTANT:
                index += 1;
                return Expression.constant("1".equals(token.text()));
            case NOT:
                enter(token);
                Expression operand = atom();
                depth -= 1;
                return Expression.not(operand);
            case OPEN_PAREN:
                enter(token);
                Expression inner = expression();
                depth -= 1;
                Token closing = peek();
                if (closing == null) {
                    throw new SyntaxException(endPosition, CLOSING_PARENTHESIS, SyntaxException.END_OF_INPUT);
                }
                if (closing.kind() != Token.Kind.CLOSE_PAREN) {
                    throw new SyntaxException(closing.position(), CLOSING_PARENTHESIS, describe(closing));
                }
                index += 1;
                return Expression.group(inner);
            default:
                throw new SyntaxException(token.position(), OPERAND, describe(token));
        }
    }

    private void enter(Token token) throws NestingTooDeepException {
        if (depth == maximumDepth) {
            throw new NestingTooDeepException(token.position(), maximumDepth);
        }
        depth += 1;
        index += 1;
    }

    @Nullable
    private Token peek() {
        return index < tokens.size() ? tokens.get(index) : null;
    }

    private static String describe(Token token) {
        return "'" + token.text() + "'";
    }
}
