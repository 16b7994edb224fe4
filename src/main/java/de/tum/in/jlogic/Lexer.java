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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Splits an expression string into {@link Token tokens}.
 *
 * <p>Recognized are identifiers ({@code [A-Za-z_][A-Za-z0-9_]*}), the constants {@code 0} and
 * {@code 1}, the operators {@code + | * & ^ @ % ! ~ -} and parentheses. Whitespace separates tokens
 * and is not emitted. A constant must stand on its own: {@code 10} or {@code 1A} is rejected instead
 * of being read as two operands.</p>
 */
public final class Lexer {
    private Lexer() {}

    public static List<Token> tokenize(String text) throws LexException {
        List<Token> tokens = new ArrayList<>();
        int length = text.length();
        int position = 0;
        while (position < length) {
            char character = text.charAt(position);
            if (Character.isWhitespace(character)) {
                position += 1;
                continue;
            }

            if (isIdentifierStart(character)) {
                int end = position + 1;
                while (end < length && isIdentifierPart(text.charAt(end))) {
                    end += 1;
                }
                tokens.add(new Token(Token.Kind.IDENTIFIER, text.substring(position, end), position));
                position = end;
                continue;
            }

            if (character == '0' || character == '1') {
                if (position + 1 < length && isIdentifierPart(text.charAt(position + 1))) {
                    throw new LexException(position + 1, text.charAt(position + 1));
                }
                tokens.add(new Token(Token.Kind.CONSTANT, String.valueOf(character), position));
                position += 1;
                continue;
            }

            Token.Kind kind = symbolKind(character);
            if (kind == null) {
                throw new LexException(position, character);
            }
            tokens.add(new Token(kind, String.valueOf(character), position));
            position += 1;
        }
        return Collections.unmodifiableList(tokens);
    }

    @Nullable
    private static Token.Kind symbolKind(char character) {
        switch (character) {
            case '+':
            case '|':
                return Token.Kind.OR;
            case '*':
            case '&':
                return Token.Kind.AND;
            case '^':
                return Token.Kind.XOR;
            case '@':
                return Token.Kind.NAND;
            case '%':
                return Token.Kind.NOR;
            case '!':
            case '~':
            case '-':
                return Token.Kind.NOT;
            case '(':
                return Token.Kind.OPEN_PAREN;
            case ')':
                return Token.Kind.CLOSE_PAREN;
            default:
                return null;
        }
    }

    private static boolean isIdentifierStart(char character) {
        return (character >= 'a' && character <= 'z') || (character >= 'A' && character <= 'Z') || character == '_';
    }

    private static boolean isIdentifierPart(char character) {
        return isIdentifierStart(character) || (character >= '0' && character <= '9');
    }
}
