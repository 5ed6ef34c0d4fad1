// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.selector;

/**
 * The selector lexer: splits a selector string into {@link SelectorToken}s on demand.
 * <p>
 * Whitespace is significant in selectors, so runs of whitespace are reported as tokens of their own; it is up to the
 * parser to decide whether they denote the descendant combinator. Whitespace inside quoted strings is part of the
 * string.
 */
final class SelectorLexer {
    SelectorLexer(final String source) {
        this.source = source;
        length = source.length();
    }

    /**
     * Reads the next token. Once the end of input is reached, every call returns an {@link SelectorToken.Type#END}
     * token.
     *
     * @throws SelectorParserException if a quoted string is not terminated
     */
    SelectorToken next() {
        if (position >= length) {
            return new SelectorToken(SelectorToken.Type.END, "", length);
        }
        final var start = position;
        final var ch = source.charAt(position);
        if (isWhitespace(ch)) {
            while (position < length && isWhitespace(source.charAt(position))) {
                position += 1;
            }
            return token(SelectorToken.Type.WHITESPACE, start);
        }
        if (isNameCharacter(ch)) {
            return new SelectorToken(SelectorToken.Type.NAME, readName(), start);
        }
        position += 1;
        switch (ch) {
            case '"', '\'' -> {
                return readString(ch, start);
            }
            case '#' -> {
                return new SelectorToken(SelectorToken.Type.HASH, readName(), start);
            }
            case '*', '~', '|', '^', '$' -> {
                if (position < length && source.charAt(position) == '=') {
                    position += 1;
                    return token(SelectorToken.Type.OPERATOR, start);
                }
                return switch (ch) {
                    case '*' -> token(SelectorToken.Type.STAR, start);
                    case '~' -> token(SelectorToken.Type.TILDE, start);
                    case '|' -> token(SelectorToken.Type.PIPE, start);
                    default -> token(SelectorToken.Type.DELIMITER, start);
                };
            }
            case ':' -> {
                if (position < length && source.charAt(position) == ':') {
                    position += 1;
                }
                return token(SelectorToken.Type.COLON, start);
            }
            default -> {
                final var type = singleCharacterType(ch);
                if (type == SelectorToken.Type.DELIMITER && position < length && source.charAt(position) == '=') {
                    // Lexed as an operator so that the parser can report it as an unknown one.
                    position += 1;
                    return token(SelectorToken.Type.OPERATOR, start);
                }
                return token(type, start);
            }
        }
    }

    private static SelectorToken.Type singleCharacterType(final char ch) {
        return switch (ch) {
            case '=' -> SelectorToken.Type.OPERATOR;
            case '.' -> SelectorToken.Type.DOT;
            case '[' -> SelectorToken.Type.LEFT_BRACKET;
            case ']' -> SelectorToken.Type.RIGHT_BRACKET;
            case '>' -> SelectorToken.Type.GREATER;
            case '+' -> SelectorToken.Type.PLUS;
            case ',' -> SelectorToken.Type.COMMA;
            default -> SelectorToken.Type.DELIMITER;
        };
    }

    private SelectorToken token(final SelectorToken.Type type, final int start) {
        return new SelectorToken(type, source.substring(start, position), start);
    }

    private String readName() {
        final var start = position;
        while (position < length && isNameCharacter(source.charAt(position))) {
            position += 1;
        }
        return source.substring(start, position);
    }

    private SelectorToken readString(final char quote, final int start) {
        final var contents = new StringBuilder();
        var inEscapeSequence = false;
        while (true) {
            if (position >= length) {
                throw new SelectorParserException(
                    "Expected closing " + quote + " but found end of input instead", source, start);
            }
            final var ch = source.charAt(position);
            position += 1;
            if (inEscapeSequence) {
                inEscapeSequence = false;
                contents.append(ch);
            } else if (ch == '\\') {
                inEscapeSequence = true;
            } else if (ch == quote) {
                break;
            } else {
                contents.append(ch);
            }
        }
        return new SelectorToken(SelectorToken.Type.STRING, contents.toString(), start);
    }

    static boolean isNameCharacter(final char ch) {
        return (ch >= 'a' && ch <= 'z')
            || (ch >= 'A' && ch <= 'Z')
            || (ch >= '0' && ch <= '9')
            || ch == '-'
            || ch == '_'
            || ch >= 0x80;
    }

    static boolean isWhitespace(final char ch) {
        return ch == ' ' || ch == '\t' || ch == '\n' || ch == '\r' || ch == '\f';
    }

    private final String source;
    private final int length;
    private int position = 0;
}
