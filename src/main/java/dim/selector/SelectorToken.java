// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.selector;

/**
 * A single lexical token of a selector string.
 *
 * @param type the kind of the token
 * @param text the token's content: the name for {@link Type#NAME} and {@link Type#HASH}, the unescaped contents for
 * {@link Type#STRING}, the source text otherwise
 * @param position the zero-based offset of the token's first character
 */
record SelectorToken(Type type, String text, int position) {
    enum Type {
        NAME("a name"),
        STRING("a string"),
        HASH("an ID selector"),
        DOT("'.'"),
        STAR("'*'"),
        LEFT_BRACKET("'['"),
        RIGHT_BRACKET("']'"),
        OPERATOR("an attribute operator"),
        GREATER("'>'"),
        PLUS("'+'"),
        TILDE("'~'"),
        COMMA("','"),
        COLON("':'"),
        PIPE("'|'"),
        WHITESPACE("whitespace"),
        DELIMITER("a delimiter"),
        END("end of input");

        Type(final String description) {
            this.description = description;
        }

        private final String description;
    }

    /**
     * Returns a user-readable description of this token, for use in error messages.
     */
    String describe() {
        return switch (type) {
            case NAME -> "'" + text + "'";
            case HASH -> "'#" + text + "'";
            case STRING, WHITESPACE, END -> type.description;
            default -> "'" + text + "'";
        };
    }
}
