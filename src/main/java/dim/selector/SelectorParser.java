// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.selector;

import java.util.ArrayList;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The selector parser: a recursive descent parser with a single token of lookahead, turning selector strings into
 * {@link SelectorGroup}s.
 * <p>
 * Whitespace between two compound selectors is the descendant combinator, unless it's adjacent to an explicit
 * combinator, a comma or either end of the string, in which case it's insignificant.
 */
final class SelectorParser {
    private SelectorParser(final String source) {
        this.source = source;
        lexer = new SelectorLexer(source);
        current = lexer.next();
    }

    static SelectorGroup parseGroup(final String source) {
        return new SelectorParser(source).readGroup();
    }

    static Selector parseSelector(final String source) {
        final var parser = new SelectorParser(source);
        parser.skipWhitespace();
        if (parser.current.type() == SelectorToken.Type.END) {
            throw parser.error("Selector is empty");
        }
        final var selector = parser.readSelector();
        if (parser.current.type() == SelectorToken.Type.COMMA) {
            throw parser.error("Expected a single selector, but found a selector group");
        }
        return selector;
    }

    private SelectorGroup readGroup() {
        skipWhitespace();
        if (current.type() == SelectorToken.Type.END) {
            throw error("Selector group is empty");
        }
        final var selectors = new ArrayList<Selector>();
        while (true) {
            if (current.type() == SelectorToken.Type.COMMA || current.type() == SelectorToken.Type.END) {
                throw error("Expected a selector but found " + current.describe() + " instead");
            }
            selectors.add(readSelector());
            if (current.type() == SelectorToken.Type.END) {
                break;
            }
            // readSelector only stops at a comma or the end.
            advance();
            skipWhitespace();
        }
        return SelectorGroup.of(selectors);
    }

    private Selector readSelector() {
        final var compounds = new ArrayList<CompoundSelector>();
        final var combinators = new ArrayList<Combinator>();
        compounds.add(readCompound());
        while (true) {
            final var sawWhitespace = skipWhitespace();
            final Combinator combinator;
            switch (current.type()) {
                case END, COMMA -> {
                    return new Selector(compounds, combinators);
                }
                case GREATER -> combinator = Combinator.CHILD;
                case PLUS -> combinator = Combinator.NEXT_SIBLING;
                case TILDE -> combinator = Combinator.SUBSEQUENT_SIBLING;
                default -> {
                    if (!sawWhitespace) {
                        throw error("Unexpected " + current.describe());
                    }
                    combinator = Combinator.DESCENDANT;
                }
            }
            if (combinator != Combinator.DESCENDANT) {
                advance();
                skipWhitespace();
                if (current.type() == SelectorToken.Type.END || current.type() == SelectorToken.Type.COMMA) {
                    throw error("Expected a compound selector after combinator '" + combinator.symbol()
                        + "' but found " + current.describe() + " instead");
                }
            }
            combinators.add(combinator);
            compounds.add(readCompound());
        }
    }

    private CompoundSelector readCompound() {
        @Nullable String tag = null;
        @Nullable String id = null;
        final var classes = new ArrayList<String>();
        final var attributes = new ArrayList<AttributeSelector>();
        var hasTypeSelector = false;
        if (current.type() == SelectorToken.Type.NAME || current.type() == SelectorToken.Type.STAR) {
            if (current.type() == SelectorToken.Type.NAME) {
                tag = identifier("a tag name");
            }
            hasTypeSelector = true;
            advance();
        }
        var empty = !hasTypeSelector;
        while (true) {
            switch (current.type()) {
                case HASH -> {
                    if (id != null) {
                        throw error("Multiple ID selectors in one compound selector");
                    }
                    id = identifier("an ID");
                    advance();
                }
                case DOT -> {
                    advance();
                    if (current.type() != SelectorToken.Type.NAME) {
                        throw error("Expected a class name after '.' but found " + current.describe() + " instead");
                    }
                    classes.add(identifier("a class name"));
                    advance();
                }
                case LEFT_BRACKET -> attributes.add(readAttribute());
                case COLON -> throw error(current.text().equals("::")
                    ? "Pseudo-elements are not supported"
                    : "Pseudo-classes are not supported");
                case PIPE -> throw error("Namespace prefixes are not supported");
                case NAME, STAR -> throw error(hasTypeSelector
                    ? "Multiple type selectors in one compound selector"
                    : "A type selector must come first in a compound selector");
                default -> {
                    if (empty) {
                        throw error("Expected a simple selector but found " + current.describe() + " instead");
                    }
                    return new CompoundSelector(tag, id, classes, attributes);
                }
            }
            empty = false;
        }
    }

    private AttributeSelector readAttribute() {
        final var start = current.position();
        advance();
        skipWhitespace();
        if (current.type() != SelectorToken.Type.NAME) {
            throw unterminatedAttributeOr(start, "Expected an attribute name");
        }
        final var name = identifier("an attribute name");
        advance();
        skipWhitespace();
        if (current.type() == SelectorToken.Type.RIGHT_BRACKET) {
            advance();
            return AttributeSelector.exists(name);
        }
        if (current.type() != SelectorToken.Type.OPERATOR) {
            throw unterminatedAttributeOr(start, "Expected an attribute operator or ']'");
        }
        final var type = AttributeSelectorType.byOperator(current.text());
        if (type == null) {
            throw error("Unknown attribute operator '" + current.text() + "'");
        }
        advance();
        skipWhitespace();
        if (current.type() != SelectorToken.Type.NAME && current.type() != SelectorToken.Type.STRING) {
            throw unterminatedAttributeOr(start, "Expected an attribute value");
        }
        final var value = current.text();
        advance();
        skipWhitespace();
        if (current.type() != SelectorToken.Type.RIGHT_BRACKET) {
            throw unterminatedAttributeOr(start, "Expected ']'");
        }
        advance();
        return new AttributeSelector(name, type, value);
    }

    private SelectorParserException unterminatedAttributeOr(final int start, final String expectation) {
        if (current.type() == SelectorToken.Type.END) {
            return new SelectorParserException("Unterminated attribute selector", source, start);
        }
        return error(expectation + " but found " + current.describe() + " instead");
    }

    /**
     * Validates the text of the current token as a CSS identifier and returns it.
     */
    private String identifier(final String what) {
        final var text = current.text();
        if (!isIdentifier(text)) {
            throw error("Expected " + what + " but found " + current.describe() + " instead");
        }
        return text;
    }

    private static boolean isIdentifier(final String text) {
        if (text.isEmpty() || text.equals("-") || isDigit(text.charAt(0))) {
            return false;
        }
        return !(text.charAt(0) == '-' && isDigit(text.charAt(1)));
    }

    private static boolean isDigit(final char ch) {
        return ch >= '0' && ch <= '9';
    }

    private boolean skipWhitespace() {
        if (current.type() != SelectorToken.Type.WHITESPACE) {
            return false;
        }
        advance();
        return true;
    }

    private void advance() {
        current = lexer.next();
    }

    private SelectorParserException error(final String reason) {
        return new SelectorParserException(reason, source, current.position());
    }

    private final String source;
    private final SelectorLexer lexer;
    private SelectorToken current;
}
