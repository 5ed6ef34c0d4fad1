// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.html;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.jsoup.parser.Parser;

/**
 * A lenient lexical HTML tokenizer: the means of converting HTML source text into a lazy stream of
 * {@link HtmlEvent}s.
 * <p>
 * The tokenizer knows nothing about document structure, it merely splits the input into tags, text runs and comments.
 * It never fails: input that doesn't look like markup is reported as text, and a tag cut off by the end of input is
 * dropped. Doctypes, processing instructions and other markup declarations are reported as comments.
 * <p>
 * The contents of {@code script} and {@code style} elements are raw text; the contents of {@code title} and
 * {@code textarea} are raw text with character references decoded.
 * <p>
 * Tokenizer objects should <em>never</em> be shared between threads.
 */
public final class HtmlTokenizer implements Iterator<HtmlEvent> {
    /**
     * Initializes a new tokenizer that will read from the given source text.
     */
    public HtmlTokenizer(final String source) {
        this.source = source;
        length = source.length();
    }

    /**
     * Returns an iterable that tokenizes the given source text afresh each time it's iterated.
     */
    public static Iterable<HtmlEvent> tokenize(final String source) {
        return () -> new HtmlTokenizer(source);
    }

    @Override
    public boolean hasNext() {
        if (pending == null) {
            pending = readEvent();
        }
        return pending != null;
    }

    @Override
    public HtmlEvent next() {
        final var event = hasNext() ? pending : null;
        if (event == null) {
            throw new NoSuchElementException("No more HTML events left");
        }
        pending = null;
        return event;
    }

    private @Nullable HtmlEvent readEvent() {
        while (position < length) {
            final @Nullable HtmlEvent event;
            if (rawTextElement != null) {
                event = readRawText(rawTextElement);
            } else if (startsMarkup(position)) {
                event = readMarkup();
            } else {
                event = readText();
            }
            if (event != null) {
                return event;
            }
        }
        return null;
    }

    private @Nullable HtmlEvent readMarkup() {
        final var next = source.charAt(position + 1);
        if (isAsciiLetter(next)) {
            return readStartTag();
        }
        switch (next) {
            case '/' -> {
                if (position + 2 < length && isAsciiLetter(source.charAt(position + 2))) {
                    return readEndTag();
                }
                if (source.startsWith("</>", position)) {
                    position += 3;
                    return null;
                }
                return readBogusComment(position + 2);
            }
            case '!' -> {
                return source.startsWith("<!--", position) ? readComment() : readBogusComment(position + 2);
            }
            default -> {
                return readBogusComment(position + 1);
            }
        }
    }

    private HtmlEvent readText() {
        final var start = position;
        var end = position + 1;
        while (end < length && !startsMarkup(end)) {
            end += 1;
        }
        position = end;
        return new HtmlEvent.Text(Parser.unescapeEntities(source.substring(start, end), false));
    }

    private @Nullable HtmlEvent readRawText(final String elementName) {
        final var end = findRawTextEnd(elementName);
        final var content = source.substring(position, end);
        position = end;
        rawTextElement = null;
        if (content.isEmpty()) {
            return null;
        }
        return new HtmlEvent.Text(escapableRawTextElements.contains(elementName)
            ? Parser.unescapeEntities(content, false)
            : content);
    }

    private int findRawTextEnd(final String elementName) {
        var candidate = source.indexOf("</", position);
        while (candidate >= 0) {
            final var nameEnd = candidate + 2 + elementName.length();
            if (source.regionMatches(true, candidate + 2, elementName, 0, elementName.length())
                && (nameEnd >= length || isTagNameTerminator(source.charAt(nameEnd)))) {
                return candidate;
            }
            candidate = source.indexOf("</", candidate + 2);
        }
        return length;
    }

    private @Nullable HtmlEvent readStartTag() {
        position += 1;
        final var name = readTagName();
        final var attributes = new LinkedHashMap<String, String>();
        while (true) {
            skipWhitespace();
            if (position >= length) {
                return null;
            }
            final var ch = source.charAt(position);
            if (ch == '>') {
                position += 1;
                break;
            }
            if (ch == '/') {
                position += 1;
            } else {
                readAttribute(attributes);
            }
        }
        if (rawTextElements.contains(name) || escapableRawTextElements.contains(name)) {
            rawTextElement = name;
        }
        return new HtmlEvent.StartTag(name, attributes);
    }

    private @Nullable HtmlEvent readEndTag() {
        position += 2;
        final var name = readTagName();
        final var close = source.indexOf('>', position);
        if (close < 0) {
            position = length;
            return null;
        }
        position = close + 1;
        return new HtmlEvent.EndTag(name);
    }

    private HtmlEvent readComment() {
        // <!--> and <!---> are complete, empty comments.
        for (final var emptyComment : emptyComments) {
            if (source.startsWith(emptyComment, position)) {
                position += emptyComment.length();
                return new HtmlEvent.Comment("");
            }
        }
        final var contentStart = position + 4;
        final var close = source.indexOf("-->", contentStart);
        if (close < 0) {
            position = length;
            return new HtmlEvent.Comment(source.substring(contentStart));
        }
        position = close + 3;
        return new HtmlEvent.Comment(source.substring(contentStart, close));
    }

    private HtmlEvent readBogusComment(final int contentStart) {
        final var close = source.indexOf('>', contentStart);
        if (close < 0) {
            position = length;
            return new HtmlEvent.Comment(source.substring(Math.min(contentStart, length)));
        }
        position = close + 1;
        return new HtmlEvent.Comment(source.substring(contentStart, close));
    }

    private String readTagName() {
        final var start = position;
        while (position < length && !isTagNameTerminator(source.charAt(position))) {
            position += 1;
        }
        return source.substring(start, position).toLowerCase(Locale.ROOT);
    }

    private void readAttribute(final Map<String, String> attributes) {
        final var start = position;
        // The first character is always part of the name, even if it's '='.
        position += 1;
        while (position < length) {
            final var ch = source.charAt(position);
            if (isWhitespace(ch) || ch == '/' || ch == '>' || ch == '=') {
                break;
            }
            position += 1;
        }
        final var name = source.substring(start, position).toLowerCase(Locale.ROOT);
        skipWhitespace();
        var value = "";
        if (position < length && source.charAt(position) == '=') {
            position += 1;
            skipWhitespace();
            value = readAttributeValue();
        }
        attributes.putIfAbsent(name, value);
    }

    private String readAttributeValue() {
        if (position >= length) {
            return "";
        }
        final var quote = source.charAt(position);
        final String raw;
        if (quote == '"' || quote == '\'') {
            final var close = source.indexOf(quote, position + 1);
            final var end = (close < 0) ? length : close;
            raw = source.substring(position + 1, end);
            position = Math.min(end + 1, length);
        } else {
            final var start = position;
            while (position < length && !isWhitespace(source.charAt(position)) && source.charAt(position) != '>') {
                position += 1;
            }
            raw = source.substring(start, position);
        }
        return Parser.unescapeEntities(raw, true);
    }

    private void skipWhitespace() {
        while (position < length && isWhitespace(source.charAt(position))) {
            position += 1;
        }
    }

    private boolean startsMarkup(final int index) {
        if (source.charAt(index) != '<' || index + 1 >= length) {
            return false;
        }
        final var next = source.charAt(index + 1);
        return isAsciiLetter(next) || next == '!' || next == '?' || (next == '/' && index + 2 < length);
    }

    private static boolean isTagNameTerminator(final char ch) {
        return isWhitespace(ch) || ch == '/' || ch == '>';
    }

    private static boolean isWhitespace(final char ch) {
        return ch == ' ' || ch == '\t' || ch == '\n' || ch == '\f' || ch == '\r';
    }

    private static boolean isAsciiLetter(final char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }

    private static final Set<String> rawTextElements = Set.of("script", "style");
    private static final Set<String> escapableRawTextElements = Set.of("textarea", "title");
    private static final List<String> emptyComments = List.of("<!-->", "<!--->");

    private final String source;
    private final int length;
    private int position = 0;
    private @Nullable String rawTextElement = null;
    private @Nullable HtmlEvent pending = null;
}
