// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.dom;

import java.util.List;
import dim.html.HtmlTokenizer;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The entry point for turning HTML source text into a DOM tree.
 * <p>
 * The whole input is tokenized with {@link HtmlTokenizer} and consumed by a {@link DomBuilder} before any of these
 * methods return.
 */
public final class HtmlParser {
    private HtmlParser() {
    }

    /**
     * Parses the given HTML source with the default, tolerant options and returns the root element.
     *
     * @see #parse(String, ParseOptions)
     */
    @CheckReturnValue
    public static Node.@Nullable Element parse(final String source) {
        return parse(source, ParseOptions.defaults());
    }

    /**
     * Parses the given HTML source and returns the root element, that is the first top-level element, or
     * {@code null} if the source contains no elements at all.
     * <p>
     * If the source contains multiple top-level elements, only the first is returned; use
     * {@link #parseFragment(String, ParseOptions)} to get all of them.
     *
     * @throws DomBuilderException if {@code options} request strict mode and the markup is structurally malformed
     */
    @CheckReturnValue
    public static Node.@Nullable Element parse(final String source, final ParseOptions options) {
        return DomBuilder.root(parseFragment(source, options));
    }

    /**
     * Parses the given HTML source with the default, tolerant options and returns all top-level nodes.
     */
    @CheckReturnValue
    public static List<Node> parseFragment(final String source) {
        return parseFragment(source, ParseOptions.defaults());
    }

    /**
     * Parses the given HTML source and returns all top-level nodes, in document order.
     *
     * @throws DomBuilderException if {@code options} request strict mode and the markup is structurally malformed
     */
    @CheckReturnValue
    public static List<Node> parseFragment(final String source, final ParseOptions options) {
        return DomBuilder.build(new HtmlTokenizer(source), options);
    }
}
