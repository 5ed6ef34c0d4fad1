// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.selector;

import java.util.List;
import dim.dom.Node;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * A CSS selector: a chain of compound selectors joined by combinators, such as {@code main#main p > a.term[href]}.
 * <p>
 * Selectors are evaluated right to left: the last compound selector, the <dfn>subject</dfn>, constrains the candidate
 * element itself, and each combinator constrains an ancestor or a preceding sibling through the compound selectors
 * to its left.
 * <p>
 * Selectors are immutable, so a selector parsed once can be reused for any number of queries from any thread.
 *
 * @param compounds the compound selectors, in source order
 * @param combinators the combinators, in source order; {@code combinators.get(i)} joins {@code compounds.get(i)} and
 * {@code compounds.get(i + 1)}
 */
public record Selector(List<CompoundSelector> compounds, List<Combinator> combinators) {
    public Selector {
        compounds = List.copyOf(compounds);
        combinators = List.copyOf(combinators);
        if (compounds.isEmpty()) {
            throw new IllegalArgumentException("A selector needs at least one compound selector");
        }
        if (combinators.size() != compounds.size() - 1) {
            throw new IllegalArgumentException("Expected exactly one combinator between each pair of compound selectors");
        }
    }

    /**
     * Returns a new selector consisting of a single compound selector.
     */
    public static Selector of(final CompoundSelector compound) {
        return new Selector(List.of(compound), List.of());
    }

    /**
     * Parses the given string as a single selector.
     * <p>
     * Unlike {@link SelectorGroup#fromString(String)}, a comma-separated list of selectors is rejected.
     *
     * @throws SelectorParserException if the string is not a valid selector
     */
    @CheckReturnValue
    public static Selector fromString(final String text) {
        return SelectorParser.parseSelector(text);
    }

    /**
     * Retrieves the rightmost compound selector, the one the matched element itself must satisfy.
     */
    public CompoundSelector subject() {
        return compounds.get(compounds.size() - 1);
    }

    /**
     * Checks whether the given node is matched by this selector. Ancestor and sibling lookups are unrestricted.
     */
    @CheckReturnValue
    public boolean matches(final Node node) {
        return SelectorMatcher.matches(node, this, null);
    }

    @Override
    public String toString() {
        final var builder = new StringBuilder();
        builder.append(compounds.get(0));
        for (int i = 0; i < combinators.size(); i += 1) {
            builder.append(combinators.get(i).separator()).append(compounds.get(i + 1));
        }
        return builder.toString();
    }
}
