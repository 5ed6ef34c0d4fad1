// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.selector;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import dim.dom.Node;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A group of CSS selectors, that is a comma-separated list of alternatives such as {@code th.center, td.center}.
 * <p>
 * A group matches an element if any of its selectors does. Groups are immutable and never empty.
 * <p>
 * Parsing is much more expensive than matching, so callers running the same query repeatedly should keep the parsed
 * group around instead of passing the selector string to {@link Node#selectAll(String)} each time.
 */
public final class SelectorGroup implements Iterable<Selector> {
    private SelectorGroup(final List<Selector> selectors) {
        if (selectors.isEmpty()) {
            throw new IllegalArgumentException("A selector group needs at least one selector");
        }
        this.selectors = selectors;
    }

    /**
     * Returns a new group consisting of the given selectors, in order.
     */
    public static SelectorGroup of(final List<Selector> selectors) {
        return new SelectorGroup(List.copyOf(selectors));
    }

    public static SelectorGroup of(final Selector... selectors) {
        return new SelectorGroup(List.of(selectors));
    }

    /**
     * Parses the given string as a group of selectors.
     * <p>
     * Supported are type, universal, ID, class and attribute selectors, and the descendant, child, next-sibling and
     * subsequent-sibling combinators. Pseudo-classes, pseudo-elements and namespace prefixes are rejected. Whitespace
     * around the whole group and around commas is insignificant.
     *
     * @throws SelectorParserException if the string is not a valid group of selectors
     */
    @CheckReturnValue
    public static SelectorGroup fromString(final String text) {
        return SelectorParser.parseGroup(text);
    }

    public Selector get(final int index) {
        return selectors.get(index);
    }

    public int size() {
        return selectors.size();
    }

    /**
     * Retrieves an unmodifiable list of the selectors in this group.
     */
    public List<Selector> selectors() {
        return selectors;
    }

    @Override
    public Iterator<Selector> iterator() {
        return selectors.iterator();
    }

    /**
     * Checks whether the given node is matched by any selector in this group. Ancestor and sibling lookups are
     * unrestricted.
     */
    @CheckReturnValue
    public boolean matches(final Node node) {
        return SelectorMatcher.matches(node, this, null);
    }

    /**
     * Checks whether the given node is matched by any selector in this group, without letting parent and ancestor
     * lookups go past {@code scope}.
     */
    @CheckReturnValue
    public boolean matches(final Node node, final Node scope) {
        return SelectorMatcher.matches(node, this, scope);
    }

    @Override
    public boolean equals(final @Nullable Object obj) {
        return obj instanceof SelectorGroup other && selectors.equals(other.selectors);
    }

    @Override
    public int hashCode() {
        return selectors.hashCode();
    }

    @Override
    public String toString() {
        return selectors.stream().map(Selector::toString).collect(Collectors.joining(", "));
    }

    private final List<Selector> selectors;
}
