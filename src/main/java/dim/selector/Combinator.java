// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.selector;

/**
 * The relation between two adjacent compound selectors in a {@link Selector}.
 */
public enum Combinator {
    /**
     * {@code A B}: any strict ancestor.
     */
    DESCENDANT(" "),
    /**
     * {@code A > B}: the parent.
     */
    CHILD(">"),
    /**
     * {@code A + B}: the nearest preceding element sibling.
     */
    NEXT_SIBLING("+"),
    /**
     * {@code A ~ B}: any preceding element sibling.
     */
    SUBSEQUENT_SIBLING("~");

    Combinator(final String symbol) {
        this.symbol = symbol;
    }

    /**
     * Retrieves the symbol of this combinator as it appears in selector source; a single space for
     * {@link #DESCENDANT}.
     */
    public String symbol() {
        return symbol;
    }

    String separator() {
        return (this == DESCENDANT) ? symbol : ' ' + symbol + ' ';
    }

    private final String symbol;
}
