// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.selector;

/**
 * Exception thrown when a selector string could not be parsed.
 */
public final class SelectorParserException extends RuntimeException {
    /**
     * Initializes a new exception with the given user-readable reason, the selector string being parsed and the
     * character offset at which the failure was detected.
     */
    public SelectorParserException(final String reason, final String selector, final int position) {
        super("Selector parser aborted at character " + position + " of \"" + selector + "\": " + reason);
        this.reason = reason;
        this.selector = selector;
        this.position = position;
    }

    /**
     * Retrieves the reason of the failure, without location information.
     */
    public String reason() {
        return reason;
    }

    public String selector() {
        return selector;
    }

    /**
     * Retrieves the zero-based character offset in {@link #selector()} where the failure was detected.
     */
    public int position() {
        return position;
    }

    private static final long serialVersionUID = 1L;

    private final String reason;
    private final String selector;
    private final int position;
}
