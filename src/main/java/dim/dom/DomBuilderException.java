// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.dom;

/**
 * Exception thrown when the {@link DomBuilder} is misused, or when it detects malformed markup in strict mode.
 */
public final class DomBuilderException extends RuntimeException {
    /**
     * Initializes a new exception with the given user-readable reason.
     */
    public DomBuilderException(final String message) {
        super(message);
    }

    private static final long serialVersionUID = 1L;
}
