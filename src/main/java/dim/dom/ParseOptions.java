// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.dom;

/**
 * Options controlling DOM construction.
 * <p>
 * In the default, tolerant mode, structural anomalies in the markup are recovered from silently: stray end tags are
 * ignored and unclosed elements are closed implicitly. In strict mode, each such recovery is reported as a
 * {@link DomBuilderException} instead.
 *
 * @param strict whether structural anomalies are reported rather than recovered from
 */
public record ParseOptions(boolean strict) {
    /**
     * Returns the default, tolerant options.
     */
    public static ParseOptions defaults() {
        return defaultOptions;
    }

    /**
     * Returns options that escalate structural anomalies to exceptions.
     */
    public static ParseOptions strictMode() {
        return strictOptions;
    }

    private static final ParseOptions defaultOptions = new ParseOptions(false);
    private static final ParseOptions strictOptions = new ParseOptions(true);
}
