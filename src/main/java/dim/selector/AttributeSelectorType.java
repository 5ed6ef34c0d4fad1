// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.selector;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The forms of attribute selectors.
 */
public enum AttributeSelectorType {
    /**
     * {@code [attr]}: the attribute is present, whatever its value.
     */
    EXISTS(""),
    /**
     * {@code [attr=val]}: the value is exactly {@code val}.
     */
    EQUALS("="),
    /**
     * {@code [attr~=val]}: one of the whitespace-separated words of the value is {@code val}.
     */
    CONTAINS_WORD("~="),
    /**
     * {@code [attr|=val]}: the value is {@code val} or starts with {@code val} followed by a hyphen.
     */
    HYPHEN_PREFIX("|="),
    /**
     * {@code [attr^=val]}: the value starts with {@code val}.
     */
    STARTS_WITH("^="),
    /**
     * {@code [attr$=val]}: the value ends with {@code val}.
     */
    ENDS_WITH("$="),
    /**
     * {@code [attr*=val]}: the value contains {@code val}.
     */
    CONTAINS("*=");

    AttributeSelectorType(final String operator) {
        this.operator = operator;
    }

    /**
     * Retrieves the type with the given operator, or {@code null} if there is no such operator.
     */
    public static @Nullable AttributeSelectorType byOperator(final String operator) {
        return typesByOperator.get(operator);
    }

    /**
     * Retrieves the operator of this type, as it appears in selector source. Empty for {@link #EXISTS}.
     */
    public String operator() {
        return operator;
    }

    private static final Map<String, AttributeSelectorType> typesByOperator = Arrays.stream(values())
        .filter(type -> type != EXISTS)
        .collect(Collectors.toUnmodifiableMap(AttributeSelectorType::operator, Function.identity()));

    private final String operator;
}
