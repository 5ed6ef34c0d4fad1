// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.selector;

import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A single attribute constraint of a compound selector, such as {@code [href^="https:"]}.
 * <p>
 * The attribute name is case-insensitive and stored in lower case. The value is compared case-sensitively.
 *
 * @param name the attribute name
 * @param type the form of the constraint
 * @param value the value to compare against; {@code null} if and only if {@code type} is
 * {@link AttributeSelectorType#EXISTS}
 */
public record AttributeSelector(String name, AttributeSelectorType type, @Nullable String value) {
    public AttributeSelector {
        name = name.toLowerCase(Locale.ROOT);
        if ((type == AttributeSelectorType.EXISTS) != (value == null)) {
            throw new IllegalArgumentException("A value is required for all attribute selector types except EXISTS");
        }
    }

    /**
     * Returns a new selector matching elements that have the given attribute, whatever its value.
     */
    public static AttributeSelector exists(final String name) {
        return new AttributeSelector(name, AttributeSelectorType.EXISTS, null);
    }

    @Override
    public String toString() {
        if (value == null) {
            return '[' + name + ']';
        }
        final var builder = new StringBuilder();
        builder.append('[').append(name).append(type.operator()).append('"');
        for (int i = 0; i < value.length(); i += 1) {
            final var ch = value.charAt(i);
            if (ch == '"' || ch == '\\') {
                builder.append('\\');
            }
            builder.append(ch);
        }
        return builder.append("\"]").toString();
    }
}
