// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.selector;

import java.util.List;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A sequence of simple selectors not separated by combinators, such as {@code div#main.wide[lang]}.
 * <p>
 * All constraints must hold for an element to match. A compound selector without any constraint is the universal
 * selector {@code *}.
 *
 * @param tag the required tag name, in lower case, or {@code null} for any tag
 * @param id the required ID, or {@code null} for any ID
 * @param classes the required class names
 * @param attributes the attribute constraints
 */
public record CompoundSelector(
    @Nullable String tag,
    @Nullable String id,
    List<String> classes,
    List<AttributeSelector> attributes
) {
    public CompoundSelector {
        tag = (tag == null) ? null : tag.toLowerCase(Locale.ROOT);
        classes = List.copyOf(classes);
        attributes = List.copyOf(attributes);
    }

    /**
     * Returns the universal selector {@code *}.
     */
    public static CompoundSelector universal() {
        return universal;
    }

    /**
     * Returns a new compound selector matching elements with the given tag name.
     */
    public static CompoundSelector ofTag(final String tag) {
        return new CompoundSelector(tag, null, List.of(), List.of());
    }

    public boolean isUniversal() {
        return tag == null && id == null && classes.isEmpty() && attributes.isEmpty();
    }

    @Override
    public String toString() {
        if (isUniversal()) {
            return "*";
        }
        final var builder = new StringBuilder();
        if (tag != null) {
            builder.append(tag);
        }
        if (id != null) {
            builder.append('#').append(id);
        }
        for (final var className : classes) {
            builder.append('.').append(className);
        }
        for (final var attribute : attributes) {
            builder.append(attribute);
        }
        return builder.toString();
    }

    private static final CompoundSelector universal = new CompoundSelector(null, null, List.of(), List.of());
}
