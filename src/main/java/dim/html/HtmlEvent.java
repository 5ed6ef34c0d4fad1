// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.html;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A lexical event produced by an HTML tokenizer and consumed by the DOM builder.
 * <p>
 * Character references are expected to be already decoded in both text content and attribute values.
 */
public sealed interface HtmlEvent {
    /**
     * A start tag, with its attributes in source order.
     */
    record StartTag(String name, Map<String, String> attributes) implements HtmlEvent {
        public StartTag {
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }

        public StartTag(final String name) {
            this(name, Map.of());
        }
    }

    record EndTag(String name) implements HtmlEvent {
    }

    /**
     * A run of character data. Consecutive runs may be split arbitrarily by the tokenizer.
     */
    record Text(String content) implements HtmlEvent {
    }

    /**
     * A comment. Markup declarations the tokenizer doesn't otherwise understand, such as doctypes, are reported as
     * comments too.
     */
    record Comment(String content) implements HtmlEvent {
    }
}
