// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.dom;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import dim.selector.Selector;
import dim.selector.SelectorGroup;
import dim.selector.SelectorMatcher;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The base class for DOM tree nodes.
 * <p>
 * Only text and element nodes exist, and this is not going to change, hence the class is sealed.
 * <p>
 * A node is owned by the children list of its parent element. The parent reference kept by each node is a plain
 * back-pointer used for upward and sideways traversal; top-level nodes have no parent and no siblings.
 * <p>
 * Trees are never modified by the selector engine, so a tree can be queried from multiple threads at once, as long
 * as nobody calls the mutation methods of {@link Element} concurrently.
 */
public abstract sealed class Node {
    private Node() {
    }

    /**
     * Retrieves the parent element of this node, or {@code null} if this is a top-level node.
     */
    public final @Nullable Element parent() {
        return parent;
    }

    /**
     * Retrieves an unmodifiable view of the children of this node. Text nodes never have children.
     */
    public abstract List<Node> children();

    /**
     * Retrieves the text content of this node.
     * <p>
     * For text nodes this is the payload, for elements it's the concatenation of all descendant text nodes.
     */
    public abstract String text();

    public final @Nullable Node firstChild() {
        final var children = children();
        return children.isEmpty() ? null : children.get(0);
    }

    public final @Nullable Node lastChild() {
        final var children = children();
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    public final @Nullable Element firstElementChild() {
        for (final var child : children()) {
            if (child instanceof Element element) {
                return element;
            }
        }
        return null;
    }

    public final @Nullable Element lastElementChild() {
        final var children = children();
        for (int i = children.size() - 1; i >= 0; i -= 1) {
            if (children.get(i) instanceof Element element) {
                return element;
            }
        }
        return null;
    }

    /**
     * Retrieves the sibling immediately following this node, if any.
     * <p>
     * Sibling lookups are linear in the number of siblings.
     */
    public final @Nullable Node nextSibling() {
        final var parent = this.parent;
        if (parent == null) {
            return null;
        }
        final var index = parent.indexOf(this) + 1;
        return (index < parent.children.size()) ? parent.children.get(index) : null;
    }

    /**
     * Returns the siblings following this node, in document order.
     */
    public final List<Node> nextSiblings() {
        final var parent = this.parent;
        if (parent == null) {
            return List.of();
        }
        final var siblings = parent.children;
        return List.copyOf(siblings.subList(parent.indexOf(this) + 1, siblings.size()));
    }

    public final @Nullable Element nextElementSibling() {
        final var parent = this.parent;
        if (parent == null) {
            return null;
        }
        final var siblings = parent.children;
        for (int i = parent.indexOf(this) + 1; i < siblings.size(); i += 1) {
            if (siblings.get(i) instanceof Element element) {
                return element;
            }
        }
        return null;
    }

    /**
     * Retrieves the sibling immediately preceding this node, if any.
     */
    public final @Nullable Node previousSibling() {
        final var parent = this.parent;
        if (parent == null) {
            return null;
        }
        final var index = parent.indexOf(this);
        return (index > 0) ? parent.children.get(index - 1) : null;
    }

    /**
     * Returns the siblings preceding this node.
     * <p>
     * Compared to document order, the order is reversed: the adjacent sibling, if any, comes first.
     */
    public final List<Node> previousSiblings() {
        final var parent = this.parent;
        if (parent == null) {
            return List.of();
        }
        final var siblings = parent.children;
        final var result = new ArrayList<Node>();
        for (int i = parent.indexOf(this) - 1; i >= 0; i -= 1) {
            result.add(siblings.get(i));
        }
        return Collections.unmodifiableList(result);
    }

    public final @Nullable Element previousElementSibling() {
        final var parent = this.parent;
        if (parent == null) {
            return null;
        }
        final var siblings = parent.children;
        for (int i = parent.indexOf(this) - 1; i >= 0; i -= 1) {
            if (siblings.get(i) instanceof Element element) {
                return element;
            }
        }
        return null;
    }

    /**
     * Returns all ancestors of this node, nearest first.
     */
    public final List<Element> ancestors() {
        final var result = new ArrayList<Element>();
        for (var ancestor = parent; ancestor != null; ancestor = ancestor.parent()) {
            result.add(ancestor);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the ancestors of this node, nearest first, stopping at (and including) {@code root}.
     * <p>
     * If this node is {@code root}, the result is empty. If {@code root} is not in the ancestor chain, an
     * {@link IllegalArgumentException} is thrown.
     */
    public final List<Element> ancestors(final Node root) {
        if (this == root) {
            return List.of();
        }
        final var result = new ArrayList<Element>();
        for (var ancestor = parent; ; ancestor = ancestor.parent()) {
            if (ancestor == null) {
                throw new IllegalArgumentException("The given root node was not found in the ancestor chain");
            }
            result.add(ancestor);
            if (ancestor == root) {
                return Collections.unmodifiableList(result);
            }
        }
    }

    /**
     * Returns all descendants of this node in document order, that is depth-first pre-order. The node itself is not
     * included.
     */
    public final List<Node> descendants() {
        final var result = new ArrayList<Node>();
        final var pending = new ArrayDeque<Node>();
        pushChildrenReversed(pending, this);
        while (!pending.isEmpty()) {
            final var node = pending.pop();
            result.add(node);
            pushChildrenReversed(pending, node);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the first element, in document order, matched by the given group of selectors, or {@code null} if
     * there's no such element.
     * <p>
     * This node itself is eligible. Only candidates are restricted to the subtree rooted at this node; combinators
     * may relate them to elements above it, exactly as {@link #matchedBy(String)} does.
     * <p>
     * The string is parsed anew on every call; callers that run the same query repeatedly should parse it once with
     * {@link SelectorGroup#fromString(String)} and use {@link #select(SelectorGroup)} instead.
     *
     * @throws dim.selector.SelectorParserException if the selector is not syntactically valid
     */
    @CheckReturnValue
    public final @Nullable Element select(final String selectorGroup) {
        return select(SelectorGroup.fromString(selectorGroup));
    }

    @CheckReturnValue
    public final @Nullable Element select(final SelectorGroup selectorGroup) {
        return SelectorMatcher.selectFirst(this, selectorGroup);
    }

    @CheckReturnValue
    public final @Nullable Element select(final Selector selector) {
        return select(SelectorGroup.of(selector));
    }

    /**
     * Returns all elements matched by the given group of selectors, in document order.
     * <p>
     * This node itself is eligible. Like {@link #select(String)}, the string is parsed on every call.
     *
     * @throws dim.selector.SelectorParserException if the selector is not syntactically valid
     */
    @CheckReturnValue
    public final List<Element> selectAll(final String selectorGroup) {
        return selectAll(SelectorGroup.fromString(selectorGroup));
    }

    @CheckReturnValue
    public final List<Element> selectAll(final SelectorGroup selectorGroup) {
        return SelectorMatcher.selectAll(this, selectorGroup);
    }

    @CheckReturnValue
    public final List<Element> selectAll(final Selector selector) {
        return selectAll(SelectorGroup.of(selector));
    }

    /**
     * Checks whether this node is matched by the given group of selectors.
     * <p>
     * Ancestor and sibling lookups are unrestricted. The string is parsed on every call.
     *
     * @throws dim.selector.SelectorParserException if the selector is not syntactically valid
     */
    @CheckReturnValue
    public final boolean matchedBy(final String selectorGroup) {
        return matchedBy(SelectorGroup.fromString(selectorGroup));
    }

    @CheckReturnValue
    public final boolean matchedBy(final SelectorGroup selectorGroup) {
        return SelectorMatcher.matches(this, selectorGroup, null);
    }

    @CheckReturnValue
    public final boolean matchedBy(final Selector selector) {
        return SelectorMatcher.matches(this, selector, null);
    }

    /**
     * Checks whether this node is matched by the given group of selectors, without letting parent and ancestor
     * lookups go past {@code root}: its own parent and ancestors are never considered. Sibling lookups are
     * unrestricted.
     */
    @CheckReturnValue
    public final boolean matchedBy(final SelectorGroup selectorGroup, final Node root) {
        return SelectorMatcher.matches(this, selectorGroup, root);
    }

    private static void pushChildrenReversed(final ArrayDeque<Node> pending, final Node node) {
        final var children = node.children();
        for (int i = children.size() - 1; i >= 0; i -= 1) {
            pending.push(children.get(i));
        }
    }

    private @Nullable Element parent = null;

    /**
     * DOM node representing an HTML element, with attributes and children.
     * <p>
     * Tag and attribute names are case-insensitive and stored in lower case; attribute values are case-sensitive.
     */
    public static final class Element extends Node {
        /**
         * Initializes a new element with the given tag name, no attributes and no children.
         */
        public Element(final String tag) {
            this(tag, Map.of());
        }

        /**
         * Initializes a new element with the given tag name and attributes, and no children.
         * <p>
         * Attribute names are lower-cased; if that makes two names collide, the first one in iteration order wins.
         */
        public Element(final String tag, final Map<String, String> attributes) {
            this.tag = tag.toLowerCase(Locale.ROOT);
            for (final var entry : attributes.entrySet()) {
                this.attributes.putIfAbsent(normalizeName(entry.getKey()), entry.getValue());
            }
        }

        /**
         * Retrieves the lower-case tag name of this element.
         */
        public String tag() {
            return tag;
        }

        /**
         * Retrieves an unmodifiable view of the attributes of this element, in insertion order.
         * <p>
         * Attributes without a value in the source, such as {@code <input disabled>}, have the empty string as value.
         */
        public Map<String, String> attributes() {
            return attributesView;
        }

        /**
         * Retrieves the value of the attribute with the given name, or {@code null} if no such attribute is present.
         */
        public @Nullable String attribute(final String name) {
            return attributes.get(normalizeName(name));
        }

        public boolean hasAttribute(final String name) {
            return attributes.containsKey(normalizeName(name));
        }

        public @Nullable String id() {
            return attributes.get("id");
        }

        /**
         * Returns the whitespace-separated tokens of the {@code class} attribute, in order of appearance.
         */
        public List<String> classes() {
            final var value = attributes.get("class");
            if (value == null) {
                return List.of();
            }
            return Arrays.stream(value.split("[ \\t\\n\\r\\f]+"))
                .filter(token -> !token.isEmpty())
                .toList();
        }

        @Override
        public List<Node> children() {
            return childrenView;
        }

        @Override
        public String text() {
            final var builder = new StringBuilder();
            for (final var node : descendants()) {
                if (node instanceof Text text) {
                    builder.append(text.text());
                }
            }
            return builder.toString();
        }

        /**
         * Appends the given node as the last child of this element.
         * <p>
         * If the node already has a parent, it's removed from that parent first. Appending an element to itself or to
         * one of its own descendants is rejected with an {@link IllegalArgumentException}.
         */
        public void appendChild(final Node child) {
            for (Element ancestor = this; ancestor != null; ancestor = ancestor.parent()) {
                if (ancestor == child) {
                    throw new IllegalArgumentException("Element <" + tag + "> cannot become its own descendant");
                }
            }
            final var oldParent = child.parent();
            if (oldParent != null) {
                oldParent.removeChild(child);
            }
            children.add(child);
            child.parent = this;
        }

        /**
         * Removes the given child from this element.
         *
         * @throws IllegalArgumentException if the node is not a child of this element
         */
        public void removeChild(final Node child) {
            final var index = indexOf(child);
            children.remove(index);
            child.parent = null;
        }

        /**
         * Sets the attribute with the given name, replacing an existing value in place or appending a new attribute.
         */
        public void setAttribute(final String name, final String value) {
            attributes.put(normalizeName(name), Objects.requireNonNull(value));
        }

        /**
         * Removes the attribute with the given name, returning its previous value, or {@code null} if there was none.
         */
        public @Nullable String removeAttribute(final String name) {
            return attributes.remove(normalizeName(name));
        }

        @Override
        public String toString() {
            final var builder = new StringBuilder();
            builder.append('<').append(tag);
            attributes.forEach((name, value) -> builder.append(' ').append(name).append("=\"").append(value).append('"'));
            builder.append('>');
            return builder.toString();
        }

        // Identity-based, because text nodes compare equal by payload.
        private int indexOf(final Node child) {
            for (int i = 0; i < children.size(); i += 1) {
                if (children.get(i) == child) {
                    return i;
                }
            }
            throw new IllegalArgumentException("Node is not a child of element <" + tag + ">");
        }

        private static String normalizeName(final String name) {
            return name.toLowerCase(Locale.ROOT);
        }

        private final String tag;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final Map<String, String> attributesView = Collections.unmodifiableMap(attributes);
        private final List<Node> children = new ArrayList<>();
        private final List<Node> childrenView = Collections.unmodifiableList(children);
    }

    /**
     * DOM node representing bare text.
     * <p>
     * Two text nodes are equal if and only if their payloads are equal, regardless of their position in any tree.
     */
    public static final class Text extends Node {
        public Text(final String text) {
            this.text = Objects.requireNonNull(text);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public String text() {
            return text;
        }

        @Override
        public boolean equals(final @Nullable Object obj) {
            return obj instanceof Text other && text.equals(other.text);
        }

        @Override
        public int hashCode() {
            return text.hashCode();
        }

        @Override
        public String toString() {
            return "Text[text=" + text + ']';
        }

        private final String text;
    }
}
