// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.selector;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import dim.dom.Node;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The matching engine: evaluates selectors against nodes of a DOM tree.
 * <p>
 * Selectors are evaluated right to left. The rightmost compound selector must match the candidate node itself, then
 * each combinator is followed to the nodes it relates the candidate to, which must in turn match the rest of the
 * selector. Text nodes never match any compound selector, and sibling combinators skip over them.
 * <p>
 * The {@code matches} methods accept an optional <dfn>scope</dfn>: when present, parent and ancestor lookups stop at
 * it, so the scope's own ancestors never take part in a match. Sibling lookups are not affected. Queries through
 * {@link #selectAll} and {@link #selectFirst} are unscoped, so an element is selected exactly when
 * {@code matches(element, group, null)} holds.
 */
public final class SelectorMatcher {
    private SelectorMatcher() {
    }

    /**
     * Checks whether the given node is matched by any selector in the given group.
     */
    @CheckReturnValue
    public static boolean matches(final Node node, final SelectorGroup group, final @Nullable Node scope) {
        for (final var selector : group) {
            if (matches(node, selector, scope)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether the given node is matched by the given selector.
     */
    @CheckReturnValue
    public static boolean matches(final Node node, final Selector selector, final @Nullable Node scope) {
        return matchesFrom(node, selector, selector.compounds().size() - 1, scope);
    }

    /**
     * Collects all elements in the subtree rooted at {@code root}, including {@code root} itself, that are matched by
     * any selector in the given group, in document order. Combinators may look above {@code root}.
     */
    @CheckReturnValue
    public static List<Node.Element> selectAll(final Node root, final SelectorGroup group) {
        final var result = new ArrayList<Node.Element>();
        walk(root, group, result, false);
        return result;
    }

    /**
     * Finds the first element in document order in the subtree rooted at {@code root}, including {@code root}
     * itself, that is matched by any selector in the given group. Combinators may look above {@code root}.
     */
    @CheckReturnValue
    public static Node.@Nullable Element selectFirst(final Node root, final SelectorGroup group) {
        final var result = new ArrayList<Node.Element>(1);
        walk(root, group, result, true);
        return result.isEmpty() ? null : result.get(0);
    }

    private static void walk(
        final Node root,
        final SelectorGroup group,
        final List<Node.Element> result,
        final boolean firstOnly
    ) {
        final var stack = new ArrayDeque<Node>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final var node = stack.pop();
            if (node instanceof Node.Element element && matches(element, group, null)) {
                result.add(element);
                if (firstOnly) {
                    return;
                }
            }
            final var children = node.children();
            for (int i = children.size() - 1; i >= 0; i -= 1) {
                stack.push(children.get(i));
            }
        }
    }

    /**
     * Checks whether the part of the selector up to and including the compound selector at {@code index} matches the
     * given node.
     */
    private static boolean matchesFrom(
        final Node node,
        final Selector selector,
        final int index,
        final @Nullable Node scope
    ) {
        if (!matchesCompound(node, selector.compounds().get(index))) {
            return false;
        }
        if (index == 0) {
            return true;
        }
        final var next = index - 1;
        switch (selector.combinators().get(next)) {
            case DESCENDANT -> {
                if (node == scope) {
                    return false;
                }
                for (var ancestor = node.parent(); ancestor != null; ancestor = ancestor.parent()) {
                    if (matchesFrom(ancestor, selector, next, scope)) {
                        return true;
                    }
                    if (ancestor == scope) {
                        break;
                    }
                }
                return false;
            }
            case CHILD -> {
                final var parent = node.parent();
                return node != scope && parent != null && matchesFrom(parent, selector, next, scope);
            }
            case NEXT_SIBLING -> {
                final var sibling = node.previousElementSibling();
                return sibling != null && matchesFrom(sibling, selector, next, scope);
            }
            case SUBSEQUENT_SIBLING -> {
                for (var sibling = node.previousElementSibling(); sibling != null;
                     sibling = sibling.previousElementSibling()) {
                    if (matchesFrom(sibling, selector, next, scope)) {
                        return true;
                    }
                }
                return false;
            }
        }
        throw new IllegalStateException("Unknown combinator");
    }

    private static boolean matchesCompound(final Node node, final CompoundSelector compound) {
        if (!(node instanceof Node.Element element)) {
            return false;
        }
        final var tag = compound.tag();
        if (tag != null && !tag.equals(element.tag())) {
            return false;
        }
        final var id = compound.id();
        if (id != null && !id.equals(element.id())) {
            return false;
        }
        if (!compound.classes().isEmpty() && !element.classes().containsAll(compound.classes())) {
            return false;
        }
        for (final var attribute : compound.attributes()) {
            if (!matchesAttribute(element, attribute)) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesAttribute(final Node.Element element, final AttributeSelector selector) {
        final var actual = element.attribute(selector.name());
        if (actual == null) {
            return false;
        }
        final var expected = selector.value();
        if (expected == null) {
            return true;
        }
        return switch (selector.type()) {
            case EXISTS -> true;
            case EQUALS -> actual.equals(expected);
            case CONTAINS_WORD -> !expected.isEmpty()
                && expected.chars().noneMatch(ch -> SelectorLexer.isWhitespace((char) ch))
                && List.of(actual.split("[ \\t\\n\\r\\f]+")).contains(expected);
            case HYPHEN_PREFIX -> actual.equals(expected) || actual.startsWith(expected + "-");
            case STARTS_WITH -> !expected.isEmpty() && actual.startsWith(expected);
            case ENDS_WITH -> !expected.isEmpty() && actual.endsWith(expected);
            case CONTAINS -> !expected.isEmpty() && actual.contains(expected);
        };
    }
}
