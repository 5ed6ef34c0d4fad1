// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.dom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import dim.html.HtmlEvent;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The DOM builder: assembles a tree of {@link Node}s out of a stream of {@link HtmlEvent}s.
 * <p>
 * The builder keeps a stack of currently open elements. Content is appended to the element on top of the stack, or
 * to the top-level forest when the stack is empty. Void elements, such as {@code <br>}, are never opened. An end tag
 * closes the nearest open element with the same name, implicitly closing everything opened after it; an end tag
 * with no matching open element is ignored. Comments are dropped, and adjacent text runs are coalesced into a single
 * text node.
 * <p>
 * With {@link ParseOptions#strict()} set, ignored end tags, implicitly closed elements and elements left open at the
 * end of input are reported as {@link DomBuilderException}s instead.
 * <p>
 * Builder objects are single-use, and should <em>never</em> be shared between threads.
 */
public final class DomBuilder {
    /**
     * Initializes a new DOM builder with the given options.
     */
    public DomBuilder(final ParseOptions options) {
        this.options = options;
    }

    /**
     * Consumes all events from the given iterator and returns the resulting top-level forest.
     *
     * @see #finish()
     */
    public static List<Node> build(final Iterator<HtmlEvent> events, final ParseOptions options) {
        final var builder = new DomBuilder(options);
        while (events.hasNext()) {
            builder.accept(events.next());
        }
        return builder.finish();
    }

    /**
     * Returns the first element of the given forest, or {@code null} if it contains no elements.
     */
    public static Node.@Nullable Element root(final List<Node> forest) {
        for (final var node : forest) {
            if (node instanceof Node.Element element) {
                return element;
            }
        }
        return null;
    }

    /**
     * Processes a single event.
     *
     * @throws DomBuilderException if the builder has already finished, or if the event reveals malformed structure in
     * strict mode
     */
    public void accept(final HtmlEvent event) {
        ensureNotFinished();
        if (event instanceof HtmlEvent.StartTag startTag) {
            startTag(startTag.name(), startTag.attributes());
        } else if (event instanceof HtmlEvent.EndTag endTag) {
            endTag(endTag.name());
        } else if (event instanceof HtmlEvent.Text text) {
            text(text.content());
        }
        // Comments are not part of the tree.
    }

    /**
     * Finishes construction, closing all elements that are still open, and returns an unmodifiable list of top-level
     * nodes in document order.
     * <p>
     * The list is empty if no content was seen. Typically it contains a single root element, possibly surrounded by
     * whitespace text.
     *
     * @throws DomBuilderException if the builder has already finished, or if elements are still open in strict mode
     */
    public List<Node> finish() {
        ensureNotFinished();
        flushText();
        if (!openElements.isEmpty()) {
            if (options.strict()) {
                throw new DomBuilderException("Unclosed elements at end of input: " + describeOpenElements(0));
            }
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Implicitly closing at end of input: " + describeOpenElements(0));
            }
            openElements.clear();
        }
        finished = true;
        return Collections.unmodifiableList(topLevel);
    }

    private void startTag(final String name, final Map<String, String> attributes) {
        flushText();
        final var element = new Node.Element(name, attributes);
        append(element);
        if (!voidElements.contains(element.tag())) {
            openElements.add(element);
        }
    }

    private void endTag(final String name) {
        final var tag = name.toLowerCase(Locale.ROOT);
        final var index = findOpenElement(tag);
        if (index < 0) {
            if (options.strict()) {
                throw new DomBuilderException("Unexpected end tag </" + tag + ">, no such element is open");
            }
            logger.fine(() -> "Ignoring end tag </" + tag + ">, no such element is open");
            return;
        }
        final var top = openElements.size() - 1;
        if (index < top) {
            final var implicitlyClosed = describeOpenElements(index + 1);
            if (options.strict()) {
                throw new DomBuilderException(
                    "End tag </" + tag + "> found while these elements are still open: " + implicitlyClosed);
            }
            logger.fine(() -> "End tag </" + tag + "> implicitly closes " + implicitlyClosed);
        }
        flushText();
        openElements.subList(index, openElements.size()).clear();
    }

    private void text(final String content) {
        pendingText.append(content);
    }

    private void flushText() {
        if (pendingText.length() == 0) {
            return;
        }
        append(new Node.Text(pendingText.toString()));
        pendingText.setLength(0);
    }

    private void append(final Node node) {
        if (openElements.isEmpty()) {
            topLevel.add(node);
        } else {
            openElements.get(openElements.size() - 1).appendChild(node);
        }
    }

    private int findOpenElement(final String tag) {
        for (int i = openElements.size() - 1; i >= 0; i -= 1) {
            if (openElements.get(i).tag().equals(tag)) {
                return i;
            }
        }
        return -1;
    }

    private String describeOpenElements(final int fromIndex) {
        final var builder = new StringBuilder();
        for (int i = openElements.size() - 1; i >= fromIndex; i -= 1) {
            if (builder.length() > 0) {
                builder.append(", ");
            }
            builder.append('<').append(openElements.get(i).tag()).append('>');
        }
        return builder.toString();
    }

    private void ensureNotFinished() {
        if (finished) {
            throw new DomBuilderException("The DOM builder has already finished");
        }
    }

    /**
     * Elements that can never have children.
     */
    private static final Set<String> voidElements = Set.of(
        "area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta", "param", "source", "track", "wbr"
    );

    private static final Logger logger = Logger.getLogger(DomBuilder.class.getName());

    private final ParseOptions options;
    private final List<Node.Element> openElements = new ArrayList<>();
    private final List<Node> topLevel = new ArrayList<>();
    // Text is buffered until the tree structure changes, so adjacent runs end up in a single node.
    private final StringBuilder pendingText = new StringBuilder();
    private boolean finished = false;
}
