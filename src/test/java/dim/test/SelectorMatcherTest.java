// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dim.test;

import java.util.List;
import java.util.stream.Stream;
import dim.dom.HtmlParser;
import dim.dom.Node;
import dim.selector.Selector;
import dim.selector.SelectorGroup;
import dim.selector.SelectorMatcher;
import static dim.test.SampleDocument.annotation;
import static dim.test.SampleDocument.annotations;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

final class SelectorMatcherTest {
    static Stream<Arguments> provideSelectors() {
        return Stream.of(
            Arguments.of("header", List.of("2.1")),
            Arguments.of("#body", List.of("2.2")),
            Arguments.of("main#article", List.of("2.2.1")),
            Arguments.of("body > main#article", List.of()),
            Arguments.of("#article + #ads", List.of()),
            Arguments.of("#article ~ #ads", List.of("2.2.3")),
            Arguments.of("#article + nav + #ads", List.of("2.2.3")),
            Arguments.of(".ad", List.of("2.2.3.1", "2.2.3.2", "2.2.3.3", "2.2.3.4")),
            Arguments.of(".ad.first-party", List.of("2.2.3.1", "2.2.3.2")),
            Arguments.of(".first-party.ad", List.of("2.2.3.1", "2.2.3.2")),
            Arguments.of(".ad .first-party", List.of()),
            Arguments.of("span.ad", List.of()),
            Arguments.of("[title]", List.of("2.2.1.1.1", "2.2.1.1.2", "2.2.1.2.1", "2.2.1.2.2", "2.2.2")),
            Arguments.of("nav[title]", List.of("2.2.2")),
            Arguments.of("[title=Navigation]", List.of("2.2.2")),
            Arguments.of("[title=navigation]", List.of()),
            Arguments.of("[TITLE=Navigation]", List.of("2.2.2")),
            Arguments.of("[title='internal link1']", List.of("2.2.1.1.1")),
            Arguments.of("[title=\"internal link1\"]", List.of("2.2.1.1.1")),
            Arguments.of("[title='internal link1'], [title='internal link2']", List.of("2.2.1.1.1", "2.2.1.1.2")),
            Arguments.of("[title~=link]", List.of("2.2.1.2.2")),
            Arguments.of("[class|=first]", List.of("2.2.3.1")),
            Arguments.of("[hreflang|=en]", List.of("2.2.1.2.2")),
            Arguments.of("[hreflang|=en-]", List.of()),
            Arguments.of("[title^=internal]", List.of("2.2.1.1.1", "2.2.1.1.2", "2.2.1.2.1")),
            Arguments.of("[title$=' link']", List.of("2.2.1.2.2")),
            Arguments.of("[class$=ad]", List.of("2.2.3.1", "2.2.3.3", "2.2.3.4")),
            Arguments.of("[title*=link]", List.of("2.2.1.1.1", "2.2.1.1.2", "2.2.1.2.1", "2.2.1.2.2")),
            Arguments.of("[title*='']", List.of()),
            Arguments.of("#body p", List.of("2.2.1.1", "2.2.1.3", "2.2.1.5")),
            Arguments.of("#body p[id]", List.of("2.2.1.1")),
            Arguments.of("#body > p[id]", List.of()),
            Arguments.of("#body > * > p[id]", List.of("2.2.1.1")),
            Arguments.of("img[src='/image.png']", List.of("2.2.1.1.3")),
            Arguments.of("MAIN > P#p1 > A", List.of("2.2.1.1.1", "2.2.1.1.2")),
            Arguments.of("p ~ div", List.of("2.2.1.4")),
            Arguments.of("blockquote ~ p", List.of("2.2.1.3", "2.2.1.5")),
            Arguments.of("blockquote + p", List.of("2.2.1.3")),
            Arguments.of("a + img", List.of("2.2.1.1.3")),
            Arguments.of("footer, header", List.of("2.1", "2.3"))
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("provideSelectors")
    void selectorMatchesExpectedElements(final String selector, final List<String> expected) {
        final var tree = SampleDocument.parse();
        final var matches = tree.selectAll(selector);
        assertThat(annotations(matches)).isEqualTo(expected);
        if (expected.isEmpty()) {
            assertThat(tree.select(selector)).isNull();
        } else {
            assertThat(annotation(tree.select(selector))).isEqualTo(expected.get(0));
        }
        for (final var node : matches) {
            assertThat(node.matchedBy(selector)).isTrue();
        }
    }

    @Test
    void selectionFromNonRootOnlyRestrictsCandidates() {
        final var tree = SampleDocument.parse();
        final var paragraph = tree.select("#p1");
        assertThat(paragraph).isNotNull();
        assertThat(annotations(paragraph.selectAll("a"))).containsExactly("2.2.1.1.1", "2.2.1.1.2");
        assertThat(paragraph.selectAll(".ad")).isEmpty();
        assertThat(annotations(paragraph.selectAll("main a"))).containsExactly("2.2.1.1.1", "2.2.1.1.2");
        assertThat(annotations(paragraph.selectAll("#body > main > p > a"))).containsExactly("2.2.1.1.1", "2.2.1.1.2");
        assertThat(annotations(paragraph.selectAll("p a"))).containsExactly("2.2.1.1.1", "2.2.1.1.2");
        assertThat(paragraph.selectAll("p")).containsExactly(paragraph);
        assertThat(paragraph.selectAll("main > p")).containsExactly(paragraph);
    }

    @Test
    void selectAllAgreesWithMatchedBy() {
        final var root = HtmlParser.parse("<main><p id=p1><a id=x>x</a></p></main>");
        assertThat(root).isNotNull();
        final var paragraph = root.select("#p1");
        final var link = root.select("#x");
        assertThat(paragraph).isNotNull();
        assertThat(link).isNotNull();
        assertThat(link.matchedBy("main a")).isTrue();
        assertThat(paragraph.selectAll("main a")).containsExactly(link);
        assertThat(paragraph.select("main a")).isSameAs(link);
        assertThat(link.selectAll("main a")).containsExactly(link);
    }

    @Test
    void explicitScopeStopsParentAndAncestorLookups() {
        final var tree = SampleDocument.parse();
        final var paragraph = tree.select("#p1");
        final var main = tree.select("main");
        final var link = tree.select("#p1 > a");
        assertThat(paragraph).isNotNull();
        assertThat(main).isNotNull();
        assertThat(link).isNotNull();

        final var descendant = SelectorGroup.fromString("main a");
        assertThat(link.matchedBy(descendant)).isTrue();
        assertThat(link.matchedBy(descendant, tree)).isTrue();
        assertThat(link.matchedBy(descendant, main)).isTrue();
        assertThat(link.matchedBy(descendant, paragraph)).isFalse();

        final var child = SelectorGroup.fromString("main > p");
        assertThat(paragraph.matchedBy(child, tree)).isTrue();
        assertThat(paragraph.matchedBy(child, paragraph)).isFalse();
    }

    @Test
    void explicitScopeDoesNotRestrictSiblings() {
        final var tree = SampleDocument.parse();
        final var group = SelectorGroup.fromString("#article ~ #ads");
        final var ads = tree.select("#ads");
        assertThat(ads).isNotNull();
        assertThat(ads.matchedBy(group)).isTrue();
        assertThat(ads.matchedBy(group, tree)).isTrue();
        assertThat(ads.matchedBy(group, ads)).isTrue();
        assertThat(ads.selectAll(group)).containsExactly(ads);
    }

    @Test
    void compoundRequiresEveryConstraint() {
        final var selector = Selector.fromString("div.item#x[data-k=\"v\"]");
        assertThat(HtmlParser.parse("<div id=x class=\"other item\" data-k=v></div>").matchedBy(selector)).isTrue();
        for (final var html : new String[] {
            "<span id=x class=item data-k=v></span>",
            "<div id=y class=item data-k=v></div>",
            "<div id=x class=items data-k=v></div>",
            "<div id=x class=item data-k=w></div>",
            "<div id=x class=item></div>",
        }) {
            final var element = HtmlParser.parse(html);
            assertThat(element).isNotNull();
            assertThat(element.matchedBy(selector)).as(html).isFalse();
        }
    }

    @Test
    void nextSiblingIsDirectional() {
        final var root = HtmlParser.parse("<ul><li id=a></li><li id=b></li></ul>");
        assertThat(root).isNotNull();
        assertThat(root.selectAll("li#a + li#b")).extracting(Node.Element::id).containsExactly("b");
        assertThat(root.selectAll("li#b + li#a")).isEmpty();
        assertThat(root.selectAll("li#b ~ li#a")).isEmpty();
    }

    @Test
    void groupsMatchInDocumentOrderRegardlessOfAlternativeOrder() {
        final var tree = SampleDocument.parse();
        final var group = SelectorGroup.fromString("p, div");
        assertThat(group.size()).isEqualTo(2);
        assertThat(tree.selectAll(group))
            .isEqualTo(tree.selectAll("p, div"))
            .isEqualTo(tree.selectAll("div, p"));
        assertThat(tree.selectAll(group.get(0))).isEqualTo(tree.selectAll("p"));
        assertThat(annotations(tree.selectAll("div, p")))
            .containsExactly(
                "2.2", "2.2.1.1", "2.2.1.3", "2.2.1.4", "2.2.1.5", "2.2.3.1", "2.2.3.2", "2.2.3.3", "2.2.3.4");
    }

    @Test
    void queryRootIsEligible() {
        final var tree = SampleDocument.parse();
        assertThat(tree.select("html")).isSameAs(tree);
        assertThat(tree.select("*")).isSameAs(tree);
        assertThat(tree.selectAll("*")).hasSize((int) tree.descendants().stream()
            .filter(node -> node instanceof Node.Element)
            .count() + 1);
    }

    @Test
    void textNodesNeverMatch() {
        final var tree = SampleDocument.parse();
        final var text = tree.firstChild();
        assertThat(text).isInstanceOf(Node.Text.class);
        assertThat(text.matchedBy("*")).isFalse();
        assertThat(text.selectAll("*")).isEmpty();
    }

    @Test
    void siblingCombinatorsSkipTextNodes() {
        final var root = HtmlParser.parse("<ul><li id=a>A</li> text <li id=b>B</li><li id=c>C</li></ul>");
        assertThat(root).isNotNull();
        assertThat(root.selectAll("li#a + li#b")).extracting(Node.Element::id).containsExactly("b");
        assertThat(root.selectAll("li#a + li")).extracting(Node.Element::id).containsExactly("b");
        assertThat(root.selectAll("li#a ~ li")).extracting(Node.Element::id).containsExactly("b", "c");
        assertThat(root.selectAll("li + li + li")).extracting(Node.Element::id).containsExactly("c");
        assertThat(root.selectAll("li ~ #a")).isEmpty();
    }

    @Test
    void descendantCombinatorBacktracks() {
        final var root = HtmlParser.parse("<div class=x><div class=y><p><span><em>hi</em></span></p></div></div>");
        assertThat(root).isNotNull();
        assertThat(root.selectAll(".x p em")).hasSize(1);
        assertThat(root.selectAll(".x > .y em")).hasSize(1);
        assertThat(root.selectAll(".y > .x em")).isEmpty();
        assertThat(root.selectAll("div > p > em")).isEmpty();
        assertThat(root.selectAll("div span > em")).hasSize(1);
    }

    @Test
    void wordAndHyphenOperatorsFollowTokenRules() {
        final var root = HtmlParser.parse("<div lang=\"en-GB\" data-words=\"alpha  beta\tgamma\"></div>");
        assertThat(root).isNotNull();
        assertThat(root.matchedBy("[data-words~=beta]")).isTrue();
        assertThat(root.matchedBy("[data-words~=gamma]")).isTrue();
        assertThat(root.matchedBy("[data-words~=bet]")).isFalse();
        assertThat(root.matchedBy("[data-words~='alpha beta']")).isFalse();
        assertThat(root.matchedBy("[data-words~='']")).isFalse();
        assertThat(root.matchedBy("[lang|=en]")).isTrue();
        assertThat(root.matchedBy("[lang|=en-GB]")).isTrue();
        assertThat(root.matchedBy("[lang|=e]")).isFalse();
        assertThat(root.matchedBy("[lang^='']")).isFalse();
        assertThat(root.matchedBy("[lang$='']")).isFalse();
        assertThat(root.matchedBy("[lang='']")).isFalse();
    }

    @Test
    void emptyAttributeValuesAreDistinctFromAbsence() {
        final var root = HtmlParser.parse("<form><input disabled><input value=\"\"><input></form>");
        assertThat(root).isNotNull();
        assertThat(root.selectAll("[disabled]")).hasSize(1);
        assertThat(root.selectAll("[value]")).hasSize(1);
        assertThat(root.selectAll("[value='']")).hasSize(1);
    }

    @Test
    void parsedSelectorsCanBeReused() {
        final var selector = Selector.fromString("aside > .ad");
        final var first = SampleDocument.parse();
        final var second = SampleDocument.parse();
        assertThat(annotations(first.selectAll(selector))).isEqualTo(annotations(second.selectAll(selector)));
        assertThat(SelectorMatcher.selectFirst(first, SelectorGroup.of(selector))).isSameAs(first.select(selector));
    }
}
