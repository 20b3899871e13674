package org.pragmatica.wikitext.include;

import org.junit.jupiter.api.Test;
import org.pragmatica.wikitext.tree.IncludeStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for include expansion with fake resolvers.
 */
class IncludeExpanderTest {

    @Test
    void resolvedInclude_isSubstitutedAtItsPosition() {
        var resolver = IncludeResolver.fromMap(Map.of("inner", "INNER"));

        var expanded = IncludeExpander.expand("before [[include inner]] after", resolver);

        assertThat(expanded).isEqualTo("before INNER after");
    }

    @Test
    void directiveName_isCaseInsensitive_andMaySpanLines() {
        var resolver = IncludeResolver.fromMap(Map.of("inner", "INNER"));

        var expanded = IncludeExpander.expand("[[INCLUDE\n inner ]]", resolver);

        assertThat(expanded).isEqualTo("INNER");
    }

    @Test
    void selfInclude_isNotResolvedAgain_andLeavesCyclePlaceholder() {
        var calls = new AtomicInteger();
        IncludeResolver resolver = page -> {
            calls.incrementAndGet();
            return Resolution.resolved("start [[include loop]] end");
        };

        var expanded = IncludeExpander.expand("[[include loop]]", resolver);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(expanded).isEqualTo("start [[include-failed page=\"loop\" reason=\"cyclic-include\"]] end");
    }

    @Test
    void indirectCycle_isDetectedThroughTheChain() {
        var requested = new ArrayList<String>();
        var pages = Map.of("a", "A[[include b]]", "b", "B[[include a]]");
        IncludeResolver resolver = page -> {
            requested.add(page.page());
            return Resolution.resolved(pages.get(page.page()));
        };

        var expanded = IncludeExpander.expand("[[include a]]", resolver);

        assertThat(requested).containsExactly("a", "b");
        assertThat(expanded).isEqualTo("AB[[include-failed page=\"a\" reason=\"cyclic-include\"]]");
    }

    @Test
    void cycleKey_ignoresCase() {
        var calls = new AtomicInteger();
        IncludeResolver resolver = page -> {
            calls.incrementAndGet();
            return Resolution.resolved("[[include Loop]]");
        };

        var expanded = IncludeExpander.expand("[[include loop]]", resolver);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(expanded).contains("reason=\"cyclic-include\"");
    }

    @Test
    void samePage_canBeIncludedTwiceOutsideAChain() {
        var resolver = IncludeResolver.fromMap(Map.of("x", "X"));

        var expanded = IncludeExpander.expand("[[include x]] and [[include x]]", resolver);

        assertThat(expanded).isEqualTo("X and X");
    }

    @Test
    void missingPage_leavesNotFoundPlaceholder() {
        var expanded = IncludeExpander.expand("[[include missing]]", IncludeResolver.none());

        assertThat(expanded).isEqualTo("[[include-failed page=\"missing\" reason=\"not-found\"]]");
    }

    @Test
    void throwingResolver_isRecoveredAsResolverError() {
        IncludeResolver resolver = page -> {
            throw new IllegalStateException("backend down");
        };

        var expanded = IncludeExpander.expand("a [[include broken]] b", resolver);

        assertThat(expanded).isEqualTo("a [[include-failed page=\"broken\" reason=\"resolver-error\"]] b");
    }

    @Test
    void variables_areSubstitutedIntoIncludedText() {
        var resolver = IncludeResolver.fromMap(Map.of("greeting", "Hello {$name}, from {$place}. {$other}"));

        var expanded = IncludeExpander.expand("[[include greeting name=World | place = Earth]]", resolver);

        assertThat(expanded).isEqualTo("Hello World, from Earth. {$other}");
    }

    @Test
    void nestedIncludes_areExpandedRecursively() {
        var resolver = IncludeResolver.fromMap(Map.of("outer", "(outer [[include inner]])", "inner", "inner"));

        var expanded = IncludeExpander.expand("[[include outer]]", resolver);

        assertThat(expanded).isEqualTo("(outer inner)");
    }

    @Test
    void sitePrefix_isPassedToResolver() {
        var seen = new ArrayList<PageRef>();
        IncludeResolver resolver = page -> {
            seen.add(page);
            return Resolution.resolved("remote");
        };

        IncludeExpander.expand("[[include :other-site:page]]", resolver);

        assertThat(seen).containsExactly(PageRef.pageAndSite("other-site", "page"));
    }

    @Test
    void directiveWithoutPage_isLeftAsWritten() {
        var calls = new AtomicInteger();
        IncludeResolver resolver = page -> {
            calls.incrementAndGet();
            return Resolution.resolved("x");
        };

        var expanded = IncludeExpander.expand("[[include  ]] and [[included]]", resolver);

        assertThat(calls.get()).isZero();
        assertThat(expanded).isEqualTo("[[include  ]] and [[included]]");
    }

    @Test
    void parseDirective_splitsPageAndVariables() {
        var include = IncludeExpander.parseDirective("page-name a=1 | b=two words | broken").orElseThrow();

        assertThat(include.page()).isEqualTo(PageRef.pageOnly("page-name"));
        assertThat(include.variables()).containsExactly(Map.entry("a", "1"), Map.entry("b", "two words"));
    }

    @Test
    void placeholder_dropsCharactersThatWouldBreakIt() {
        var error = new ResolutionError.NotFound(PageRef.pageOnly("bad\"]name"));

        assertThat(IncludeExpander.placeholder(error)).isEqualTo("[[include-failed page=\"badname\" reason=\"not-found\"]]");
    }

    @Test
    void cyclicError_recordsChainOutermostFirst() {
        var error = new ResolutionError.Cyclic(PageRef.pageOnly("a"), List.of(PageRef.pageOnly("a"), PageRef.pageOnly("b")));

        assertThat(error.status()).isEqualTo(IncludeStatus.CYCLIC_INCLUDE);
        assertThat(error.message()).contains("[a, b]");
    }

    // === Included Pages ===

    @Test
    void include_reportsPagesInResolutionOrder_nestedOnesIncluded() {
        var resolver = IncludeResolver.fromMap(Map.of("a", "A[[include c]]", "b", "B", "c", "C"));

        var expansion = IncludeExpander.include("[[include a]] [[include b]] [[include missing]] [[include b]]", resolver);

        assertThat(expansion.text()).startsWith("AC B [[include-failed page=\"missing\"");
        assertThat(expansion.pages()).extracting(PageRef::page)
                                     .containsExactly("a", "c", "b", "b");
    }

    @Test
    void include_leavesCyclicAndFailedPagesOutOfTheList() {
        var resolver = IncludeResolver.fromMap(Map.of("loop", "x [[include loop]]"));

        var expansion = IncludeExpander.include("[[include loop]] [[include gone]]", resolver);

        assertThat(expansion.pages()).extracting(PageRef::page)
                                     .containsExactly("loop");
    }
}
