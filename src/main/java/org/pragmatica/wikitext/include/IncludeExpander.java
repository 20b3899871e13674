package org.pragmatica.wikitext.include;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code [[include page var=value | ...]]} directives with the included page text.
 *
 * <p>Included text has its {@code {$var}} references substituted and is then expanded recursively.
 * Every failure, including a cycle, leaves an inert {@code [[include-failed ...]]} placeholder
 * in place of the directive.
 */
public final class IncludeExpander {
    private static final Logger log = LoggerFactory.getLogger(IncludeExpander.class);

    private static final Pattern INCLUDE = Pattern.compile("\\[\\[\\s*include\\s+([^\\]]*?)\\s*\\]\\]",
                                                           Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern VARIABLE = Pattern.compile("\\{\\$([A-Za-z0-9_-]+)\\}");

    public static final String PLACEHOLDER_NAME = "include-failed";

    private final IncludeResolver resolver;
    private final Deque<PageRef> chain = new ArrayDeque<>();
    private final Map<String, PageRef> active = new LinkedHashMap<>();
    private final List<PageRef> included = new ArrayList<>();

    private IncludeExpander(IncludeResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Expand all include directives in the text.
     */
    public static String expand(String text, IncludeResolver resolver) {
        return include(text, resolver).text();
    }

    /**
     * Expand all include directives in the text and report which pages were included.
     */
    public static Expansion include(String text, IncludeResolver resolver) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(resolver, "resolver");
        var expander = new IncludeExpander(resolver);
        var expanded = expander.expandText(text);
        return new Expansion(expanded, expander.included);
    }

    /**
     * Parse the body of an include directive, the part after {@code include}.
     * Returns empty if no page name is present.
     */
    public static Optional<IncludeRef> parseDirective(String body) {
        var segments = body.split("\\|", -1);
        var head = segments[0].trim();
        if (head.isEmpty()) {
            return Optional.empty();
        }

        var firstSpace = indexOfWhitespace(head);
        var pageText = firstSpace < 0 ? head : head.substring(0, firstSpace);
        var variables = new LinkedHashMap<String, String>();
        if (firstSpace >= 0) {
            addVariable(variables, head.substring(firstSpace));
        }
        for (int i = 1; i < segments.length; i++) {
            addVariable(variables, segments[i]);
        }
        return Optional.of(new IncludeRef(PageRef.parse(pageText), variables));
    }

    /**
     * The inert text left where an include could not be expanded.
     */
    public static String placeholder(ResolutionError error) {
        return "[[" + PLACEHOLDER_NAME
               + " page=\"" + sanitize(error.page().toString()) + "\""
               + " reason=\"" + error.status().reason() + "\"]]";
    }

    /**
     * Replace {@code {$name}} references with variable values. Unknown references stay as written.
     */
    public static String substituteVariables(String text, Map<String, String> variables) {
        if (variables.isEmpty()) {
            return text;
        }
        var matcher = VARIABLE.matcher(text);
        var sb = new StringBuilder(text.length());
        while (matcher.find()) {
            var value = variables.get(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value == null ? matcher.group() : value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private String expandText(String text) {
        var matcher = INCLUDE.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        var sb = new StringBuilder(text.length());
        do {
            var replacement = parseDirective(matcher.group(1))
                .map(this::expandInclude)
                .orElse(matcher.group());
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        } while (matcher.find());
        matcher.appendTail(sb);
        return sb.toString();
    }

    private String expandInclude(IncludeRef include) {
        var page = include.page();
        if (active.containsKey(page.key())) {
            log.debug("Cyclic include of '{}' through {}", page, chain);
            return placeholder(new ResolutionError.Cyclic(page, chainOutermostFirst()));
        }

        var resolution = resolve(page);
        if (resolution instanceof Resolution.Unresolved unresolved) {
            log.debug("Include of '{}' unresolved: {}", page, unresolved.error().message());
            return placeholder(unresolved.error());
        }

        var text = ((Resolution.Resolved) resolution).text();
        log.trace("Expanding include of '{}' ({} chars, depth {})", page, text.length(), chain.size() + 1);

        included.add(page);
        chain.push(page);
        active.put(page.key(), page);
        try {
            return expandText(substituteVariables(text, include.variables()));
        } finally {
            chain.pop();
            active.remove(page.key());
        }
    }

    private Resolution resolve(PageRef page) {
        try {
            var resolution = resolver.resolve(page);
            return resolution == null
                   ? Resolution.failed(new ResolutionError.ResolverFailure(page, "resolver returned null"))
                   : resolution;
        } catch (RuntimeException e) {
            log.warn("Include resolver failed for page '{}'", page, e);
            return Resolution.failed(new ResolutionError.ResolverFailure(page, String.valueOf(e.getMessage())));
        }
    }

    private List<PageRef> chainOutermostFirst() {
        var list = new ArrayList<>(chain);
        Collections.reverse(list);
        return list;
    }

    private static void addVariable(Map<String, String> variables, String segment) {
        int eq = segment.indexOf('=');
        if (eq <= 0) {
            return;
        }
        var key = segment.substring(0, eq).trim();
        if (!key.isEmpty()) {
            variables.put(key, segment.substring(eq + 1).trim());
        }
    }

    private static int indexOfWhitespace(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static String sanitize(String target) {
        return target.replace("\"", "")
                     .replace("]", "")
                     .replace('\n', ' ');
    }
}
