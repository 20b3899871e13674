package org.pragmatica.wikitext.preprocess;

import org.pragmatica.wikitext.include.IncludeExpander;
import org.pragmatica.wikitext.include.IncludeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Text-level substitution engine.
 *
 * <p>Passes run in a fixed order: comment removal, include expansion (only with a resolver),
 * miscellaneous normalization, typography (when enabled), then character references and macros.
 * Comments go before includes so a commented-out directive is never resolved; the comment pass
 * runs again with the other normalization passes to clear comments brought in by included pages.
 * Malformed markers are left as written and no diagnostics are produced.
 */
public final class Preprocessor {
    private static final Logger log = LoggerFactory.getLogger(Preprocessor.class);

    private final Optional<IncludeResolver> resolver;
    private final List<Replacer> passes;

    private Preprocessor(Optional<IncludeResolver> resolver, List<Replacer> passes) {
        this.resolver = resolver;
        this.passes = passes;
    }

    public static Preprocessor create() {
        return create(PipelineConfig.DEFAULT, Optional.empty());
    }

    public static Preprocessor create(PipelineConfig config, Optional<IncludeResolver> resolver) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(resolver, "resolver");
        var passes = new ArrayList<>(MiscSubstitutions.PASSES);
        if (config.typography()) {
            passes.addAll(Typography.PASSES);
        }
        passes.addAll(EscapeSubstitutions.passes(config.macros(), config.clock()));
        return new Preprocessor(resolver, List.copyOf(passes));
    }

    /**
     * Names of the rewrite passes in the order they run after include expansion.
     */
    public List<String> passNames() {
        return passes.stream()
                     .map(Replacer::name)
                     .toList();
    }

    public String preprocess(String text) {
        Objects.requireNonNull(text, "text");
        log.debug("Preprocessing {} chars", text.length());

        var result = MiscSubstitutions.COMMENTS.apply(text);
        if (resolver.isPresent()) {
            var expansion = IncludeExpander.include(result, resolver.get());
            log.debug("Included {} pages", expansion.pages().size());
            result = expansion.text();
        }
        for (var pass : passes) {
            var rewritten = pass.apply(result);
            if (log.isTraceEnabled() && !rewritten.equals(result)) {
                log.trace("Pass '{}' changed text: {} -> {} chars", pass.name(), result.length(), rewritten.length());
            }
            result = rewritten;
        }

        log.debug("Preprocessed {} chars into {} chars", text.length(), result.length());
        return result;
    }
}
