package org.pragmatica.wikitext;

import org.pragmatica.wikitext.include.IncludeResolver;
import org.pragmatica.wikitext.lexer.Scanner;
import org.pragmatica.wikitext.lexer.Tokenization;
import org.pragmatica.wikitext.parser.ParseOutcome;
import org.pragmatica.wikitext.parser.TreeBuilder;
import org.pragmatica.wikitext.preprocess.PipelineConfig;
import org.pragmatica.wikitext.preprocess.Preprocessor;

import java.util.Objects;
import java.util.Optional;

/**
 * A configured preprocess, tokenize and parse pipeline. Immutable and safe to share between threads
 * as long as the include resolver is.
 */
public final class WikitextPipeline {
    private final PipelineConfig config;
    private final Optional<IncludeResolver> resolver;
    private final Preprocessor preprocessor;

    WikitextPipeline(PipelineConfig config, Optional<IncludeResolver> resolver) {
        this.config = Objects.requireNonNull(config, "config");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.preprocessor = Preprocessor.create(config, resolver);
    }

    public PipelineConfig config() {
        return config;
    }

    public Optional<IncludeResolver> resolver() {
        return resolver;
    }

    public String preprocess(String text) {
        return preprocessor.preprocess(text);
    }

    public Tokenization tokenize(String text) {
        return Scanner.tokenize(text);
    }

    public ParseOutcome parse(Tokenization tokens) {
        return TreeBuilder.build(tokens);
    }

    /**
     * Run all three stages in order.
     */
    public ParseOutcome process(String text) {
        return parse(tokenize(preprocess(text)));
    }
}
