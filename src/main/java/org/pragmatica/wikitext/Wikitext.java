package org.pragmatica.wikitext;

import org.pragmatica.wikitext.include.IncludeResolver;
import org.pragmatica.wikitext.lexer.Scanner;
import org.pragmatica.wikitext.lexer.Tokenization;
import org.pragmatica.wikitext.parser.ParseOutcome;
import org.pragmatica.wikitext.parser.TreeBuilder;
import org.pragmatica.wikitext.preprocess.PipelineConfig;
import org.pragmatica.wikitext.preprocess.Preprocessor;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for parsing wikitext.
 *
 * <p>Example usage:
 * <pre>{@code
 * var outcome = Wikitext.process("**bold** text");
 * outcome.tree();          // document > paragraph > [bold > "bold", " text"]
 * outcome.diagnostics();   // empty
 *
 * var pipeline = Wikitext.builder()
 *                        .typography(false)
 *                        .includes(IncludeResolver.fromMap(Map.of("footer", "-- end --")))
 *                        .build();
 * pipeline.process("[[include footer]]");
 * }</pre>
 */
public final class Wikitext {
    private Wikitext() {}

    /**
     * Apply the text substitutions with the default configuration and no include expansion.
     */
    public static String preprocess(String text) {
        return Preprocessor.create()
                           .preprocess(text);
    }

    /**
     * Apply the text substitutions, expanding includes through the given resolver first.
     */
    public static String preprocess(String text, IncludeResolver resolver) {
        Objects.requireNonNull(resolver, "resolver");
        return Preprocessor.create(PipelineConfig.DEFAULT, Optional.of(resolver))
                           .preprocess(text);
    }

    public static Tokenization tokenize(String text) {
        return Scanner.tokenize(text);
    }

    public static ParseOutcome parse(Tokenization tokens) {
        return TreeBuilder.build(tokens);
    }

    /**
     * Preprocess, tokenize and parse with the default configuration.
     */
    public static ParseOutcome process(String text) {
        return parse(tokenize(preprocess(text)));
    }

    /**
     * Create a builder for a configured pipeline.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final PipelineConfig.Builder config = PipelineConfig.builder();
        private IncludeResolver resolver;

        private Builder() {}

        public Builder typography(boolean enabled) {
            config.typography(enabled);
            return this;
        }

        public Builder macro(String name, String value) {
            config.macro(name, value);
            return this;
        }

        public Builder macros(Map<String, String> values) {
            config.macros(values);
            return this;
        }

        public Builder clock(Clock clock) {
            config.clock(clock);
            return this;
        }

        public Builder includes(IncludeResolver resolver) {
            this.resolver = Objects.requireNonNull(resolver, "resolver");
            return this;
        }

        public WikitextPipeline build() {
            return new WikitextPipeline(config.build(), Optional.ofNullable(resolver));
        }
    }
}
