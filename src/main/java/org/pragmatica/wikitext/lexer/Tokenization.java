package org.pragmatica.wikitext.lexer;

import java.util.List;

/**
 * Scanner output: the scanned text and its tokens in order, ending with {@link Token#INPUT_END}.
 */
public record Tokenization(String text, List<ExtractedToken> tokens) {
    public Tokenization {
        tokens = List.copyOf(tokens);
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(Token.INPUT_END)) {
            throw new IllegalArgumentException("Token sequence must end with " + Token.INPUT_END.tag());
        }
    }

    public int size() {
        return tokens.size();
    }

    public ExtractedToken get(int index) {
        return tokens.get(index);
    }
}
