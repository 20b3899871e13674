package org.pragmatica.wikitext.parser;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BlockArgumentsTest {

    @Test
    void parse_readsQuotedAndBareValues() {
        var arguments = BlockArguments.parse(" class=\"note wide\" id='main' width=50% ");

        assertThat(arguments).containsExactly(Map.entry("class", "note wide"),
                                              Map.entry("id", "main"),
                                              Map.entry("width", "50%"));
    }

    @Test
    void parse_lowerCasesKeysOnly() {
        assertThat(BlockArguments.parse("Style=\"Color: Red\"")).isEqualTo(Map.of("style", "Color: Red"));
    }

    @Test
    void parse_handlesEscapesInQuotedValues() {
        assertThat(BlockArguments.parse("title=\"say \\\"hi\\\"\\n\"")).isEqualTo(Map.of("title", "say \"hi\"\n"));
    }

    @Test
    void parse_skipsMalformedPairs() {
        assertThat(BlockArguments.parse("flag, =y other=1 tail=")).isEqualTo(Map.of("other", "1"));
    }

    @Test
    void parse_unterminatedQuote_runsToEnd() {
        assertThat(BlockArguments.parse("a=\"open value")).isEqualTo(Map.of("a", "open value"));
    }

    @Test
    void splitName_separatesLowerCasedName() {
        assertThat(BlockArguments.splitName("  DIV class=\"x\"")).containsExactly("div", " class=\"x\"");
        assertThat(BlockArguments.splitName("=")).containsExactly("=", "");
        assertThat(BlockArguments.splitName("   ")).containsExactly("", "");
    }
}
