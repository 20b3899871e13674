package org.pragmatica.wikitext.parser;

import org.pragmatica.wikitext.include.IncludeExpander;
import org.pragmatica.wikitext.lexer.ExtractedToken;
import org.pragmatica.wikitext.lexer.Token;
import org.pragmatica.wikitext.lexer.Tokenization;
import org.pragmatica.wikitext.tree.Alignment;
import org.pragmatica.wikitext.tree.FormatStyle;
import org.pragmatica.wikitext.tree.IncludeStatus;
import org.pragmatica.wikitext.tree.LinkKind;
import org.pragmatica.wikitext.tree.SourceSpan;
import org.pragmatica.wikitext.tree.WikiNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Builds a syntax tree from a token sequence, recovering from every malformed construct.
 *
 * <p>Open constructs live on an explicit {@link ConstructStack}. Block boundaries close what is
 * open inside them, and the end of input drains the whole stack, so every token sequence yields
 * a complete tree. Each recovery is recorded as a diagnostic.
 */
public final class TreeBuilder {
    private static final Logger log = LoggerFactory.getLogger(TreeBuilder.class);

    private static final Pattern COLOR_NAME = Pattern.compile("#?[A-Za-z0-9]+");
    private static final Pattern ANCHOR_NOISE = Pattern.compile("[^a-z0-9:_]+");
    private static final String EMPTY_ANCHOR = "javascript:;";

    private static final Map<String, String> BLOCK_ALIASES = Map.of(
        "deletion", "del",
        "insertion", "ins"
    );

    private final BuildContext context;
    private final ConstructStack stack;

    private TreeBuilder(Tokenization tokenization) {
        this.context = BuildContext.create(tokenization);
        this.stack = new ConstructStack(context);
    }

    public static ParseOutcome build(Tokenization tokenization) {
        Objects.requireNonNull(tokenization, "tokenization");
        log.debug("Building tree from {} tokens", tokenization.size());
        var outcome = new TreeBuilder(tokenization).buildAll();
        log.debug("Built tree of {} nodes with {} diagnostics",
                  outcome.tree().stream().count(),
                  outcome.diagnostics().size());
        return outcome;
    }

    private ParseOutcome buildAll() {
        int pos = 0;
        while (!context.is(pos, Token.INPUT_END)) {
            var token = context.token(pos);
            if (context.atLineStart(pos) && !token.token().newline()) {
                startLine(token);
            }
            pos = step(pos);
        }
        var document = stack.drain(context.token(pos).span().start());
        return new ParseOutcome(document, context.diagnostics(), context.text());
    }

    /**
     * Handle the token at the given index and return the index of the next unhandled token.
     */
    private int step(int i) {
        return switch (context.token(i).token()) {
            case PARAGRAPH_BREAK -> paragraphBreak(i);
            case LINE_BREAK -> lineBreak(i);
            case HEADING -> heading(i);
            case BULLET_ITEM, NUMBERED_ITEM -> listItem(i);
            case HORIZONTAL_RULE -> horizontalRule(i);
            case TABLE_COLUMN, TABLE_COLUMN_TITLE -> tableColumn(i);
            case BOLD, ITALICS, UNDERLINE, STRIKETHROUGH, SUPERSCRIPT, SUBSCRIPT -> delimiter(i);
            case LEFT_MONOSPACE -> openMonospace(i);
            case RIGHT_MONOSPACE -> closeMonospace(i);
            case COLOR -> color(i);
            case RAW -> raw(i);
            case LEFT_RAW -> angledRaw(i);
            case LEFT_LINK -> tripleLink(i);
            case LEFT_BRACKET -> bracketLink(i);
            case URL -> bareLink(i);
            case EMAIL -> email(i);
            case LEFT_BLOCK -> block(i);
            case LEFT_BLOCK_END -> blockEnd(i);
            case LEFT_COMMENT -> comment(i);
            case RIGHT_RAW, RIGHT_LINK, RIGHT_COMMENT -> unmatched(i);
            case WHITESPACE -> whitespace(i);
            default -> literal(i);
        };
    }

    // === Block Level ===

    /**
     * Lines that do not continue a list or table end it.
     */
    private void startLine(ExtractedToken token) {
        if (!token.is(Token.BULLET_ITEM) && !token.is(Token.NUMBERED_ITEM)) {
            var list = stack.outermostInBlock(c -> c.kind() == ConstructKind.LIST);
            if (list >= 0) {
                stack.closeAbove(list - 1, "end of list");
            }
        }
        if (!token.is(Token.TABLE_COLUMN) && !token.is(Token.TABLE_COLUMN_TITLE)) {
            var table = stack.outermostInBlock(c -> c.kind() == ConstructKind.TABLE);
            if (table >= 0) {
                stack.closeAbove(table - 1, "end of table");
            }
        }
    }

    private int paragraphBreak(int i) {
        stack.closeAbove(stack.containerIndex(), "end of paragraph");
        return i + 1;
    }

    private int lineBreak(int i) {
        var host = stack.findInBlock(c -> isLineBound(c.kind()));
        if (host < 0) {
            return i + 1;
        }
        switch (stack.get(host).kind()) {
            case HEADING, TABLE_ROW -> stack.closeAbove(host - 1, "end of line");
            case TABLE_CELL -> {
                var row = stack.findInBlock(c -> c.kind() == ConstructKind.TABLE_ROW);
                stack.closeAbove((row >= 0 ? row : host) - 1, "end of table row");
            }
            case LIST_ITEM -> stack.closeAbove(host, "end of list item");
            default -> {
                if (endsParagraph(i + 1)) {
                    stack.closeAbove(host - 1, "end of paragraph");
                } else {
                    stack.append(new WikiNode.LineBreak(context.token(i).span()));
                }
            }
        }
        return i + 1;
    }

    private int heading(int i) {
        var token = context.token(i);
        stack.closeAbove(stack.containerIndex(), "heading");
        var level = (int) token.slice().chars().filter(c -> c == '+').count();
        open(OpenConstruct.heading(token.span(), level));
        return i + 1;
    }

    private int horizontalRule(int i) {
        stack.closeAbove(stack.containerIndex(), "horizontal rule");
        stack.append(new WikiNode.HorizontalRule(context.token(i).span()));
        return i + 1;
    }

    /**
     * Indentation sets the depth of an item. An item can be at most one level deeper than the list it follows.
     */
    private int listItem(int i) {
        var token = context.token(i);
        var ordered = token.is(Token.NUMBERED_ITEM);
        var depth = indentation(token.slice()) + 1;

        var outer = stack.outermostInBlock(c -> c.kind() == ConstructKind.LIST);
        int current;
        if (outer < 0) {
            stack.closeAbove(stack.containerIndex(), "list");
            current = 0;
        } else {
            var item = stack.findInBlock(c -> c.kind() == ConstructKind.LIST_ITEM);
            stack.closeAbove(Math.max(item, outer), "list item");
            current = stack.count(c -> c.kind() == ConstructKind.LIST, outer);
        }

        var target = Math.min(depth, current + 1);
        while (current > target) {
            stack.autoClose("end of list item");
            stack.autoClose("end of list");
            current--;
        }
        if (current == target) {
            stack.autoClose("end of list item");
            if (stack.top().ordered() != ordered) {
                stack.autoClose("end of list");
                open(OpenConstruct.list(token.span(), ordered));
            }
        } else {
            open(OpenConstruct.list(token.span(), ordered));
        }
        open(OpenConstruct.listItem(token.span()));
        return i + 1;
    }

    private int tableColumn(int i) {
        if (context.atLineStart(i)) {
            var table = stack.findInBlock(c -> c.kind() == ConstructKind.TABLE);
            if (table < 0) {
                stack.closeAbove(stack.containerIndex(), "table");
                open(OpenConstruct.table(context.token(i).span().start()));
            } else {
                stack.closeAbove(table, "table row");
            }
            open(OpenConstruct.tableRow(context.token(i).span().start()));
            return cellSeparator(i);
        }

        var cell = stack.findInBlock(c -> c.kind() == ConstructKind.TABLE_CELL);
        if (cell >= 0) {
            stack.closeAbove(cell, "end of table cell");
            stack.closeBeforeMarker();
            return cellSeparator(i);
        }
        var row = stack.findInBlock(c -> c.kind() == ConstructKind.TABLE_ROW);
        if (row >= 0) {
            stack.closeAbove(row, "table cell");
            return cellSeparator(i);
        }
        return literal(i);
    }

    /**
     * Handle a separator inside a row: widen, start a cell, or end the row when only whitespace follows.
     */
    private int cellSeparator(int i) {
        int last = i;
        int columnSpan = 1;
        while (context.is(last, Token.TABLE_COLUMN)
               && (context.is(last + 1, Token.TABLE_COLUMN) || context.is(last + 1, Token.TABLE_COLUMN_TITLE))) {
            last++;
            columnSpan++;
        }
        int next = last + 1;
        while (context.is(next, Token.WHITESPACE)) {
            next++;
        }
        var marker = context.token(last);
        if (context.token(next).token().newline()) {
            stack.closeExplicitly(marker.span().end());
            return next;
        }
        open(OpenConstruct.tableCell(marker.span(), marker.is(Token.TABLE_COLUMN_TITLE), columnSpan));
        return last + 1;
    }

    // === Inline Level ===

    /**
     * A delimiter closes the innermost matching span when it can, otherwise opens a new one.
     */
    private int delimiter(int i) {
        var token = context.token(i);
        var open = stack.findInlineSpan(c -> c.delimiter() == token.token());
        if (token.flank().canClose() && open >= 0) {
            closeSpan(open, token);
            return i + 1;
        }
        if (token.flank().canOpen()) {
            ensureInline(token);
            open(OpenConstruct.format(token.span(), styleOf(token.token()), token.token()));
            return i + 1;
        }
        if (token.flank().canClose()) {
            return unmatched(i);
        }
        return literal(i);
    }

    private int openMonospace(int i) {
        var token = context.token(i);
        ensureInline(token);
        open(OpenConstruct.format(token.span(), FormatStyle.MONOSPACE, Token.RIGHT_MONOSPACE));
        return i + 1;
    }

    private int closeMonospace(int i) {
        var token = context.token(i);
        var open = stack.findInlineSpan(c -> c.delimiter() == Token.RIGHT_MONOSPACE);
        if (open < 0) {
            return unmatched(i);
        }
        closeSpan(open, token);
        return i + 1;
    }

    /**
     * {@code ##name|} opens a colour span and the next {@code ##} closes it.
     */
    private int color(int i) {
        var token = context.token(i);
        var open = stack.findInlineSpan(c -> c.kind() == ConstructKind.COLOR);
        if (open >= 0) {
            closeSpan(open, token);
            return i + 1;
        }
        var name = context.token(i + 1);
        if (name.is(Token.TEXT) && context.is(i + 2, Token.PIPE) && COLOR_NAME.matcher(name.slice()).matches()) {
            ensureInline(token);
            open(OpenConstruct.color(context.spanOf(i, i + 2), name.slice()));
            return i + 3;
        }
        return degraded(i, "color span");
    }

    /**
     * {@code @@...@@} on one line. A run of closing markers is taken as far as it goes, so
     * {@code @@@@@@} holds a literal {@code @@}.
     */
    private int raw(int i) {
        var close = context.findOnLine(i, Token.RAW);
        if (close < 0) {
            return degraded(i, "raw text");
        }
        while (context.is(close + 1, Token.RAW)) {
            close++;
        }
        return appendRaw(i, close);
    }

    private int angledRaw(int i) {
        var close = context.findOnLine(i, Token.RIGHT_RAW);
        if (close < 0) {
            return degraded(i, "raw text");
        }
        return appendRaw(i, close);
    }

    private int appendRaw(int open, int close) {
        ensureInline(context.token(open));
        stack.append(new WikiNode.Raw(context.spanOf(open, close), context.between(open, close)));
        return close + 1;
    }

    /**
     * {@code [[[target]]]}, {@code [[[target|label]]]}; a leading {@code *} opens in a new tab.
     */
    private int tripleLink(int i) {
        var close = context.findOnLine(i, Token.RIGHT_LINK);
        if (close < 0) {
            return degraded(i, "link");
        }
        var inner = context.between(i, close);
        var pipe = inner.indexOf('|');
        var target = (pipe < 0 ? inner : inner.substring(0, pipe)).strip();
        var newTab = target.startsWith("*");
        if (newTab) {
            target = target.substring(1).strip();
        }
        if (target.isEmpty()) {
            return degraded(i, "link");
        }
        var label = pipe < 0
                    ? Optional.<String>empty()
                    : nonEmpty(inner.substring(pipe + 1));
        ensureInline(context.token(i));
        stack.append(new WikiNode.Link(context.spanOf(i, close), LinkKind.TRIPLE_BRACKET, target, label, newTab));
        return close + 1;
    }

    /**
     * {@code [url label]}, {@code [*url label]} and {@code [#anchor label]}. Any other bracket is plain text.
     */
    private int bracketLink(int i) {
        var after = context.token(i).endOffset();
        if (context.text().startsWith("#", after) && !context.text().startsWith("##", after)) {
            return anchorLink(i);
        }
        int url = i + 1;
        var newTab = false;
        if (context.is(url, Token.TEXT) && context.token(url).slice().equals("*")) {
            newTab = true;
            url++;
        }
        if (!context.is(url, Token.URL)) {
            return literal(i);
        }
        var close = context.findOnLine(url, Token.RIGHT_BRACKET);
        if (close < 0) {
            return degraded(i, "link");
        }
        ensureInline(context.token(i));
        stack.append(new WikiNode.Link(context.spanOf(i, close),
                                       LinkKind.SINGLE_BRACKET,
                                       context.token(url).slice(),
                                       nonEmpty(context.between(url, close)),
                                       newTab));
        return close + 1;
    }

    /**
     * {@code [#name label]} links to an anchor on the same page. {@code [# label]} is a link that goes nowhere.
     */
    private int anchorLink(int i) {
        var close = context.findOnLine(i, Token.RIGHT_BRACKET);
        if (close < 0) {
            return degraded(i, "anchor link");
        }
        var inner = context.between(i, close).substring(1);
        var split = indexOfWhitespace(inner);
        var anchor = normalizeAnchor(split < 0 ? inner : inner.substring(0, split));
        var label = split < 0 ? Optional.<String>empty() : nonEmpty(inner.substring(split));
        ensureInline(context.token(i));
        stack.append(new WikiNode.Link(context.spanOf(i, close),
                                       LinkKind.ANCHOR,
                                       anchor.isEmpty() ? EMPTY_ANCHOR : "#" + anchor,
                                       label,
                                       false));
        return close + 1;
    }

    private int bareLink(int i) {
        var token = context.token(i);
        ensureInline(token);
        stack.append(new WikiNode.Link(token.span(), LinkKind.BARE, token.slice(), Optional.empty(), false));
        return i + 1;
    }

    private int email(int i) {
        var token = context.token(i);
        ensureInline(token);
        stack.append(new WikiNode.Email(token.span(), token.slice()));
        return i + 1;
    }

    // === Blocks ===

    private int block(int i) {
        var close = context.findInParagraph(i, Token.RIGHT_BLOCK);
        if (close < 0) {
            return degraded(i, "block");
        }
        var header = BlockArguments.splitName(context.between(i, close));
        var name = canonicalName(header[0]);
        var arguments = header[1];
        var span = context.spanOf(i, close);
        if (name.isEmpty()) {
            return degraded(i, "block");
        }

        switch (name) {
            case "include" -> {
                var include = IncludeExpander.parseDirective(arguments);
                if (include.isEmpty()) {
                    return degraded(i, "include");
                }
                appendLeaf(new WikiNode.IncludePlaceholder(span,
                                                           include.get().page().toString(),
                                                           include.get().variables(),
                                                           IncludeStatus.UNRESOLVED));
            }
            case IncludeExpander.PLACEHOLDER_NAME -> {
                var attributes = BlockArguments.parse(arguments);
                var status = IncludeStatus.fromReason(attributes.getOrDefault("reason", ""))
                                          .orElse(IncludeStatus.RESOLVER_ERROR);
                appendLeaf(new WikiNode.IncludePlaceholder(span,
                                                           attributes.getOrDefault("page", ""),
                                                           Map.of(),
                                                           status));
            }
            case "div", "quote" -> openDiv(span, name, Optional.empty(), BlockArguments.parse(arguments));
            case "span", "del", "ins" -> {
                ensureInline(context.token(i));
                open(OpenConstruct.span(span, name, BlockArguments.parse(arguments)));
            }
            case "footnote" -> {
                ensureInline(context.token(i));
                open(OpenConstruct.footnote(span));
            }
            case "footnoteblock" -> {
                var title = Optional.ofNullable(BlockArguments.parse(arguments).get("title"));
                stack.closeAbove(stack.containerIndex(), "footnote block");
                stack.append(new WikiNode.FootnoteBlock(span, title));
            }
            case "collapsible" -> {
                var options = CollapsibleOptions.from(BlockArguments.parse(arguments));
                if (options.isEmpty()) {
                    return degraded(i, "collapsible block");
                }
                stack.closeAbove(stack.containerIndex(), "start of block");
                open(OpenConstruct.collapsible(span, options.get()));
            }
            case "code" -> {
                return code(i, close, BlockArguments.parse(arguments));
            }
            default -> {
                var alignment = Alignment.fromMarker(name);
                if (alignment.isPresent()) {
                    context.deprecated(span,
                                       "alignment block '[[" + name + "]]' is deprecated",
                                       "use [[div style=\"text-align: " + cssAlignment(alignment.get()) + "\"]] instead");
                    openDiv(span, name, alignment, BlockArguments.parse(arguments));
                } else {
                    appendLeaf(new WikiNode.Unrecognized(span, name, span.extract(context.text())));
                }
            }
        }
        return close + 1;
    }

    /**
     * {@code [[code]]} runs to the next line starting with {@code [[/code]]}. Nothing in between is parsed.
     */
    private int code(int open, int close, Map<String, String> arguments) {
        var end = context.findBlockEndLine(close, "code");
        var endClose = end < 0 ? -1 : context.findOnLine(end, Token.RIGHT_BLOCK);
        if (endClose < 0) {
            return degraded(open, "code block");
        }
        var contents = context.between(close, end);
        if (contents.startsWith("\n")) {
            contents = contents.substring(1);
        }
        if (contents.endsWith("\n")) {
            contents = contents.substring(0, contents.length() - 1);
        }
        stack.closeAbove(stack.containerIndex(), "code block");
        stack.append(new WikiNode.Code(context.spanOf(open, endClose),
                                       Optional.ofNullable(arguments.get("type")),
                                       contents));
        return endClose + 1;
    }

    private void openDiv(SourceSpan span, String name, Optional<Alignment> alignment, Map<String, String> attributes) {
        stack.closeAbove(stack.containerIndex(), "start of block");
        open(OpenConstruct.div(span, name, alignment, attributes));
    }

    /**
     * {@code [[/name]]} closes the innermost open block of that name and everything opened inside it.
     */
    private int blockEnd(int i) {
        var close = context.findOnLine(i, Token.RIGHT_BLOCK);
        if (close < 0) {
            return degraded(i, "block end");
        }
        var name = canonicalName(context.between(i, close)
                                        .strip()
                                        .toLowerCase(Locale.ROOT));
        var open = stack.find(c -> (c.kind() == ConstructKind.DIV || c.kind() == ConstructKind.SPAN)
                                   && c.name().equals(name));
        var span = context.spanOf(i, close);
        if (open < 0) {
            context.unmatchedCloser(span);
            ensureInline(context.token(i));
            appendText(span);
            return close + 1;
        }
        stack.closeAbove(open, "'[[/" + name + "]]'");
        stack.closeExplicitly(span.end());
        return close + 1;
    }

    /**
     * Comments normally go during preprocessing. Any left here are skipped when complete.
     */
    private int comment(int i) {
        var close = context.findAhead(i, Token.RIGHT_COMMENT);
        if (close < 0) {
            return degraded(i, "comment");
        }
        return close + 1;
    }

    // === Text ===

    private int whitespace(int i) {
        if (stack.top().kind().inline()) {
            appendText(context.token(i).span());
        }
        return i + 1;
    }

    private int literal(int i) {
        var token = context.token(i);
        ensureInline(token);
        appendText(token.span());
        return i + 1;
    }

    private int unmatched(int i) {
        context.unmatchedCloser(context.token(i).span());
        return literal(i);
    }

    private int degraded(int i, String construct) {
        context.degraded(context.token(i).span(), construct);
        return literal(i);
    }

    // Helper methods

    /**
     * Make sure an inline construct is on top, starting a paragraph if needed.
     */
    private void ensureInline(ExtractedToken token) {
        if (stack.top().kind().inline()) {
            return;
        }
        stack.closeAbove(stack.containerIndex(), "paragraph");
        open(OpenConstruct.paragraph(token.span().start()));
    }

    private void appendLeaf(WikiNode node) {
        if (!stack.top().kind().inline()) {
            stack.closeAbove(stack.containerIndex(), "paragraph");
            open(OpenConstruct.paragraph(node.span().start()));
        }
        stack.append(node);
    }

    private void appendText(SourceSpan span) {
        stack.append(new WikiNode.Text(span, span.extract(context.text())));
    }

    private void closeSpan(int index, ExtractedToken closer) {
        stack.closeAbove(index, "'" + closer.slice() + "'");
        stack.closeExplicitly(closer.span().end());
    }

    private void open(OpenConstruct construct) {
        log.trace("Opening {}", construct);
        stack.push(construct);
    }

    private static boolean isLineBound(ConstructKind kind) {
        return kind == ConstructKind.HEADING
               || kind == ConstructKind.TABLE_CELL
               || kind == ConstructKind.TABLE_ROW
               || kind == ConstructKind.LIST_ITEM
               || kind == ConstructKind.PARAGRAPH;
    }

    /**
     * True if the line starting at the given token cannot continue a paragraph.
     */
    private boolean endsParagraph(int i) {
        var token = context.token(i).token();
        if (token.lineStart()) {
            return true;
        }
        return switch (token) {
            case TABLE_COLUMN, TABLE_COLUMN_TITLE, INPUT_END -> true;
            case LEFT_BLOCK -> {
                var close = context.findOnLine(i, Token.RIGHT_BLOCK);
                yield close >= 0 && isBlockLevel(BlockArguments.splitName(context.between(i, close))[0]);
            }
            case LEFT_BLOCK_END -> {
                var close = context.findOnLine(i, Token.RIGHT_BLOCK);
                var name = close < 0 ? "" : canonicalName(context.between(i, close).strip().toLowerCase(Locale.ROOT));
                yield stack.find(c -> c.kind() == ConstructKind.DIV && c.name().equals(name)) >= 0;
            }
            default -> false;
        };
    }

    private static boolean isBlockLevel(String name) {
        return switch (name) {
            case "div", "quote", "collapsible", "code", "footnoteblock" -> true;
            default -> Alignment.fromMarker(name).isPresent();
        };
    }

    private static String canonicalName(String name) {
        return BLOCK_ALIASES.getOrDefault(name, name);
    }

    private static FormatStyle styleOf(Token token) {
        return switch (token) {
            case BOLD -> FormatStyle.BOLD;
            case ITALICS -> FormatStyle.ITALICS;
            case UNDERLINE -> FormatStyle.UNDERLINE;
            case STRIKETHROUGH -> FormatStyle.STRIKETHROUGH;
            case SUPERSCRIPT -> FormatStyle.SUPERSCRIPT;
            case SUBSCRIPT -> FormatStyle.SUBSCRIPT;
            default -> throw new IllegalArgumentException("Not a formatting delimiter: " + token.tag());
        };
    }

    private static String cssAlignment(Alignment alignment) {
        return switch (alignment) {
            case LEFT -> "left";
            case RIGHT -> "right";
            case CENTER -> "center";
            case JUSTIFY -> "justify";
        };
    }

    private static int indentation(String marker) {
        int spaces = 0;
        while (spaces < marker.length() && marker.charAt(spaces) == ' ') {
            spaces++;
        }
        return spaces;
    }

    /**
     * Lower-case the anchor and turn every run of other characters into one dash.
     */
    static String normalizeAnchor(String anchor) {
        var dashed = ANCHOR_NOISE.matcher(anchor.toLowerCase(Locale.ROOT)).replaceAll("-");
        int from = 0;
        int to = dashed.length();
        while (from < to && dashed.charAt(from) == '-') {
            from++;
        }
        while (to > from && dashed.charAt(to - 1) == '-') {
            to--;
        }
        return dashed.substring(from, to);
    }

    private static int indexOfWhitespace(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static Optional<String> nonEmpty(String text) {
        var stripped = text.strip();
        return stripped.isEmpty() ? Optional.empty() : Optional.of(stripped);
    }
}
