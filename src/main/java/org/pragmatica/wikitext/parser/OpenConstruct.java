package org.pragmatica.wikitext.parser;

import org.pragmatica.wikitext.lexer.Token;
import org.pragmatica.wikitext.tree.Alignment;
import org.pragmatica.wikitext.tree.FormatStyle;
import org.pragmatica.wikitext.tree.SourceLocation;
import org.pragmatica.wikitext.tree.SourceSpan;
import org.pragmatica.wikitext.tree.WikiNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A construct that has been opened but not yet closed: its kind, opening marker and the children
 * collected so far.
 *
 * <p>The span of the finished node runs from {@code start} to the end of the closing marker, or to
 * the end of the last consumed token when the construct is auto-closed.
 *
 * <p>Contiguous text children are held as one pending span and only turned into a
 * {@link WikiNode.Text} when another child arrives or the construct finishes.
 */
public final class OpenConstruct {
    @FunctionalInterface
    interface NodeFactory {
        WikiNode create(SourceSpan span, List<WikiNode> children);
    }

    private final ConstructKind kind;
    private final SourceLocation start;
    private final SourceSpan opener;
    private final NodeFactory factory;
    private final List<WikiNode> children = new ArrayList<>();
    private final Token delimiter;
    private final String name;
    private final boolean ordered;
    private SourceLocation end;
    private SourceSpan pendingText;

    private OpenConstruct(ConstructKind kind,
                          SourceSpan opener,
                          NodeFactory factory,
                          Token delimiter,
                          String name,
                          boolean ordered) {
        this.kind = kind;
        this.start = opener.start();
        this.opener = opener;
        this.factory = factory;
        this.delimiter = delimiter;
        this.name = name;
        this.ordered = ordered;
        this.end = opener.end();
    }

    private static OpenConstruct of(ConstructKind kind, SourceSpan opener, NodeFactory factory) {
        return new OpenConstruct(kind, opener, factory, null, "", false);
    }

    public static OpenConstruct document(SourceLocation start) {
        return of(ConstructKind.DOCUMENT, SourceSpan.at(start), WikiNode.Document::new);
    }

    public static OpenConstruct paragraph(SourceLocation start) {
        return of(ConstructKind.PARAGRAPH, SourceSpan.at(start), WikiNode.Paragraph::new);
    }

    public static OpenConstruct heading(SourceSpan marker, int level) {
        return of(ConstructKind.HEADING, marker, (span, children) -> new WikiNode.Heading(span, level, children));
    }

    public static OpenConstruct list(SourceSpan marker, boolean ordered) {
        return new OpenConstruct(ConstructKind.LIST,
                                 SourceSpan.at(marker.start()),
                                 (span, children) -> new WikiNode.ListBlock(span, ordered, children),
                                 null,
                                 "",
                                 ordered);
    }

    public static OpenConstruct listItem(SourceSpan marker) {
        return of(ConstructKind.LIST_ITEM, marker, WikiNode.ListItem::new);
    }

    public static OpenConstruct table(SourceLocation start) {
        return of(ConstructKind.TABLE, SourceSpan.at(start), WikiNode.Table::new);
    }

    public static OpenConstruct tableRow(SourceLocation start) {
        return of(ConstructKind.TABLE_ROW, SourceSpan.at(start), WikiNode.TableRow::new);
    }

    public static OpenConstruct tableCell(SourceSpan marker, boolean header, int columnSpan) {
        return of(ConstructKind.TABLE_CELL,
                  marker,
                  (span, children) -> new WikiNode.TableCell(span, header, columnSpan, children));
    }

    /**
     * Formatting span closed by the given delimiter token.
     */
    public static OpenConstruct format(SourceSpan marker, FormatStyle style, Token closer) {
        return new OpenConstruct(ConstructKind.FORMAT,
                                 marker,
                                 (span, children) -> new WikiNode.Format(span, style, children),
                                 closer,
                                 style.tag(),
                                 false);
    }

    public static OpenConstruct color(SourceSpan marker, String color) {
        return new OpenConstruct(ConstructKind.COLOR,
                                 marker,
                                 (span, children) -> new WikiNode.Color(span, color, children),
                                 Token.COLOR,
                                 "color",
                                 false);
    }

    /**
     * Block container, {@code div} or a legacy alignment block.
     */
    public static OpenConstruct div(SourceSpan marker,
                                    String name,
                                    Optional<Alignment> alignment,
                                    Map<String, String> attributes) {
        return new OpenConstruct(ConstructKind.DIV,
                                 marker,
                                 (span, children) -> new WikiNode.Container(span, name, alignment, attributes, children),
                                 null,
                                 name,
                                 false);
    }

    /**
     * Inline container: {@code span}, {@code del} or {@code ins}.
     */
    public static OpenConstruct span(SourceSpan marker, String name, Map<String, String> attributes) {
        return new OpenConstruct(ConstructKind.SPAN,
                                 marker,
                                 (span, children) -> new WikiNode.Container(span, name, Optional.empty(), attributes, children),
                                 null,
                                 name,
                                 false);
    }

    public static OpenConstruct footnote(SourceSpan marker) {
        return new OpenConstruct(ConstructKind.SPAN, marker, WikiNode.Footnote::new, null, "footnote", false);
    }

    public static OpenConstruct collapsible(SourceSpan marker, CollapsibleOptions options) {
        return new OpenConstruct(ConstructKind.DIV,
                                 marker,
                                 (span, children) -> new WikiNode.Collapsible(span,
                                                                              options.startOpen(),
                                                                              options.showText(),
                                                                              options.hideText(),
                                                                              options.showTop(),
                                                                              options.showBottom(),
                                                                              options.attributes(),
                                                                              children),
                                 null,
                                 "collapsible",
                                 false);
    }

    public ConstructKind kind() {
        return kind;
    }

    /**
     * Name used in diagnostics, e.g. {@code bold} or {@code 'div' block}.
     */
    public String description() {
        return switch (kind) {
            case DIV, SPAN -> "'" + name + "' block";
            default -> kind.description();
        };
    }

    public SourceSpan opener() {
        return opener;
    }

    public SourceLocation end() {
        return end;
    }

    /**
     * Closing delimiter for formatting and colour spans, {@code null} for other kinds.
     */
    public Token delimiter() {
        return delimiter;
    }

    /**
     * Block name for containers, style tag for formatting spans.
     */
    public String name() {
        return name;
    }

    public boolean ordered() {
        return ordered;
    }

    public boolean isEmpty() {
        return children.isEmpty() && pendingText == null;
    }

    /**
     * Append a child. Text directly following other text joins it in a single node.
     */
    public void append(WikiNode child, String source) {
        if (child instanceof WikiNode.Text text) {
            if (pendingText != null && pendingText.endOffset() == text.span().startOffset()) {
                pendingText = pendingText.merge(text.span());
            } else {
                flushText(source);
                pendingText = text.span();
            }
        } else {
            flushText(source);
            children.add(child);
        }
        extendTo(child.span().end());
    }

    private void flushText(String source) {
        if (pendingText != null) {
            children.add(new WikiNode.Text(pendingText, pendingText.extract(source)));
            pendingText = null;
        }
    }

    public void extendTo(SourceLocation location) {
        if (location.offset() > end.offset()) {
            end = location;
        }
    }

    /**
     * Build the finished node ending at the given location.
     */
    public WikiNode finish(SourceLocation closedAt, String source) {
        flushText(source);
        extendTo(closedAt);
        return factory.create(SourceSpan.of(start, end), children);
    }

    @Override
    public String toString() {
        return description() + "@" + start;
    }
}
