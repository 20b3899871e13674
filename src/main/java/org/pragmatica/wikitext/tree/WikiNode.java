package org.pragmatica.wikitext.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Syntax tree node - a closed set of variants produced by the tree builder.
 *
 * <p>Every node owns its span into the preprocessed text. Container variants own an ordered list
 * of children whose spans lie inside the parent span, do not overlap and appear in document order.
 * Gaps between children hold markers and separators that produce no node.
 */
public sealed interface WikiNode {
    /**
     * The source span covered by this node.
     */
    SourceSpan span();

    /**
     * The stable variant tag.
     */
    NodeKind kind();

    /**
     * Child nodes in document order, empty for leaf variants.
     */
    default List<WikiNode> children() {
        return List.of();
    }

    /**
     * This node followed by all of its descendants, depth first.
     */
    default Stream<WikiNode> stream() {
        return Stream.concat(Stream.of(this),
                             children().stream()
                                       .flatMap(WikiNode::stream));
    }

    /**
     * Root of every tree.
     */
    record Document(SourceSpan span, List<WikiNode> children) implements WikiNode {
        public Document {
            children = List.copyOf(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.DOCUMENT;
        }
    }

    record Paragraph(SourceSpan span, List<WikiNode> children) implements WikiNode {
        public Paragraph {
            children = List.copyOf(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PARAGRAPH;
        }
    }

    /**
     * Heading line, {@code + Title} through {@code ++++++ Title}.
     */
    record Heading(SourceSpan span, int level, List<WikiNode> children) implements WikiNode {
        public Heading {
            children = List.copyOf(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.HEADING;
        }
    }

    /**
     * Bulleted ({@code *}) or numbered ({@code #}) list. Children are {@link ListItem}s.
     */
    record ListBlock(SourceSpan span, boolean ordered, List<WikiNode> children) implements WikiNode {
        public ListBlock {
            children = List.copyOf(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.LIST;
        }
    }

    /**
     * List item. Holds inline content followed by any nested {@link ListBlock}.
     */
    record ListItem(SourceSpan span, List<WikiNode> children) implements WikiNode {
        public ListItem {
            children = List.copyOf(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.LIST_ITEM;
        }
    }

    record Table(SourceSpan span, List<WikiNode> children) implements WikiNode {
        public Table {
            children = List.copyOf(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TABLE;
        }
    }

    record TableRow(SourceSpan span, List<WikiNode> children) implements WikiNode {
        public TableRow {
            children = List.copyOf(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TABLE_ROW;
        }
    }

    /**
     * Table cell.
     *
     * @param header     true for {@code ||~} title cells
     * @param columnSpan number of columns covered, at least 1
     */
    record TableCell(SourceSpan span, boolean header, int columnSpan, List<WikiNode> children) implements WikiNode {
        public TableCell {
            children = List.copyOf(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TABLE_CELL;
        }
    }

    /**
     * Inline formatting span such as bold or italics.
     */
    record Format(SourceSpan span, FormatStyle style, List<WikiNode> children) implements WikiNode {
        public Format {
            children = List.copyOf(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FORMAT;
        }
    }

    /**
     * Coloured text, {@code ##blue|text##}.
     */
    record Color(SourceSpan span, String color, List<WikiNode> children) implements WikiNode {
        public Color {
            children = List.copyOf(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.COLOR;
        }
    }

    /**
     * Explicit block container. Block-level for {@code div}, {@code quote} and the alignment
     * markers; inline for {@code span}, {@code del} and {@code ins}.
     *
     * @param name       lower-case block name
     * @param alignment  set for legacy alignment blocks
     * @param attributes block arguments in written order, keys lower-cased
     */
    record Container(SourceSpan span,
                     String name,
                     Optional<Alignment> alignment,
                     Map<String, String> attributes,
                     List<WikiNode> children) implements WikiNode {
        public Container {
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
            children = List.copyOf(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CONTAINER;
        }
    }

    /**
     * Content hidden behind a show/hide toggle, {@code [[collapsible]]...[[/collapsible]]}.
     *
     * @param startOpen  false unless written with {@code folded="no"}
     * @param showText   toggle text while folded
     * @param hideText   toggle text while open
     * @param showTop    toggle shown above the content
     * @param showBottom toggle shown below the content
     * @param attributes all block arguments in written order
     */
    record Collapsible(SourceSpan span,
                       boolean startOpen,
                       Optional<String> showText,
                       Optional<String> hideText,
                       boolean showTop,
                       boolean showBottom,
                       Map<String, String> attributes,
                       List<WikiNode> children) implements WikiNode {
        public Collapsible {
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
            children = List.copyOf(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.COLLAPSIBLE;
        }
    }

    /**
     * Inline footnote body, {@code [[footnote]]...[[/footnote]]}. Footnotes are numbered in document order.
     */
    record Footnote(SourceSpan span, List<WikiNode> children) implements WikiNode {
        public Footnote {
            children = List.copyOf(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FOOTNOTE;
        }
    }

    /**
     * Where the collected footnotes are listed, {@code [[footnoteblock]]}.
     */
    record FootnoteBlock(SourceSpan span, Optional<String> title) implements WikiNode {
        @Override
        public NodeKind kind() {
            return NodeKind.FOOTNOTE_BLOCK;
        }
    }

    /**
     * Link to a page or URL.
     *
     * @param label  display text, empty when the target itself is displayed
     * @param newTab true for {@code [[[*page]]]} and {@code [*url label]}
     */
    record Link(SourceSpan span, LinkKind linkKind, String target, Optional<String> label, boolean newTab)
    implements WikiNode {
        @Override
        public NodeKind kind() {
            return NodeKind.LINK;
        }
    }

    /**
     * An e-mail address in running text.
     */
    record Email(SourceSpan span, String address) implements WikiNode {
        @Override
        public NodeKind kind() {
            return NodeKind.EMAIL;
        }
    }

    /**
     * Literal text. The text is always the exact source slice under the span.
     */
    record Text(SourceSpan span, String text) implements WikiNode {
        @Override
        public NodeKind kind() {
            return NodeKind.TEXT;
        }
    }

    record LineBreak(SourceSpan span) implements WikiNode {
        @Override
        public NodeKind kind() {
            return NodeKind.LINE_BREAK;
        }
    }

    record HorizontalRule(SourceSpan span) implements WikiNode {
        @Override
        public NodeKind kind() {
            return NodeKind.HORIZONTAL_RULE;
        }
    }

    /**
     * Verbatim text from {@code @@...@@} or {@code @<...>@}, never interpreted.
     */
    record Raw(SourceSpan span, String text) implements WikiNode {
        @Override
        public NodeKind kind() {
            return NodeKind.RAW;
        }
    }

    /**
     * {@code [[code]]} block. The body is kept verbatim, without the line breaks next to its markers.
     *
     * @param language value of the {@code type} argument
     */
    record Code(SourceSpan span, Optional<String> language, String contents) implements WikiNode {
        @Override
        public NodeKind kind() {
            return NodeKind.CODE;
        }
    }

    /**
     * An include directive that was not replaced by page content.
     *
     * @param target    page reference as written, including any {@code :site:} prefix
     * @param variables include arguments in written order
     */
    record IncludePlaceholder(SourceSpan span, String target, Map<String, String> variables, IncludeStatus status)
    implements WikiNode {
        public IncludePlaceholder {
            variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        }

        @Override
        public NodeKind kind() {
            return NodeKind.INCLUDE_PLACEHOLDER;
        }
    }

    /**
     * A well-formed {@code [[name ...]]} block this parser does not know.
     *
     * @param source the full block text, brackets included
     */
    record Unrecognized(SourceSpan span, String name, String source) implements WikiNode {
        @Override
        public NodeKind kind() {
            return NodeKind.UNRECOGNIZED;
        }
    }
}
