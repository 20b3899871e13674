package org.pragmatica.wikitext.parser;

import org.pragmatica.wikitext.tree.WikiNode;

import java.util.stream.Collectors;

/**
 * Compact one-line rendering of a tree for assertions, e.g. {@code doc(p(bold("bold") " text"))}.
 */
public final class TreeDump {
    private TreeDump() {}

    public static String dump(WikiNode node) {
        if (node instanceof WikiNode.Text text) {
            return "\"" + text.text().replace("\n", "\\n") + "\"";
        }
        if (node instanceof WikiNode.LineBreak) {
            return "br";
        }
        if (node instanceof WikiNode.HorizontalRule) {
            return "hr";
        }
        if (node instanceof WikiNode.Raw raw) {
            return "raw(\"" + raw.text() + "\")";
        }
        if (node instanceof WikiNode.Link link) {
            return "link(" + link.linkKind().name().toLowerCase() + ":" + (link.newTab() ? "*" : "")
                   + link.target() + link.label().map(label -> "|" + label).orElse("") + ")";
        }
        if (node instanceof WikiNode.Email email) {
            return "email(" + email.address() + ")";
        }
        if (node instanceof WikiNode.Code code) {
            return "code(" + code.language().map(language -> language + ":").orElse("")
                   + "\"" + code.contents().replace("\n", "\\n") + "\")";
        }
        if (node instanceof WikiNode.FootnoteBlock) {
            return "footnoteblock";
        }
        if (node instanceof WikiNode.IncludePlaceholder include) {
            return "include(" + include.target() + " " + include.status().reason() + ")";
        }
        if (node instanceof WikiNode.Unrecognized unrecognized) {
            return "unknown(" + unrecognized.name() + ")";
        }
        return name(node) + "(" + node.children()
                                      .stream()
                                      .map(TreeDump::dump)
                                      .collect(Collectors.joining(" ")) + ")";
    }

    private static String name(WikiNode node) {
        if (node instanceof WikiNode.Document) {
            return "doc";
        }
        if (node instanceof WikiNode.Paragraph) {
            return "p";
        }
        if (node instanceof WikiNode.Heading heading) {
            return "h" + heading.level();
        }
        if (node instanceof WikiNode.ListBlock list) {
            return list.ordered() ? "ol" : "ul";
        }
        if (node instanceof WikiNode.ListItem) {
            return "li";
        }
        if (node instanceof WikiNode.Table) {
            return "table";
        }
        if (node instanceof WikiNode.TableRow) {
            return "tr";
        }
        if (node instanceof WikiNode.TableCell cell) {
            return (cell.header() ? "th" : "td") + (cell.columnSpan() > 1 ? "*" + cell.columnSpan() : "");
        }
        if (node instanceof WikiNode.Format format) {
            return format.style().tag();
        }
        if (node instanceof WikiNode.Color color) {
            return "color:" + color.color();
        }
        if (node instanceof WikiNode.Container container) {
            return container.name();
        }
        return node.kind().tag();
    }
}
