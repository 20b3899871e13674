package org.pragmatica.wikitext.parser;

import org.pragmatica.wikitext.tree.SourceLocation;
import org.pragmatica.wikitext.tree.WikiNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Stack of open constructs. The bottom entry is always the document.
 *
 * <p>Closing a construct turns it into a node and appends it to the construct below. Constructs
 * with an explicit closing marker that are closed any other way are reported as auto-closed.
 */
public final class ConstructStack {
    private final BuildContext context;
    private final List<OpenConstruct> frames = new ArrayList<>();

    public ConstructStack(BuildContext context) {
        this.context = context;
        frames.add(OpenConstruct.document(SourceLocation.START));
    }

    public OpenConstruct top() {
        return frames.get(frames.size() - 1);
    }

    public OpenConstruct get(int index) {
        return frames.get(index);
    }

    public void push(OpenConstruct construct) {
        frames.add(construct);
    }

    /**
     * Add a finished node to the innermost open construct.
     */
    public void append(WikiNode node) {
        top().append(node, context.text());
    }

    /**
     * Index of the innermost block container (document or div).
     */
    public int containerIndex() {
        for (int i = frames.size() - 1; i > 0; i--) {
            if (frames.get(i).kind().blockContainer()) {
                return i;
            }
        }
        return 0;
    }

    /**
     * Index of the innermost construct above the current block container matching the predicate, or -1.
     */
    public int findInBlock(Predicate<OpenConstruct> predicate) {
        var container = containerIndex();
        for (int i = frames.size() - 1; i > container; i--) {
            if (predicate.test(frames.get(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Index of the outermost construct above the current block container matching the predicate, or -1.
     */
    public int outermostInBlock(Predicate<OpenConstruct> predicate) {
        for (int i = containerIndex() + 1; i < frames.size(); i++) {
            if (predicate.test(frames.get(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Index of the innermost construct matching the predicate, searching only through the
     * formatting and colour spans on top of the stack, or -1.
     */
    public int findInlineSpan(Predicate<OpenConstruct> predicate) {
        for (int i = frames.size() - 1; i > 0 && frames.get(i).kind().inlineSpan(); i--) {
            if (predicate.test(frames.get(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Index of the innermost construct matching the predicate anywhere on the stack, or -1.
     */
    public int find(Predicate<OpenConstruct> predicate) {
        for (int i = frames.size() - 1; i > 0; i--) {
            if (predicate.test(frames.get(i))) {
                return i;
            }
        }
        return -1;
    }

    public int count(Predicate<OpenConstruct> predicate, int fromIndex) {
        int count = 0;
        for (int i = fromIndex; i < frames.size(); i++) {
            if (predicate.test(frames.get(i))) {
                count++;
            }
        }
        return count;
    }

    /**
     * Close the top construct with its closing marker ending at the given location.
     */
    public void closeExplicitly(SourceLocation closerEnd) {
        var construct = frames.remove(frames.size() - 1);
        append(construct.finish(closerEnd, context.text()));
    }

    /**
     * Close the top construct at the end of its content when its closing marker also opens what follows.
     */
    public void closeBeforeMarker() {
        var construct = frames.remove(frames.size() - 1);
        append(construct.finish(construct.end(), context.text()));
    }

    /**
     * Close the top construct at the end of its content, reporting it if it needed a closing marker.
     */
    public void autoClose(String boundary) {
        var construct = frames.remove(frames.size() - 1);
        if (construct.kind().explicitCloser()) {
            context.autoClosed(construct, boundary);
        }
        if (construct.kind() == ConstructKind.PARAGRAPH && construct.isEmpty()) {
            return;
        }
        append(construct.finish(construct.end(), context.text()));
    }

    /**
     * Auto-close every construct above the given index.
     */
    public void closeAbove(int index, String boundary) {
        while (frames.size() - 1 > index) {
            autoClose(boundary);
        }
    }

    /**
     * Close everything above the document and finish it.
     */
    public WikiNode.Document drain(SourceLocation documentEnd) {
        closeAbove(0, "end of input");
        return (WikiNode.Document) frames.get(0)
                                         .finish(documentEnd, context.text());
    }
}
