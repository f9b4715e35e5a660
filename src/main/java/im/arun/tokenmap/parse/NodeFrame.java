package im.arun.tokenmap.parse;

import im.arun.tokenmap.model.ParsedNode;
import im.arun.tokenmap.util.ContentHasher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * An element that has been opened but not yet closed. Both parse strategies keep a
 * stack of frames and turn each one into a {@link ParsedNode} once all of its
 * children are complete, so the two produce identical nodes for the same input.
 */
final class NodeFrame {
    static final String EMPTY_DOCUMENT_TAG = "document";

    private final String tag;
    private final String path;
    private final Map<String, String> attributes;
    private final StringBuilder text = new StringBuilder();
    private final List<ParsedNode> children = new ArrayList<>();
    private final Map<String, Integer> siblingCounters = new HashMap<>();

    NodeFrame(String tag, String path, Map<String, String> attributes) {
        this.tag = tag;
        this.path = path;
        // Sorted so both strategies expose attributes identically
        this.attributes = attributes == null || attributes.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(attributes));
    }

    static NodeFrame root(String tag, Map<String, String> attributes) {
        return new NodeFrame(tag, segment(tag, 1), attributes);
    }

    /**
     * Opens a child frame, assigning the next sibling index for its tag.
     */
    NodeFrame openChild(String childTag, Map<String, String> childAttributes) {
        int index = siblingCounters.merge(childTag, 1, Integer::sum);
        return new NodeFrame(childTag, path + "/" + segment(childTag, index), childAttributes);
    }

    void appendText(String chunk) {
        text.append(chunk);
    }

    void appendText(char[] chars, int start, int length) {
        text.append(chars, start, length);
    }

    void addChild(ParsedNode child) {
        children.add(child);
    }

    String path() {
        return path;
    }

    /**
     * Builds the immutable node; children must all be finalized already.
     */
    ParsedNode finish(boolean retainText) {
        String ownText = text.toString();
        String localName = localName(tag);
        return ParsedNode.builder()
            .id(path)
            .path(path)
            .tag(tag)
            .attributes(attributes)
            .kind(NodeClassifier.classify(localName, ownText, children.size()))
            .semanticType(SemanticClassifier.classify(tag, attributes))
            .charCount(ownText.length())
            .contentHash(ContentHasher.hash(attributes, ownText))
            .text(retainText ? ownText : null)
            .children(children.isEmpty() ? List.of() : Collections.unmodifiableList(children))
            .build();
    }

    /**
     * The single empty root produced for blank input.
     */
    static ParsedNode emptyDocument(boolean retainText) {
        return root(EMPTY_DOCUMENT_TAG, Map.of()).finish(retainText);
    }

    private static String segment(String tag, int index) {
        return tag + "[" + index + "]";
    }

    private static String localName(String tag) {
        int colon = tag.lastIndexOf(':');
        return colon >= 0 ? tag.substring(colon + 1) : tag;
    }
}
