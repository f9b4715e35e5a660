package im.arun.tokenmap.parse;

import im.arun.tokenmap.model.NodeKind;

import java.util.Locale;

/**
 * Derives a node's {@link NodeKind} from its tag, own text and child count.
 */
public final class NodeClassifier {

    private NodeClassifier() {}

    /**
     * @param localName  tag name without namespace prefix
     * @param text       own text, may be null
     * @param childCount number of element children
     */
    public static NodeKind classify(String localName, String text, int childCount) {
        if (childCount == 0 && text != null && !text.isBlank()) {
            return NodeKind.TEXT;
        }
        String lower = localName == null ? "" : localName.toLowerCase(Locale.ROOT);
        if (lower.equals("script") || lower.equals("style") || lower.contains("code")) {
            return NodeKind.CODE;
        }
        if (lower.equals("meta") || lower.equals("head") || lower.contains("meta")) {
            return NodeKind.METADATA;
        }
        if (childCount > 0) {
            return NodeKind.CONTAINER;
        }
        return NodeKind.OTHER;
    }
}
