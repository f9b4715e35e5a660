package im.arun.tokenmap.tree;

import im.arun.tokenmap.model.ParsedNode;
import org.apache.commons.text.StringEscapeUtils;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Human-facing labels, grouping keys and previews for display nodes.
 */
final class NodeLabels {
    private static final Pattern HEXISH = Pattern.compile("^[a-fA-F0-9]{16,}$");
    private static final Pattern BASE64ISH = Pattern.compile("^[A-Za-z0-9+/=]{16,}$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final List<String> NAME_ATTRIBUTES = List.of("name", "title", "file", "filepath");
    private static final List<String> LOCATION_ATTRIBUTES = List.of("path", "src", "uri", "url");
    private static final List<String> GROUP_ATTRIBUTES =
        List.of("file", "filepath", "path", "src", "source", "uri", "url", "module");

    private NodeLabels() {}

    /**
     * Best-effort label: a readable name/title/file attribute, the basename of a
     * location attribute, the tag, a readable id, then "node".
     */
    static String friendlyName(ParsedNode node) {
        Map<String, String> attrs = node.getAttributes();
        String preferred = firstReadable(attrs, NAME_ATTRIBUTES);
        if (preferred != null) {
            return preferred;
        }
        String location = firstReadable(attrs, LOCATION_ATTRIBUTES);
        if (location != null) {
            return basename(location);
        }
        String tag = node.getTag();
        if (tag != null && !tag.isEmpty() && !tag.toLowerCase(Locale.ROOT).equals("promptnode")) {
            return tag;
        }
        String id = attrs.get("id");
        if (id != null && !id.isEmpty() && !isOpaqueId(id)) {
            return id;
        }
        return tag != null && !tag.isEmpty() ? tag : "node";
    }

    /**
     * Grouping key: a file/module-like attribute, else the path, else the tag.
     */
    static String groupKey(ParsedNode node) {
        String group = firstReadable(node.getAttributes(), GROUP_ATTRIBUTES);
        if (group != null) {
            return group;
        }
        return node.getPath() != null && !node.getPath().isEmpty() ? node.getPath() : node.getTag();
    }

    /**
     * Whitespace-collapsed, truncated, HTML-escaped preview of the node's own text, or
     * null when there is no retained text.
     */
    static String preview(ParsedNode node, int previewLength) {
        String raw = node.getText();
        if (raw == null || raw.isEmpty() || previewLength == 0) {
            return null;
        }
        String normalized = WHITESPACE.matcher(raw).replaceAll(" ").trim();
        if (normalized.isEmpty()) {
            return null;
        }
        String truncated = normalized.length() > previewLength
            ? normalized.substring(0, previewLength) + "…"
            : normalized;
        return StringEscapeUtils.escapeHtml4(truncated);
    }

    static boolean isOpaqueId(String value) {
        if (value == null) {
            return false;
        }
        boolean hexish = HEXISH.matcher(value).matches();
        boolean base64ish = BASE64ISH.matcher(value).matches() && value.length() % 4 == 0;
        return hexish || base64ish || value.length() > 40;
    }

    private static String firstReadable(Map<String, String> attrs, List<String> keys) {
        for (String key : keys) {
            String value = attrs.get(key);
            if (value != null && !value.isEmpty() && !isOpaqueId(value)) {
                return value;
            }
        }
        return null;
    }

    private static String basename(String location) {
        String[] parts = location.split("[\\\\/]");
        String last = parts.length == 0 ? "" : parts[parts.length - 1];
        return last.isEmpty() ? location : last;
    }
}
