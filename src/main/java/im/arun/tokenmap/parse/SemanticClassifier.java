package im.arun.tokenmap.parse;

import im.arun.tokenmap.model.SemanticType;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies prompt elements (files, instructions, code maps...) from the tag name
 * and the {@code class}, {@code type}, {@code role} and {@code name} attributes.
 * Rules are ordered from most to least specific; the first match wins.
 */
public final class SemanticClassifier {

    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern FILE_EXTENSION = Pattern.compile("\\.[a-z0-9]{1,8}$");
    private static final List<String> HINT_ATTRIBUTES = List.of("class", "type", "role", "name");
    private static final List<String> PATH_ATTRIBUTES = List.of("file", "filepath", "path", "src", "url", "uri");

    private SemanticClassifier() {}

    public static SemanticType classify(String tag, Map<String, String> attributes) {
        Map<String, String> attrs = attributes == null ? Map.of() : attributes;
        String base = localName(tag).toLowerCase(Locale.ROOT);
        Set<String> tokens = tokenize(base);

        StringBuilder hints = new StringBuilder();
        for (String key : HINT_ATTRIBUTES) {
            String value = attrs.get(key);
            if (value != null && !value.isEmpty()) {
                hints.append(value).append(' ');
            }
        }
        Set<String> attrTokens = tokenize(hints.toString());

        if (base.startsWith("sugg")
                || containsAny(tokens, "suggestion", "suggestions", "sugg")
                || containsAny(attrTokens, "sugg", "suggestion", "suggestions")) {
            return SemanticType.SUGGESTIONS;
        }

        if (containsAll(tokens, "file", "map")
                || containsAll(tokens, "file", "tree")
                || (containsAny(tokens, "filetree", "directory", "dir", "tree") && tokens.contains("file"))
                || base.equals("file_map") || base.equals("filetree") || base.equals("file_tree")
                || containsAll(attrTokens, "file", "tree")
                || containsAll(attrTokens, "file", "map")) {
            return SemanticType.FILE_TREE;
        }

        if (tokens.contains("codemap") || containsAll(tokens, "code", "map")
                || attrTokens.contains("codemap") || containsAll(attrTokens, "code", "map")) {
            return SemanticType.CODEMAP;
        }

        if (containsAny(tokens, "instructions", "instruction")
                || containsAny(attrTokens, "instructions", "instruction")
                || (base.equals("prompt")
                    && (attrTokens.contains("user") || attributeIncludes(attrs, List.of("role", "type"), "user")))) {
            return SemanticType.INSTRUCTIONS;
        }

        if (containsAll(tokens, "meta", "prompt")
                || tokens.contains("metaprompt")
                || containsAll(attrTokens, "meta", "prompt")
                || (base.equals("prompt")
                    && attributeIncludes(attrs, List.of("type", "role"), "meta", "system", "template"))) {
            return SemanticType.META_PROMPT;
        }

        if (containsAny(tokens, "references", "reference", "refs", "links", "link", "docs", "documentation")
                || containsAny(attrTokens, "references", "reference", "refs", "links", "link", "docs", "documentation")
                || attrs.containsKey("href") || attrs.containsKey("url") || attrs.containsKey("link")) {
            return SemanticType.REFERENCES;
        }

        if (base.equals("file")
                || containsAny(tokens, "file", "files", "filecontents", "filecontent")
                || containsAny(attrTokens, "file", "files", "filecontent", "filecontents")
                || isLikelyFilePath(attrs)) {
            return SemanticType.FILES;
        }

        return SemanticType.OTHER;
    }

    private static String localName(String tag) {
        if (tag == null) {
            return "";
        }
        String trimmed = tag.trim();
        int colon = trimmed.lastIndexOf(':');
        return colon >= 0 ? trimmed.substring(colon + 1) : trimmed;
    }

    /**
     * Lowercased alphanumeric tokens, deduplicated in order of appearance.
     */
    static Set<String> tokenize(String input) {
        Set<String> out = new LinkedHashSet<>();
        for (String part : NON_ALNUM.split(input.toLowerCase(Locale.ROOT))) {
            if (!part.isEmpty()) {
                out.add(part);
            }
        }
        return out;
    }

    private static boolean containsAny(Set<String> tokens, String... candidates) {
        return Arrays.stream(candidates).anyMatch(tokens::contains);
    }

    private static boolean containsAll(Set<String> tokens, String... candidates) {
        return Arrays.stream(candidates).allMatch(tokens::contains);
    }

    private static boolean attributeIncludes(Map<String, String> attrs, List<String> keys, String... needles) {
        for (String key : keys) {
            String value = attrs.get(key);
            if (value == null) {
                continue;
            }
            String lower = value.toLowerCase(Locale.ROOT);
            for (String needle : needles) {
                if (lower.contains(needle)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isLikelyFilePath(Map<String, String> attrs) {
        for (String key : PATH_ATTRIBUTES) {
            String value = attrs.get(key);
            if (value == null || value.isEmpty()) {
                continue;
            }
            String lower = value.toLowerCase(Locale.ROOT);
            if (lower.contains("/") || lower.contains("\\") || FILE_EXTENSION.matcher(lower).find()) {
                return true;
            }
        }
        return false;
    }
}
