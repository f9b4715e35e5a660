package im.arun.tokenmap.parse;

import java.util.regex.Pattern;

/**
 * Strips document type declarations and processing instructions before parsing.
 * A leading XML declaration ({@code <?xml ...?>}) is kept. Nothing is resolved or
 * fetched: without a DOCTYPE there are no external entities left to expand.
 */
public final class MarkupSanitizer {

    // DOCTYPE with an optional bracketed internal subset
    private static final Pattern DOCTYPE = Pattern.compile(
        "<!DOCTYPE[^<>\\[\\]]*(\\[[\\s\\S]*?\\])?[^>]*>", Pattern.CASE_INSENSITIVE);

    // Any PI except the XML declaration
    private static final Pattern PROCESSING_INSTRUCTION = Pattern.compile(
        "<\\?(?!xml\\s)[\\s\\S]*?\\?>", Pattern.CASE_INSENSITIVE);

    private static final Pattern LEADING_DECLARATION = Pattern.compile(
        "^\\s*<\\?xml\\s[\\s\\S]*?\\?>");

    private MarkupSanitizer() {}

    /**
     * Remove every DOCTYPE and every non-declaration processing instruction.
     * Never throws; a construct that does not match (for example an unterminated
     * DOCTYPE) is left in place and fails later in the parser.
     */
    public static String sanitize(String markup) {
        if (markup == null || markup.isEmpty()) {
            return "";
        }
        String withoutDoctype = DOCTYPE.matcher(markup).replaceAll("");
        return PROCESSING_INSTRUCTION.matcher(withoutDoctype).replaceAll("");
    }

    /**
     * True when nothing but whitespace and an optional XML declaration remains.
     */
    public static boolean isBlankDocument(String sanitized) {
        if (sanitized == null || sanitized.isBlank()) {
            return true;
        }
        return LEADING_DECLARATION.matcher(sanitized).replaceFirst("").isBlank();
    }
}
