package im.arun.tokenmap.util;

import net.openhft.hashing.LongHashFunction;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Deterministic content hashing of an element's (sorted attributes, own text) pair.
 * Produces a 16-character lowercase hex xxHash64 digest (seed 0) over the UTF-8 bytes
 * of {@code k1=v1|k2=v2|text}.
 */
public final class ContentHasher {
    private static final LongHashFunction XX64 = LongHashFunction.xx();
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private ContentHasher() {}

    /**
     * Hash of an element's canonical content.
     *
     * @param attributes attribute map, may be null or empty
     * @param text       own text, may be null
     */
    public static String hash(Map<String, String> attributes, String text) {
        return hashString(stableAttributeString(attributes) + "|" + (text == null ? "" : text));
    }

    /**
     * Serializes attributes as {@code k=v} pairs sorted by key and joined with {@code |}.
     */
    public static String stableAttributeString(Map<String, String> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return "";
        }
        List<String> keys = new ArrayList<>(attributes.keySet());
        keys.sort(null);
        StringBuilder sb = new StringBuilder();
        for (String key : keys) {
            String value = attributes.get(key);
            if (key == null || value == null) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append('|');
            }
            sb.append(key).append('=').append(value);
        }
        return sb.toString();
    }

    public static String hashString(String input) {
        return toHex64(XX64.hashBytes(input.getBytes(StandardCharsets.UTF_8)));
    }

    static String toHex64(long value) {
        char[] out = new char[16];
        for (int i = 15; i >= 0; i--) {
            out[i] = HEX[(int) (value & 0xF)];
            value >>>= 4;
        }
        return new String(out);
    }
}
