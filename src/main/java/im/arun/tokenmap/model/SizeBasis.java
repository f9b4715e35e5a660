package im.arun.tokenmap.model;

import java.util.Locale;

/**
 * Unit used to size display nodes.
 */
public enum SizeBasis {
    TOKENS,
    CHARS;

    public static SizeBasis fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Size basis must not be null");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "tokens":
                return TOKENS;
            case "chars":
            case "characters":
                return CHARS;
            default:
                throw new IllegalArgumentException("Unknown size basis: " + name);
        }
    }
}
