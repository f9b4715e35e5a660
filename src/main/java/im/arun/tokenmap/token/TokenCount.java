package im.arun.tokenmap.token;

import lombok.Value;

/**
 * A token count together with where it came from. {@code approximate} is set for
 * character-derived estimates and for every count of a heuristic tokenizer.
 */
@Value
public class TokenCount {

    public enum Source {
        CACHE,
        ENCODED,
        ESTIMATED
    }

    int tokens;
    Source source;
    boolean approximate;
}
