package im.arun.tokenmap.token;

import java.util.OptionalInt;

/**
 * Read-only access to cached token counts keyed by {@code (contentHash, modelId)}.
 */
public interface TokenCacheView {

    OptionalInt get(String contentHash, String modelId);

    /**
     * A view with no entries, for character-only transforms.
     */
    static TokenCacheView empty() {
        return (contentHash, modelId) -> OptionalInt.empty();
    }
}
