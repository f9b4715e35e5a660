package im.arun.tokenmap.token;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Token counting for one tokenizer family, with its own cache.
 * One instance exists per family for the lifetime of a {@link TokenizerRegistry}.
 */
public interface TokenizerAdapter {

    /**
     * Load the underlying encoder. Idempotent.
     */
    void ensureReady();

    /**
     * Whether {@link #countText(String)} runs the model's real tokenizer. Heuristic
     * adapters return false and all their counts are flagged approximate.
     */
    boolean isExact();

    int countText(String text);

    /**
     * Estimate from a character count: {@code ceil(chars / charsPerToken)}, at least 1
     * for positive input, 0 otherwise.
     */
    int approximateFromChars(int charCount);

    OptionalInt cacheGet(String contentHash, String modelId);

    void cacheSet(String contentHash, String modelId, int tokens);

    /**
     * Cached count if present; else an exact count of {@code text} (cached); else, when
     * {@code allowApprox} and a character count are given, an uncached estimate; else empty.
     *
     * @param text      own text of the node, or null when not available
     * @param charCount character count for estimation, or null
     */
    Optional<TokenCount> getOrCount(String contentHash, String modelId, String text,
                                    boolean allowApprox, Integer charCount);
}
