package im.arun.tokenmap.token;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Cache handling and the default approximation policy shared by all adapters.
 */
public abstract class AbstractTokenizerAdapter implements TokenizerAdapter {
    protected static final int DEFAULT_CHARS_PER_TOKEN = 4;

    private final TokenCache cache = new TokenCache();
    private final int charsPerToken;

    protected AbstractTokenizerAdapter() {
        this(DEFAULT_CHARS_PER_TOKEN);
    }

    protected AbstractTokenizerAdapter(int charsPerToken) {
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be positive, got " + charsPerToken);
        }
        this.charsPerToken = charsPerToken;
    }

    @Override
    public void ensureReady() {
        // nothing to load by default
    }

    @Override
    public int approximateFromChars(int charCount) {
        if (charCount <= 0) {
            return 0;
        }
        return Math.max(1, (charCount + charsPerToken - 1) / charsPerToken);
    }

    @Override
    public OptionalInt cacheGet(String contentHash, String modelId) {
        return cache.get(contentHash, modelId);
    }

    @Override
    public void cacheSet(String contentHash, String modelId, int tokens) {
        cache.putIfAbsent(contentHash, modelId, tokens);
    }

    @Override
    public Optional<TokenCount> getOrCount(String contentHash, String modelId, String text,
                                           boolean allowApprox, Integer charCount) {
        OptionalInt cached = cacheGet(contentHash, modelId);
        if (cached.isPresent()) {
            return Optional.of(new TokenCount(cached.getAsInt(), TokenCount.Source.CACHE, !isExact()));
        }

        if (text != null) {
            int tokens = countText(text);
            cacheSet(contentHash, modelId, tokens);
            return Optional.of(new TokenCount(tokens, TokenCount.Source.ENCODED, !isExact()));
        }

        // Estimates stay out of the cache so a later exact count can still land
        if (allowApprox && charCount != null) {
            return Optional.of(new TokenCount(approximateFromChars(charCount), TokenCount.Source.ESTIMATED, true));
        }

        return Optional.empty();
    }

    TokenCache cache() {
        return cache;
    }
}
