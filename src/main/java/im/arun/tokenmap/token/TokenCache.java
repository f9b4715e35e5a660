package im.arun.tokenmap.token;

import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only token count store. Entries are only ever added: a second write for the
 * same key keeps the first value, and nothing is evicted for the process lifetime.
 * Approximate counts must never be written here.
 */
public class TokenCache implements TokenCacheView {
    private final Map<String, Integer> entries = new ConcurrentHashMap<>();

    @Override
    public OptionalInt get(String contentHash, String modelId) {
        Integer value = entries.get(key(contentHash, modelId));
        return value != null ? OptionalInt.of(value) : OptionalInt.empty();
    }

    /**
     * Stores a count unless the key is already present.
     *
     * @return the value now associated with the key
     */
    public int putIfAbsent(String contentHash, String modelId, int tokens) {
        if (tokens < 0) {
            throw new IllegalArgumentException("Token count must not be negative: " + tokens);
        }
        Integer previous = entries.putIfAbsent(key(contentHash, modelId), tokens);
        return previous != null ? previous : tokens;
    }

    public int size() {
        return entries.size();
    }

    private static String key(String contentHash, String modelId) {
        return contentHash + ":" + modelId;
    }
}
