package im.arun.tokenmap.token;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import im.arun.tokenmap.model.TokenizerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exact token counting with JTokkit (Java port of tiktoken) for the OpenAI BPE families.
 */
public class JTokkitTokenizerAdapter extends AbstractTokenizerAdapter {
    private static final Logger logger = LoggerFactory.getLogger(JTokkitTokenizerAdapter.class);
    private final EncodingRegistry registry;
    private final EncodingType encodingType;
    private volatile Encoding encoding;

    public JTokkitTokenizerAdapter(EncodingType encodingType) {
        this(Encodings.newLazyEncodingRegistry(), encodingType);
    }

    public JTokkitTokenizerAdapter(EncodingRegistry registry, EncodingType encodingType) {
        this.registry = registry;
        this.encodingType = encodingType;
    }

    /**
     * Adapter for a BPE tokenizer family.
     *
     * @throws IllegalArgumentException if the family has no JTokkit encoding
     */
    public static JTokkitTokenizerAdapter forType(TokenizerType type) {
        switch (type) {
            case CL100K_BASE:
                return new JTokkitTokenizerAdapter(EncodingType.CL100K_BASE);
            case O200K_BASE:
                return new JTokkitTokenizerAdapter(EncodingType.O200K_BASE);
            default:
                throw new IllegalArgumentException("No JTokkit encoding for tokenizer " + type.id());
        }
    }

    @Override
    public void ensureReady() {
        if (encoding == null) {
            synchronized (this) {
                if (encoding == null) {
                    long start = System.nanoTime();
                    encoding = registry.getEncoding(encodingType);
                    logger.debug("Loaded {} encoding in {} ms", encodingType.getName(),
                        (System.nanoTime() - start) / 1_000_000);
                }
            }
        }
    }

    @Override
    public boolean isExact() {
        return true;
    }

    /**
     * Count tokens in text with this adapter's encoding.
     *
     * @param text The text to count tokens for
     * @return Number of tokens, 0 for null or empty text
     */
    @Override
    public int countText(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        ensureReady();
        return encoding.countTokens(text);
    }
}
