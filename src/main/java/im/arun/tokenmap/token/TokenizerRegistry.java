package im.arun.tokenmap.token;

import im.arun.tokenmap.model.ModelConfig;
import im.arun.tokenmap.model.TokenizerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * One {@link TokenizerAdapter} per tokenizer family, shared by every model of that
 * family. Constructed once by the orchestrator and passed to whoever needs counts;
 * also serves as the read-only cache view for the transformer.
 */
public class TokenizerRegistry implements TokenCacheView {
    private static final Logger logger = LoggerFactory.getLogger(TokenizerRegistry.class);

    private final ModelCatalog catalog;
    private final Function<TokenizerType, TokenizerAdapter> adapterFactory;
    private final Map<TokenizerType, TokenizerAdapter> adapters = new EnumMap<>(TokenizerType.class);

    public TokenizerRegistry(ModelCatalog catalog) {
        this(catalog, TokenizerRegistry::defaultAdapter);
    }

    public TokenizerRegistry(ModelCatalog catalog, Function<TokenizerType, TokenizerAdapter> adapterFactory) {
        this.catalog = catalog;
        this.adapterFactory = adapterFactory;
    }

    static TokenizerAdapter defaultAdapter(TokenizerType type) {
        switch (type) {
            case CL100K_BASE:
            case O200K_BASE:
                return JTokkitTokenizerAdapter.forType(type);
            case CLAUDE:
            case GEMINI:
            case CUSTOM:
            default:
                return new HeuristicTokenizerAdapter();
        }
    }

    /**
     * Adapter for a model id.
     *
     * @throws UnknownModelException when the id is not in the catalog
     */
    public TokenizerAdapter adapterFor(String modelId) {
        ModelConfig model = catalog.require(modelId);
        return adapterForType(model.getTokenizer());
    }

    public synchronized TokenizerAdapter adapterForType(TokenizerType type) {
        return adapters.computeIfAbsent(type, t -> {
            logger.debug("Creating tokenizer adapter for {}", t.id());
            return adapterFactory.apply(t);
        });
    }

    public ModelCatalog catalog() {
        return catalog;
    }

    /**
     * Cached count for a model; unknown models simply have no entries.
     */
    @Override
    public OptionalInt get(String contentHash, String modelId) {
        return catalog.find(modelId)
            .map(model -> adapterForType(model.getTokenizer()).cacheGet(contentHash, modelId))
            .orElse(OptionalInt.empty());
    }
}
