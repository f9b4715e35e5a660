package im.arun.tokenmap.token;

import im.arun.tokenmap.model.ModelConfig;
import im.arun.tokenmap.model.TokenizerType;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The selectable models, keyed by id.
 */
public class ModelCatalog {
    private final Map<String, ModelConfig> models;

    public ModelCatalog(Collection<ModelConfig> models) {
        Map<String, ModelConfig> byId = new LinkedHashMap<>();
        for (ModelConfig model : models) {
            if (model.getId() == null || model.getTokenizer() == null) {
                throw new IllegalArgumentException("Model entries need an id and a tokenizer: " + model);
            }
            if (byId.putIfAbsent(model.getId(), model) != null) {
                throw new IllegalArgumentException("Duplicate model id: " + model.getId());
            }
        }
        this.models = Collections.unmodifiableMap(byId);
    }

    public static ModelCatalog defaults() {
        return new ModelCatalog(defaultModels());
    }

    /**
     * Built-in catalog used when the configuration lists no models.
     */
    public static List<ModelConfig> defaultModels() {
        return List.of(
            new ModelConfig("gpt-4-128k", "GPT-4 (128k)", 128_000, TokenizerType.CL100K_BASE, 0),
            new ModelConfig("gpt-4o-128k", "GPT-4o (128k)", 128_000, TokenizerType.O200K_BASE, 0),
            new ModelConfig("claude-3-opus-200k", "Claude 3 Opus (200k)", 200_000, TokenizerType.CLAUDE, 0),
            new ModelConfig("claude-3.5-sonnet-200k", "Claude 3.5 Sonnet (200k)", 200_000, TokenizerType.CLAUDE, 0),
            new ModelConfig("gemini-1.5-pro-1m", "Gemini 1.5 Pro (1M)", 1_000_000, TokenizerType.GEMINI, 0)
        );
    }

    public Optional<ModelConfig> find(String modelId) {
        return Optional.ofNullable(models.get(modelId));
    }

    public ModelConfig require(String modelId) {
        ModelConfig model = modelId == null ? null : models.get(modelId);
        if (model == null) {
            throw new UnknownModelException(modelId, models.keySet());
        }
        return model;
    }

    public Collection<ModelConfig> all() {
        return models.values();
    }
}
