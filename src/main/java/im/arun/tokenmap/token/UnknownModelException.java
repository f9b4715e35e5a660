package im.arun.tokenmap.token;

/**
 * A model identifier has no registered tokenizer. Raised instead of silently
 * falling back to a default tokenizer.
 */
public class UnknownModelException extends RuntimeException {
    private final String modelId;

    public UnknownModelException(String modelId, Iterable<String> knownModels) {
        super("Unknown model '" + modelId + "'. Known models: " + String.join(", ", knownModels));
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
