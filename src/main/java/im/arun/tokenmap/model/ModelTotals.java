package im.arun.tokenmap.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Grand totals of a document under one model.
 */
@Value
@AllArgsConstructor
public class ModelTotals {

    @JsonProperty("model_id")
    String modelId;

    @JsonProperty("total_tokens")
    long totalTokens;

    @JsonProperty("total_chars")
    long totalChars;

    @JsonProperty("context_limit")
    int contextLimit;

    /**
     * Share of the model's context window the document occupies, or 0 when the limit is unknown.
     */
    public double contextUsage(int overheadTokens) {
        if (contextLimit <= 0) {
            return 0.0;
        }
        return (double) (totalTokens + overheadTokens) / contextLimit;
    }
}
