package im.arun.tokenmap.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Display tree plus the grand totals of the transformed document.
 */
@Value
@AllArgsConstructor
public class TransformResult {

    @JsonProperty("tree")
    DisplayNode tree;

    /** Tokens where cached, characters as fallback for nodes without a count. */
    @JsonProperty("total_tokens")
    long totalTokens;

    @JsonProperty("total_chars")
    long totalChars;
}
