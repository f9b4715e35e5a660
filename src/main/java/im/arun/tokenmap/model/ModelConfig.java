package im.arun.tokenmap.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A selectable model: identifier, context window and tokenizer family.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelConfig {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("context_limit")
    private int contextLimit;

    @JsonProperty("tokenizer")
    private TokenizerType tokenizer;

    // System/tool wrapper overhead added on top of the document
    @JsonProperty("overhead_tokens")
    private int overheadTokens;
}
