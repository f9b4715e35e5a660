package im.arun.tokenmap.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Token count observed for one node during a tokenization pass.
 */
@Value
@AllArgsConstructor
public class TokenUpdate {

    @JsonProperty("id")
    String id;

    @JsonProperty("hash")
    String hash;

    @JsonProperty("tokens")
    int tokens;

    @JsonProperty("approximate")
    boolean approximate;
}
