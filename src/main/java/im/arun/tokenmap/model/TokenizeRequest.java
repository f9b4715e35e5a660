package im.arun.tokenmap.model;

import lombok.Value;

@Value
public class TokenizeRequest {
    ParsedNode root;
    String modelId;
}
