package im.arun.tokenmap.model;

import lombok.Value;

/**
 * Raw markup plus the options to parse it with.
 */
@Value
public class ParseRequest {
    String text;
    ParseOptions options;
}
