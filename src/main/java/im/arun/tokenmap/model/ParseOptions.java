package im.arun.tokenmap.model;

import lombok.Builder;
import lombok.Value;

/**
 * Options of a single parse request.
 */
@Value
@Builder(toBuilder = true)
public class ParseOptions {

    @Builder.Default
    boolean preserveAttributes = true;

    @Builder.Default
    boolean honorNamespaces = true;

    /** Keep each element's own text on the node (exact token counts and previews need it). */
    @Builder.Default
    boolean retainText = true;

    public static ParseOptions defaults() {
        return ParseOptions.builder().build();
    }
}
