package im.arun.tokenmap.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * One element of the source document.
 * Created once by the parser and never mutated afterwards; token counts are kept
 * in the token cache keyed by {@code (contentHash, modelId)}, not on the node.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ParsedNode {

    @JsonProperty("id")
    String id;

    @JsonProperty("path")
    String path;

    @JsonProperty("tag")
    String tag;

    @Builder.Default
    @JsonProperty("attributes")
    Map<String, String> attributes = Map.of();

    @JsonProperty("kind")
    NodeKind kind;

    @JsonProperty("semantic_type")
    SemanticType semanticType;

    @JsonProperty("char_count")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    int charCount;

    @JsonProperty("content_hash")
    String contentHash;

    /** Own text content, or null when the parse did not retain text. */
    @JsonProperty("text")
    String text;

    @Builder.Default
    @JsonProperty("children")
    List<ParsedNode> children = List.of();

    @JsonIgnore
    public boolean isLeaf() {
        return children.isEmpty();
    }
}
