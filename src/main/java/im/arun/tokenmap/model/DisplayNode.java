package im.arun.tokenmap.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Render-ready node of the summary tree.
 * {@code totalValue} always equals {@code value} plus the children's {@code totalValue}.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DisplayNode {

    @JsonProperty("id")
    String id;

    @JsonProperty("name")
    String name;

    @JsonProperty("path")
    String path;

    @JsonProperty("value")
    long value;

    @JsonProperty("total_value")
    long totalValue;

    @JsonProperty("content")
    String content;

    @JsonProperty("aggregate")
    boolean aggregate;

    @Builder.Default
    @JsonProperty("attributes")
    Map<String, String> attributes = Map.of();

    @Builder.Default
    @JsonProperty("children")
    List<DisplayNode> children = List.of();
}
