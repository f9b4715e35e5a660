package im.arun.tokenmap.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.tokenmap.model.ModelConfig;
import im.arun.tokenmap.model.ParseOptions;
import im.arun.tokenmap.model.TransformOptions;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TokenMapConfig {
    @JsonProperty("model")
    private String model = "gpt-4o-128k";

    @JsonProperty("basis")
    private String basis = "tokens";

    @JsonProperty("aggregation_threshold")
    private double aggregationThreshold = TransformOptions.DEFAULT_AGGREGATION_THRESHOLD;

    @JsonProperty("max_visible_nodes")
    private int maxVisibleNodes = TransformOptions.DEFAULT_MAX_VISIBLE_NODES;

    // 0 or less means unbounded
    @JsonProperty("max_depth")
    private int maxDepth = 0;

    @JsonProperty("preview_length")
    private int previewLength = TransformOptions.DEFAULT_PREVIEW_LENGTH;

    @JsonProperty("streaming_threshold_chars")
    private int streamingThresholdChars = 2 * 1024 * 1024;

    @JsonProperty("stream_chunk_chars")
    private int streamChunkChars = 64 * 1024;

    @JsonProperty("preserve_attributes")
    private boolean preserveAttributes = true;

    @JsonProperty("honor_namespaces")
    private boolean honorNamespaces = true;

    @JsonProperty("retain_text")
    private boolean retainText = true;

    @JsonProperty("run_log")
    private boolean runLog = false;

    @JsonProperty("run_log_dir")
    private String runLogDir = "./logs";

    @JsonProperty("models")
    private List<ModelConfig> models = new ArrayList<>();

    public ParseOptions toParseOptions() {
        return ParseOptions.builder()
            .preserveAttributes(preserveAttributes)
            .honorNamespaces(honorNamespaces)
            .retainText(retainText)
            .build();
    }

    public TransformOptions toTransformOptions() {
        return TransformOptions.builder()
            .aggregationThreshold(aggregationThreshold)
            .maxVisibleNodes(maxVisibleNodes)
            .maxDepth(maxDepth > 0 ? maxDepth : TransformOptions.UNBOUNDED_DEPTH)
            .previewLength(previewLength)
            .build();
    }
}
