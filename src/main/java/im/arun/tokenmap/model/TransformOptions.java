package im.arun.tokenmap.model;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregation and level-of-detail settings of the tree transformer.
 */
@Value
@Builder(toBuilder = true)
public class TransformOptions {

    public static final double DEFAULT_AGGREGATION_THRESHOLD = 0.0075;
    public static final int DEFAULT_MAX_VISIBLE_NODES = 2000;
    public static final int UNBOUNDED_DEPTH = Integer.MAX_VALUE;
    public static final int DEFAULT_PREVIEW_LENGTH = 160;

    /** Fraction of the global root total below which a child is folded into "Other". */
    @Builder.Default
    double aggregationThreshold = DEFAULT_AGGREGATION_THRESHOLD;

    @Builder.Default
    int maxVisibleNodes = DEFAULT_MAX_VISIBLE_NODES;

    @Builder.Default
    int maxDepth = UNBOUNDED_DEPTH;

    @Builder.Default
    int previewLength = DEFAULT_PREVIEW_LENGTH;

    public static TransformOptions defaults() {
        return TransformOptions.builder().build();
    }

    /**
     * Rejects settings the transformer cannot honor.
     *
     * @throws IllegalArgumentException on a negative or non-finite threshold, a zero budget,
     *                                  a negative depth or a negative preview length
     */
    public void validate() {
        if (Double.isNaN(aggregationThreshold) || Double.isInfinite(aggregationThreshold)
                || aggregationThreshold < 0 || aggregationThreshold > 1) {
            throw new IllegalArgumentException(
                "aggregationThreshold must be within [0, 1], got " + aggregationThreshold);
        }
        if (maxVisibleNodes < 1) {
            throw new IllegalArgumentException("maxVisibleNodes must be at least 1, got " + maxVisibleNodes);
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative, got " + maxDepth);
        }
        if (previewLength < 0) {
            throw new IllegalArgumentException("previewLength must not be negative, got " + previewLength);
        }
    }
}
