package im.arun.tokenmap.tree;

import im.arun.tokenmap.model.DisplayNode;
import im.arun.tokenmap.model.ParsedNode;
import im.arun.tokenmap.model.SizeBasis;
import im.arun.tokenmap.model.TransformOptions;
import im.arun.tokenmap.model.TransformResult;
import im.arun.tokenmap.token.TokenCacheView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Turns a parsed tree plus the token cache into a bounded display tree.
 *
 * <p>Pass 1 computes subtree totals post-order. Pass 2 builds display nodes top-down:
 * children are ranked by subtree total, children below the aggregation threshold
 * (a fraction of the whole document's total) are folded into one synthetic
 * "Other" leaf, and the visible-node budget demotes the lowest-ranked survivors into
 * the same leaf when they do not fit. Nodes past the depth limit or the budget are
 * emitted collapsed. Totals are never lost: every display node satisfies
 * {@code totalValue == value + sum(children.totalValue)}.
 *
 * <p>The transformer is pure: the same inputs always produce the same tree.
 */
public class TreeTransformer {
    private static final Logger logger = LoggerFactory.getLogger(TreeTransformer.class);

    static final String ATTR_TAG = "__tag";
    static final String ATTR_GROUP = "__group";
    static final String ATTR_KIND = "__kind";
    static final String ATTR_SEMANTIC = "__semantic";
    static final String ATTR_OWN = "__own";
    static final String ATTR_AGGREGATED = "__aggregated";

    /**
     * Transform with default options.
     */
    public TransformResult transform(ParsedNode root, SizeBasis basis, String modelId, TokenCacheView cache) {
        return transform(root, basis, modelId, cache, TransformOptions.defaults());
    }

    /**
     * @throws IllegalArgumentException for invalid options, before any traversal
     */
    public TransformResult transform(ParsedNode root, SizeBasis basis, String modelId,
                                     TokenCacheView cache, TransformOptions options) {
        TransformOptions effective = options != null ? options : TransformOptions.defaults();
        effective.validate();
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(basis, "basis");
        TokenCacheView tokens = cache != null ? cache : TokenCacheView.empty();

        Map<ParsedNode, NodeStats> stats = computeStats(root, modelId, tokens);
        NodeStats rootStats = stats.get(root);

        BuildState state = new BuildState(effective, basis, stats, rootStats.total(basis));
        DisplayNode tree = build(root, 0, state);

        logger.debug("Transformed tree into {} visible nodes (basis={}, model={})",
            state.visible, basis, modelId);
        return new TransformResult(tree, rootStats.totalTokens, rootStats.totalChars);
    }

    /**
     * Pass 1: post-order subtree totals, iterative so arbitrarily deep documents are safe.
     * Token values come only from the cache, never from the node.
     */
    private Map<ParsedNode, NodeStats> computeStats(ParsedNode root, String modelId, TokenCacheView cache) {
        Map<ParsedNode, NodeStats> stats = new IdentityHashMap<>();
        Deque<ParsedNode> pending = new ArrayDeque<>();
        Deque<ParsedNode> postOrder = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            ParsedNode node = pending.pop();
            postOrder.push(node);
            for (ParsedNode child : node.getChildren()) {
                pending.push(child);
            }
        }

        while (!postOrder.isEmpty()) {
            ParsedNode node = postOrder.pop();
            OptionalInt cached = modelId != null ? cache.get(node.getContentHash(), modelId) : OptionalInt.empty();
            NodeStats nodeStats = new NodeStats(node.getCharCount(), cached.isPresent() ? cached.getAsInt() : null);
            for (ParsedNode child : node.getChildren()) {
                nodeStats.absorb(stats.get(child));
            }
            stats.put(node, nodeStats);
        }
        return stats;
    }

    /**
     * Pass 2 for one node. The caller has already reserved this node's slot.
     */
    private DisplayNode build(ParsedNode node, int depth, BuildState state) {
        state.visible++;

        NodeStats nodeStats = state.stats.get(node);
        long own = nodeStats.own(state.basis);
        long total = nodeStats.total(state.basis);

        // Slots this node's children may use without starving reserved siblings
        int available = state.options.getMaxVisibleNodes() - state.visible - state.reserved;
        if (node.isLeaf() || depth >= state.options.getMaxDepth() || available <= 0) {
            return collapsed(node, own, total, state);
        }

        List<ChildEntry> ranked = new ArrayList<>(node.getChildren().size());
        for (ParsedNode child : node.getChildren()) {
            ranked.add(new ChildEntry(child, state.stats.get(child).total(state.basis)));
        }
        // List.sort is stable: ties keep document order
        ranked.sort(Comparator.comparingLong((ChildEntry e) -> e.total).reversed());

        double smallThreshold = state.options.getAggregationThreshold() * state.rootTotal;
        List<ChildEntry> keep = new ArrayList<>();
        List<ChildEntry> aggregate = new ArrayList<>();
        for (ChildEntry entry : ranked) {
            if (entry.total < smallThreshold) {
                aggregate.add(entry);
            } else {
                keep.add(entry);
            }
        }

        boolean aggregateNeeded = !aggregate.isEmpty();
        int allowedKeep = aggregateNeeded ? available - 1 : available;

        if (keep.size() > allowedKeep) {
            if (!aggregateNeeded) {
                // Threshold alone was not enough: the overflow needs an aggregate slot too
                aggregateNeeded = true;
                allowedKeep = Math.max(0, available - 1);
            }
            // keep is in descending order, so its tail holds the smallest survivors
            List<ChildEntry> demoted = keep.subList(allowedKeep, keep.size());
            aggregate.addAll(demoted);
            demoted.clear();
        }

        state.reserved += keep.size() + (aggregateNeeded ? 1 : 0);

        List<DisplayNode> children = new ArrayList<>(keep.size() + 1);
        for (ChildEntry entry : keep) {
            state.reserved--;
            children.add(build(entry.node, depth + 1, state));
        }

        if (aggregateNeeded) {
            state.reserved--;
            state.visible++;
            children.add(aggregateNode(node, aggregate));
        }

        return DisplayNode.builder()
            .id(node.getId())
            .name(NodeLabels.friendlyName(node))
            .path(node.getPath())
            .value(own)
            .totalValue(total)
            .content(NodeLabels.preview(node, state.options.getPreviewLength()))
            .attributes(decorate(node, null))
            .children(Collections.unmodifiableList(children))
            .build();
    }

    /**
     * A node shown without children; its value absorbs the whole subtree.
     */
    private DisplayNode collapsed(ParsedNode node, long own, long total, BuildState state) {
        return DisplayNode.builder()
            .id(node.getId())
            .name(NodeLabels.friendlyName(node))
            .path(node.getPath())
            .value(total)
            .totalValue(total)
            .content(NodeLabels.preview(node, state.options.getPreviewLength()))
            .attributes(decorate(node, node.isLeaf() ? null : own))
            .build();
    }

    private DisplayNode aggregateNode(ParsedNode parent, List<ChildEntry> aggregated) {
        long sum = 0;
        for (ChildEntry entry : aggregated) {
            sum += entry.total;
        }
        int count = aggregated.size();

        Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put(ATTR_TAG, "other");
        attrs.put(ATTR_GROUP, NodeLabels.groupKey(parent));
        attrs.put(ATTR_AGGREGATED, Integer.toString(count));

        return DisplayNode.builder()
            .id(parent.getId() + "::other")
            .name("Other (" + count + (count == 1 ? " item)" : " items)"))
            .path(parent.getPath() + "/other")
            .value(sum)
            .totalValue(sum)
            .aggregate(true)
            .attributes(Collections.unmodifiableMap(attrs))
            .build();
    }

    private static Map<String, String> decorate(ParsedNode node, Long ownValue) {
        Map<String, String> attrs = new LinkedHashMap<>(node.getAttributes());
        attrs.put(ATTR_TAG, node.getTag());
        attrs.put(ATTR_GROUP, NodeLabels.groupKey(node));
        if (node.getKind() != null) {
            attrs.put(ATTR_KIND, node.getKind().label());
        }
        if (node.getSemanticType() != null) {
            attrs.put(ATTR_SEMANTIC, node.getSemanticType().label());
        }
        if (ownValue != null) {
            attrs.put(ATTR_OWN, Long.toString(ownValue));
        }
        return Collections.unmodifiableMap(attrs);
    }

    private static final class ChildEntry {
        final ParsedNode node;
        final long total;

        ChildEntry(ParsedNode node, long total) {
            this.node = node;
            this.total = total;
        }
    }

    private static final class BuildState {
        final TransformOptions options;
        final SizeBasis basis;
        final Map<ParsedNode, NodeStats> stats;
        final long rootTotal;
        int visible;
        // Slots promised to siblings (and aggregates) that are not built yet
        int reserved;

        BuildState(TransformOptions options, SizeBasis basis, Map<ParsedNode, NodeStats> stats, long rootTotal) {
            this.options = options;
            this.basis = basis;
            this.stats = stats;
            this.rootTotal = rootTotal;
        }
    }
}
