package im.arun.tokenmap.tree;

import im.arun.tokenmap.model.SizeBasis;

/**
 * Own and subtree sizes of one parsed node. Token totals fall back to the character
 * count for nodes without a cached count, so partially tokenized trees still get a
 * usable estimate that improves as counts arrive.
 */
final class NodeStats {
    final int ownChars;
    /** Cached own token count, or null. */
    final Integer ownTokens;
    long totalChars;
    long totalTokens;

    NodeStats(int ownChars, Integer ownTokens) {
        this.ownChars = ownChars;
        this.ownTokens = ownTokens;
        this.totalChars = ownChars;
        this.totalTokens = ownTokens != null ? ownTokens : ownChars;
    }

    void absorb(NodeStats child) {
        totalChars += child.totalChars;
        totalTokens += child.totalTokens;
    }

    long own(SizeBasis basis) {
        if (basis == SizeBasis.TOKENS) {
            return ownTokens != null ? ownTokens : ownChars;
        }
        return ownChars;
    }

    long total(SizeBasis basis) {
        return basis == SizeBasis.TOKENS ? totalTokens : totalChars;
    }
}
