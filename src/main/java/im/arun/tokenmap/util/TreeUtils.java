package im.arun.tokenmap.util;

import im.arun.tokenmap.model.DisplayNode;
import im.arun.tokenmap.model.ParsedNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Utility methods for walking parsed and display trees.
 */
public class TreeUtils {

    /**
     * Count all nodes of a parsed tree, root included, breadth-first.
     */
    public static int countNodes(ParsedNode root) {
        if (root == null) {
            return 0;
        }
        int count = 0;
        Deque<ParsedNode> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            ParsedNode node = queue.poll();
            count++;
            queue.addAll(node.getChildren());
        }
        return count;
    }

    /**
     * Count all nodes of a display tree, synthetic aggregates included.
     */
    public static int countNodes(DisplayNode root) {
        if (root == null) {
            return 0;
        }
        int count = 1;
        for (DisplayNode child : root.getChildren()) {
            count += countNodes(child);
        }
        return count;
    }

    /**
     * Sum of own character counts over the whole subtree.
     */
    public static long totalChars(ParsedNode root) {
        long[] total = {0};
        forEachPreOrder(root, node -> total[0] += node.getCharCount());
        return total[0];
    }

    /**
     * Depth of the deepest node; a lone root has depth 0.
     */
    public static int maxDepth(DisplayNode root) {
        int deepest = 0;
        for (DisplayNode child : root.getChildren()) {
            deepest = Math.max(deepest, 1 + maxDepth(child));
        }
        return deepest;
    }

    /**
     * Visit every node in document order without recursion, so very deep trees are safe.
     */
    public static void forEachPreOrder(ParsedNode root, Consumer<ParsedNode> visitor) {
        if (root == null) {
            return;
        }
        Deque<ParsedNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            ParsedNode node = stack.pop();
            visitor.accept(node);
            for (int i = node.getChildren().size() - 1; i >= 0; i--) {
                stack.push(node.getChildren().get(i));
            }
        }
    }

    /**
     * Locate a node by its structural path, e.g. {@code "prompt[1]/files[1]/file[3]"}.
     * Follows the path segment by segment instead of scanning the whole tree.
     */
    public static Optional<ParsedNode> findByPath(ParsedNode root, String path) {
        if (root == null || path == null || path.isEmpty()) {
            return Optional.empty();
        }
        if (!path.equals(root.getPath()) && !path.startsWith(root.getPath() + "/")) {
            return Optional.empty();
        }

        ParsedNode current = root;
        while (!current.getPath().equals(path)) {
            ParsedNode next = null;
            for (ParsedNode child : current.getChildren()) {
                String childPath = child.getPath();
                if (path.equals(childPath) || path.startsWith(childPath + "/")) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                return Optional.empty();
            }
            current = next;
        }
        return Optional.of(current);
    }
}
