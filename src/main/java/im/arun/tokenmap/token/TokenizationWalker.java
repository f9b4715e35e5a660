package im.arun.tokenmap.token;

import im.arun.tokenmap.model.ParsedNode;
import im.arun.tokenmap.model.TokenUpdate;
import im.arun.tokenmap.util.EmissionThrottle;
import im.arun.tokenmap.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Breadth-first token counting over a parsed tree. Every node yields an update, cache
 * hit or not; updates are flushed in batches at most every {@value #BATCH_INTERVAL_MS} ms
 * and once more at the end.
 */
public class TokenizationWalker {
    private static final Logger logger = LoggerFactory.getLogger(TokenizationWalker.class);
    static final long BATCH_INTERVAL_MS = 16;

    private final TokenizerRegistry registry;
    private final LongSupplier nanoClock;

    public TokenizationWalker(TokenizerRegistry registry) {
        this(registry, System::nanoTime);
    }

    public TokenizationWalker(TokenizerRegistry registry, LongSupplier nanoClock) {
        this.registry = registry;
        this.nanoClock = nanoClock;
    }

    /**
     * Tokenize a tree for a model, reporting through the sink. Failures, including an
     * unknown model, end the pass with {@link TokenizeEvent.Error}; counts cached before
     * the failure stay cached.
     */
    public void tokenize(ParsedNode root, String modelId, Consumer<TokenizeEvent> sink) {
        AtomicBoolean terminated = new AtomicBoolean(false);
        Consumer<TokenizeEvent> guarded = event -> {
            if (event.isTerminal()) {
                terminated.set(true);
            }
            sink.accept(event);
        };
        try {
            walk(root, modelId, guarded);
        } catch (RuntimeException e) {
            logger.warn("Tokenization for model {} failed: {}", modelId, e.getMessage());
            if (!terminated.get()) {
                sink.accept(new TokenizeEvent.Error(String.valueOf(e.getMessage())));
            }
        }
    }

    private void walk(ParsedNode root, String modelId, Consumer<TokenizeEvent> sink) {
        TokenizerAdapter adapter = registry.adapterFor(modelId);
        adapter.ensureReady();

        int totalNodes = TreeUtils.countNodes(root);
        int processed = 0;
        long totalTokens = 0;
        int approximateNodes = 0;

        List<TokenUpdate> buffer = new ArrayList<>();
        EmissionThrottle flushWindow = new EmissionThrottle(BATCH_INTERVAL_MS, nanoClock);

        Deque<ParsedNode> queue = new ArrayDeque<>();
        if (root != null) {
            queue.add(root);
        }

        while (!queue.isEmpty()) {
            ParsedNode node = queue.poll();
            // Enqueue before counting to keep the queue evenly populated
            queue.addAll(node.getChildren());

            String text = node.getText();
            Optional<TokenCount> count = adapter.getOrCount(node.getContentHash(), modelId, text,
                text == null, node.getCharCount());

            int tokens = count.map(TokenCount::getTokens).orElse(0);
            boolean approximate = count.map(TokenCount::isApproximate).orElse(true);
            buffer.add(new TokenUpdate(node.getId(), node.getContentHash(), tokens, approximate));

            processed++;
            totalTokens += tokens;
            if (approximate) {
                approximateNodes++;
            }

            if (flushWindow.tryAcquire()) {
                flush(buffer, processed, totalNodes, sink);
                // Give the host scheduler a turn when the next window is already used up
                if (flushWindow.elapsed()) {
                    Thread.yield();
                }
            }
        }

        flush(buffer, processed, totalNodes, sink);
        logger.info("Tokenized {} nodes for {}: {} tokens ({} approximate)",
            processed, modelId, totalTokens, approximateNodes);
        sink.accept(new TokenizeEvent.Done(modelId, totalTokens, approximateNodes));
    }

    private static void flush(List<TokenUpdate> buffer, int processed, int total, Consumer<TokenizeEvent> sink) {
        if (!buffer.isEmpty()) {
            sink.accept(new TokenizeEvent.Partial(List.copyOf(buffer)));
            buffer.clear();
        }
        sink.accept(new TokenizeEvent.Progress(processed, total));
    }
}
