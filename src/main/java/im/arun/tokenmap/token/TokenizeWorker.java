package im.arun.tokenmap.token;

import im.arun.tokenmap.model.ParsedNode;
import im.arun.tokenmap.model.TokenizeRequest;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

/**
 * Runs tokenization requests on the dedicated tokenize executor, one at a time.
 * A request carries its own tree snapshot; a superseding request does not stop it.
 */
public class TokenizeWorker {
    private final TokenizationWalker walker;
    private final ExecutorService executor;

    public TokenizeWorker(TokenizationWalker walker, ExecutorService executor) {
        this.walker = walker;
        this.executor = executor;
    }

    public CompletableFuture<Void> submit(TokenizeRequest request, Consumer<TokenizeEvent> sink) {
        return submit(request.getRoot(), request.getModelId(), sink);
    }

    public CompletableFuture<Void> submit(ParsedNode root, String modelId, Consumer<TokenizeEvent> sink) {
        return CompletableFuture.runAsync(() -> walker.tokenize(root, modelId, sink), executor);
    }
}
