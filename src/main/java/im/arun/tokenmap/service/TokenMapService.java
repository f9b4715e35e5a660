package im.arun.tokenmap.service;

import im.arun.tokenmap.config.TokenMapConfig;
import im.arun.tokenmap.model.ModelConfig;
import im.arun.tokenmap.model.ModelTotals;
import im.arun.tokenmap.model.ParseRequest;
import im.arun.tokenmap.model.ParsedNode;
import im.arun.tokenmap.model.SizeBasis;
import im.arun.tokenmap.model.TokenizeRequest;
import im.arun.tokenmap.model.TransformOptions;
import im.arun.tokenmap.model.TransformResult;
import im.arun.tokenmap.parse.MarkupParseException;
import im.arun.tokenmap.parse.MarkupParser;
import im.arun.tokenmap.parse.ParseEvent;
import im.arun.tokenmap.parse.ParseWorker;
import im.arun.tokenmap.token.ModelCatalog;
import im.arun.tokenmap.token.TokenizationWalker;
import im.arun.tokenmap.token.TokenizeEvent;
import im.arun.tokenmap.token.TokenizeWorker;
import im.arun.tokenmap.token.TokenizerRegistry;
import im.arun.tokenmap.tree.TreeTransformer;
import im.arun.tokenmap.util.JsonLogger;
import im.arun.tokenmap.util.TreeUtils;
import im.arun.tokenmap.util.WorkerExecutors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Orchestrates parse, tokenize and transform for one document at a time.
 *
 * <p>Owns the long-lived handles: the tokenizer registry (and so the token cache), the
 * two worker executors and the transformer. Each parse gets a new document id; results
 * of {@link #analyze} that belong to a superseded document complete with a
 * {@link CancellationException} instead of being delivered.
 */
public class TokenMapService implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TokenMapService.class);

    private final TokenMapConfig config;
    private final TokenizerRegistry registry;
    private final WorkerExecutors executors;
    private final ParseWorker parseWorker;
    private final TokenizeWorker tokenizeWorker;
    private final TreeTransformer transformer;
    private final Map<String, ModelTotals> totalsByModel = new ConcurrentHashMap<>();
    private final AtomicLong documentIds = new AtomicLong();

    public TokenMapService(TokenMapConfig config) {
        this(config, new TokenizerRegistry(new ModelCatalog(config.getModels())));
    }

    public TokenMapService(TokenMapConfig config, TokenizerRegistry registry) {
        this.config = config;
        this.registry = registry;
        this.executors = new WorkerExecutors();
        MarkupParser parser = new MarkupParser(config.getStreamingThresholdChars(), config.getStreamChunkChars());
        this.parseWorker = new ParseWorker(parser, executors.parseExecutor());
        this.tokenizeWorker = new TokenizeWorker(new TokenizationWalker(registry), executors.tokenizeExecutor());
        this.transformer = new TreeTransformer();
    }

    public TokenizerRegistry getRegistry() {
        return registry;
    }

    /**
     * Parses a new document. Starts a new document id, which makes earlier
     * {@link #analyze} calls stale.
     */
    public CompletableFuture<Void> parse(String text, Consumer<ParseEvent> sink) {
        long documentId = documentIds.incrementAndGet();
        logger.debug("Parsing document {} ({} chars)", documentId, text == null ? 0 : text.length());
        return parseWorker.submit(new ParseRequest(text, config.toParseOptions()), sink);
    }

    /**
     * Counts tokens for every node of {@code root}. On completion the totals for the
     * model are recorded, see {@link #totalsFor(String)}.
     */
    public CompletableFuture<Void> tokenize(ParsedNode root, String modelId, Consumer<TokenizeEvent> sink) {
        return tokenizeWorker.submit(new TokenizeRequest(root, modelId), event -> {
            if (event instanceof TokenizeEvent.Done) {
                try {
                    recordTotals(root, modelId);
                } catch (RuntimeException e) {
                    // Done still reaches the caller; only the totals are missing
                    logger.warn("Could not record totals for model {}: {}", modelId, e.getMessage(), e);
                }
            }
            sink.accept(event);
        });
    }

    /**
     * Builds the display tree from whatever counts are cached right now.
     */
    public TransformResult transform(ParsedNode root, String modelId, SizeBasis basis, TransformOptions options) {
        return transformer.transform(root, basis, modelId, registry, options);
    }

    /**
     * Transforms only the subtree at {@code path}, so its children get the whole budget.
     *
     * @throws IllegalArgumentException when no node has that path
     */
    public TransformResult focus(ParsedNode root, String path, String modelId, SizeBasis basis,
                                 TransformOptions options) {
        ParsedNode subtree = TreeUtils.findByPath(root, path)
            .orElseThrow(() -> new IllegalArgumentException("No node at path: " + path));
        return transform(subtree, modelId, basis, options);
    }

    public CompletableFuture<TransformResult> analyze(String text, String modelId, SizeBasis basis,
                                                      TransformOptions options) {
        return analyze("document", text, modelId, basis, options);
    }

    public CompletableFuture<TransformResult> analyze(String documentName, String text, String modelId,
                                                      SizeBasis basis, TransformOptions options) {
        return analyze(documentName, text, modelId, basis, options, null);
    }

    /**
     * Parse, tokenize and transform in sequence, optionally zoomed to the subtree at
     * {@code focusPath}. Totals are always recorded for the whole document.
     *
     * <p>Fails with {@link MarkupParseException} for malformed input, with
     * {@link IllegalStateException} when tokenization fails and with
     * {@link IllegalArgumentException} for an unknown focus path. An unknown model is
     * rejected before anything is parsed.
     */
    public CompletableFuture<TransformResult> analyze(String documentName, String text, String modelId,
                                                      SizeBasis basis, TransformOptions options,
                                                      String focusPath) {
        registry.catalog().require(modelId);
        TransformOptions effective = options != null ? options : config.toTransformOptions();
        effective.validate();

        JsonLogger runLog = config.isRunLog() ? new JsonLogger(documentName, Paths.get(config.getRunLogDir())) : null;
        long documentId = documentIds.incrementAndGet();
        journal(runLog, "Analysis started", Map.of("document_id", documentId, "model", modelId,
            "chars", text == null ? 0 : text.length()));

        CompletableFuture<ParsedNode> parsed = new CompletableFuture<>();
        parseWorker.submit(new ParseRequest(text, config.toParseOptions()), event -> {
            if (event instanceof ParseEvent.Done) {
                parsed.complete(((ParseEvent.Done) event).getRoot());
            } else if (event instanceof ParseEvent.Error) {
                ParseEvent.Error error = (ParseEvent.Error) event;
                parsed.completeExceptionally(
                    new MarkupParseException(error.getMessage(), error.getLine(), error.getColumn()));
            }
        });

        return parsed
            .thenCompose(root -> {
                journal(runLog, "Parsed", Map.of("nodes", TreeUtils.countNodes(root)));
                return tokenizeAndWait(root, modelId);
            })
            .thenApply(root -> {
                if (documentIds.get() != documentId) {
                    throw new CancellationException("Document " + documentId + " was superseded");
                }
                TransformResult result = focusPath == null
                    ? transform(root, modelId, basis, effective)
                    : focus(root, focusPath, modelId, basis, effective);
                journal(runLog, "Analysis complete", Map.of("total_tokens", result.getTotalTokens(),
                    "total_chars", result.getTotalChars(),
                    "visible_nodes", TreeUtils.countNodes(result.getTree())));
                return result;
            })
            .whenComplete((result, error) -> {
                if (error != null) {
                    logger.warn("Analysis of document {} did not complete: {}", documentId, error.getMessage());
                    if (runLog != null) {
                        runLog.error("Analysis failed", Map.of("error", String.valueOf(error.getMessage())));
                    }
                }
            });
    }

    private CompletableFuture<ParsedNode> tokenizeAndWait(ParsedNode root, String modelId) {
        CompletableFuture<ParsedNode> tokenized = new CompletableFuture<>();
        tokenize(root, modelId, event -> {
            if (event instanceof TokenizeEvent.Done) {
                tokenized.complete(root);
            } else if (event instanceof TokenizeEvent.Error) {
                tokenized.completeExceptionally(
                    new IllegalStateException("Tokenization failed: " + ((TokenizeEvent.Error) event).getMessage()));
            }
        });
        return tokenized;
    }

    private void recordTotals(ParsedNode root, String modelId) {
        TransformResult totals = transformer.transform(root, SizeBasis.TOKENS, modelId, registry,
            TransformOptions.builder().maxDepth(0).build());
        int contextLimit = registry.catalog().find(modelId).map(ModelConfig::getContextLimit).orElse(0);
        totalsByModel.put(modelId, new ModelTotals(modelId, totals.getTotalTokens(), totals.getTotalChars(), contextLimit));
    }

    private static void journal(JsonLogger runLog, String message, Map<String, ?> details) {
        if (runLog != null) {
            runLog.info(message, details);
        }
    }

    /**
     * Totals of the last document tokenized for a model.
     */
    public Optional<ModelTotals> totalsFor(String modelId) {
        return Optional.ofNullable(totalsByModel.get(modelId));
    }

    public Map<String, ModelTotals> getTotals() {
        return Collections.unmodifiableMap(totalsByModel);
    }

    public long currentDocumentId() {
        return documentIds.get();
    }

    @Override
    public void close() {
        executors.close();
    }
}
