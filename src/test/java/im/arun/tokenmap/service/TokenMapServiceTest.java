package im.arun.tokenmap.service;

import im.arun.tokenmap.config.ConfigLoader;
import im.arun.tokenmap.config.TokenMapConfig;
import im.arun.tokenmap.model.DisplayNode;
import im.arun.tokenmap.model.ModelTotals;
import im.arun.tokenmap.model.ParsedNode;
import im.arun.tokenmap.model.SizeBasis;
import im.arun.tokenmap.model.TransformOptions;
import im.arun.tokenmap.model.TransformResult;
import im.arun.tokenmap.parse.MarkupParseException;
import im.arun.tokenmap.parse.ParseEvent;
import im.arun.tokenmap.token.ModelCatalog;
import im.arun.tokenmap.token.TokenizeEvent;
import im.arun.tokenmap.token.TokenizerRegistry;
import im.arun.tokenmap.token.UnknownModelException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenMapServiceTest {

    // Heuristic tokenizer: ceil(chars / 4), deterministic and offline
    private static final String MODEL = "claude-3-opus-200k";
    private static final String DOCUMENT = "<r><a>12345678</a><b>1234</b></r>";

    @TempDir
    Path tempDir;

    private TokenMapService service = new TokenMapService(new ConfigLoader().load());

    @AfterEach
    void tearDown() {
        service.close();
    }

    @Test
    void analyze_shouldParseTokenizeAndTransform() {
        // Act
        TransformResult result = service.analyze(DOCUMENT, MODEL, SizeBasis.TOKENS, TransformOptions.defaults())
            .orTimeout(30, TimeUnit.SECONDS).join();

        // Assert
        DisplayNode tree = result.getTree();
        assertThat(tree.getPath()).isEqualTo("r[1]");
        assertThat(tree.getTotalValue()).isEqualTo(3);
        assertThat(tree.getChildren()).extracting(DisplayNode::getValue).containsExactly(2L, 1L);
        assertThat(result.getTotalChars()).isEqualTo(12);
    }

    @Test
    void analyze_shouldRecordTotalsPerModel() {
        // Act
        service.analyze(DOCUMENT, MODEL, SizeBasis.CHARS, null).orTimeout(30, TimeUnit.SECONDS).join();

        // Assert
        ModelTotals totals = service.totalsFor(MODEL).orElseThrow();
        assertThat(totals.getTotalTokens()).isEqualTo(3);
        assertThat(totals.getTotalChars()).isEqualTo(12);
        assertThat(totals.getContextLimit()).isEqualTo(200_000);
        assertThat(totals.contextUsage(0)).isEqualTo(3.0 / 200_000);
        assertThat(service.getTotals()).containsOnlyKeys(MODEL);
    }

    @Test
    void analyze_shouldFailWithParseErrorForMalformedInput() {
        CompletableFuture<TransformResult> future =
            service.analyze("<a><b></a>", MODEL, SizeBasis.TOKENS, TransformOptions.defaults());

        assertThatThrownBy(() -> future.orTimeout(30, TimeUnit.SECONDS).join())
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(MarkupParseException.class);
        assertThat(service.totalsFor(MODEL)).isEmpty();
    }

    @Test
    void analyze_shouldRejectUnknownModelsBeforeParsing() {
        long before = service.currentDocumentId();

        assertThatThrownBy(() -> service.analyze(DOCUMENT, "no-such-model", SizeBasis.TOKENS, null))
            .isInstanceOf(UnknownModelException.class);
        assertThat(service.currentDocumentId()).isEqualTo(before);
    }

    @Test
    void analyze_shouldZoomIntoFocusPath() {
        // Act
        TransformResult result = service.analyze("doc", DOCUMENT, MODEL, SizeBasis.CHARS,
            TransformOptions.defaults(), "r[1]/a[1]").orTimeout(30, TimeUnit.SECONDS).join();

        // Assert
        assertThat(result.getTree().getPath()).isEqualTo("r[1]/a[1]");
        assertThat(result.getTree().getTotalValue()).isEqualTo(8);
        assertThat(service.totalsFor(MODEL)).get().extracting(ModelTotals::getTotalChars).isEqualTo(12L);
    }

    @Test
    void analyze_shouldFailForUnknownFocusPath() {
        CompletableFuture<TransformResult> future = service.analyze("doc", DOCUMENT, MODEL, SizeBasis.CHARS,
            TransformOptions.defaults(), "r[1]/zzz[1]");

        assertThatThrownBy(() -> future.orTimeout(30, TimeUnit.SECONDS).join())
            .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void analyze_shouldDropResultsOfSupersededDocuments() throws Exception {
        // Arrange: hold the parse thread so both requests queue up behind it
        CountDownLatch release = new CountDownLatch(1);
        service.parse("<held/>", event -> {
            if (event.isTerminal()) {
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });

        // Act
        CompletableFuture<TransformResult> stale = service.analyze(DOCUMENT, MODEL, SizeBasis.TOKENS, null);
        CompletableFuture<TransformResult> current = service.analyze("<r><c>fresh</c></r>", MODEL, SizeBasis.TOKENS, null);
        release.countDown();

        // Assert
        assertThatThrownBy(() -> stale.orTimeout(30, TimeUnit.SECONDS).join())
            .hasCauseInstanceOf(CancellationException.class);
        assertThat(current.orTimeout(30, TimeUnit.SECONDS).join().getTree().getPath()).isEqualTo("r[1]");
    }

    @Test
    void parseTokenizeTransform_shouldWorkAsSeparateStages() throws Exception {
        // Arrange
        List<ParseEvent> parseEvents = new CopyOnWriteArrayList<>();
        service.parse(DOCUMENT, parseEvents::add).get(30, TimeUnit.SECONDS);
        ParsedNode root = ((ParseEvent.Done) parseEvents.get(parseEvents.size() - 1)).getRoot();
        List<TokenizeEvent> tokenizeEvents = new CopyOnWriteArrayList<>();

        // Act
        service.tokenize(root, MODEL, tokenizeEvents::add).get(30, TimeUnit.SECONDS);
        TransformResult byTokens = service.transform(root, MODEL, SizeBasis.TOKENS, TransformOptions.defaults());
        TransformResult byChars = service.transform(root, MODEL, SizeBasis.CHARS, TransformOptions.defaults());

        // Assert
        assertThat(tokenizeEvents.get(tokenizeEvents.size() - 1)).isEqualTo(new TokenizeEvent.Done(MODEL, 3, 3));
        assertThat(byTokens.getTree().getTotalValue()).isEqualTo(3);
        assertThat(byChars.getTree().getTotalValue()).isEqualTo(12);
    }

    @Test
    void analyze_shouldWriteRunJournalWhenEnabled() throws Exception {
        // Arrange
        service.close();
        TokenMapConfig config = new ConfigLoader().load(Map.of("run_log", true, "run_log_dir", tempDir.toString()));
        service = new TokenMapService(config);

        // Act
        service.analyze("prompt.xml", DOCUMENT, MODEL, SizeBasis.TOKENS, null, null)
            .orTimeout(30, TimeUnit.SECONDS).join();

        // Assert
        try (Stream<Path> files = Files.list(tempDir)) {
            List<Path> journals = files.toList();
            assertThat(journals).singleElement().satisfies(path -> {
                assertThat(path.getFileName().toString()).startsWith("prompt_").endsWith(".json");
                assertThat(Files.readString(path)).contains("Analysis complete");
            });
        }
    }

    @Test
    void tokenize_shouldDeliverDoneEvenWhenTotalsCannotBeRecorded() throws Exception {
        // Arrange: the walker writes through the adapters, only cache reads fail
        service.close();
        TokenMapConfig config = new ConfigLoader().load();
        TokenizerRegistry failingReads = new TokenizerRegistry(new ModelCatalog(config.getModels())) {
            @Override
            public OptionalInt get(String contentHash, String modelId) {
                throw new IllegalStateException("cache unavailable");
            }
        };
        service = new TokenMapService(config, failingReads);
        List<ParseEvent> parseEvents = new CopyOnWriteArrayList<>();
        service.parse(DOCUMENT, parseEvents::add).get(30, TimeUnit.SECONDS);
        ParsedNode root = ((ParseEvent.Done) parseEvents.get(parseEvents.size() - 1)).getRoot();
        List<TokenizeEvent> tokenizeEvents = new CopyOnWriteArrayList<>();

        // Act
        service.tokenize(root, MODEL, tokenizeEvents::add).get(30, TimeUnit.SECONDS);

        // Assert
        assertThat(tokenizeEvents.get(tokenizeEvents.size() - 1)).isInstanceOf(TokenizeEvent.Done.class);
        assertThat(service.totalsFor(MODEL)).isEmpty();
    }
}
