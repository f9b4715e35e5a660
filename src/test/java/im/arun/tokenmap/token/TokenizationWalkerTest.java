package im.arun.tokenmap.token;

import im.arun.tokenmap.model.ParseOptions;
import im.arun.tokenmap.model.ParsedNode;
import im.arun.tokenmap.model.TokenUpdate;
import im.arun.tokenmap.parse.MarkupParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class TokenizationWalkerTest {

    private static final String MODEL = "gpt-4-128k";

    private final CountingTokenizerAdapter adapter = new CountingTokenizerAdapter();
    private final TokenizerRegistry registry = new TokenizerRegistry(ModelCatalog.defaults(), type -> adapter);
    // A clock that never moves: everything is flushed once, at the end
    private final TokenizationWalker walker = new TokenizationWalker(registry, () -> 0L);

    private static ParsedNode parse(String markup) throws Exception {
        return new MarkupParser().parse(markup, ParseOptions.defaults());
    }

    private List<TokenizeEvent> tokenize(ParsedNode root, String modelId) {
        List<TokenizeEvent> events = new ArrayList<>();
        walker.tokenize(root, modelId, events::add);
        return events;
    }

    private static List<TokenUpdate> updates(List<TokenizeEvent> events) {
        return events.stream()
            .filter(e -> e instanceof TokenizeEvent.Partial)
            .flatMap(e -> ((TokenizeEvent.Partial) e).getUpdates().stream())
            .collect(Collectors.toList());
    }

    @Test
    void tokenize_shouldVisitNodesBreadthFirst() throws Exception {
        // Arrange
        ParsedNode root = parse("<a><b><d>x</d></b><c>y</c></a>");

        // Act
        List<TokenizeEvent> events = tokenize(root, MODEL);

        // Assert
        assertThat(updates(events)).extracting(TokenUpdate::getId)
            .containsExactly("a[1]", "a[1]/b[1]", "a[1]/c[1]", "a[1]/b[1]/d[1]");
    }

    @Test
    void tokenize_shouldEndWithFinalFlushAndDone() throws Exception {
        // Arrange
        ParsedNode root = parse("<a><b>one two</b><c>three</c></a>");

        // Act
        List<TokenizeEvent> events = tokenize(root, MODEL);

        // Assert
        assertThat(events).hasSize(3);
        assertThat(events.get(0)).isInstanceOf(TokenizeEvent.Partial.class);
        assertThat(events.get(1)).isEqualTo(new TokenizeEvent.Progress(3, 3));
        assertThat(events.get(2)).isEqualTo(new TokenizeEvent.Done(MODEL, 3, 0));
    }

    @Test
    void tokenize_shouldEncodeDuplicateContentOnce() throws Exception {
        // Arrange
        ParsedNode root = parse("<r><x>hello</x><y>hello</y></r>");

        // Act
        List<TokenizeEvent> events = tokenize(root, MODEL);

        // Assert
        assertThat(adapter.encodeCount("hello")).isEqualTo(1);
        assertThat(updates(events)).filteredOn(u -> !u.getId().equals("r[1]"))
            .extracting(TokenUpdate::getTokens).containsExactly(1, 1);
        assertThat(registry.get(root.getChildren().get(1).getContentHash(), MODEL)).hasValue(1);
    }

    @Test
    void tokenize_shouldSkipTheEncoderOnASecondPass() throws Exception {
        // Arrange
        ParsedNode root = parse("<a><b>one two</b><c>three</c></a>");
        tokenize(root, MODEL);
        int encodedAfterFirstPass = adapter.encoded().size();

        // Act
        tokenize(root, MODEL);

        // Assert
        assertThat(adapter.encoded()).hasSize(encodedAfterFirstPass);
    }

    @Test
    void tokenize_shouldEstimateNodesWithoutRetainedText() throws Exception {
        // Arrange
        ParsedNode root = new MarkupParser().parse("<a>12345678</a>",
            ParseOptions.builder().retainText(false).build());

        // Act
        List<TokenizeEvent> events = tokenize(root, MODEL);

        // Assert
        assertThat(updates(events)).singleElement()
            .satisfies(u -> {
                assertThat(u.getTokens()).isEqualTo(2);
                assertThat(u.isApproximate()).isTrue();
            });
        assertThat(events.get(events.size() - 1)).isEqualTo(new TokenizeEvent.Done(MODEL, 2, 1));
        assertThat(registry.get(root.getContentHash(), MODEL)).isEmpty();
    }

    @Test
    void tokenize_shouldReportUnknownModelAsError() throws Exception {
        // Act
        List<TokenizeEvent> events = tokenize(parse("<a>x</a>"), "no-such-model");

        // Assert
        assertThat(events).singleElement().isInstanceOf(TokenizeEvent.Error.class);
        assertThat(((TokenizeEvent.Error) events.get(0)).getMessage()).contains("no-such-model");
        assertThat(adapter.encoded()).isEmpty();
    }

    @Test
    void tokenize_shouldKeepCountsCachedBeforeAFailure() throws Exception {
        // Arrange
        CountingTokenizerAdapter failing = new CountingTokenizerAdapter(3);
        TokenizerRegistry failingRegistry = new TokenizerRegistry(ModelCatalog.defaults(), type -> failing);
        TokenizationWalker failingWalker = new TokenizationWalker(failingRegistry, () -> 0L);
        ParsedNode root = parse("<a><b>one</b><c>two</c></a>");
        List<TokenizeEvent> events = new ArrayList<>();

        // Act
        failingWalker.tokenize(root, MODEL, events::add);

        // Assert
        assertThat(events).filteredOn(TokenizeEvent::isTerminal).singleElement()
            .isInstanceOf(TokenizeEvent.Error.class);
        assertThat(failingRegistry.get(root.getContentHash(), MODEL)).isPresent();
        assertThat(failingRegistry.get(root.getChildren().get(0).getContentHash(), MODEL)).hasValue(1);
        assertThat(failingRegistry.get(root.getChildren().get(1).getContentHash(), MODEL)).isEmpty();
    }

    @Test
    void tokenize_shouldFlushBatchesAsTimePasses() throws Exception {
        // Arrange
        AtomicLong clock = new AtomicLong();
        TokenizationWalker ticking = new TokenizationWalker(registry,
            () -> clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(10)));
        ParsedNode root = parse("<a><b>1</b><b>2</b><b>3</b><b>4</b><b>5</b><b>6</b></a>");
        List<TokenizeEvent> events = new ArrayList<>();

        // Act
        ticking.tokenize(root, MODEL, events::add);

        // Assert
        assertThat(events).filteredOn(e -> e instanceof TokenizeEvent.Partial).hasSizeGreaterThan(1);
        assertThat(updates(events)).hasSize(7);
        assertThat(events).filteredOn(TokenizeEvent::isTerminal).singleElement()
            .isInstanceOf(TokenizeEvent.Done.class);
    }
}
