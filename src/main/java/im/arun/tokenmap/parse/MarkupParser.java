package im.arun.tokenmap.parse;

import im.arun.tokenmap.model.ParseOptions;
import im.arun.tokenmap.model.ParsedNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Entry point of the parse stage: sanitizes the input, picks a strategy by input size
 * and reports the outcome as exactly one terminal event.
 */
public class MarkupParser {
    private static final Logger logger = LoggerFactory.getLogger(MarkupParser.class);

    public static final int DEFAULT_STREAMING_THRESHOLD_CHARS = 2 * 1024 * 1024;
    public static final int DEFAULT_STREAM_CHUNK_CHARS = 64 * 1024;

    private final int streamingThresholdChars;
    private final ParseStrategy wholeDocument;
    private final ParseStrategy streaming;
    private final LongSupplier nanoClock;

    public MarkupParser() {
        this(DEFAULT_STREAMING_THRESHOLD_CHARS, DEFAULT_STREAM_CHUNK_CHARS);
    }

    public MarkupParser(int streamingThresholdChars, int streamChunkChars) {
        this(streamingThresholdChars, streamChunkChars, System::nanoTime);
    }

    public MarkupParser(int streamingThresholdChars, int streamChunkChars, LongSupplier nanoClock) {
        this.streamingThresholdChars = streamingThresholdChars;
        this.wholeDocument = new DomParseStrategy();
        this.streaming = new StreamingParseStrategy(streamChunkChars);
        this.nanoClock = nanoClock;
    }

    /**
     * Parse markup, delivering progress, partial subtrees and one terminal event to the sink.
     * Malformed input is reported as {@link ParseEvent.Error}, never thrown.
     */
    public void parse(String markup, ParseOptions options, Consumer<ParseEvent> sink) {
        ParseOptions effective = options != null ? options : ParseOptions.defaults();
        String sanitized = MarkupSanitizer.sanitize(markup);

        if (MarkupSanitizer.isBlankDocument(sanitized)) {
            logger.debug("Blank input, emitting empty document root");
            sink.accept(new ParseEvent.Done(NodeFrame.emptyDocument(effective.isRetainText())));
            return;
        }

        ParseStrategy strategy = selectStrategy(sanitized.length());
        logger.info("Parsing {} chars with {} strategy", sanitized.length(), strategy.name());

        ParsedNode root;
        try {
            root = strategy.parse(sanitized, effective, new ParseEmitter(sink, nanoClock));
        } catch (MarkupParseException e) {
            logger.warn("Markup is not well-formed at {}:{}: {}", e.getLine(), e.getColumn(), e.getMessage());
            sink.accept(new ParseEvent.Error(e.getMessage(), e.getLine(), e.getColumn()));
            return;
        }
        sink.accept(new ParseEvent.Done(root));
    }

    /**
     * Parse synchronously, discarding progress; malformed input is thrown.
     */
    public ParsedNode parse(String markup, ParseOptions options) throws MarkupParseException {
        ParseEvent[] terminal = new ParseEvent[1];
        parse(markup, options, event -> {
            if (event.isTerminal()) {
                terminal[0] = event;
            }
        });
        if (terminal[0] instanceof ParseEvent.Error) {
            ParseEvent.Error error = (ParseEvent.Error) terminal[0];
            throw new MarkupParseException(error.getMessage(), error.getLine(), error.getColumn());
        }
        return ((ParseEvent.Done) terminal[0]).getRoot();
    }

    String strategyFor(int sanitizedLength) {
        return selectStrategy(sanitizedLength).name();
    }

    private ParseStrategy selectStrategy(int sanitizedLength) {
        return sanitizedLength < streamingThresholdChars ? wholeDocument : streaming;
    }
}
