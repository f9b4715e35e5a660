package im.arun.tokenmap.parse;

import im.arun.tokenmap.model.ParseOptions;
import im.arun.tokenmap.model.ParseRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs parse requests on the dedicated parse executor, one at a time. Events reach
 * the sink on the worker thread; the returned future completes after the terminal
 * event has been delivered.
 */
public class ParseWorker {
    private static final Logger logger = LoggerFactory.getLogger(ParseWorker.class);

    private final MarkupParser parser;
    private final ExecutorService executor;

    public ParseWorker(MarkupParser parser, ExecutorService executor) {
        this.parser = parser;
        this.executor = executor;
    }

    public CompletableFuture<Void> submit(ParseRequest request, Consumer<ParseEvent> sink) {
        return submit(request.getText(), request.getOptions(), sink);
    }

    public CompletableFuture<Void> submit(String markup, ParseOptions options, Consumer<ParseEvent> sink) {
        return CompletableFuture.runAsync(() -> {
            AtomicBoolean terminated = new AtomicBoolean(false);
            try {
                parser.parse(markup, options, event -> {
                    if (event.isTerminal()) {
                        terminated.set(true);
                    }
                    sink.accept(event);
                });
            } catch (RuntimeException e) {
                logger.error("Parse request failed", e);
                // Anything the parser did not classify still ends the request with one error
                if (!terminated.get()) {
                    sink.accept(new ParseEvent.Error(String.valueOf(e.getMessage()), -1, -1));
                }
            }
        }, executor);
    }
}
