package im.arun.tokenmap.parse;

import im.arun.tokenmap.model.ParsedNode;
import im.arun.tokenmap.util.EmissionThrottle;

import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Progress and partial-subtree emission for one parse, rate-limited by wall-clock
 * windows so very wide and very deep trees produce a bounded event volume.
 */
final class ParseEmitter {
    static final long PARTIAL_INTERVAL_MS = 30;
    static final long PROGRESS_INTERVAL_MS = 60;

    private final Consumer<ParseEvent> sink;
    private final EmissionThrottle partialThrottle;
    private final EmissionThrottle progressThrottle;
    private long processed;

    ParseEmitter(Consumer<ParseEvent> sink, LongSupplier nanoClock) {
        this.sink = sink;
        this.partialThrottle = new EmissionThrottle(PARTIAL_INTERVAL_MS, nanoClock);
        this.progressThrottle = new EmissionThrottle(PROGRESS_INTERVAL_MS, nanoClock);
    }

    void progress(long done, Long total, ParseStage stage) {
        sink.accept(new ParseEvent.Progress(done, total, stage));
    }

    void maybeProgress(Long total, ParseStage stage) {
        if (progressThrottle.tryAcquire()) {
            progress(processed, total, stage);
        }
    }

    /**
     * Records a finalized node and emits it as a partial subtree if the window allows.
     */
    void nodeCompleted(ParsedNode node, Long total, ParseStage stage) {
        processed++;
        if (partialThrottle.tryAcquire()) {
            sink.accept(new ParseEvent.Partial(node));
        }
        maybeProgress(total, stage);
    }

    long processed() {
        return processed;
    }
}
