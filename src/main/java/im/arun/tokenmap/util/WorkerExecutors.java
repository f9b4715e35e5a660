package im.arun.tokenmap.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the two long-lived background execution contexts: one for parsing, one for
 * tokenization. Each is a single daemon thread that runs one request to completion
 * before starting the next.
 * Created once by the orchestrator and handed to the workers; close it on shutdown.
 */
public final class WorkerExecutors implements AutoCloseable {
    private final ExecutorService parseExecutor;
    private final ExecutorService tokenizeExecutor;

    public WorkerExecutors() {
        this.parseExecutor = Executors.newSingleThreadExecutor(namedDaemonFactory("tokenmap-parse"));
        this.tokenizeExecutor = Executors.newSingleThreadExecutor(namedDaemonFactory("tokenmap-tokenize"));
    }

    public ExecutorService parseExecutor() {
        return parseExecutor;
    }

    public ExecutorService tokenizeExecutor() {
        return tokenizeExecutor;
    }

    private static ThreadFactory namedDaemonFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        };
    }

    /**
     * Shuts down both executors, waiting briefly for in-flight requests.
     */
    @Override
    public void close() {
        parseExecutor.shutdown();
        tokenizeExecutor.shutdown();
        try {
            if (!parseExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                parseExecutor.shutdownNow();
            }
            if (!tokenizeExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                tokenizeExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            parseExecutor.shutdownNow();
            tokenizeExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
