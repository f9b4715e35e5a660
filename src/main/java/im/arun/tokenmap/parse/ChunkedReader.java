package im.arun.tokenmap.parse;

import java.io.Reader;
import java.util.function.LongConsumer;

/**
 * Serves a string to the streaming tokenizer in fixed-size chunks. Every time a chunk
 * has been handed out completely the listener is told how many characters have been
 * fed so far and the thread yields before the next chunk.
 */
final class ChunkedReader extends Reader {
    private final String source;
    private final int chunkSize;
    private final LongConsumer chunkListener;
    private int position;
    private int chunkEnd;

    ChunkedReader(String source, int chunkSize, LongConsumer chunkListener) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, got " + chunkSize);
        }
        this.source = source;
        this.chunkSize = chunkSize;
        this.chunkListener = chunkListener;
        this.chunkEnd = Math.min(chunkSize, source.length());
    }

    @Override
    public int read(char[] cbuf, int off, int len) {
        if (len == 0) {
            return 0;
        }
        if (position >= source.length()) {
            return -1;
        }
        if (position == chunkEnd) {
            chunkListener.accept(position);
            Thread.yield();
            chunkEnd = Math.min(position + chunkSize, source.length());
        }
        int count = Math.min(len, chunkEnd - position);
        source.getChars(position, position + count, cbuf, off);
        position += count;
        return count;
    }

    @Override
    public void close() {
        // nothing to release; the source string is owned by the caller
    }
}
