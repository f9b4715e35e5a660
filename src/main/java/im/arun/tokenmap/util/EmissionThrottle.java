package im.arun.tokenmap.util;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Wall-clock rate limiter for progress and partial events.
 * {@link #tryAcquire()} succeeds at most once per interval.
 */
public final class EmissionThrottle {
    private final long intervalNanos;
    private final LongSupplier nanoClock;
    private long lastEmitNanos;

    /**
     * The first window starts now, so the first call succeeds only after one interval.
     */
    public EmissionThrottle(long intervalMillis, LongSupplier nanoClock) {
        this.intervalNanos = TimeUnit.MILLISECONDS.toNanos(intervalMillis);
        this.nanoClock = nanoClock;
        this.lastEmitNanos = nanoClock.getAsLong();
    }

    public boolean tryAcquire() {
        long now = nanoClock.getAsLong();
        if (now - lastEmitNanos > intervalNanos) {
            lastEmitNanos = now;
            return true;
        }
        return false;
    }

    /**
     * True when the current window has run out, without consuming it.
     */
    public boolean elapsed() {
        return nanoClock.getAsLong() - lastEmitNanos >= intervalNanos;
    }
}
