package io.clype.sqsbatcher.service;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Pauses the calling thread between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> TimeUnit.NANOSECONDS.sleep(saturatedNanos(duration));

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Converts to nanoseconds, saturating at {@link Long#MAX_VALUE} for durations too long to
     * represent (about 292 years).
     */
    static long saturatedNanos(Duration duration) {
        if (duration.isNegative()) {
            return 0;
        }
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
