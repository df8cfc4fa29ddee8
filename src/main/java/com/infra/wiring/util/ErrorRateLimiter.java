package com.infra.wiring.util;

import org.apache.logging.log4j.Logger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of error logging.
 * A failing root resource fails every dependent; without throttling one root
 * cause would be logged once per downstream resource.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * Logs {@code message} at ERROR unless another message was logged within
     * the interval.
     *
     * @return true if the message was logged.
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last == Long.MIN_VALUE || now - last > minIntervalNanos) {
            // only one thread logs per interval
            if (lastLogTime.compareAndSet(last, now)) {
                long skipped = suppressed.getAndSet(0);
                if (skipped > 0)
                    logger.error("{} ({} similar errors suppressed)", message, skipped, t);
                else
                    logger.error(message, t);
                return true;
            }
        }
        suppressed.incrementAndGet();
        return false;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
