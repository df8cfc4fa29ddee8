package com.infra.wiring.util;

import com.infra.wiring.api.ProvisioningListener;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A listener that logs provisioning progress and keeps simple counters.
 *
 * <p>
 * Successes are logged at INFO with their latency. Failures are logged at
 * ERROR through an {@link ErrorRateLimiter}, so a cascade caused by one failed
 * root resource stays readable.
 */
public final class LoggingProvisioningListener implements ProvisioningListener {
    private static final Logger log = LogManager.getLogger(LoggingProvisioningListener.class);

    private final ErrorRateLimiter errLimiter;
    private final AtomicLong provisioned = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();
    private final AtomicLong totalLatencyNanos = new AtomicLong();

    public LoggingProvisioningListener() {
        this(1000);
    }

    public LoggingProvisioningListener(long errorIntervalMillis) {
        this.errLimiter = new ErrorRateLimiter(log, errorIntervalMillis);
    }

    @Override
    public void onBatchStart(long batch, int nodeCount) {
        log.info("Batch {}: {} resources scheduled", batch, nodeCount);
    }

    @Override
    public void onProvisionStart(String identity) {
        log.debug("Creating {}", identity);
    }

    @Override
    public void onProvisioned(String identity, Map<String, String> outputs, long durationNanos) {
        provisioned.incrementAndGet();
        totalLatencyNanos.addAndGet(durationNanos);
        log.info("Created {} in {} us: {}", identity, durationNanos / 1000, outputs);
    }

    @Override
    public void onProvisionError(String identity, Throwable error) {
        failed.incrementAndGet();
        errLimiter.log(String.format("Provisioning failure at '%s': %s", identity, error.getMessage()), null);
    }

    @Override
    public void onCancelled(String identity) {
        cancelled.incrementAndGet();
        log.info("Cancelled {}", identity);
    }

    public long provisionedCount() {
        return provisioned.get();
    }

    public long failedCount() {
        return failed.get();
    }

    public long cancelledCount() {
        return cancelled.get();
    }

    public double avgLatencyMicros() {
        long n = provisioned.get();
        return n == 0 ? 0.0 : (totalLatencyNanos.get() / 1000.0) / n;
    }
}
