package com.infra.wiring.util;

import com.infra.wiring.component.Realtime;
import com.infra.wiring.component.Scope;
import com.infra.wiring.engine.LocalProvisioningEngine;
import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class LoggingProvisioningListenerTest {

    @Test
    public void testCountsOutcomes() throws Exception {
        LoggingProvisioningListener listener = new LoggingProvisioningListener();
        try (LocalProvisioningEngine engine = new LocalProvisioningEngine();
                Scope scope = Scope.create("dev", engine)) {
            engine.setListener(listener);
            Realtime realtime = new Realtime("Realtime", scope);
            String failing = realtime.subscribe("src/a.handler").nodes().rule().identity();
            realtime.subscribe("src/b.handler");
            engine.failOn(failing, "denied");

            engine.provision().get(5, TimeUnit.SECONDS);

            // one subscriber fully created, the other keeps only its function
            assertEquals(4, listener.provisionedCount());
            assertEquals(2, listener.failedCount());
            assertTrue(listener.avgLatencyMicros() >= 0.0);
        }
    }

    @Test
    public void testCountsCancellations() {
        LoggingProvisioningListener listener = new LoggingProvisioningListener();
        try (LocalProvisioningEngine engine = new LocalProvisioningEngine();
                Scope scope = Scope.create("dev", engine)) {
            engine.setListener(listener);
            new Realtime("Realtime", scope).subscribe("src/a.handler");
            scope.close();
            assertEquals(3, listener.cancelledCount());
            assertEquals(0, listener.provisionedCount());
        }
    }

    @Test
    public void testErrorRateLimiterSuppressesBursts() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(getClass()), 60_000);
        assertTrue(limiter.log("first", null));
        assertFalse(limiter.log("second", null));
        assertFalse(limiter.log("third", null));
        assertEquals(2, limiter.suppressedCount());
    }
}
