package com.infra.wiring.component;

import com.infra.wiring.engine.LocalProvisioningEngine;
import com.infra.wiring.node.ResourceKind;
import com.infra.wiring.resource.FunctionArgs;
import com.infra.wiring.value.Deferred;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class RealtimeTest {

    private LocalProvisioningEngine engine;
    private Scope scope;
    private Realtime realtime;

    @Before
    public void setUp() {
        engine = new LocalProvisioningEngine();
        scope = Scope.create("dev", engine);
        realtime = new Realtime("Realtime", scope);
    }

    @After
    public void tearDown() {
        scope.close();
        engine.close();
    }

    @Test
    public void testSuffixIsStable() {
        String s = Realtime.suffix("#src/sub.handler");
        assertEquals(6, s.length());
        assertEquals(s, Realtime.suffix("#src/sub.handler"));
        assertFalse(Character.isLowerCase(s.charAt(0)));
        assertNotEquals(s, Realtime.suffix("devices/#src/sub.handler"));
    }

    @Test
    public void testSubscriberNameIsDerivedFromFilterAndHandler() {
        RealtimeLambdaSubscriber sub = realtime.subscribe("src/sub.handler");
        assertEquals("RealtimeSubscriber" + Realtime.suffix("#src/sub.handler"), sub.name());
        assertEquals(sub.name() + "Handler", sub.nodes().function().identity());
        Deferred<?> description = (Deferred<?>) sub.nodes().function().node().args().get("description");
        assertEquals("Subscribed to Realtime on #", description.now().get());

        try (LocalProvisioningEngine other = new LocalProvisioningEngine();
                Scope otherScope = Scope.create("prod", other)) {
            RealtimeLambdaSubscriber again = new Realtime("Realtime", otherScope).subscribe("src/sub.handler");
            assertEquals(sub.name(), again.name());
        }
    }

    @Test
    public void testFilterChangesName() {
        RealtimeLambdaSubscriber all = realtime.subscribe("src/sub.handler");
        RealtimeLambdaSubscriber status = realtime.subscribe("src/sub.handler",
                new Realtime.SubscribeArgs().filter("devices/+/status"));
        assertNotEquals(all.name(), status.name());
        assertEquals(2, scope.components().size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSameSubscriptionTwiceIsRejected() {
        realtime.subscribe("src/sub.handler");
        realtime.subscribe("src/sub.handler");
    }

    @Test
    public void testFunctionArgsAndTransforms() {
        RealtimeLambdaSubscriber sub = realtime.subscribe(
                FunctionArgs.builder().handler("src/sub.handler").environment(Map.of("STAGE", "dev")).build(),
                new Realtime.SubscribeArgs().transform(ResourceKind.TOPIC_RULE, draft -> draft.with("enabled", false)));

        assertEquals(Boolean.FALSE, sub.nodes().rule().node().args().get("enabled"));
        assertTrue(sub.nodes().function().node().args().has("environment"));
        assertEquals("RealtimeSubscriber" + Realtime.suffix("#src/sub.handler"), sub.name());
    }

    @Test
    public void testInvalidSubscriberNamesField() {
        assertRejected(null, "subscriber");
        assertRejected(" ", "subscriber");
        assertRejected(42, "subscriber");
        assertRejected(FunctionArgs.builder().memory(256).build(), "subscriber.handler");
        assertTrue(scope.components().isEmpty());
        assertEquals(0, engine.queuedCount());
    }

    private void assertRejected(Object subscriber, String field) {
        try {
            realtime.subscribe(subscriber);
            fail("Should reject " + subscriber);
        } catch (ComponentValidationException e) {
            assertEquals(field, e.field());
            assertTrue(e.getMessage().contains("RealtimeSubscriber"));
        }
    }

    @Test
    public void testNullSubscribeArgsUseDefaults() {
        RealtimeLambdaSubscriber sub = realtime.subscribe("src/sub.handler", null);
        assertEquals("RealtimeSubscriber" + Realtime.suffix("#src/sub.handler"), sub.name());
        Deferred<?> sql = (Deferred<?>) sub.nodes().rule().node().args().get("sql");
        assertEquals("SELECT * FROM '#'", sql.now().get());
    }
}
