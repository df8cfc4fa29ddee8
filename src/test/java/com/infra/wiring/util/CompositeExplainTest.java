package com.infra.wiring.util;

import com.infra.wiring.component.RealtimeLambdaSubscriber;
import com.infra.wiring.component.Scope;
import com.infra.wiring.component.SubscriberArgs;
import com.infra.wiring.engine.LocalProvisioningEngine;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class CompositeExplainTest {

    private LocalProvisioningEngine engine;
    private Scope scope;
    private RealtimeLambdaSubscriber sub;

    @Before
    public void setUp() {
        engine = new LocalProvisioningEngine();
        scope = Scope.create("dev", engine);
        sub = scope.declare(RealtimeLambdaSubscriber::new, "Sub",
                SubscriberArgs.create().iot("Realtime").subscriber("src/sub.handler"));
    }

    @After
    public void tearDown() {
        scope.close();
        engine.close();
    }

    @Test
    public void testDumpTopology() {
        String dump = new CompositeExplain(sub).dumpTopology();
        assertTrue(dump.startsWith(RealtimeLambdaSubscriber.TYPE + " 'Sub' (3 resources)"));
        assertTrue(dump.contains("[0] SubHandler (FUNCTION) (ROOT) -> SubRule, SubPermission"));
        assertTrue(dump.contains("[1] SubRule (TOPIC_RULE) -> SubPermission"));
        assertTrue(dump.contains("[2] SubPermission (PERMISSION)\n"));
    }

    @Test
    public void testExplainNodeBeforeAndAfterProvisioning() throws Exception {
        CompositeExplain explain = new CompositeExplain(sub);
        String pending = explain.explainNode("SubRule");
        assertTrue(pending.contains("Parent: dev/Sub"));
        assertTrue(pending.contains("Depends on: [SubHandler]"));
        assertTrue(pending.contains("arn = <PENDING>"));

        engine.provision().get(5, TimeUnit.SECONDS);
        String done = explain.explainNode("SubRule");
        assertTrue(done.contains("Outputs: RESOLVED"));
        assertTrue(done.contains("arn = arn:aws:iot:"));
        assertTrue(done.contains("Dependents (1): SubPermission"));
    }

    @Test
    public void testMermaid() {
        String mermaid = new CompositeExplain(sub).toMermaid();
        assertTrue(mermaid.startsWith("graph TD;"));
        assertTrue(mermaid.contains("SubHandler --> SubRule;"));
        assertTrue(mermaid.contains("SubRule --> SubPermission;"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownNode() {
        new CompositeExplain(sub).explainNode("Nope");
    }
}
