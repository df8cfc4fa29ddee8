package com.infra.wiring;

import com.infra.wiring.component.Realtime;
import com.infra.wiring.component.RealtimeLambdaSubscriber;
import com.infra.wiring.component.Scope;
import com.infra.wiring.engine.LocalProvisioningEngine;
import com.infra.wiring.fn.TransformHook;
import com.infra.wiring.io.DeclarationSnapshot;
import com.infra.wiring.node.ResourceKind;
import com.infra.wiring.util.CompositeExplain;
import com.infra.wiring.util.LoggingProvisioningListener;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import lombok.extern.log4j.Log4j2;

/**
 * Declares two realtime subscribers against the in-process engine, provisions
 * them and prints the resulting graph.
 */
@Log4j2
public class RealtimeSubscriberDemo {

    public static void main(String[] args) throws Exception {
        log.info("Starting Realtime Subscriber Demo...");

        try (LocalProvisioningEngine engine = new LocalProvisioningEngine();
                Scope scope = Scope.create("dev", engine)) {
            var listener = new LoggingProvisioningListener();
            engine.setListener(listener);

            Realtime realtime = new Realtime("Realtime", scope);
            RealtimeLambdaSubscriber all = realtime.subscribe("src/all.handler");
            RealtimeLambdaSubscriber status = realtime.subscribe("src/status.handler",
                    new Realtime.SubscribeArgs()
                            .filter("devices/+/status")
                            .transform(ResourceKind.TOPIC_RULE,
                                    TransformHook.merging(Map.of("description", "device status feed"))));

            log.info("\n{}", new CompositeExplain(status).dumpTopology());

            engine.provision().get(10, TimeUnit.SECONDS);

            log.info("Function ARN: {}", all.nodes().function().arn().now().orElse("<unresolved>"));
            log.info("Rule ARN: {}", status.nodes().rule().arn().now().orElse("<unresolved>"));
            log.info("\n{}", DeclarationSnapshot.toJson(scope));
            log.info("Provisioned {} resources, avg {} us", listener.provisionedCount(),
                    String.format("%.1f", listener.avgLatencyMicros()));
        }
        log.info("Demo complete.");
    }
}
