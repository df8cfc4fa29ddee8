package com.infra.wiring.resource;

import com.infra.wiring.dsl.ComponentBuilder;
import com.infra.wiring.fn.TransformHook;
import com.infra.wiring.node.ResourceArgs;
import com.infra.wiring.node.ResourceKind;
import com.infra.wiring.value.Deferred;
import com.infra.wiring.node.ResourceNode;

import java.util.List;

/**
 * An IoT topic rule routing matching messages to actions.
 * Outputs: {@code arn}, {@code name}.
 */
public final class TopicRule extends ResourceHandle {
    public static final String SQL_VERSION = "2016-03-23";

    private TopicRule(ResourceNode node) {
        super(node);
    }

    public static TopicRule declare(ComponentBuilder b, String identity, ResourceArgs defaults, TransformHook transform) {
        return new TopicRule(b.declare(identity, ResourceKind.TOPIC_RULE, defaults, transform));
    }

    /** The {@code lambdas} action list invoking one function. */
    public static List<ResourceArgs> lambdaActions(Deferred<String> functionArn) {
        return List.of(ResourceArgs.of("functionArn", functionArn));
    }

    public Deferred<String> arn() {
        return node().output("arn");
    }

    public Deferred<String> name() {
        return node().output("name");
    }
}
