package com.infra.wiring.resource;

import com.infra.wiring.dsl.ComponentBuilder;
import com.infra.wiring.fn.TransformHook;
import com.infra.wiring.node.ResourceArgs;
import com.infra.wiring.node.ResourceKind;
import com.infra.wiring.node.ResourceNode;
import com.infra.wiring.value.Deferred;

/**
 * Grants a principal the right to invoke a function. Output: {@code id}.
 */
public final class LambdaPermission extends ResourceHandle {
    public static final String INVOKE_ACTION = "lambda:InvokeFunction";

    private LambdaPermission(ResourceNode node) {
        super(node);
    }

    public static LambdaPermission declare(ComponentBuilder b, String identity, ResourceArgs defaults,
            TransformHook transform) {
        return new LambdaPermission(b.declare(identity, ResourceKind.PERMISSION, defaults, transform));
    }

    public Deferred<String> id() {
        return node().output("id");
    }
}
