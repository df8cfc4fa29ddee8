package com.infra.wiring.resource;

import com.infra.wiring.dsl.ComponentBuilder;
import com.infra.wiring.fn.TransformHook;
import com.infra.wiring.node.ResourceArgs;
import com.infra.wiring.node.ResourceKind;
import com.infra.wiring.node.ResourceNode;
import com.infra.wiring.value.Deferred;

/**
 * A compute function resource. Outputs: {@code arn}, {@code name}.
 */
public final class LambdaFunction extends ResourceHandle {

    private LambdaFunction(ResourceNode node) {
        super(node);
    }

    /**
     * Declares a function from a definition that is either a handler string or
     * a {@link FunctionArgs}.
     *
     * @param b          Builder of the owning component.
     * @param identity   Resource identity.
     * @param definition Handler string or FunctionArgs.
     * @param override   Fields that win over the definition, e.g. a component
     *                   generated description. May be null.
     * @param transform  Component-level transform, applied after the
     *                   definition's own transform. May be null.
     * @throws IllegalArgumentException if the definition is neither a non-blank
     *                                  handler nor a FunctionArgs with one.
     */
    public static LambdaFunction fromDefinition(ComponentBuilder b, String identity, Object definition,
            ResourceArgs override, TransformHook transform) {
        FunctionArgs args = toFunctionArgs(identity, definition);
        ResourceArgs defaults = args.toResourceArgs().merge(override);
        TransformHook hook = TransformHook.compose(args.getTransform(), transform);
        return new LambdaFunction(b.declare(identity, ResourceKind.FUNCTION, defaults, hook));
    }

    /**
     * Normalizes a definition to FunctionArgs.
     *
     * @throws IllegalArgumentException for unusable definitions.
     */
    public static FunctionArgs toFunctionArgs(String identity, Object definition) {
        if (definition instanceof String handler && !handler.isBlank())
            return FunctionArgs.of(handler);
        if (definition instanceof FunctionArgs fa && fa.getHandler() != null && !fa.getHandler().isBlank())
            return fa;
        throw new IllegalArgumentException("Invalid function definition for the \"" + identity + "\" Function");
    }

    public Deferred<String> arn() {
        return node().output("arn");
    }

    public Deferred<String> name() {
        return node().output("name");
    }
}
