package com.infra.wiring.component;

import com.infra.wiring.dsl.ComponentBuilder;
import com.infra.wiring.node.ResourceArgs;
import com.infra.wiring.node.ResourceKind;
import com.infra.wiring.resource.FunctionArgs;
import com.infra.wiring.resource.LambdaFunction;
import com.infra.wiring.resource.LambdaPermission;
import com.infra.wiring.resource.TopicRule;
import com.infra.wiring.value.Deferred;
import com.infra.wiring.value.Deferreds;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Subscribes a compute function to a realtime (IoT) topic filter.
 *
 * <p>
 * Declares three resources, in this order:
 * <ol>
 * <li>{@code <name>Handler}: the function, described as "Subscribed to
 * {iot} on {filter}".</li>
 * <li>{@code <name>Rule}: a topic rule selecting every message on the filter
 * and invoking the function (depends on the handler's ARN).</li>
 * <li>{@code <name>Permission}: lets the IoT service invoke the function from
 * that rule (depends on the handler's name and the rule's ARN).</li>
 * </ol>
 *
 * <p>
 * Usually created through {@link Realtime#subscribe(Object, Realtime.SubscribeArgs)}.
 */
public final class RealtimeLambdaSubscriber extends CompositeComponent {
    public static final String TYPE = "wiring:aws:RealtimeLambdaSubscriber";
    public static final String IOT_PRINCIPAL = "iot.amazonaws.com";

    private final LambdaFunction function;
    private final TopicRule rule;
    private final LambdaPermission permission;

    public RealtimeLambdaSubscriber(String name, SubscriberArgs args, Scope scope) {
        super(TYPE, name, scope);
        validate(args);

        Deferred<String> iot = args.iot();
        Deferred<String> filter = normalizeFilter(args);

        ComponentBuilder b = builder();
        this.function = createFunction(b, args, iot, filter);
        this.rule = createRule(b, args, filter);
        this.permission = createPermission(b, args);

        Map<String, Deferred<?>> outputs = new LinkedHashMap<>();
        outputs.put("functionArn", function.arn());
        outputs.put("functionName", function.name());
        outputs.put("ruleArn", rule.arn());
        outputs.put("permissionId", permission.id());
        publish(b, outputs);
    }

    private void validate(SubscriberArgs args) {
        String component = TYPE + " '" + name() + "'";
        if (args == null)
            throw new ComponentValidationException(component, "args", "is required");
        if (args.iot() == null)
            throw new ComponentValidationException(component, "iot", "is required");
        if (args.subscriber() == null)
            throw new ComponentValidationException(component, "subscriber", "is required");
        if (args.subscriber() instanceof String handler && handler.isBlank())
            throw new ComponentValidationException(component, "subscriber", "must not be blank");
        if (args.subscriber() instanceof FunctionArgs fa && (fa.getHandler() == null || fa.getHandler().isBlank()))
            throw new ComponentValidationException(component, "subscriber.handler", "is required");
        if (args.plainFilter() != null && args.plainFilter().isBlank())
            throw new ComponentValidationException(component, "filter", "must not be blank");
    }

    private static Deferred<String> normalizeFilter(SubscriberArgs args) {
        return args.filter() != null ? args.filter() : Deferreds.lift(SubscriberArgs.MATCH_ALL);
    }

    private LambdaFunction createFunction(ComponentBuilder b, SubscriberArgs args, Deferred<String> iot,
            Deferred<String> filter) {
        ResourceArgs override = ResourceArgs.of("description",
                Deferreds.interpolate("Subscribed to {} on {}", iot, filter));
        return LambdaFunction.fromDefinition(b, name() + "Handler", args.subscriber(), override,
                args.transform(ResourceKind.FUNCTION));
    }

    private TopicRule createRule(ComponentBuilder b, SubscriberArgs args, Deferred<String> filter) {
        ResourceArgs defaults = ResourceArgs.builder()
                .put("sqlVersion", TopicRule.SQL_VERSION)
                .put("sql", Deferreds.interpolate("SELECT * FROM '{}'", filter))
                .put("enabled", true)
                .put("lambdas", TopicRule.lambdaActions(function.arn()))
                .build();
        return TopicRule.declare(b, name() + "Rule", defaults, args.transform(ResourceKind.TOPIC_RULE));
    }

    private LambdaPermission createPermission(ComponentBuilder b, SubscriberArgs args) {
        ResourceArgs defaults = ResourceArgs.builder()
                .put("action", LambdaPermission.INVOKE_ACTION)
                .put("function", function.name())
                .put("principal", IOT_PRINCIPAL)
                .put("sourceArn", rule.arn())
                .build();
        return LambdaPermission.declare(b, name() + "Permission", defaults, args.transform(ResourceKind.PERMISSION));
    }

    /** The underlying resources this component creates. */
    public Nodes nodes() {
        return new Nodes(function, permission, rule);
    }

    /**
     * Introspectable children.
     *
     * @param function   The function that is notified.
     * @param permission The invoke permission.
     * @param rule       The IoT topic rule.
     */
    public record Nodes(LambdaFunction function, LambdaPermission permission, TopicRule rule) {
    }
}
