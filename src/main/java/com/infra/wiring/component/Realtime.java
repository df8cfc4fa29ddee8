package com.infra.wiring.component;

import com.infra.wiring.fn.TransformHook;
import com.infra.wiring.node.ResourceKind;
import com.infra.wiring.resource.FunctionArgs;
import com.infra.wiring.resource.LambdaFunction;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A realtime (IoT) endpoint that functions can subscribe to.
 *
 * <p>
 * Each {@link #subscribe(Object, SubscribeArgs)} call declares one
 * {@link RealtimeLambdaSubscriber} named {@code <name>Subscriber<Suffix>}, where
 * the suffix is derived from the filter and the handler so that the same
 * subscription always gets the same identity.
 */
public final class Realtime {
    private static final int SUFFIX_LENGTH = 6;

    private final String name;
    private final Scope scope;

    public Realtime(String name, Scope scope) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Realtime name must not be blank");
        this.name = name;
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    public String name() {
        return name;
    }

    /** Subscribes to every topic. */
    public RealtimeLambdaSubscriber subscribe(Object subscriber) {
        return subscribe(subscriber, new SubscribeArgs());
    }

    /**
     * Subscribes a function to the topics matching {@code args.filter()}.
     *
     * @param subscriber Handler string or {@link FunctionArgs}.
     * @param args       Filter and per-kind transforms; null for the defaults.
     * @return The declared subscriber.
     * @throws ComponentValidationException if the subscriber is missing, blank
     *                                      or of an unsupported type.
     */
    public RealtimeLambdaSubscriber subscribe(Object subscriber, SubscribeArgs args) {
        if (args == null)
            args = new SubscribeArgs();
        validateSubscriber(subscriber);

        String filter = args.filter != null ? args.filter : SubscriberArgs.MATCH_ALL;
        FunctionArgs fn = LambdaFunction.toFunctionArgs(name + "Subscriber", subscriber);
        String subscriberName = name + "Subscriber" + suffix(filter + fn.getHandler());

        SubscriberArgs sa = SubscriberArgs.create().iot(name).filter(args.filter);
        if (subscriber instanceof FunctionArgs)
            sa.subscriber(fn);
        else
            sa.subscriber(fn.getHandler());
        args.transforms.forEach(sa::transform);
        return scope.declare(RealtimeLambdaSubscriber::new, subscriberName, sa);
    }

    // the subscriber name is derived from the handler, so it is checked before
    // the component exists
    private void validateSubscriber(Object subscriber) {
        String component = RealtimeLambdaSubscriber.TYPE + " '" + name + "Subscriber'";
        if (subscriber == null)
            throw new ComponentValidationException(component, "subscriber", "is required");
        if (subscriber instanceof String handler) {
            if (handler.isBlank())
                throw new ComponentValidationException(component, "subscriber", "must not be blank");
        } else if (subscriber instanceof FunctionArgs fa) {
            if (fa.getHandler() == null || fa.getHandler().isBlank())
                throw new ComponentValidationException(component, "subscriber.handler", "is required");
        } else {
            throw new ComponentValidationException(component, "subscriber",
                    "must be a handler string or FunctionArgs, got " + subscriber.getClass().getSimpleName());
        }
    }

    /**
     * Base-36 prefix of the SHA-256 of {@code text}, first character upper-cased.
     */
    static String suffix(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            String s = new BigInteger(1, digest).toString(36).substring(0, SUFFIX_LENGTH);
            return Character.toUpperCase(s.charAt(0)) + s.substring(1);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Options of {@link #subscribe(Object, SubscribeArgs)}. */
    public static final class SubscribeArgs {
        private String filter;
        private final Map<ResourceKind, TransformHook> transforms = new EnumMap<>(ResourceKind.class);

        public SubscribeArgs filter(String filter) {
            this.filter = filter;
            return this;
        }

        public SubscribeArgs transform(ResourceKind kind, TransformHook hook) {
            transforms.put(kind, Objects.requireNonNull(hook, "hook"));
            return this;
        }
    }
}
