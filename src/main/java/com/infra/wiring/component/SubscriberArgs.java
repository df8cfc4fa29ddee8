package com.infra.wiring.component;

import com.infra.wiring.fn.TransformHook;
import com.infra.wiring.node.ResourceKind;
import com.infra.wiring.resource.FunctionArgs;
import com.infra.wiring.value.Deferred;
import com.infra.wiring.value.Deferreds;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Arguments of a {@link RealtimeLambdaSubscriber}.
 *
 * <ul>
 * <li>{@code iot} (required): name of the realtime endpoint.</li>
 * <li>{@code subscriber} (required): handler string or {@link FunctionArgs}.</li>
 * <li>{@code filter} (optional): topic pattern, defaults to
 * {@link #MATCH_ALL}.</li>
 * <li>{@code transform} (optional): one hook per child resource kind.</li>
 * </ul>
 */
public final class SubscriberArgs {
    /** Topic filter matching every topic. */
    public static final String MATCH_ALL = "#";

    private Deferred<String> iot;
    private Object subscriber;
    private Deferred<String> filter;
    private String plainFilter;
    private final Map<ResourceKind, TransformHook> transforms = new EnumMap<>(ResourceKind.class);

    public static SubscriberArgs create() {
        return new SubscriberArgs();
    }

    public SubscriberArgs iot(String realtimeName) {
        this.iot = realtimeName == null ? null : Deferreds.lift(realtimeName);
        return this;
    }

    public SubscriberArgs iot(Deferred<String> realtimeName) {
        this.iot = realtimeName;
        return this;
    }

    public SubscriberArgs subscriber(String handler) {
        this.subscriber = handler;
        return this;
    }

    public SubscriberArgs subscriber(FunctionArgs function) {
        this.subscriber = function;
        return this;
    }

    public SubscriberArgs filter(String filter) {
        this.plainFilter = filter;
        this.filter = filter == null ? null : Deferreds.lift(filter);
        return this;
    }

    public SubscriberArgs filter(Deferred<String> filter) {
        this.plainFilter = null;
        this.filter = filter;
        return this;
    }

    public SubscriberArgs transform(ResourceKind kind, TransformHook hook) {
        if (hook == null)
            transforms.remove(kind);
        else
            transforms.put(kind, hook);
        return this;
    }

    public Deferred<String> iot() {
        return iot;
    }

    /** Handler string, FunctionArgs, or null when missing. */
    public Object subscriber() {
        return subscriber;
    }

    /** The filter as given; null when absent. */
    public Deferred<String> filter() {
        return filter;
    }

    /** The filter if it was given as a plain string, for eager validation. */
    String plainFilter() {
        return plainFilter;
    }

    /** Hook for {@code kind}, or null for none. */
    public TransformHook transform(ResourceKind kind) {
        return transforms.get(kind);
    }

    public Map<ResourceKind, TransformHook> transforms() {
        return Collections.unmodifiableMap(transforms);
    }
}
