package com.infra.wiring.api;

/**
 * Something that can own declared resources: a composite component or the
 * outermost scope.
 *
 * Resources hold their parent only as a back reference for naming and
 * introspection; ownership always flows from parent to child.
 */
public interface ResourceParent {

    /** Logical name of this parent, unique within its own parent. */
    String name();

    /** Type token, e.g. {@code wiring:aws:RealtimeLambdaSubscriber}. */
    String type();

    /**
     * The enclosing parent, or null for the outermost scope.
     */
    ResourceParent parent();

    /**
     * Slash separated chain of names from the outermost scope down to this
     * parent, e.g. {@code dev/OrdersSubscriber}.
     */
    default String path() {
        ResourceParent p = parent();
        return p == null ? name() : p.path() + "/" + name();
    }
}
