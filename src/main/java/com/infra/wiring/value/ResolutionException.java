package com.infra.wiring.value;

/**
 * Raised when a resource fails to provision.
 *
 * The exception travels unchanged through every {@link Deferred} derived from
 * the failed resource's outputs. When a resource fails because one of its
 * upstream resources failed, the upstream exception is kept as the cause, so
 * {@link #failedIdentity()} always names the resource where the chain broke.
 */
public class ResolutionException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String identity;

    public ResolutionException(String identity, String message) {
        super("Resource '" + identity + "' failed to provision: " + message);
        this.identity = identity;
    }

    public ResolutionException(String identity, String message, Throwable cause) {
        super("Resource '" + identity + "' failed to provision: " + message, cause);
        this.identity = identity;
    }

    /** The resource whose outputs carry this failure. */
    public String identity() {
        return identity;
    }

    /**
     * Walks the cause chain and returns the identity of the deepest resource
     * that failed.
     */
    public String failedIdentity() {
        String deepest = identity;
        Throwable t = getCause();
        while (t != null) {
            if (t instanceof ResolutionException re)
                deepest = re.identity;
            t = t.getCause();
        }
        return deepest;
    }
}
