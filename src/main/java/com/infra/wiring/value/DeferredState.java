package com.infra.wiring.value;

/**
 * Settlement state of a {@link Deferred}.
 *
 * PENDING is the only non-terminal state. CANCELLED is terminal and must be
 * treated by consumers as a failure, never as "still pending".
 */
public enum DeferredState {
    PENDING,
    RESOLVED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
