package com.infra.wiring.component;

/**
 * Raised synchronously when a composite is declared with missing or malformed
 * configuration. Nothing has been registered when this is thrown.
 */
public class ComponentValidationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final String component;
    private final String field;

    public ComponentValidationException(String component, String field, String problem) {
        super(component + ": field '" + field + "' " + problem);
        this.component = component;
        this.field = field;
    }

    /** Type and name of the composite being declared. */
    public String component() {
        return component;
    }

    /** Name of the offending configuration field, e.g. {@code subscriber}. */
    public String field() {
        return field;
    }
}
