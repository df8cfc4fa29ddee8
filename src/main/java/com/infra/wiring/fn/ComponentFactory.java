package com.infra.wiring.fn;

import com.infra.wiring.component.CompositeComponent;
import com.infra.wiring.component.Scope;

/**
 * Creates a reusable composite inside a scope.
 *
 * <p>
 * Constructors of concrete composites match this shape, e.g.
 * {@code scope.declare(RealtimeLambdaSubscriber::new, "Orders", args)}.
 *
 * @param <A> Argument type of the composite.
 * @param <C> Composite type.
 */
@FunctionalInterface
public interface ComponentFactory<A, C extends CompositeComponent> {
    /**
     * Instantiates the composite.
     *
     * @param name  Logical name, unique within the scope.
     * @param args  Composite arguments.
     * @param scope Owning scope.
     * @return The declared composite.
     */
    C create(String name, A args, Scope scope);
}
