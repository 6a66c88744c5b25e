package com.umlarchitect.core.syntax;

import java.util.Objects;
import java.util.Optional;

/**
 * One variable of a field declaration ({@code int a = 1, b;} declares two).
 *
 * @param name variable identifier
 * @param initializer initializer expression, or null when absent
 */
public record VariableDeclarator(String name, Expression initializer) {

    public VariableDeclarator {
        name = Objects.requireNonNullElse(name, "");
    }

    /**
     * Creates a variable without an initializer.
     *
     * @param name variable identifier
     * @return variable declarator
     */
    public static VariableDeclarator of(String name) {
        return new VariableDeclarator(name, null);
    }

    public Optional<Expression> getInitializer() {
        return Optional.ofNullable(initializer);
    }
}
