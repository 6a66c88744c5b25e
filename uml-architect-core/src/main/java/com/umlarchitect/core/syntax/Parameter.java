package com.umlarchitect.core.syntax;

import java.util.Objects;

/**
 * A constructor or method parameter.
 *
 * @param name parameter identifier
 * @param type declared type, verbatim (e.g., "List&lt;String&gt;")
 */
public record Parameter(String name, String type) {

    public Parameter {
        name = Objects.requireNonNullElse(name, "");
        type = Objects.requireNonNullElse(type, "");
    }
}
