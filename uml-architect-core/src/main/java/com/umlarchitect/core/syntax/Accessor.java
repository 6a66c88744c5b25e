package com.umlarchitect.core.syntax;

import java.util.List;
import java.util.Objects;

/**
 * A property accessor such as {@code get}, {@code protected set} or {@code init}.
 *
 * @param keyword accessor keyword
 * @param modifiers accessor-level modifiers in source order
 */
public record Accessor(String keyword, List<Modifier> modifiers) {

    public Accessor {
        keyword = Objects.requireNonNullElse(keyword, "");
        modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
    }

    /**
     * Creates an accessor without modifiers.
     *
     * @param keyword accessor keyword
     * @return accessor
     */
    public static Accessor of(String keyword) {
        return new Accessor(keyword, List.of());
    }

    /**
     * Returns true when the accessor itself is declared private.
     *
     * @return true if a private modifier is present
     */
    public boolean isPrivate() {
        return Modifier.contains(modifiers, ModifierKind.PRIVATE);
    }
}
