package com.umlarchitect.core.syntax;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A modifier token of a declaration, kept verbatim.
 *
 * <p>Example: {@code public static readonly} is the list
 * {@code [Modifier("public"), Modifier("static"), Modifier("readonly")]}.
 *
 * @param keyword modifier keyword as written in source (e.g., "public", "sealed")
 */
public record Modifier(String keyword) {

    private static final Map<String, ModifierKind> KINDS = Map.of(
        "public", ModifierKind.PUBLIC,
        "private", ModifierKind.PRIVATE,
        "protected", ModifierKind.PROTECTED,
        "internal", ModifierKind.INTERNAL,
        "abstract", ModifierKind.ABSTRACT,
        "static", ModifierKind.STATIC
    );

    public Modifier {
        keyword = Objects.requireNonNullElse(keyword, "");
    }

    /**
     * Creates a modifier from its keyword.
     *
     * @param keyword modifier keyword
     * @return modifier
     */
    public static Modifier of(String keyword) {
        return new Modifier(keyword);
    }

    /**
     * Creates an ordered modifier list from keywords.
     *
     * @param keywords modifier keywords in source order
     * @return immutable modifier list
     */
    public static List<Modifier> listOf(String... keywords) {
        return Arrays.stream(keywords).map(Modifier::of).toList();
    }

    /**
     * Classifies this modifier.
     *
     * @return modifier kind, {@link ModifierKind#OTHER} for unknown keywords
     */
    public ModifierKind kind() {
        return KINDS.getOrDefault(keyword, ModifierKind.OTHER);
    }

    /**
     * Checks whether any modifier in the list has the given kind.
     *
     * @param modifiers modifier list
     * @param kind kind to look for
     * @return true if present
     */
    public static boolean contains(List<Modifier> modifiers, ModifierKind kind) {
        return modifiers.stream().anyMatch(modifier -> modifier.kind() == kind);
    }
}
