package com.umlarchitect.core.generator.impl;

import java.util.List;
import java.util.stream.Collectors;

import com.umlarchitect.core.syntax.Modifier;
import com.umlarchitect.core.syntax.ModifierKind;

/**
 * Translates declaration modifiers into PlantUML class diagram notation.
 *
 * <p>Both translators are token-wise: each modifier maps independently, source order is
 * kept and duplicates pass through. The result is space-joined with one trailing space, or
 * the empty string when nothing is emitted, so callers can concatenate it directly in front
 * of the next token.
 *
 * <table>
 *   <caption>Member modifiers</caption>
 *   <tr><th>Modifier</th><th>Notation</th></tr>
 *   <tr><td>public</td><td>{@code +}</td></tr>
 *   <tr><td>private</td><td>{@code -}</td></tr>
 *   <tr><td>protected</td><td>{@code #}</td></tr>
 *   <tr><td>abstract</td><td>{@code {abstract}}</td></tr>
 *   <tr><td>static</td><td>{@code {static}}</td></tr>
 *   <tr><td>internal and any other keyword</td><td>{@code <<keyword>>}</td></tr>
 * </table>
 */
public final class ModifierNotation {

    private static final String STEREOTYPE_OPEN = "<<";
    private static final String STEREOTYPE_CLOSE = ">>";
    private static final String SEPARATOR = " ";

    private ModifierNotation() {
        // Utility class
    }

    /**
     * Translates the modifiers of an interface, class or struct into stereotypes.
     *
     * <p>Access modifiers are not shown on types and {@code abstract} is part of the type
     * keyword, so both are dropped. {@code public sealed partial} becomes
     * {@code "<<sealed>> <<partial>> "}.
     *
     * @param modifiers type modifiers in source order
     * @return stereotype text with trailing space, or empty string
     */
    public static String typeStereotypes(List<Modifier> modifiers) {
        String text = modifiers.stream()
            .filter(modifier -> !modifier.kind().isVisibility())
            .filter(modifier -> modifier.kind() != ModifierKind.ABSTRACT)
            .map(modifier -> stereotype(modifier.keyword()))
            .collect(Collectors.joining(SEPARATOR));
        return withTrailingSeparator(text);
    }

    /**
     * Translates the modifiers of a field, property, method or constructor.
     *
     * <p>{@code public static} becomes {@code "+ {static} "}.
     *
     * @param modifiers member modifiers in source order
     * @return notation text with trailing space, or empty string
     */
    public static String memberModifiers(List<Modifier> modifiers) {
        String text = modifiers.stream()
            .map(ModifierNotation::memberSymbol)
            .collect(Collectors.joining(SEPARATOR));
        return withTrailingSeparator(text);
    }

    /**
     * Maps a single member modifier to its notation.
     *
     * @param modifier modifier token
     * @return visibility symbol, {@code {keyword}} marker or stereotype
     */
    static String memberSymbol(Modifier modifier) {
        return switch (modifier.kind()) {
            case PUBLIC -> "+";
            case PRIVATE -> "-";
            case PROTECTED -> "#";
            case ABSTRACT, STATIC -> "{" + modifier.keyword() + "}";
            case INTERNAL, OTHER -> stereotype(modifier.keyword());
        };
    }

    /**
     * Wraps text as a stereotype.
     *
     * @param text stereotype content
     * @return {@code <<text>>}
     */
    static String stereotype(String text) {
        return STEREOTYPE_OPEN + text + STEREOTYPE_CLOSE;
    }

    private static String withTrailingSeparator(String text) {
        return text.isEmpty() ? text : text + SEPARATOR;
    }
}
