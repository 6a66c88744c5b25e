package com.umlarchitect.core.syntax;

/**
 * Kind of an initializer expression.
 *
 * <p>Only literal kinds are shown in diagrams; {@link #OTHER} covers invocations,
 * object and array creation, operators and everything else.
 */
public enum ExpressionKind {
    NUMERIC_LITERAL,
    STRING_LITERAL,
    CHARACTER_LITERAL,
    BOOLEAN_LITERAL,
    NULL_LITERAL,
    DEFAULT_LITERAL,
    OTHER;

    /**
     * Returns true for every literal kind.
     *
     * @return true unless {@link #OTHER}
     */
    public boolean isLiteral() {
        return this != OTHER;
    }
}
