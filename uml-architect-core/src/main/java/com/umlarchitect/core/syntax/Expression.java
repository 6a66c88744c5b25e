package com.umlarchitect.core.syntax;

import java.util.Objects;

/**
 * An initializer expression with its verbatim source text.
 *
 * @param kind expression kind
 * @param text source text (e.g., "42", "\"name\"", "Compute()")
 */
public record Expression(ExpressionKind kind, String text) {

    public Expression {
        kind = Objects.requireNonNullElse(kind, ExpressionKind.OTHER);
        text = Objects.requireNonNullElse(text, "");
    }

    /**
     * Creates a literal expression.
     *
     * @param kind literal kind
     * @param text literal text
     * @return expression
     */
    public static Expression literal(ExpressionKind kind, String text) {
        return new Expression(kind, text);
    }

    /**
     * Creates a non-literal expression.
     *
     * @param text source text
     * @return expression of kind {@link ExpressionKind#OTHER}
     */
    public static Expression other(String text) {
        return new Expression(ExpressionKind.OTHER, text);
    }

    public boolean isLiteral() {
        return kind.isLiteral();
    }
}
