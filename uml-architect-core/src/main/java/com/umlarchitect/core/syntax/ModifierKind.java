package com.umlarchitect.core.syntax;

/**
 * Classification of declaration modifier keywords.
 *
 * <p>Only the keywords that carry their own diagram notation get a dedicated constant.
 * Everything else ({@code sealed}, {@code final}, {@code readonly}, {@code default}, ...)
 * is {@link #OTHER} and keeps its verbatim text.
 */
public enum ModifierKind {
    /** {@code public} */
    PUBLIC,

    /** {@code private} */
    PRIVATE,

    /** {@code protected} */
    PROTECTED,

    /** {@code internal} */
    INTERNAL,

    /** {@code abstract} */
    ABSTRACT,

    /** {@code static} */
    STATIC,

    /** Any other keyword */
    OTHER;

    /**
     * Returns true for the access modifiers.
     *
     * @return true for public, private, protected and internal
     */
    public boolean isVisibility() {
        return this == PUBLIC || this == PRIVATE || this == PROTECTED || this == INTERNAL;
    }
}
