package com.umlarchitect.core.syntax;

import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed source file: its top-level declarations in source order.
 *
 * <p>Trees are acyclic by construction. Producing a well-formed tree is the job of the
 * parser that builds it; consumers do not validate.
 *
 * @param sourceName name of the source the tree was parsed from (file path or label)
 * @param members top-level declarations
 */
public record SyntaxTree(
    String sourceName,
    List<Declaration> members
) {
    public SyntaxTree {
        sourceName = Objects.requireNonNullElse(sourceName, "");
        members = members != null ? List.copyOf(members) : List.of();
    }

    /**
     * Dispatches every top-level declaration to the visitor, in source order.
     *
     * @param visitor visitor to call
     */
    public void accept(DeclarationVisitor visitor) {
        for (Declaration member : members) {
            member.accept(visitor);
        }
    }
}
