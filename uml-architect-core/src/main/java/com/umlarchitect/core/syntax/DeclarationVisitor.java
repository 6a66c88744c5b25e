package com.umlarchitect.core.syntax;

import com.umlarchitect.core.syntax.Declaration.ClassDeclaration;
import com.umlarchitect.core.syntax.Declaration.ConstructorDeclaration;
import com.umlarchitect.core.syntax.Declaration.EnumDeclaration;
import com.umlarchitect.core.syntax.Declaration.EnumMemberDeclaration;
import com.umlarchitect.core.syntax.Declaration.FieldDeclaration;
import com.umlarchitect.core.syntax.Declaration.InterfaceDeclaration;
import com.umlarchitect.core.syntax.Declaration.MethodDeclaration;
import com.umlarchitect.core.syntax.Declaration.NamespaceDeclaration;
import com.umlarchitect.core.syntax.Declaration.PropertyDeclaration;
import com.umlarchitect.core.syntax.Declaration.StructDeclaration;

/**
 * Visitor over the closed set of {@link Declaration} kinds.
 *
 * <p>Implementations decide themselves whether and how to descend into container members.
 */
public interface DeclarationVisitor {

    void visitInterface(InterfaceDeclaration node);

    void visitClass(ClassDeclaration node);

    void visitStruct(StructDeclaration node);

    void visitEnum(EnumDeclaration node);

    void visitEnumMember(EnumMemberDeclaration node);

    void visitConstructor(ConstructorDeclaration node);

    void visitField(FieldDeclaration node);

    void visitProperty(PropertyDeclaration node);

    void visitMethod(MethodDeclaration node);

    void visitNamespace(NamespaceDeclaration node);
}
