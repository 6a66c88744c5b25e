package com.umlarchitect.core.syntax;

import java.util.List;
import java.util.Objects;

/**
 * A declaration node of a parsed source file.
 *
 * <p>The node kinds form a closed set: the containers ({@link InterfaceDeclaration},
 * {@link ClassDeclaration}, {@link StructDeclaration}, {@link EnumDeclaration}), the members
 * ({@link ConstructorDeclaration}, {@link FieldDeclaration}, {@link PropertyDeclaration},
 * {@link MethodDeclaration}, {@link EnumMemberDeclaration}) and the transparent
 * {@link NamespaceDeclaration}. Each node dispatches to its own {@link DeclarationVisitor}
 * method, so adding a kind breaks every visitor at compile time.
 *
 * <p>All nodes are immutable. Collections are copied, {@code null} collections become empty
 * lists, and {@code null} text becomes the empty string; nodes built from partial parse
 * results therefore never carry nulls into the diagram writer.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * // public abstract class Shape<T> : IComparable<T> { protected int sides = 3; }
 * Declaration shape = new Declaration.ClassDeclaration(
 *     "Shape",
 *     Modifier.listOf("public", "abstract"),
 *     "<T>",
 *     List.of("IComparable<T>"),
 *     List.of(new Declaration.FieldDeclaration(
 *         Modifier.listOf("protected"),
 *         "int",
 *         List.of(new VariableDeclarator("sides",
 *             Expression.literal(ExpressionKind.NUMERIC_LITERAL, "3")))))
 * );
 * }</pre>
 *
 * @see DeclarationVisitor
 * @see SyntaxTree
 */
public sealed interface Declaration {

    /**
     * Dispatches this node to the matching visitor method.
     *
     * @param visitor visitor to call
     */
    void accept(DeclarationVisitor visitor);

    /**
     * A type declaration that can own members and inherit from base types:
     * interfaces, classes and structs.
     */
    sealed interface TypeDeclaration extends Declaration {

        String identifier();

        List<Modifier> modifiers();

        /**
         * Verbatim generic parameter clause, e.g. {@code "<T, U>"}; empty when absent.
         */
        String typeParameters();

        /**
         * Base types in source order, verbatim including generic arguments.
         */
        List<String> baseTypes();

        List<Declaration> members();

        default boolean hasModifier(ModifierKind kind) {
            return Modifier.contains(modifiers(), kind);
        }
    }

    /**
     * Interface declaration.
     *
     * @param identifier interface name
     * @param modifiers modifiers in source order
     * @param typeParameters verbatim type parameter clause
     * @param baseTypes extended interfaces
     * @param members member declarations in source order
     */
    record InterfaceDeclaration(
        String identifier,
        List<Modifier> modifiers,
        String typeParameters,
        List<String> baseTypes,
        List<Declaration> members
    ) implements TypeDeclaration {
        public InterfaceDeclaration {
            identifier = Objects.requireNonNullElse(identifier, "");
            modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
            typeParameters = Objects.requireNonNullElse(typeParameters, "");
            baseTypes = baseTypes != null ? List.copyOf(baseTypes) : List.of();
            members = members != null ? List.copyOf(members) : List.of();
        }

        @Override
        public void accept(DeclarationVisitor visitor) {
            visitor.visitInterface(this);
        }
    }

    /**
     * Class declaration.
     *
     * @param identifier class name
     * @param modifiers modifiers in source order
     * @param typeParameters verbatim type parameter clause
     * @param baseTypes base class and implemented interfaces, in source order
     * @param members member declarations in source order
     */
    record ClassDeclaration(
        String identifier,
        List<Modifier> modifiers,
        String typeParameters,
        List<String> baseTypes,
        List<Declaration> members
    ) implements TypeDeclaration {
        public ClassDeclaration {
            identifier = Objects.requireNonNullElse(identifier, "");
            modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
            typeParameters = Objects.requireNonNullElse(typeParameters, "");
            baseTypes = baseTypes != null ? List.copyOf(baseTypes) : List.of();
            members = members != null ? List.copyOf(members) : List.of();
        }

        @Override
        public void accept(DeclarationVisitor visitor) {
            visitor.visitClass(this);
        }
    }

    /**
     * Struct (value type) declaration. Java records are mapped to this node.
     *
     * @param identifier struct name
     * @param modifiers modifiers in source order
     * @param typeParameters verbatim type parameter clause
     * @param baseTypes implemented interfaces
     * @param members member declarations in source order
     */
    record StructDeclaration(
        String identifier,
        List<Modifier> modifiers,
        String typeParameters,
        List<String> baseTypes,
        List<Declaration> members
    ) implements TypeDeclaration {
        public StructDeclaration {
            identifier = Objects.requireNonNullElse(identifier, "");
            modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
            typeParameters = Objects.requireNonNullElse(typeParameters, "");
            baseTypes = baseTypes != null ? List.copyOf(baseTypes) : List.of();
            members = members != null ? List.copyOf(members) : List.of();
        }

        @Override
        public void accept(DeclarationVisitor visitor) {
            visitor.visitStruct(this);
        }
    }

    /**
     * Enum declaration. Enum modifiers and underlying types are not part of the diagram.
     *
     * @param identifier enum name
     * @param members enum members in source order
     */
    record EnumDeclaration(
        String identifier,
        List<EnumMemberDeclaration> members
    ) implements Declaration {
        public EnumDeclaration {
            identifier = Objects.requireNonNullElse(identifier, "");
            members = members != null ? List.copyOf(members) : List.of();
        }

        @Override
        public void accept(DeclarationVisitor visitor) {
            visitor.visitEnum(this);
        }
    }

    /**
     * Enum member, optionally with an explicit value.
     *
     * @param identifier member name
     * @param value verbatim value expression ({@code "2"} for {@code B = 2}), or null
     */
    record EnumMemberDeclaration(
        String identifier,
        String value
    ) implements Declaration {
        public EnumMemberDeclaration {
            identifier = Objects.requireNonNullElse(identifier, "");
        }

        public static EnumMemberDeclaration of(String identifier) {
            return new EnumMemberDeclaration(identifier, null);
        }

        @Override
        public void accept(DeclarationVisitor visitor) {
            visitor.visitEnumMember(this);
        }
    }

    /**
     * Constructor declaration.
     *
     * @param identifier constructor name (the type name)
     * @param modifiers modifiers in source order
     * @param parameters parameters in declaration order
     */
    record ConstructorDeclaration(
        String identifier,
        List<Modifier> modifiers,
        List<Parameter> parameters
    ) implements Declaration {
        public ConstructorDeclaration {
            identifier = Objects.requireNonNullElse(identifier, "");
            modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
            parameters = parameters != null ? List.copyOf(parameters) : List.of();
        }

        @Override
        public void accept(DeclarationVisitor visitor) {
            visitor.visitConstructor(this);
        }
    }

    /**
     * Field declaration statement, possibly declaring several variables of one type.
     *
     * @param modifiers modifiers in source order
     * @param type declared type, verbatim
     * @param variables declared variables in source order
     */
    record FieldDeclaration(
        List<Modifier> modifiers,
        String type,
        List<VariableDeclarator> variables
    ) implements Declaration {
        public FieldDeclaration {
            modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
            type = Objects.requireNonNullElse(type, "");
            variables = variables != null ? List.copyOf(variables) : List.of();
        }

        @Override
        public void accept(DeclarationVisitor visitor) {
            visitor.visitField(this);
        }
    }

    /**
     * Property declaration with accessors.
     *
     * @param identifier property name
     * @param modifiers modifiers in source order
     * @param type declared type, verbatim
     * @param accessors accessors in source order (empty for expression-bodied properties)
     * @param initializer initializer expression, or null
     */
    record PropertyDeclaration(
        String identifier,
        List<Modifier> modifiers,
        String type,
        List<Accessor> accessors,
        Expression initializer
    ) implements Declaration {
        public PropertyDeclaration {
            identifier = Objects.requireNonNullElse(identifier, "");
            modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
            type = Objects.requireNonNullElse(type, "");
            accessors = accessors != null ? List.copyOf(accessors) : List.of();
        }

        @Override
        public void accept(DeclarationVisitor visitor) {
            visitor.visitProperty(this);
        }
    }

    /**
     * Method declaration.
     *
     * @param identifier method name
     * @param modifiers modifiers in source order
     * @param returnType return type, verbatim
     * @param parameters parameters in declaration order
     */
    record MethodDeclaration(
        String identifier,
        List<Modifier> modifiers,
        String returnType,
        List<Parameter> parameters
    ) implements Declaration {
        public MethodDeclaration {
            identifier = Objects.requireNonNullElse(identifier, "");
            modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
            returnType = Objects.requireNonNullElse(returnType, "");
            parameters = parameters != null ? List.copyOf(parameters) : List.of();
        }

        @Override
        public void accept(DeclarationVisitor visitor) {
            visitor.visitMethod(this);
        }
    }

    /**
     * Namespace or package grouping. Produces no diagram lines of its own.
     *
     * @param name namespace name (e.g., "com.example.shapes")
     * @param members declarations inside the namespace
     */
    record NamespaceDeclaration(
        String name,
        List<Declaration> members
    ) implements Declaration {
        public NamespaceDeclaration {
            name = Objects.requireNonNullElse(name, "");
            members = members != null ? List.copyOf(members) : List.of();
        }

        @Override
        public void accept(DeclarationVisitor visitor) {
            visitor.visitNamespace(this);
        }
    }
}
