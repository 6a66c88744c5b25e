package com.umlarchitect.core.generator.impl;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.umlarchitect.core.generator.LineSink;
import com.umlarchitect.core.syntax.Accessor;
import com.umlarchitect.core.syntax.Declaration;
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
import com.umlarchitect.core.syntax.Declaration.TypeDeclaration;
import com.umlarchitect.core.syntax.DeclarationVisitor;
import com.umlarchitect.core.syntax.Expression;
import com.umlarchitect.core.syntax.Modifier;
import com.umlarchitect.core.syntax.ModifierKind;
import com.umlarchitect.core.syntax.Parameter;
import com.umlarchitect.core.syntax.SyntaxTree;
import com.umlarchitect.core.syntax.VariableDeclarator;

/**
 * Walks a syntax tree depth-first and writes PlantUML class diagram lines.
 *
 * <p>Containers (interfaces, classes, structs, enums) produce a header line, their members
 * one level deeper, and a closing brace. Inheritance edges of a type follow its closing
 * brace, one per base type in source order. Every other declaration produces exactly one
 * line (fields one per declared variable). Namespaces are transparent.
 *
 * <h2>Output</h2>
 * <pre>{@code
 * abstract class Shape<T> <<sealed>> {
 *     # sides : int = 3
 *     + Name : string <<get>>
 *     + Shape(name:string)
 *     + {abstract} Area() : double
 * }
 * Shape <|-- IComparable<T>
 * enum Color {
 *     Red,
 *     Green = 2,
 * }
 * }</pre>
 *
 * <p>Every line is prefixed with the indent unit repeated once per enclosing container. The
 * depth is back at its starting value after each declaration.
 *
 * <p>The visitor performs no validation. Absent parts of a node (no modifiers, no type
 * parameters, no initializer) are omitted; the input tree must be well formed and acyclic.
 * An instance holds traversal state and is meant for a single tree.
 */
public class ClassDiagramVisitor implements DeclarationVisitor {

    private static final String INTERFACE_KEYWORD = "interface";
    private static final String CLASS_KEYWORD = "class";
    private static final String ENUM_KEYWORD = "enum";
    private static final String ABSTRACT_PREFIX = "abstract ";
    private static final String STRUCT_STEREOTYPE = "<<struct>> ";
    private static final String OPEN_BRACE = "{";
    private static final String CLOSE_BRACE = "}";
    private static final String INHERITANCE_ARROW = " <|-- ";
    private static final String PARAMETER_SEPARATOR = ", ";

    private final LineSink sink;
    private final String indent;
    private int nestingDepth = 0;

    /**
     * Creates a visitor writing to the given sink.
     *
     * @param sink destination for indented lines
     * @param indent indentation unit per nesting level
     */
    public ClassDiagramVisitor(LineSink sink, String indent) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.indent = Objects.requireNonNull(indent, "indent must not be null");
    }

    /**
     * Visits all top-level declarations of a tree.
     *
     * @param tree tree to visit
     */
    public void visit(SyntaxTree tree) {
        tree.accept(this);
    }

    /**
     * Current nesting depth; zero outside any container.
     *
     * @return nesting depth
     */
    public int getNestingDepth() {
        return nestingDepth;
    }

    @Override
    public void visitInterface(InterfaceDeclaration node) {
        visitTypeDeclaration(node, INTERFACE_KEYWORD, "");
    }

    @Override
    public void visitClass(ClassDeclaration node) {
        visitTypeDeclaration(node, CLASS_KEYWORD, "");
    }

    @Override
    public void visitStruct(StructDeclaration node) {
        visitTypeDeclaration(node, CLASS_KEYWORD, STRUCT_STEREOTYPE);
    }

    @Override
    public void visitEnum(EnumDeclaration node) {
        writeLine(ENUM_KEYWORD + " " + node.identifier() + " " + OPEN_BRACE);
        visitMembers(node.members());
        writeLine(CLOSE_BRACE);
    }

    @Override
    public void visitEnumMember(EnumMemberDeclaration node) {
        String value = node.value() != null && !node.value().isEmpty() ? " = " + node.value() : "";
        writeLine(node.identifier() + value + ",");
    }

    @Override
    public void visitConstructor(ConstructorDeclaration node) {
        writeLine(ModifierNotation.memberModifiers(node.modifiers())
            + node.identifier() + "(" + formatParameters(node.parameters()) + ")");
    }

    @Override
    public void visitField(FieldDeclaration node) {
        String modifiers = ModifierNotation.memberModifiers(node.modifiers());
        for (VariableDeclarator variable : node.variables()) {
            writeLine(modifiers + variable.name() + " : " + node.type()
                + initializerSuffix(variable.initializer()));
        }
    }

    @Override
    public void visitProperty(PropertyDeclaration node) {
        writeLine(ModifierNotation.memberModifiers(node.modifiers())
            + node.identifier() + " : " + node.type() + " "
            + formatAccessors(node.accessors())
            + initializerSuffix(node.initializer()));
    }

    @Override
    public void visitMethod(MethodDeclaration node) {
        writeLine(ModifierNotation.memberModifiers(node.modifiers())
            + node.identifier() + "(" + formatParameters(node.parameters()) + ") : "
            + node.returnType());
    }

    @Override
    public void visitNamespace(NamespaceDeclaration node) {
        for (Declaration member : node.members()) {
            member.accept(this);
        }
    }

    /**
     * Writes header, members, closing brace and inheritance edges of a type.
     *
     * @param node type declaration
     * @param keyword diagram keyword ("class" or "interface")
     * @param fixedStereotype stereotype placed before the modifier stereotypes, or empty
     */
    private void visitTypeDeclaration(TypeDeclaration node, String keyword, String fixedStereotype) {
        String prefix = node.hasModifier(ModifierKind.ABSTRACT) ? ABSTRACT_PREFIX : "";
        String name = node.identifier();

        writeLine(prefix + keyword + " " + name + node.typeParameters() + " "
            + fixedStereotype + ModifierNotation.typeStereotypes(node.modifiers()) + OPEN_BRACE);
        visitMembers(node.members());
        writeLine(CLOSE_BRACE);

        for (String baseType : node.baseTypes()) {
            writeLine(name + INHERITANCE_ARROW + baseType);
        }
    }

    private void visitMembers(List<? extends Declaration> members) {
        nestingDepth++;
        try {
            for (Declaration member : members) {
                member.accept(this);
            }
        } finally {
            nestingDepth--;
        }
    }

    /**
     * Formats parameters as {@code name:type} pairs.
     *
     * @param parameters parameters in declaration order
     * @return comma-separated list, empty for no parameters
     */
    private String formatParameters(List<Parameter> parameters) {
        return parameters.stream()
            .map(parameter -> parameter.name() + ":" + parameter.type())
            .collect(Collectors.joining(PARAMETER_SEPARATOR));
    }

    /**
     * Formats non-private accessors as stereotypes, e.g. {@code <<get>> <<protected set>>}.
     *
     * @param accessors property accessors
     * @return space-separated stereotypes, empty if none qualify
     */
    private String formatAccessors(List<Accessor> accessors) {
        return accessors.stream()
            .filter(accessor -> !accessor.isPrivate())
            .map(accessor -> ModifierNotation.stereotype(accessorModifiers(accessor) + accessor.keyword()))
            .collect(Collectors.joining(" "));
    }

    private String accessorModifiers(Accessor accessor) {
        if (accessor.modifiers().isEmpty()) {
            return "";
        }
        return accessor.modifiers().stream()
            .map(Modifier::keyword)
            .collect(Collectors.joining(" ")) + " ";
    }

    /**
     * Literal initializers are shown as {@code " = text"}; anything else is left out.
     *
     * @param initializer initializer expression, may be null
     * @return suffix or empty string
     */
    private String initializerSuffix(Expression initializer) {
        if (initializer == null || !initializer.isLiteral()) {
            return "";
        }
        return " = " + initializer.text();
    }

    private void writeLine(String line) {
        sink.writeLine(indent.repeat(nestingDepth) + line);
    }
}
