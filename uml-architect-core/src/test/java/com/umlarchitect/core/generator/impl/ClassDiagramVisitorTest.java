package com.umlarchitect.core.generator.impl;

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
import com.umlarchitect.core.syntax.Expression;
import com.umlarchitect.core.syntax.ExpressionKind;
import com.umlarchitect.core.syntax.Modifier;
import com.umlarchitect.core.syntax.Parameter;
import com.umlarchitect.core.syntax.SyntaxTree;
import com.umlarchitect.core.syntax.VariableDeclarator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link ClassDiagramVisitor}.
 */
class ClassDiagramVisitorTest {

    private static final String INDENT = "    ";

    private List<String> lines;
    private ClassDiagramVisitor visitor;

    @BeforeEach
    void setUp() {
        lines = new ArrayList<>();
        visitor = new ClassDiagramVisitor(lines::add, INDENT);
    }

    @Test
    void visit_withEmptyTree_writesNothing() {
        visitor.visit(new SyntaxTree("Empty.java", List.of()));

        assertThat(lines).isEmpty();
    }

    @Test
    void visitClass_withoutModifiers_writesPlainHeader() {
        visit(new ClassDeclaration("Foo", List.of(), "", List.of(), List.of()));

        assertThat(lines).containsExactly("class Foo {", "}");
    }

    @Test
    void visitClass_withVisibilityOnly_dropsVisibility() {
        visit(new ClassDeclaration("Foo", Modifier.listOf("public"), "", List.of(), List.of()));

        assertThat(lines).containsExactly("class Foo {", "}");
    }

    @Test
    void visitClass_withAbstractAndSealed_prefixesAbstractAndAddsStereotype() {
        visit(new ClassDeclaration("Shape", Modifier.listOf("public", "abstract", "sealed"), "", List.of(), List.of()));

        assertThat(lines).containsExactly("abstract class Shape <<sealed>> {", "}");
    }

    @Test
    void visitClass_withTypeParameters_appendsThemVerbatim() {
        visit(new ClassDeclaration("Box", List.of(), "<T extends Comparable<T>>", List.of(), List.of()));

        assertThat(lines).containsExactly("class Box<T extends Comparable<T>> {", "}");
    }

    @Test
    void visitClass_withBaseTypes_writesEdgesAfterClosingBraceInOrder() {
        visit(new ClassDeclaration("Circle", List.of(), "", List.of("Shape", "IComparable<Circle>"), List.of()));

        assertThat(lines).containsExactly(
            "class Circle {",
            "}",
            "Circle <|-- Shape",
            "Circle <|-- IComparable<Circle>"
        );
    }

    @Test
    void visitInterface_writesInterfaceHeader() {
        visit(new InterfaceDeclaration("IShape", Modifier.listOf("public"), "<T>", List.of("IBase"), List.of(
            new MethodDeclaration("Area", List.of(), "double", List.of())
        )));

        assertThat(lines).containsExactly(
            "interface IShape<T> {",
            "    Area() : double",
            "}",
            "IShape <|-- IBase"
        );
    }

    @Test
    void visitStruct_writesStructStereotypeBeforeModifierStereotypes() {
        visit(new StructDeclaration("Point", Modifier.listOf("public", "readonly"), "", List.of(), List.of()));

        assertThat(lines).containsExactly("class Point <<struct>> <<readonly>> {", "}");
    }

    @Test
    void visitEnum_writesMembersWithTrailingComma() {
        visit(new EnumDeclaration("Color", List.of(
            EnumMemberDeclaration.of("A"),
            new EnumMemberDeclaration("B", "2")
        )));

        assertThat(lines).containsExactly(
            "enum Color {",
            "    A,",
            "    B = 2,",
            "}"
        );
    }

    @Test
    void visitEnumMember_withEmptyValue_omitsAssignment() {
        visit(new EnumDeclaration("Color", List.of(new EnumMemberDeclaration("B", ""))));

        assertThat(lines).containsExactly("enum Color {", "    B,", "}");
    }

    @Test
    void visitField_withLiteralInitializer_showsInitializer() {
        visitMember(new FieldDeclaration(Modifier.listOf("private"), "int",
            List.of(new VariableDeclarator("count", Expression.literal(ExpressionKind.NUMERIC_LITERAL, "0")))));

        assertThat(lines).contains("    - count : int = 0");
    }

    @Test
    void visitField_withNonLiteralInitializer_suppressesInitializer() {
        visitMember(new FieldDeclaration(Modifier.listOf("private"), "List<String>",
            List.of(new VariableDeclarator("names", Expression.other("new ArrayList<>()")))));

        assertThat(lines).contains("    - names : List<String>");
    }

    @Test
    void visitField_withSeveralVariables_writesOneLinePerVariable() {
        visitMember(new FieldDeclaration(Modifier.listOf("public", "static"), "int", List.of(
            VariableDeclarator.of("x"),
            new VariableDeclarator("y", Expression.literal(ExpressionKind.NUMERIC_LITERAL, "1"))
        )));

        assertThat(lines).containsSubsequence(
            "    + {static} x : int",
            "    + {static} y : int = 1"
        );
    }

    @Test
    void visitProperty_withAccessors_writesAccessorStereotypes() {
        visitMember(new PropertyDeclaration("Name", Modifier.listOf("public"), "string",
            List.of(Accessor.of("get"), Accessor.of("set")), null));

        assertThat(lines).contains("    + Name : string <<get>> <<set>>");
    }

    @Test
    void visitProperty_withPrivateAccessor_suppressesIt() {
        visitMember(new PropertyDeclaration("Id", Modifier.listOf("public"), "int",
            List.of(Accessor.of("get"), new Accessor("set", Modifier.listOf("private"))), null));

        assertThat(lines).contains("    + Id : int <<get>>");
    }

    @Test
    void visitProperty_withProtectedAccessor_keepsAccessorModifiers() {
        visitMember(new PropertyDeclaration("Id", Modifier.listOf("public"), "int",
            List.of(Accessor.of("get"), new Accessor("set", Modifier.listOf("protected"))), null));

        assertThat(lines).contains("    + Id : int <<get>> <<protected set>>");
    }

    @Test
    void visitProperty_withLiteralInitializer_appendsInitializer() {
        visitMember(new PropertyDeclaration("Title", List.of(), "string",
            List.of(Accessor.of("get")), Expression.literal(ExpressionKind.STRING_LITERAL, "\"none\"")));

        assertThat(lines).contains("    Title : string <<get>> = \"none\"");
    }

    @Test
    void visitProperty_withoutAccessors_keepsSeparatorSpace() {
        visitMember(new PropertyDeclaration("Value", List.of(), "int", List.of(), null));

        assertThat(lines).contains("    Value : int ");
    }

    @Test
    void visitConstructor_writesParametersWithoutSpaceAroundColon() {
        visitMember(new ConstructorDeclaration("Circle", Modifier.listOf("public"), List.of(
            new Parameter("radius", "double"),
            new Parameter("name", "string")
        )));

        assertThat(lines).contains("    + Circle(radius:double, name:string)");
    }

    @Test
    void visitMethod_withStaticAndAbstract_writesBracedModifiers() {
        visitMember(new MethodDeclaration("Create", Modifier.listOf("public", "static"), "Shape",
            List.of(new Parameter("kind", "string"))));
        visitMember(new MethodDeclaration("Area", Modifier.listOf("protected", "abstract"), "double", List.of()));

        assertThat(lines)
            .contains("    + {static} Create(kind:string) : Shape")
            .contains("    # {abstract} Area() : double");
    }

    @Test
    void visitMethod_withOtherModifiers_writesStereotypes() {
        visitMember(new MethodDeclaration("Run", Modifier.listOf("internal", "async"), "Task", List.of()));

        assertThat(lines).contains("    <<internal>> <<async>> Run() : Task");
    }

    @Test
    void visitNamespace_isTransparent() {
        visitor.visit(new SyntaxTree("Shapes.cs", List.of(
            new NamespaceDeclaration("Shapes", List.of(
                new ClassDeclaration("Circle", List.of(), "", List.of(), List.of())
            ))
        )));

        assertThat(lines).containsExactly("class Circle {", "}");
    }

    @Test
    void visit_withNestedTypes_indentsByDepthAndRestoresDepth() {
        ClassDeclaration inner = new ClassDeclaration("Inner", List.of(), "", List.of("Base"), List.of(
            new FieldDeclaration(List.of(), "int", List.of(VariableDeclarator.of("x")))
        ));
        ClassDeclaration outer = new ClassDeclaration("Outer", List.of(), "", List.of(), List.of(inner));

        visit(outer);

        assertThat(lines).containsExactly(
            "class Outer {",
            "    class Inner {",
            "        x : int",
            "    }",
            "    Inner <|-- Base",
            "}"
        );
        assertThat(visitor.getNestingDepth()).isZero();
    }

    @Test
    void visit_withCustomIndent_usesIndentPerLevel() {
        List<String> tabbed = new ArrayList<>();
        ClassDiagramVisitor tabVisitor = new ClassDiagramVisitor(tabbed::add, "\t");

        tabVisitor.visit(new SyntaxTree("A.java", List.of(
            new ClassDeclaration("A", List.of(), "", List.of(), List.of(
                new MethodDeclaration("run", List.of(), "void", List.of())
            ))
        )));

        assertThat(tabbed).containsExactly("class A {", "\trun() : void", "}");
    }

    @Test
    void visit_writesBalancedBraces() {
        visit(new ClassDeclaration("A", List.of(), "", List.of(), List.of(
            new EnumDeclaration("Kind", List.of(EnumMemberDeclaration.of("X"))),
            new StructDeclaration("P", List.of(), "", List.of(), List.of())
        )));

        long opening = lines.stream().filter(line -> line.endsWith("{")).count();
        long closing = lines.stream().filter(line -> line.trim().equals("}")).count();
        assertThat(opening).isEqualTo(closing).isEqualTo(3);
    }

    @Test
    void constructor_withNullSink_throwsException() {
        assertThatThrownBy(() -> new ClassDiagramVisitor(null, INDENT))
            .isInstanceOf(NullPointerException.class);
    }

    private void visit(Declaration declaration) {
        visitor.visit(new SyntaxTree("Test.cs", List.of(declaration)));
    }

    private void visitMember(Declaration member) {
        visit(new ClassDeclaration("Host", List.of(), "", List.of(), List.of(member)));
    }
}
