package com.umlarchitect.core.parser.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithModifiers;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.TypeParameter;
import com.umlarchitect.core.parser.SourceParser;
import com.umlarchitect.core.syntax.Accessor;
import com.umlarchitect.core.syntax.Declaration;
import com.umlarchitect.core.syntax.Expression;
import com.umlarchitect.core.syntax.ExpressionKind;
import com.umlarchitect.core.syntax.Modifier;
import com.umlarchitect.core.syntax.Parameter;
import com.umlarchitect.core.syntax.SyntaxTree;
import com.umlarchitect.core.syntax.VariableDeclarator;

/**
 * Java front end that converts JavaParser compilation units into syntax trees.
 *
 * <p><b>Mapping:</b>
 * <ul>
 *   <li>package: namespace wrapping the file's types</li>
 *   <li>class: class; base types are the extended class followed by the implemented
 *       interfaces</li>
 *   <li>interface: interface; base types are the extended interfaces</li>
 *   <li>record: struct; each component becomes a read-only property with a {@code get}
 *       accessor, declared before the record body members</li>
 *   <li>enum: enum with one member per constant; fields and methods in the enum body are
 *       not part of the diagram</li>
 *   <li>annotation type: skipped</li>
 * </ul>
 *
 * <p>Modifiers, types, type parameter clauses and literals are kept as written. Annotations
 * are not modifiers. Text block initializers are treated as non-literal because they span
 * several lines.
 *
 * <p>Method bodies are never descended into, so local and anonymous classes do not appear.
 */
public class JavaSourceParser implements SourceParser {

    private static final Logger log = LoggerFactory.getLogger(JavaSourceParser.class);

    private static final String LANGUAGE = "java";
    private static final String FILE_EXTENSION = "java";
    private static final String RECORD_ACCESSOR = "get";
    private static final String VARARGS_SUFFIX = "...";

    /**
     * JavaParser instance configured for Java 17 sources.
     */
    private final JavaParser javaParser;

    public JavaSourceParser() {
        ParserConfiguration configuration = new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.javaParser = new JavaParser(configuration);
    }

    @Override
    public SyntaxTree parseFile(Path filePath) throws IOException {
        String content = Files.readString(filePath);
        return parseString(filePath.toString(), content);
    }

    @Override
    public SyntaxTree parseString(String sourceName, String sourceCode) {
        ParseResult<CompilationUnit> result = javaParser.parse(sourceCode);

        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            log.debug("Failed to parse Java source: {}", sourceName);
            result.getProblems().forEach(problem -> log.debug("  - {}", problem));
            throw new SourceParseException("Failed to parse " + sourceName + ": " + describe(result.getProblems()));
        }

        return toSyntaxTree(sourceName, result.getResult().get());
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String getLanguage() {
        return LANGUAGE;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    // ==================== Compilation unit ====================

    private SyntaxTree toSyntaxTree(String sourceName, CompilationUnit unit) {
        List<Declaration> types = new ArrayList<>();
        for (TypeDeclaration<?> type : unit.getTypes()) {
            convertType(type).ifPresent(types::add);
        }

        List<Declaration> members = unit.getPackageDeclaration()
            .<List<Declaration>>map(pkg -> List.of(new Declaration.NamespaceDeclaration(pkg.getNameAsString(), types)))
            .orElse(types);

        log.debug("Parsed {} top-level types from {}", types.size(), sourceName);
        return new SyntaxTree(sourceName, members);
    }

    // ==================== Types ====================

    private Optional<Declaration> convertType(TypeDeclaration<?> type) {
        if (type instanceof ClassOrInterfaceDeclaration classOrInterface) {
            return Optional.of(convertClassOrInterface(classOrInterface));
        }
        if (type instanceof RecordDeclaration recordDecl) {
            return Optional.of(convertRecord(recordDecl));
        }
        if (type instanceof EnumDeclaration enumDecl) {
            return Optional.of(convertEnum(enumDecl));
        }
        if (type instanceof AnnotationDeclaration) {
            log.debug("Skipping annotation type: {}", type.getNameAsString());
        }
        return Optional.empty();
    }

    private Declaration convertClassOrInterface(ClassOrInterfaceDeclaration decl) {
        String name = decl.getNameAsString();
        List<Modifier> modifiers = modifiers(decl);
        String typeParameters = typeParameters(decl.getTypeParameters());
        List<Declaration> members = members(decl.getMembers());

        if (decl.isInterface()) {
            return new Declaration.InterfaceDeclaration(
                name, modifiers, typeParameters, typeNames(decl.getExtendedTypes()), members);
        }

        List<String> baseTypes = new ArrayList<>(typeNames(decl.getExtendedTypes()));
        baseTypes.addAll(typeNames(decl.getImplementedTypes()));
        return new Declaration.ClassDeclaration(name, modifiers, typeParameters, baseTypes, members);
    }

    private Declaration convertRecord(RecordDeclaration decl) {
        List<Declaration> members = new ArrayList<>();
        for (com.github.javaparser.ast.body.Parameter component : decl.getParameters()) {
            members.add(new Declaration.PropertyDeclaration(
                component.getNameAsString(),
                List.of(),
                component.getType().asString(),
                List.of(Accessor.of(RECORD_ACCESSOR)),
                null
            ));
        }
        members.addAll(members(decl.getMembers()));

        return new Declaration.StructDeclaration(
            decl.getNameAsString(),
            modifiers(decl),
            typeParameters(decl.getTypeParameters()),
            typeNames(decl.getImplementedTypes()),
            members
        );
    }

    private Declaration convertEnum(EnumDeclaration decl) {
        List<Declaration.EnumMemberDeclaration> constants = decl.getEntries().stream()
            .map(entry -> Declaration.EnumMemberDeclaration.of(entry.getNameAsString()))
            .toList();
        return new Declaration.EnumDeclaration(decl.getNameAsString(), constants);
    }

    // ==================== Members ====================

    private List<Declaration> members(NodeList<BodyDeclaration<?>> bodyDeclarations) {
        List<Declaration> members = new ArrayList<>();
        for (BodyDeclaration<?> body : bodyDeclarations) {
            if (body instanceof FieldDeclaration field) {
                members.addAll(convertField(field));
            } else if (body instanceof ConstructorDeclaration constructor) {
                members.add(new Declaration.ConstructorDeclaration(
                    constructor.getNameAsString(), modifiers(constructor), parameters(constructor.getParameters())));
            } else if (body instanceof MethodDeclaration method) {
                members.add(new Declaration.MethodDeclaration(
                    method.getNameAsString(), modifiers(method), method.getType().asString(),
                    parameters(method.getParameters())));
            } else if (body instanceof TypeDeclaration<?> nested) {
                convertType(nested).ifPresent(members::add);
            }
        }
        return members;
    }

    /**
     * Array brackets after a variable name belong to that variable, so {@code int a[], b;}
     * declares an {@code int[]} and an {@code int}. Consecutive declarators sharing a type
     * are kept together in one field declaration.
     */
    private List<Declaration> convertField(FieldDeclaration field) {
        List<Declaration> fields = new ArrayList<>();
        List<Modifier> modifiers = modifiers(field);
        String currentType = null;
        List<VariableDeclarator> group = new ArrayList<>();
        for (com.github.javaparser.ast.body.VariableDeclarator variable : field.getVariables()) {
            String type = variable.getType().asString();
            if (currentType != null && !currentType.equals(type)) {
                fields.add(new Declaration.FieldDeclaration(modifiers, currentType, group));
                group = new ArrayList<>();
            }
            currentType = type;
            group.add(new VariableDeclarator(
                variable.getNameAsString(),
                variable.getInitializer().map(this::expression).orElse(null)));
        }
        if (currentType != null) {
            fields.add(new Declaration.FieldDeclaration(modifiers, currentType, group));
        }
        return fields;
    }

    private List<Parameter> parameters(NodeList<com.github.javaparser.ast.body.Parameter> parameters) {
        return parameters.stream()
            .map(parameter -> new Parameter(
                parameter.getNameAsString(),
                parameter.isVarArgs()
                    ? parameter.getType().asString() + VARARGS_SUFFIX
                    : parameter.getType().asString()))
            .toList();
    }

    // ==================== Text helpers ====================

    private List<Modifier> modifiers(NodeWithModifiers<?> node) {
        return node.getModifiers().stream()
            .map(modifier -> Modifier.of(modifier.getKeyword().asString()))
            .toList();
    }

    private String typeParameters(NodeList<TypeParameter> typeParameters) {
        if (typeParameters.isEmpty()) {
            return "";
        }
        return typeParameters.stream()
            .map(TypeParameter::asString)
            .collect(Collectors.joining(", ", "<", ">"));
    }

    private List<String> typeNames(NodeList<ClassOrInterfaceType> types) {
        return types.stream()
            .map(ClassOrInterfaceType::asString)
            .toList();
    }

    /**
     * Classifies an initializer by its JavaParser node type.
     *
     * <p>A negative number such as {@code -1} is a unary expression, not a literal.
     */
    private Expression expression(com.github.javaparser.ast.expr.Expression expr) {
        String text = expr.toString();
        if (expr instanceof TextBlockLiteralExpr) {
            return Expression.other(text);
        }
        if (expr instanceof IntegerLiteralExpr || expr instanceof LongLiteralExpr || expr instanceof DoubleLiteralExpr) {
            return Expression.literal(ExpressionKind.NUMERIC_LITERAL, text);
        }
        if (expr instanceof StringLiteralExpr) {
            return Expression.literal(ExpressionKind.STRING_LITERAL, text);
        }
        if (expr instanceof CharLiteralExpr) {
            return Expression.literal(ExpressionKind.CHARACTER_LITERAL, text);
        }
        if (expr instanceof BooleanLiteralExpr) {
            return Expression.literal(ExpressionKind.BOOLEAN_LITERAL, text);
        }
        if (expr instanceof NullLiteralExpr) {
            return Expression.literal(ExpressionKind.NULL_LITERAL, text);
        }
        return Expression.other(text);
    }

    private String describe(List<Problem> problems) {
        if (problems.isEmpty()) {
            return "unknown error";
        }
        return problems.get(0).getMessage();
    }
}
