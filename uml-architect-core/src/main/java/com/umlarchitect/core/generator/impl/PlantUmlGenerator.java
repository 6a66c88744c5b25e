package com.umlarchitect.core.generator.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.umlarchitect.core.generator.DiagramGenerator;
import com.umlarchitect.core.generator.GeneratedDiagram;
import com.umlarchitect.core.generator.GeneratorConfig;
import com.umlarchitect.core.syntax.SyntaxTree;

/**
 * Generates PlantUML class diagrams from syntax trees.
 *
 * <p>The diagram body is produced by a fresh {@link ClassDiagramVisitor} per tree, indented
 * with {@link GeneratorConfig#indent()}. With {@link GeneratorConfig#wrapDocument()} set, the
 * body is enclosed in {@code @startuml} / {@code @enduml} so the file can be rendered on its
 * own; without it the body can be {@code !include}d into a larger diagram.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * SyntaxTree tree = new JavaSourceParser().parseFile(Paths.get("Shape.java"));
 * GeneratedDiagram diagram = new PlantUmlGenerator().generate(tree, GeneratorConfig.defaults());
 * // diagram.fileName() is "Shape.puml"
 * }</pre>
 *
 * @see <a href="https://plantuml.com/class-diagram">PlantUML Class Diagram</a>
 */
public class PlantUmlGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(PlantUmlGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "plantuml";
    private static final String GENERATOR_DISPLAY_NAME = "PlantUML Class Diagram Generator";
    private static final String FILE_EXTENSION = "puml";

    // Document markers
    static final String START_UML = "@startuml";
    static final String END_UML = "@enduml";
    private static final String NEWLINE = "\n";

    private static final String DEFAULT_DIAGRAM_NAME = "class-diagram";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public GeneratedDiagram generate(SyntaxTree tree, GeneratorConfig config) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(config, "config must not be null");

        log.debug("Generating PlantUML class diagram for: {}", tree.sourceName());

        List<String> lines = new ArrayList<>();
        if (config.wrapDocument()) {
            lines.add(START_UML);
        }

        ClassDiagramVisitor visitor = new ClassDiagramVisitor(lines::add, config.indent());
        visitor.visit(tree);

        if (config.wrapDocument()) {
            lines.add(END_UML);
        }

        String diagramName = diagramName(tree.sourceName());
        log.info("Generated PlantUML class diagram: {} ({} lines)", diagramName, lines.size());

        return new GeneratedDiagram(diagramName, toContent(lines), getFileExtension());
    }

    /**
     * Derives the diagram name from the source name: the file name without directories and
     * extension ({@code src/shapes/Shape.java} becomes {@code Shape}).
     *
     * @param sourceName source file path or label
     * @return diagram name, or "class-diagram" when the source has no usable name
     */
    static String diagramName(String sourceName) {
        String fileName = sourceName.replace('\\', '/');
        fileName = fileName.substring(fileName.lastIndexOf('/') + 1);

        int lastDot = fileName.lastIndexOf('.');
        if (lastDot > 0) {
            fileName = fileName.substring(0, lastDot);
        }
        return fileName.isBlank() ? DEFAULT_DIAGRAM_NAME : fileName;
    }

    private String toContent(List<String> lines) {
        if (lines.isEmpty()) {
            return "";
        }
        return String.join(NEWLINE, lines) + NEWLINE;
    }
}
