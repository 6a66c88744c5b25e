package com.umlarchitect.core.generator;

import com.umlarchitect.core.syntax.SyntaxTree;

/**
 * Interface for generators that turn a parsed syntax tree into diagram text.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI) and selected by
 * {@link #getId()} from configuration or the command line.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class PlantUmlGenerator implements DiagramGenerator {
 *     @Override
 *     public String getId() {
 *         return "plantuml";
 *     }
 *
 *     @Override
 *     public GeneratedDiagram generate(SyntaxTree tree, GeneratorConfig config) {
 *         List<String> lines = new ArrayList<>();
 *         new ClassDiagramVisitor(lines::add, config.indent()).visit(tree);
 *         return new GeneratedDiagram("Shape", String.join("\n", lines), "puml");
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.umlarchitect.core.generator.DiagramGenerator}
 *
 * @see SyntaxTree
 * @see GeneratorConfig
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used for referencing the generator in configuration. Should be lowercase
     * (e.g., "plantuml").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated diagrams, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Generates a diagram from a syntax tree.
     *
     * <p>An empty tree yields a valid, empty diagram rather than an error.
     *
     * @param tree the parsed source to visualize
     * @param config configuration settings for generation
     * @return generated diagram content
     * @throws NullPointerException if tree or config is null
     */
    GeneratedDiagram generate(SyntaxTree tree, GeneratorConfig config);
}
