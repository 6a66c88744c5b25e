package com.umlarchitect.core.parser;

import java.io.IOException;
import java.nio.file.Path;

import com.umlarchitect.core.syntax.SyntaxTree;

/**
 * Common interface for language-specific source front ends.
 *
 * <p>A source parser turns one source file into a {@link SyntaxTree} of declaration nodes,
 * keeping type references, parameter types and literals as verbatim source text. It does no
 * semantic resolution: a field of type {@code Order} stays the text {@code "Order"}.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * SourceParser parser = new JavaSourceParser();
 * SyntaxTree tree = parser.parseFile(Paths.get("src/main/java/com/example/Order.java"));
 * }</pre>
 *
 * @see com.umlarchitect.core.parser.impl.JavaSourceParser
 */
public interface SourceParser {

    /**
     * Parses a source file.
     *
     * @param filePath path to the source file
     * @return syntax tree named after the file
     * @throws IOException if the file cannot be read
     * @throws SourceParseException if the content is not valid source
     */
    SyntaxTree parseFile(Path filePath) throws IOException;

    /**
     * Parses source text.
     *
     * @param sourceName name recorded in the tree (file path or label)
     * @param sourceCode source text
     * @return syntax tree
     * @throws SourceParseException if the content is not valid source
     */
    SyntaxTree parseString(String sourceName, String sourceCode);

    /**
     * Checks if this parser is available (i.e., required dependencies are present).
     *
     * @return true if parser is available, false otherwise
     */
    boolean isAvailable();

    /**
     * Gets the language this parser supports.
     *
     * @return language identifier (e.g., "java")
     */
    String getLanguage();

    /**
     * Gets the source file extension this parser handles, without leading dot.
     *
     * @return file extension (e.g., "java")
     */
    String getFileExtension();

    /**
     * Exception thrown when source text cannot be parsed.
     */
    class SourceParseException extends RuntimeException {
        public SourceParseException(String message, Throwable cause) {
            super(message, cause);
        }

        public SourceParseException(String message) {
            super(message);
        }
    }
}
