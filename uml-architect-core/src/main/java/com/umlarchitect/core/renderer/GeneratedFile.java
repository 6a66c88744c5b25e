package com.umlarchitect.core.renderer;

import java.util.Objects;

/**
 * A generated file to be rendered.
 *
 * @param relativePath path relative to the output directory, with forward slashes
 *                     (e.g., "com/example/Order.puml")
 * @param content file content
 * @param contentType content type, may be null
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /** Content type of PlantUML sources. */
    public static final String PLANTUML_CONTENT_TYPE = "text/x-plantuml";

    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
