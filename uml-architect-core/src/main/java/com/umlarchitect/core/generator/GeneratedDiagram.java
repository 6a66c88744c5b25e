package com.umlarchitect.core.generator;

import java.util.Objects;

/**
 * Represents a generated diagram.
 *
 * @param name diagram name, usually the source file name without extension
 * @param content diagram text
 * @param fileExtension file extension for this content, without leading dot
 */
public record GeneratedDiagram(
    String name,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedDiagram {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    /**
     * Returns the file name for this diagram.
     *
     * @return name plus extension, e.g. "Shape.puml"
     */
    public String fileName() {
        return name + "." + fileExtension;
    }
}
