package com.umlarchitect.core.generator;

/**
 * Append-only destination for diagram lines.
 *
 * <p>Each call receives one complete line, already indented, without a line terminator.
 * A {@code List<String>} works directly via {@code lines::add}.
 */
@FunctionalInterface
public interface LineSink {

    /**
     * Appends one line.
     *
     * @param line indented line content
     */
    void writeLine(String line);
}
