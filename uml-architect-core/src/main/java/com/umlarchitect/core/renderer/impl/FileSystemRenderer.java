package com.umlarchitect.core.renderer.impl;

import com.umlarchitect.core.renderer.GeneratedFile;
import com.umlarchitect.core.renderer.GeneratedOutput;
import com.umlarchitect.core.renderer.OutputRenderer;
import com.umlarchitect.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Renderer that writes {@code .puml} files below the output directory.
 *
 * <p>Relative paths are resolved against {@link RenderContext#outputDirectory()}; parent
 * directories are created as needed and existing files are overwritten. Paths that would
 * escape the output directory are rejected.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = new RenderContext("./docs/uml", Map.of());
 * GeneratedOutput output = new GeneratedOutput(List.of(
 *     new GeneratedFile("com/example/Order.puml", "@startuml\n...", GeneratedFile.PLANTUML_CONTENT_TYPE)
 * ));
 * new FileSystemRenderer().render(output, context);
 * // Creates: ./docs/uml/com/example/Order.puml
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory()).toAbsolutePath().normalize();
        log.info("Writing {} diagram(s) to {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }

        log.info("Wrote {} diagram(s)", output.files().size());
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        if (!targetPath.startsWith(outputDir)) {
            throw new IllegalStateException("Refusing to write outside output directory: " + file.relativePath());
        }

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
            log.debug("Wrote file: {} ({} chars)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
