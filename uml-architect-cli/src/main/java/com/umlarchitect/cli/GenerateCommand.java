package com.umlarchitect.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.umlarchitect.core.config.ConfigLoader;
import com.umlarchitect.core.config.ProjectConfig;
import com.umlarchitect.core.generator.DiagramGenerator;
import com.umlarchitect.core.generator.GeneratedDiagram;
import com.umlarchitect.core.generator.GeneratorConfig;
import com.umlarchitect.core.parser.SourceParser;
import com.umlarchitect.core.parser.SourceParser.SourceParseException;
import com.umlarchitect.core.parser.impl.JavaSourceParser;
import com.umlarchitect.core.renderer.GeneratedFile;
import com.umlarchitect.core.renderer.GeneratedOutput;
import com.umlarchitect.core.renderer.OutputRenderer;
import com.umlarchitect.core.renderer.RenderContext;
import com.umlarchitect.core.syntax.SyntaxTree;
import com.umlarchitect.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to generate class diagrams from Java sources.
 *
 * <p>Runs the diagram pipeline:
 * <ol>
 *   <li>Load {@code umlarchitect.yaml} (from {@code --config} or the input directory)</li>
 *   <li>Discover the generator and renderer via SPI</li>
 *   <li>Parse each source file and generate one diagram per file</li>
 *   <li>Optionally add an {@code include.puml} index of all diagrams</li>
 *   <li>Render the files to the selected destination</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Single file
 * umlarchitect generate src/main/java/com/example/Order.java
 *
 * # Whole source tree, mirrored below docs/uml, with an index
 * umlarchitect generate src/main/java -o docs/uml --index
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate PlantUML class diagrams from a source file or directory",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    static final String INDEX_FILE_NAME = "include.puml";

    @Parameters(
        index = "0",
        description = "Source file or directory (default: current directory)",
        defaultValue = "."
    )
    private Path inputPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: umlarchitect.yaml in the input directory)"
    )
    private Path configPath;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"--indent"},
        description = "Indentation unit for nested lines (overrides config, default: four spaces)"
    )
    private String indent;

    @Option(
        names = {"--no-wrap"},
        description = "Omit @startuml/@enduml so diagrams can be included elsewhere"
    )
    private boolean noWrap;

    @Option(
        names = {"--renderer"},
        description = "Output renderer: filesystem or console (overrides config)"
    )
    private String rendererId;

    @Option(
        names = {"--index"},
        description = "Also write " + INDEX_FILE_NAME + " including every generated diagram"
    )
    private boolean index;

    @Option(
        names = {"--no-color"},
        description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    private final SourceParser parser = new JavaSourceParser();

    @Override
    public Integer call() {
        try {
            if (!Files.exists(inputPath)) {
                log.error("Input not found: {}", inputPath);
                System.err.println("✗ Input not found: " + inputPath);
                return 1;
            }

            ProjectConfig config = loadConfiguration();
            ProjectConfig.GeneratorSettings generatorSettings = config.effectiveGenerator();
            ProjectConfig.OutputConfig outputConfig = config.effectiveOutput();

            Optional<DiagramGenerator> generator = findGenerator(generatorSettings.effectiveId());
            if (generator.isEmpty()) {
                System.err.println("✗ Unknown generator: " + generatorSettings.effectiveId());
                return 1;
            }

            String selectedRenderer = rendererId != null ? rendererId : outputConfig.effectiveRenderer();
            Optional<OutputRenderer> renderer = findRenderer(selectedRenderer);
            if (renderer.isEmpty()) {
                System.err.println("✗ Unknown renderer: " + selectedRenderer);
                return 1;
            }

            Path root = baseDirectory().toAbsolutePath().normalize();
            List<Path> sources = findSources(config.effectiveInput());
            if (sources.isEmpty()) {
                log.error("No source files found in: {}", inputPath);
                System.err.println("✗ No source files found in: " + inputPath);
                return 1;
            }

            GeneratorConfig generatorConfig = buildGeneratorConfig(generatorSettings);
            List<GeneratedFile> files = generateDiagrams(generator.get(), generatorConfig, root, sources);
            if (files.isEmpty()) {
                System.err.println("✗ None of the " + sources.size() + " source file(s) could be processed");
                return 1;
            }

            if (index || outputConfig.shouldGenerateIndex()) {
                if (files.stream().anyMatch(file -> file.relativePath().equals(INDEX_FILE_NAME))) {
                    log.warn("Not writing {}: a generated diagram already uses that path", INDEX_FILE_NAME);
                    System.err.println("⚠ Skipped " + INDEX_FILE_NAME + ": a diagram already uses that path");
                } else {
                    files.add(buildIndex(files));
                }
            }

            String outputDirectory = outputDir != null ? outputDir.toString() : outputConfig.effectiveDirectory();
            renderer.get().render(new GeneratedOutput(files), new RenderContext(outputDirectory, renderSettings()));
            log.info("Rendered {} file(s) with renderer '{}'", files.size(), renderer.get().getId());
            return 0;

        } catch (IOException | RuntimeException e) {
            log.error("Generation failed", e);
            System.err.println("✗ Generation failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Loads project configuration from YAML file.
     */
    private ProjectConfig loadConfiguration() {
        Path resolvedConfig = configPath;
        if (resolvedConfig == null) {
            resolvedConfig = baseDirectory().resolve(ProjectConfig.DEFAULT_FILE_NAME);
        }
        log.debug("Loading configuration from: {}", resolvedConfig);
        return ConfigLoader.load(resolvedConfig);
    }

    /**
     * Directory that output paths mirror: the input directory, or the parent of a single input file.
     */
    private Path baseDirectory() {
        return Files.isDirectory(inputPath) ? inputPath : inputPath.toAbsolutePath().getParent();
    }

    private GeneratorConfig buildGeneratorConfig(ProjectConfig.GeneratorSettings settings) {
        GeneratorConfig fromConfig = settings.toGeneratorConfig();
        String effectiveIndent = indent != null ? indent : fromConfig.indent();
        boolean wrap = !noWrap && fromConfig.wrapDocument();
        return new GeneratorConfig(effectiveIndent, wrap, fromConfig.customSettings());
    }

    private List<Path> findSources(ProjectConfig.InputConfig input) throws IOException {
        if (Files.isRegularFile(inputPath)) {
            if (!FileUtils.getExtension(inputPath).equals(parser.getFileExtension())) {
                log.warn("{} does not look like a .{} file, parsing it anyway", inputPath, parser.getFileExtension());
            }
            return List.of(inputPath);
        }
        List<Path> sources = FileUtils.findFiles(inputPath, input.include(), input.exclude());
        log.info("Found {} source file(s) in {}", sources.size(), inputPath);
        return sources;
    }

    /**
     * Parses and generates one diagram per source file. Files that cannot be read or parsed
     * are logged and skipped.
     */
    private List<GeneratedFile> generateDiagrams(DiagramGenerator generator, GeneratorConfig generatorConfig,
                                                 Path root, List<Path> sources) {
        List<GeneratedFile> files = new ArrayList<>();
        for (Path source : sources) {
            try {
                SyntaxTree tree = parser.parseFile(source);
                GeneratedDiagram diagram = generator.generate(tree, generatorConfig);
                String relativeSource = FileUtils.toUnixPath(root.relativize(source.toAbsolutePath().normalize()));
                String relativePath = FileUtils.replaceExtension(relativeSource, diagram.fileExtension());
                files.add(new GeneratedFile(relativePath, diagram.content(), GeneratedFile.PLANTUML_CONTENT_TYPE));
            } catch (IOException | SourceParseException e) {
                log.warn("Skipping {}: {}", source, e.getMessage());
            }
        }
        return files;
    }

    private GeneratedFile buildIndex(List<GeneratedFile> diagrams) {
        StringBuilder content = new StringBuilder("@startuml\n");
        for (GeneratedFile diagram : diagrams) {
            content.append("!include ").append(diagram.relativePath()).append('\n');
        }
        content.append("@enduml\n");
        return new GeneratedFile(INDEX_FILE_NAME, content.toString(), GeneratedFile.PLANTUML_CONTENT_TYPE);
    }

    private Map<String, String> renderSettings() {
        Map<String, String> settings = new HashMap<>();
        if (noColor) {
            settings.put("console.colors", "false");
        }
        return settings;
    }

    private Optional<DiagramGenerator> findGenerator(String id) {
        for (DiagramGenerator generator : ServiceLoader.load(DiagramGenerator.class)) {
            if (generator.getId().equals(id)) {
                return Optional.of(generator);
            }
        }
        log.error("No generator registered with id '{}'", id);
        return Optional.empty();
    }

    private Optional<OutputRenderer> findRenderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return Optional.of(renderer);
            }
        }
        log.error("No renderer registered with id '{}'", id);
        return Optional.empty();
    }
}
