package com.umlarchitect.core.config;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.umlarchitect.core.generator.GeneratorConfig;

/**
 * Root configuration for UML Architect projects.
 *
 * <p>Loaded from {@code umlarchitect.yaml} next to the sources. Every section is optional;
 * missing sections and values fall back to the defaults of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "Order Service"
 *   version: "1.0.0"
 *
 * input:
 *   include: "**\/*.java"
 *   exclude:
 *     - "**\/generated/**"
 *
 * generator:
 *   id: plantuml
 *   indent: "  "
 *   wrapDocument: true
 *
 * output:
 *   directory: "./docs/uml"
 *   renderer: filesystem
 *   generateIndex: true
 * }</pre>
 *
 * @param project project metadata
 * @param input source selection
 * @param generator generator settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("input") InputConfig input,
    @JsonProperty("generator") GeneratorSettings generator,
    @JsonProperty("output") OutputConfig output
) {
    public static final String DEFAULT_FILE_NAME = "umlarchitect.yaml";

    /**
     * Creates the default configuration: all Java files, PlantUML with four-space indent,
     * written to {@code ./docs/uml} without an index.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(
            new ProjectInfo("project", "1.0.0", null),
            InputConfig.defaults(),
            GeneratorSettings.defaults(),
            OutputConfig.defaults()
        );
    }

    /**
     * Returns the input section, or its defaults when absent.
     *
     * @return input configuration
     */
    public InputConfig effectiveInput() {
        return input != null ? input : InputConfig.defaults();
    }

    /**
     * Returns the generator section, or its defaults when absent.
     *
     * @return generator settings
     */
    public GeneratorSettings effectiveGenerator() {
        return generator != null ? generator : GeneratorSettings.defaults();
    }

    /**
     * Returns the output section, or its defaults when absent.
     *
     * @return output configuration
     */
    public OutputConfig effectiveOutput() {
        return output != null ? output : OutputConfig.defaults();
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param version project version
     * @param description optional project description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("description") String description
    ) {}

    /**
     * Source file selection, relative to the input directory.
     *
     * @param include glob of files to parse
     * @param exclude globs of files to skip
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InputConfig(
        @JsonProperty("include") String include,
        @JsonProperty("exclude") List<String> exclude
    ) {
        public static final String DEFAULT_INCLUDE = "**/*.java";

        public InputConfig {
            if (include == null || include.isBlank()) {
                include = DEFAULT_INCLUDE;
            }
            exclude = exclude != null ? List.copyOf(exclude) : List.of();
        }

        public static InputConfig defaults() {
            return new InputConfig(DEFAULT_INCLUDE, List.of());
        }
    }

    /**
     * Generator selection and settings.
     *
     * @param id generator ID (e.g., "plantuml")
     * @param indent indentation unit per nesting level
     * @param wrapDocument whether to emit document start/end markers
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeneratorSettings(
        @JsonProperty("id") String id,
        @JsonProperty("indent") String indent,
        @JsonProperty("wrapDocument") Boolean wrapDocument
    ) {
        public static final String DEFAULT_ID = "plantuml";

        public static GeneratorSettings defaults() {
            return new GeneratorSettings(DEFAULT_ID, GeneratorConfig.DEFAULT_INDENT, true);
        }

        /**
         * Returns the generator ID, defaulting to "plantuml".
         *
         * @return generator ID
         */
        public String effectiveId() {
            return id != null && !id.isBlank() ? id : DEFAULT_ID;
        }

        /**
         * Converts these settings to a generator configuration.
         *
         * @return generator configuration
         */
        public GeneratorConfig toGeneratorConfig() {
            return new GeneratorConfig(indent, wrapDocument == null || wrapDocument, Map.of());
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     * @param renderer renderer ID ("filesystem" or "console")
     * @param generateIndex whether to write an include.puml index
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("renderer") String renderer,
        @JsonProperty("generateIndex") Boolean generateIndex
    ) {
        public static final String DEFAULT_DIRECTORY = "./docs/uml";
        public static final String DEFAULT_RENDERER = "filesystem";

        public static OutputConfig defaults() {
            return new OutputConfig(DEFAULT_DIRECTORY, DEFAULT_RENDERER, false);
        }

        public String effectiveDirectory() {
            return directory != null && !directory.isBlank() ? directory : DEFAULT_DIRECTORY;
        }

        public String effectiveRenderer() {
            return renderer != null && !renderer.isBlank() ? renderer : DEFAULT_RENDERER;
        }

        public boolean shouldGenerateIndex() {
            return Boolean.TRUE.equals(generateIndex);
        }
    }
}
