package com.umlarchitect.core.config;

import com.umlarchitect.core.generator.GeneratorConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ProjectConfig}.
 */
class ProjectConfigTest {

    @Test
    void defaults_describesPlantUmlToDocsDirectory() {
        ProjectConfig config = ProjectConfig.defaults();

        assertThat(config.effectiveInput().include()).isEqualTo("**/*.java");
        assertThat(config.effectiveGenerator().effectiveId()).isEqualTo("plantuml");
        assertThat(config.effectiveOutput().effectiveDirectory()).isEqualTo("./docs/uml");
        assertThat(config.effectiveOutput().effectiveRenderer()).isEqualTo("filesystem");
        assertThat(config.effectiveOutput().shouldGenerateIndex()).isFalse();
    }

    @Test
    void effectiveSections_withNullSections_returnDefaults() {
        ProjectConfig config = new ProjectConfig(null, null, null, null);

        assertThat(config.effectiveInput()).isEqualTo(ProjectConfig.InputConfig.defaults());
        assertThat(config.effectiveGenerator()).isEqualTo(ProjectConfig.GeneratorSettings.defaults());
        assertThat(config.effectiveOutput()).isEqualTo(ProjectConfig.OutputConfig.defaults());
    }

    @Test
    void inputConfig_withBlankInclude_usesDefaultInclude() {
        ProjectConfig.InputConfig input = new ProjectConfig.InputConfig(" ", null);

        assertThat(input.include()).isEqualTo(ProjectConfig.InputConfig.DEFAULT_INCLUDE);
        assertThat(input.exclude()).isEmpty();
    }

    @Test
    void generatorSettings_withMissingValues_usesGeneratorDefaults() {
        ProjectConfig.GeneratorSettings settings = new ProjectConfig.GeneratorSettings(null, null, null);

        GeneratorConfig config = settings.toGeneratorConfig();

        assertThat(settings.effectiveId()).isEqualTo("plantuml");
        assertThat(config.indent()).isEqualTo(GeneratorConfig.DEFAULT_INDENT);
        assertThat(config.wrapDocument()).isTrue();
    }

    @Test
    void outputConfig_withBlankValues_usesDefaults() {
        ProjectConfig.OutputConfig output = new ProjectConfig.OutputConfig("", " ", null);

        assertThat(output.effectiveDirectory()).isEqualTo("./docs/uml");
        assertThat(output.effectiveRenderer()).isEqualTo("filesystem");
        assertThat(output.shouldGenerateIndex()).isFalse();
    }

    @Test
    void inputConfig_copiesExcludeList() {
        ProjectConfig.InputConfig input = new ProjectConfig.InputConfig("**/*.java", List.of("a/**"));

        assertThat(input.exclude()).containsExactly("a/**");
    }
}
