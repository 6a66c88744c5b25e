package com.umlarchitect.core.renderer.impl;

import com.umlarchitect.core.renderer.GeneratedFile;
import com.umlarchitect.core.renderer.GeneratedOutput;
import com.umlarchitect.core.renderer.RenderContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private static final String DIAGRAM = "@startuml\nclass Order {\n}\n@enduml\n";

    private ConsoleRenderer renderer;
    private final PrintStream originalOut = System.out;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() {
        renderer = new ConsoleRenderer();
        outputStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_withSingleFile_printsHeaderAndContent() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("com/example/Order.puml", DIAGRAM, GeneratedFile.PLANTUML_CONTENT_TYPE)));
        RenderContext context = new RenderContext("./output", Map.of(ConsoleRenderer.COLORS_SETTING, "false"));

        // When
        renderer.render(output, context);

        // Then
        assertThat(console()).isEqualTo("File 1/1: com/example/Order.puml\n" + DIAGRAM);
    }

    @Test
    void render_withHeadersDisabled_printsContentOnly() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("Order.puml", DIAGRAM, null)));
        RenderContext context = new RenderContext("./output", Map.of(
            ConsoleRenderer.COLORS_SETTING, "false",
            ConsoleRenderer.HEADERS_SETTING, "false"));

        // When
        renderer.render(output, context);

        // Then
        assertThat(console()).isEqualTo(DIAGRAM);
    }

    @Test
    void render_withMultipleFiles_separatesFiles() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("A.puml", "class A {\n}\n", null),
            new GeneratedFile("B.puml", "class B {\n}\n", null)));
        RenderContext context = new RenderContext("./output", Map.of(
            ConsoleRenderer.COLORS_SETTING, "false",
            ConsoleRenderer.SEPARATOR_SETTING, "=="));

        // When
        renderer.render(output, context);

        // Then
        String consoleOutput = console();
        assertThat(consoleOutput).contains("File 1/2: A.puml", "File 2/2: B.puml", "=".repeat(80));
        assertThat(consoleOutput.indexOf("class A")).isLessThan(consoleOutput.indexOf("class B"));
        assertThat(consoleOutput).doesNotContain("---");
    }

    @Test
    void render_withColors_wrapsHeaderInAnsiCodes() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("A.puml", "class A {\n}\n", null)));
        RenderContext context = new RenderContext("./output", Map.of());

        // When
        renderer.render(output, context);

        // Then
        assertThat(console()).contains("\u001B[").contains("class A {\n}\n");
    }

    @Test
    void render_withContentWithoutTrailingNewline_endsLine() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("A.puml", "class A {}", null),
            new GeneratedFile("B.puml", "class B {}", null)));
        RenderContext context = new RenderContext("./output", Map.of(
            ConsoleRenderer.COLORS_SETTING, "false",
            ConsoleRenderer.HEADERS_SETTING, "false"));

        // When
        renderer.render(output, context);

        // Then
        assertThat(console()).isEqualTo("class A {}\n" + "-".repeat(78) + "\nclass B {}\n");
    }

    @Test
    void render_withEmptyOutput_printsNothing() {
        renderer.render(new GeneratedOutput(List.of()), new RenderContext("./output", Map.of()));

        assertThat(console()).isEmpty();
    }

    private String console() {
        return outputStream.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
    }
}
