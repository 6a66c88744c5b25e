package com.umlarchitect.cli;

import com.umlarchitect.core.generator.DiagramGenerator;
import com.umlarchitect.core.renderer.OutputRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available generators or renderers.
 *
 * <p>Discovers plugins via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * umlarchitect list generators
 * umlarchitect list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available generators or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: generators or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "generators", "generator" -> listGenerators();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: generators or renderers", type);
                yield 1;
            }
        };
    }

    private int listGenerators() {
        System.out.println("Available Generators:");
        System.out.println();

        boolean found = false;
        for (DiagramGenerator generator : ServiceLoader.load(DiagramGenerator.class)) {
            found = true;
            System.out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            System.out.printf("    File Extension: .%s%n", generator.getFileExtension());
            System.out.println();
        }

        if (!found) {
            System.out.println("  No generators found.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            System.out.printf("  • %s%n", renderer.getId());
        }

        if (!found) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }
}
