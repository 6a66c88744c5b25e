package com.umlarchitect.core.renderer.impl;

import com.umlarchitect.core.renderer.GeneratedFile;
import com.umlarchitect.core.renderer.GeneratedOutput;
import com.umlarchitect.core.renderer.OutputRenderer;
import com.umlarchitect.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Renderer that prints generated diagrams to standard output.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "true")</li>
 *   <li>{@code console.separator} - Separator between files (default: "---")</li>
 *   <li>{@code console.showHeaders} - Show file headers ("true"/"false", default: "true")</li>
 * </ul>
 *
 * <p>Diagram content is printed verbatim so it can be piped into PlantUML.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    static final String COLORS_SETTING = "console.colors";
    static final String SEPARATOR_SETTING = "console.separator";
    static final String HEADERS_SETTING = "console.showHeaders";

    private static final String DEFAULT_SEPARATOR = "---";
    private static final int LINE_WIDTH = 80;

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault(COLORS_SETTING, "true"));
        String separator = context.getSettingOrDefault(SEPARATOR_SETTING, DEFAULT_SEPARATOR);
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault(HEADERS_SETTING, "true"));
        if (separator.isEmpty()) {
            separator = DEFAULT_SEPARATOR;
        }

        log.debug("Printing {} diagram(s) (colors: {}, headers: {})",
            output.files().size(), useColors, showHeaders);

        PrintStream out = System.out;
        int total = output.files().size();
        for (int i = 0; i < total; i++) {
            GeneratedFile file = output.files().get(i);
            if (showHeaders) {
                out.println(paint(useColors, ANSI_BOLD + ANSI_CYAN,
                    "File " + (i + 1) + "/" + total + ": " + file.relativePath()));
            }
            out.print(file.content());
            if (!file.content().isEmpty() && !file.content().endsWith("\n")) {
                out.println();
            }
            if (i < total - 1) {
                out.println(paint(useColors, ANSI_YELLOW, separatorLine(separator)));
            }
        }
        out.flush();
    }

    private static String separatorLine(String separator) {
        return separator.repeat(Math.max(1, LINE_WIDTH / separator.length()));
    }

    private static String paint(boolean useColors, String color, String text) {
        return useColors ? color + text + ANSI_RESET : text;
    }
}
