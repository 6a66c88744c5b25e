package com.umlarchitect.core.renderer;

/**
 * Interface for output renderers that deliver generated diagram files.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI) and selected by
 * {@link #getId()}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.umlarchitect.core.renderer.OutputRenderer}
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer (e.g., "filesystem", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the generated output to the target destination.
     *
     * @param output the generated files to render
     * @param context rendering context with output directory and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
