package com.solseq.cli.renderer;

import com.solseq.core.generator.GeneratedDiagram;

/**
 * Interface for output renderers that deliver a generated diagram to its destination.
 *
 * <p>Implementations should throw {@link IllegalStateException} when the destination
 * cannot be written.
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer (e.g. "console", "filesystem").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the diagram to the target destination.
     *
     * @param diagram generated diagram
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedDiagram diagram);
}
