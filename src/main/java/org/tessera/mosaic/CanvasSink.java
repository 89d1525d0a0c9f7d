package org.tessera.mosaic;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists a finished (or partial) canvas. Format and destination are up to the implementation.
 */
public interface CanvasSink {

    /**
     * @param canvas The canvas to persist. Not modified afterwards.
     * @return Where the canvas was written.
     * @throws IOException if the canvas could not be written.
     */
    Path persist(MosaicCanvas canvas) throws IOException;
}
