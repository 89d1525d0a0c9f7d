package org.tessera.mosaic;

/**
 * Thrown when a run is set up with no usable tiles. Raised before any work is queued,
 * so no threads are started and no output is written.
 */
public class EmptyTileCorpusException extends RuntimeException {

    public EmptyTileCorpusException(String message) {
        super(message);
    }
}
