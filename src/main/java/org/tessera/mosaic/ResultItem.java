package org.tessera.mosaic;

import java.util.Objects;

/**
 * Entry of the result channel between {@link MatcherWorker} and {@link Compositor}.
 */
public sealed interface ResultItem permits ResultItem.Pasted, ResultItem.WorkerDone {

    /**
     * The best tile for one block.
     *
     * @param coords    Where the tile goes in the canvas.
     * @param tileIndex Index into the tile corpus.
     */
    record Pasted(Box coords, int tileIndex) implements ResultItem {
        public Pasted {
            Objects.requireNonNull(coords, "coords");
            if (tileIndex < 0) {
                throw new IllegalArgumentException("tileIndex must not be negative: " + tileIndex);
            }
        }
    }

    /**
     * Sent once by every worker when it exits, on every exit path.
     */
    enum WorkerDone implements ResultItem {
        INSTANCE
    }
}
