package org.tessera.mosaic;

import java.util.Objects;

/**
 * Entry of the work queue between {@link BlockDispatcher} and {@link MatcherWorker}.
 */
public sealed interface WorkItem permits WorkItem.Block, WorkItem.Shutdown {

    /**
     * One target block to match.
     *
     * @param blockPixels Packed RGB of the block in matching resolution, row-major.
     * @param coords      Destination of the chosen tile in full-resolution space.
     */
    record Block(int[] blockPixels, Box coords) implements WorkItem {
        public Block {
            Objects.requireNonNull(blockPixels, "blockPixels");
            Objects.requireNonNull(coords, "coords");
        }
    }

    /**
     * Tells exactly one worker to stop.
     */
    enum Shutdown implements WorkItem {
        INSTANCE
    }
}
