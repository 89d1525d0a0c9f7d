package org.tessera.mosaic;

/**
 * Receives dispatch progress. Called on the dispatching thread after every enqueue.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (completed, total) -> { };

    /**
     * @param completedBlocks Blocks queued so far.
     * @param totalBlocks     Blocks in the whole target.
     */
    void onBlockDispatched(int completedBlocks, int totalBlocks);
}
