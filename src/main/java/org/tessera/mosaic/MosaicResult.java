package org.tessera.mosaic;

import java.nio.file.Path;

/**
 * Summary of a finished run.
 *
 * @param outputPath       Where the canvas was persisted.
 * @param blocksDispatched Blocks handed to the matcher pool.
 * @param blocksPasted     Blocks written into the canvas.
 * @param totalBlocks      Blocks in the canvas.
 * @param cancelled        Whether dispatch stopped before the last block.
 */
public record MosaicResult(Path outputPath, int blocksDispatched, int blocksPasted, int totalBlocks,
                           boolean cancelled) {

    public boolean isComplete() {
        return blocksPasted == totalBlocks;
    }
}
