package org.tessera.mosaic;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.imaging.TileRecord;

/**
 * Sole consumer of the result channel. Pastes every chosen tile into the canvas and persists
 * the canvas once all workers have reported done.
 * <p>
 * Results may arrive in any order; each one carries its own destination, so the final canvas
 * does not depend on scheduling. A cancelled run sends the same done markers as a complete one,
 * so the compositor stops cleanly in both cases and saves whatever has been pasted.
 */
public class Compositor implements Callable<Path> {

    private static final Logger log = LoggerFactory.getLogger(Compositor.class);

    private final BlockingQueue<ResultItem> resultChannel;
    private final List<TileRecord> tiles;
    private final MosaicCanvas canvas;
    private final int workerCount;
    private final CanvasSink sink;

    public Compositor(BlockingQueue<ResultItem> resultChannel, List<TileRecord> tiles, MosaicCanvas canvas,
                      int workerCount, CanvasSink sink) {
        this.resultChannel = resultChannel;
        this.tiles = tiles;
        this.canvas = canvas;
        this.workerCount = workerCount;
        this.sink = sink;
    }

    /**
     * Consumes results until {@code workerCount} done markers have arrived, then persists.
     * <p>
     * Interrupts do not stop the loop: the canvas is always saved. The interrupt status is
     * restored afterwards.
     *
     * @return Where the canvas was written.
     * @throws IOException if the sink cannot persist the canvas.
     */
    @Override
    public Path call() throws IOException {
        int activeWorkers = workerCount;
        while (activeWorkers > 0) {
            ResultItem item = Uninterruptibles.take(resultChannel);
            if (item instanceof ResultItem.Pasted pasted) {
                canvas.paste(pasted.coords(), tiles.get(pasted.tileIndex()).fullGrid());
            } else {
                activeWorkers--;
                log.debug("Worker done, {} still active", activeWorkers);
            }
        }

        if (canvas.isComplete()) {
            log.debug("All {} blocks pasted", canvas.getTotalBlocks());
        } else {
            log.info("Saving partial mosaic: {}/{} blocks pasted", canvas.getPastedCount(), canvas.getTotalBlocks());
        }
        return sink.persist(canvas);
    }

    public MosaicCanvas getCanvas() {
        return canvas;
    }
}
