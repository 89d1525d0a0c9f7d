package org.tessera.mosaic;

import java.util.concurrent.BlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.imaging.PixelGrid;

/**
 * Cuts the downsampled target into blocks and feeds them to the matcher pool.
 * <p>
 * Blocks are queued in row-major order. The work queue is bounded, so {@link #dispatch}
 * blocks whenever the workers fall behind. Whether the walk finishes, is cancelled, or is
 * interrupted, it always ends by queueing exactly one {@link WorkItem.Shutdown} per worker.
 */
public class BlockDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BlockDispatcher.class);

    private final MosaicSettings settings;
    private final BlockingQueue<WorkItem> workQueue;
    private final int workerCount;
    private final RunCancellation cancellation;
    private final ProgressListener progress;

    /**
     * Outcome of one dispatch pass.
     *
     * @param dispatched Blocks actually queued.
     * @param total      Blocks in the target.
     * @param cancelled  Whether the walk stopped early.
     */
    public record Summary(int dispatched, int total, boolean cancelled) {
    }

    public BlockDispatcher(MosaicSettings settings, BlockingQueue<WorkItem> workQueue, int workerCount,
                           RunCancellation cancellation, ProgressListener progress) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1, was " + workerCount);
        }
        this.settings = settings;
        this.workQueue = workQueue;
        this.workerCount = workerCount;
        this.cancellation = cancellation;
        this.progress = progress;
    }

    /**
     * Queues every block of {@code targetSmallGrid}, then one shutdown marker per worker.
     * <p>
     * An interrupt while waiting for queue space is treated as cancellation. The interrupt
     * status is restored before returning.
     *
     * @param targetSmallGrid The downsampled target; both sides must be multiples of
     *                        {@link MosaicSettings#matchSide()}.
     * @return What was dispatched.
     */
    public Summary dispatch(PixelGrid targetSmallGrid) {
        int matchSide = settings.matchSide();
        if (targetSmallGrid.getWidth() % matchSide != 0 || targetSmallGrid.getHeight() % matchSide != 0) {
            throw new IllegalArgumentException("Downsampled target " + targetSmallGrid
                + " is not a whole number of " + matchSide + "px blocks");
        }
        int xTileCount = targetSmallGrid.getWidth() / matchSide;
        int yTileCount = targetSmallGrid.getHeight() / matchSide;
        int total = xTileCount * yTileCount;
        int dispatched = 0;
        boolean interrupted = false;

        log.debug("Dispatching {} blocks ({}x{}) to {} workers", total, xTileCount, yTileCount, workerCount);
        try {
            walk:
            for (int row = 0; row < yTileCount; row++) {
                for (int column = 0; column < xTileCount; column++) {
                    if (cancellation.isCancelled()) {
                        break walk;
                    }
                    Box smallBox = Box.ofCell(column, row, matchSide);
                    Box largeBox = Box.ofCell(column, row, settings.tileSize());
                    int[] blockPixels = targetSmallGrid.copyRegion(
                        smallBox.x0(), smallBox.y0(), smallBox.width(), smallBox.height());

                    workQueue.put(new WorkItem.Block(blockPixels, largeBox));
                    dispatched++;
                    progress.onBlockDispatched(dispatched, total);
                }
            }
        } catch (InterruptedException e) {
            interrupted = true;
            cancellation.cancel();
            log.warn("Dispatch interrupted after {}/{} blocks", dispatched, total);
        } finally {
            sendShutdownMarkers();
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        boolean cancelled = dispatched < total;
        if (cancelled) {
            log.info("Dispatch stopped early: {}/{} blocks queued", dispatched, total);
        }
        return new Summary(dispatched, total, cancelled);
    }

    private void sendShutdownMarkers() {
        for (int i = 0; i < workerCount; i++) {
            Uninterruptibles.put(workQueue, WorkItem.Shutdown.INSTANCE);
        }
    }
}
