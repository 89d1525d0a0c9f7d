package org.tessera.mosaic;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.imaging.PixelGrid;
import org.tessera.imaging.TargetImage;
import org.tessera.imaging.TileRecord;

/**
 * Coordinates one mosaic run: a compositor thread, a pool of matcher threads, and the
 * dispatcher on the calling thread.
 * <p>
 * Pipeline:
 * <pre>
 *   dispatcher --(bounded work queue)--&gt; matchers --(unbounded result channel)--&gt; compositor --&gt; sink
 * </pre>
 * The work queue holds at most {@code workerCount} blocks, which bounds memory in flight.
 * Completion and cancellation take the same path: the dispatcher stops queueing blocks and
 * sends one shutdown marker per matcher, each matcher sends one done marker, and the
 * compositor saves the canvas after the last done marker.
 * <p>
 * All inputs are validated in the constructor, so a misconfigured run (for example an empty
 * tile corpus) fails before any thread starts or any block is queued.
 * <p>
 * A matcher that hangs stalls the run indefinitely; there are no timeouts inside the pipeline.
 */
public class MosaicRun {

    private static final Logger log = LoggerFactory.getLogger(MosaicRun.class);

    private final MosaicSettings settings;
    private final List<TileRecord> tiles;
    private final TargetImage target;
    private final CanvasSink sink;
    private final ProgressListener progress;
    private final TileFitter fitter;
    private final int workerCount;
    private final RunCancellation cancellation = new RunCancellation();
    private final AtomicReference<Throwable> firstFault = new AtomicReference<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch finished = new CountDownLatch(1);

    /**
     * @param settings Run parameters.
     * @param tiles    The tile corpus in index order.
     * @param target   The prepared target image.
     * @param sink     Where the canvas goes at the end.
     * @param progress Dispatch progress callback.
     * @throws EmptyTileCorpusException if {@code tiles} is empty.
     * @throws IllegalArgumentException if tile or target geometry does not fit the settings.
     */
    public MosaicRun(MosaicSettings settings, List<TileRecord> tiles, TargetImage target,
                     CanvasSink sink, ProgressListener progress) {
        this(settings, tiles, target, sink, progress, TileFitter::new);
    }

    MosaicRun(MosaicSettings settings, List<TileRecord> tiles, TargetImage target,
              CanvasSink sink, ProgressListener progress, Function<List<TileRecord>, TileFitter> fitterFactory) {
        if (tiles.isEmpty()) {
            throw new EmptyTileCorpusException("No usable tiles found; nothing to build a mosaic from");
        }
        this.settings = settings;
        this.tiles = List.copyOf(tiles);
        this.target = target;
        this.sink = sink;
        this.progress = progress;
        this.workerCount = settings.effectiveWorkerCount();
        validateTiles();
        validateTarget();
        this.fitter = fitterFactory.apply(this.tiles);
    }

    private void validateTiles() {
        int tileSize = settings.tileSize();
        int matchSide = settings.matchSide();
        for (int i = 0; i < tiles.size(); i++) {
            TileRecord tile = tiles.get(i);
            if (tile.fullGrid().getWidth() != tileSize) {
                throw new IllegalArgumentException(String.format(
                    "Tile %d (%s) is %s, expected %dx%d", i, tile.source(), tile.fullGrid(), tileSize, tileSize));
            }
            if (tile.matchGrid().getWidth() != matchSide) {
                throw new IllegalArgumentException(String.format(
                    "Match grid of tile %d (%s) is %s, expected %dx%d",
                    i, tile.source(), tile.matchGrid(), matchSide, matchSide));
            }
        }
    }

    private void validateTarget() {
        PixelGrid full = target.fullGrid();
        PixelGrid small = target.smallGrid();
        int tileSize = settings.tileSize();
        int matchSide = settings.matchSide();
        int xTileCount = full.getWidth() / tileSize;
        int yTileCount = full.getHeight() / tileSize;
        if (xTileCount < 1 || yTileCount < 1) {
            throw new IllegalArgumentException("Target " + full + " is smaller than one " + tileSize + "px tile");
        }
        if (small.getWidth() != xTileCount * matchSide || small.getHeight() != yTileCount * matchSide) {
            throw new IllegalArgumentException(String.format(
                "Downsampled target %s does not match %dx%d blocks of %dpx", small, xTileCount, yTileCount, matchSide));
        }
    }

    /**
     * Runs the pipeline to completion (or cancellation) and persists the canvas.
     * <p>
     * Returns only after the compositor has finished saving. May be called once.
     *
     * @return Summary of the run.
     * @throws IOException          if the canvas could not be persisted.
     * @throws WorkerFaultException if a matcher failed; the partial canvas has been persisted.
     */
    public MosaicResult run() throws IOException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("A MosaicRun can only be run once");
        }
        try {
            return execute();
        } finally {
            finished.countDown();
        }
    }

    private MosaicResult execute() throws IOException {
        MosaicCanvas canvas = MosaicCanvas.forTarget(target.fullGrid(), settings.tileSize());
        BlockingQueue<WorkItem> workQueue = new ArrayBlockingQueue<>(workerCount);
        BlockingQueue<ResultItem> resultChannel = new LinkedBlockingQueue<>();

        log.info("Building {}x{} mosaic ({}x{} tiles of {}px) from {} tiles with {} matcher thread(s)",
            canvas.getWidth(), canvas.getHeight(), canvas.getXTileCount(), canvas.getYTileCount(),
            settings.tileSize(), tiles.size(), workerCount);

        ExecutorService executor = Executors.newFixedThreadPool(workerCount + 1, newThreadFactory());
        try {
            Compositor compositor = new Compositor(resultChannel, tiles, canvas, workerCount, sink);
            Future<Path> composed = executor.submit(compositor);

            for (int i = 0; i < workerCount; i++) {
                executor.submit(new MatcherWorker("matcher-" + i, fitter, workQueue, resultChannel, this::onWorkerFault));
            }

            BlockDispatcher dispatcher = new BlockDispatcher(settings, workQueue, workerCount, cancellation, progress);
            BlockDispatcher.Summary summary = dispatcher.dispatch(target.smallGrid());
            if (summary.cancelled()) {
                log.warn("Halting, saving partial image please wait...");
            }

            Path outputPath = awaitComposition(composed);

            Throwable fault = firstFault.get();
            if (fault != null) {
                throw new WorkerFaultException("Matcher failed; partial mosaic saved to " + outputPath, fault);
            }
            return new MosaicResult(outputPath, summary.dispatched(), canvas.getPastedCount(),
                canvas.getTotalBlocks(), summary.cancelled());
        } finally {
            executor.shutdown();
        }
    }

    private Path awaitComposition(Future<Path> composed) throws IOException {
        try {
            return Uninterruptibles.get(composed);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Compositor failed", cause);
        }
    }

    private void onWorkerFault(String workerName, Throwable fault) {
        if (firstFault.compareAndSet(null, fault)) {
            log.error("Cancelling run after failure in {}", workerName);
        }
        cancellation.cancel();
    }

    /**
     * Asks the dispatcher to stop queueing blocks. Already queued blocks are still matched and
     * pasted, then the partial canvas is persisted. Safe to call from any thread, any number of times.
     */
    public void cancel() {
        if (cancellation.cancel()) {
            log.debug("Cancellation requested");
        }
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    /**
     * Waits until {@link #run()} has returned or thrown.
     *
     * @return {@code false} if the timeout elapsed first.
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int getWorkerCount() {
        return workerCount;
    }

    private static ThreadFactory newThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            int n = counter.getAndIncrement();
            Thread thread = new Thread(runnable, n == 0 ? "mosaic-compositor" : "mosaic-matcher-" + (n - 1));
            thread.setDaemon(true);
            return thread;
        };
    }
}
