package org.tessera.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.imaging.ImageFileSink;
import org.tessera.imaging.TargetImage;
import org.tessera.imaging.TargetSource;
import org.tessera.imaging.TileCorpus;
import org.tessera.imaging.TileRecord;
import org.tessera.mosaic.EmptyTileCorpusException;
import org.tessera.mosaic.MosaicResult;
import org.tessera.mosaic.MosaicRun;
import org.tessera.mosaic.MosaicSettings;
import org.tessera.mosaic.WorkerFaultException;

/**
 * Wires the image collaborators to a {@link MosaicRun} for one command-line invocation.
 * <p>
 * Ctrl-C during a run cancels dispatch; the JVM shutdown hook then waits (up to
 * {@code shutdownTimeout}) until the partial mosaic has been saved.
 */
public class MosaicEngine {

    private static final Logger log = LoggerFactory.getLogger(MosaicEngine.class);

    private final MosaicSettings settings;
    private final PrintStream out;
    private final AtomicReference<MosaicRun> activeRun = new AtomicReference<>();

    public MosaicEngine(MosaicSettings settings, PrintStream out) {
        this.settings = settings;
        this.out = out;
    }

    /**
     * Builds a mosaic of {@code targetImage} from the images under {@code tileDirectory}.
     *
     * @return Exit code (0 for success, non-zero for failure).
     */
    public int execute(Path targetImage, Path tileDirectory) {
        try {
            TargetImage target = new TargetSource(targetImage, settings).load();
            List<TileRecord> tiles = new TileCorpus(tileDirectory, settings).load();

            MosaicRun run = new MosaicRun(settings, tiles, target,
                new ImageFileSink(settings.outputPath()), new ConsoleProgressReporter(out));
            out.println("Building mosaic, press Ctrl-C to abort...");

            MosaicResult result = runWithShutdownHook(run);
            if (result.cancelled()) {
                out.println("Partial mosaic (" + result.blocksPasted() + "/" + result.totalBlocks()
                    + " tiles) saved to " + result.outputPath());
            } else {
                out.println("Finished, output is in " + result.outputPath());
            }
            return 0;
        } catch (EmptyTileCorpusException e) {
            log.error("{} (directory: {})", e.getMessage(), tileDirectory);
            return 1;
        } catch (WorkerFaultException e) {
            log.error("{}: {}", e.getMessage(), e.getCause().getMessage());
            return 1;
        } catch (IOException e) {
            log.error("{}", e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            log.error("Invalid input: {}", e.getMessage());
            return 1;
        }
    }

    private MosaicResult runWithShutdownHook(MosaicRun run) throws IOException {
        activeRun.set(run);
        Thread shutdownHook = createShutdownHook();
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            return run.run();
        } finally {
            removeShutdownHook(shutdownHook);
            activeRun.set(null);
        }
    }

    /**
     * Cancels the active run, if any, and waits for it to save. Called from the shutdown hook.
     */
    void cancelAndAwait() {
        MosaicRun run = activeRun.get();
        if (run == null) {
            return;
        }
        log.warn("Interrupt received, stopping dispatch...");
        run.cancel();
        try {
            if (!run.awaitCompletion(settings.shutdownTimeout())) {
                log.error("Partial mosaic was not saved within {}", settings.shutdownTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Thread createShutdownHook() {
        return new Thread(this::cancelAndAwait, "mosaic-shutdown-hook");
    }

    private void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook is running or has run
            log.debug("Shutdown in progress, hook stays registered");
        }
    }
}
