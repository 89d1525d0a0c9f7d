package org.tessera.mosaic;

import java.util.concurrent.BlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One matcher thread: takes blocks, picks the best tile, and reports the result.
 * <p>
 * The worker exits when it takes a {@link WorkItem.Shutdown}. It sends exactly one
 * {@link ResultItem.WorkerDone} on the way out, including when matching failed or the
 * thread was interrupted, so the {@link Compositor} can always count down to zero.
 * <p>
 * If matching a block throws (an {@link Error} included), the failure is reported to the
 * {@link FaultListener} once and the worker keeps taking (and discarding) blocks until its shutdown
 * marker arrives. That keeps the bounded work queue moving, so the dispatcher never blocks on a dead
 * consumer. A failure escaping the loop itself is reported before the worker exits.
 */
public class MatcherWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MatcherWorker.class);

    /**
     * Notified when a worker fails to match a block.
     */
    @FunctionalInterface
    public interface FaultListener {
        void onFault(String workerName, Throwable fault);
    }

    private final String name;
    private final TileFitter fitter;
    private final BlockingQueue<WorkItem> workQueue;
    private final BlockingQueue<ResultItem> resultChannel;
    private final FaultListener faultListener;
    private volatile int matched;

    public MatcherWorker(String name, TileFitter fitter, BlockingQueue<WorkItem> workQueue,
                         BlockingQueue<ResultItem> resultChannel, FaultListener faultListener) {
        this.name = name;
        this.fitter = fitter;
        this.workQueue = workQueue;
        this.resultChannel = resultChannel;
        this.faultListener = faultListener;
    }

    @Override
    public void run() {
        boolean faulted = false;
        int discarded = 0;
        try {
            while (true) {
                WorkItem item = workQueue.take();
                if (item instanceof WorkItem.Shutdown) {
                    break;
                }
                WorkItem.Block block = (WorkItem.Block) item;
                if (faulted) {
                    discarded++;
                    continue;
                }
                try {
                    int tileIndex = fitter.findBestFit(block.blockPixels());
                    // unbounded: never blocks the worker
                    resultChannel.add(new ResultItem.Pasted(block.coords(), tileIndex));
                    matched++;
                } catch (RuntimeException | Error e) {
                    faulted = true;
                    log.error("{} failed matching block {}: {}", name, block.coords(), e.getMessage());
                    log.debug("Matcher failure details", e);
                    faultListener.onFault(name, e);
                }
            }
        } catch (InterruptedException e) {
            log.warn("{} interrupted before receiving its shutdown marker", name);
            Thread.currentThread().interrupt();
        } catch (RuntimeException | Error e) {
            if (!faulted) {
                log.error("{} stopped unexpectedly: {}", name, e.toString());
                faultListener.onFault(name, e);
            }
            throw e;
        } finally {
            resultChannel.add(ResultItem.WorkerDone.INSTANCE);
            log.debug("{} finished: {} blocks matched, {} discarded", name, matched, discarded);
        }
    }

    /**
     * @return Blocks this worker has matched so far.
     */
    public int getMatchedCount() {
        return matched;
    }
}
