package org.tessera.cli;

import java.io.PrintStream;
import java.util.Locale;
import java.util.function.LongSupplier;

import org.tessera.mosaic.ProgressListener;

/**
 * Prints dispatch progress as a single, continuously overwritten console line.
 * <p>
 * Updates are throttled to one every 500 ms; the final block always prints.
 */
public class ConsoleProgressReporter implements ProgressListener {

    private static final long UPDATE_INTERVAL_MS = 500;
    private static final int BAR_WIDTH = 40;

    private final PrintStream out;
    private final LongSupplier clock;
    private final long startTime;
    private long lastUpdate;

    public ConsoleProgressReporter(PrintStream out) {
        this(out, System::currentTimeMillis);
    }

    ConsoleProgressReporter(PrintStream out, LongSupplier clock) {
        this.out = out;
        this.clock = clock;
        this.startTime = clock.getAsLong();
        this.lastUpdate = Long.MIN_VALUE;
    }

    @Override
    public void onBlockDispatched(int completedBlocks, int totalBlocks) {
        long now = clock.getAsLong();
        boolean last = completedBlocks >= totalBlocks;
        if (!last && lastUpdate != Long.MIN_VALUE && now - lastUpdate < UPDATE_INTERVAL_MS) {
            return;
        }
        lastUpdate = now;
        out.print("\r" + formatLine(completedBlocks, totalBlocks, now - startTime));
        if (last) {
            out.println();
        }
        out.flush();
    }

    static String formatLine(int completed, int total, long elapsedMs) {
        double percent = total > 0 ? 100.0 * completed / total : 100.0;
        int filled = total > 0 ? (int) ((long) completed * BAR_WIDTH / total) : BAR_WIDTH;
        StringBuilder bar = new StringBuilder("[");
        for (int i = 0; i < BAR_WIDTH; i++) {
            bar.append(i < filled ? '=' : ' ');
        }
        bar.append(']');
        long remaining = completed > 0 ? elapsedMs * (total - completed) / completed : -1;
        return String.format(Locale.ROOT, "Progress: %s %5.1f%% | Block %d/%d | Elapsed: %s | ETA: %s",
            bar, percent, completed, total, formatTime(elapsedMs), formatTime(remaining));
    }

    static String formatTime(long ms) {
        if (ms < 0) return "?";
        long sec = ms / 1000;
        long h = sec / 3600;
        long m = (sec % 3600) / 60;
        long s = sec % 60;
        return h > 0 ? String.format("%d:%02d:%02d", h, m, s) : String.format("%d:%02d", m, s);
    }
}
