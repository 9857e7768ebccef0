package cli;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Progress lines and a heartbeat for one batch run.
 *
 * <p>The heartbeat thread is a daemon and is stopped by {@link #close()}.</p>
 */
public final class CliProgressMonitor implements AutoCloseable {

    public static final long DEFAULT_HEARTBEAT_MS = 30_000L;

    private final int total;
    private final long startNs = System.nanoTime();
    private final AtomicInteger current = new AtomicInteger(0);
    private volatile String currentKey = "";
    private final Thread heartbeat;

    private CliProgressMonitor(int total, long heartbeatMs) {
        this.total = Math.max(0, total);
        this.heartbeat = new Thread(() -> beat(heartbeatMs), "sql-format-heartbeat");
        this.heartbeat.setDaemon(true);
    }

    public static CliProgressMonitor start(int total) {
        return start(total, DEFAULT_HEARTBEAT_MS);
    }

    public static CliProgressMonitor start(int total, long heartbeatMs) {
        CliProgressMonitor m = new CliProgressMonitor(total, heartbeatMs);
        m.heartbeat.start();
        return m;
    }

    public void setCurrent(String key, int index1Based) {
        currentKey = key == null ? "" : key;
        current.set(Math.max(0, index1Based));
    }

    /**
     * Prints one {@code [PROGRESS]} line with counters, throughput, a rough ETA and heap usage.
     */
    public void logProgress(int done, int formatted, int unchanged, int skip) {
        long elapsedMs = (System.nanoTime() - startNs) / 1_000_000L;
        long etaMs = done <= 0 ? -1L : elapsedMs * (total - done) / done;

        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        System.out.printf("[PROGRESS] %d/%d formatted=%d unchanged=%d skip=%d elapsed=%dms eta=%s heap=%d/%dMB last=%s%n",
                done, total, formatted, unchanged, skip, elapsedMs, etaMs < 0 ? "?" : etaMs + "ms",
                heap.getUsed() >> 20, heap.getMax() >> 20, currentKey);
    }

    @Override
    public void close() {
        heartbeat.interrupt();
    }

    private void beat(long heartbeatMs) {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                Thread.sleep(heartbeatMs);
                System.out.println("[HEARTBEAT] running... " + current.get() + "/" + total + " last=" + currentKey);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
