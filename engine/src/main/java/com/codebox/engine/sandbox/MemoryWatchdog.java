package com.codebox.engine.sandbox;

import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic resident-memory sampler for one sandbox process tree.
 *
 * Each tick sums VmRSS over the live tree, keeps the peak, and fires the
 * limit callback once when the sum exceeds the ceiling. The RLIMIT_AS set by
 * the launch shim is the hard cap; this catches trees whose members each stay
 * under it, and provides peak_memory_bytes. Sampling also records descendants
 * on the process, which is how orphans are found at teardown.
 */
final class MemoryWatchdog implements Runnable {

    private final SandboxProcess process;
    private final long limitBytes;
    private final Runnable onLimitExceeded;
    private final AtomicLong peak = new AtomicLong(-1);
    private final AtomicBoolean tripped = new AtomicBoolean(false);

    MemoryWatchdog(SandboxProcess process, long limitBytes, Runnable onLimitExceeded) {
        this.process         = process;
        this.limitBytes      = limitBytes;
        this.onLimitExceeded = onLimitExceeded;
    }

    @Override
    public void run() {
        List<ProcessHandle> tree = process.liveTree();
        if (tree.isEmpty() || !ProcFs.available()) return;

        long total = 0;
        boolean sampled = false;
        for (ProcessHandle h : tree) {
            OptionalLong rss = ProcFs.residentBytes(h.pid());
            if (rss.isPresent()) {
                total += rss.getAsLong();
                sampled = true;
            }
        }
        if (!sampled) return;

        long sum = total;
        peak.accumulateAndGet(sum, Math::max);
        if (sum > limitBytes && tripped.compareAndSet(false, true)) {
            onLimitExceeded.run();
        }
    }

    boolean tripped() { return tripped.get(); }

    /** Highest sampled tree RSS, or null if no sample was ever taken. */
    Long peakBytes() {
        long p = peak.get();
        return p < 0 ? null : p;
    }
}
