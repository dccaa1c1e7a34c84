package com.delta.gapreview.workflow.service;

import com.delta.gapreview.workflow.model.Gap;
import com.delta.gapreview.workflow.model.GapBranch;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Barrier for one run's fan-out. Each branch owns one slot, indexed by its position in the gap
 * list; nothing else is shared between branches. Once cancelled, or once a slot is terminal, further
 * writes to it are discarded.
 */
public class BranchCollector {
    public static final String TIMEOUT_CODE = "branch_timeout";

    private final String runId;
    private final List<Gap> gaps;
    private final AtomicReferenceArray<GapBranch> slots;
    private final Object monitor = new Object();
    private volatile boolean cancelled;

    public BranchCollector(String runId, List<Gap> gaps) {
        this.runId = runId;
        this.gaps = List.copyOf(gaps);
        this.slots = new AtomicReferenceArray<>(gaps.size());
        for (int i = 0; i < gaps.size(); i++) {
            slots.set(i, GapBranch.pending(runId, gaps.get(i).gapId()));
        }
    }

    public String runId() {
        return runId;
    }

    public List<Gap> gaps() {
        return gaps;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void markRunning(int index, Instant at) {
        GapBranch current = slots.get(index);
        if (!cancelled && !current.status().isTerminal()) {
            slots.compareAndSet(index, current, current.running(at));
        }
    }

    /**
     * @return false when the write was discarded
     */
    public boolean record(int index, GapBranch terminal) {
        if (cancelled) {
            return false;
        }
        while (true) {
            GapBranch current = slots.get(index);
            if (current.status().isTerminal()) {
                return false;
            }
            if (slots.compareAndSet(index, current, terminal)) {
                synchronized (monitor) {
                    monitor.notifyAll();
                }
                return true;
            }
        }
    }

    public void cancel() {
        cancelled = true;
        synchronized (monitor) {
            monitor.notifyAll();
        }
    }

    public boolean allTerminal() {
        for (int i = 0; i < slots.length(); i++) {
            if (!slots.get(i).status().isTerminal()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Waits until every slot is terminal, the collector is cancelled, or the timeout passes.
     *
     * @return true when every slot is terminal
     */
    public boolean await(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (monitor) {
            while (!allTerminal() && !cancelled) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                TimeUnit.NANOSECONDS.timedWait(monitor, remaining);
            }
        }
        return allTerminal();
    }

    /**
     * Fails every non-terminal slot with a timeout and closes the collector to late writes.
     */
    public void expireOutstanding(Instant at) {
        cancelled = true;
        for (int i = 0; i < slots.length(); i++) {
            while (true) {
                GapBranch current = slots.get(i);
                if (current.status().isTerminal()) {
                    break;
                }
                GapBranch expired = current.failed(TIMEOUT_CODE, "branch did not finish before the barrier timeout", at);
                if (slots.compareAndSet(i, current, expired)) {
                    break;
                }
            }
        }
    }

    public List<GapBranch> snapshot() {
        List<GapBranch> out = new ArrayList<>(slots.length());
        for (int i = 0; i < slots.length(); i++) {
            out.add(slots.get(i));
        }
        return out;
    }
}
