package com.emtech.scan.service.pipeline;

import com.emtech.scan.model.DocumentStage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared handle on a running scan: its stage, page progress and the cancellation request.
 */
public class ScanControl {

    // System.nanoTime() may be negative, so only MIN_VALUE is safe as the unset marker
    private static final long NOT_CANCELLED = Long.MIN_VALUE;

    private final AtomicReference<DocumentStage> stage = new AtomicReference<>(DocumentStage.INGESTED);
    private final AtomicLong cancelledAtNanos = new AtomicLong(NOT_CANCELLED);
    private final AtomicInteger totalPages = new AtomicInteger();
    private final AtomicInteger finishedPages = new AtomicInteger();

    public DocumentStage stage() {
        return stage.get();
    }

    /**
     * Moves the scan forward to {@code next}. Requests that would move it backwards, or out of a
     * terminal stage, are ignored.
     *
     * @return whether the stage changed
     */
    public boolean advance(DocumentStage next) {
        while (true) {
            DocumentStage current = stage.get();
            if (current.isTerminal() || next.ordinal() <= current.ordinal()) {
                return false;
            }
            if (stage.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    public void cancel() {
        cancel(System.nanoTime());
    }

    void cancel(long nowNanos) {
        long stamp = nowNanos == NOT_CANCELLED ? NOT_CANCELLED + 1 : nowNanos;
        cancelledAtNanos.compareAndSet(NOT_CANCELLED, stamp);
    }

    public boolean isCancelled() {
        return cancelledAtNanos.get() != NOT_CANCELLED;
    }

    long cancelledAtNanos() {
        return cancelledAtNanos.get();
    }

    void totalPages(int pages) {
        totalPages.set(pages);
    }

    public int totalPages() {
        return totalPages.get();
    }

    void pageFinished() {
        finishedPages.incrementAndGet();
    }

    public int finishedPages() {
        return finishedPages.get();
    }
}
