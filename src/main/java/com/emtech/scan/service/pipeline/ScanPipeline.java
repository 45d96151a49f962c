package com.emtech.scan.service.pipeline;

import com.emtech.scan.config.ScanProperties;
import com.emtech.scan.exception.EmptyMergeInputException;
import com.emtech.scan.exception.EngineUnavailableException;
import com.emtech.scan.exception.ScanException;
import com.emtech.scan.model.CanonicalText;
import com.emtech.scan.model.Document;
import com.emtech.scan.model.DocumentStage;
import com.emtech.scan.model.OcrResult;
import com.emtech.scan.model.Page;
import com.emtech.scan.model.PageOutcome;
import com.emtech.scan.model.PageStatus;
import com.emtech.scan.model.ScanReport;
import com.emtech.scan.service.consensus.ConsensusMerger;
import com.emtech.scan.service.matching.MatchOutcome;
import com.emtech.scan.service.matching.TermCatalog;
import com.emtech.scan.service.matching.TermMatcher;
import com.emtech.scan.service.ocr.OcrEngine;
import com.emtech.scan.service.ocr.OcrEnginePair;
import com.emtech.scan.service.raster.RasterSession;
import com.emtech.scan.service.raster.Rasterizer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs a document through rasterization, both OCR engines, the consensus merge and term matching.
 *
 * <p>Pages are rasterized one at a time on the calling thread and processed concurrently on the
 * page pool, with at most {@code page-workers} pages in memory at once. The two engine calls of
 * a page run on the engine pool and are joined with a per-call timeout. Any page failure is
 * recorded against the page and the document carries on; only a document that cannot be opened
 * at all fails as a whole.</p>
 */
@Service
public class ScanPipeline {

    private static final Logger log = LoggerFactory.getLogger(ScanPipeline.class);

    private static final long POLL_MILLIS = 100;
    static final String CANCELLED_REASON = "Scan cancelled before the page was processed";

    private final Rasterizer rasterizer;
    private final OcrEnginePair engines;
    private final ConsensusMerger merger;
    private final TermMatcher matcher;
    private final TermCatalog catalog;
    private final ResultAggregator aggregator;
    private final AsyncTaskExecutor pageExecutor;
    private final AsyncTaskExecutor engineExecutor;
    private final Duration pageTimeout;
    private final Duration cancelGracePeriod;
    private final int pageWorkers;

    public ScanPipeline(Rasterizer rasterizer,
                        OcrEnginePair engines,
                        ConsensusMerger merger,
                        TermMatcher matcher,
                        TermCatalog catalog,
                        ResultAggregator aggregator,
                        @Qualifier("pageExecutor") AsyncTaskExecutor pageExecutor,
                        @Qualifier("engineExecutor") AsyncTaskExecutor engineExecutor,
                        ScanProperties properties) {
        this.rasterizer = rasterizer;
        this.engines = engines;
        this.merger = merger;
        this.matcher = matcher;
        this.catalog = catalog;
        this.aggregator = aggregator;
        this.pageExecutor = pageExecutor;
        this.engineExecutor = engineExecutor;
        this.pageTimeout = properties.ocr().pageTimeout();
        this.cancelGracePeriod = properties.pipeline().cancelGracePeriod();
        this.pageWorkers = properties.pipeline().effectivePageWorkers();
    }

    public ScanReport scan(Document document) {
        return scan(document, new ScanControl());
    }

    /**
     * Scans a document. Never throws for document-level problems: an unreadable document yields a
     * failed report with zero hits and the reason.
     */
    public ScanReport scan(Document document, ScanControl control) {
        long started = System.nanoTime();
        log.info("Scanning document {} ({}, {} bytes) with engines {} (primary) and {}",
                document.id(), document.name(), document.size(), engines.primary().id(), engines.secondary().id());
        aggregator.begin(document);
        control.advance(DocumentStage.RASTERIZING);
        try (RasterSession session = rasterizer.open(document)) {
            control.totalPages(session.pageCount());
            runPages(document, session, control);
        } catch (ScanException ex) {
            log.error("Scan of document {} failed: {}", document.id(), ex.getMessage());
            aggregator.discard(document.id());
            control.advance(DocumentStage.FAILED);
            return ScanReport.failed(document.id(), document.name(), ex.getMessage(), List.of());
        }

        if (control.isCancelled()) {
            aggregator.markCancelled(document.id());
        }
        ScanReport report = aggregator.finalizeReport(document);
        if (report.isFailed()) {
            control.advance(DocumentStage.FAILED);
            log.error("Scan of document {} failed: {}", document.id(), report.failureReason());
        } else {
            control.advance(DocumentStage.AGGREGATED);
            control.advance(DocumentStage.REPORTED);
            log.info("Finished document {} in {} ms: {} page(s), {} failed, {} hit(s), status {}",
                    document.id(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started),
                    report.totalPages(), report.failedPages().size(), report.hits().size(), report.status());
        }
        return report;
    }

    private void runPages(Document document, RasterSession session, ScanControl control) {
        Semaphore slots = new Semaphore(pageWorkers);
        List<PageTask> tasks = new ArrayList<>();
        Iterator<Page> pages = session.iterator();
        int next = 0;
        while (pages.hasNext() && acquire(slots, control)) {
            Page page = pages.next();
            next++;
            if (page.status() == PageStatus.FAILED) {
                slots.release();
                aggregator.recordPage(document.id(),
                        PageOutcome.failed(page.index(), page.failureReason().orElse("Page extraction failed")));
                control.pageFinished();
                continue;
            }
            control.advance(DocumentStage.RECOGNIZING);
            try {
                Future<?> future = pageExecutor.submit(() -> {
                    try {
                        process(document, page, control);
                    } finally {
                        slots.release();
                    }
                });
                tasks.add(new PageTask(page, future));
            } catch (RuntimeException ex) {
                slots.release();
                fail(document, page, "Page could not be scheduled: " + ex.getMessage());
            }
        }
        if (control.isCancelled()) {
            int total = session.pageCount();
            if (next < total) {
                log.info("Scan of {} cancelled; {} page(s) not started", document.id(), total - next);
            }
            for (int index = next; index < total; index++) {
                aggregator.recordPage(document.id(), PageOutcome.failed(index, CANCELLED_REASON));
            }
        }
        awaitPages(document, tasks, control);
    }

    private boolean acquire(Semaphore slots, ScanControl control) {
        try {
            while (!control.isCancelled()) {
                if (slots.tryAcquire(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    if (!control.isCancelled()) {
                        return true;
                    }
                    slots.release();
                }
            }
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            control.cancel();
            return false;
        }
    }

    /**
     * Waits for submitted pages. Once the scan is cancelled, pages still running after the grace
     * period are interrupted and reported as failed.
     */
    private void awaitPages(Document document, List<PageTask> tasks, ScanControl control) {
        for (PageTask task : tasks) {
            while (!task.future().isDone()) {
                long wait = POLL_MILLIS;
                if (control.isCancelled()) {
                    long deadline = control.cancelledAtNanos() + cancelGracePeriod.toNanos();
                    long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                    if (remaining <= 0) {
                        break;
                    }
                    wait = Math.min(wait, remaining);
                }
                try {
                    task.future().get(wait, TimeUnit.MILLISECONDS);
                } catch (TimeoutException ignore) {
                    // poll again
                } catch (ExecutionException ex) {
                    log.warn("Page {} of {} terminated abnormally: {}", task.page().index(), document.id(),
                            ex.getCause() == null ? ex.getMessage() : ex.getCause().getMessage());
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    control.cancel();
                    break;
                }
            }
        }
        for (PageTask task : tasks) {
            if (!task.future().isDone()) {
                task.future().cancel(true);
            }
            fail(document, task.page(), CANCELLED_REASON);
        }
    }

    private void process(Document document, Page page, ScanControl control) {
        try {
            if (control.isCancelled()) {
                fail(document, page, CANCELLED_REASON);
                return;
            }
            Recognition recognition = recognize(page);
            if (recognition.primary() == null && recognition.secondary() == null) {
                fail(document, page, "Both OCR engines unavailable: " + String.join("; ", recognition.failures()));
                return;
            }
            if (!page.tryAdvance(PageStatus.RECOGNIZED)) {
                return;
            }
            control.advance(DocumentStage.MERGING);
            CanonicalText text = merger.merge(page.index(), recognition.primary(), recognition.secondary());
            if (!page.assignCanonicalText(text)) {
                return;
            }
            control.advance(DocumentStage.MATCHING);
            MatchOutcome outcome = matcher.match(document.id(), text, catalog);
            if (outcome.suppressedCount() > 0) {
                log.debug("Page {} of {}: {} hit(s) below the confidence threshold suppressed",
                        page.index(), document.id(), outcome.suppressedCount());
            }
            complete(document, page, text, outcome);
        } catch (EmptyMergeInputException ex) {
            log.warn("Page {} of {} has no recognizable text", page.index(), document.id());
            fail(document, page, ex.getMessage());
        } catch (RuntimeException ex) {
            log.warn("Page {} of {} failed: {}", page.index(), document.id(), ex.getMessage());
            fail(document, page, "Page processing failed: " + ex.getMessage());
        } finally {
            page.releaseBitmap();
            control.pageFinished();
        }
    }

    private Recognition recognize(Page page) {
        OcrEngine primary = engines.primary();
        OcrEngine secondary = engines.secondary();
        Future<OcrResult> primaryCall = engineExecutor.submit(() -> primary.recognize(page));
        Future<OcrResult> secondaryCall = engineExecutor.submit(() -> secondary.recognize(page));
        List<String> failures = new ArrayList<>(2);
        // both calls share one deadline, so a page never waits longer than the page timeout
        long deadline = System.nanoTime() + pageTimeout.toNanos();
        OcrResult first = await(primary, page, primaryCall, deadline, failures);
        OcrResult second = await(secondary, page, secondaryCall, deadline, failures);
        return new Recognition(first, second, failures);
    }

    private OcrResult await(OcrEngine engine, Page page, Future<OcrResult> call, long deadline,
            List<String> failures) {
        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            OcrResult result = call.get(remaining, TimeUnit.NANOSECONDS);
            log.debug("Page {}: {} returned {} token(s)", page.index(), engine.id(),
                    result == null ? 0 : result.tokens().size());
            return result;
        } catch (TimeoutException ex) {
            call.cancel(true);
            String reason = engine.id() + " timed out after " + pageTimeout.toSeconds() + "s";
            log.warn("Page {}: {}", page.index(), reason);
            failures.add(reason);
            return null;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (!(cause instanceof EngineUnavailableException)) {
                log.warn("Page {}: engine {} failed unexpectedly", page.index(), engine.id(), cause);
            } else {
                log.warn("Page {}: {}", page.index(), cause.getMessage());
            }
            failures.add(engine.id() + ": " + cause.getMessage());
            return null;
        } catch (InterruptedException ex) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new ScanException("Interrupted while waiting for " + engine.id() + " on page " + page.index(), ex);
        }
    }

    private void complete(Document document, Page page, CanonicalText text, MatchOutcome outcome) {
        synchronized (page) {
            if (page.tryAdvance(PageStatus.MATCHED)) {
                aggregator.recordPage(document.id(), new PageOutcome(page.index(), PageStatus.MATCHED, null,
                        text.mergeConfidence(), outcome.hits().size(), outcome.suppressedCount(), text.text()),
                        outcome.hits());
            }
        }
    }

    private void fail(Document document, Page page, String reason) {
        synchronized (page) {
            if (page.markFailed(reason)) {
                aggregator.recordPage(document.id(), PageOutcome.failed(page.index(), reason));
            }
        }
    }

    private record PageTask(Page page, Future<?> future) {
    }

    private record Recognition(OcrResult primary, OcrResult secondary, List<String> failures) {
    }
}
