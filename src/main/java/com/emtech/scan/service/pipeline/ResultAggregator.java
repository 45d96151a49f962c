package com.emtech.scan.service.pipeline;

import com.emtech.scan.model.Document;
import com.emtech.scan.model.Hit;
import com.emtech.scan.model.PageOutcome;
import com.emtech.scan.model.ScanReport;
import com.emtech.scan.model.ScanStatus;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Collects hits and page outcomes of in-progress scans and turns them into immutable reports.
 * Recording is append-only and serialized per document, so pages finishing concurrently never
 * corrupt each other's entries.
 */
@Component
public class ResultAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    private final Map<String, Accumulator> inProgress = new ConcurrentHashMap<>();

    public void begin(Document document) {
        if (inProgress.putIfAbsent(document.id(), new Accumulator()) != null) {
            throw new IllegalStateException("Document " + document.id() + " is already being scanned");
        }
    }

    public void record(String documentId, Hit hit) {
        if (!hit.documentId().equals(documentId)) {
            throw new IllegalArgumentException("Hit belongs to document " + hit.documentId() + ", not " + documentId);
        }
        accumulator(documentId).addHit(hit);
    }

    public void recordPage(String documentId, PageOutcome outcome) {
        recordPage(documentId, outcome, List.of());
    }

    /**
     * Records the outcome of one page together with its hits in one step.
     */
    public void recordPage(String documentId, PageOutcome outcome, Collection<Hit> hits) {
        Accumulator accumulator = accumulator(documentId);
        synchronized (accumulator) {
            for (Hit hit : hits) {
                record(documentId, hit);
            }
            accumulator.addPage(outcome);
        }
    }

    public void markCancelled(String documentId) {
        Accumulator accumulator = inProgress.get(documentId);
        if (accumulator != null) {
            accumulator.cancel();
        }
    }

    public void discard(String documentId) {
        inProgress.remove(documentId);
    }

    /**
     * Produces the final report and forgets the document. Never throws for a document that
     * yielded no usable page: such a report is marked failed and carries no hits.
     */
    public ScanReport finalizeReport(Document document) {
        Accumulator accumulator = inProgress.remove(document.id());
        if (accumulator == null) {
            return ScanReport.failed(document.id(), document.name(), "Document was never scanned", List.of());
        }
        return accumulator.toReport(document);
    }

    private Accumulator accumulator(String documentId) {
        Accumulator accumulator = inProgress.get(documentId);
        if (accumulator == null) {
            throw new IllegalStateException("No scan in progress for document " + documentId);
        }
        return accumulator;
    }

    private static final class Accumulator {

        private final List<Hit> hits = new ArrayList<>();
        private final Set<String> hitKeys = new HashSet<>();
        private final Map<Integer, PageOutcome> pages = new TreeMap<>();
        private boolean cancelled;

        synchronized void addHit(Hit hit) {
            String key = hit.pageIndex() + ":" + hit.term() + ":" + hit.start() + ":" + hit.end();
            if (hitKeys.add(key)) {
                hits.add(hit);
            }
        }

        synchronized void addPage(PageOutcome outcome) {
            PageOutcome previous = pages.putIfAbsent(outcome.pageIndex(), outcome);
            if (previous != null) {
                log.warn("Ignoring second outcome for page {}", outcome.pageIndex());
            }
        }

        synchronized void cancel() {
            cancelled = true;
        }

        synchronized ScanReport toReport(Document document) {
            List<PageOutcome> outcomes = List.copyOf(pages.values());
            boolean anyProcessed = outcomes.stream().anyMatch(outcome -> !outcome.isFailed());
            if (!anyProcessed) {
                String reason = outcomes.isEmpty()
                        ? "Document contains no pages"
                        : cancelled ? "Scan cancelled before any page completed" : "No page could be processed";
                return ScanReport.failed(document.id(), document.name(), reason, outcomes);
            }
            Map<String, Long> counts = new TreeMap<>();
            for (Hit hit : hits) {
                counts.merge(hit.category(), 1L, Long::sum);
            }
            ScanStatus status = cancelled ? ScanStatus.CANCELLED : ScanStatus.COMPLETED;
            return new ScanReport(document.id(), document.name(), status, cancelled ? "Scan cancelled" : null,
                    hits, counts, outcomes);
        }
    }
}
