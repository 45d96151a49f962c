package com.emtech.scan.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of a finished document scan. Failed pages are listed separately from pages
 * that simply had no hits, so an OCR failure never reads as a clean negative.
 */
public record ScanReport(
        String documentId,
        String documentName,
        ScanStatus status,
        String failureReason,
        List<Hit> hits,
        Map<String, Long> categoryCounts,
        List<PageOutcome> pages) {

    public static final Comparator<Hit> HIT_ORDER = Comparator.comparingInt(Hit::pageIndex)
            .thenComparing(Comparator.comparingDouble(Hit::confidence).reversed())
            .thenComparingInt(Hit::start)
            .thenComparing(Hit::term);

    public ScanReport {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(status, "status");
        hits = hits == null ? List.of() : hits.stream().sorted(HIT_ORDER).toList();
        categoryCounts = categoryCounts == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(categoryCounts));
        pages = pages == null ? List.of() : pages.stream()
                .sorted(Comparator.comparingInt(PageOutcome::pageIndex))
                .toList();
    }

    public static ScanReport failed(String documentId, String documentName, String reason,
            List<PageOutcome> pages) {
        return new ScanReport(documentId, documentName, ScanStatus.FAILED, reason, List.of(), Map.of(), pages);
    }

    public boolean isFailed() {
        return status == ScanStatus.FAILED;
    }

    public int totalPages() {
        return pages.size();
    }

    public List<PageOutcome> failedPages() {
        return pages.stream().filter(PageOutcome::isFailed).toList();
    }

    public List<Hit> hitsForCategory(String category) {
        return hits.stream().filter(hit -> hit.category().equals(category)).toList();
    }

    public List<Hit> hitsForPage(int pageIndex) {
        return hits.stream().filter(hit -> hit.pageIndex() == pageIndex).toList();
    }

    public List<Hit> hitsAtLeast(double confidence) {
        return hits.stream().filter(hit -> hit.confidence() >= confidence).toList();
    }

    public Map<String, List<Hit>> hitsByCategory() {
        return hits.stream().collect(Collectors.groupingBy(Hit::category, LinkedHashMap::new, Collectors.toList()));
    }
}
