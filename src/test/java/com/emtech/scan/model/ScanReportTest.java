package com.emtech.scan.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ScanReportTest {

    private static Hit hit(int page, String term, String category, int start, double confidence) {
        return new Hit("doc", page, term, category, MatchMode.CASE_INSENSITIVE, start, start + term.length(), term,
                confidence, term);
    }

    @Test
    void ordersHitsByPageThenConfidenceThenPosition() {
        Hit late = hit(1, "blockchain", "ledger", 0, 0.9);
        Hit weak = hit(0, "ai", "ai", 5, 0.4);
        Hit strong = hit(0, "quantum", "computing", 20, 0.8);
        Hit strongEarlier = hit(0, "qubit", "computing", 2, 0.8);

        ScanReport report = new ScanReport("doc", "doc.pdf", ScanStatus.COMPLETED, null,
                List.of(late, weak, strong, strongEarlier), Map.of("ai", 1L), List.of());

        assertThat(report.hits()).containsExactly(strongEarlier, strong, weak, late);
    }

    @Test
    void answersQueriesOverHitsAndPages() {
        Hit quantum = hit(0, "quantum", "computing", 0, 0.9);
        Hit ai = hit(2, "ai", "ai", 0, 0.35);
        List<PageOutcome> pages = List.of(
                new PageOutcome(2, PageStatus.MATCHED, null, 1.0, 1, 0, "ai"),
                PageOutcome.failed(1, "Both OCR engines unavailable"),
                new PageOutcome(0, PageStatus.MATCHED, null, 1.0, 1, 0, "quantum"));

        ScanReport report = new ScanReport("doc", "doc.pdf", ScanStatus.COMPLETED, null,
                List.of(ai, quantum), Map.of("computing", 1L, "ai", 1L), pages);

        assertThat(report.totalPages()).isEqualTo(3);
        assertThat(report.pages()).extracting(PageOutcome::pageIndex).containsExactly(0, 1, 2);
        assertThat(report.failedPages()).extracting(PageOutcome::pageIndex).containsExactly(1);
        assertThat(report.hitsForCategory("computing")).containsExactly(quantum);
        assertThat(report.hitsForPage(2)).containsExactly(ai);
        assertThat(report.hitsAtLeast(0.5)).containsExactly(quantum);
        assertThat(report.hitsByCategory()).containsOnlyKeys("computing", "ai");
        assertThat(report.categoryCounts().keySet()).containsExactly("ai", "computing");
    }

    @Test
    void failedReportCarriesNoHits() {
        ScanReport report = ScanReport.failed("doc", "doc.bin", "Unsupported format", null);

        assertThat(report.isFailed()).isTrue();
        assertThat(report.hits()).isEmpty();
        assertThat(report.categoryCounts()).isEmpty();
        assertThat(report.failureReason()).isEqualTo("Unsupported format");
    }
}
