package com.emtech.scan.model;

import java.util.List;
import java.util.Objects;

/**
 * The merged text of one page together with per-token provenance. Produced exactly once per page
 * by the consensus merger.
 *
 * @param mergeConfidence fraction of paired token positions on which the engines agreed; engine-exclusive
 *        tokens are not counted
 */
public record CanonicalText(int pageIndex, String text, List<MergedSpan> spans, double mergeConfidence) {

    public CanonicalText {
        Objects.requireNonNull(text, "text");
        spans = spans == null ? List.of() : List.copyOf(spans);
        for (MergedSpan span : spans) {
            if (span.end() > text.length()) {
                throw new IllegalArgumentException("Span " + span + " exceeds canonical text");
            }
        }
        mergeConfidence = Math.max(0.0, Math.min(1.0, mergeConfidence));
    }

    /**
     * Mean confidence of the tokens covering {@code [start, end)}; zero when no token is covered.
     */
    public double confidenceOver(int start, int end) {
        double sum = 0.0;
        int count = 0;
        for (MergedSpan span : spans) {
            if (span.overlaps(start, end)) {
                sum += span.confidence();
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    public boolean isEmpty() {
        return text.isBlank();
    }
}
