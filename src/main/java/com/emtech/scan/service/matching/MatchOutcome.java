package com.emtech.scan.service.matching;

import com.emtech.scan.model.Hit;
import java.util.List;

/**
 * Hits found on one page and how many candidate hits fell below the confidence threshold.
 */
public record MatchOutcome(List<Hit> hits, int suppressedCount) {

    public MatchOutcome {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }

    public static MatchOutcome none() {
        return new MatchOutcome(List.of(), 0);
    }
}
