package com.emtech.scan.model;

import java.util.Objects;
import java.util.Set;

/**
 * A token of the canonical text with the character range it occupies and which engines
 * contributed it.
 */
public record MergedSpan(int start, int end, String text, Provenance provenance, Set<String> engines,
        double confidence) {

    public MergedSpan {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(provenance, "provenance");
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid span range [" + start + ", " + end + ")");
        }
        if (end - start != text.length()) {
            throw new IllegalArgumentException("Span range does not match token length");
        }
        engines = engines == null ? Set.of() : Set.copyOf(engines);
    }

    public boolean overlaps(int from, int to) {
        return start < to && from < end;
    }
}
