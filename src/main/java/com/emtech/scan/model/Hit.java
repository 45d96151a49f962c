package com.emtech.scan.model;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.Objects;

@Schema(description = "A technology term found on a page")
public record Hit(
        @Schema(description = "Document the hit belongs to") String documentId,
        @Schema(description = "Zero-based page index", example = "0") int pageIndex,
        @Schema(description = "Configured term that matched", example = "quantum computing") String term,
        @Schema(description = "Category of the term", example = "computing") String category,
        @Schema(description = "Mode the term was matched with") MatchMode mode,
        @Schema(description = "Start offset of the match in the page canonical text") int start,
        @Schema(description = "End offset (exclusive) of the match in the page canonical text") int end,
        @Schema(description = "Canonical text covered by the match", example = "Quantum Computing") String matchedText,
        @Schema(description = "Merge confidence of the span times the match-mode certainty") double confidence,
        @Schema(description = "Canonical text surrounding the match") String context) {

    public Hit {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(term, "term");
        Objects.requireNonNull(mode, "mode");
        if (matchedText == null || matchedText.isEmpty()) {
            throw new IllegalArgumentException("A hit must cover a non-empty span");
        }
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid hit span [" + start + ", " + end + ")");
        }
        category = category == null ? TermDefinition.DEFAULT_CATEGORY : category;
        context = context == null ? matchedText : context;
    }

    public boolean overlaps(Hit other) {
        return pageIndex == other.pageIndex && start < other.end && other.start < end;
    }
}
