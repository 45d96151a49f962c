package com.emtech.scan.model;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.Objects;

/**
 * A technology term to look for. Optional settings left {@code null} fall back to the matching
 * defaults.
 */
@Schema(description = "Configured technology term")
public record TermDefinition(
        @Schema(description = "Canonical term or regular expression", example = "quantum computing")
        String term,
        @Schema(description = "How the term is matched against canonical text")
        MatchMode mode,
        @Schema(description = "Category label used to group hits", example = "computing")
        String category,
        @Schema(description = "Maximum edit distance for fuzzy matching")
        Integer maxDistance,
        @Schema(description = "Minimum hit confidence for this term")
        Double minConfidence,
        @Schema(description = "Whether matches must start and end on word boundaries")
        Boolean wholeWord,
        @Schema(description = "Certainty factor applied to regular expression hits")
        Double certainty) {

    public static final String DEFAULT_CATEGORY = "uncategorized";

    public TermDefinition {
        Objects.requireNonNull(term, "term");
        if (term.isBlank()) {
            throw new IllegalArgumentException("Term must not be blank");
        }
        mode = mode == null ? MatchMode.CASE_INSENSITIVE : mode;
        category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category.trim();
        wholeWord = wholeWord == null ? Boolean.TRUE : wholeWord;
        certainty = certainty == null ? 1.0 : Math.max(0.0, Math.min(1.0, certainty));
        if (maxDistance != null && maxDistance < 0) {
            throw new IllegalArgumentException("Fuzzy distance must not be negative for term " + term);
        }
        if (minConfidence != null && (minConfidence < 0.0 || minConfidence > 1.0)) {
            throw new IllegalArgumentException("Minimum confidence must be within [0, 1] for term " + term);
        }
    }

    public static TermDefinition of(String term, MatchMode mode, String category) {
        return new TermDefinition(term, mode, category, null, null, null, null);
    }
}
