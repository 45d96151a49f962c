package com.emtech.scan.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Output of one engine for one page. Produced once per (page, engine) pair and never modified.
 */
public record OcrResult(String engineId, int pageIndex, String rawText, List<OcrToken> tokens) {

    public OcrResult {
        Objects.requireNonNull(engineId, "engineId");
        rawText = rawText == null ? "" : rawText;
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    /**
     * Builds a result from plain text, tokenised on whitespace, without confidences.
     */
    public static OcrResult fromText(String engineId, int pageIndex, String rawText) {
        String text = rawText == null ? "" : rawText;
        List<OcrToken> tokens = Arrays.stream(text.trim().split("\\s+"))
                .filter(token -> !token.isBlank())
                .map(OcrToken::of)
                .toList();
        return new OcrResult(engineId, pageIndex, text, tokens);
    }

    public static OcrResult empty(String engineId, int pageIndex) {
        return new OcrResult(engineId, pageIndex, "", List.of());
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public boolean reportsConfidence() {
        return !tokens.isEmpty() && tokens.stream().allMatch(OcrToken::hasConfidence);
    }

    /**
     * Mean token confidence; an empty result counts as zero confidence.
     */
    public double meanConfidence() {
        if (tokens.isEmpty()) {
            return 0.0;
        }
        OptionalDouble average = tokens.stream()
                .filter(OcrToken::hasConfidence)
                .mapToDouble(OcrToken::confidence)
                .average();
        return average.orElse(0.0);
    }
}
