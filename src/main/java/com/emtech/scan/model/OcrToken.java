package com.emtech.scan.model;

import java.util.Objects;

/**
 * A word-level unit reported by an OCR engine. Region and confidence are optional because not
 * every engine reports them.
 *
 * @param text the recognized token, never blank
 * @param region where the token sits on the page, or {@code null} when unknown
 * @param confidence engine confidence in {@code [0, 1]}, or {@code null} when unknown
 */
public record OcrToken(String text, BoundingBox region, Double confidence) {

    public OcrToken {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            throw new IllegalArgumentException("Token text must not be blank");
        }
        if (confidence != null) {
            if (!Double.isFinite(confidence)) {
                confidence = null;
            } else {
                confidence = Math.max(0.0, Math.min(1.0, confidence));
            }
        }
    }

    public static OcrToken of(String text) {
        return new OcrToken(text, null, null);
    }

    public boolean hasConfidence() {
        return confidence != null;
    }
}
