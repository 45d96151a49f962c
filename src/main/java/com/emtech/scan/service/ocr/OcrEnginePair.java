package com.emtech.scan.service.ocr;

import java.util.List;
import java.util.Objects;

/**
 * The two engines consulted for every page. The primary engine wins disagreements that cannot be
 * settled by reported confidences.
 */
public record OcrEnginePair(OcrEngine primary, OcrEngine secondary) {

    public OcrEnginePair {
        Objects.requireNonNull(primary, "primary");
        Objects.requireNonNull(secondary, "secondary");
        if (primary.id().equals(secondary.id())) {
            throw new IllegalArgumentException("OCR engines must have distinct ids, got " + primary.id() + " twice");
        }
    }

    /**
     * Orders two engines so that the one whose id matches {@code primaryId} comes first. When
     * neither matches, the first argument stays primary.
     */
    public static OcrEnginePair of(String primaryId, OcrEngine first, OcrEngine second) {
        if (second.id().equals(primaryId)) {
            return new OcrEnginePair(second, first);
        }
        return new OcrEnginePair(first, second);
    }

    public String primaryId() {
        return primary.id();
    }

    public List<OcrEngine> engines() {
        return List.of(primary, secondary);
    }
}
