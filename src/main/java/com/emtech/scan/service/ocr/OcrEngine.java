package com.emtech.scan.service.ocr;

import com.emtech.scan.exception.EngineUnavailableException;
import com.emtech.scan.model.OcrResult;
import com.emtech.scan.model.Page;

/**
 * A text recognizer wrapped behind a uniform contract. Implementations hold no mutable state
 * shared between calls, so the two engines of a page can run concurrently on the same
 * read-only bitmap.
 */
public interface OcrEngine {

    /**
     * @return stable identifier used for provenance and primary-engine tie-breaks
     */
    String id();

    /**
     * @return whether the engine can be invoked at all in this environment
     */
    boolean isAvailable();

    /**
     * Recognizes the text of a rasterized page. Empty engine output is a valid, zero-confidence
     * result, not an error.
     *
     * @throws EngineUnavailableException when the engine cannot be invoked for this page
     */
    OcrResult recognize(Page page);
}
