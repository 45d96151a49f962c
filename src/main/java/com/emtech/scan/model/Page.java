package com.emtech.scan.model;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * One page of a document travelling through the pipeline. The bitmap is owned by the rasterizer
 * until the page is consumed, after which {@link #releaseBitmap()} drops the reference. Status
 * transitions are monotonic and the canonical text can be assigned exactly once.
 */
public final class Page {

    private final String documentId;
    private final int index;
    private BufferedImage bitmap;
    private final Path imageFile;
    private PageStatus status;
    private CanonicalText canonicalText;
    private String failureReason;

    private Page(String documentId, int index, BufferedImage bitmap, Path imageFile, PageStatus status,
            String failureReason) {
        if (index < 0) {
            throw new IllegalArgumentException("Page index must not be negative");
        }
        this.documentId = Objects.requireNonNull(documentId, "documentId");
        this.index = index;
        this.bitmap = bitmap;
        this.imageFile = imageFile;
        this.status = status;
        this.failureReason = failureReason;
    }

    public static Page rasterized(String documentId, int index, BufferedImage bitmap, Path imageFile) {
        Objects.requireNonNull(bitmap, "bitmap");
        return new Page(documentId, index, bitmap, imageFile, PageStatus.RASTERIZED, null);
    }

    public static Page failed(String documentId, int index, String reason) {
        return new Page(documentId, index, null, null, PageStatus.FAILED, reason);
    }

    public String documentId() {
        return documentId;
    }

    public int index() {
        return index;
    }

    public synchronized Optional<BufferedImage> bitmap() {
        return Optional.ofNullable(bitmap);
    }

    public Optional<Path> imageFile() {
        return Optional.ofNullable(imageFile);
    }

    public synchronized PageStatus status() {
        return status;
    }

    public synchronized Optional<String> failureReason() {
        return Optional.ofNullable(failureReason);
    }

    public synchronized Optional<CanonicalText> canonicalText() {
        return Optional.ofNullable(canonicalText);
    }

    public synchronized void advanceTo(PageStatus next) {
        if (next == PageStatus.FAILED) {
            throw new IllegalArgumentException("Use markFailed to fail a page");
        }
        if (!status.canAdvanceTo(next)) {
            throw new IllegalStateException(
                    "Page " + index + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    /**
     * Advances the page unless it already failed.
     *
     * @return whether the transition happened
     */
    public synchronized boolean tryAdvance(PageStatus next) {
        if (status == PageStatus.FAILED || !status.canAdvanceTo(next) || next == PageStatus.FAILED) {
            return false;
        }
        status = next;
        return true;
    }

    /**
     * Marks the page failed. A page that already reached a terminal status keeps it.
     *
     * @return whether the transition happened
     */
    public synchronized boolean markFailed(String reason) {
        if (status.isTerminal()) {
            return false;
        }
        status = PageStatus.FAILED;
        failureReason = reason;
        bitmap = null;
        return true;
    }

    /**
     * Assigns the merged text and moves the page to {@code MERGED}.
     *
     * @return {@code false} when the page failed in the meantime and the text was discarded
     */
    public synchronized boolean assignCanonicalText(CanonicalText text) {
        Objects.requireNonNull(text, "text");
        if (canonicalText != null) {
            throw new IllegalStateException("Canonical text already assigned for page " + index);
        }
        if (text.pageIndex() != index) {
            throw new IllegalArgumentException(
                    "Canonical text belongs to page " + text.pageIndex() + ", not " + index);
        }
        if (status == PageStatus.FAILED) {
            return false;
        }
        advanceTo(PageStatus.MERGED);
        canonicalText = text;
        return true;
    }

    public synchronized void releaseBitmap() {
        bitmap = null;
    }
}
