package com.emtech.scan.exception;

/**
 * A page could not be extracted from an otherwise readable document. Only the page fails.
 */
public class CorruptDocumentException extends ScanException {

    private final int pageIndex;

    public CorruptDocumentException(int pageIndex, String message, Throwable cause) {
        super(message, cause);
        this.pageIndex = pageIndex;
    }

    public int getPageIndex() {
        return pageIndex;
    }
}
