package com.emtech.scan.exception;

/**
 * Neither engine produced any text for a page, so there is nothing to merge.
 */
public class EmptyMergeInputException extends ScanException {

    private final int pageIndex;

    public EmptyMergeInputException(int pageIndex) {
        super("Both OCR results are empty for page " + pageIndex);
        this.pageIndex = pageIndex;
    }

    public int getPageIndex() {
        return pageIndex;
    }
}
