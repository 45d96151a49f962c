package com.emtech.scan.exception;

/**
 * An OCR engine could not be invoked for a page, either because it is missing, crashed or timed
 * out. Never retried: engine absence is a configuration problem.
 */
public class EngineUnavailableException extends ScanException {

    private final String engineId;
    private final int pageIndex;

    public EngineUnavailableException(String engineId, int pageIndex, String message) {
        super(message);
        this.engineId = engineId;
        this.pageIndex = pageIndex;
    }

    public EngineUnavailableException(String engineId, int pageIndex, String message, Throwable cause) {
        super(message, cause);
        this.engineId = engineId;
        this.pageIndex = pageIndex;
    }

    public String getEngineId() {
        return engineId;
    }

    public int getPageIndex() {
        return pageIndex;
    }
}
