package com.emtech.scan.exception;

/**
 * Base type for failures raised while scanning a document.
 */
public class ScanException extends RuntimeException {

    public ScanException(String message) {
        super(message);
    }

    public ScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
