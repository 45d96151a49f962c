package com.emtech.scan.exception;

/**
 * The input is neither a recognized image nor a parseable PDF. Fatal for the document.
 */
public class UnsupportedFormatException extends ScanException {

    public UnsupportedFormatException(String message) {
        super(message);
    }

    public UnsupportedFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
