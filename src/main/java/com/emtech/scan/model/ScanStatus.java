package com.emtech.scan.model;

public enum ScanStatus {
    COMPLETED,
    CANCELLED,
    FAILED
}
