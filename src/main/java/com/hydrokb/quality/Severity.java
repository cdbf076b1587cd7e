package com.hydrokb.quality;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
