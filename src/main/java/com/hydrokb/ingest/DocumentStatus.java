package com.hydrokb.ingest;

public enum DocumentStatus {
    ACTIVE,
    ARCHIVED
}
