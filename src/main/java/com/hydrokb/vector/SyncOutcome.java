package com.hydrokb.vector;

public enum SyncOutcome {
    COMPLETED,
    UP_TO_DATE,
    SKIPPED,
    FAILED
}
