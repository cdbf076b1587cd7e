package com.hydrokb.vector;

public enum SyncMode {
    /** Scan only when the index holds fewer rows than the store. */
    INCREMENTAL,
    /** Scan every chunk regardless of row counts. */
    FULL
}
