package com.hydrokb.vector;

public enum SyncState {
    IDLE,
    SCANNING,
    FETCH,
    VALIDATE,
    REEMBED,
    UPSERT,
    ERROR
}
