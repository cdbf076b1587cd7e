package com.hydrokb.health;

public enum DocumentIndexStatus {
    NOT_INDEXED,
    PARTIAL,
    COMPLETE,
    CORRUPTED
}
