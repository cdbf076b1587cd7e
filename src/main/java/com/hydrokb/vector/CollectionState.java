package com.hydrokb.vector;

public enum CollectionState {
    EXISTING,
    CREATED,
    RECREATED
}
