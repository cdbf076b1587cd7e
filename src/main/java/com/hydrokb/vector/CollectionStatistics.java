package com.hydrokb.vector;

public record CollectionStatistics(String collection, long rowCount) {
}
