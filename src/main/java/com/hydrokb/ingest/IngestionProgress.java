package com.hydrokb.ingest;

public record IngestionProgress(int current, int total, String message) {
}
