package com.hydrokb.vector;

public record SyncReport(
        long epoch,
        SyncOutcome outcome,
        CollectionState collectionState,
        long storeChunks,
        long indexRowsBefore,
        int scanned,
        int reembedded,
        int upserted,
        int failedBatches,
        int skippedChunks) {

    static SyncReport skipped(long epoch) {
        return new SyncReport(epoch, SyncOutcome.SKIPPED, null, 0, 0, 0, 0, 0, 0, 0);
    }

    static SyncReport failed(long epoch, CollectionState collectionState) {
        return new SyncReport(epoch, SyncOutcome.FAILED, collectionState, 0, 0, 0, 0, 0, 0, 0);
    }
}
