package com.hydrokb.ingest;

@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = progress -> {
    };

    void onProgress(IngestionProgress progress);
}
