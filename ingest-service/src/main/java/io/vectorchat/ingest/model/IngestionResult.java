package io.vectorchat.ingest.model;

import io.vectorchat.docprocessor.model.FileMetadata;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of ingesting one upload or text submission.
 *
 * @param storedPath where the raw upload was written, or {@code null} for text submissions
 */
public record IngestionResult(String docId, FileMetadata metadata, Path storedPath, List<ChunkRecord> chunks) {

    public IngestionResult {
        chunks = List.copyOf(chunks);
    }
}
