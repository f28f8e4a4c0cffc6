package io.vectorchat.ingest.model;

import java.util.UUID;

/**
 * A wrapped chunk ready for the vector store; {@code id} is {@code docId-chunkIndex}.
 */
public record ChunkRecord(String id, String docId, UUID fileId, int chunkIndex, String content) {

    public static ChunkRecord of(String docId, UUID fileId, int chunkIndex, String content) {
        return new ChunkRecord(docId + "-" + chunkIndex, docId, fileId, chunkIndex, content);
    }
}
