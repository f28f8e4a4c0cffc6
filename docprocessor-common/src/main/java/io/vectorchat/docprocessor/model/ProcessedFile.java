package io.vectorchat.docprocessor.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Result of processing one upload or text submission.
 *
 * @param id           opaque identifier assigned at processing time
 * @param filename     base filename (synthesized for text submissions)
 * @param originalSize size of the submitted content in bytes
 * @param contentHash  hex SHA-256 of the submitted bytes
 * @param markdown     converted markdown (the raw text for text submissions)
 * @param chunks       ordered, non-blank chunks ready for embedding
 * @param processedAt  UTC processing timestamp
 */
public record ProcessedFile(
        UUID id,
        String filename,
        long originalSize,
        String contentHash,
        String markdown,
        List<String> chunks,
        Instant processedAt
) {

    public ProcessedFile {
        chunks = List.copyOf(chunks);
    }
}
