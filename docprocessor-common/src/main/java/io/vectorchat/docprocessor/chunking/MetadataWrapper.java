package io.vectorchat.docprocessor.chunking;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Prefixes each chunk with YAML-style front-matter so it can be addressed once embedded:
 *
 * <pre>
 * ---
 * doc_id: kb-42-handbook.pdf
 * file_id: 6f1c...
 * source: "handbook.pdf"
 * section: "Getting started"
 * chunk_index: 0
 * created_at: 2025-03-01T10:15:30Z
 * ---
 *
 * body...
 * </pre>
 *
 * <p>Blocks that would not fit the {@link TokenBudget} with their front-matter are reduced by the
 * {@link OverflowSplitter} first. {@code chunk_index} starts at 0 and grows by one per emitted
 * chunk across the whole document.</p>
 */
@Slf4j
public class MetadataWrapper {

    static final int MAX_METADATA_VALUE_LENGTH = 256;

    private static final String FRONT_MATTER = "---\n"
            + "doc_id: %s\n"
            + "file_id: %s\n"
            + "source: \"%s\"\n"
            + "section: \"%s\"\n"
            + "chunk_index: %s\n"
            + "created_at: %s\n"
            + "---\n\n";

    // widest possible index, so the overhead estimate covers every real chunk_index
    private static final String PLACEHOLDER_INDEX = String.valueOf(Integer.MAX_VALUE);

    private final OverflowSplitter overflowSplitter;
    private final TokenEstimator estimator;

    public MetadataWrapper(OverflowSplitter overflowSplitter, ChunkOptions options) {
        this.overflowSplitter = overflowSplitter;
        this.estimator = new TokenEstimator(options.charsPerToken());
    }

    /**
     * Wraps structural chunks of one document.
     *
     * @param chunks    structural chunks in document order
     * @param docId     document identifier (single line, not blank)
     * @param source    human-readable origin, typically the filename
     * @param fileId    identifier of the stored file row
     * @param createdAt ingestion time, rendered in UTC with second precision
     * @return wrapped chunks in document order
     */
    public List<String> wrap(List<StructuralChunk> chunks, String docId, String source, UUID fileId, Instant createdAt) {
        requireSingleLine(docId, "docId");
        if (fileId == null) {
            throw new IllegalArgumentException("fileId is required");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt is required");
        }

        String sanitizedSource = sanitizeMetadataValue(source);
        String fileIdentifier = fileId.toString();
        String created = formatCreatedAt(createdAt);

        List<String> wrapped = new ArrayList<>();
        int chunkIndex = 0;

        for (StructuralChunk chunk : chunks) {
            String section = sanitizeMetadataValue(chunk.section());
            if (section.isEmpty()) {
                section = MarkdownStructuralChunker.DEFAULT_SECTION;
            }

            int overhead = estimator.estimateCeil(
                    frontMatter(docId, fileIdentifier, sanitizedSource, section, PLACEHOLDER_INDEX, created));

            for (String part : overflowSplitter.split(chunk.text(), overhead)) {
                wrapped.add(frontMatter(docId, fileIdentifier, sanitizedSource, section,
                        String.valueOf(chunkIndex), created) + part);
                chunkIndex++;
            }
        }

        log.debug("Wrapped {} structural blocks into {} chunks for doc {}", chunks.size(), wrapped.size(), docId);
        return wrapped;
    }

    /**
     * Upper-bound token estimate of the front-matter for the given values.
     */
    public int metadataOverheadTokens(String docId, UUID fileId, String source, String section, Instant createdAt) {
        String sanitizedSection = sanitizeMetadataValue(section);
        if (sanitizedSection.isEmpty()) {
            sanitizedSection = MarkdownStructuralChunker.DEFAULT_SECTION;
        }
        return estimator.estimateCeil(frontMatter(docId, fileId.toString(), sanitizeMetadataValue(source),
                sanitizedSection, PLACEHOLDER_INDEX, formatCreatedAt(createdAt)));
    }

    /**
     * Makes a value safe to place inside a double-quoted front-matter field: trimmed, line breaks
     * collapsed to spaces, double quotes turned into single quotes, capped in length.
     */
    static String sanitizeMetadataValue(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.strip()
                .replace("\r\n", " ")
                .replace('\n', ' ')
                .replace('\r', ' ')
                .replace('"', '\'');
        if (sanitized.codePointCount(0, sanitized.length()) > MAX_METADATA_VALUE_LENGTH) {
            sanitized = sanitized.substring(0, sanitized.offsetByCodePoints(0, MAX_METADATA_VALUE_LENGTH)).strip();
        }
        return sanitized;
    }

    static String formatCreatedAt(Instant createdAt) {
        return DateTimeFormatter.ISO_INSTANT.format(createdAt.truncatedTo(ChronoUnit.SECONDS));
    }

    private static String frontMatter(String docId, String fileId, String source, String section,
                                      String chunkIndex, String created) {
        return String.format(FRONT_MATTER, docId, fileId, source, section, chunkIndex, created);
    }

    private static void requireSingleLine(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            throw new IllegalArgumentException(name + " must be a single line");
        }
    }
}
