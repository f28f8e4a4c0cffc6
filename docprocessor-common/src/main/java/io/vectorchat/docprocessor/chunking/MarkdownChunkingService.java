package io.vectorchat.docprocessor.chunking;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Entry point to the chunking pipeline.
 *
 * <ol>
 *   <li>Structural chunking of markdown (headings, fences, tables, soft/hard limits)</li>
 *   <li>Optionally, budget enforcement and front-matter wrapping for vector storage</li>
 * </ol>
 *
 * <p>Holds no mutable state and can be shared between threads.</p>
 */
@Slf4j
public class MarkdownChunkingService {

    private final ChunkOptions options;
    private final MarkdownStructuralChunker structuralChunker;
    private final MetadataWrapper metadataWrapper;
    private final TextChunker textChunker;

    public MarkdownChunkingService(ChunkOptions options, TokenBudget budget) {
        this.options = options;
        this.textChunker = new TextChunker();
        this.structuralChunker = new MarkdownStructuralChunker(options);
        this.metadataWrapper = new MetadataWrapper(new OverflowSplitter(textChunker, options, budget), options);
    }

    /**
     * Convenience constructor using {@link ChunkOptions#defaults()} and {@link TokenBudget#defaults()}.
     */
    public MarkdownChunkingService() {
        this(ChunkOptions.defaults(), TokenBudget.defaults());
    }

    /**
     * Chunks markdown with this service's options and returns the block texts only.
     */
    public List<String> chunkMarkdown(String markdown) {
        return chunkMarkdown(markdown, options);
    }

    /**
     * Chunks markdown with the given options and returns the block texts only.
     */
    public List<String> chunkMarkdown(String markdown, ChunkOptions chunkOptions) {
        MarkdownStructuralChunker chunker = chunkOptions.equals(options)
                ? structuralChunker
                : new MarkdownStructuralChunker(chunkOptions);
        return chunker.chunk(markdown).stream()
                .map(StructuralChunk::text)
                .filter(text -> !text.isBlank())
                .toList();
    }

    /**
     * Section-tagged structural blocks, before any budget enforcement.
     */
    public List<StructuralChunk> structuralChunks(String markdown) {
        return structuralChunker.chunk(markdown);
    }

    /**
     * Chunks markdown and wraps every resulting chunk with addressable front-matter, splitting
     * blocks that would exceed the embedding budget.
     *
     * @return wrapped chunks with {@code chunk_index} 0..n-1 in document order, or an empty list
     *         when the markdown has no content
     */
    public List<String> wrapMarkdownWithMetadata(String markdown, String docId, String source,
                                                 UUID fileId, Instant createdAt) {
        List<StructuralChunk> blocks = structuralChunker.chunk(markdown);
        if (blocks.isEmpty()) {
            return List.of();
        }

        List<String> wrapped = metadataWrapper.wrap(blocks, docId, source, fileId, createdAt);
        log.info("Wrapped doc {} into {} chunks ({} structural blocks)", docId, wrapped.size(), blocks.size());
        return wrapped;
    }

    /**
     * Fixed-size windows for unstructured text.
     */
    public List<String> chunkText(String text, int chunkSize) {
        return textChunker.chunkText(text, chunkSize);
    }

    public List<String> chunkTextWithOverlap(String text, int chunkSize, int overlap) {
        return textChunker.chunkTextWithOverlap(text, chunkSize, overlap);
    }

    public MetadataWrapper metadataWrapper() {
        return metadataWrapper;
    }

    public ChunkOptions options() {
        return options;
    }
}
