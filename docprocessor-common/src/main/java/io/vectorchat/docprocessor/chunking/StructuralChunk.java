package io.vectorchat.docprocessor.chunking;

/**
 * A block of markdown produced by {@link MarkdownStructuralChunker}, tagged with the heading it
 * falls under ({@value MarkdownStructuralChunker#DEFAULT_SECTION} before the first heading).
 */
public record StructuralChunk(String section, String text) {
}
