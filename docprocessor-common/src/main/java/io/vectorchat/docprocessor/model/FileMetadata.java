package io.vectorchat.docprocessor.model;

import io.vectorchat.docprocessor.chunking.TokenEstimator;
import io.vectorchat.docprocessor.processor.FileNames;
import io.vectorchat.docprocessor.processor.MarkdownText;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Summary of a {@link ProcessedFile} suitable for listing and bookkeeping.
 */
public record FileMetadata(
        UUID id,
        String filename,
        String title,
        String extension,
        String fileType,
        long size,
        String readableSize,
        String contentHash,
        Instant processedAt,
        int chunkCount,
        int wordCount,
        int tokenCount
) {

    private static final String SIZE_UNITS = "KMGTPE";

    public static FileMetadata from(ProcessedFile file) {
        return new FileMetadata(
                file.id(),
                file.filename(),
                MarkdownText.extractTitle(file.markdown()),
                FileNames.extension(file.filename()),
                FileNames.fileType(file.filename()),
                file.originalSize(),
                formatSize(file.originalSize()),
                file.contentHash(),
                file.processedAt(),
                file.chunks().size(),
                MarkdownText.countWords(file.markdown()),
                TokenEstimator.defaults().estimate(file.markdown())
        );
    }

    /**
     * Formats a byte count with binary units, e.g. {@code 512 B}, {@code 1.5 KB}.
     */
    public static String formatSize(long bytes) {
        long unit = 1024;
        if (bytes < unit) {
            return bytes + " B";
        }
        long div = unit;
        int exp = 0;
        for (long n = bytes / unit; n >= unit; n /= unit) {
            div *= unit;
            exp++;
        }
        return String.format(Locale.ROOT, "%.1f %cB", (double) bytes / div, SIZE_UNITS.charAt(exp));
    }
}
