package io.vectorchat.docprocessor.chunking;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-size window splitter for unstructured text.
 *
 * <p>Windows are measured in Unicode code points so surrogate pairs are never cut. Windows
 * containing only whitespace are dropped.</p>
 */
public class TextChunker {

    public static final int DEFAULT_CHUNK_SIZE = 1000;

    /**
     * Splits text into consecutive, non-overlapping windows of {@code chunkSize} code points.
     *
     * @param text      text to split
     * @param chunkSize window size; values {@code <= 0} fall back to {@value #DEFAULT_CHUNK_SIZE}
     * @return ordered non-blank windows
     */
    public List<String> chunkText(String text, int chunkSize) {
        return chunkTextWithOverlap(text, chunkSize, 0);
    }

    /**
     * Splits text into windows of {@code chunkSize} code points, each starting
     * {@code chunkSize - overlap} code points after the previous one.
     *
     * <p>An overlap that would stall the window ({@code overlap >= chunkSize}) is clamped to
     * {@code chunkSize / 4}. The loop stops once a window reaches the end of the text.</p>
     */
    public List<String> chunkTextWithOverlap(String text, int chunkSize, int overlap) {
        List<String> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }
        if (chunkSize <= 0) {
            chunkSize = DEFAULT_CHUNK_SIZE;
        }
        if (overlap < 0) {
            overlap = 0;
        }
        if (overlap >= chunkSize) {
            overlap = chunkSize / 4;
        }

        int[] codePoints = text.codePoints().toArray();
        int step = chunkSize - overlap;

        for (int start = 0; start < codePoints.length; start += step) {
            int end = Math.min(start + chunkSize, codePoints.length);

            String chunk = new String(codePoints, start, end - start);
            if (!chunk.isBlank()) {
                chunks.add(chunk);
            }

            if (end >= codePoints.length) {
                break;
            }
        }

        return chunks;
    }
}
