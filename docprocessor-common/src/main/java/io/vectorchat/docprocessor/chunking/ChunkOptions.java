package io.vectorchat.docprocessor.chunking;

/**
 * Parameters for structural markdown chunking and overflow splitting.
 *
 * @param maxTokens      hard per-chunk budget; a buffer reaching {@code maxTokens * charsPerToken}
 *                       characters is split
 * @param minTokens      soft budget; a buffer past {@code minTokens * charsPerToken} characters is
 *                       flushed at the next blank line
 * @param charsPerToken  divisor used by the token heuristic
 * @param overlapPercent fraction of an overflow window repeated in the next window
 */
public record ChunkOptions(
        int maxTokens,
        int minTokens,
        int charsPerToken,
        double overlapPercent
) {

    public static final int DEFAULT_CHARS_PER_TOKEN = 4;

    public ChunkOptions {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be > 0");
        }
        if (minTokens < 0 || minTokens > maxTokens) {
            throw new IllegalArgumentException("minTokens must be between 0 and maxTokens");
        }
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be > 0");
        }
        if (overlapPercent < 0 || overlapPercent >= 1) {
            throw new IllegalArgumentException("overlapPercent must be in [0, 1)");
        }
    }

    public static ChunkOptions defaults() {
        return new ChunkOptions(1200, 800, DEFAULT_CHARS_PER_TOKEN, 0.10);
    }

    public int maxChars() {
        return maxTokens * charsPerToken;
    }

    public int minChars() {
        return minTokens * charsPerToken;
    }
}
