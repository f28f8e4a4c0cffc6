package io.vectorchat.docprocessor.chunking;

/**
 * Character-based token heuristic: {@code codePoints / charsPerToken}.
 *
 * <p>Not a model tokenizer. Every budget check in the chunking pipeline goes through the same
 * instance, so comparisons against a budget stay consistent even though absolute counts are
 * approximate.</p>
 */
public final class TokenEstimator {

    private static final TokenEstimator DEFAULT = new TokenEstimator(ChunkOptions.DEFAULT_CHARS_PER_TOKEN);

    private final int charsPerToken;

    public TokenEstimator(int charsPerToken) {
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be > 0");
        }
        this.charsPerToken = charsPerToken;
    }

    public static TokenEstimator defaults() {
        return DEFAULT;
    }

    public int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return length(text) / charsPerToken;
    }

    /**
     * Rounds up; used for overhead that must never be under-counted.
     */
    public int estimateCeil(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (length(text) + charsPerToken - 1) / charsPerToken;
    }

    public int charsPerToken() {
        return charsPerToken;
    }

    /**
     * Length in the same unit the splitters window over.
     */
    static int length(String text) {
        return text.codePointCount(0, text.length());
    }
}
