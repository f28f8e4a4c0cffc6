package io.vectorchat.docprocessor.chunking;

/**
 * Embedding input limit every wrapped chunk (front-matter included) must respect.
 *
 * @param maxEmbeddingTokens  tokens accepted by the embedding model for a single input
 * @param metadataTokenBuffer headroom kept free below that limit
 */
public record TokenBudget(int maxEmbeddingTokens, int metadataTokenBuffer) {

    public TokenBudget {
        if (maxEmbeddingTokens <= 0) {
            throw new IllegalArgumentException("maxEmbeddingTokens must be > 0");
        }
        if (metadataTokenBuffer < 0 || metadataTokenBuffer >= maxEmbeddingTokens) {
            throw new IllegalArgumentException("metadataTokenBuffer must be in [0, maxEmbeddingTokens)");
        }
    }

    public static TokenBudget defaults() {
        return new TokenBudget(7000, 200);
    }

    /**
     * Largest estimated token count a wrapped chunk may have.
     */
    public int safeTokens() {
        return maxEmbeddingTokens - metadataTokenBuffer;
    }
}
