package io.vectorchat.docprocessor.chunking;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;

/**
 * Reduces a block until every piece fits the embedding budget once its front-matter is added.
 *
 * <p>Oversized pieces are first cut into overlapping windows sized to the room left by the
 * front-matter; when that yields a single window (nothing to cut on) they are hard-split into
 * adjacent windows instead. Resulting pieces go back to the front of a work queue, so order is
 * preserved and recursion depth stays constant however often a piece is re-split.</p>
 */
@Slf4j
public class OverflowSplitter {

    private final TextChunker textChunker;
    private final TokenEstimator estimator;
    private final ChunkOptions options;
    private final TokenBudget budget;

    public OverflowSplitter(TextChunker textChunker, ChunkOptions options, TokenBudget budget) {
        this.textChunker = textChunker;
        this.estimator = new TokenEstimator(options.charsPerToken());
        this.options = options;
        this.budget = budget;
    }

    /**
     * Splits {@code text} into ordered pieces that each satisfy
     * {@code estimate(piece) + overheadTokens <= budget.safeTokens()}. Whitespace-only pieces are
     * dropped.
     *
     * @param text           block to split
     * @param overheadTokens front-matter tokens that will be prepended to every piece
     * @return pieces in document order; a block that already fits is returned as-is
     */
    public List<String> split(String text, int overheadTokens) {
        List<String> pieces = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return pieces;
        }

        int windowChars = windowChars(overheadTokens);
        Deque<String> queue = new ArrayDeque<>();
        queue.add(text);

        while (!queue.isEmpty()) {
            String piece = queue.pollFirst();
            if (piece.isBlank()) {
                continue;
            }
            if (fits(piece, overheadTokens)) {
                pieces.add(piece);
                continue;
            }

            List<String> parts = splitOnce(piece, windowChars);
            if (parts.size() == 1 && parts.get(0).equals(piece)) {
                throw new IllegalStateException(
                        "Overflow split made no progress on a piece of " + TokenEstimator.length(piece) + " chars");
            }
            pushFront(queue, parts);
        }

        return pieces;
    }

    public boolean fits(String text, int overheadTokens) {
        return estimator.estimate(text) + overheadTokens <= budget.safeTokens();
    }

    /**
     * Window size in code points that keeps a piece plus its front-matter inside the budget.
     */
    int windowChars(int overheadTokens) {
        int availableTokens = budget.safeTokens() - overheadTokens;
        if (availableTokens <= 0) {
            throw new IllegalStateException(String.format(
                    "Front-matter of %d tokens leaves no room in an embedding budget of %d tokens",
                    overheadTokens, budget.safeTokens()));
        }
        return availableTokens * options.charsPerToken();
    }

    List<String> splitOnce(String text, int windowChars) {
        int overlap = (int) Math.round(windowChars * options.overlapPercent());
        if (overlap >= windowChars) {
            overlap = windowChars / 4;
        }

        List<String> windows = textChunker.chunkTextWithOverlap(text, windowChars, overlap);
        if (windows.size() > 1) {
            return windows;
        }

        log.warn("Overlap split could not reduce a {} char piece; hard splitting at {} chars",
                TokenEstimator.length(text), windowChars);
        return hardSplit(text, windowChars);
    }

    private List<String> hardSplit(String text, int windowChars) {
        return textChunker.chunkText(text, windowChars);
    }

    private static void pushFront(Deque<String> queue, List<String> parts) {
        ListIterator<String> it = parts.listIterator(parts.size());
        while (it.hasPrevious()) {
            queue.addFirst(it.previous());
        }
    }
}
