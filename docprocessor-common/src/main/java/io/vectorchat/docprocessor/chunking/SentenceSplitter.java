package io.vectorchat.docprocessor.chunking;

import java.util.ArrayList;
import java.util.List;

/**
 * Heuristic sentence boundary detection.
 *
 * <p>A {@code .}, {@code !} or {@code ?} ends a sentence when it is followed by whitespace and
 * then an uppercase letter, or when it is the last character of the text. Abbreviations and
 * decimals ("e.g. this", "3.14") therefore stay inside their sentence.</p>
 */
public final class SentenceSplitter {

    private SentenceSplitter() {}

    public static List<String> split(String text) {
        List<String> sentences = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return sentences;
        }

        int[] codePoints = text.codePoints().toArray();
        StringBuilder current = new StringBuilder();

        for (int i = 0; i < codePoints.length; i++) {
            int c = codePoints[i];
            current.appendCodePoint(c);

            if (c != '.' && c != '!' && c != '?') {
                continue;
            }

            boolean last = i == codePoints.length - 1;
            boolean boundary = last
                    || (i + 2 < codePoints.length
                    && Character.isWhitespace(codePoints[i + 1])
                    && Character.isUpperCase(codePoints[i + 2]));

            if (boundary) {
                addIfNotBlank(sentences, current);
                current.setLength(0);
            }
        }

        addIfNotBlank(sentences, current);
        return sentences;
    }

    private static void addIfNotBlank(List<String> sentences, StringBuilder current) {
        String sentence = current.toString().strip();
        if (!sentence.isEmpty()) {
            sentences.add(sentence);
        }
    }
}
