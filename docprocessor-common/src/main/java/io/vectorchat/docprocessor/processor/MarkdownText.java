package io.vectorchat.docprocessor.processor;

/**
 * Small read-only helpers over converted markdown.
 */
public final class MarkdownText {

    private MarkdownText() {}

    /**
     * Text of the first level-one heading ({@code # Title}), or an empty string when there is none.
     */
    public static String extractTitle(String markdown) {
        if (markdown == null || markdown.isEmpty()) {
            return "";
        }
        for (String line : markdown.split("\n")) {
            String trimmed = line.strip();
            if (trimmed.startsWith("# ")) {
                return trimmed.substring(1).strip();
            }
        }
        return "";
    }

    /**
     * Number of whitespace-separated words.
     */
    public static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.strip().split("\\s+").length;
    }
}
