package io.vectorchat.docprocessor.processor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MarkdownText")
class MarkdownTextTest {

    @Test
    @DisplayName("Title is the first level-one heading")
    void extractsTitle() {
        String markdown = "Preamble\n## Not this\n  #  Annual Report 2024 \n# Later";

        assertThat(MarkdownText.extractTitle(markdown)).isEqualTo("Annual Report 2024");
    }

    @Test
    @DisplayName("No level-one heading means no title")
    void noTitle() {
        assertThat(MarkdownText.extractTitle("## Section\n#hashtag\nbody")).isEmpty();
        assertThat(MarkdownText.extractTitle(null)).isEmpty();
    }

    @Test
    @DisplayName("Counts whitespace-separated words")
    void countsWords() {
        assertThat(MarkdownText.countWords("  one two\n\tthree  ")).isEqualTo(3);
        assertThat(MarkdownText.countWords(" \n ")).isZero();
        assertThat(MarkdownText.countWords(null)).isZero();
    }
}
