package io.vectorchat.docprocessor.chunking;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MarkdownStructuralChunker")
class MarkdownStructuralChunkerTest {

    // 100 chars hard limit, 40 chars soft limit
    private final MarkdownStructuralChunker chunker =
            new MarkdownStructuralChunker(new ChunkOptions(25, 10, 4, 0.10));

    @Test
    @DisplayName("Blank markdown yields no chunks")
    void blankMarkdown() {
        assertThat(chunker.chunk("")).isEmpty();
        assertThat(chunker.chunk("   \n\n  \n")).isEmpty();
        assertThat(chunker.chunk(null)).isEmpty();
    }

    @Test
    @DisplayName("Text before any heading is labelled with the default section")
    void defaultSection() {
        List<StructuralChunk> chunks = chunker.chunk("just some text");

        assertThat(chunks).containsExactly(new StructuralChunk("Document", "just some text"));
    }

    @Nested
    @DisplayName("Headings")
    class Headings {

        @Test
        @DisplayName("Each heading starts a new chunk and labels it")
        void headingsSplit() {
            List<StructuralChunk> chunks = chunker.chunk("# Intro\nhello\n## Details\nworld");

            assertThat(chunks).containsExactly(
                    new StructuralChunk("Intro", "# Intro\nhello"),
                    new StructuralChunk("Details", "## Details\nworld"));
        }

        @Test
        @DisplayName("Hashtags without a space are not headings")
        void hashtagIsNotHeading() {
            List<StructuralChunk> chunks = chunker.chunk("# Title\n#hashtag line");

            assertThat(chunks).hasSize(1);
            assertThat(chunks.get(0).section()).isEqualTo("Title");
        }

        @Test
        @DisplayName("Large sections under two headings keep their own labels")
        void largeSectionsKeepLabels() {
            MarkdownStructuralChunker defaults = new MarkdownStructuralChunker(ChunkOptions.defaults());
            String markdown = "# A\n" + "x".repeat(5000) + "\n## B\n" + "y".repeat(5000);

            List<StructuralChunk> chunks = defaults.chunk(markdown);

            assertThat(chunks).extracting(StructuralChunk::section).containsExactly("A", "B");
            assertThat(chunks.get(0).text()).startsWith("# A\nxxx").doesNotContain("y");
            assertThat(chunks.get(1).text()).startsWith("## B\nyyy").doesNotContain("x");
        }
    }

    @Nested
    @DisplayName("Fenced code")
    class Fences {

        @Test
        @DisplayName("A heading inside a fence does not split")
        void headingInsideFence() {
            List<StructuralChunk> chunks = chunker.chunk("```\n# not a heading\n```");

            assertThat(chunks).containsExactly(new StructuralChunk("Document", "```\n# not a heading\n```"));
        }

        @Test
        @DisplayName("A fence larger than the hard limit stays in one chunk")
        void largeFenceNotSplit() {
            StringBuilder fence = new StringBuilder("```java\n");
            for (int i = 0; i < 30; i++) {
                fence.append("int x").append(i).append(" = 0;\n\n");
            }
            fence.append("```");

            List<StructuralChunk> chunks = chunker.chunk(fence.toString());

            assertThat(chunks).hasSize(1);
            assertThat(chunks.get(0).text()).startsWith("```java").endsWith("```");
            assertThat(chunks.get(0).text()).contains("int x0", "int x29");
        }

        @Test
        @DisplayName("A fence between the soft and hard limits survives a hard split of the text around it")
        void midSizedFenceKeptWhole() {
            ChunkOptions defaults = ChunkOptions.defaults();
            StringBuilder body = new StringBuilder("```text\n");
            for (int i = 0; i < 100; i++) {
                body.append(String.format("row-%03d ", i)).append("x".repeat(30)).append("\n\n");
            }
            String fence = body.append("```").toString();
            assertThat(fence.length()).isBetween(defaults.minChars(), defaults.maxChars());

            String markdown = "p".repeat(3000) + "\n\n" + fence + "\n\nafter the block";
            List<StructuralChunk> chunks = new MarkdownStructuralChunker(defaults).chunk(markdown);

            assertThat(chunks).extracting(StructuralChunk::text)
                    .containsExactly("p".repeat(3000), fence, "after the block");
        }

        @Test
        @DisplayName("A fence only closes on its own marker")
        void tildeFence() {
            List<StructuralChunk> chunks = chunker.chunk("~~~\n```\n# inside\n~~~\n# Real");

            assertThat(chunks).containsExactly(
                    new StructuralChunk("Document", "~~~\n```\n# inside\n~~~"),
                    new StructuralChunk("Real", "# Real"));
        }
    }

    @Nested
    @DisplayName("Size limits")
    class Limits {

        @Test
        @DisplayName("Soft limit flushes at the next blank line")
        void softLimit() {
            List<StructuralChunk> chunks = chunker.chunk("a".repeat(45) + "\n\n" + "b".repeat(10));

            assertThat(chunks).extracting(StructuralChunk::text)
                    .containsExactly("a".repeat(45), "b".repeat(10));
        }

        @Test
        @DisplayName("Hard limit splits at the last blank line and keeps the remainder")
        void hardLimitAtBlank() {
            String markdown = String.join("\n",
                    "a".repeat(30), "", "b".repeat(30), "c".repeat(30), "d".repeat(30), "e".repeat(30));

            List<StructuralChunk> chunks = chunker.chunk(markdown);

            assertThat(chunks).extracting(StructuralChunk::text).containsExactly(
                    "a".repeat(30),
                    String.join("\n", "b".repeat(30), "c".repeat(30), "d".repeat(30), "e".repeat(30)));
        }

        @Test
        @DisplayName("Hard split remainder keeps the section it started in")
        void hardSplitKeepsSection() {
            String markdown = "# Long\n" + "a".repeat(30) + "\n\n" + String.join("\n",
                    "b".repeat(30), "c".repeat(30), "d".repeat(30));

            List<StructuralChunk> chunks = chunker.chunk(markdown);

            assertThat(chunks).hasSizeGreaterThan(1);
            assertThat(chunks).extracting(StructuralChunk::section).containsOnly("Long");
        }
    }

    @Nested
    @DisplayName("Tables")
    class Tables {

        @Test
        @DisplayName("A table larger than the hard limit stays in one chunk")
        void tableNotSplit() {
            StringBuilder markdown = new StringBuilder("# T\n| col a | col b |\n|---|---|\n");
            for (int i = 0; i < 10; i++) {
                markdown.append("| aaaaaaaaaa | bbbbbbbbbb |\n");
            }
            markdown.append("\nafter");

            List<StructuralChunk> chunks = chunker.chunk(markdown.toString());

            assertThat(chunks).hasSize(2);
            assertThat(chunks.get(0).text()).startsWith("# T\n| col a |").endsWith("| aaaaaaaaaa | bbbbbbbbbb |");
            assertThat(chunks.get(1)).isEqualTo(new StructuralChunk("T", "after"));
        }

        @Test
        @DisplayName("Two or more pipes mark a table row")
        void tableRowHeuristic() {
            assertThat(MarkdownStructuralChunker.looksLikeTableRow("| a | b |")).isTrue();
            assertThat(MarkdownStructuralChunker.looksLikeTableRow("a | b | c")).isTrue();
            assertThat(MarkdownStructuralChunker.looksLikeTableRow("a | b")).isFalse();
        }
    }
}
