package io.vectorchat.docprocessor.chunking;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits markdown into section-tagged blocks with a single forward scan over its lines.
 *
 * <p>Rules, in order of precedence:
 * <ol>
 *   <li>A heading outside a fenced code block closes the current block; the heading starts the
 *       next one and becomes its section label.</li>
 *   <li>Fenced code blocks and table regions (lines with two or more {@code |} outside a fence,
 *       ended by a blank line) are never split, whatever their size.</li>
 *   <li>Hard limit: once the buffer reaches {@link ChunkOptions#maxChars()} it is split at the
 *       last blank line it contains (or at the current line when there is none). The remainder
 *       keeps accumulating under the same section.</li>
 *   <li>Soft limit: once the buffer reaches {@link ChunkOptions#minChars()}, the next blank line
 *       flushes it.</li>
 * </ol>
 *
 * <p>Blocks are trimmed; whitespace-only blocks are dropped. Blocks larger than the embedding
 * budget (long fences, tables, single huge lines) are left for {@link OverflowSplitter}.</p>
 *
 * <p>Stateless; all scan state lives in a per-call {@link Scan}.</p>
 */
@Slf4j
public class MarkdownStructuralChunker {

    public static final String DEFAULT_SECTION = "Document";

    private static final Pattern HEADING = Pattern.compile("^#{1,6}(?:\\s.*)?$");

    private static final String[] FENCE_MARKERS = {"```", "~~~"};

    private final ChunkOptions options;

    public MarkdownStructuralChunker(ChunkOptions options) {
        this.options = options;
    }

    public List<StructuralChunk> chunk(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return List.of();
        }

        Scan scan = new Scan(options.maxChars(), options.minChars());
        for (String line : markdown.split("\n", -1)) {
            scan.accept(line);
        }
        scan.flush();

        log.debug("Structural chunking produced {} blocks from {} chars", scan.chunks.size(), markdown.length());
        return scan.chunks;
    }

    static boolean isHeading(String trimmed) {
        return HEADING.matcher(trimmed).matches();
    }

    static String headingText(String trimmed) {
        int level = 0;
        while (level < trimmed.length() && trimmed.charAt(level) == '#') {
            level++;
        }
        return trimmed.substring(level).strip();
    }

    static boolean looksLikeTableRow(String line) {
        int pipes = 0;
        for (int i = 0; i < line.length() && pipes < 2; i++) {
            if (line.charAt(i) == '|') {
                pipes++;
            }
        }
        return pipes >= 2;
    }

    private static String fenceMarker(String trimmed) {
        for (String marker : FENCE_MARKERS) {
            if (trimmed.startsWith(marker)) {
                return marker;
            }
        }
        return null;
    }

    /**
     * A buffered line; {@code boundary} marks a blank line outside any fence or table where the
     * buffer may be cut.
     */
    private record BufferedLine(String text, boolean boundary) {
    }

    /**
     * Mutable state of one scan.
     */
    private static final class Scan {

        private final int maxChars;
        private final int minChars;
        private final List<StructuralChunk> chunks = new ArrayList<>();

        private List<BufferedLine> lines = new ArrayList<>();
        private int length;
        private int lastBlankIndex = -1;
        private String bufferSection;
        private String activeSection;
        private String openFence;
        private boolean inTable;

        Scan(int maxChars, int minChars) {
            this.maxChars = maxChars;
            this.minChars = minChars;
        }

        void accept(String line) {
            String trimmed = line.strip();

            String marker = fenceMarker(trimmed);
            if (marker != null) {
                if (openFence == null) {
                    openFence = marker;
                } else if (openFence.equals(marker)) {
                    openFence = null;
                }
            }
            boolean inFence = openFence != null;

            if (!inFence && marker == null && isHeading(trimmed)) {
                activeSection = headingText(trimmed);
                inTable = false;
                if (!lines.isEmpty()) {
                    flush();
                }
                append(new BufferedLine(line, false));
                return;
            }

            if (!inFence) {
                if (!trimmed.isEmpty() && looksLikeTableRow(line)) {
                    inTable = true;
                } else if (trimmed.isEmpty()) {
                    inTable = false;
                }
            }

            append(new BufferedLine(line, trimmed.isEmpty() && !inFence && !inTable));

            if (inFence || inTable) {
                return;
            }

            if (length >= maxChars) {
                splitAtLastBlank();
                return;
            }

            if (length >= minChars && trimmed.isEmpty()) {
                flush();
            }
        }

        private void append(BufferedLine line) {
            if (lines.isEmpty()) {
                bufferSection = activeSection;
            }
            lines.add(line);
            length += line.text().length() + 1;
            if (line.boundary()) {
                lastBlankIndex = lines.size() - 1;
            }
        }

        private void splitAtLastBlank() {
            int splitIndex = lastBlankIndex >= 0 ? lastBlankIndex + 1 : lines.size();
            List<BufferedLine> remainder = new ArrayList<>(lines.subList(splitIndex, lines.size()));
            String section = bufferSection;

            lines = new ArrayList<>(lines.subList(0, splitIndex));
            flush();

            for (BufferedLine line : remainder) {
                append(line);
            }
            if (!lines.isEmpty()) {
                bufferSection = section;
            }
        }

        void flush() {
            String text = lines.stream()
                    .map(BufferedLine::text)
                    .collect(Collectors.joining("\n"))
                    .strip();
            if (!text.isEmpty()) {
                String section = bufferSection;
                if (section == null || section.isEmpty()) {
                    section = DEFAULT_SECTION;
                }
                chunks.add(new StructuralChunk(section, text));
            }
            lines = new ArrayList<>();
            length = 0;
            lastBlankIndex = -1;
            bufferSection = null;
        }
    }
}
