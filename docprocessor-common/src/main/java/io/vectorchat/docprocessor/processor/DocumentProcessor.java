package io.vectorchat.docprocessor.processor;

import io.vectorchat.docprocessor.chunking.MarkdownChunkingService;
import io.vectorchat.docprocessor.chunking.TextChunker;
import io.vectorchat.docprocessor.client.MarkitdownClient;
import io.vectorchat.docprocessor.exception.ConversionServiceException;
import io.vectorchat.docprocessor.exception.DocumentProcessingException;
import io.vectorchat.docprocessor.exception.DocumentValidationException;
import io.vectorchat.docprocessor.model.ProcessedFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Turns uploads and free text into {@link ProcessedFile}s.
 *
 * <p>Uploads are validated (size, name, extension), read once while being hashed, converted to
 * markdown by the {@link MarkitdownClient}, and chunked structurally. Free text skips conversion and
 * is cut into fixed windows.</p>
 *
 * <p>Each processor owns its own {@link SupportedExtensionCache}; instances do not share state.</p>
 */
@Slf4j
public class DocumentProcessor {

    public static final long MAX_FILE_BYTES = 10L * 1024 * 1024;
    public static final int MAX_TEXT_BYTES = 200_000;
    public static final int TEXT_CHUNK_SIZE = TextChunker.DEFAULT_CHUNK_SIZE;

    private static final DateTimeFormatter TEXT_FILENAME_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final MarkitdownClient markitdownClient;
    private final MarkdownChunkingService chunkingService;
    private final SupportedExtensionCache extensionCache;
    private final int textChunkSize;
    private final Clock clock;

    public DocumentProcessor(MarkitdownClient markitdownClient, MarkdownChunkingService chunkingService) {
        this(markitdownClient, chunkingService, TEXT_CHUNK_SIZE, Clock.systemUTC());
    }

    public DocumentProcessor(MarkitdownClient markitdownClient, MarkdownChunkingService chunkingService,
                             int textChunkSize, Clock clock) {
        if (markitdownClient == null) {
            throw new IllegalArgumentException("markitdown client is not configured");
        }
        this.markitdownClient = markitdownClient;
        this.chunkingService = chunkingService;
        this.extensionCache = new SupportedExtensionCache(markitdownClient::supportedExtensions);
        this.textChunkSize = textChunkSize;
        this.clock = clock;
    }

    /**
     * Converts an uploaded file to markdown and chunks it.
     *
     * @throws DocumentValidationException for oversized, unnamed, extensionless or unsupported files
     *                                     and for files without indexable content
     * @throws DocumentProcessingException when reading the upload or calling the conversion service fails
     */
    public ProcessedFile processFile(MultipartFile file) {
        if (file == null) {
            throw new DocumentValidationException("file is required");
        }
        if (file.getSize() > MAX_FILE_BYTES) {
            throw new DocumentValidationException(String.format(
                    "file exceeds maximum size (10MB): %s (%d bytes)", file.getOriginalFilename(), file.getSize()));
        }

        String filename = FileNames.baseName(file.getOriginalFilename());
        if (filename.isEmpty()) {
            throw new DocumentValidationException("file name is required");
        }

        String extension = FileNames.extension(filename);
        if (extension.isEmpty()) {
            throw new DocumentValidationException("file extension is required: " + filename);
        }

        if (!isExtensionSupported(extension)) {
            throw new DocumentValidationException("unsupported file type: " + extension);
        }

        HashedContent content = readAndHash(file, filename);

        String markdown;
        try {
            markdown = markitdownClient.convert(filename, content.bytes()).strip();
        } catch (ConversionServiceException e) {
            throw new DocumentProcessingException(String.format(
                    "failed to convert file to markdown: %s (%d bytes)", filename, content.bytes().length), e);
        }
        if (markdown.isEmpty()) {
            throw new DocumentValidationException("converted markdown is empty: " + filename);
        }

        List<String> chunks = chunkingService.chunkMarkdown(markdown);
        if (chunks.isEmpty()) {
            throw new DocumentValidationException("file did not produce any indexable content: " + filename);
        }

        log.info("Processed file {} ({} bytes): {} chars of markdown, {} chunks",
                filename, file.getSize(), markdown.length(), chunks.size());

        return new ProcessedFile(
                UUID.randomUUID(),
                filename,
                file.getSize(),
                content.hash(),
                markdown,
                chunks,
                Instant.now(clock)
        );
    }

    /**
     * Chunks free text into fixed windows. The text is kept verbatim as the markdown.
     *
     * @throws DocumentValidationException for blank text or text over {@value #MAX_TEXT_BYTES} UTF-8 bytes
     */
    public ProcessedFile processText(String text) {
        if (text == null || text.isBlank()) {
            throw new DocumentValidationException("text is required");
        }
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_TEXT_BYTES) {
            throw new DocumentValidationException(String.format(
                    "text exceeds maximum allowed length (%d > %d bytes)", bytes.length, MAX_TEXT_BYTES));
        }

        List<String> chunks = chunkingService.chunkText(text, textChunkSize);
        if (chunks.isEmpty()) {
            throw new DocumentValidationException("text did not produce any chunks");
        }

        Instant now = Instant.now(clock);
        String filename = "text-" + TEXT_FILENAME_TIMESTAMP.format(now) + ".txt";

        log.info("Processed text submission {} ({} bytes): {} chunks", filename, bytes.length, chunks.size());

        return new ProcessedFile(
                UUID.randomUUID(),
                filename,
                bytes.length,
                HexFormat.of().formatHex(sha256().digest(bytes)),
                text,
                chunks,
                now
        );
    }

    /**
     * Extensions accepted by {@link #processFile(MultipartFile)}, sorted; loads them on first use.
     *
     * @throws DocumentProcessingException if the conversion service cannot be queried
     */
    public List<String> getSupportedExtensions() {
        return loadExtensions().stream().sorted().toList();
    }

    /**
     * Drops the cached extension set so the next upload re-fetches it.
     */
    public void invalidateSupportedExtensions() {
        extensionCache.invalidate();
    }

    /**
     * Chunks markdown and wraps each chunk with addressable front-matter for vector storage.
     */
    public List<String> wrapMarkdownWithMetadata(String markdown, String docId, String source,
                                                 UUID fileId, Instant createdAt) {
        return chunkingService.wrapMarkdownWithMetadata(markdown, docId, source, fileId, createdAt);
    }

    public MarkdownChunkingService chunkingService() {
        return chunkingService;
    }

    private boolean isExtensionSupported(String extension) {
        return loadExtensions().contains(FileNames.normalizeExtension(extension));
    }

    private Set<String> loadExtensions() {
        try {
            return extensionCache.get();
        } catch (ConversionServiceException e) {
            throw new DocumentProcessingException("failed to load supported file types", e);
        }
    }

    private HashedContent readAndHash(MultipartFile file, String filename) {
        MessageDigest digest = sha256();
        try (InputStream in = new DigestInputStream(file.getInputStream(), digest)) {
            byte[] bytes = in.readAllBytes();
            return new HashedContent(bytes, HexFormat.of().formatHex(digest.digest()));
        } catch (IOException e) {
            throw new DocumentProcessingException(String.format(
                    "failed to read uploaded file: %s (%d bytes)", filename, file.getSize()), e);
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private record HashedContent(byte[] bytes, String hash) {
    }
}
