package io.vectorchat.ingest.config;

import io.vectorchat.docprocessor.chunking.ChunkOptions;
import io.vectorchat.docprocessor.chunking.MarkdownChunkingService;
import io.vectorchat.docprocessor.chunking.TokenBudget;
import io.vectorchat.docprocessor.client.MarkitdownClient;
import io.vectorchat.docprocessor.processor.DocumentProcessor;
import io.vectorchat.docprocessor.storage.FileStorageService;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the document processing library from {@code application.yml}.
 */
@Configuration
@EnableConfigurationProperties({
        AppConfig.MarkitdownProperties.class,
        AppConfig.ChunkingProperties.class,
        AppConfig.StorageProperties.class
})
public class AppConfig {

    // ----------------------------------------------------------------------
    // Conversion service
    // ----------------------------------------------------------------------

    @Bean
    public MarkitdownClient markitdownClient(MarkitdownProperties props) {
        return new MarkitdownClient(props.getUrl(), props.getTimeoutMs(), props.getConnectTimeoutMs());
    }

    // ----------------------------------------------------------------------
    // Chunking and processing
    // ----------------------------------------------------------------------

    @Bean
    public MarkdownChunkingService markdownChunkingService(ChunkingProperties props) {
        return new MarkdownChunkingService(props.toChunkOptions(), props.toTokenBudget());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Processor with its own supported-extension cache.
     */
    @Bean
    public DocumentProcessor documentProcessor(MarkitdownClient markitdownClient,
                                               MarkdownChunkingService chunkingService,
                                               ChunkingProperties props,
                                               Clock clock) {
        return new DocumentProcessor(markitdownClient, chunkingService, props.getTextChunkSize(), clock);
    }

    // ----------------------------------------------------------------------
    // Storage
    // ----------------------------------------------------------------------

    @Bean
    public FileStorageService fileStorageService(StorageProperties props) {
        return new FileStorageService(Path.of(props.getUploadDir()));
    }

    // ----------------------------------------------------------------------
    // Configuration properties
    // ----------------------------------------------------------------------

    /**
     * MarkItDown service endpoint and timeouts.
     *
     * <p>Bound from {@code markitdown.*} in {@code application.yml}.
     */
    @Data
    @ConfigurationProperties(prefix = "markitdown")
    public static class MarkitdownProperties {
        private String url = "http://localhost:8000";
        private long timeoutMs = 60000;
        private long connectTimeoutMs = 5000;
    }

    /**
     * Chunk sizing and embedding budget.
     *
     * <p>Bound from {@code chunking.*} in {@code application.yml}.
     */
    @Data
    @ConfigurationProperties(prefix = "chunking")
    public static class ChunkingProperties {
        private int maxTokens = 1200;
        private int minTokens = 800;
        private int charsPerToken = 4;
        private double overlapPercent = 0.10;
        private int maxEmbeddingTokens = 7000;
        private int metadataTokenBuffer = 200;
        private int textChunkSize = 1000;

        public ChunkOptions toChunkOptions() {
            return new ChunkOptions(maxTokens, minTokens, charsPerToken, overlapPercent);
        }

        public TokenBudget toTokenBudget() {
            return new TokenBudget(maxEmbeddingTokens, metadataTokenBuffer);
        }
    }

    /**
     * Bound from {@code storage.*} in {@code application.yml}.
     */
    @Data
    @ConfigurationProperties(prefix = "storage")
    public static class StorageProperties {
        private String uploadDir = "./uploads";
    }
}
