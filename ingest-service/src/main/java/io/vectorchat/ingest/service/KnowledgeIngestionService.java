package io.vectorchat.ingest.service;

import io.vectorchat.docprocessor.exception.DocumentValidationException;
import io.vectorchat.docprocessor.model.FileMetadata;
import io.vectorchat.docprocessor.model.ProcessedFile;
import io.vectorchat.docprocessor.processor.DocumentProcessor;
import io.vectorchat.docprocessor.storage.FileStorageService;
import io.vectorchat.ingest.model.ChunkRecord;
import io.vectorchat.ingest.model.IngestionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns uploads and text submissions into chunk records addressed by {@code doc_id}.
 *
 * <p>{@code doc_id} is {@code namespace-basename}; each chunk record id is {@code doc_id-chunkIndex}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeIngestionService {

    private final DocumentProcessor documentProcessor;
    private final FileStorageService fileStorageService;

    public IngestionResult ingestFile(String namespace, MultipartFile file) {
        requireNamespace(namespace);

        ProcessedFile processed = documentProcessor.processFile(file);
        Path stored = fileStorageService.save(file, namespace);
        try {
            return toResult(namespace, processed, stored);
        } catch (RuntimeException e) {
            fileStorageService.delete(stored);
            throw e;
        }
    }

    public IngestionResult ingestText(String namespace, String text) {
        requireNamespace(namespace);
        return toResult(namespace, documentProcessor.processText(text), null);
    }

    private IngestionResult toResult(String namespace, ProcessedFile processed, Path stored) {
        String docId = namespace + "-" + processed.filename();

        List<String> wrapped = documentProcessor.wrapMarkdownWithMetadata(
                processed.markdown(), docId, processed.filename(), processed.id(), processed.processedAt());
        if (wrapped.isEmpty()) {
            throw new DocumentValidationException("file did not produce any indexable content: " + processed.filename());
        }

        List<ChunkRecord> records = new ArrayList<>(wrapped.size());
        for (int i = 0; i < wrapped.size(); i++) {
            records.add(ChunkRecord.of(docId, processed.id(), i, wrapped.get(i)));
        }

        log.info("Ingested {} into namespace {}: {} chunks", processed.filename(), namespace, records.size());
        return new IngestionResult(docId, FileMetadata.from(processed), stored, records);
    }

    private static void requireNamespace(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new DocumentValidationException("namespace is required");
        }
        if (namespace.contains("\n") || namespace.contains("\r")) {
            throw new DocumentValidationException("namespace must be a single line");
        }
    }
}
