package io.vectorchat.docprocessor.storage;

import io.vectorchat.docprocessor.exception.DocumentProcessingException;
import io.vectorchat.docprocessor.processor.FileNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Keeps raw uploads on local disk under {@code {uploadDir}/{prefix}-{basename}}.
 */
@Slf4j
public class FileStorageService {

    private final Path uploadDir;

    public FileStorageService(Path uploadDir) {
        if (uploadDir == null) {
            throw new IllegalArgumentException("upload directory is required");
        }
        this.uploadDir = uploadDir.toAbsolutePath().normalize();
    }

    /**
     * Copies the upload to the upload directory, creating the directory when missing. A partially
     * written file is removed if the copy fails.
     *
     * @return absolute path of the stored file
     */
    public Path save(MultipartFile file, String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("storage prefix is required");
        }
        String basename = FileNames.baseName(file.getOriginalFilename());
        FileNames.validate(basename);

        Path target = uploadDir.resolve(FileNames.storedFilename(prefix, basename)).normalize();
        if (!target.startsWith(uploadDir)) {
            throw new DocumentProcessingException("resolved path escapes upload directory: " + target);
        }

        try {
            Files.createDirectories(uploadDir);
        } catch (IOException e) {
            throw new DocumentProcessingException("failed to create upload directory: " + uploadDir, e);
        }

        try (InputStream in = file.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            removePartial(target);
            throw new DocumentProcessingException("failed to save file: " + target.getFileName(), e);
        }

        log.debug("Stored {} ({} bytes) at {}", basename, file.getSize(), target);
        return target;
    }

    /**
     * Deletes a stored file. A file that is already gone is not an error.
     */
    public void delete(Path path) {
        try {
            if (!Files.deleteIfExists(path)) {
                log.debug("Nothing to delete at {}", path);
            }
        } catch (IOException e) {
            throw new DocumentProcessingException("failed to delete file: " + path, e);
        }
    }

    private static void removePartial(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException cleanup) {
            log.warn("Could not remove partially written file {}: {}", target, cleanup.getMessage());
        }
    }
}
