package io.vectorchat.docprocessor.storage;

import io.vectorchat.docprocessor.exception.DocumentProcessingException;
import io.vectorchat.docprocessor.exception.DocumentValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("FileStorageService")
class FileStorageServiceTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Writes the upload under prefix-basename, creating the directory")
    void savesUpload() throws IOException {
        Path uploadDir = tempDir.resolve("uploads");
        FileStorageService storage = new FileStorageService(uploadDir);
        MockMultipartFile file = new MockMultipartFile("file", "nested/notes.md", "text/markdown",
                "# Notes".getBytes(StandardCharsets.UTF_8));

        Path stored = storage.save(file, "kb-7");

        assertThat(stored.getFileName().toString()).isEqualTo("kb-7-notes.md");
        assertThat(stored.getParent()).isEqualTo(uploadDir.toAbsolutePath().normalize());
        assertThat(Files.readString(stored)).isEqualTo("# Notes");
    }

    @Test
    @DisplayName("Rejects unsafe names")
    void rejectsUnsafeName() {
        FileStorageService storage = new FileStorageService(tempDir);
        MockMultipartFile file = new MockMultipartFile("file", "..", "text/plain", new byte[]{1});

        assertThatThrownBy(() -> storage.save(file, "kb"))
                .isInstanceOf(DocumentValidationException.class);
    }

    @Test
    @DisplayName("Removes the partial file when the copy fails")
    void removesPartialFile() throws IOException {
        FileStorageService storage = new FileStorageService(tempDir);
        MultipartFile file = mock(MultipartFile.class);
        when(file.getOriginalFilename()).thenReturn("broken.pdf");
        when(file.getInputStream()).thenReturn(new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("stream reset");
            }
        });

        assertThatThrownBy(() -> storage.save(file, "kb"))
                .isInstanceOf(DocumentProcessingException.class)
                .hasMessageContaining("kb-broken.pdf")
                .hasRootCauseMessage("stream reset");
        assertThat(tempDir.resolve("kb-broken.pdf")).doesNotExist();
    }

    @Test
    @DisplayName("Deletes stored files and ignores missing ones")
    void deletes() throws IOException {
        FileStorageService storage = new FileStorageService(tempDir);
        Path stored = Files.writeString(tempDir.resolve("kb-a.txt"), "a");

        storage.delete(stored);

        assertThat(stored).doesNotExist();
        assertThatCode(() -> storage.delete(stored)).doesNotThrowAnyException();
    }
}
