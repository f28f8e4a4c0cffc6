package io.vectorchat.docprocessor.processor;

import io.vectorchat.docprocessor.exception.DocumentValidationException;

import java.util.Locale;

/**
 * Filename helpers shared by the processor and the storage layer.
 */
public final class FileNames {

    private static final String INVALID_CHARS = "/\\:*?\"<>|";

    private FileNames() {}

    /**
     * Strips any directory part (either separator style). Returns an empty string for blank input.
     */
    public static String baseName(String filename) {
        if (filename == null) {
            return "";
        }
        String name = filename.strip();
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        return slash >= 0 ? name.substring(slash + 1) : name;
    }

    /**
     * Lower-cased extension including the leading dot ({@code ".pdf"}), or an empty string when the
     * name has none. A leading dot alone ({@code ".env"}) is not treated as an extension.
     */
    public static String extension(String filename) {
        String name = baseName(filename);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * Normalizes an extension reported by the conversion service: trimmed, lower-cased, dotted.
     */
    public static String normalizeExtension(String ext) {
        if (ext == null || ext.isBlank()) {
            return "";
        }
        String normalized = ext.strip().toLowerCase(Locale.ROOT);
        return normalized.startsWith(".") ? normalized : "." + normalized;
    }

    /**
     * Rejects names that are blank, contain path traversal, or contain characters that are unsafe in
     * stored filenames.
     */
    public static void validate(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new DocumentValidationException("filename cannot be empty");
        }
        if (filename.contains("..")) {
            throw new DocumentValidationException("filename cannot contain path traversal sequences");
        }
        for (char c : INVALID_CHARS.toCharArray()) {
            if (filename.indexOf(c) >= 0) {
                throw new DocumentValidationException("filename contains invalid character: " + c);
            }
        }
    }

    public static String storedFilename(String prefix, String originalFilename) {
        return prefix + "-" + baseName(originalFilename);
    }

    public static String parseStoredFilename(String storedFilename, String prefix) {
        String marker = prefix + "-";
        return storedFilename.startsWith(marker) ? storedFilename.substring(marker.length()) : storedFilename;
    }

    /**
     * {@code text} for synthesized text submissions, {@code website} for crawled pages, {@code file}
     * otherwise.
     */
    public static String fileType(String filename) {
        if (filename.startsWith("text-") && filename.endsWith(".txt")) {
            return "text";
        }
        if (filename.startsWith("website-")) {
            return "website";
        }
        return "file";
    }
}
