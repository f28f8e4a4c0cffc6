package io.vectorchat.docprocessor.processor;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Lazily loaded set of file extensions the conversion service accepts.
 *
 * <p>The first caller to find the cache empty takes the write lock, re-checks, and loads the set;
 * concurrent callers wait for that load instead of issuing their own. Later callers only take the
 * read lock. An empty result is not cached, so the next call tries again. The snapshot lives as
 * long as its owner unless {@link #invalidate()} or {@link #refresh()} is called.</p>
 */
@Slf4j
public class SupportedExtensionCache {

    private final Supplier<List<String>> loader;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private Set<String> extensions = Set.of();

    public SupportedExtensionCache(Supplier<List<String>> loader) {
        this.loader = loader;
    }

    /**
     * Returns the cached extensions, loading them on first use.
     */
    public Set<String> get() {
        lock.readLock().lock();
        try {
            if (!extensions.isEmpty()) {
                return extensions;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            if (extensions.isEmpty()) {
                extensions = load();
            }
            return extensions;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isSupported(String extension) {
        return get().contains(FileNames.normalizeExtension(extension));
    }

    /**
     * Drops the snapshot; the next {@link #get()} loads again.
     */
    public void invalidate() {
        lock.writeLock().lock();
        try {
            extensions = Set.of();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Loads a fresh snapshot unconditionally. On failure the previous snapshot is kept.
     */
    public Set<String> refresh() {
        lock.writeLock().lock();
        try {
            extensions = load();
            return extensions;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Set<String> load() {
        List<String> fetched = loader.get();
        Set<String> normalized = new LinkedHashSet<>();
        if (fetched != null) {
            for (String ext : fetched) {
                String value = FileNames.normalizeExtension(ext);
                if (!value.isEmpty()) {
                    normalized.add(value);
                }
            }
        }

        if (normalized.isEmpty()) {
            log.warn("Conversion service reported no supported extensions");
        } else {
            log.info("Loaded {} supported extensions", normalized.size());
        }
        return Set.copyOf(normalized);
    }
}
