package io.vectorchat.docprocessor.processor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SupportedExtensionCache")
class SupportedExtensionCacheTest {

    @Test
    @DisplayName("Normalizes reported extensions")
    void normalizes() {
        SupportedExtensionCache cache = new SupportedExtensionCache(() -> List.of("PDF", " .Docx ", "", ".md"));

        assertThat(cache.get()).containsExactlyInAnyOrder(".pdf", ".docx", ".md");
        assertThat(cache.isSupported(".PDF")).isTrue();
        assertThat(cache.isSupported("docx")).isTrue();
        assertThat(cache.isSupported(".exe")).isFalse();
    }

    @Test
    @DisplayName("Concurrent first use loads exactly once")
    void loadsOnceUnderContention() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        SupportedExtensionCache cache = new SupportedExtensionCache(() -> {
            calls.incrementAndGet();
            return List.of(".pdf");
        });

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Set<String>>> results = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return cache.get();
                }));
            }
            start.countDown();

            for (Future<Set<String>> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).containsExactly(".pdf");
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("An empty result is not cached")
    void emptyResultNotCached() {
        AtomicInteger calls = new AtomicInteger();
        SupportedExtensionCache cache = new SupportedExtensionCache(() ->
                calls.incrementAndGet() == 1 ? List.of() : List.of(".txt"));

        assertThat(cache.get()).isEmpty();
        assertThat(cache.get()).containsExactly(".txt");
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Invalidate forces a reload on next use")
    void invalidate() {
        AtomicInteger calls = new AtomicInteger();
        SupportedExtensionCache cache = new SupportedExtensionCache(() ->
                List.of(calls.incrementAndGet() == 1 ? ".pdf" : ".html"));

        assertThat(cache.get()).containsExactly(".pdf");
        cache.invalidate();
        assertThat(cache.get()).containsExactly(".html");
    }

    @Test
    @DisplayName("A failed refresh keeps the previous snapshot")
    void failedRefreshKeepsSnapshot() {
        AtomicInteger calls = new AtomicInteger();
        SupportedExtensionCache cache = new SupportedExtensionCache(() -> {
            if (calls.incrementAndGet() > 1) {
                throw new IllegalStateException("service down");
            }
            return List.of(".pdf");
        });

        assertThat(cache.get()).containsExactly(".pdf");
        assertThatThrownBy(cache::refresh).isInstanceOf(IllegalStateException.class);
        assertThat(cache.get()).containsExactly(".pdf");
    }
}
