package org.metalineage.pipeline.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.metalineage.pipeline.api.errors.ExternalToolException;
import org.metalineage.pipeline.api.errors.InputException;
import org.metalineage.pipeline.api.tools.IAligner;
import org.metalineage.pipeline.api.tools.IReferenceDownloader;
import org.metalineage.pipeline.api.tools.IReferenceDownloader.DownloadedReference;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class ReferenceCacheManagerTest {

    @TempDir
    Path cacheRoot;

    @Mock
    IReferenceDownloader downloader;

    @Mock
    IAligner aligner;

    private ReferenceCacheManager manager;
    private final AtomicInteger downloads = new AtomicInteger();

    @BeforeEach
    void setUp() {
        manager = new ReferenceCacheManager(cacheRoot, downloader, aligner);
    }

    private Answer<DownloadedReference> writesReference() {
        return invocation -> {
            List<String> ids = invocation.getArgument(0);
            Path target = invocation.getArgument(1);
            int generation = downloads.incrementAndGet();
            Path fasta = target.resolve(ReferenceCacheManager.FASTA_NAME);
            Path taxonomy = target.resolve(ReferenceCacheManager.TAXONOMY_NAME);
            StringBuilder sequences = new StringBuilder();
            for (String id : ids) {
                sequences.append('>').append(id).append(" generation ").append(generation).append("\nACGT\n");
            }
            Files.writeString(fasta, sequences.toString());
            Files.writeString(taxonomy, "GCF\tTaxID\tIdentifiers\n");
            return new DownloadedReference(fasta, taxonomy);
        };
    }

    private List<Path> strayDirectories() throws IOException {
        try (Stream<Path> files = Files.list(cacheRoot)) {
            return files.filter(p -> p.getFileName().toString().startsWith(".")).toList();
        }
    }

    @Nested
    @DisplayName("Resolve")
    class Resolve {

        @Test
        @DisplayName("Second resolve of a permuted list is a cache hit")
        void hitDoesNotDownloadAgain() {
            when(downloader.fetch(anyList(), any(Path.class))).thenAnswer(writesReference());

            CacheEntry first = manager.resolve(List.of("GCF_2.1", "GCF_1.1"), false);
            CacheEntry second = manager.resolve(List.of("GCF_1.1", "GCF_2.1", "GCF_1.1"), false);

            assertThat(second).isEqualTo(first);
            assertThat(first.status()).isEqualTo(CacheStatus.READY);
            assertThat(first.fastaPath()).isRegularFile();
            assertThat(first.taxonomyMapPath()).isRegularFile();
            assertThat(first.directory().resolve(CacheManifest.FILE_NAME)).isRegularFile();
            verify(downloader, times(1)).fetch(eq(List.of("GCF_1.1", "GCF_2.1")), any(Path.class));
        }

        @Test
        void findReturnsOnlyReadyEntries() {
            when(downloader.fetch(anyList(), any(Path.class))).thenAnswer(writesReference());

            assertThat(manager.find(List.of("A"))).isEmpty();
            CacheEntry entry = manager.resolve(List.of("A"), false);
            assertThat(manager.find(List.of("A"))).contains(entry);
        }

        @Test
        void forceRefreshRebuildsInPlace() throws IOException {
            when(downloader.fetch(anyList(), any(Path.class))).thenAnswer(writesReference());

            CacheEntry first = manager.resolve(List.of("A", "B"), false);
            CacheEntry refreshed = manager.resolve(List.of("A", "B"), true);

            assertThat(refreshed.directory()).isEqualTo(first.directory());
            assertThat(Files.readString(refreshed.fastaPath())).contains("generation 2");
            assertThat(strayDirectories()).isEmpty();
            verify(downloader, times(2)).fetch(anyList(), any(Path.class));
        }

        @Test
        @DisplayName("Failed download leaves no entry and no temporary directory")
        void failedDownloadLeavesNothingBehind() throws IOException {
            when(downloader.fetch(anyList(), any(Path.class)))
                    .thenThrow(new ExternalToolException("download failed", List.of("fetch"), 1));

            assertThatThrownBy(() -> manager.resolve(List.of("A"), false))
                    .isInstanceOf(ExternalToolException.class);

            assertThat(manager.find(List.of("A"))).isEmpty();
            assertThat(strayDirectories()).isEmpty();
        }

        @Test
        void directoryWithoutManifestIsRebuilt() throws IOException {
            when(downloader.fetch(anyList(), any(Path.class))).thenAnswer(writesReference());
            String key = CacheKeys.stableHash(List.of("A"));
            Files.createDirectories(cacheRoot.resolve(key));
            Files.writeString(cacheRoot.resolve(key).resolve(ReferenceCacheManager.FASTA_NAME), ">partial\n");

            assertThat(manager.find(List.of("A"))).isEmpty();
            CacheEntry entry = manager.resolve(List.of("A"), false);

            assertThat(Files.readString(entry.fastaPath())).contains("generation 1");
        }

        @Test
        void emptyCandidateListIsRejected() {
            assertThatThrownBy(() -> manager.resolve(List.of(), false)).isInstanceOf(InputException.class);
            verify(downloader, never()).fetch(anyList(), any(Path.class));
        }
    }

    @Test
    @DisplayName("Concurrent resolves of one key download exactly once")
    void concurrentResolvesDownloadOnce() throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        when(downloader.fetch(anyList(), any(Path.class))).thenAnswer(invocation -> {
            Thread.sleep(50);
            return writesReference().answer(invocation);
        });

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<CacheEntry>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return manager.resolve(List.of("GCF_9.1", "GCF_8.1"), false);
                }));
            }
            start.countDown();

            CacheEntry expected = futures.get(0).get(10, TimeUnit.SECONDS);
            for (Future<CacheEntry> future : futures) {
                assertThat(future.get(10, TimeUnit.SECONDS)).isEqualTo(expected);
            }
        } finally {
            executor.shutdownNow();
        }
        verify(downloader, times(1)).fetch(anyList(), any(Path.class));
    }

    @Test
    void ensureIndexBuildsOnceAndRenamesIntoPlace() {
        when(downloader.fetch(anyList(), any(Path.class))).thenAnswer(writesReference());
        doAnswer(invocation -> {
            Path out = invocation.getArgument(1);
            Files.writeString(out, "index");
            return null;
        }).when(aligner).index(any(Path.class), any(Path.class));

        CacheEntry entry = manager.resolve(List.of("A"), false);
        manager.ensureIndex(entry);
        manager.ensureIndex(entry);

        assertThat(entry.hasIndex()).isTrue();
        assertThat(entry.indexPath()).hasContent("index");
        verify(aligner, times(1)).index(eq(entry.fastaPath()), any(Path.class));
    }

    @Test
    void listEntriesSkipsLockFilesAndPartialDirectories() throws IOException {
        when(downloader.fetch(anyList(), any(Path.class))).thenAnswer(writesReference());
        CacheEntry a = manager.resolve(List.of("A"), false);
        CacheEntry b = manager.resolve(List.of("B"), false);
        Files.createDirectories(cacheRoot.resolve(CacheKeys.stableHash(List.of("C"))));

        assertThat(manager.listEntries()).containsExactlyInAnyOrder(a, b);
    }
}
