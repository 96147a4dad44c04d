package pmc.dal;

import com.google.gson.Gson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author Martin Sustik <sustik@herman.cz>
 * @since 12/10/2026
 */
class ReservationStoreTest {

    @TempDir
    Path tempDir;

    private Path cacheFile;
    private Gson gson;

    @BeforeEach
    void setUp() {
        cacheFile = tempDir.resolve("state").resolve("command-cache.json");
        gson = new Gson();
    }

    @Test
    @DisplayName("Should reserve a command only once")
    void shouldReserveOnlyOnce() throws IOException {
        // Given
        ReservationStore store = new ReservationStore(cacheFile, gson);
        store.load();

        // When
        boolean first = store.tryReserve("cmd-1");
        boolean second = store.tryReserve("cmd-1");

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(store.get("cmd-1")).get()
                .extracting(CommandReservation::status).isEqualTo(ReservationStatus.RESERVED);
    }

    @Test
    @DisplayName("Should refuse blank command ids")
    void shouldRefuseBlankIds() throws IOException {
        // Given
        ReservationStore store = new ReservationStore(cacheFile, gson);

        // When & Then
        assertThat(store.tryReserve("")).isFalse();
        assertThat(store.tryReserve(null)).isFalse();
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Should keep reservations across restart")
    void shouldKeepReservationsAcrossRestart() throws IOException {
        // Given
        ReservationStore store = new ReservationStore(cacheFile, gson);
        store.tryReserve("cmd-1");
        store.finalizeReservation("cmd-1", ReservationStatus.COMPLETED);

        // When
        ReservationStore restarted = new ReservationStore(cacheFile, gson);
        restarted.load();

        // Then
        assertThat(restarted.tryReserve("cmd-1")).isFalse();
        assertThat(restarted.get("cmd-1")).get()
                .extracting(CommandReservation::status).isEqualTo(ReservationStatus.COMPLETED);
    }

    @Test
    @DisplayName("Should write lowercase statuses under commands key")
    void shouldWriteDocumentedFileFormat() throws IOException {
        // Given
        ReservationStore store = new ReservationStore(cacheFile, gson);

        // When
        store.tryReserve("cmd-7");
        store.finalizeReservation("cmd-7", ReservationStatus.FAILED);

        // Then
        String content = Files.readString(cacheFile, StandardCharsets.UTF_8);
        assertThat(content).contains("\"commands\"").contains("\"cmd-7\"").contains("\"failed\"");
        assertThat(Files.exists(cacheFile.resolveSibling("command-cache.json.tmp"))).isFalse();
    }

    @Test
    @DisplayName("Should start empty when cache file is corrupt")
    void shouldStartEmptyOnCorruptFile() throws IOException {
        // Given
        Files.createDirectories(cacheFile.getParent());
        Files.writeString(cacheFile, "{not json", StandardCharsets.UTF_8);
        ReservationStore store = new ReservationStore(cacheFile, gson);

        // When
        store.load();

        // Then
        assertThat(store.size()).isZero();
        assertThat(store.tryReserve("cmd-1")).isTrue();
    }

    @Test
    @DisplayName("Should grant a contested reservation to exactly one thread")
    void shouldGrantContestedReservationOnce() throws Exception {
        // Given
        ReservationStore store = new ReservationStore(cacheFile, gson);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger granted = new AtomicInteger();

        // When
        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    startGate.await();
                    if (store.tryReserve("shared")) {
                        granted.incrementAndGet();
                    }
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                } finally {
                    done.countDown();
                }
            });
        }
        startGate.countDown();

        // Then
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdownNow();
        assertThat(granted.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should leave a command unreserved when the reservation cannot be written")
    void shouldReleaseReservationWhenWriteFails() throws IOException {
        // Given
        Path blocker = tempDir.resolve("blocker");
        Files.write(blocker, new byte[0]);
        ReservationStore store = new ReservationStore(blocker.resolve("command-cache.json"), gson);

        // When
        assertThatThrownBy(() -> store.tryReserve("cmd-9")).isInstanceOf(IOException.class);
        Files.delete(blocker);
        boolean retried = store.tryReserve("cmd-9");

        // Then
        assertThat(retried).isTrue();
        assertThat(store.get("cmd-9")).get()
                .extracting(CommandReservation::status).isEqualTo(ReservationStatus.RESERVED);
    }
}
