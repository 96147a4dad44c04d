package pmc.domain.command;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author Martin Sustik <sustik@herman.cz>
 * @since 14/10/2026
 */
@ExtendWith(MockitoExtension.class)
class RecipientCommandRouterTest {

    @Mock
    private ICommandQueue queue;

    @Mock
    private CommandWorker workerSn1;

    @Mock
    private CommandWorker workerSn2;

    private RecipientCommandRouter router;

    @BeforeEach
    void setUp() {
        router = new RecipientCommandRouter(queue, 15);
        lenient().when(workerSn1.getIpAddress()).thenReturn("10.0.0.1");
        lenient().when(workerSn2.getIpAddress()).thenReturn("10.0.0.2");
    }

    private static Command forSerial(String id, String serial) {
        return new Command(id, "poke", Map.of("printerSerial", serial), null, null);
    }

    @Test
    @DisplayName("Should route to registered workers and keep the rest for later")
    void shouldRouteAndBacklog() throws IOException {
        // Given
        router.registerWorker("SN1", workerSn1);
        Command a = forSerial("a", "SN1");
        Command b = forSerial("b", "SN2");
        Command c = forSerial("c", "SN2");
        when(queue.fetchCommands(null, null)).thenReturn(List.of(a, b, c));

        // When
        int received = router.forcePoll();
        int drained = router.registerWorker("SN2", workerSn2);

        // Then
        assertThat(received).isEqualTo(3);
        assertThat(drained).isEqualTo(2);
        assertThat(router.getBacklog()).isEmpty();
        verify(workerSn1).submit(a);
        InOrder order = inOrder(workerSn2);
        order.verify(workerSn2).submit(b);
        order.verify(workerSn2).submit(c);
    }

    @Test
    @DisplayName("Should match by address when no serial is given")
    void shouldMatchByAddress() {
        // Given
        router.registerWorker("SN1", workerSn1);
        router.registerWorker("SN2", workerSn2);
        Command command = new Command("x", "poke", Map.of("printerIpAddress", "10.0.0.2"), null, null);

        // When
        boolean delivered = router.route(command);

        // Then
        assertThat(delivered).isTrue();
        verify(workerSn2).submit(command);
        verify(workerSn1, never()).submit(any());
    }

    @Test
    @DisplayName("Should not deliver by address when a serial is present")
    void shouldPreferSerialOverAddress() {
        // Given
        router.registerWorker("SN1", workerSn1);
        Command command = new Command("x", "poke", Map.of("printerSerial", "SN9"), null, "10.0.0.1");

        // When
        boolean delivered = router.route(command);

        // Then
        assertThat(delivered).isFalse();
        assertThat(router.getBacklog()).containsExactly(command);
    }

    @Test
    @DisplayName("Should keep the backlog when a worker is unregistered")
    void shouldKeepBacklogOnUnregister() {
        // Given
        router.registerWorker("SN1", workerSn1);
        router.route(forSerial("q", "SN3"));

        // When
        router.unregisterWorker("SN1");

        // Then
        assertThat(router.getWorkerCount()).isZero();
        assertThat(router.getBacklog()).hasSize(1);
    }

    @Test
    @DisplayName("Should report a failed poll and recover on the next one")
    void shouldRecoverAfterFailedPoll() throws IOException {
        // Given
        when(queue.fetchCommands(null, null))
                .thenThrow(new IOException("503"))
                .thenReturn(List.of());

        // When
        int failed = router.pollOnce();
        int recovered = router.pollOnce();

        // Then
        assertThat(failed).isEqualTo(-1);
        assertThat(recovered).isZero();
    }

    @Test
    @DisplayName("Should drain only the backlog commands of the registered printer, in order")
    void shouldDrainOnlyMatchingBacklog() {
        // Given
        Command first = forSerial("s1-a", "SN1");
        Command other = forSerial("s2-a", "SN2");
        Command second = forSerial("s1-b", "SN1");
        router.route(first);
        router.route(other);
        router.route(second);

        // When
        int drained = router.registerWorker("SN1", workerSn1);

        // Then
        assertThat(drained).isEqualTo(2);
        InOrder order = inOrder(workerSn1);
        order.verify(workerSn1).submit(first);
        order.verify(workerSn1).submit(second);
        verify(workerSn1, times(2)).submit(any());
        assertThat(router.getBacklog()).containsExactly(other);
    }

    @Test
    @DisplayName("Should keep a repeatedly polled pending command in the backlog once")
    void shouldNotDuplicateRepeatedPendingCommand() throws IOException {
        // Given
        Command pending = forSerial("p1", "SN2");
        when(queue.fetchCommands(null, null)).thenReturn(List.of(pending));

        // When
        for (int i = 0; i < 100; i++) {
            router.pollOnce();
        }
        int drained = router.registerWorker("SN2", workerSn2);

        // Then
        assertThat(drained).isEqualTo(1);
        verify(workerSn2, times(1)).submit(pending);
        assertThat(router.getBacklog()).isEmpty();
    }
}
