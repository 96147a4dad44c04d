package pmc.domain.command;

import com.google.gson.Gson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import pmc.dal.PrinterConfig;
import pmc.dal.ReservationStatus;
import pmc.dal.ReservationStore;
import pmc.domain.device.ControlSequence;
import pmc.domain.device.FakeDevice;
import pmc.domain.errors.TransportException;
import pmc.domain.start.PrintStartProtocol;
import pmc.domain.status.SnapshotNormalizer;
import pmc.domain.start.StartOptions;
import pmc.domain.start.StartResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author Martin Sustik <sustik@herman.cz>
 * @since 14/10/2026
 */
@ExtendWith(MockitoExtension.class)
class CommandWorkerTest {

    private static final PrinterConfig PRINTER = PrinterConfig.lan("SN1", "10.0.0.5", "12345678", "Lab");

    @TempDir
    Path tempDir;

    @Mock
    private ICommandQueue queue;

    @Mock
    private PrintStartProtocol startProtocol;

    private FakeDevice device;
    private ReservationStore reservations;
    private CommandWorker worker;

    @BeforeEach
    void setUp() {
        device = new FakeDevice("SN1").support("send_gcode");
        reservations = new ReservationStore(tempDir.resolve("command-cache.json"), new Gson());
        worker = new CommandWorker(PRINTER, device, queue, reservations, new CommandExecutor(new ControlSequence()), 3, 5, false);
    }

    @Test
    @DisplayName("Should acknowledge, execute, report and finalize a command")
    void shouldProcessCommand() throws IOException {
        // When
        CommandOutcome outcome = worker.processCommand(new Command("c1", "sendRaw", Map.of("gcode", "M400"), "SN1", null));

        // Then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.message()).isEqualTo("Sent: M400");
        assertThat(device.isConnected()).isTrue();
        InOrder order = inOrder(queue);
        order.verify(queue).acknowledge("SN1", "c1", CommandOutcome.PROCESSING, "Command received", null);
        order.verify(queue).reportResult(outcome);
        assertThat(reservations.get("c1")).get().extracting(r -> r.status()).isEqualTo(ReservationStatus.COMPLETED);
    }

    @Test
    @DisplayName("Should execute a command id only once")
    void shouldExecuteOnlyOnce() throws IOException {
        // Given
        Command command = new Command("c1", "sendRaw", Map.of("gcode", "M400"), "SN1", null);
        worker.processCommand(command);

        // When
        CommandOutcome second = worker.processCommand(command);

        // Then
        assertThat(second).isNull();
        assertThat(device.callsTo("send_gcode")).hasSize(1);
        verify(queue).reportResult(any());
    }

    @Test
    @DisplayName("Should not execute a command reserved before a restart")
    void shouldHonourReservationsAcrossRestart() throws IOException {
        // Given
        reservations.tryReserve("c1");
        ReservationStore reloaded = new ReservationStore(reservations.getPath(), new Gson());
        reloaded.load();
        CommandWorker restarted = new CommandWorker(PRINTER, device, queue, reloaded,
                new CommandExecutor(new ControlSequence()), 3, 5, false);

        // When
        CommandOutcome outcome = restarted.processCommand(new Command("c1", "sendRaw", Map.of("gcode", "M400"), "SN1", null));

        // Then
        assertThat(outcome).isNull();
        verify(queue, never()).acknowledge(anyString(), anyString(), anyString(), anyString(), any());
    }

    @Test
    @DisplayName("Should skip commands without id")
    void shouldSkipCommandsWithoutId() {
        assertThat(worker.processCommand(new Command(" ", "poke", null, "SN1", null))).isNull();
        assertThat(reservations.size()).isZero();
    }

    @Test
    @DisplayName("Should report unknown verbs as failed")
    void shouldReportUnknownVerbAsFailed() throws IOException {
        // When
        CommandOutcome outcome = worker.processCommand(new Command("c2", "levitate", null, "SN1", null));

        // Then
        assertThat(outcome.status()).isEqualTo(CommandOutcome.FAILED);
        assertThat(outcome.errorMessage()).contains("levitate");
        assertThat(reservations.get("c2")).get().extracting(r -> r.status()).isEqualTo(ReservationStatus.FAILED);
    }

    @Test
    @DisplayName("Should report an unreachable printer as failed")
    void shouldReportUnreachablePrinter() throws IOException {
        // Given
        device.failConnect(new TransportException("SN1", "connection refused"));

        // When
        CommandOutcome outcome = worker.processCommand(new Command("c3", "poke", null, "SN1", null));

        // Then
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.errorMessage()).startsWith("Printer unreachable");
        ArgumentCaptor<CommandOutcome> reported = ArgumentCaptor.forClass(CommandOutcome.class);
        verify(queue).reportResult(reported.capture());
        assertThat(reported.getValue().commandId()).isEqualTo("c3");
    }

    @Test
    @DisplayName("Should still execute and finalize when the cloud is unreachable")
    void shouldExecuteWhenCloudUnreachable() throws IOException {
        // Given
        doThrow(new IOException("timeout")).when(queue).acknowledge(anyString(), anyString(), anyString(), anyString(), isNull());
        doThrow(new IOException("timeout")).when(queue).reportResult(any());

        // When
        CommandOutcome outcome = worker.processCommand(new Command("c4", "sendRaw", Map.of("gcode", "G28"), "SN1", null));

        // Then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(reservations.get("c4")).get().extracting(r -> r.status()).isEqualTo(ReservationStatus.COMPLETED);
    }

    @Test
    @DisplayName("Should poll its own queue when polling is enabled")
    void shouldPollOwnQueue() throws IOException {
        // Given
        CommandWorker polling = new CommandWorker(PRINTER, device, queue, reservations,
                new CommandExecutor(new ControlSequence()), 3, 5, true);
        when(queue.fetchCommands("SN1", "10.0.0.5"))
                .thenReturn(List.of(new Command("c5", "sendRaw", Map.of("gcode", "M400"), "SN1", null)));

        // When
        polling.pollQueueOnce();

        // Then
        assertThat(device.callsTo("send_gcode")).hasSize(1);
    }

    @Test
    @DisplayName("Should process submitted commands on its thread and stop on request")
    void shouldProcessSubmittedCommands() throws Exception {
        // Given
        CountDownLatch reported = new CountDownLatch(2);
        doAnswer(invocation -> {
            reported.countDown();
            return null;
        }).when(queue).reportResult(any());
        ExecutorService executor = Executors.newSingleThreadExecutor();

        // When
        worker.start(executor);
        worker.submit(new Command("c6", "sendRaw", Map.of("gcode", "M400"), "SN1", null));
        worker.submit(new Command("c7", "sendRaw", Map.of("gcode", "M401"), "SN1", null));

        // Then
        assertThat(reported.await(5, TimeUnit.SECONDS)).isTrue();
        worker.stop(2000);
        assertThat(worker.isRunning()).isFalse();
        assertThat(device.callsTo("send_gcode")).extracting(call -> call.args()[0]).containsExactly("M400", "M401");
        verify(queue).acknowledge(eq("SN1"), eq("c7"), eq(CommandOutcome.PROCESSING), anyString(), isNull());
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should start a stored file through the print start protocol")
    void shouldStartPrintCommand() throws Exception {
        // Given
        CommandWorker printing = new CommandWorker(PRINTER, device, queue, reservations,
                new CommandExecutor(new ControlSequence()), startProtocol, 3, 5, false);
        when(startProtocol.startPrint(eq(PRINTER), eq(device), eq("benchy.3mf"), isNull(), any()))
                .thenReturn(new StartResult(true, "RUNNING", 0.0, false, false, "start_print"));

        // When
        CommandOutcome outcome = printing.processCommand(new Command("c8", "startPrint",
                Map.of("fileName", "benchy.3mf", "useAms", false, "plateIndex", 2), "SN1", null));

        // Then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.message()).isEqualTo("Print started: benchy.3mf");
        ArgumentCaptor<StartOptions> options = ArgumentCaptor.forClass(StartOptions.class);
        verify(startProtocol).startPrint(eq(PRINTER), eq(device), eq("benchy.3mf"), isNull(), options.capture());
        assertThat(options.getValue().useAms()).isFalse();
        assertThat(options.getValue().plateIndex()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should fail a print start the printer never confirmed")
    void shouldFailUnconfirmedPrintStart() throws Exception {
        // Given
        CommandWorker printing = new CommandWorker(PRINTER, device, queue, reservations,
                new CommandExecutor(new ControlSequence()), startProtocol, 3, 5, false);
        when(startProtocol.startPrint(any(), any(), any(), any(), any()))
                .thenReturn(new StartResult(false, "IDLE", null, true, false, "start_print"));

        // When
        CommandOutcome outcome = printing.processCommand(new Command("c9", "startPrint",
                Map.of("fileName", "benchy.3mf"), "SN1", null));

        // Then
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.errorMessage()).contains("did not confirm", "IDLE");
        assertThat(reservations.get("c9")).get().extracting(r -> r.status()).isEqualTo(ReservationStatus.FAILED);
    }

    @Test
    @DisplayName("Should reject a print start without a file name or start protocol")
    void shouldRejectIncompletePrintStart() throws Exception {
        // When
        CommandOutcome noProtocol = worker.processCommand(new Command("c10", "startPrint",
                Map.of("fileName", "benchy.3mf"), "SN1", null));
        CommandOutcome noFile = new CommandWorker(PRINTER, device, queue, reservations,
                new CommandExecutor(new ControlSequence()), startProtocol, 3, 5, false)
                .processCommand(new Command("c11", "startPrint", Map.of(), "SN1", null));

        // Then
        assertThat(noProtocol.isSuccess()).isFalse();
        assertThat(noFile.errorMessage()).contains("requires metadata.fileName");
        verify(startProtocol, never()).startPrint(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("Should reject a print start that requires another transport than the printer uses")
    void shouldRejectPrintStartOnTransportMismatch() {
        // Given
        CommandWorker printing = new CommandWorker(PRINTER, device, queue, reservations,
                new CommandExecutor(new ControlSequence()),
                new PrintStartProtocol(100, 10, new SnapshotNormalizer(), new ControlSequence()), 3, 5, false);

        // When
        CommandOutcome mismatch = printing.processCommand(new Command("c12", "startPrint",
                Map.of("fileName", "benchy.3mf", "connectionMethod", "bambu_connect"), "SN1", null));
        CommandOutcome unknown = printing.processCommand(new Command("c13", "startPrint",
                Map.of("fileName", "benchy.3mf", "transport", "carrier-pigeon"), "SN1", null));

        // Then
        assertThat(mismatch.isSuccess()).isFalse();
        assertThat(mismatch.errorMessage()).contains("configured for LAN", "requires CLOUD");
        assertThat(unknown.errorMessage()).contains("Unknown transport 'carrier-pigeon'");
        assertThat(device.callsTo("start_print")).isEmpty();
    }
}
