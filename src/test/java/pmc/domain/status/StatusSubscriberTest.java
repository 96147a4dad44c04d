package pmc.domain.status;

import io.reactivex.rxjava3.observers.TestObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pmc.dal.MonitorConfig;
import pmc.domain.device.FakeDevice;
import pmc.domain.device.PrinterCredentials;
import pmc.domain.errors.TransportException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author Martin Sustik <sustik@herman.cz>
 * @since 13/10/2026
 */
class StatusSubscriberTest {

    private static final PrinterCredentials CREDENTIALS = new PrinterCredentials("10.0.0.5", "SN1", "secret", "Lab");

    private MonitorConfig config;
    private FakeDevice device;
    private StatusSubscriber subscriber;

    @BeforeEach
    void setUp() {
        config = new MonitorConfig(0.5, 5.0, 0.1, 3, 0.05, 1, 60, 2);
        device = new FakeDevice("SN1").support("stop_print");
        subscriber = new StatusSubscriber(CREDENTIALS, device, config, new SnapshotNormalizer(), 5, System::currentTimeMillis);
    }

    @Test
    @DisplayName("Should emit the first snapshot and then only material changes")
    void shouldEmitOnlyMaterialChanges() {
        // Given
        TestObserver<StatusSnapshotEvent> observer = subscriber.getChanges().test();

        // When
        StatusSnapshotEvent first = subscriber.handleSnapshot(snapshot("RUNNING", 10.0, 210.0, 0));
        StatusSnapshotEvent jitter = subscriber.handleSnapshot(snapshot("RUNNING", 10.0, 210.01, 1000));
        StatusSnapshotEvent progressed = subscriber.handleSnapshot(snapshot("RUNNING", 11.0, 210.0, 2000));

        // Then
        assertThat(first).isNotNull();
        assertThat(first.getType()).isEqualTo(StatusSnapshotEvent.EType.CHANGE);
        assertThat(jitter).isNull();
        assertThat(progressed).isNotNull();
        observer.assertValueCount(2);
    }

    @Test
    @DisplayName("Should emit a heartbeat when nothing changed for the heartbeat interval")
    void shouldEmitHeartbeat() {
        // Given
        TestObserver<StatusSnapshotEvent> heartbeats = subscriber.getHeartbeats().test();
        subscriber.handleSnapshot(snapshot("IDLE", 0.0, 25.0, 0));

        // When
        StatusSnapshotEvent early = subscriber.handleSnapshot(snapshot("IDLE", 0.0, 25.0, 4999));
        StatusSnapshotEvent due = subscriber.handleSnapshot(snapshot("IDLE", 0.0, 25.0, 5000));

        // Then
        assertThat(early).isNull();
        assertThat(due.getType()).isEqualTo(StatusSnapshotEvent.EType.HEARTBEAT);
        heartbeats.assertValueCount(1);
    }

    @Test
    @DisplayName("Should stop a print stuck at 100% and report idle")
    void shouldStopStalledPrint() {
        // Given
        List<StatusSnapshotEvent> received = new ArrayList<>();
        subscriber.addListener(received::add);
        subscriber.handleSnapshot(snapshot("RUNNING", 100.0, 210.0, 0));
        subscriber.handleSnapshot(snapshot("RUNNING", 100.0, 210.0, 5000));
        subscriber.handleSnapshot(snapshot("RUNNING", 100.0, 210.0, 10000));

        // When
        StatusSnapshotEvent third = subscriber.handleSnapshot(snapshot("RUNNING", 100.0, 210.0, 15000));

        // Then
        assertThat(third.isStallOverride()).isTrue();
        assertThat(third.getType()).isEqualTo(StatusSnapshotEvent.EType.CHANGE);
        assertThat(third.getSnapshot().state()).isEqualTo(StatusSnapshot.IDLE);
        assertThat(third.getSnapshot().progressPercent()).isEqualTo(0.0);
        assertThat(device.callsTo("stop_print")).hasSize(1);
        assertThat(received).hasSize(4);
        assertThat(subscriber.getLastSnapshot().state()).isEqualTo(StatusSnapshot.IDLE);
    }

    @Test
    @DisplayName("Should stop a stuck print while a cooling nozzle keeps changing the readings")
    void shouldStopStalledPrintWhileCooling() {
        // Given
        List<StatusSnapshotEvent> received = new ArrayList<>();
        subscriber.addListener(received::add);

        // When
        double nozzle = 210.0;
        for (long t = 0; t <= 600_000; t += 1000) {
            subscriber.handleSnapshot(snapshot("RUNNING", 100.0, nozzle, t));
            nozzle -= 0.2;
        }

        // Then
        assertThat(device.callsTo("stop_print")).hasSize(1);
        assertThat(received).filteredOn(StatusSnapshotEvent::isStallOverride).first()
                .satisfies(event -> assertThat(event.getTimestamp()).isEqualTo(15000L));
        assertThat(subscriber.getLastSnapshot().state()).isEqualTo(StatusSnapshot.IDLE);
    }

    @Test
    @DisplayName("Should not stop a print on a single 100% reading")
    void shouldNotStopOnSingleFullProgressReading() {
        // When
        StatusSnapshotEvent full = subscriber.handleSnapshot(snapshot("RUNNING", 100.0, 210.0, 0));
        StatusSnapshotEvent next = subscriber.handleSnapshot(snapshot("RUNNING", 99.0, 210.0, 20000));

        // Then
        assertThat(full.isStallOverride()).isFalse();
        assertThat(full.getSnapshot().progressPercent()).isEqualTo(100.0);
        assertThat(next.isStallOverride()).isFalse();
        assertThat(device.callsTo("stop_print")).isEmpty();
    }

    @Test
    @DisplayName("Should keep reporting idle until progress leaves 100%")
    void shouldHoldIdleUntilProgressDrops() {
        // Given
        for (long t = 0; t <= 15000; t += 5000) {
            subscriber.handleSnapshot(snapshot("RUNNING", 100.0, 210.0, t));
        }

        // When
        StatusSnapshotEvent stillStuck = subscriber.handleSnapshot(snapshot("RUNNING", 100.0, 210.0, 16000));
        StatusSnapshotEvent recovered = subscriber.handleSnapshot(snapshot("RUNNING", 3.0, 210.0, 17000));

        // Then
        assertThat(stillStuck).isNull();
        assertThat(subscriber.getLastSnapshot().state()).isEqualTo(StatusSnapshot.IDLE);
        assertThat(recovered.isStallOverride()).isFalse();
        assertThat(recovered.getSnapshot().progressPercent()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should not treat a finished print at 100% as stalled")
    void shouldNotStallFinishedPrint() {
        // When
        StatusSnapshotEvent last = null;
        for (long t = 0; t <= 20000; t += 5000) {
            last = subscriber.handleSnapshot(snapshot("FINISH", 100.0, 210.0, t));
        }

        // Then
        assertThat(last.isStallOverride()).isFalse();
        assertThat(device.callsTo("stop_print")).isEmpty();
    }

    @Test
    @DisplayName("Should keep timestamps monotonic")
    void shouldKeepTimestampsMonotonic() {
        // Given
        subscriber.handleSnapshot(snapshot("RUNNING", 10.0, 210.0, 9000));

        // When
        StatusSnapshotEvent event = subscriber.handleSnapshot(snapshot("RUNNING", 20.0, 210.0, 8000));

        // Then
        assertThat(event.getTimestamp()).isEqualTo(9000L);
    }

    @Test
    @DisplayName("Should connect and read accessors on poll")
    void shouldConnectOnPoll() throws TransportException {
        // Given
        device.answer("get_state", "RUNNING").answer("get_percentage", "37%");

        // When
        StatusSnapshot snapshot = subscriber.pollOnce();

        // Then
        assertThat(device.isConnected()).isTrue();
        assertThat(snapshot.state()).isEqualTo("RUNNING");
        assertThat(snapshot.progressPercent()).isEqualTo(37.0);
    }

    @Test
    @DisplayName("Should treat a poll without any telemetry as a connection failure")
    void shouldFailPollWithoutTelemetry() {
        assertThatThrownBy(() -> subscriber.pollOnce()).isInstanceOf(TransportException.class);
    }

    @Test
    @DisplayName("Should keep polling after connection failures until stopped")
    void shouldReconnectUntilStopped() throws InterruptedException {
        // Given
        FakeDevice flaky = new FakeDevice("SN2").failConnect(new TransportException("SN2", "refused"));
        MonitorConfig fast = new MonitorConfig(0.5, 5.0, 0.05, 3, 0.05, 1, 60, 2);
        StatusSubscriber flakySubscriber = new StatusSubscriber(CREDENTIALS, flaky, fast, new SnapshotNormalizer(), 1);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        // When
        flakySubscriber.start(executor);
        Thread.sleep(200);
        boolean runningWhileFailing = flakySubscriber.isRunning();
        flakySubscriber.stop(2000);

        // Then
        assertThat(runningWhileFailing).isTrue();
        assertThat(flakySubscriber.isRunning()).isFalse();
        executor.shutdown();
        assertThat(executor.awaitTermination(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Should deliver events to listeners from the polling thread")
    void shouldDeliverEventsFromPollingThread() throws InterruptedException {
        // Given
        device.answer("get_state", "IDLE");
        CountDownLatch delivered = new CountDownLatch(1);
        StatusSubscriber live = new StatusSubscriber(CREDENTIALS, device, config, new SnapshotNormalizer(), 1);
        live.addListener(event -> delivered.countDown());
        ExecutorService executor = Executors.newSingleThreadExecutor();

        // When
        live.start(executor);

        // Then
        assertThat(delivered.await(3, TimeUnit.SECONDS)).isTrue();
        live.stop(2000);
        executor.shutdownNow();
    }

    private static StatusSnapshot snapshot(String gcodeState, Double progress, Double nozzle, long timestamp) {
        return new StatusSnapshot(gcodeState, gcodeState, progress, nozzle, 60.0, null, null, null, "job-1", "a.3mf", timestamp);
    }
}
