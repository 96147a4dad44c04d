package pmc.domain.status;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.subjects.PublishSubject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.dal.MonitorConfig;
import pmc.domain.device.DeviceCapabilityAdapter;
import pmc.domain.device.DeviceMethods;
import pmc.domain.device.IDeviceHandle;
import pmc.domain.device.InvocationOutcome;
import pmc.domain.device.PrinterCredentials;
import pmc.domain.errors.TransportException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Background worker polling one printer and emitting normalized snapshots.
 *
 * <p>A snapshot is emitted at once when it differs materially from the last emitted one, otherwise
 * when the heartbeat interval has elapsed. Connection failures back off for a fixed delay and
 * reconnect; only {@link #stop(long)} ends the loop.</p>
 *
 * <p>Stall safeguard: progress held at 100% without a terminal gcode state for the configured number of
 * heartbeat intervals stops the print and reports idle / 0% until a non-100% reading arrives. The streak
 * is measured in time, so readings emitted as changes (a cooling nozzle) still count towards it.</p>
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 08/10/2026
 */
public class StatusSubscriber {
    private static final Logger logger = LoggerFactory.getLogger(StatusSubscriber.class);

    private final PrinterCredentials credentials;
    private final IDeviceHandle device;
    private final DeviceCapabilityAdapter adapter;
    private final MonitorConfig config;
    private final SnapshotNormalizer normalizer;
    private final int connectTimeoutSeconds;
    private final LongSupplier clock;

    private final PublishSubject<StatusSnapshotEvent> eventSubject = PublishSubject.create();
    private final List<Consumer<StatusSnapshotEvent>> listeners = new CopyOnWriteArrayList<>();

    private volatile StatusSnapshot lastSnapshot;
    private StatusSnapshot lastEmitted;
    private long lastEmittedAt = 0;
    private long lastTimestamp = 0;
    private long fullProgressSince = -1;
    private boolean stalled = false;
    private int consecutiveFailures = 0;

    private boolean running = false;         // guarded by start/stop synchronization
    private CountDownLatch stopSignal;
    private CountDownLatch finished;

    public StatusSubscriber(PrinterCredentials credentials, IDeviceHandle device, MonitorConfig config,
                            SnapshotNormalizer normalizer, int connectTimeoutSeconds) {
        this(credentials, device, config, normalizer, connectTimeoutSeconds, System::currentTimeMillis);
    }

    StatusSubscriber(PrinterCredentials credentials, IDeviceHandle device, MonitorConfig config,
                     SnapshotNormalizer normalizer, int connectTimeoutSeconds, LongSupplier clock) {
        this.credentials = credentials;
        this.device = device;
        this.adapter = new DeviceCapabilityAdapter(device);
        this.config = config;
        this.normalizer = normalizer;
        this.connectTimeoutSeconds = connectTimeoutSeconds;
        this.clock = clock;
    }

    /**
     * All emitted snapshots
     */
    public Observable<StatusSnapshotEvent> getEvents() {
        return eventSubject;
    }

    public Observable<StatusSnapshotEvent> getChanges() {
        return eventSubject.filter(ev -> ev.getType() == StatusSnapshotEvent.EType.CHANGE);
    }

    public Observable<StatusSnapshotEvent> getHeartbeats() {
        return eventSubject.filter(ev -> ev.getType() == StatusSnapshotEvent.EType.HEARTBEAT);
    }

    public void addListener(Consumer<StatusSnapshotEvent> listener) {
        if (listener != null && !listeners.contains(listener)) {
            listeners.add(listener);
        }
    }

    public void removeListener(Consumer<StatusSnapshotEvent> listener) {
        listeners.remove(listener);
    }

    /**
     * Start the polling loop on the executor
     */
    public synchronized void start(ExecutorService executor) {
        if (running) {
            logger.warn("[{}] Status subscriber is already running", credentials.describe());
            return;
        }
        running = true;
        stopSignal = new CountDownLatch(1);
        finished = new CountDownLatch(1);
        CountDownLatch localStop = stopSignal;
        CountDownLatch localFinished = finished;
        executor.execute(() -> runLoop(localStop, localFinished));
        logger.info("[{}] Status subscriber started", credentials.describe());
    }

    /**
     * Signal the loop to stop and wait up to the timeout for it to exit. Proceeds regardless.
     */
    public synchronized void stop(long joinTimeoutMs) {
        if (!running) {
            return;
        }
        running = false;
        stopSignal.countDown();
        try {
            if (!finished.await(joinTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.warn("[{}] Status subscriber did not stop within {}ms, abandoning it", credentials.describe(), joinTimeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("[{}] Status subscriber stopped", credentials.describe());
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public StatusSnapshot getLastSnapshot() {
        return lastSnapshot;
    }

    private void runLoop(CountDownLatch stop, CountDownLatch done) {
        try {
            while (stop.getCount() > 0) {
                long delay = config.statusPollMs();
                try {
                    StatusSnapshot snapshot = pollOnce();
                    handleSnapshot(snapshot);
                    if (consecutiveFailures > 0) {
                        logger.info("[{}] Telemetry restored after {} failed attempts", credentials.describe(), consecutiveFailures);
                        consecutiveFailures = 0;
                    }
                } catch (TransportException e) {
                    onConnectionFailure(e.getMessage());
                    delay = config.reconnectDelayMs();
                } catch (Exception e) {
                    logger.error("[{}] Status poll failed", credentials.describe(), e);
                    onConnectionFailure(e.getMessage());
                    delay = config.reconnectDelayMs();
                }
                if (stop.await(delay, TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            done.countDown();
        }
    }

    private void onConnectionFailure(String message) {
        consecutiveFailures++;
        if (consecutiveFailures == 1) {
            logger.warn("[{}] Printer unreachable: {} (reconnecting every {}ms)", credentials.describe(),
                    credentials.maskSecrets(message), config.reconnectDelayMs());
        } else {
            logger.debug("[{}] Printer still unreachable ({} attempts)", credentials.serialNumber(), consecutiveFailures);
        }
        try {
            device.disconnect();
        } catch (RuntimeException e) {
            logger.debug("[{}] Disconnect after failure: {}", credentials.serialNumber(), e.getMessage());
        }
    }

    /**
     * Connect if needed and read every available accessor
     */
    StatusSnapshot pollOnce() throws TransportException {
        if (!device.isConnected()) {
            device.connect(connectTimeoutSeconds);
        }
        Object state = adapter.query(DeviceMethods.STATE);
        Object percentage = adapter.query(DeviceMethods.PERCENTAGE);
        Object gcode = adapter.query(DeviceMethods.GCODE_STATE);
        Object raw = adapter.query(DeviceMethods.RAW_STATUS);
        if (state == null && percentage == null && gcode == null && raw == null) {
            throw new TransportException(credentials.serialNumber(), "No telemetry available from " + credentials.describe());
        }
        return normalizer.normalize(raw, state, percentage, gcode, clock.getAsLong());
    }

    /**
     * Decide whether to emit, apply the stall safeguard, emit
     * @return the emitted event, null when nothing was emitted
     */
    StatusSnapshotEvent handleSnapshot(StatusSnapshot snapshot) {
        long now = snapshot.timestamp();
        boolean stallCandidate = snapshot.isAtFullProgress() && !PrintStates.isTerminal(snapshot.gcodeState());
        if (!stallCandidate) {
            fullProgressSince = -1;
            stalled = false;
        } else if (fullProgressSince < 0) {
            fullProgressSince = now;
        }
        if (stallCandidate && !stalled && now - fullProgressSince >= config.stallHeartbeats() * config.heartbeatMs()) {
            forceStop(now - fullProgressSince);
            stalled = true;
        }

        StatusSnapshot outgoing = stalled ? snapshot.asIdle() : snapshot;
        boolean changed = outgoing.differsFrom(lastEmitted, config.numericEpsilon());
        boolean heartbeatDue = lastEmitted != null && now - lastEmittedAt >= config.heartbeatMs();
        lastSnapshot = outgoing;
        if (!changed && !heartbeatDue) {
            return null;
        }
        StatusSnapshotEvent.EType type = changed ? StatusSnapshotEvent.EType.CHANGE : StatusSnapshotEvent.EType.HEARTBEAT;

        // keep wall clock order monotonic within this printer
        long timestamp = Math.max(now, lastTimestamp);
        lastTimestamp = timestamp;
        outgoing = outgoing.withTimestamp(timestamp);

        lastEmitted = outgoing;
        lastEmittedAt = now;
        StatusSnapshotEvent event = new StatusSnapshotEvent(credentials.serialNumber(), outgoing, type, stalled);
        emit(event);
        return event;
    }

    private void forceStop(long stuckMs) {
        logger.warn("[{}] Progress stuck at 100% for {}s without finishing, stopping print and reporting idle",
                credentials.describe(), stuckMs / 1000);
        InvocationOutcome outcome = adapter.invokeFirst(DeviceMethods.STOP);
        if (!outcome.succeeded()) {
            logger.warn("[{}] Stop of stalled print failed: {}", credentials.describe(), outcome.lastError());
        }
    }

    private void emit(StatusSnapshotEvent event) {
        try {
            eventSubject.onNext(event);
        } catch (Exception e) {
            logger.error("[{}] Error in snapshot observer: {}", credentials.serialNumber(), e.getMessage());
        }
        for (Consumer<StatusSnapshotEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                logger.error("[{}] Error notifying status listener: {}", credentials.serialNumber(), e.getMessage());
            }
        }
    }
}
