package pmc.domain.orchestration;

import com.google.common.eventbus.EventBus;
import io.reactivex.rxjava3.disposables.Disposable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.dal.PrinterConfig;
import pmc.domain.cloud.StatusReporter;
import pmc.domain.command.CommandWorker;
import pmc.domain.completion.CompletionMonitor;
import pmc.domain.completion.CompletionResult;
import pmc.domain.device.IDeviceHandle;
import pmc.domain.errors.PrinterOperationException;
import pmc.domain.errors.TransportException;
import pmc.domain.events.HmsErrorEvent;
import pmc.domain.hms.HmsTracker;
import pmc.domain.jobs.JobStatus;
import pmc.domain.jobs.JobTracker;
import pmc.domain.jobs.TrackedJob;
import pmc.domain.start.PrintStartProtocol;
import pmc.domain.start.StartOptions;
import pmc.domain.start.StartResult;
import pmc.domain.status.StatusSnapshot;
import pmc.domain.status.StatusSnapshotEvent;
import pmc.domain.status.StatusSubscriber;
import pmc.domain.transfer.UploadProtocol;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;

/**
 * Everything running for one physical printer: its status subscriber and command worker, and the
 * hand-off of each snapshot to job tracking, completion detection, HMS reporting and status reporting.
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 16/10/2026
 */
public class PrinterAgent {
    private static final Logger logger = LoggerFactory.getLogger(PrinterAgent.class);

    private final PrinterConfig config;
    private final IDeviceHandle device;
    private final StatusSubscriber subscriber;
    private final CommandWorker worker;
    private final CompletionMonitor completionMonitor;
    private final JobTracker jobTracker;
    private final HmsTracker hmsTracker;
    private final EventBus eventBus;
    private final StatusReporter statusReporter;
    private final UploadProtocol uploadProtocol;
    private final PrintStartProtocol startProtocol;
    private final int connectTimeoutSeconds;

    private Disposable subscription;

    public PrinterAgent(PrinterConfig config, IDeviceHandle device, StatusSubscriber subscriber, CommandWorker worker,
                        CompletionMonitor completionMonitor, JobTracker jobTracker, HmsTracker hmsTracker, EventBus eventBus,
                        StatusReporter statusReporter, UploadProtocol uploadProtocol, PrintStartProtocol startProtocol,
                        int connectTimeoutSeconds) {
        this.config = config;
        this.device = device;
        this.subscriber = subscriber;
        this.worker = worker;
        this.completionMonitor = completionMonitor;
        this.jobTracker = jobTracker;
        this.hmsTracker = hmsTracker;
        this.eventBus = eventBus;
        this.statusReporter = statusReporter;
        this.uploadProtocol = uploadProtocol;
        this.startProtocol = startProtocol;
        this.connectTimeoutSeconds = connectTimeoutSeconds;
    }

    public PrinterConfig getConfig() {
        return config;
    }

    public String getSerial() {
        return config.serialNumber();
    }

    public IDeviceHandle getDevice() {
        return device;
    }

    public CommandWorker getWorker() {
        return worker;
    }

    public StatusSubscriber getSubscriber() {
        return subscriber;
    }

    /**
     * Open the device session
     */
    public void initialize() throws TransportException {
        device.connect(connectTimeoutSeconds);
    }

    public synchronized void start(ExecutorService deviceExecutor) {
        if (subscription == null) {
            subscription = subscriber.getEvents().subscribe(this::onSnapshot,
                    error -> logger.error("[{}] Snapshot stream failed", config.toCredentials().describe(), error));
        }
        subscriber.start(deviceExecutor);
        worker.start(deviceExecutor);
    }

    /**
     * Stop both loops with a bounded wait each, then drop the device session
     */
    public synchronized void stop(long joinTimeoutMs) {
        subscriber.stop(joinTimeoutMs);
        worker.stop(joinTimeoutMs);
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
        }
        device.disconnect();
    }

    void onSnapshot(StatusSnapshotEvent event) {
        StatusSnapshot snapshot = event.getSnapshot();
        String serial = getSerial();
        try {
            TrackedJob changed = jobTracker.updateFromStatus(serial, config.ipAddress(), snapshot);
            if (changed != null && changed.getStatus() == JobStatus.PRINTING) {
                completionMonitor.clearCompletedJobs(serial);
            }

            if (!event.isStallOverride()) {
                completionMonitor.checkAndNotify(snapshot, serial, this::onCompletion);
            }

            hmsTracker.observe(serial, snapshot.hmsErrorCode())
                    .ifPresent(error -> eventBus.post(new HmsErrorEvent(serial, config.ipAddress(), error, snapshot)));

            if (statusReporter != null) {
                statusReporter.maybeReport(serial, config.ipAddress(), snapshot);
            }
        } catch (RuntimeException e) {
            logger.error("[{}] Snapshot handling failed", config.toCredentials().describe(), e);
        }
    }

    private void onCompletion(CompletionResult result) {
        String serial = getSerial();
        TrackedJob current = jobTracker.getCurrentJob(serial);
        if (current == null) {
            // printing began before this process saw it, record it so the completion is still reported
            current = jobTracker.startJob(serial, config.ipAddress(), result.jobId(), result.fileName());
        }
        jobTracker.finishJob(serial, current.getJobId());
    }

    /**
     * Upload a local project file and start printing it
     */
    public StartResult uploadAndStart(Path localFile, String remoteName, String paramPath, StartOptions options)
            throws PrinterOperationException {
        String uploaded = uploadProtocol.upload(config.toCredentials(), device, localFile, remoteName);
        StartResult result = startProtocol.startPrint(config, device, uploaded, paramPath, options);
        logger.info("[{}] Print of {} {}", config.toCredentials().describe(), uploaded,
                result.acknowledged() ? "acknowledged" : "not acknowledged");
        return result;
    }
}
