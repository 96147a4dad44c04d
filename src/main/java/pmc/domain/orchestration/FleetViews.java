package pmc.domain.orchestration;

import org.joda.time.DateTime;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;
import pmc.domain.jobs.TrackedJob;
import pmc.domain.status.StatusSnapshot;

/**
 * JSON views returned by the local status API
 * @author Martin Sustik <sustik@herman.cz>
 * @since 17/10/2026
 */
public final class FleetViews {
    private static final DateTimeFormatter ISO = ISODateTimeFormat.dateTime().withZoneUTC();

    private FleetViews() {
    }

    public record PrinterView(String serial, String nickname, String ipAddress, String connectionType, boolean connected,
                              boolean subscriberRunning, boolean workerRunning, int queuedCommands, StatusSnapshot lastSnapshot) {

        static PrinterView of(PrinterAgent agent) {
            return new PrinterView(agent.getSerial(), agent.getConfig().nickname(), agent.getConfig().ipAddress(),
                    agent.getConfig().connectionType().name(), agent.getDevice().isConnected(),
                    agent.getSubscriber().isRunning(), agent.getWorker().isRunning(), agent.getWorker().getInboxSize(),
                    agent.getSubscriber().getLastSnapshot());
        }
    }

    public record JobView(String jobId, String printerSerial, String printerIp, String fileName, String status,
                          String startedAt, String finishedAt, boolean sentToBackend, String backendEventId,
                          String productId, String productName) {

        static JobView of(TrackedJob job) {
            return new JobView(job.getJobId(), job.getPrinterSerial(), job.getPrinterIp(), job.getFileName(),
                    job.getStatus().wireValue(), format(job.getStartedAt()), format(job.getFinishedAt()),
                    job.isSentToBackend(), job.getBackendEventId(), job.getProductId(), job.getProductName());
        }
    }

    public record HealthView(String status, int printers, long connected, int backlog, int pendingJobs) {
    }

    /**
     * Body of a print request
     */
    public static class PrintRequest {
        private String file;
        private String remoteName;
        private String paramPath;
        private Integer plateIndex;
        private Boolean useAms;
        private String transport;

        public String getFile() {
            return file;
        }

        public String getRemoteName() {
            return remoteName;
        }

        public String getParamPath() {
            return paramPath;
        }

        public int getPlateIndex() {
            return plateIndex == null ? 1 : plateIndex;
        }

        public boolean isUseAms() {
            return useAms == null || useAms;
        }

        /**
         * Transport the start must use, null when any is fine
         */
        public String getTransport() {
            return transport;
        }
    }

    private static String format(DateTime value) {
        return value == null ? null : ISO.print(value);
    }
}
