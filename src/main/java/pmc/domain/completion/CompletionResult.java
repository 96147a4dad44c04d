package pmc.domain.completion;

/**
 * Decision of one completion check
 * @param completed true when the print is (or already was) reported complete
 * @param reason which signal decided, "debounce n/m" while waiting for confirmation
 * @param jobId job id reported by the printer, may be null
 * @param fileName file name reported by the printer, may be null
 * @param printerSerial printer serial
 * @param timestamp epoch millis of the decision
 */
public record CompletionResult(boolean completed, String reason, String jobId, String fileName,
                               String printerSerial, long timestamp) {

    /**
     * Dedup key: job id, else file name, else "unknown"
     */
    public String dedupKey() {
        return CompletionMonitor.dedupKey(jobId, fileName);
    }
}
