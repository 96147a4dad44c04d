package pmc.domain.completion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.domain.status.PrintStates;
import pmc.domain.status.StatusSnapshot;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Debounced, deduplicated print completion detection across all printers.
 *
 * <p>Detection priority: gcode state in the completion set, then progress &gt;= 100, then the generic
 * state in the completion set. A completion must repeat {@code debounceCount} consecutive times before
 * it is reported; any non-completed reading resets the count. Each (printer, job) pair is reported
 * once until the printer's history is cleared.</p>
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 09/10/2026
 */
public class CompletionMonitor {
    private static final Logger logger = LoggerFactory.getLogger(CompletionMonitor.class);

    private final int debounceCount;
    private final Object lock = new Object();
    private final Map<String, Set<String>> completedJobs = new HashMap<>();
    private final Map<String, PendingCompletion> pending = new HashMap<>();

    public CompletionMonitor(int debounceCount) {
        this.debounceCount = Math.max(1, debounceCount);
    }

    public int getDebounceCount() {
        return debounceCount;
    }

    /**
     * Completion signal of a single snapshot, without debounce or dedup.
     * @return the deciding reason, null when not completed
     */
    public String completionReason(StatusSnapshot snapshot) {
        if (snapshot.gcodeState() != null && PrintStates.isCompletion(snapshot.gcodeState())) {
            return "gcodeState=" + snapshot.gcodeState();
        }
        if (snapshot.progressPercent() != null && snapshot.progressPercent() >= 100.0) {
            return "progressPercent=" + snapshot.progressPercent();
        }
        if (snapshot.state() != null && PrintStates.isCompletion(snapshot.state())) {
            return "state=" + snapshot.state();
        }
        return null;
    }

    public boolean isPrintCompleted(StatusSnapshot snapshot) {
        return completionReason(snapshot) != null;
    }

    /**
     * Failure or cancellation signal in gcode state or state
     * @return the deciding reason, null when not failed
     */
    public String failureReason(StatusSnapshot snapshot) {
        if (snapshot.gcodeState() != null && PrintStates.isFailed(snapshot.gcodeState())) {
            return "gcodeState=" + snapshot.gcodeState();
        }
        if (snapshot.state() != null && PrintStates.isFailed(snapshot.state())) {
            return "state=" + snapshot.state();
        }
        return null;
    }

    public boolean isPrintFailed(StatusSnapshot snapshot) {
        return failureReason(snapshot) != null;
    }

    /**
     * Check the snapshot and invoke the callback on the first confirmed completion of its job
     */
    public CompletionResult checkAndNotify(StatusSnapshot snapshot, String printerSerial, Consumer<CompletionResult> onCompletion) {
        String jobId = snapshot.currentJobId();
        String fileName = snapshot.fileName();
        long now = System.currentTimeMillis();

        String reason = completionReason(snapshot);
        if (reason == null) {
            synchronized (lock) {
                pending.remove(printerSerial);
            }
            return new CompletionResult(false, "", jobId, fileName, printerSerial, now);
        }

        String key = dedupKey(jobId, fileName);
        CompletionResult result;
        synchronized (lock) {
            Set<String> reported = completedJobs.get(printerSerial);
            if (reported != null && reported.contains(key)) {
                logger.debug("[completion] Already reported for {}: {}", printerSerial, key);
                return new CompletionResult(true, reason + " (already reported)", jobId, fileName, printerSerial, now);
            }

            PendingCompletion current = pending.get(printerSerial);
            int count = (current != null && current.dedupKey.equals(key)) ? current.count + 1 : 1;
            if (count < debounceCount) {
                pending.put(printerSerial, new PendingCompletion(key, count));
                logger.debug("[completion] Pending confirmation {}/{} for {} job={}", count, debounceCount, printerSerial, key);
                return new CompletionResult(false, "debounce " + count + "/" + debounceCount, jobId, fileName, printerSerial, now);
            }

            pending.remove(printerSerial);
            completedJobs.computeIfAbsent(printerSerial, k -> new HashSet<>()).add(key);
            result = new CompletionResult(true, reason, jobId, fileName, printerSerial, now);
        }

        logger.info("PRINT COMPLETED: printer={}, job={}, file={}, reason={}",
                printerSerial, jobId == null ? "unknown" : jobId, fileName == null ? "unknown" : fileName, reason);

        if (onCompletion != null) {
            try {
                onCompletion.accept(result);
            } catch (Exception e) {
                logger.warn("Completion callback failed for {}: {}", printerSerial, e.getMessage());
            }
        }
        return result;
    }

    /**
     * Forget reported completions (and pending confirmations) of one printer, or of all when serial is null
     */
    public void clearCompletedJobs(String printerSerial) {
        synchronized (lock) {
            if (printerSerial != null) {
                completedJobs.remove(printerSerial);
                pending.remove(printerSerial);
            } else {
                completedJobs.clear();
                pending.clear();
            }
        }
        logger.debug("[completion] Cleared completed jobs for {}", printerSerial == null ? "all printers" : printerSerial);
    }

    public Set<String> getCompletedJobs(String printerSerial) {
        synchronized (lock) {
            Set<String> reported = completedJobs.get(printerSerial);
            return reported == null ? Set.of() : Set.copyOf(reported);
        }
    }

    static String dedupKey(String jobId, String fileName) {
        if (jobId != null && !jobId.isBlank()) {
            return jobId;
        }
        if (fileName != null && !fileName.isBlank()) {
            return fileName;
        }
        return "unknown";
    }

    private static final class PendingCompletion {
        private final String dedupKey;
        private final int count;

        private PendingCompletion(String dedupKey, int count) {
            this.dedupKey = dedupKey;
            this.count = count;
        }
    }
}
