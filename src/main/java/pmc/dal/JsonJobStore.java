package pmc.dal;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.joda.time.DateTime;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.domain.jobs.IJobStore;
import pmc.domain.jobs.JobStatus;
import pmc.domain.jobs.TrackedJob;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Job store backed by a single JSON file, rewritten on every save
 * @author Martin Sustik <sustik@herman.cz>
 * @since 10/10/2026
 */
public class JsonJobStore implements IJobStore {
    private static final Logger logger = LoggerFactory.getLogger(JsonJobStore.class);
    private static final DateTimeFormatter ISO = ISODateTimeFormat.dateTime().withZoneUTC();

    private final Path path;
    private final Gson gson;
    private final Map<String, JobRecord> records = new LinkedHashMap<>();
    private boolean loaded;

    public JsonJobStore(Path path, Gson gson) {
        this.path = path;
        this.gson = gson;
    }

    @Override
    public synchronized void save(TrackedJob job) throws IOException {
        ensureLoaded();
        records.put(job.getPrinterSerial() + "|" + job.getJobId(), JobRecord.from(job));
        flush();
    }

    @Override
    public synchronized List<TrackedJob> loadAll() throws IOException {
        ensureLoaded();
        List<TrackedJob> jobs = new ArrayList<>();
        for (JobRecord record : records.values()) {
            try {
                jobs.add(record.toJob());
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping malformed job record {}/{}: {}", record.printerSerial, record.jobId, e.getMessage());
            }
        }
        return jobs;
    }

    private void ensureLoaded() throws IOException {
        if (loaded) {
            return;
        }
        loaded = true;
        if (!Files.exists(path)) {
            return;
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            StoreFile file = gson.fromJson(reader, StoreFile.class);
            if (file != null && file.jobs != null) {
                for (JobRecord record : file.jobs) {
                    if (record != null && record.jobId != null && record.printerSerial != null) {
                        records.put(record.printerSerial + "|" + record.jobId, record);
                    }
                }
            }
            logger.info("Loaded {} job record(s) from {}", records.size(), path);
        } catch (JsonParseException e) {
            throw new IOException("Corrupt job store " + path + ": " + e.getMessage(), e);
        }
    }

    private void flush() throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        StoreFile file = new StoreFile();
        file.jobs = new ArrayList<>(records.values());
        try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            gson.toJson(file, writer);
        }
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private static final class StoreFile {
        List<JobRecord> jobs;
    }

    private static final class JobRecord {
        String jobId;
        String printerSerial;
        String printerIp;
        String fileName;
        String status;
        String startedAt;
        String finishedAt;
        boolean sentToBackend;
        String backendEventId;
        String productId;
        String productName;

        static JobRecord from(TrackedJob job) {
            JobRecord record = new JobRecord();
            record.jobId = job.getJobId();
            record.printerSerial = job.getPrinterSerial();
            record.printerIp = job.getPrinterIp();
            record.fileName = job.getFileName();
            record.status = job.getStatus().wireValue();
            record.startedAt = job.getStartedAt() == null ? null : ISO.print(job.getStartedAt());
            record.finishedAt = job.getFinishedAt() == null ? null : ISO.print(job.getFinishedAt());
            record.sentToBackend = job.isSentToBackend();
            record.backendEventId = job.getBackendEventId();
            record.productId = job.getProductId();
            record.productName = job.getProductName();
            return record;
        }

        TrackedJob toJob() {
            DateTime started = startedAt == null ? new DateTime(0L) : ISO.parseDateTime(startedAt);
            DateTime finished = finishedAt == null ? null : ISO.parseDateTime(finishedAt);
            return TrackedJob.restore(jobId, printerSerial, printerIp, fileName, JobStatus.fromWire(status),
                    started, finished, sentToBackend, backendEventId, productId, productName);
        }
    }
}
