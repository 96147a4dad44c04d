package pmc.dal;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * On-disk cache of command reservations giving at-most-once local execution per command id,
 * also across process restarts.
 *
 * <p>File format: {@code {"commands": {"<commandId>": {"status": "reserved", "timestamp": 1700000000000}}}}.
 * All access goes through one monitor and every write rewrites the file before returning.</p>
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 09/10/2026
 */
public class ReservationStore {
    private static final Logger logger = LoggerFactory.getLogger(ReservationStore.class);

    private final Path path;
    private final Gson gson;
    private final Map<String, Entry> commands = new LinkedHashMap<>();

    public ReservationStore(Path path, Gson gson) {
        this.path = path;
        this.gson = gson;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Read the cache file. A missing file means an empty cache, an unreadable one is logged and ignored.
     */
    public synchronized void load() {
        commands.clear();
        if (!Files.exists(path)) {
            logger.info("Reservation cache {} not found, starting empty", path);
            return;
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            CacheFile file = gson.fromJson(reader, CacheFile.class);
            if (file != null && file.commands != null) {
                file.commands.forEach((id, entry) -> {
                    if (id != null && entry != null && entry.status != null) {
                        commands.put(id, entry);
                    }
                });
            }
            logger.info("Loaded {} command reservation(s) from {}", commands.size(), path);
        } catch (IOException | JsonParseException e) {
            logger.error("Failed to read reservation cache {}: {}", path, e.getMessage());
        }
    }

    /**
     * Check-and-set a reservation
     * @return true when the command was not known and is now reserved, false when already taken
     * @throws IOException when the reservation could not be persisted; the command stays unreserved
     */
    public synchronized boolean tryReserve(String commandId) throws IOException {
        if (commandId == null || commandId.isBlank()) {
            return false;
        }
        if (commands.containsKey(commandId)) {
            logger.debug("Command {} already reserved ({})", commandId, commands.get(commandId).status);
            return false;
        }
        commands.put(commandId, new Entry(ReservationStatus.RESERVED, System.currentTimeMillis()));
        try {
            flush();
        } catch (IOException e) {
            commands.remove(commandId);
            throw e;
        }
        return true;
    }

    public synchronized void finalizeReservation(String commandId, ReservationStatus status) throws IOException {
        commands.put(commandId, new Entry(status, System.currentTimeMillis()));
        flush();
    }

    public synchronized Optional<CommandReservation> get(String commandId) {
        Entry entry = commands.get(commandId);
        return entry == null ? Optional.empty() : Optional.of(new CommandReservation(commandId, entry.status, entry.timestamp));
    }

    public synchronized int size() {
        return commands.size();
    }

    private void flush() throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        CacheFile file = new CacheFile();
        file.commands = new LinkedHashMap<>(commands);
        try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            gson.toJson(file, writer);
        }
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private static final class CacheFile {
        Map<String, Entry> commands;
    }

    private static final class Entry {
        ReservationStatus status;
        long timestamp;

        Entry(ReservationStatus status, long timestamp) {
            this.status = status;
            this.timestamp = timestamp;
        }
    }
}
