package pmc.domain.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.common.PrinterConstants;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Polls the command queue for the whole recipient and hands each command to the worker of its printer.
 *
 * <p>Commands for printers without a registered worker wait in an in-memory backlog, in arrival order,
 * until a worker with a matching serial (or address) registers. The queue repeats a command until it is
 * acknowledged, so the backlog holds each command id once. Unregistering a worker leaves the backlog
 * untouched.</p>
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 14/10/2026
 */
public class RecipientCommandRouter {
    private static final Logger logger = LoggerFactory.getLogger(RecipientCommandRouter.class);

    private final ICommandQueue queue;
    private final int pollIntervalSec;

    private final Map<String, CommandWorker> workers = new LinkedHashMap<>();
    private final Map<String, Command> backlog = new LinkedHashMap<>();
    private final Object pollLock = new Object();

    private ScheduledFuture<?> pollTask;
    private int consecutiveFailures;

    public RecipientCommandRouter(ICommandQueue queue, int pollIntervalSec) {
        this.queue = queue;
        this.pollIntervalSec = pollIntervalSec;
    }

    /**
     * Register the worker of a printer and drain the backlog commands targeting it
     * @return number of backlog commands handed over
     */
    public synchronized int registerWorker(String serial, CommandWorker worker) {
        workers.put(serial, worker);
        int drained = 0;
        Iterator<Command> iterator = backlog.values().iterator();
        while (iterator.hasNext()) {
            Command command = iterator.next();
            if (matches(command, serial, worker)) {
                iterator.remove();
                worker.submit(command);
                drained++;
            }
        }
        logger.info("Worker registered for {} ({} backlog command(s) drained, {} still queued)", serial, drained, backlog.size());
        return drained;
    }

    public synchronized void unregisterWorker(String serial) {
        if (workers.remove(serial) != null) {
            logger.info("Worker unregistered for {} (backlog kept: {})", serial, backlog.size());
        }
    }

    /**
     * Hand a command to its worker, or keep it in the backlog
     * @return true when delivered to a worker
     */
    public synchronized boolean route(Command command) {
        for (Map.Entry<String, CommandWorker> entry : workers.entrySet()) {
            if (matches(command, entry.getKey(), entry.getValue())) {
                entry.getValue().submit(command);
                return true;
            }
        }
        String commandId = command.commandId();
        if (commandId == null || commandId.isBlank()) {
            logger.warn("Dropping command without id and without a worker: {}", command);
            return false;
        }
        if (backlog.putIfAbsent(commandId, command) == null) {
            logger.debug("No worker for {}, queued in backlog ({})", command, backlog.size());
        }
        return false;
    }

    private static boolean matches(Command command, String serial, CommandWorker worker) {
        List<String> serials = command.serialCandidates();
        if (!serials.isEmpty()) {
            return serials.contains(serial);
        }
        String ip = command.resolveTargetIp();
        return ip != null && worker != null && ip.equals(worker.getIpAddress());
    }

    public synchronized List<Command> getBacklog() {
        return List.copyOf(backlog.values());
    }

    public synchronized int getWorkerCount() {
        return workers.size();
    }

    public void start(ScheduledExecutorService executorService) {
        synchronized (pollLock) {
            if (pollTask != null) {
                return;
            }
            pollTask = executorService.scheduleWithFixedDelay(this::pollOnce, 0, pollIntervalSec, TimeUnit.SECONDS);
        }
        logger.info("Command router polling every {}s", pollIntervalSec);
    }

    public void stop() {
        synchronized (pollLock) {
            if (pollTask != null) {
                pollTask.cancel(false);
                pollTask = null;
            }
        }
    }

    /**
     * Poll now, outside the schedule
     * @return number of commands received, -1 when the poll failed
     */
    public int forcePoll() {
        return pollOnce();
    }

    int pollOnce() {
        List<Command> commands;
        synchronized (pollLock) {
            try {
                commands = queue.fetchCommands(null, null);
            } catch (IOException | RuntimeException e) {
                consecutiveFailures++;
                if (consecutiveFailures == 1 || consecutiveFailures % PrinterConstants.ROUTER_ERROR_LOG_EVERY == 0) {
                    logger.warn("Command poll failed ({} consecutive): {}", consecutiveFailures, e.getMessage());
                }
                return -1;
            }
            if (consecutiveFailures > 0) {
                logger.info("Command poll recovered after {} failure(s)", consecutiveFailures);
                consecutiveFailures = 0;
            }
        }
        for (Command command : commands) {
            route(command);
        }
        if (!commands.isEmpty()) {
            logger.info("Received {} command(s)", commands.size());
        }
        return commands.size();
    }
}
