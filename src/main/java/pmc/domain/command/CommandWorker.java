package pmc.domain.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.common.ECommandType;
import pmc.common.EConnectionType;
import pmc.dal.PrinterConfig;
import pmc.dal.ReservationStatus;
import pmc.dal.ReservationStore;
import pmc.domain.device.DeviceCapabilityAdapter;
import pmc.domain.device.IDeviceHandle;
import pmc.domain.errors.PrinterOperationException;
import pmc.domain.errors.TransportException;
import pmc.domain.errors.TransportMismatchException;
import pmc.domain.errors.UnsupportedCommandException;
import pmc.domain.start.PrintStartProtocol;
import pmc.domain.start.StartOptions;
import pmc.domain.start.StartResult;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Command worker of one printer.
 *
 * <p>Commands arrive through {@link #submit(Command)} (routed by {@link RecipientCommandRouter}) or, when
 * queue polling is enabled, from the cloud queue every poll interval. Each command is reserved in the
 * {@link ReservationStore} before it runs, so a command id executes at most once, also across restarts.
 * No exception leaves the worker loop; only {@link #stop(long)} ends it.</p>
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 13/10/2026
 */
public class CommandWorker {
    private static final Logger logger = LoggerFactory.getLogger(CommandWorker.class);

    private static final Command POISON = new Command("", "", null, null, null);

    private final PrinterConfig printer;
    private final IDeviceHandle device;
    private final DeviceCapabilityAdapter adapter;
    private final ICommandQueue queue;
    private final ReservationStore reservations;
    private final CommandExecutor executor;
    private final long pollIntervalMs;
    private final int connectTimeoutSeconds;
    private final boolean pollQueue;
    private final PrintStartProtocol startProtocol;

    private final BlockingQueue<Command> inbox = new LinkedBlockingQueue<>();
    private volatile boolean running;
    private CountDownLatch finished = new CountDownLatch(0);
    private int pollFailures;

    public CommandWorker(PrinterConfig printer, IDeviceHandle device, ICommandQueue queue, ReservationStore reservations,
                         CommandExecutor executor, int pollIntervalSec, int connectTimeoutSeconds, boolean pollQueue) {
        this(printer, device, queue, reservations, executor, null, pollIntervalSec, connectTimeoutSeconds, pollQueue);
    }

    /**
     * @param startProtocol carries {@code startPrint} commands, null when this worker does not start prints
     */
    public CommandWorker(PrinterConfig printer, IDeviceHandle device, ICommandQueue queue, ReservationStore reservations,
                         CommandExecutor executor, PrintStartProtocol startProtocol, int pollIntervalSec,
                         int connectTimeoutSeconds, boolean pollQueue) {
        this.printer = printer;
        this.device = device;
        this.adapter = new DeviceCapabilityAdapter(device);
        this.queue = queue;
        this.reservations = reservations;
        this.executor = executor;
        this.pollIntervalMs = pollIntervalSec * 1000L;
        this.connectTimeoutSeconds = connectTimeoutSeconds;
        this.pollQueue = pollQueue;
        this.startProtocol = startProtocol;
    }

    public String getSerial() {
        return printer.serialNumber();
    }

    public String getIpAddress() {
        return printer.ipAddress();
    }

    /**
     * Hand a command to this worker
     */
    public void submit(Command command) {
        inbox.offer(command);
    }

    public int getInboxSize() {
        return (int) inbox.stream().filter(command -> command != POISON).count();
    }

    public synchronized void start(ExecutorService executorService) {
        if (running) {
            return;
        }
        running = true;
        finished = new CountDownLatch(1);
        executorService.submit(this::runLoop);
        logger.info("[{}] Command worker started (queue polling {})", printer.toCredentials().describe(),
                pollQueue ? "every " + pollIntervalMs / 1000 + "s" : "disabled");
    }

    /**
     * Signal stop and wait up to the timeout for the loop to finish
     */
    public void stop(long joinTimeoutMs) {
        CountDownLatch done;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            done = finished;
        }
        inbox.offer(POISON);
        try {
            if (!done.await(joinTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.warn("[{}] Command worker did not stop within {}ms", getSerial(), joinTimeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    private void runLoop() {
        try {
            while (running) {
                if (pollQueue) {
                    pollQueueOnce();
                }
                long deadline = System.currentTimeMillis() + pollIntervalMs;
                long remaining;
                while (running && (remaining = deadline - System.currentTimeMillis()) > 0) {
                    Command command = inbox.poll(remaining, TimeUnit.MILLISECONDS);
                    if (command == null || command == POISON) {
                        continue;
                    }
                    processCommand(command);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            logger.error("[{}] Command worker loop failed", getSerial(), e);
        } finally {
            running = false;
            finished.countDown();
            logger.info("[{}] Command worker stopped", getSerial());
        }
    }

    void pollQueueOnce() {
        List<Command> commands;
        try {
            commands = queue.fetchCommands(printer.serialNumber(), printer.ipAddress());
            if (pollFailures > 0) {
                logger.info("[{}] Command queue reachable again after {} failure(s)", getSerial(), pollFailures);
            }
            pollFailures = 0;
        } catch (IOException e) {
            if (pollFailures++ == 0) {
                logger.warn("[{}] Command poll failed: {}", getSerial(), e.getMessage());
            }
            commands = Collections.emptyList();
        }
        for (Command command : commands) {
            processCommand(command);
        }
    }

    /**
     * Reserve, acknowledge, execute, report and finalize one command
     * @return the outcome, null when the command was skipped
     */
    public CommandOutcome processCommand(Command command) {
        String commandId = command.commandId();
        String who = printer.toCredentials().describe();
        if (commandId == null || commandId.isBlank()) {
            logger.warn("[{}] Ignoring command without id: {}", who, command);
            return null;
        }

        try {
            if (!reservations.tryReserve(commandId)) {
                logger.info("[{}] Command {} already handled, skipping", who, commandId);
                return null;
            }
        } catch (IOException e) {
            logger.error("[{}] Cannot persist reservation of {}, not executing: {}", who, commandId, e.getMessage());
            return null;
        }

        try {
            queue.acknowledge(getSerial(), commandId, CommandOutcome.PROCESSING, "Command received", null);
        } catch (IOException e) {
            logger.warn("[{}] Acknowledge of {} failed: {}", who, commandId, e.getMessage());
        }

        CommandOutcome outcome = execute(command, who);

        try {
            queue.reportResult(outcome);
        } catch (IOException e) {
            logger.warn("[{}] Result report of {} failed: {}", who, commandId, e.getMessage());
        }
        try {
            reservations.finalizeReservation(commandId, ReservationStatus.fromOutcome(outcome.isSuccess()));
        } catch (IOException e) {
            logger.error("[{}] Cannot persist final state of {}: {}", who, commandId, e.getMessage());
        }
        return outcome;
    }

    private CommandOutcome execute(Command command, String who) {
        String commandId = command.commandId();
        try {
            if (!device.isConnected()) {
                device.connect(connectTimeoutSeconds);
            }
            String message = command.type().filter(type -> type == ECommandType.START_PRINT).isPresent()
                    ? startPrint(command)
                    : executor.execute(command, adapter);
            logger.info("[{}] Command {} ({}) completed: {}", who, commandId, command.commandType(), message);
            return CommandOutcome.completed(commandId, message);
        } catch (UnsupportedCommandException e) {
            logger.warn("[{}] Command {} rejected: {}", who, commandId, e.getMessage());
            return CommandOutcome.failed(commandId, e.getMessage());
        } catch (TransportMismatchException e) {
            logger.error("[{}] Command {} rejected: {}", who, commandId, e.getMessage());
            return CommandOutcome.failed(commandId, e.getMessage());
        } catch (TransportException e) {
            logger.warn("[{}] Command {} failed, printer unreachable: {}", who, commandId, e.getMessage());
            return CommandOutcome.failed(commandId, "Printer unreachable: " + e.getMessage());
        } catch (PrinterOperationException e) {
            logger.warn("[{}] Command {} ({}) failed: {}", who, commandId, command.commandType(), e.getMessage());
            return CommandOutcome.failed(commandId, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("[{}] Command {} failed unexpectedly", who, commandId, e);
            return CommandOutcome.failed(commandId, "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Start a file already stored on the printer.
     * Metadata: fileName (required), paramPath, useAms, plateIndex, transport (or connectionMethod).
     */
    private String startPrint(Command command) throws PrinterOperationException {
        String serial = getSerial();
        if (startProtocol == null) {
            throw new UnsupportedCommandException(serial, command.commandType());
        }
        String fileName = command.metadataString("fileName");
        if (fileName == null) {
            fileName = command.metadataString("file");
        }
        if (fileName == null) {
            throw new PrinterOperationException(serial, "startPrint requires metadata.fileName");
        }
        StartOptions defaults = StartOptions.defaults();
        String useAms = command.metadataString("useAms");
        Double plate = command.metadataDouble("plateIndex", "plate");
        String transport = command.metadataString("transport");
        if (transport == null) {
            transport = command.metadataString("connectionMethod");
        }
        EConnectionType requiredTransport = null;
        if (transport != null) {
            String requested = transport;
            requiredTransport = EConnectionType.fromValue(transport)
                    .orElseThrow(() -> new PrinterOperationException(serial, "Unknown transport '" + requested + "'"));
        }
        StartOptions options = new StartOptions(
                useAms == null ? defaults.useAms() : Boolean.parseBoolean(useAms.toLowerCase(Locale.ROOT)),
                plate == null ? defaults.plateIndex() : plate.intValue(),
                requiredTransport);

        StartResult result = startProtocol.startPrint(printer, device, fileName, command.metadataString("paramPath"), options);
        if (!result.acknowledged()) {
            throw new PrinterOperationException(serial, "Printer did not confirm start of " + fileName
                    + " (state " + result.state() + ")");
        }
        return "Print started: " + fileName + (result.fallbackTriggered() ? " (without AMS)" : "");
    }
}
