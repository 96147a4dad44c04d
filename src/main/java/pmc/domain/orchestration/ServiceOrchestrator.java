package pmc.domain.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.dal.PrinterConfig;
import pmc.dal.StartupMode;
import pmc.domain.ServiceInitializationResult;
import pmc.domain.StartupException;
import pmc.domain.device.IDeviceFactory;
import pmc.domain.device.IDeviceHandle;
import pmc.domain.errors.TransportException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestrates printer agent initialization and evaluates the startup mode
 * @author Martin Sustik <sustik@herman.cz>
 * @since 16/10/2026
 */
public class ServiceOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(ServiceOrchestrator.class);

    /**
     * Builds the agent of a printer around its device handle
     */
    @FunctionalInterface
    public interface AgentAssembler {
        PrinterAgent assemble(PrinterConfig config, IDeviceHandle device);
    }

    private final IDeviceFactory deviceFactory;
    private final AgentAssembler assembler;

    private final Map<String, ServiceInitializationResult> initializationResults = new LinkedHashMap<>();
    private final Map<String, PrinterAgent> agents = new LinkedHashMap<>();

    public ServiceOrchestrator(IDeviceFactory deviceFactory, AgentAssembler assembler) {
        this.deviceFactory = deviceFactory;
        this.assembler = assembler;
    }

    /**
     * Create a device and agent per printer and open each device session.
     * A printer whose session fails still gets an agent, its subscriber keeps reconnecting.
     * @return one result per printer
     */
    public List<ServiceInitializationResult> initializeAllPrinters(List<PrinterConfig> printers) {
        List<ServiceInitializationResult> results = new ArrayList<>();
        for (PrinterConfig printer : printers) {
            ServiceInitializationResult result = initializePrinter(printer);
            results.add(result);
            initializationResults.put(printer.serialNumber(), result);
        }
        return results;
    }

    private ServiceInitializationResult initializePrinter(PrinterConfig printer) {
        String name = "Printer " + printer.toCredentials().describe() + (printer.isSimulated() ? " (Simulated)" : "");
        logger.info("Initializing {}...", name);
        long startTime = System.currentTimeMillis();

        IDeviceHandle device;
        try {
            device = deviceFactory.create(printer);
        } catch (TransportException e) {
            long duration = System.currentTimeMillis() - startTime;
            logger.error("✗ {} has no device driver: {}", name, e.getMessage());
            return ServiceInitializationResult.failure(name, e, duration);
        }

        PrinterAgent agent = assembler.assemble(printer, device);
        agents.put(printer.serialNumber(), agent);
        try {
            agent.initialize();
            long duration = System.currentTimeMillis() - startTime;
            logger.info("✓ {} connected in {}ms", name, duration);
            return ServiceInitializationResult.success(name, duration);
        } catch (TransportException e) {
            long duration = System.currentTimeMillis() - startTime;
            logger.error("✗ {} connection failed after {}ms: {}", name, duration,
                    printer.toCredentials().maskSecrets(e.getMessage()));
            return ServiceInitializationResult.failure(name, e, duration);
        }
    }

    /**
     * Evaluate if startup requirements are met based on mode
     * @throws StartupException if requirements not met
     */
    public void evaluateStartupRequirements(StartupMode mode, List<ServiceInitializationResult> results) throws StartupException {
        long successful = results.stream().filter(ServiceInitializationResult::isSuccess).count();
        long total = results.size();

        logger.info("Printer initialization complete: {}/{} printers connected", successful, total);

        switch (mode) {
            case STRICT:
                if (successful != total) {
                    String message = String.format("STRICT mode requires all printers to initialize. Only %d/%d printers initialized successfully.",
                            successful, total);
                    throw new StartupException(message, mode, results);
                }
                logger.info("✓ STRICT mode requirement met: all printers initialized");
                break;

            case LENIENT:
                if (total > 0 && successful == 0) {
                    throw new StartupException("LENIENT mode requires at least one printer to initialize. All printers failed to initialize.",
                            mode, results);
                }
                if (successful < total) {
                    logger.warn("⚠ LENIENT mode: {}/{} printers initialized (others keep reconnecting)", successful, total);
                } else {
                    logger.info("✓ LENIENT mode requirement met: all printers initialized");
                }
                break;

            case PERMISSIVE:
                if (successful < total) {
                    logger.warn("⚠ PERMISSIVE mode: {}/{} printers initialized", successful, total);
                } else {
                    logger.info("✓ PERMISSIVE mode: all printers initialized");
                }
                break;
        }
    }

    /**
     * Log startup summary
     */
    public void logStartupSummary(List<ServiceInitializationResult> results, boolean serverEnabled, String serverHost, int serverPort) {
        logger.info("========================================");
        logger.info("Startup Complete - Client Status:");
        logger.info("========================================");
        for (ServiceInitializationResult result : results) {
            logger.info(result.toString());
        }
        if (serverEnabled) {
            logger.info("Status API: http://{}:{}/api/health", serverHost, serverPort);
        } else {
            logger.info("Status API: DISABLED");
        }
        logger.info("========================================");
    }

    public Map<String, PrinterAgent> getAgents() {
        return Collections.unmodifiableMap(agents);
    }

    public Map<String, ServiceInitializationResult> getInitializationResults() {
        return Collections.unmodifiableMap(initializationResults);
    }
}
