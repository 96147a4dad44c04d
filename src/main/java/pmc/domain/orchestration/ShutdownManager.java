package pmc.domain.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.domain.cloud.HeartbeatService;
import pmc.domain.command.RecipientCommandRouter;

import java.util.Collection;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Manages graceful shutdown of the client
 * @author Martin Sustik <sustik@herman.cz>
 * @since 16/10/2026
 */
public class ShutdownManager {
    private static final Logger logger = LoggerFactory.getLogger(ShutdownManager.class);

    static final long AGENT_JOIN_TIMEOUT_MS = 5000;

    private final WebServerManager webServerManager;
    private final RecipientCommandRouter router;
    private final HeartbeatService heartbeatService;
    private final Supplier<Collection<PrinterAgent>> agents;
    private final ExecutorService schedulerService;
    private final ExecutorService deviceExecutor;

    private volatile boolean shutdownHookRegistered = false;
    private volatile boolean shutDown = false;

    public ShutdownManager(WebServerManager webServerManager, RecipientCommandRouter router, HeartbeatService heartbeatService,
                           Supplier<Collection<PrinterAgent>> agents, ExecutorService schedulerService, ExecutorService deviceExecutor) {
        this.webServerManager = webServerManager;
        this.router = router;
        this.heartbeatService = heartbeatService;
        this.agents = agents;
        this.schedulerService = schedulerService;
        this.deviceExecutor = deviceExecutor;
    }

    public void registerShutdownHook() {
        if (!shutdownHookRegistered) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "pmc-shutdown"));
            shutdownHookRegistered = true;
        }
    }

    /**
     * Graceful shutdown, safe to call more than once
     */
    public synchronized void shutdown() {
        if (shutDown) {
            return;
        }
        shutDown = true;
        logger.info("Shutting down PrintMaster client...");

        try {
            if (webServerManager != null) {
                webServerManager.stop();
            }
            router.stop();
            heartbeatService.stop();

            for (PrinterAgent agent : agents.get()) {
                agent.stop(AGENT_JOIN_TIMEOUT_MS);
            }

            terminate(schedulerService, "Scheduler");
            terminate(deviceExecutor, "Device executor");

            logger.info("Client shut down successfully");
        } catch (Exception e) {
            logger.error("Error during shutdown", e);
        }
    }

    private static void terminate(ExecutorService executorService, String name) {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("{} did not terminate in time, forcing shutdown", name);
                executorService.shutdownNow();
                if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                    logger.error("{} did not terminate", name);
                }
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
