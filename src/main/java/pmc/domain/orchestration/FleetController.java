package pmc.domain.orchestration;

import com.google.common.eventbus.EventBus;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.gson.Gson;
import com.google.inject.Injector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.dal.CloudConfig;
import pmc.dal.ConfigurationService;
import pmc.dal.MonitorConfig;
import pmc.dal.PrinterConfig;
import pmc.dal.ReservationStore;
import pmc.dal.ServerConfig;
import pmc.dal.StartupMode;
import pmc.domain.ServiceInitializationResult;
import pmc.domain.StartupException;
import pmc.domain.cloud.EventReporter;
import pmc.domain.cloud.HeartbeatService;
import pmc.domain.cloud.StatusReporter;
import pmc.domain.command.CommandExecutor;
import pmc.domain.command.CommandWorker;
import pmc.domain.command.ICommandQueue;
import pmc.domain.command.RecipientCommandRouter;
import pmc.domain.completion.CompletionMonitor;
import pmc.domain.device.IDeviceFactory;
import pmc.domain.device.IDeviceHandle;
import pmc.domain.events.JobEndedEvent;
import pmc.domain.hms.HmsTracker;
import pmc.domain.jobs.JobTracker;
import pmc.domain.start.PrintStartProtocol;
import pmc.domain.status.SnapshotNormalizer;
import pmc.domain.status.StatusSubscriber;
import pmc.domain.transfer.UploadProtocol;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Runs the whole fleet of one recipient: printer agents, command routing, cloud reporting and the local API
 * @author Martin Sustik <sustik@herman.cz>
 * @since 17/10/2026
 */
public class FleetController {
    private static final Logger logger = LoggerFactory.getLogger(FleetController.class);

    private final ConfigurationService configService;
    private final CloudConfig cloudConfig;
    private final MonitorConfig monitorConfig;
    private final ServerConfig serverConfig;
    private final Injector injector;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService deviceExecutor;

    private final JobTracker jobTracker;
    private final RecipientCommandRouter router;
    private final HeartbeatService heartbeatService;
    private final ServiceOrchestrator serviceOrchestrator;
    private final WebServerManager webServerManager;
    private final ShutdownManager shutdownManager;

    public FleetController(ConfigurationService configService, Injector injector) {
        this.configService = configService;
        this.cloudConfig = configService.getCloudConfiguration();
        this.monitorConfig = configService.getMonitorConfiguration();
        this.serverConfig = configService.getServerConfiguration();
        this.injector = injector;

        this.scheduler = Executors.newScheduledThreadPool(serverConfig.threadPoolSize(),
                new ThreadFactoryBuilder().setNameFormat("pmc-scheduler-%d").setDaemon(true).build());
        this.deviceExecutor = Executors.newCachedThreadPool(
                new ThreadFactoryBuilder().setNameFormat("pmc-device-%d").setDaemon(true).build());

        EventBus eventBus = injector.getInstance(EventBus.class);
        this.jobTracker = injector.getInstance(JobTracker.class);
        this.jobTracker.setOnJobEnded(job -> eventBus.post(new JobEndedEvent(job)));
        eventBus.register(injector.getInstance(EventReporter.class));

        this.router = new RecipientCommandRouter(injector.getInstance(ICommandQueue.class), cloudConfig.controlPollSec());
        this.heartbeatService = injector.getInstance(HeartbeatService.class);
        this.serviceOrchestrator = new ServiceOrchestrator(injector.getInstance(IDeviceFactory.class), this::assembleAgent);

        if (serverConfig.enabled()) {
            FleetApiController apiController = new FleetApiController(serviceOrchestrator::getAgents, jobTracker, router);
            this.webServerManager = new WebServerManager(serverConfig, apiController, injector.getInstance(Gson.class));
        } else {
            this.webServerManager = null;
        }
        this.shutdownManager = new ShutdownManager(webServerManager, router, heartbeatService,
                () -> serviceOrchestrator.getAgents().values(), scheduler, deviceExecutor);

        logger.info("FleetController initialized with startup mode: {}", serverConfig.startupMode());
    }

    private PrinterAgent assembleAgent(PrinterConfig printer, IDeviceHandle device) {
        int connectTimeout = cloudConfig.connectTimeoutSec();
        StatusSubscriber subscriber = new StatusSubscriber(printer.toCredentials(), device, monitorConfig,
                injector.getInstance(SnapshotNormalizer.class), connectTimeout);
        CommandWorker worker = new CommandWorker(printer, device, injector.getInstance(ICommandQueue.class),
                injector.getInstance(ReservationStore.class), injector.getInstance(CommandExecutor.class),
                injector.getInstance(PrintStartProtocol.class), cloudConfig.controlPollSec(), connectTimeout, false);
        return new PrinterAgent(printer, device, subscriber, worker,
                injector.getInstance(CompletionMonitor.class), jobTracker, injector.getInstance(HmsTracker.class),
                injector.getInstance(EventBus.class), cloudConfig.enabled() ? injector.getInstance(StatusReporter.class) : null,
                injector.getInstance(UploadProtocol.class), injector.getInstance(PrintStartProtocol.class), connectTimeout);
    }

    public void start() throws StartupException {
        start(serverConfig.startupMode());
    }

    /**
     * Start the client with the given startup mode
     * @throws StartupException if startup requirements are not met
     */
    public void start(StartupMode mode) throws StartupException {
        logger.info("========================================");
        logger.info("Starting PrintMaster client");
        logger.info("Startup Mode: {}", mode);
        logger.info("========================================");

        try {
            // Step 1: Recover jobs that were printing when the previous process ended
            jobTracker.loadFromDatabase();

            // Step 2: Devices and agents
            List<ServiceInitializationResult> results =
                    serviceOrchestrator.initializeAllPrinters(configService.getPrinterConfigurations());

            // Step 3: Evaluate startup success based on mode
            serviceOrchestrator.evaluateStartupRequirements(mode, results);

            // Step 4: Start agents, hand their workers to the router
            for (PrinterAgent agent : serviceOrchestrator.getAgents().values()) {
                agent.start(deviceExecutor);
                router.registerWorker(agent.getSerial(), agent.getWorker());
            }

            // Step 5: Cloud polling and heartbeat
            if (cloudConfig.enabled()) {
                router.start(scheduler);
                heartbeatService.start(scheduler);
            } else {
                logger.warn("Cloud disabled: no command polling, heartbeat or event reporting");
            }

            // Step 6: Local status API
            if (webServerManager != null) {
                webServerManager.start();
            }

            shutdownManager.registerShutdownHook();
            serviceOrchestrator.logStartupSummary(results, serverConfig.enabled(), serverConfig.host(), serverConfig.port());

        } catch (StartupException e) {
            logger.error("Startup failed: {}", e.getMessage());
            shutdownManager.shutdown();
            throw e;
        } catch (Exception e) {
            logger.error("Unexpected error during startup", e);
            shutdownManager.shutdown();
            throw new StartupException("Unexpected startup failure", mode,
                    new ArrayList<>(serviceOrchestrator.getInitializationResults().values()));
        }
    }

    public void shutdown() {
        shutdownManager.shutdown();
    }

    public Map<String, PrinterAgent> getAgents() {
        return serviceOrchestrator.getAgents();
    }

    public RecipientCommandRouter getRouter() {
        return router;
    }

    public JobTracker getJobTracker() {
        return jobTracker;
    }
}
