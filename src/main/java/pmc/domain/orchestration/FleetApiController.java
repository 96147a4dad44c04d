package pmc.domain.orchestration;

import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.common.EConnectionType;
import pmc.domain.command.RecipientCommandRouter;
import pmc.domain.errors.PrinterOperationException;
import pmc.domain.jobs.JobTracker;
import pmc.domain.start.StartOptions;
import pmc.domain.start.StartResult;
import pmc.domain.status.StatusSnapshot;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.path;
import static io.javalin.apibuilder.ApiBuilder.post;

/**
 * REST API of the local status endpoint
 * @author Martin Sustik <sustik@herman.cz>
 * @since 17/10/2026
 */
public class FleetApiController {
    private static final Logger logger = LoggerFactory.getLogger(FleetApiController.class);

    private final Supplier<Map<String, PrinterAgent>> agents;
    private final JobTracker jobTracker;
    private final RecipientCommandRouter router;

    public FleetApiController(Supplier<Map<String, PrinterAgent>> agents, JobTracker jobTracker, RecipientCommandRouter router) {
        this.agents = agents;
        this.jobTracker = jobTracker;
        this.router = router;
    }

    /**
     * Register all REST API routes
     */
    public void registerRoutes() {
        path("/api", () -> {
            get("/health", this::health);
            path("/printers", () -> {
                get("", this::listPrinters);
                get("/{serial}/status", this::printerStatus);
                post("/{serial}/print", this::print);
            });
            path("/jobs", () -> {
                get("", this::listJobs);
                get("/pending", this::pendingJobs);
            });
            post("/router/poll", this::forcePoll);
        });
    }

    private void health(Context ctx) {
        Map<String, PrinterAgent> current = agents.get();
        long connected = current.values().stream().filter(agent -> agent.getDevice().isConnected()).count();
        FleetViews.HealthView health = new FleetViews.HealthView(connected > 0 || current.isEmpty() ? "UP" : "DEGRADED",
                current.size(), connected, router.getBacklog().size(), jobTracker.getPendingJobs().size());
        ctx.json(ApiResponse.success(health));
    }

    private void listPrinters(Context ctx) {
        ctx.json(ApiResponse.success(agents.get().values().stream()
                .map(FleetViews.PrinterView::of)
                .collect(Collectors.toList())));
    }

    private void printerStatus(Context ctx) {
        PrinterAgent agent = agents.get().get(ctx.pathParam("serial"));
        if (agent == null) {
            ctx.status(404).json(ApiResponse.error("Unknown printer: " + ctx.pathParam("serial")));
            return;
        }
        StatusSnapshot snapshot = agent.getSubscriber().getLastSnapshot();
        if (snapshot == null) {
            ctx.status(503).json(ApiResponse.error("No telemetry received yet"));
            return;
        }
        ctx.json(ApiResponse.success(snapshot));
    }

    private void print(Context ctx) {
        PrinterAgent agent = agents.get().get(ctx.pathParam("serial"));
        if (agent == null) {
            ctx.status(404).json(ApiResponse.error("Unknown printer: " + ctx.pathParam("serial")));
            return;
        }
        FleetViews.PrintRequest request = ctx.bodyAsClass(FleetViews.PrintRequest.class);
        if (request == null || request.getFile() == null || request.getFile().isBlank()) {
            ctx.status(400).json(ApiResponse.error("file is required"));
            return;
        }
        Path file = Paths.get(request.getFile());
        if (!Files.isReadable(file)) {
            ctx.status(400).json(ApiResponse.error("File not readable: " + file));
            return;
        }
        EConnectionType transport = null;
        if (request.getTransport() != null) {
            transport = EConnectionType.fromValue(request.getTransport()).orElse(null);
            if (transport == null) {
                ctx.status(400).json(ApiResponse.error("Unknown transport: " + request.getTransport()));
                return;
            }
        }
        String remoteName = request.getRemoteName() != null ? request.getRemoteName() : file.getFileName().toString();
        try {
            StartResult result = agent.uploadAndStart(file, remoteName, request.getParamPath(),
                    new StartOptions(request.isUseAms(), request.getPlateIndex(), transport));
            ctx.json(ApiResponse.success(result.acknowledged() ? "Print started" : "Print not acknowledged", result));
        } catch (PrinterOperationException e) {
            logger.warn("[{}] Print request failed: {}", agent.getSerial(), e.getMessage());
            ctx.status(502).json(ApiResponse.error(e));
        }
    }

    private void listJobs(Context ctx) {
        ctx.json(ApiResponse.success(jobTracker.getAllJobs().stream()
                .map(FleetViews.JobView::of)
                .collect(Collectors.toList())));
    }

    private void pendingJobs(Context ctx) {
        ctx.json(ApiResponse.success(jobTracker.getPendingJobs().stream()
                .map(FleetViews.JobView::of)
                .collect(Collectors.toList())));
    }

    private void forcePoll(Context ctx) {
        int received = router.forcePoll();
        if (received < 0) {
            ctx.status(502).json(ApiResponse.error("Command poll failed"));
            return;
        }
        ctx.json(ApiResponse.success(Map.of("received", received)));
    }
}
