package pmc.dal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.common.EConnectionType;
import pmc.common.PrinterConstants;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Main configuration service - entry point for all configuration needs
 * @author Martin Sustik <sustik@herman.cz>
 * @since 05/10/2026
 */
public class ConfigurationService {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationService.class);

    private final ConfigurationLoader loader;
    private List<PrinterConfig> printerConfigs;
    private CloudConfig cloudConfig;
    private MonitorConfig monitorConfig;
    private TransferConfig transferConfig;
    private StorageConfig storageConfig;
    private ServerConfig serverConfig;

    public ConfigurationService() throws ConfigurationException {
        this(new ConfigurationLoader());
    }

    public ConfigurationService(ConfigurationLoader loader) throws ConfigurationException {
        this.loader = loader;
        loadAll();
    }

    private void loadAll() throws ConfigurationException {
        this.printerConfigs = loadPrinterConfigurations();
        this.cloudConfig = loadCloudConfiguration();
        this.monitorConfig = loadMonitorConfiguration();
        this.transferConfig = loadTransferConfiguration();
        this.storageConfig = loadStorageConfiguration();
        this.serverConfig = loadServerConfiguration();
    }

    /**
     * Load printer list: printers.count and printers.N.* (N starting at 1)
     */
    private List<PrinterConfig> loadPrinterConfigurations() throws ConfigurationException {
        int count = loader.getInt("printers.count", 0);
        List<PrinterConfig> configs = new ArrayList<>();
        Set<String> serials = new HashSet<>();

        for (int i = 1; i <= count; i++) {
            String prefix = "printers." + i + ".";
            String serial = loader.getString(prefix + "serial", "");
            String nickname = loader.getString(prefix + "nickname", serial);

            String connectionTypeStr = loader.getString(prefix + "connection", "LAN");
            EConnectionType connectionType = EConnectionType.fromValue(connectionTypeStr).orElse(null);
            if (connectionType == null) {
                logger.warn("Invalid connection type '{}' for printer #{}, defaulting to LAN", connectionTypeStr, i);
                connectionType = EConnectionType.LAN;
            }

            PrinterConfig config;
            switch (connectionType) {
                case LAN:
                    config = PrinterConfig.lan(serial, loader.getString(prefix + "ip", ""),
                            loader.getString(prefix + "access.code", ""), nickname);
                    logger.info("Configured LAN printer: {} ({}) at {}", nickname, serial, config.ipAddress());
                    break;

                case CLOUD:
                    config = PrinterConfig.cloud(serial, loader.getString(prefix + "ip", ""),
                            loader.getString(prefix + "access.code", ""), nickname);
                    logger.info("Configured CLOUD printer: {} ({})", nickname, serial);
                    break;

                case NONE:
                    config = PrinterConfig.simulated(serial, nickname);
                    logger.info("Configured SIMULATED printer: {} ({})", nickname, serial);
                    break;

                default:
                    throw new ConfigurationException("Unsupported connection type: " + connectionType);
            }

            config.validate();
            if (!serials.add(config.serialNumber())) {
                throw new ConfigurationException(prefix + "serial", "Duplicate printer serial: " + config.serialNumber());
            }
            configs.add(config);
        }

        if (configs.isEmpty()) {
            logger.warn("No printers configured (printers.count=0)");
        }
        return List.copyOf(configs);
    }

    private CloudConfig loadCloudConfiguration() throws ConfigurationException {
        boolean enabled = loader.getBoolean("cloud.enabled", true);
        String baseUrl = loader.getString("cloud.base.url", "http://localhost:8080");
        String recipientId = loader.getString("cloud.recipient.id", "");
        String apiKey = loader.getString("cloud.api.key", "");

        int pollSec = loader.getInt("control.poll.sec", "CONTROL_POLL_SEC", PrinterConstants.DEFAULT_CONTROL_POLL_SEC);
        if (pollSec < PrinterConstants.MIN_CONTROL_POLL_SEC) {
            logger.warn("control.poll.sec={} below minimum, using {}", pollSec, PrinterConstants.MIN_CONTROL_POLL_SEC);
            pollSec = PrinterConstants.MIN_CONTROL_POLL_SEC;
        }
        int connectTimeout = loader.getInt("connect.timeout.seconds", "CONNECT_TIMEOUT_SECONDS",
                PrinterConstants.DEFAULT_CONNECT_TIMEOUT_SECONDS);

        int heartbeat = Math.max(PrinterConstants.MIN_HEARTBEAT_INTERVAL_SEC,
                loader.getInt("heartbeat.interval.sec", PrinterConstants.DEFAULT_HEARTBEAT_INTERVAL_SEC));
        int statusReport = Math.max(1,
                loader.getInt("status.report.interval.sec", PrinterConstants.DEFAULT_STATUS_REPORT_INTERVAL_SEC));

        CloudConfig config = new CloudConfig(enabled, baseUrl, recipientId, apiKey, pollSec, connectTimeout, heartbeat, statusReport);
        config.validate();
        return config;
    }

    private MonitorConfig loadMonitorConfiguration() throws ConfigurationException {
        double poll = Math.max(PrinterConstants.MIN_STATUS_POLL_SEC,
                loader.getDouble("status.poll.interval.sec", PrinterConstants.DEFAULT_STATUS_POLL_SEC));
        double heartbeat = Math.max(PrinterConstants.MIN_HEARTBEAT_SEC,
                loader.getDouble("status.heartbeat.interval.sec", PrinterConstants.DEFAULT_HEARTBEAT_SEC));
        double reconnect = Math.max(0.0,
                loader.getDouble("status.reconnect.delay.sec", PrinterConstants.DEFAULT_RECONNECT_DELAY_SEC));

        MonitorConfig config = new MonitorConfig(
                poll,
                heartbeat,
                reconnect,
                loader.getInt("status.stall.heartbeats", PrinterConstants.DEFAULT_STALL_HEARTBEATS),
                loader.getDouble("status.numeric.epsilon", PrinterConstants.DEFAULT_NUMERIC_EPSILON),
                Math.max(1, loader.getInt("completion.debounce.count", PrinterConstants.DEFAULT_COMPLETION_DEBOUNCE)),
                loader.getInt("start.ack.timeout.sec", PrinterConstants.DEFAULT_START_ACK_TIMEOUT_SEC),
                loader.getInt("start.ack.poll.sec", PrinterConstants.DEFAULT_START_ACK_POLL_SEC));
        config.validate();
        return config;
    }

    private TransferConfig loadTransferConfiguration() throws ConfigurationException {
        List<String> commands = loader.getList("transfer.reactivate.commands", "BAMBU_FTPS_REACTIVATE_STOR_COMMANDS",
                PrinterConstants.DEFAULT_REACTIVATE_COMMANDS);
        TransferConfig config = new TransferConfig(commands,
                loader.getInt("transfer.chunk.size", PrinterConstants.DEFAULT_TRANSFER_CHUNK_SIZE));
        config.validate();
        return config;
    }

    private StorageConfig loadStorageConfiguration() throws ConfigurationException {
        StorageConfig config = new StorageConfig(
                loader.getPath("command.cache.path", "~/.printmaster/command-cache.json"),
                loader.getPath("job.store.path", "~/.printmaster/jobs.json"));
        config.validate();
        return config;
    }

    private ServerConfig loadServerConfiguration() throws ConfigurationException {
        int port = loader.getInt("server.port", 7070);
        String host = loader.getString("server.host", "0.0.0.0");
        boolean enabled = loader.getBoolean("server.enabled", true);
        int threadPoolSize = loader.getInt("server.thread.pool", 8);

        String modeStr = loader.getString("server.startup.mode", "LENIENT");
        StartupMode startupMode;
        try {
            startupMode = StartupMode.valueOf(modeStr.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid startup mode '{}', using LENIENT", modeStr);
            startupMode = StartupMode.LENIENT;
        }

        ServerConfig config = new ServerConfig(port, host, enabled, threadPoolSize, startupMode);
        config.validate();
        return config;
    }

    public List<PrinterConfig> getPrinterConfigurations() {
        return printerConfigs;
    }

    public CloudConfig getCloudConfiguration() {
        return cloudConfig;
    }

    public MonitorConfig getMonitorConfiguration() {
        return monitorConfig;
    }

    public TransferConfig getTransferConfiguration() {
        return transferConfig;
    }

    public StorageConfig getStorageConfiguration() {
        return storageConfig;
    }

    public ServerConfig getServerConfiguration() {
        return serverConfig;
    }

    /**
     * Reload configuration
     */
    public void reload() throws ConfigurationException {
        logger.info("Reloading configuration...");
        loadAll();
        logger.info("Configuration reloaded successfully");
        logger.info("Printers: {}", printerConfigs);
        logger.info("Cloud: {}", cloudConfig);
        logger.info("Server: {}", serverConfig);
    }
}
