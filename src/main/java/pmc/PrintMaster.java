package pmc;

import com.google.inject.Guice;
import com.google.inject.Injector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.dal.ConfigurationService;
import pmc.domain.StartupException;
import pmc.domain.orchestration.FleetController;

/**
 * Main entry point of the PrintMaster fleet client
 * @author Martin Sustik <sustik@herman.cz>
 * @since 05/10/2026
 */
public class PrintMaster {
    private static final Logger logger = LoggerFactory.getLogger(PrintMaster.class);

    public static void main(String[] args) {
        logger.info("Starting PrintMaster client...");

        try {
            ConfigurationService configService = new ConfigurationService();

            logger.info("Configuration loaded successfully");
            logger.debug("Printers: {}", configService.getPrinterConfigurations());
            logger.debug("Cloud: {}", configService.getCloudConfiguration());
            logger.debug("Monitor: {}", configService.getMonitorConfiguration());
            logger.debug("Server: {}", configService.getServerConfiguration());

            Injector injector = Guice.createInjector(new GuiceModule(configService));

            FleetController app = new FleetController(configService, injector);
            app.start();

        } catch (StartupException e) {
            logger.error("Client startup failed:");
            logger.error("  Mode: {}", e.getMode());
            logger.error("  Failed printers: {}", e.getFailedServices().size());
            for (var result : e.getFailedServices()) {
                logger.error("    - {}", result);
            }
            System.exit(1);

        } catch (Exception e) {
            logger.error("Failed to start client", e);
            System.exit(1);
        }
    }
}
