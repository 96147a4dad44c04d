package pmc.domain.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.dal.PrinterConfig;
import pmc.domain.errors.TransportException;

/**
 * Device factory used when no vendor driver module is installed.
 * Simulated printers are created in-process, LAN and CLOUD printers need a vendor driver binding.
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 06/10/2026
 */
public class DefaultDeviceFactory implements IDeviceFactory {
    private static final Logger logger = LoggerFactory.getLogger(DefaultDeviceFactory.class);

    @Override
    public IDeviceHandle create(PrinterConfig config) throws TransportException {
        if (config.isSimulated()) {
            logger.info("Creating simulated printer device for {}", config.serialNumber());
            return new SimulatedPrinterDevice(config.serialNumber());
        }
        throw new TransportException(config.serialNumber(),
                "No vendor driver bound for " + config.connectionType() + " printer " + config.toCredentials().describe());
    }
}
