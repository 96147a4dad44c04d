package pmc.domain.device;

import pmc.dal.PrinterConfig;
import pmc.domain.errors.TransportException;

/**
 * Creates driver handles for configured printers
 * @author Martin Sustik <sustik@herman.cz>
 * @since 06/10/2026
 */
public interface IDeviceFactory {

    IDeviceHandle create(PrinterConfig config) throws TransportException;
}
