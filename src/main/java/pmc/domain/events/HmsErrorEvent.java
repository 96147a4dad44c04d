package pmc.domain.events;

import pmc.domain.hms.HmsError;
import pmc.domain.status.StatusSnapshot;

/**
 * Posted on the event bus when a printer reports a new HMS error
 * @param printerSerial printer serial
 * @param printerIp printer address
 * @param error parsed error
 * @param snapshot reading that carried the error
 */
public record HmsErrorEvent(String printerSerial, String printerIp, HmsError error, StatusSnapshot snapshot) {
}
