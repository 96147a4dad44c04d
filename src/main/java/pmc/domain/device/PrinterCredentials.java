package pmc.domain.device;

/**
 * Identifies one physical printer. The serial number is the key used everywhere else.
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 06/10/2026
 */
public record PrinterCredentials(String ipAddress, String serialNumber, String accessCode, String nickname) {

    /**
     * Human readable identity for log lines: nickname (serial @ ip)
     */
    public String describe() {
        String name = (nickname == null || nickname.isBlank()) ? serialNumber : nickname;
        return String.format("%s (%s @ %s)", name, serialNumber, ipAddress);
    }

    /**
     * Replace every occurrence of the access code in the text with ***
     */
    public String maskSecrets(String text) {
        if (text == null || accessCode == null || accessCode.isEmpty()) {
            return text;
        }
        return text.replace(accessCode, "***");
    }

    @Override
    public String toString() {
        return String.format("PrinterCredentials{serial='%s', ip='%s', nickname='%s', accessCode=***}",
                serialNumber, ipAddress, nickname);
    }
}
