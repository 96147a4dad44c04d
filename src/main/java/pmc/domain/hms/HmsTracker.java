package pmc.domain.hms;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers the active HMS code per printer so each occurrence is reported once.
 * The code is forgotten when a reading no longer carries it.
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 12/10/2026
 */
public class HmsTracker {
    private static final Logger logger = LoggerFactory.getLogger(HmsTracker.class);

    private final Map<String, String> activeCodes = new ConcurrentHashMap<>();

    /**
     * @return the parsed error when the code is new for this printer, empty otherwise
     */
    public Optional<HmsError> observe(String printerSerial, String hmsCode) {
        if (hmsCode == null || hmsCode.isBlank()) {
            String cleared = activeCodes.remove(printerSerial);
            if (cleared != null) {
                logger.info("[{}] HMS error cleared: {}", printerSerial, cleared);
            }
            return Optional.empty();
        }

        HmsError error = HmsParser.parse(hmsCode);
        String previous = activeCodes.put(printerSerial, error.hmsCode());
        if (error.hmsCode().equals(previous)) {
            return Optional.empty();
        }
        logger.warn("[{}] HMS error {} ({}, {}): {}", printerSerial, error.hmsCode(), error.module(),
                error.severity().wireValue(), error.description());
        return Optional.of(error);
    }

    public Optional<String> getActiveCode(String printerSerial) {
        return Optional.ofNullable(activeCodes.get(printerSerial));
    }
}
