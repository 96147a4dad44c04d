package pmc.common;

import java.util.Locale;
import java.util.Optional;

/**
 * Remote command verbs understood by the command worker
 * @author Martin Sustik <sustik@herman.cz>
 * @since 05/10/2026
 */
public enum ECommandType {
    HEAT("heat"),
    COOLDOWN("cooldown"),
    PAUSE("pause"),
    RESUME("resume"),
    STOP("stop"),
    SET_FAN("setFan"),
    SET_SPEED("setSpeed"),
    SET_FLOW("setFlow"),
    HOME("home"),
    JOG("jog"),
    SEND_RAW("sendRaw"),
    POKE("poke"),
    START_PRINT("startPrint");

    private final String wireName;

    ECommandType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Resolve wire name (case-insensitive). Empty when the verb is unknown.
     */
    public static Optional<ECommandType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ECommandType type : values()) {
            if (type.wireName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
