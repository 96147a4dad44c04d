package pmc.domain.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Uniform calls over an inconsistent driver surface.
 * Never throws: every per-variant failure is logged and the next variant is tried.
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 06/10/2026
 */
public class DeviceCapabilityAdapter {
    private static final Logger logger = LoggerFactory.getLogger(DeviceCapabilityAdapter.class);

    private final IDeviceHandle device;

    public DeviceCapabilityAdapter(IDeviceHandle device) {
        this.device = device;
    }

    public IDeviceHandle getDevice() {
        return device;
    }

    /**
     * Try a single verb
     */
    public InvocationOutcome tryInvoke(String method, Object... args) {
        if (!device.supports(method)) {
            return InvocationOutcome.none(null);
        }
        try {
            Object value = device.invoke(method, args);
            return InvocationOutcome.success(method, value);
        } catch (UnsupportedOperationException e) {
            return InvocationOutcome.none(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return InvocationOutcome.none("interrupted");
        } catch (Exception e) {
            logger.debug("[{}] {} failed: {}", device.getSerial(), method, e.getMessage());
            return InvocationOutcome.none(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    /**
     * Try the candidates in order, return the first that worked
     */
    public InvocationOutcome invokeFirst(List<String> candidates, Object... args) {
        String lastError = null;
        for (String method : candidates) {
            InvocationOutcome outcome = tryInvoke(method, args);
            if (outcome.succeeded()) {
                logger.trace("[{}] {} handled by {}", device.getSerial(), candidates, method);
                return outcome;
            }
            if (outcome.lastError() != null) {
                lastError = outcome.lastError();
            }
        }
        return InvocationOutcome.none(lastError);
    }

    /**
     * Read a value through the first working query variant, null when none worked
     */
    public Object query(List<String> candidates) {
        InvocationOutcome outcome = invokeFirst(candidates);
        return outcome.succeeded() ? outcome.value() : null;
    }

    /**
     * Whether any of the candidates is exposed
     */
    public boolean supportsAny(List<String> candidates) {
        for (String method : candidates) {
            if (device.supports(method)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Send a raw G-code line through the first working gcode verb
     */
    public InvocationOutcome sendGcode(String gcode) {
        return invokeFirst(DeviceMethods.GCODE, gcode);
    }
}
