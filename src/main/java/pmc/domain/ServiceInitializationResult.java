package pmc.domain;

/**
 * Result of bringing up one printer agent (or another startup service)
 * @author Martin Sustik <sustik@herman.cz>
 * @since 16/10/2026
 */
public class ServiceInitializationResult {
    private final String serviceName;
    private final boolean success;
    private final String errorMessage;
    private final Exception exception;
    private final long initializationTimeMs;

    private ServiceInitializationResult(String serviceName, boolean success, String errorMessage, Exception exception,
                                        long initializationTimeMs) {
        this.serviceName = serviceName;
        this.success = success;
        this.errorMessage = errorMessage;
        this.exception = exception;
        this.initializationTimeMs = initializationTimeMs;
    }

    public static ServiceInitializationResult success(String serviceName, long initTimeMs) {
        return new ServiceInitializationResult(serviceName, true, null, null, initTimeMs);
    }

    public static ServiceInitializationResult failure(String serviceName, Exception exception, long initTimeMs) {
        return new ServiceInitializationResult(serviceName, false, exception.getMessage(), exception, initTimeMs);
    }

    public String getServiceName() {
        return serviceName;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Exception getException() {
        return exception;
    }

    public long getInitializationTimeMs() {
        return initializationTimeMs;
    }

    @Override
    public String toString() {
        if (success) {
            return String.format("%s: SUCCESS (initialized in %dms)", serviceName, initializationTimeMs);
        }
        return String.format("%s: FAILED (attempted for %dms) - %s", serviceName, initializationTimeMs, errorMessage);
    }
}
