package pmc.domain.orchestration;

import pmc.domain.errors.PrinterOperationException;

/**
 * Standard envelope of the local status API.
 * Failed printer operations carry the failure kind in {@code errorType}.
 * @author Martin Sustik <sustik@herman.cz>
 * @since 17/10/2026
 */
public class ApiResponse<T> {
    private final boolean success;
    private final String message;
    private final String errorType;
    private final T data;
    private final long timestamp;

    public ApiResponse(boolean success, String message, String errorType, T data) {
        this.success = success;
        this.message = message;
        this.errorType = errorType;
        this.data = data;
        this.timestamp = System.currentTimeMillis();
    }

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, "Operation completed successfully", null, data);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(true, message, null, data);
    }

    public static <T> ApiResponse<T> error(String message) {
        return new ApiResponse<>(false, message, null, null);
    }

    /**
     * Error response for a failed printer operation, e.g. errorType "ProtocolConflict" for a ProtocolConflictException
     */
    public static <T> ApiResponse<T> error(PrinterOperationException cause) {
        String type = cause.getClass().getSimpleName();
        if (type.endsWith("Exception")) {
            type = type.substring(0, type.length() - "Exception".length());
        }
        return new ApiResponse<>(false, cause.getMessage(), type, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    public String getErrorType() {
        return errorType;
    }

    public T getData() {
        return data;
    }

    public long getTimestamp() {
        return timestamp;
    }
}
