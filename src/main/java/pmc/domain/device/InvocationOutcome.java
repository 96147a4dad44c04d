package pmc.domain.device;

/**
 * Result of trying a list of capability variants
 * @param succeeded true when one variant completed without failure
 * @param method name of the variant that worked, null when none did
 * @param value return value of the variant that worked
 * @param lastError message of the last failing variant, null when none failed
 */
public record InvocationOutcome(boolean succeeded, String method, Object value, String lastError) {

    public static InvocationOutcome success(String method, Object value) {
        return new InvocationOutcome(true, method, value, null);
    }

    public static InvocationOutcome none(String lastError) {
        return new InvocationOutcome(false, null, null, lastError);
    }
}
