package pmc.domain.start;

/**
 * Outcome of a print start attempt
 * @param acknowledged the printer confirmed the new job began
 * @param state last observed state
 * @param percentage last observed progress, null when not reported
 * @param useAmsActually material system flag of the attempt that was last submitted
 * @param fallbackTriggered the conflict fallback path was taken
 * @param method native verb or control channel that carried the last attempt
 */
public record StartResult(boolean acknowledged, String state, Double percentage, boolean useAmsActually,
                          boolean fallbackTriggered, String method) {
}
