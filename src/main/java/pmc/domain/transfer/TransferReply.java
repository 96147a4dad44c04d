package pmc.domain.transfer;

import java.util.Locale;

/**
 * Reply of the transfer channel: a three digit code and its text
 * @author Martin Sustik <sustik@herman.cz>
 * @since 07/10/2026
 */
public record TransferReply(String code, String message) {

    public static TransferReply of(String code, String message) {
        return new TransferReply(code, message == null ? "" : message);
    }

    public boolean isPositive() {
        return code != null && (code.startsWith("2") || code.startsWith("1"));
    }

    public boolean is(String expectedCode) {
        return expectedCode.equals(code);
    }

    /**
     * 550/553/450 style refusal: permission or the channel is in a state that refuses writes
     */
    public boolean isPermissionOrStateError() {
        if ("550".equals(code) || "553".equals(code) || "450".equals(code) || "532".equals(code)) {
            return !isNotFound();
        }
        String lowered = lowerMessage();
        return lowered.contains("permission") || lowered.contains("denied");
    }

    public boolean isNotFound() {
        String lowered = lowerMessage();
        return lowered.contains("not found") || lowered.contains("no such file") || lowered.contains("does not exist");
    }

    private String lowerMessage() {
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return code + " " + message;
    }
}
