package pmc.domain.cloud;

import java.io.IOException;

/**
 * Cloud endpoint answered with a non-success HTTP status
 * @author Martin Sustik <sustik@herman.cz>
 * @since 14/10/2026
 */
public class CloudRequestException extends IOException {
    private final int statusCode;

    public CloudRequestException(String endpoint, int statusCode, String body) {
        super("HTTP " + statusCode + " from " + endpoint + (body == null || body.isBlank() ? "" : ": " + abbreviate(body)));
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    private static String abbreviate(String body) {
        String text = body.trim();
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
