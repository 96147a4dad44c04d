package pmc.domain.cloud;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.domain.command.Command;
import pmc.domain.command.CommandOutcome;
import pmc.domain.command.ICommandQueue;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command queue of the cloud control plane
 * @author Martin Sustik <sustik@herman.cz>
 * @since 14/10/2026
 */
public class CloudControlClient implements ICommandQueue {
    private static final Logger logger = LoggerFactory.getLogger(CloudControlClient.class);
    private static final Type METADATA_TYPE = new TypeToken<Map<String, Object>>() { }.getType();

    static final String CONTROL_PATH = "/control";
    static final String ACK_PATH = "/ackPrinterCommand";
    static final String RESULT_PATH = "/control/result";

    private final CloudHttpClient http;
    private final Gson gson;
    private final String recipientId;

    public CloudControlClient(CloudHttpClient http, Gson gson) {
        this.http = http;
        this.gson = gson;
        this.recipientId = http.getConfig().recipientId();
    }

    @Override
    public List<Command> fetchCommands(String printerSerial, String printerIpAddress) throws IOException {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("recipientId", recipientId);
        query.put("printerSerial", printerSerial);
        query.put("printerIpAddress", printerIpAddress);

        JsonObject response = http.get(CONTROL_PATH, query);
        JsonElement commandsElement = response.get("commands");
        List<Command> commands = new ArrayList<>();
        if (commandsElement == null || !commandsElement.isJsonArray()) {
            return commands;
        }
        JsonArray array = commandsElement.getAsJsonArray();
        for (JsonElement element : array) {
            if (!element.isJsonObject()) {
                logger.warn("Skipping malformed command entry: {}", element);
                continue;
            }
            commands.add(toCommand(element.getAsJsonObject()));
        }
        return commands;
    }

    Command toCommand(JsonObject json) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        JsonElement metadataElement = json.get("metadata");
        if (metadataElement != null && metadataElement.isJsonObject()) {
            Map<String, Object> parsed = gson.fromJson(metadataElement, METADATA_TYPE);
            if (parsed != null) {
                metadata.putAll(parsed);
            }
        }
        return new Command(
                CloudHttpClient.stringMember(json, "commandId", "id"),
                CloudHttpClient.stringMember(json, "commandType", "type", "command"),
                metadata,
                CloudHttpClient.stringMember(json, "printerSerial", "serial"),
                CloudHttpClient.stringMember(json, "printerIpAddress", "ipAddress"));
    }

    @Override
    public void acknowledge(String printerSerial, String commandId, String status, String message, String errorMessage)
            throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("recipientId", recipientId);
        body.put("printerSerial", printerSerial);
        body.put("commandId", commandId);
        body.put("status", status);
        if (message != null) {
            body.put("message", message);
        }
        if (errorMessage != null) {
            body.put("errorMessage", errorMessage);
        }
        http.post(ACK_PATH, body);
    }

    @Override
    public void reportResult(CommandOutcome outcome) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("commandId", outcome.commandId());
        body.put("status", CommandOutcome.normalizeStatus(outcome.status()));
        if (outcome.message() != null) {
            body.put("message", outcome.message());
        }
        if (outcome.errorMessage() != null) {
            body.put("errorMessage", outcome.errorMessage());
        }
        http.post(RESULT_PATH, body);
    }
}
