package pmc.domain.cloud;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.HttpClientResponseHandler;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.net.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pmc.dal.CloudConfig;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * JSON over HTTP to the cloud control plane. Every request carries the API key header.
 * @author Martin Sustik <sustik@herman.cz>
 * @since 14/10/2026
 */
public class CloudHttpClient {
    private static final Logger logger = LoggerFactory.getLogger(CloudHttpClient.class);

    static final String API_KEY_HEADER = "X-API-Key";

    private final CloudConfig config;
    private final HttpClient httpClient;
    private final Gson gson;

    public CloudHttpClient(CloudConfig config, HttpClient httpClient, Gson gson) {
        this.config = config;
        this.httpClient = httpClient;
        this.gson = gson;
    }

    public CloudConfig getConfig() {
        return config;
    }

    /**
     * GET with query parameters; null values are omitted
     */
    public JsonObject get(String path, Map<String, String> query) throws IOException {
        URI uri;
        try {
            URIBuilder builder = new URIBuilder(config.normalizedBaseUrl() + path);
            query.forEach((name, value) -> {
                if (value != null && !value.isBlank()) {
                    builder.addParameter(name, value);
                }
            });
            uri = builder.build();
        } catch (URISyntaxException e) {
            throw new IOException("Invalid cloud URL for " + path + ": " + e.getMessage(), e);
        }
        return execute(new HttpGet(uri), path);
    }

    public JsonObject post(String path, Object body) throws IOException {
        HttpPost request = new HttpPost(config.normalizedBaseUrl() + path);
        request.setEntity(new StringEntity(gson.toJson(body), ContentType.APPLICATION_JSON));
        return execute(request, path);
    }

    private JsonObject execute(HttpUriRequestBase request, String path) throws IOException {
        request.addHeader(API_KEY_HEADER, config.apiKey() == null ? "" : config.apiKey());
        request.addHeader("Accept", "application/json");
        logger.trace("{} {}", request.getMethod(), path);

        HttpClientResponseHandler<JsonObject> handler = response -> {
            int code = response.getCode();
            String body = response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
            if (code < 200 || code >= 300) {
                throw new CloudRequestException(path, code, body);
            }
            return parse(body, path);
        };
        return httpClient.execute(request, handler);
    }

    private static JsonObject parse(String body, String path) throws IOException {
        if (body == null || body.isBlank()) {
            return new JsonObject();
        }
        try {
            JsonElement element = JsonParser.parseString(body);
            if (element.isJsonObject()) {
                return element.getAsJsonObject();
            }
            JsonObject wrapper = new JsonObject();
            wrapper.add("data", element);
            return wrapper;
        } catch (JsonParseException e) {
            throw new IOException("Invalid JSON from " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * First non-null string member among the names
     */
    static String stringMember(JsonObject object, String... names) {
        for (String name : names) {
            JsonElement element = object.get(name);
            if (element != null && element.isJsonPrimitive()) {
                String value = element.getAsString();
                if (!value.isBlank()) {
                    return value;
                }
            }
        }
        return null;
    }
}
