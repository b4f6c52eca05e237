package org.tabula.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.tabula.config.ConfigSchema;
import org.tabula.errors.ConfigException;
import org.tabula.errors.IngestException;
import org.tabula.errors.SourceFetchException;
import org.tabula.errors.SourceFormatException;
import org.tabula.model.Table;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Adapter for JSON REST endpoints. Issues a single request and converts the JSON response into one table,
 * already stamped with provenance since REST results do not pass through file ingestion.
 */
public class RestAdapter extends AbstractSourceAdapter {

    public static final int DEFAULT_TIMEOUT_SECONDS = 30;
    static final String FILE_TYPE = "rest";
    private static final int MAX_DETAIL_LENGTH = 500;

    static final ConfigSchema SCHEMA = ConfigSchema.forAdapter("RestAdapter")
            .require("url", "method")
            .optional("timeout", DEFAULT_TIMEOUT_SECONDS)
            .build();

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient httpClient;

    public RestAdapter(Map<String, ?> config, Logger logger) throws ConfigException {
        this(config, logger, null);
    }

    public RestAdapter(Map<String, ?> config, Logger logger, HttpClient httpClient) throws ConfigException {
        super(config, SCHEMA, logger);
        int timeout = this.config.getInt("timeout", DEFAULT_TIMEOUT_SECONDS);
        this.httpClient = httpClient != null ? httpClient : HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(timeout))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public List<Table> fetch() throws IngestException {
        markFetchStart();
        HttpRequest request = buildRequest();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to fetch data from " + request.uri() + ": " + e.getMessage());
            throw new SourceFetchException("Failed to fetch data from " + request.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceFetchException("Interrupted while fetching " + request.uri(), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String body = response.body() == null ? "" : response.body();
            String detail = body.length() > MAX_DETAIL_LENGTH ? body.substring(0, MAX_DETAIL_LENGTH) : body;
            logger.log(Level.SEVERE, "Failed to fetch data from {0}: HTTP {1}", new Object[]{request.uri(), status});
            throw new SourceFetchException("HTTP " + status + " from " + request.uri(), status, detail);
        }

        try {
            JsonNode root = MAPPER.readTree(response.body());
            if (root == null || root.isMissingNode()) {
                throw new SourceFormatException("Empty response body from " + request.uri());
            }
            return transform(List.of(JsonTables.toTable(tableName(request.uri()), root, FILE_TYPE, null, logger)));
        } catch (JsonProcessingException e) {
            throw new SourceFormatException("Response from " + request.uri() + " is not JSON: " + e.getOriginalMessage(), e);
        }
    }

    HttpRequest buildRequest() throws ConfigException {
        URI uri;
        try {
            uri = URI.create(withQuery(config.getString("url"), config.getMap("params")));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("RestAdapter: invalid url '" + config.getString("url") + "': " + e.getMessage());
        }
        int timeout = config.getInt("timeout", DEFAULT_TIMEOUT_SECONDS);
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(timeout))
                .header("Accept", "application/json");
        config.getMap("headers").forEach((name, value) -> builder.header(name, String.valueOf(value)));

        HttpRequest.BodyPublisher publisher = HttpRequest.BodyPublishers.noBody();
        Object body = config.get("body");
        if (body != null) {
            try {
                publisher = HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body), StandardCharsets.UTF_8);
            } catch (JsonProcessingException e) {
                throw new ConfigException("RestAdapter: body cannot be serialized as JSON: " + e.getOriginalMessage());
            }
            if (!config.getMap("headers").containsKey("Content-Type")) {
                builder.header("Content-Type", "application/json");
            }
        }
        return builder.method(config.getString("method").toUpperCase(Locale.ROOT), publisher).build();
    }

    static String withQuery(String url, Map<String, Object> params) {
        if (params.isEmpty()) return url;
        String query = params.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                          + URLEncoder.encode(String.valueOf(e.getValue()), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        return url + (url.contains("?") ? "&" : "?") + query;
    }

    static String tableName(URI uri) {
        String path = uri.getPath();
        if (path == null) return "response";
        String[] segments = path.split("/");
        for (int i = segments.length - 1; i >= 0; i--) {
            if (!segments[i].isBlank()) return segments[i];
        }
        return "response";
    }
}
