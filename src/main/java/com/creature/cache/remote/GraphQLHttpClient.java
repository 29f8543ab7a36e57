package com.creature.cache.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link RemoteClient} that posts GraphQL documents over HTTP.
 *
 * <p>Usage:</p>
 * <pre>
 * GraphQLHttpClient client = GraphQLHttpClient.builder()
 *     .endpoint("https://beta.pokeapi.co/graphql/v1beta")
 *     .timeout(Duration.ofSeconds(10))
 *     .build();
 *
 * RemoteClientHandle handle = RemoteClientHandle.initialize(() -> {
 *     client.verifySchema();
 *     return client;
 * });
 * </pre>
 */
public class GraphQLHttpClient implements RemoteClient {
    private static final Logger log = LoggerFactory.getLogger(GraphQLHttpClient.class);

    public static final String DEFAULT_ENDPOINT = "https://beta.pokeapi.co/graphql/v1beta";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0";
    private static final String SCHEMA_PROBE = "query SchemaProbe { __schema { queryType { name } } }";

    private final URI endpoint;
    private final Duration timeout;
    private final Map<String, String> headers;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private GraphQLHttpClient(Builder builder) {
        this.endpoint = URI.create(builder.endpoint != null ? builder.endpoint : DEFAULT_ENDPOINT);
        if (endpoint.getScheme() == null || endpoint.getHost() == null) {
            throw new IllegalArgumentException("endpoint must be an absolute URL: " + endpoint);
        }
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.headers = new LinkedHashMap<>(builder.headers);
        this.headers.putIfAbsent("User-Agent", builder.userAgent != null ? builder.userAgent : DEFAULT_USER_AGENT);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        log.info("GraphQL client initialized for {}", endpoint);
    }

    @Override
    public JsonNode execute(String query, Map<String, Object> variables) {
        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(new GraphQLRequest(query, variables));
        } catch (JsonProcessingException e) {
            throw new RemoteClientException("Could not encode GraphQL request: " + e.getMessage(), e);
        }

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody));
        headers.forEach(request::header);

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RemoteClientException("GraphQL request to " + endpoint + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteClientException("Interrupted while calling " + endpoint, e);
        }

        if (response.statusCode() != 200) {
            throw new RemoteClientException("GraphQL endpoint returned status " + response.statusCode()
                    + ": " + abbreviate(response.body()));
        }
        return readData(response.body());
    }

    /**
     * Sends a minimal introspection query to check that the endpoint speaks GraphQL.
     *
     * @throws RemoteClientException if the endpoint cannot answer it
     */
    public void verifySchema() {
        JsonNode data = execute(SCHEMA_PROBE, Map.of());
        String queryType = data.path("__schema").path("queryType").path("name").asText(null);
        if (queryType == null) {
            throw new RemoteClientException("Endpoint " + endpoint + " did not describe a query type");
        }
        log.info("GraphQL schema verified at {} (query type: {})", endpoint, queryType);
    }

    @Override
    public String getEndpoint() {
        return endpoint.toString();
    }

    private JsonNode readData(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RemoteClientException("Unreadable GraphQL response: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new RemoteClientException("GraphQL response is not an object");
        }

        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            StringBuilder messages = new StringBuilder();
            for (JsonNode error : errors) {
                if (messages.length() > 0) {
                    messages.append("; ");
                }
                messages.append(error.path("message").asText(error.toString()));
            }
            throw new RemoteClientException("GraphQL errors: " + messages);
        }

        JsonNode data = root.get("data");
        if (data == null || data.isNull()) {
            throw new RemoteClientException("GraphQL response has no data");
        }
        return data;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String endpoint;
        private Duration timeout;
        private String userAgent;
        private ObjectMapper objectMapper;
        private final Map<String, String> headers = new LinkedHashMap<>();

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public GraphQLHttpClient build() {
            return new GraphQLHttpClient(this);
        }
    }

    private record GraphQLRequest(String query, Map<String, Object> variables) {}
}
