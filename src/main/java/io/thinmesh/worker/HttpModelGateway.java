package io.thinmesh.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.thinmesh.error.TaskExecutionException;
import io.thinmesh.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;

/**
 * {@link ModelGateway} over HTTP. Both endpoints take the task request JSON
 * written by {@link TaskRequests}:
 * <ul>
 *     <li>{@code POST /v1/estimate} answers {@code {"cost_micros": n}}</li>
 *     <li>{@code POST /v1/invoke} answers {@code {"output_base64", "content_type", "cost_micros"}}</li>
 * </ul>
 * A non-2xx invoke response may still report {@code cost_micros}; that amount
 * is charged to the failed attempt.
 */
public final class HttpModelGateway implements ModelGateway {
    private final String baseUrl;
    private final HttpClient client;
    private final Duration requestTimeout;

    public HttpModelGateway(String baseUrl, Duration requestTimeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Override
    public long estimateMicros(TaskContext context) throws IOException, InterruptedException {
        JsonNode body = post("/v1/estimate", context);
        long estimate = body.path("cost_micros").asLong(-1L);
        if (estimate < 0L) {
            throw new TaskExecutionException("model gateway returned no cost estimate");
        }
        return estimate;
    }

    @Override
    public Invocation invoke(TaskContext context) throws IOException, InterruptedException {
        JsonNode body = post("/v1/invoke", context);
        String output = body.path("output_base64").asText(null);
        if (output == null) {
            throw new TaskExecutionException("model gateway response has no output",
                    body.path("cost_micros").asLong(0L));
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(output);
        } catch (IllegalArgumentException e) {
            throw new TaskExecutionException("model gateway output is not base64",
                    body.path("cost_micros").asLong(0L), e);
        }
        String contentType = body.path("content_type").asText(null);
        return new Invocation(bytes, contentType, body.path("cost_micros").asLong(0L));
    }

    private JsonNode post(String path, TaskContext context) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(TaskRequests.toJson(context)))
                .build();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TaskExecutionException("model gateway unreachable: " + e.getMessage(), 0L, e);
        }
        JsonNode body = parse(response.body());
        if (response.statusCode() / 100 != 2) {
            throw new TaskExecutionException("model gateway " + path + " returned HTTP " + response.statusCode()
                    + ": " + body.path("error").asText(""), body.path("cost_micros").asLong(0L));
        }
        return body;
    }

    private static JsonNode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Jsons.compactMapper().createObjectNode();
        }
        try {
            return Jsons.compactMapper().readTree(raw);
        } catch (IOException e) {
            throw new TaskExecutionException("model gateway response is not JSON", 0L, e);
        }
    }
}
