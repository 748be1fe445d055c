package com.pokeme.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pokeme.shared.model.AnswerBody;
import com.pokeme.shared.model.AskBody;
import com.pokeme.shared.model.Request;
import com.pokeme.shared.model.RequestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * HTTP client for the broker, used by agents. Waiting for a human is a client-side polling
 * loop; the broker itself never blocks.
 */
public class BrokerClient {

    private static final Logger log = LoggerFactory.getLogger(BrokerClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();
    private static final Duration CALL_TIMEOUT = Duration.ofSeconds(5);

    private final URI baseUri;
    private final Duration pollInterval;
    private final HttpClient http;

    public BrokerClient(int port) {
        this(URI.create("http://127.0.0.1:" + port), Duration.ofSeconds(1));
    }

    public BrokerClient(URI baseUri, Duration pollInterval) {
        this.baseUri = baseUri;
        this.pollInterval = pollInterval;
        this.http = HttpClient.newBuilder()
                .connectTimeout(CALL_TIMEOUT)
                .build();
    }

    public URI baseUri() { return baseUri; }

    /** Posts a question or permission request and returns its id. */
    public String ask(AskBody body) {
        var resp = send(post("/api/ask", body));
        if (resp.statusCode() != 200) {
            throw refusal(resp);
        }
        return readTree(resp).path("id").asText();
    }

    public Optional<Request> status(String id) {
        var resp = send(get("/api/status/" + id));
        if (resp.statusCode() == 404) return Optional.empty();
        if (resp.statusCode() != 200) throw refusal(resp);
        return Optional.of(read(resp, new TypeReference<Request>() {}));
    }

    public List<Request> pending() {
        var resp = send(get("/api/pending"));
        if (resp.statusCode() != 200) throw refusal(resp);
        return read(resp, new TypeReference<List<Request>>() {});
    }

    /** Returns false if the request is unknown or was already answered. */
    public boolean answer(String id, String answer) {
        var resp = send(post("/api/answer", new AnswerBody(id, answer)));
        if (resp.statusCode() == 404) return false;
        if (resp.statusCode() != 200) throw refusal(resp);
        return true;
    }

    public boolean isHealthy() {
        try {
            var resp = send(get("/api/health"));
            return resp.statusCode() == 200 && "ok".equals(readTree(resp).path("status").asText());
        } catch (BrokerClientException e) {
            return false;
        }
    }

    public void shutdown() {
        try {
            send(post("/api/shutdown", null));
        } catch (BrokerClientException e) {
            // the broker may exit before the response is written
            log.debug("Shutdown call ended without response: {}", e.getMessage());
        }
    }

    /**
     * Polls the request's status until it is answered or the timeout elapses. Transient
     * failures are retried on the next tick.
     *
     * @return the answered request, or empty on timeout
     */
    public Optional<Request> awaitAnswer(String id, Duration timeout) {
        var deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            try {
                var current = status(id);
                if (current.isPresent() && current.get().status() == RequestStatus.ANSWERED) {
                    return current;
                }
            } catch (BrokerClientException e) {
                log.debug("Status poll for {} failed: {}", id, e.getMessage());
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private HttpRequest get(String path) {
        return HttpRequest.newBuilder(baseUri.resolve(path))
                .timeout(CALL_TIMEOUT)
                .GET().build();
    }

    private HttpRequest post(String path, Object body) {
        HttpRequest.BodyPublisher publisher;
        try {
            publisher = body == null
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofByteArray(MAPPER.writeValueAsBytes(body));
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot encode request body", e);
        }
        return HttpRequest.newBuilder(baseUri.resolve(path))
                .timeout(CALL_TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(publisher).build();
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new BrokerClientException("failed to reach broker at " + baseUri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerClientException("interrupted while calling broker", e);
        }
    }

    private static <T> T read(HttpResponse<String> resp, TypeReference<T> type) {
        try {
            return MAPPER.readValue(resp.body(), type);
        } catch (IOException e) {
            throw new BrokerClientException("unexpected response from broker: " + e.getMessage(), e);
        }
    }

    private static JsonNode readTree(HttpResponse<String> resp) {
        return read(resp, new TypeReference<JsonNode>() {});
    }

    private static BrokerClientException refusal(HttpResponse<String> resp) {
        String error;
        try {
            error = MAPPER.readTree(resp.body()).path("error").asText("HTTP " + resp.statusCode());
        } catch (IOException e) {
            error = "HTTP " + resp.statusCode();
        }
        return new BrokerClientException(resp.statusCode(), error);
    }
}
