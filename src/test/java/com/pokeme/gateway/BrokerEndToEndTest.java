package com.pokeme.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pokeme.client.BrokerClient;
import com.pokeme.client.BrokerClientException;
import com.pokeme.shared.model.AskBody;
import com.pokeme.shared.model.PermissionDecision;
import com.pokeme.shared.model.RequestStatus;
import com.pokeme.shared.model.RequestType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "pokeme.config=target/no-such-pokeme-config.yaml")
class BrokerEndToEndTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @LocalServerPort
    int port;

    private BrokerClient client;

    @BeforeEach
    void setUp() {
        client = new BrokerClient(URI.create("http://127.0.0.1:" + port), Duration.ofMillis(50));
    }

    @Test
    void healthCheck() {
        assertTrue(client.isHealthy());
    }

    @Test
    void askPendingAnswerStatus() {
        var id = client.ask(AskBody.question("What DB?", "We need a database", "test-bot", "choosing infra"));
        assertTrue(id.matches("^[0-9a-f]{12}$"), id);

        var pending = client.pending();
        var listed = pending.stream().filter(r -> r.id().equals(id)).findFirst().orElseThrow();
        assertEquals("What DB?", listed.question());
        assertEquals("test-bot", listed.agent());
        assertEquals(RequestStatus.PENDING, listed.status());
        assertNotNull(listed.createdAt());

        assertTrue(client.answer(id, "Postgres"));
        assertFalse(client.answer(id, "MySQL"));

        var answered = client.awaitAnswer(id, Duration.ofSeconds(2)).orElseThrow();
        assertEquals("Postgres", answered.answer());
        assertNotNull(answered.answeredAt());
        assertTrue(client.pending().stream().noneMatch(r -> r.id().equals(id)));
    }

    @Test
    void permissionRoundTrip() throws Exception {
        var id = client.ask(AskBody.permission("Delete temp files?", "rm -rf /tmp/*", null, "cleanup-bot", null));
        var stored = client.status(id).orElseThrow();
        assertEquals(RequestType.PERMISSION, stored.requestType());
        assertEquals("rm -rf /tmp/*", stored.command());

        client.answer(id, MAPPER.writeValueAsString(PermissionDecision.approve("")));

        var answered = client.awaitAnswer(id, Duration.ofSeconds(2)).orElseThrow();
        assertTrue(MAPPER.readValue(answered.answer(), PermissionDecision.class).isApproved());
    }

    @Test
    void permissionWithoutCommandIsRefused() {
        var ex = assertThrows(BrokerClientException.class,
                () -> client.ask(new AskBody("do something", null, null, null, "permission", null)));
        assertEquals(400, ex.statusCode());
        assertTrue(ex.getMessage().contains("command"), ex.getMessage());
    }

    @Test
    void unansweredRequestTimesOut() {
        var id = client.ask(AskBody.question("anyone?", null, null, null));
        assertTrue(client.awaitAnswer(id, Duration.ofMillis(200)).isEmpty());
        // leave no pending work behind for other tests
        client.answer(id, "cleanup");
    }

    @Test
    void malformedStatusIdIsNotFound() {
        assertTrue(client.status("INVALID").isEmpty());
        assertTrue(client.status("aabbccddeeff").isEmpty());
    }

    @Test
    void unknownRouteIsNotFound() throws Exception {
        var resp = HttpClient.newHttpClient().send(
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/api/nope")).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals(404, resp.statusCode());
    }

    @Test
    void preflightFromLoopbackOrigin() throws Exception {
        var resp = HttpClient.newHttpClient().send(
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/api/ask"))
                        .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
                        .header("Origin", "http://localhost:5173")
                        .header("Access-Control-Request-Method", "POST")
                        .build(),
                HttpResponse.BodyHandlers.discarding());
        assertEquals(204, resp.statusCode());
        assertEquals("http://localhost:5173",
                resp.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
    }
}
