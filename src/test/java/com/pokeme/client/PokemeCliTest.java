package com.pokeme.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pokeme.shared.model.AskBody;
import com.pokeme.shared.model.PermissionDecision;
import com.pokeme.shared.model.Request;
import com.pokeme.shared.model.RequestType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PokemeCliTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final String ID = "aabbccddeeff";

    private BrokerClient client;
    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;
    private PokemeCli cli;

    @BeforeEach
    void setUp() {
        client = mock(BrokerClient.class);
        when(client.baseUri()).thenReturn(URI.create("http://127.0.0.1:9131"));
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
        cli = new PokemeCli(client,
                new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8));
    }

    @Test
    void askPrintsAnswer() {
        when(client.ask(any())).thenReturn(ID);
        when(client.awaitAnswer(ID, TIMEOUT)).thenReturn(Optional.of(answered(RequestType.QUESTION, "Postgres")));

        var code = cli.ask(AskBody.question("What DB?", null, "test-bot", null), TIMEOUT);

        assertEquals(PokemeCli.EXIT_OK, code);
        assertEquals("Postgres", out().trim());
    }

    @Test
    void askTimeoutFails() {
        when(client.ask(any())).thenReturn(ID);
        when(client.awaitAnswer(ID, TIMEOUT)).thenReturn(Optional.empty());

        var code = cli.ask(AskBody.question("anyone?", null, null, null), TIMEOUT);

        assertEquals(PokemeCli.EXIT_FAILURE, code);
        assertTrue(err().contains("timed out"));
    }

    @Test
    void refusedAskFailsWithoutPolling() {
        when(client.ask(any())).thenThrow(new BrokerClientException(429, "too many pending requests"));

        var code = cli.ask(AskBody.question("q", null, null, null), TIMEOUT);

        assertEquals(PokemeCli.EXIT_FAILURE, code);
        assertTrue(err().contains("too many pending requests"));
        verify(client, never()).awaitAnswer(any(), any());
    }

    @Test
    void approvedPermissionExitsZero() throws Exception {
        when(client.ask(any())).thenReturn(ID);
        when(client.awaitAnswer(eq(ID), any())).thenReturn(Optional.of(answered(RequestType.PERMISSION,
                MAPPER.writeValueAsString(PermissionDecision.approve("")))));

        var code = cli.permit(AskBody.permission("Delete temp files?", "rm -rf /tmp/*", null, "cleanup-bot", null), TIMEOUT);

        assertEquals(PokemeCli.EXIT_OK, code);
    }

    @Test
    void deniedPermissionHasDistinctExitAndShowsComment() throws Exception {
        when(client.ask(any())).thenReturn(ID);
        when(client.awaitAnswer(eq(ID), any())).thenReturn(Optional.of(answered(RequestType.PERMISSION,
                MAPPER.writeValueAsString(PermissionDecision.deny("too dangerous")))));

        var code = cli.permit(AskBody.permission("Drop database?", "DROP DATABASE prod", null, "db-bot", null), TIMEOUT);

        assertEquals(PokemeCli.EXIT_DENIED, code);
        assertNotEquals(PokemeCli.EXIT_FAILURE, code);
        assertTrue(out().contains("denied"));
        assertTrue(out().contains("too dangerous"));
    }

    @Test
    void freeTextPermissionAnswerCountsAsDenied() {
        var decision = PokemeCli.decode("sure, go ahead");
        assertFalse(decision.isApproved());
        assertEquals("sure, go ahead", decision.comment());
        assertTrue(PokemeCli.decode("{\"decision\":\"approved\",\"comment\":\"ok\"}").isApproved());
    }

    @Test
    void statusListsPending() {
        var req = Request.pending(ID, "Which DB?", null, "infra-bot", null,
                RequestType.QUESTION, null, Instant.now().minusSeconds(42));
        when(client.pending()).thenReturn(List.of(req));

        assertEquals(PokemeCli.EXIT_OK, cli.status());
        assertTrue(out().contains("[infra-bot]"));
        assertTrue(out().contains("Which DB?"));
    }

    @Test
    void statusWithNothingPending() {
        when(client.pending()).thenReturn(List.of());
        assertEquals(PokemeCli.EXIT_OK, cli.status());
        assertEquals("No pending requests.", out().trim());
    }

    @Test
    void usageErrors() {
        var out = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
        var err = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
        assertEquals(PokemeCli.EXIT_FAILURE, PokemeCli.run(new String[0], out, err));
        assertEquals(PokemeCli.EXIT_FAILURE, PokemeCli.run(new String[]{"ask", "--timeout"}, out, err));
        assertEquals(PokemeCli.EXIT_FAILURE, PokemeCli.run(new String[]{"ask", "--port", "abc"}, out, err));
        assertEquals(PokemeCli.EXIT_FAILURE, PokemeCli.run(new String[]{"frobnicate"}, out, err));
    }

    private static Request answered(RequestType type, String answer) {
        var created = Instant.parse("2026-03-01T10:00:00Z");
        return Request.pending(ID, "q", null, null, null, type,
                type == RequestType.PERMISSION ? "cmd" : null, created)
                .withAnswer(answer, created.plusSeconds(3));
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }
}
