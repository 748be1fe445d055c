package com.pokeme.gateway.http;

import com.pokeme.lifecycle.BrokerShutdown;
import com.pokeme.notify.Notifier;
import com.pokeme.observability.BrokerMetrics;
import com.pokeme.shared.model.AnswerBody;
import com.pokeme.shared.model.AskBody;
import com.pokeme.shared.model.Request;
import com.pokeme.shared.model.RequestType;
import com.pokeme.store.InvalidRequestException;
import com.pokeme.store.RequestStore;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class BrokerController {

    private static final Logger log = LoggerFactory.getLogger(BrokerController.class);

    private final RequestStore store;
    private final JsonBodyReader bodyReader;
    private final Notifier notifier;
    private final BrokerShutdown shutdown;
    private final BrokerMetrics metrics;

    public BrokerController(RequestStore store, JsonBodyReader bodyReader, Notifier notifier,
                            BrokerShutdown shutdown, BrokerMetrics metrics) {
        this.store = store;
        this.bodyReader = bodyReader;
        this.notifier = notifier;
        this.shutdown = shutdown;
        this.metrics = metrics;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/pending")
    public List<Request> pending() {
        return store.pending();
    }

    @GetMapping("/status/{id}")
    public ResponseEntity<?> status(@PathVariable String id) {
        return store.get(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> error(HttpStatus.NOT_FOUND, "not found"));
    }

    @PostMapping("/ask")
    public ResponseEntity<Map<String, String>> ask(HttpServletRequest request) {
        var body = bodyReader.read(request, AskBody.class)
                .filter(b -> b.question() != null)
                .orElseThrow(() -> new InvalidRequestException("missing question"));
        var type = body.requestType() == null
                ? RequestType.QUESTION
                : RequestType.parse(body.requestType()).orElseThrow(() ->
                        new InvalidRequestException("invalid request_type: expected question or permission"));

        var created = store.create(body.question(), body.context(), body.agent(), body.task(),
                type, body.command());
        if (created.isEmpty()) {
            metrics.rejected().increment();
            log.warn("Rejected ask from agent '{}': pending capacity reached", body.agent());
            return error(HttpStatus.TOO_MANY_REQUESTS, "too many pending requests");
        }

        var req = created.get();
        metrics.created().increment();
        log.info("Request {} created ({}, agent={})", req.id(), req.requestType().wireName(), req.agent());
        notifyHuman(req, request);
        return ResponseEntity.ok(Map.of("id", req.id()));
    }

    @PostMapping("/answer")
    public ResponseEntity<Map<String, String>> answer(HttpServletRequest request) {
        var body = bodyReader.read(request, AnswerBody.class)
                .filter(b -> b.id() != null && b.answer() != null)
                .orElseThrow(() -> new InvalidRequestException("missing id or answer"));

        if (!store.answer(body.id(), body.answer())) {
            metrics.answerConflicts().increment();
            return error(HttpStatus.NOT_FOUND, "request not found or already answered");
        }
        metrics.answered().increment();
        log.info("Request {} answered", body.id());
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    @PostMapping("/shutdown")
    public Map<String, String> shutdown() {
        shutdown.request("shutdown requested over HTTP");
        return Map.of("status", "shutting down");
    }

    private void notifyHuman(Request req, HttpServletRequest request) {
        var url = "http://127.0.0.1:" + request.getLocalPort() + "/";
        try {
            notifier.notify(req.question(), req.agent(), url);
        } catch (RuntimeException e) {
            log.warn("Notification for request {} failed: {}", req.id(), e.getMessage());
        }
    }

    static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
