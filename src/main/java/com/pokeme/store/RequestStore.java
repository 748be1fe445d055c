package com.pokeme.store;

import com.pokeme.shared.config.StoreLimits;
import com.pokeme.shared.model.Request;
import com.pokeme.shared.model.RequestType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory store for agent requests.
 *
 * <p>A single lock guards the whole map and every operation holds it for its full duration,
 * so concurrent answers to the same id are linearized: the first one wins. Records are
 * immutable, callers never see a request change under them.</p>
 *
 * <p>Pending requests are never expired. An agent that gives up keeps its slot until a human
 * answers it.</p>
 */
public class RequestStore {

    private static final Logger log = LoggerFactory.getLogger(RequestStore.class);

    private final Map<String, Request> requests = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final RequestIds ids = new RequestIds();
    private final StoreLimits limits;
    private final Clock clock;

    public RequestStore() {
        this(StoreLimits.defaults(), Clock.systemUTC());
    }

    public RequestStore(StoreLimits limits, Clock clock) {
        this.limits = limits;
        this.clock = clock;
    }

    public Optional<Request> create(String question) {
        return create(question, null, null, null, null, null);
    }

    /**
     * Creates a pending request. Text fields are truncated to their limits.
     *
     * @return the new request, or empty when the pending capacity is reached
     * @throws InvalidRequestException if the question is missing, or a permission request
     *         has no command
     */
    public Optional<Request> create(String question, String context, String agent, String task,
                                    RequestType requestType, String command) {
        if (question == null) {
            throw new InvalidRequestException("missing question");
        }
        var type = requestType != null ? requestType : RequestType.QUESTION;
        if (type == RequestType.PERMISSION && (command == null || command.isBlank())) {
            throw new InvalidRequestException("missing command for permission request");
        }

        lock.lock();
        try {
            var now = clock.instant();
            evictStale(now);
            if (countPending() >= limits.maxPending()) {
                return Optional.empty();
            }
            String id;
            do {
                id = ids.next();
            } while (requests.containsKey(id));

            var request = Request.pending(
                    id,
                    truncate(question, limits.maxQuestion()),
                    truncate(context, limits.maxContext()),
                    truncate(agent, limits.maxAgent()),
                    truncate(task, limits.maxTask()),
                    type,
                    truncate(command, limits.maxCommand()),
                    now);
            requests.put(id, request);
            return Optional.of(request);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Request> get(String id) {
        if (!RequestIds.isValid(id)) return Optional.empty();
        lock.lock();
        try {
            return Optional.ofNullable(requests.get(id));
        } finally {
            lock.unlock();
        }
    }

    /** Snapshot of every pending request, oldest first. */
    public List<Request> pending() {
        lock.lock();
        try {
            return requests.values().stream()
                    .filter(Request::isPending)
                    .sorted(Comparator.comparing(Request::createdAt))
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records the human's answer. Returns false if the id is malformed, unknown or already
     * answered; the first answer is never overwritten.
     */
    public boolean answer(String id, String text) {
        if (!RequestIds.isValid(id)) return false;
        lock.lock();
        try {
            var request = requests.get(id);
            if (request == null || !request.isPending()) {
                return false;
            }
            requests.put(id, request.withAnswer(truncate(text, limits.maxAnswer()), clock.instant()));
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasPending() {
        lock.lock();
        try {
            return requests.values().stream().anyMatch(Request::isPending);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return requests.size();
        } finally {
            lock.unlock();
        }
    }

    public StoreLimits limits() { return limits; }

    // caller holds the lock
    private void evictStale(Instant now) {
        var cutoff = now.minus(limits.answeredTtl());
        var it = requests.values().iterator();
        int evicted = 0;
        while (it.hasNext()) {
            var r = it.next();
            if (!r.isPending() && r.answeredAt() != null && r.answeredAt().isBefore(cutoff)) {
                it.remove();
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} answered request(s)", evicted);
        }
    }

    // caller holds the lock
    private long countPending() {
        return requests.values().stream().filter(Request::isPending).count();
    }

    static String truncate(String value, int limit) {
        if (value == null) return null;
        if (value.codePointCount(0, value.length()) <= limit) return value;
        return value.substring(0, value.offsetByCodePoints(0, limit));
    }
}
