package com.pokeme.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pokeme.shared.config.PokemeConfig;
import com.pokeme.shared.model.AskBody;
import com.pokeme.shared.model.PermissionDecision;
import com.pokeme.shared.model.Request;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line used by agents.
 *
 * <pre>
 * pokeme ask "Which database?" [--context c] [--agent a] [--task t] [--timeout s] [--port p]
 * pokeme permit "rm -rf build" [--question q] [--agent a] ...
 * pokeme status [--port p]
 * pokeme stop [--port p]
 * </pre>
 *
 * Exit codes: 0 answered or approved, 1 timeout or failure, 2 denied.
 */
public class PokemeCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_DENIED = 2;

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Map<String, String> ALIASES = Map.of(
            "-c", "--context", "-a", "--agent", "-t", "--task", "-q", "--question");

    private final BrokerClient client;
    private final PrintStream out;
    private final PrintStream err;

    public PokemeCli(BrokerClient client, PrintStream out, PrintStream err) {
        this.client = client;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            err.println("usage: pokeme <ask|permit|status|stop> [options]");
            return EXIT_FAILURE;
        }
        Options opts;
        int port;
        Duration timeout;
        try {
            opts = Options.parse(args, 1);
            port = opts.intFlag("--port", PokemeConfig.DEFAULT_PORT);
            timeout = opts.timeout();
        } catch (IllegalArgumentException e) {
            err.println("pokeme: " + e.getMessage());
            return EXIT_FAILURE;
        }
        var cli = new PokemeCli(new BrokerClient(port), out, err);
        try {
            return cli.dispatch(args[0], opts, port, timeout);
        } catch (BrokerClientException e) {
            err.println("pokeme: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int dispatch(String command, Options opts, int port, Duration timeout) {
        switch (command) {
            case "ask": {
                if (opts.positional.isEmpty()) {
                    err.println("pokeme: ask needs a question");
                    return EXIT_FAILURE;
                }
                new BrokerLauncher().ensureRunning(port);
                var body = AskBody.question(opts.positional.get(0),
                        opts.flag("--context"), opts.flag("--agent"), opts.flag("--task"));
                return ask(body, timeout);
            }
            case "permit": {
                if (opts.positional.isEmpty()) {
                    err.println("pokeme: permit needs a command");
                    return EXIT_FAILURE;
                }
                new BrokerLauncher().ensureRunning(port);
                var shellCommand = opts.positional.get(0);
                var question = opts.flag("--question") != null ? opts.flag("--question") : "Allow: " + shellCommand;
                var body = AskBody.permission(question, shellCommand,
                        opts.flag("--context"), opts.flag("--agent"), opts.flag("--task"));
                return permit(body, timeout);
            }
            case "status":
                if (!BrokerLauncher.isRunning(port)) {
                    out.println("No pokeme server running.");
                    return EXIT_OK;
                }
                return status();
            case "stop":
                if (BrokerLauncher.isRunning(port)) {
                    client.shutdown();
                }
                return EXIT_OK;
            default:
                err.println("pokeme: unknown command '" + command + "'");
                return EXIT_FAILURE;
        }
    }

    /** Asks a question and prints the human's answer. */
    public int ask(AskBody body, Duration timeout) {
        var answered = submitAndWait(body, timeout);
        if (answered == null) return EXIT_FAILURE;
        out.println(answered.answer());
        return EXIT_OK;
    }

    /** Asks for permission to run a command; exits 0 when approved and 2 when denied. */
    public int permit(AskBody body, Duration timeout) {
        var answered = submitAndWait(body, timeout);
        if (answered == null) return EXIT_FAILURE;
        var decision = decode(answered.answer());
        if (decision.isApproved()) {
            out.println("approved");
            return EXIT_OK;
        }
        out.println("denied");
        if (decision.comment() != null && !decision.comment().isBlank()) {
            out.println(decision.comment());
        }
        return EXIT_DENIED;
    }

    public int status() {
        List<Request> pending;
        try {
            pending = client.pending();
        } catch (BrokerClientException e) {
            err.println("pokeme: " + e.getMessage());
            return EXIT_FAILURE;
        }
        if (pending.isEmpty()) {
            out.println("No pending requests.");
            return EXIT_OK;
        }
        var now = Instant.now();
        for (var req : pending) {
            var agent = req.agent() != null && !req.agent().isBlank() ? req.agent() : "unknown";
            var age = Duration.between(req.createdAt(), now).toSeconds();
            out.printf("  [%s] (%ds ago) %s%n", agent, age, req.question());
        }
        return EXIT_OK;
    }

    private Request submitAndWait(AskBody body, Duration timeout) {
        String id;
        try {
            id = client.ask(body);
        } catch (BrokerClientException e) {
            err.println("pokeme: " + e.getMessage());
            return null;
        }
        err.println("pokeme: respond at " + client.baseUri());
        var answered = client.awaitAnswer(id, timeout);
        if (answered.isEmpty()) {
            err.println("pokeme: timed out waiting for answer");
            return null;
        }
        return answered.get();
    }

    // an answer that is not a decision payload counts as a denial carrying the raw text
    static PermissionDecision decode(String answer) {
        if (answer == null) return PermissionDecision.deny("");
        try {
            var decision = MAPPER.readValue(answer, PermissionDecision.class);
            if (decision != null && decision.decision() != null) return decision;
        } catch (IOException e) {
            return PermissionDecision.deny(answer);
        }
        return PermissionDecision.deny(answer);
    }

    static final class Options {
        final List<String> positional = new ArrayList<>();
        final Map<String, String> flags = new HashMap<>();

        static Options parse(String[] args, int from) {
            var opts = new Options();
            for (int i = from; i < args.length; i++) {
                var arg = ALIASES.getOrDefault(args[i], args[i]);
                if (arg.startsWith("--")) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("missing value for " + arg);
                    }
                    opts.flags.put(arg, args[++i]);
                } else {
                    opts.positional.add(arg);
                }
            }
            return opts;
        }

        String flag(String name) {
            return flags.get(name);
        }

        int intFlag(String name, int fallback) {
            var value = flags.get(name);
            if (value == null) return fallback;
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " must be a number: " + value);
            }
        }

        Duration timeout() {
            var value = flags.get("--timeout");
            if (value == null) return DEFAULT_TIMEOUT;
            try {
                return Duration.ofSeconds(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--timeout must be a number of seconds: " + value);
            }
        }
    }
}
