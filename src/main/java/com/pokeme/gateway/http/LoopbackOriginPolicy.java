package com.pokeme.gateway.http;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Cross-origin calls are allowed only from pages served on the local machine, at any port.
 * The bundled UI runs on a port that is not known in advance.
 */
public final class LoopbackOriginPolicy {

    private static final Pattern LOOPBACK_ORIGIN =
            Pattern.compile("^http://(127\\.0\\.0\\.1|localhost)(:\\d{1,5})?$");

    private LoopbackOriginPolicy() {}

    /** Returns the origin to echo back, or empty if the origin must not be annotated. */
    public static Optional<String> allowedOrigin(String origin) {
        if (origin == null || !LOOPBACK_ORIGIN.matcher(origin).matches()) {
            return Optional.empty();
        }
        return Optional.of(origin);
    }
}
