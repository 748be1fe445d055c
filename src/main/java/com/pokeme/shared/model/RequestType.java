package com.pokeme.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of request an agent posts. A {@link #PERMISSION} request carries the command it
 * wants to run and is answered with a {@link PermissionDecision}.
 */
public enum RequestType {
    QUESTION,
    PERMISSION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Returns empty for anything other than {@code question} or {@code permission}. */
    public static Optional<RequestType> parse(String value) {
        if (value == null) return Optional.empty();
        for (var type : values()) {
            if (type.wireName().equals(value)) return Optional.of(type);
        }
        return Optional.empty();
    }

    @JsonCreator
    public static RequestType fromWireName(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown request type: " + value));
    }
}
