package com.pokeme.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Answer payload of a permission request, carried as JSON text in {@link Request#answer()}:
 * {@code {"decision":"approved","comment":""}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PermissionDecision(String decision, String comment) {

    public static final String APPROVED = "approved";
    public static final String DENIED = "denied";

    public static PermissionDecision approve(String comment) {
        return new PermissionDecision(APPROVED, comment == null ? "" : comment);
    }

    public static PermissionDecision deny(String comment) {
        return new PermissionDecision(DENIED, comment == null ? "" : comment);
    }

    @JsonIgnore
    public boolean isApproved() {
        return APPROVED.equals(decision);
    }
}
