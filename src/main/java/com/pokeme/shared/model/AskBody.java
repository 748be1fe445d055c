package com.pokeme.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of {@code POST /api/ask}. Only {@code question} is required. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AskBody(
    String question,
    String context,
    String agent,
    String task,
    @JsonProperty("request_type") String requestType,
    String command
) {
    public static AskBody question(String question, String context, String agent, String task) {
        return new AskBody(question, context, agent, task, null, null);
    }

    public static AskBody permission(String question, String command, String context, String agent, String task) {
        return new AskBody(question, context, agent, task, RequestType.PERMISSION.wireName(), command);
    }
}
