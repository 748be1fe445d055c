package com.pokeme.shared.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A question or permission request posted by an agent. Instances are immutable; answering
 * produces a new record via {@link #withAnswer(String, Instant)}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Request(
    String id,
    String question,
    String context,
    String agent,
    String task,
    @JsonProperty("request_type") RequestType requestType,
    String command,
    RequestStatus status,
    String answer,
    @JsonProperty("created_at") @JsonFormat(shape = JsonFormat.Shape.NUMBER) Instant createdAt,
    @JsonProperty("answered_at") @JsonFormat(shape = JsonFormat.Shape.NUMBER) Instant answeredAt
) {

    public static Request pending(String id, String question, String context, String agent, String task,
                                  RequestType requestType, String command, Instant createdAt) {
        return new Request(id, question, context, agent, task, requestType, command,
                RequestStatus.PENDING, null, createdAt, null);
    }

    public Request withAnswer(String answer, Instant answeredAt) {
        return new Request(id, question, context, agent, task, requestType, command,
                RequestStatus.ANSWERED, answer, createdAt, answeredAt);
    }

    @JsonIgnore
    public boolean isPending() {
        return status == RequestStatus.PENDING;
    }
}
