package com.pokeme.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Body of {@code POST /api/answer}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnswerBody(String id, String answer) {}
