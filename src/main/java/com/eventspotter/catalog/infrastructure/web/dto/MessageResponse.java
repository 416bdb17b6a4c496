package com.eventspotter.catalog.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageResponse(
        String message,
        Map<String, String> errors
) {
    public static MessageResponse of(String message) {
        return new MessageResponse(message, null);
    }
}
