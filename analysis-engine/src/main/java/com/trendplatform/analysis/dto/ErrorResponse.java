package com.trendplatform.analysis.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("message") String message     // detail, 5xx only
) {
    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null);
    }
}
