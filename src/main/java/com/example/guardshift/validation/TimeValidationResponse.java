package com.example.guardshift.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimeValidationResponse(
        @JsonProperty("valid") boolean valid,
        @JsonProperty("closest_time") String closestTime,
        @JsonProperty("message") String message) {

    public static TimeValidationResponse ok() {
        return new TimeValidationResponse(true, null, null);
    }

    public static TimeValidationResponse invalid(String message) {
        return new TimeValidationResponse(false, null, message);
    }

    public static TimeValidationResponse offGrid(String closestTime, String message) {
        return new TimeValidationResponse(false, closestTime, message);
    }
}
