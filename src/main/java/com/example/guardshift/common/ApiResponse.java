package com.example.guardshift.common;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope for the informational endpoints. Schedule generation uses its own response shape.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, String message, T data) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, null, data);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(true, message, data);
    }
}
