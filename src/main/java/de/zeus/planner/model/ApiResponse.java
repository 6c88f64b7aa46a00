package de.zeus.planner.model;

import org.springframework.http.HttpStatus;

/**
 * Envelope for every planning endpoint. The HTTP status travels in the body; the transport status stays 200.
 */
public record ApiResponse<T>(boolean success,
                             HttpStatus statusCode,
                             String message,
                             T data) {

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(true, HttpStatus.OK, message, data);
    }

    public static <T> ApiResponse<T> failure(HttpStatus status, String message) {
        return new ApiResponse<>(false, status, message, null);
    }
}
