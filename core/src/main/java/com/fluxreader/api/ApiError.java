package com.fluxreader.api;

/**
 * Opaque gateway failure. Callers only distinguish "no response at all"
 * ({@link #transportFailure()}) from "the server answered with an error".
 */
public record ApiError(String message, int httpStatus, boolean transportFailure) {

    public static ApiError transport(String message) {
        return new ApiError(message, -1, true);
    }

    public static ApiError http(int status, String message) {
        return new ApiError(message, status, false);
    }

    public static ApiError invalid(String message) {
        return new ApiError(message, -1, false);
    }

    @Override
    public String toString() {
        return httpStatus > 0 ? "HTTP " + httpStatus + ": " + message : message;
    }
}
