package com.fluxreader.api;

/**
 * Either a value or an {@link ApiError}. Gateway methods never throw.
 */
public final class ApiResult<T> {
    private final T value;
    private final ApiError error;

    private ApiResult(T value, ApiError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ApiResult<T> ok(T value) {
        return new ApiResult<>(value, null);
    }

    public static <T> ApiResult<T> fail(ApiError error) {
        return new ApiResult<>(null, error);
    }

    public boolean isOk() {
        return error == null;
    }

    public T getValue() {
        return value;
    }

    public ApiError getError() {
        return error;
    }

    @Override
    public String toString() {
        return isOk() ? "ApiResult{ok}" : "ApiResult{" + error + "}";
    }
}
