package com.ownding.camera.common;

import org.springframework.http.HttpStatus;

/**
 * Response envelope for every route. {@code code} is 0 on success and the HTTP status value on failure.
 */
public record ApiResult<T>(int code, String message, T data) {
    public static <T> ApiResult<T> success(T data) {
        return new ApiResult<>(0, "ok", data);
    }

    public static <T> ApiResult<T> success(String message, T data) {
        return new ApiResult<>(0, message, data);
    }

    public static ApiResult<Void> successMessage(String message) {
        return new ApiResult<>(0, message, null);
    }

    public static <T> ApiResult<T> fail(HttpStatus status, String message) {
        return new ApiResult<>(status.value(), message, null);
    }
}
