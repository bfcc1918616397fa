package com.touristtax.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * Envelope for every API response of the tourist tax services.
 * Errors carry a stable {@code errorCode} the UI maps to guest-facing text;
 * {@code data} on an error holds details the caller can act on.
 *
 * @param <T> Type of the response data
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BaseResponse<T> {
    private final boolean success;
    private final String message;
    private final T data;
    private final Instant timestamp;
    private final String errorCode;

    public static <T> BaseResponse<T> success(T data) {
        return success(null, data);
    }

    public static <T> BaseResponse<T> success(String message, T data) {
        return new BaseResponse<>(true, message, data, Instant.now(), null);
    }

    public static <T> BaseResponse<T> error(String message, String errorCode) {
        return error(message, errorCode, null);
    }

    public static <T> BaseResponse<T> error(String message, String errorCode, T details) {
        return new BaseResponse<>(false, message, details, Instant.now(), errorCode);
    }
}
