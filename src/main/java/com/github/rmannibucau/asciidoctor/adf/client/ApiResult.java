package com.github.rmannibucau.asciidoctor.adf.client;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Outcome of a remote call: either a value or an error message.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class ApiResult<T> {

    private final boolean success;

    private final T value;

    private final String error;

    public static <T> ApiResult<T> success(final T value) {
        return new ApiResult<>(true, value, null);
    }

    public static <T> ApiResult<T> failure(final String error) {
        return new ApiResult<>(false, null, error);
    }
}
