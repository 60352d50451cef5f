package com.medbook.shared.web;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Envelope of every HTTP response body: {@code {"data": ..., "message": "..."}}.
 * Errors carry {@code data: null}.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class StdResponse<T> {

    private T data;
    private String message;

    public static <T> StdResponse<T> of(T data, String message) {
        return new StdResponse<>(data, message);
    }

    public static StdResponse<Void> error(String message) {
        return new StdResponse<>(null, message);
    }
}
