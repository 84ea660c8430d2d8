package com.chatroom.sync.common.api;

/**
 * Envelope for every HTTP response: {@code {"ok":..., "data":..., "error":...}}.
 */
public record ApiResponse<T>(boolean ok, T data, String error) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> error(String error) {
        return new ApiResponse<>(false, null, error);
    }
}
