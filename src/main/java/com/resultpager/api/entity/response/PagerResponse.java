package com.resultpager.api.entity.response;

/**
 * 通用响应，getData 可为文本或结构化结果。
 */
public class PagerResponse<T> {

    private final boolean success;
    private final T data;
    private final String error;

    private PagerResponse(boolean success, T data, String error) {
        this.success = success;
        this.data = data;
        this.error = error;
    }

    public static <T> PagerResponse<T> success(T data) {
        return new PagerResponse<>(true, data, null);
    }

    public static <T> PagerResponse<T> failure(String message) {
        return new PagerResponse<>(false, null, message);
    }

    public boolean isSuccess() {
        return success;
    }

    public T getData() {
        return data;
    }

    public String getError() {
        return error;
    }
}
