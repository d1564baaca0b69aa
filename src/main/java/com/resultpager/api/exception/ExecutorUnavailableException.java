package com.resultpager.api.exception;

/**
 * 未配置数据源，无法执行查询。
 */
public class ExecutorUnavailableException extends RuntimeException {

    public ExecutorUnavailableException(String message) {
        super(message);
    }
}
