package com.resultpager.api.executor;

import com.resultpager.api.exception.ExecutorUnavailableException;
import com.resultpager.api.exception.QueryExecutionException;

import java.util.List;
import java.util.Map;

/**
 * 只读查询执行器，把查询文本物化为有序的行列表。
 */
public interface QueryExecutor {

    boolean isAvailable();

    /**
     * 执行只读查询，每行是保持列顺序的 列名 -> 值 映射。
     *
     * @throws ExecutorUnavailableException 未配置数据源
     * @throws QueryExecutionException      语句不是只读查询或执行失败
     */
    List<Map<String, Object>> query(String sql);
}
