package com.resultpager.api.executor;

import com.resultpager.api.exception.ExecutorUnavailableException;

import java.util.List;
import java.util.Map;

/**
 * 未配置数据源时使用，调用方只能直接提交已物化的行。
 */
public class UnavailableQueryExecutor implements QueryExecutor {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public List<Map<String, Object>> query(String sql) {
        throw new ExecutorUnavailableException("Query executor not configured, set resultpager.datasource.url or submit rows directly");
    }
}
