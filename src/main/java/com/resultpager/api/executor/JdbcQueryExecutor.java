package com.resultpager.api.executor;

import com.resultpager.api.config.PagerProperties;
import com.resultpager.api.exception.QueryExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 基于 JDBC 的只读查询执行器，每次查询使用一个独立的只读连接。
 */
public class JdbcQueryExecutor implements QueryExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcQueryExecutor.class);

    private final PagerProperties.Datasource datasource;

    public JdbcQueryExecutor(PagerProperties.Datasource datasource) {
        this.datasource = Objects.requireNonNull(datasource, "datasource must not be null");
        if (datasource.getUrl() == null || datasource.getUrl().isBlank()) {
            throw new IllegalArgumentException("datasource url must not be blank");
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public List<Map<String, Object>> query(String sql) {
        String statement = normalize(sql);
        long start = System.nanoTime();
        try (Connection conn = openConnection();
             Statement stmt = conn.createStatement()) {
            conn.setReadOnly(true);
            if (datasource.getMaxRows() > 0) {
                stmt.setMaxRows(datasource.getMaxRows());
            }
            try (ResultSet rs = stmt.executeQuery(statement)) {
                List<Map<String, Object>> rows = readRows(rs);
                LOGGER.debug("查询返回 {} 行，耗时 {} ms", rows.size(), (System.nanoTime() - start) / 1_000_000);
                return rows;
            }
        } catch (SQLException ex) {
            LOGGER.warn("执行查询失败: {}", statement, ex);
            throw new QueryExecutionException("Query failed: " + ex.getMessage(), ex);
        }
    }

    /**
     * 只接受单条 SELECT / WITH 语句，去掉末尾分号。
     */
    static String normalize(String sql) {
        String statement = Objects.requireNonNull(sql, "sql must not be null").trim();
        while (statement.endsWith(";")) {
            statement = statement.substring(0, statement.length() - 1).trim();
        }
        if (statement.isEmpty()) {
            throw new QueryExecutionException("SQL must not be empty");
        }
        String upper = statement.toUpperCase(Locale.ROOT);
        if (!(upper.startsWith("SELECT") || upper.startsWith("WITH"))) {
            throw new QueryExecutionException("Only read-only SELECT queries are allowed");
        }
        if (hasStatementSeparator(statement)) {
            throw new QueryExecutionException("Multiple statements are not allowed");
        }
        return statement;
    }

    // 跳过引号内的内容，只识别语句之间的分号
    private static boolean hasStatementSeparator(String statement) {
        char quote = 0;
        for (int i = 0; i < statement.length(); i++) {
            char c = statement.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"' || c == '`') {
                quote = c;
            } else if (c == ';') {
                return true;
            }
        }
        return false;
    }

    private Connection openConnection() throws SQLException {
        if (datasource.getUsername() == null || datasource.getUsername().isBlank()) {
            return DriverManager.getConnection(datasource.getUrl());
        }
        return DriverManager.getConnection(datasource.getUrl(), datasource.getUsername(), datasource.getPassword());
    }

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.put(meta.getColumnLabel(i), displayable(rs.getObject(i)));
            }
            rows.add(row);
        }
        return rows;
    }

    // 只保留可直接展示的类型
    private static Object displayable(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof byte[]) {
            return "<binary " + ((byte[]) value).length + " bytes>";
        }
        return value.toString();
    }
}
