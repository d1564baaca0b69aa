package com.resultpager.api.config;

import com.google.gson.ToNumberPolicy;
import com.resultpager.api.executor.JdbcQueryExecutor;
import com.resultpager.api.executor.QueryExecutor;
import com.resultpager.api.executor.UnavailableQueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.gson.GsonBuilderCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PagerProperties.class)
public class PagerConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(PagerConfig.class);

    /**
     * 配置了 JDBC 连接串时启用真实执行器，否则只能直接提交行数据
     */
    @Bean
    public QueryExecutor queryExecutor(PagerProperties properties) {
        PagerProperties.Datasource datasource = properties.getDatasource();
        if (datasource.getUrl() == null || datasource.getUrl().isBlank()) {
            LOGGER.info("未配置 resultpager.datasource.url，查询执行器不可用");
            return new UnavailableQueryExecutor();
        }
        LOGGER.info("启用 JDBC 查询执行器，最多物化 {} 行", datasource.getMaxRows());
        return new JdbcQueryExecutor(datasource);
    }

    /**
     * 未声明类型的行值按整数/浮点区分解析，避免 1 变成 1.0
     */
    @Bean
    public GsonBuilderCustomizer rowNumberPolicy() {
        return builder -> builder.setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE);
    }
}
