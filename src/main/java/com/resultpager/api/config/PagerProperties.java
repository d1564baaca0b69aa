package com.resultpager.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "resultpager")
public class PagerProperties {

    private final Session session = new Session();

    private final Datasource datasource = new Datasource();

    public Session getSession() {
        return session;
    }

    public Datasource getDatasource() {
        return datasource;
    }

    public static class Session {

        /**
         * 未指定页大小时使用的默认值
         */
        private int defaultPageSize = 20;

        private int minPageSize = 10;

        private int maxPageSize = 50;

        /**
         * 会话空闲超过该时长后被回收
         */
        private Duration idleTimeout = Duration.ofSeconds(300);

        /**
         * 后台回收任务的执行间隔
         */
        private Duration sweepInterval = Duration.ofSeconds(60);

        /**
         * 会话列表中查询文本的最大展示长度
         */
        private int queryPreviewLength = 50;

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMinPageSize() {
            return minPageSize;
        }

        public void setMinPageSize(int minPageSize) {
            this.minPageSize = minPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        public void setIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }

        public int getQueryPreviewLength() {
            return queryPreviewLength;
        }

        public void setQueryPreviewLength(int queryPreviewLength) {
            this.queryPreviewLength = queryPreviewLength;
        }
    }

    public static class Datasource {

        /**
         * JDBC 连接串，为空时不启用查询执行器
         */
        private String url;

        private String username;

        private String password;

        /**
         * 单次查询最多物化的行数
         */
        private int maxRows = 10_000;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getMaxRows() {
            return maxRows;
        }

        public void setMaxRows(int maxRows) {
            this.maxRows = maxRows;
        }
    }
}
